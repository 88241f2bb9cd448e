package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "order_header", indexes = {
        @Index(name = "idx_order_header_lookup", columnList = "order_date, order_time, customer_id")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderHeader {

    // assigned by the order number allocator, never generated by the database
    @Id
    @Column(name = "order_no")
    @ToString.Include
    private Integer orderNo;

    // free-form strings from the register, stored as sent
    @Column(name = "order_date", nullable = false)
    private String orderDate;

    @Column(name = "order_time", nullable = false)
    private String orderTime;

    @Convert(converter = OrderTypeConverter.class)
    @Column(name = "options", nullable = false)
    @ToString.Include
    private OrderType orderType;

    @Column(name = "customer_id", nullable = false)
    private Integer customerId;

    private String customerName;

    private String flat;

    private String address;

    private String contact;

    @Column(name = "delivery_boy_id", nullable = false)
    private Integer deliveryBoyId;

    @Column(name = "table_id", nullable = false)
    private Integer tableId;

    private String tableNo;

    // first seat of the selection, null when none was picked
    @Column(name = "seat_id")
    private Integer seatId;

    private String remarks;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal total;

    // finalized/"sold": updates leave seats and table alone once this is set
    @Column(nullable = false)
    @ToString.Include
    private boolean sold;

    // order type label: Order, DineIn, TakeAway
    @Column(name = "status_label", nullable = false)
    private String statusLabel;

    private String prefix;

    // prefix concatenated with the order number, e.g. "DI1042"
    @Column(name = "prefixed_no")
    private String prefixedNo;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
