package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What was sent to the kitchen for an order at one point in time.
 * One row per KOT submission; the live {@link OrderHeader} is never replaced by it.
 */
@Entity
@Table(name = "kot_header")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class KotHeader {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "kot_id")
    @ToString.Include
    private Long kotId;

    @Column(name = "order_no", nullable = false)
    @ToString.Include
    private Integer orderNo;

    @Column(name = "order_date", nullable = false)
    private String orderDate;

    @Column(name = "order_time", nullable = false)
    private String orderTime;

    @Convert(converter = OrderTypeConverter.class)
    @Column(name = "options", nullable = false)
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

    private String remarks;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal total;

    @Column(nullable = false)
    private boolean sold;

    @Column(name = "status_label", nullable = false)
    private String statusLabel;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
