package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Draft order parked on a register. Deleted once it is submitted as a real order.
 */
@Entity
@Table(name = "held_order")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class HeldOrder {

    @Id
    @Column(name = "order_no")
    @ToString.Include
    private Integer orderNo;

    @Column(name = "order_date")
    private String orderDate;

    @Column(name = "order_time")
    private String orderTime;

    private String customerName;

    @Column(name = "table_id")
    private Integer tableId;

    @Column(precision = 18, scale = 2)
    private BigDecimal total;
}
