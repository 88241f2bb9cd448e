package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "held_order_line")
@Getter
@Setter
public class HeldOrderLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_no", nullable = false)
    private Integer orderNo;

    @Column(name = "sl_no")
    private Integer slNo;

    @Column(name = "item_code")
    private Integer itemCode;

    @Column(precision = 18, scale = 2)
    private BigDecimal qty;
}
