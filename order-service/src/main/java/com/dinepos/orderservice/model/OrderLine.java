package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "order_line", uniqueConstraints = {
        @UniqueConstraint(name = "uk_order_line_sl_no", columnNames = {"order_no", "sl_no"})
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_no", nullable = false)
    @ToString.Include
    private Integer orderNo;

    @Column(name = "sl_no", nullable = false)
    @ToString.Include
    private Integer slNo;

    @Column(name = "item_code", nullable = false)
    @ToString.Include
    private Integer itemCode;

    // snapshot of the menu name at the time of ordering
    private String itemName;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal qty;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal rate;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal cost;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal vat;

    @Column(name = "vat_amt", nullable = false, precision = 18, scale = 2)
    private BigDecimal vatAmt;

    @Column(name = "tax_ledger", nullable = false)
    private Integer taxLedger;

    @Column(name = "localized_name")
    private String localizedName;

    private String notes;
}
