package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Menu master record. Only read by order processing: the printer name decides
 * where a line gets printed.
 */
@Entity
@Table(name = "menu_item")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class MenuItem {

    @Id
    @Column(name = "item_id")
    @ToString.Include
    private Integer itemId;

    @Column(name = "item_name", nullable = false)
    @ToString.Include
    private String itemName;

    @Column(name = "printer_name")
    private String printerName;

    @Column(precision = 18, scale = 2)
    private BigDecimal rate;
}
