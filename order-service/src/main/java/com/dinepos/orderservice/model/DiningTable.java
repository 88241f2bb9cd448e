package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "dining_table")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class DiningTable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "table_id")
    @ToString.Include
    private Integer tableId;

    @Column(name = "floor_no")
    private String floorNo;

    private String code;

    @ToString.Include
    private String name;

    private Integer capacity;

    private String remarks;

    @Enumerated(EnumType.ORDINAL)
    @Column(nullable = false)
    @ToString.Include
    private TableStatus status = TableStatus.FREE;
}
