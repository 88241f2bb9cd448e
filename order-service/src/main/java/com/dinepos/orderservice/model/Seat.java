package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "seat")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Seat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "seat_id")
    @ToString.Include
    private Integer seatId;

    @Column(name = "table_id", nullable = false)
    @ToString.Include
    private Integer tableId;

    // printed seat name, e.g. "T5-A"
    @Column(nullable = false)
    private String label;

    private String remarks;

    @Enumerated(EnumType.ORDINAL)
    @Column(nullable = false)
    @ToString.Include
    private SeatStatus status = SeatStatus.FREE;
}
