package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Seats picked on a register before the order exists. Older registers stage
 * their selection here instead of sending seat ids with the order.
 */
@Entity
@Table(name = "staged_seat", indexes = {
        @Index(name = "idx_staged_seat_counter", columnList = "counter")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class StagedSeat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "seat_id", nullable = false)
    @ToString.Include
    private Integer seatId;

    @Column(name = "table_id", nullable = false)
    @ToString.Include
    private Integer tableId;

    @Column(name = "seat_label")
    private String seatLabel;

    @Column(nullable = false)
    private int status;

    @Column(nullable = false)
    @ToString.Include
    private String counter;
}
