package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which seats an order claimed at submission time.
 */
@Entity
@Table(name = "order_seat", indexes = {
        @Index(name = "idx_order_seat_order", columnList = "order_no")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSeatAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_no", nullable = false)
    private Integer orderNo;

    @Column(name = "seat_id", nullable = false)
    private Integer seatId;

    @Column(name = "table_id", nullable = false)
    private Integer tableId;

    // copied from the seat master record
    @Column(name = "seat_label")
    private String seatLabel;

    @Column(nullable = false)
    private int status;

    // register/session that submitted the order
    @Column(nullable = false)
    private String counter;
}
