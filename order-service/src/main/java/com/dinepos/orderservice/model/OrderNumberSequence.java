package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Single-row counter handing out order numbers. Read under a row lock and
 * incremented in the submitting transaction, so a rolled back submission
 * gives its number back.
 */
@Entity
@Table(name = "order_number_sequence")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OrderNumberSequence {

    public static final String ORDER = "order";

    @Id
    private String name;

    @Column(name = "next_value", nullable = false)
    private Integer nextValue;
}
