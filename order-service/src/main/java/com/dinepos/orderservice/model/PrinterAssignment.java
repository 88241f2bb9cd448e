package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "printer_assignment", indexes = {
        @Index(name = "idx_printer_assignment_order", columnList = "order_no, channel")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrinterAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_no", nullable = false)
    private Integer orderNo;

    @Column(name = "sl_no", nullable = false)
    private Integer slNo;

    @Column(name = "item_id", nullable = false)
    private Integer itemId;

    // blank until the default backfill runs
    @Column(nullable = false)
    private String printer;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PrintChannel channel;
}
