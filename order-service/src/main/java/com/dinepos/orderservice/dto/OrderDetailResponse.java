package com.dinepos.orderservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A stored order as the register reloads it before amending it or sending a
 * kitchen ticket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDetailResponse {

    private Integer orderNo;
    private String orderDate;
    private String orderTime;
    private Integer option;
    private String orderType;
    private Integer customerId;
    private String customerName;
    private String flat;
    private String address;
    private String contact;
    private Integer deliveryBoyId;
    private Integer tableId;
    private String tableNo;
    private Integer seatId;
    private String remarks;
    private BigDecimal total;
    private boolean sold;
    private String statusLabel;
    private String prefix;
    private String prefixedNo;
    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private List<OrderLineResponse> lines = new ArrayList<>();
    @Builder.Default
    private List<SeatAssignmentResponse> seats = new ArrayList<>();
    @Builder.Default
    private List<PrintJobResponse> printJobs = new ArrayList<>();
}
