package com.dinepos.orderservice.dto;

import lombok.Data;

@Data
public class SeatAssignmentResponse {
    private Integer seatId;
    private Integer tableId;
    private String seatLabel;
    private String counter;
}
