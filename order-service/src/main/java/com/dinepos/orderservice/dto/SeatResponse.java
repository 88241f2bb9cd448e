package com.dinepos.orderservice.dto;

import com.dinepos.orderservice.model.SeatStatus;
import lombok.Data;

@Data
public class SeatResponse {
    private Integer seatId;
    private String label;
    private String remarks;
    private SeatStatus status;
}
