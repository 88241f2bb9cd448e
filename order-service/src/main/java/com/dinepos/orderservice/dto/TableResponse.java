package com.dinepos.orderservice.dto;

import com.dinepos.orderservice.model.TableStatus;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class TableResponse {
    private Integer tableId;
    private String floorNo;
    private String code;
    private String name;
    private Integer capacity;
    private String remarks;
    private TableStatus status;
    private List<SeatResponse> seats = new ArrayList<>();
}
