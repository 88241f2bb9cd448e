package com.dinepos.orderservice.dto;

import com.dinepos.orderservice.model.PrintChannel;
import lombok.Data;

@Data
public class PrintJobResponse {
    private Integer slNo;
    private Integer itemId;
    private String printer;
    private PrintChannel channel;
}
