package com.dinepos.orderservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// the register expects the number as a string
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NextOrderNumberResponse {
    private String orderNo;
}
