package com.dinepos.orderservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemRequest {

    @NotNull(message = "Item code cannot be null")
    private Integer itemCode;

    // line position, unique within the order
    private Integer slNo;

    private BigDecimal qty;
    private BigDecimal rate;
    private BigDecimal amount;
    private BigDecimal cost;
    private BigDecimal vat;
    private BigDecimal vatAmt;
    private Integer taxLedger;
    private String itemName;

    // localized (Arabic) item name
    private String arabic;

    private String notes;
}
