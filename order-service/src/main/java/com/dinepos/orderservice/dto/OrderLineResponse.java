package com.dinepos.orderservice.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class OrderLineResponse {
    private Integer slNo;
    private Integer itemCode;
    private String itemName;
    private BigDecimal qty;
    private BigDecimal rate;
    private BigDecimal amount;
    private BigDecimal cost;
    private BigDecimal vat;
    private BigDecimal vatAmt;
    private Integer taxLedger;
    private String localizedName;
    private String notes;
}
