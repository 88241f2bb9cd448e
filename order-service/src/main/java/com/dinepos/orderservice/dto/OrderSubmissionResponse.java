package com.dinepos.orderservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSubmissionResponse {

    private Integer orderNo;
    private Integer custId;
    private String status;
    private String message;
    private Details details;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Details {
        private String orderType;
        private CustomerInfo customerInfo;
        private TableInfo tableInfo;
        private List<Integer> selectedSeats;
        private int itemsCount;
        private BigDecimal total;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CustomerInfo {
        private Integer custId;
        private String custName;
        private String contact;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TableInfo {
        private Integer tableId;
        private String tableNo;
    }
}
