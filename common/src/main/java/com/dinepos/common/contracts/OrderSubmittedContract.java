package com.dinepos.common.contracts;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Published after an order submission commits.
 * Routing keys: order.created, order.updated, order.kot.sent.
 * Print spoolers use {@link #printJobs} to decide which station gets which line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderSubmittedContract {

    private Integer orderNo;
    private String status;
    private String orderType;
    private Integer customerId;
    private Integer tableId;
    private String tableNo;
    private List<Integer> seatIds;
    private int itemsCount;
    private BigDecimal total;
    private List<PrintJob> printJobs;
    private Instant submittedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PrintJob {
        private Integer slNo;
        private Integer itemId;
        private String printer;
    }
}
