package com.dinepos.orderservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Order as sent by the register. Numbers arrive as numbers or strings and are
 * parsed leniently when the submission is turned into a command.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSubmissionRequest {

    // client-tracked candidate; NEW orders get a fresh number from the allocator
    private String orderNo;

    @NotBlank(message = "Status cannot be blank")
    private String status;

    private String date;
    private String time;

    @NotNull(message = "Option cannot be null")
    @Min(value = 1, message = "Option must be 1 (delivery), 2 (dine-in) or 3 (take-away)")
    @Max(value = 3, message = "Option must be 1 (delivery), 2 (dine-in) or 3 (take-away)")
    private Integer option;

    private Integer custId;
    private String custName;
    private String flatNo;
    private String address;
    private String contact;
    private Integer deliveryBoyId;
    private Integer tableId;
    private String tableNo;
    private String remarks;
    private BigDecimal total;
    private String prefix;

    @NotEmpty(message = "Order must contain at least one item")
    @Valid
    private List<OrderItemRequest> items;

    // draft order to purge once this one is saved
    private Integer holdedOrder;

    private List<String> selectedSeats;

    @JsonIgnore
    @AssertTrue(message = "Order number must be present and non-zero")
    public boolean isOrderNoPresent() {
        if (orderNo == null || orderNo.isBlank()) {
            return false;
        }
        try {
            return Integer.parseInt(orderNo.trim()) != 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @JsonIgnore
    @AssertTrue(message = "Table is required for dine-in orders")
    public boolean isTableSuppliedForDineIn() {
        return option == null || option != 2 || (tableId != null && tableId > 0);
    }

    @JsonIgnore
    @AssertTrue(message = "Customer name is required for delivery orders")
    public boolean isCustomerSuppliedForDelivery() {
        return option == null || option != 1 || (custName != null && !custName.isBlank());
    }
}
