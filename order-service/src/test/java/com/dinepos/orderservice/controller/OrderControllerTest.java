package com.dinepos.orderservice.controller;

import com.dinepos.orderservice.dto.NextOrderNumberResponse;
import com.dinepos.orderservice.dto.OrderDetailResponse;
import com.dinepos.orderservice.dto.OrderLineResponse;
import com.dinepos.orderservice.dto.OrderItemRequest;
import com.dinepos.orderservice.dto.OrderSubmissionRequest;
import com.dinepos.orderservice.dto.OrderSubmissionResponse;
import com.dinepos.orderservice.exception.DatabaseUnavailableException;
import com.dinepos.orderservice.exception.ErrorCategory;
import com.dinepos.orderservice.exception.InvalidOrderSubmissionException;
import com.dinepos.orderservice.exception.OrderIntegrityException;
import com.dinepos.orderservice.exception.OrderNotFoundException;
import com.dinepos.orderservice.service.OrderService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OrderController.class)
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private OrderService orderService;

    private static OrderSubmissionRequest.OrderSubmissionRequestBuilder validRequest(String status) {
        return OrderSubmissionRequest.builder()
                .orderNo("1050")
                .status(status)
                .date("2024-05-01")
                .time("19:45")
                .option(2)
                .tableId(5)
                .tableNo("T5")
                .total(new BigDecimal("19.00"))
                .items(List.of(OrderItemRequest.builder().itemCode(101).slNo(1).qty(new BigDecimal("2"))
                        .rate(new BigDecimal("9.5")).amount(new BigDecimal("19")).build()))
                .selectedSeats(List.of("12", "13"));
    }

    private static OrderSubmissionResponse response(String status) {
        return OrderSubmissionResponse.builder()
                .orderNo(1050)
                .custId(0)
                .status(status)
                .message("Order " + status.toLowerCase() + " successfully")
                .details(OrderSubmissionResponse.Details.builder()
                        .orderType("DineIn")
                        .tableInfo(OrderSubmissionResponse.TableInfo.builder().tableId(5).tableNo("T5").build())
                        .selectedSeats(List.of(12, 13))
                        .itemsCount(1)
                        .total(new BigDecimal("19.00"))
                        .build())
                .build();
    }

    @Nested
    class Submit {

        @Test
        void newOrder_Returns201() throws Exception {
            when(orderService.submitOrder(any())).thenReturn(response("NEW"));

            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(validRequest("NEW").build())))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.orderNo").value(1050))
                    .andExpect(jsonPath("$.message").value("Order new successfully"))
                    .andExpect(jsonPath("$.details.selectedSeats[0]").value(12))
                    .andExpect(jsonPath("$.details.customerInfo").doesNotExist());
        }

        @Test
        void kot_Returns200() throws Exception {
            when(orderService.submitOrder(any())).thenReturn(response("KOT"));

            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(validRequest("KOT").build())))
                    .andExpect(status().isOk());
        }

        @Test
        void dineInWithoutTable_FailsValidation() throws Exception {
            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(validRequest("NEW").tableId(0).build())))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                    .andExpect(jsonPath("$.validationErrors.tableSuppliedForDineIn").exists());

            verify(orderService, never()).submitOrder(any());
        }

        @Test
        void zeroOrderNumber_FailsValidation() throws Exception {
            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(validRequest("NEW").orderNo("0").build())))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.validationErrors.orderNoPresent").exists());
        }

        @Test
        void deliveryWithoutCustomer_FailsValidation() throws Exception {
            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(validRequest("NEW").option(1).build())))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.validationErrors.customerSuppliedForDelivery").exists());
        }

        @Test
        void noItems_FailsValidation() throws Exception {
            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(validRequest("NEW").items(List.of()).build())))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.validationErrors.items").exists());
        }

        @Test
        void optionOutOfRange_FailsValidation() throws Exception {
            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(validRequest("NEW").option(4).build())))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.validationErrors.option").exists());
        }
    }

    @Nested
    class Errors {

        private void expectError(RuntimeException ex, int httpStatus, String errorCode) throws Exception {
            when(orderService.submitOrder(any())).thenThrow(ex);

            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(validRequest("UPDATED").build())))
                    .andExpect(status().is(httpStatus))
                    .andExpect(jsonPath("$.errorCode").value(errorCode))
                    .andExpect(jsonPath("$.correlationId").exists());
        }

        @Test
        void invalidStatus_Is400() throws Exception {
            expectError(new InvalidOrderSubmissionException("Invalid order status: VOID"), 400, "INVALID_SUBMISSION");
        }

        @Test
        void unknownOrder_Is404() throws Exception {
            expectError(new OrderNotFoundException(1050), 404, "ORDER_NOT_FOUND");
        }

        @Test
        void duplicateOrder_Is409() throws Exception {
            expectError(new OrderIntegrityException("Duplicate order number detected", ErrorCategory.DUPLICATE_ORDER,
                    null), 409, "DUPLICATE_ORDER");
        }

        @Test
        void databaseTimeout_Is503AndRetryable() throws Exception {
            when(orderService.submitOrder(any())).thenThrow(new DatabaseUnavailableException(
                    "Database operation timed out", ErrorCategory.DATABASE_TIMEOUT, null));

            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(validRequest("NEW").build())))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.retryable").value(true))
                    .andExpect(jsonPath("$.message").value("Database operation timed out"));
        }

        @Test
        void malformedJson_Is400() throws Exception {
            mockMvc.perform(post("/api/v1/orders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"status\":"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorCode").value("INVALID_SUBMISSION"));
        }
    }

    @Test
    void nextNumber_ReturnsPreview() throws Exception {
        when(orderService.getNextOrderNumber()).thenReturn(new NextOrderNumberResponse("1051"));

        mockMvc.perform(get("/api/v1/orders/next-number"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderNo").value("1051"));
    }

    @Test
    void getOrder_ReturnsDetail() throws Exception {
        OrderLineResponse line = new OrderLineResponse();
        line.setSlNo(1);
        line.setItemCode(101);
        when(orderService.getOrder(1050)).thenReturn(OrderDetailResponse.builder()
                .orderNo(1050)
                .orderType("DineIn")
                .option(2)
                .tableNo("T5")
                .lines(List.of(line))
                .build());

        mockMvc.perform(get("/api/v1/orders/1050"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderNo").value(1050))
                .andExpect(jsonPath("$.orderType").value("DineIn"))
                .andExpect(jsonPath("$.tableNo").value("T5"))
                .andExpect(jsonPath("$.lines[0].itemCode").value(101))
                .andExpect(jsonPath("$.seats").isEmpty());
    }

    @Test
    void getOrder_Unknown_Is404() throws Exception {
        when(orderService.getOrder(1050)).thenThrow(new OrderNotFoundException(1050));

        mockMvc.perform(get("/api/v1/orders/1050"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("ORDER_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Order 1050 not found"));
    }
}
