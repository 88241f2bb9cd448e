package com.dinepos.orderservice.controller;

import com.dinepos.orderservice.command.SubmissionStatus;
import com.dinepos.orderservice.dto.NextOrderNumberResponse;
import com.dinepos.orderservice.dto.OrderDetailResponse;
import com.dinepos.orderservice.dto.OrderSubmissionRequest;
import com.dinepos.orderservice.dto.OrderSubmissionResponse;
import com.dinepos.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    // 201 when a new order was created, 200 for updates and kitchen tickets
    @PostMapping
    public ResponseEntity<OrderSubmissionResponse> submitOrder(
            @Valid @RequestBody OrderSubmissionRequest orderRequest) {
        OrderSubmissionResponse response = orderService.submitOrder(orderRequest);
        HttpStatus status = SubmissionStatus.NEW.name().equals(response.getStatus())
                ? HttpStatus.CREATED
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/next-number")
    public ResponseEntity<NextOrderNumberResponse> getNextOrderNumber() {
        return ResponseEntity.ok(orderService.getNextOrderNumber());
    }

    @GetMapping("/{orderNo}")
    public ResponseEntity<OrderDetailResponse> getOrder(@PathVariable Integer orderNo) {
        return ResponseEntity.ok(orderService.getOrder(orderNo));
    }
}
