package com.dinepos.orderservice.service;

import com.dinepos.orderservice.dto.NextOrderNumberResponse;
import com.dinepos.orderservice.dto.OrderDetailResponse;
import com.dinepos.orderservice.dto.OrderSubmissionRequest;
import com.dinepos.orderservice.dto.OrderSubmissionResponse;

public interface OrderService {

    OrderSubmissionResponse submitOrder(OrderSubmissionRequest request);

    NextOrderNumberResponse getNextOrderNumber();

    OrderDetailResponse getOrder(int orderNo);
}
