package com.dinepos.orderservice.service;

import com.dinepos.orderservice.repository.OrderHeaderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Legacy numbering: highest existing order number plus one.
 * Two registers submitting at the same moment can compute the same number;
 * the second insert then fails as a duplicate order.
 */
@Component
@ConditionalOnProperty(prefix = "pos.order-number", name = "strategy", havingValue = "max-plus-one")
@RequiredArgsConstructor
@Slf4j
public class MaxPlusOneOrderNumberAllocator implements OrderNumberAllocator {

    private final OrderHeaderRepository orderHeaderRepository;

    @Override
    public int allocate() {
        int orderNo = peek();
        log.info("Order number allocated (max+1). orderNo={}", orderNo);
        return orderNo;
    }

    @Override
    public int peek() {
        return orderHeaderRepository.findMaxOrderNo() + 1;
    }
}
