package com.dinepos.orderservice.exception;

/**
 * Exception thrown when an UPDATED submission or a lookup names an order that does not exist
 * HTTP Status: 404 Not Found
 */
public class OrderNotFoundException extends OrderProcessingException {

    public OrderNotFoundException(int orderNo) {
        super("Order " + orderNo + " not found", ErrorCategory.ORDER_NOT_FOUND);
    }
}
