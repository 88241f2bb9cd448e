package com.dinepos.orderservice.service;

/**
 * Hands out order numbers for NEW submissions.
 */
public interface OrderNumberAllocator {

    /**
     * Reserves the next order number. Must run inside the submission's transaction.
     */
    int allocate();

    /**
     * Next number {@link #allocate()} would return right now. Reserves nothing.
     */
    int peek();
}
