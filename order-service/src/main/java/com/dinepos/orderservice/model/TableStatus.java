package com.dinepos.orderservice.model;

/**
 * Table occupancy. Ordinal order matches the legacy numeric column
 * (0 free, 1 partially occupied, 2 fully occupied, 3 anything else).
 */
public enum TableStatus {
    FREE,
    PARTIALLY_OCCUPIED,
    FULLY_OCCUPIED,
    OTHER
}
