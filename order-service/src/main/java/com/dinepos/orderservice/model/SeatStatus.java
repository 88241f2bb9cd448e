package com.dinepos.orderservice.model;

public enum SeatStatus {
    FREE,     // 0
    OCCUPIED  // 1
}
