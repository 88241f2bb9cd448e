package com.dinepos.orderservice.model;

public enum PrintChannel {
    ORDER,   // bill/order station, NEW and UPDATED
    KITCHEN  // kitchen order tickets
}
