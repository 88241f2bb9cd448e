package com.dinepos.orderservice.command;

import com.dinepos.orderservice.dto.OrderItemRequest;
import com.dinepos.orderservice.model.OrderType;

import java.math.BigDecimal;
import java.util.List;

/**
 * Fields every workflow carries, already normalized: numbers default to 0,
 * text to "", seat ids hold only positive values.
 */
public record OrderPayload(
        int orderNo,
        String date,
        String time,
        OrderType orderType,
        int customerId,
        String customerName,
        String flatNo,
        String address,
        String contact,
        int deliveryBoyId,
        int tableId,
        String tableNo,
        String remarks,
        BigDecimal total,
        String prefix,
        List<OrderItemRequest> items,
        List<Integer> seatIds) {

    public OrderPayload {
        items = List.copyOf(items);
        seatIds = List.copyOf(seatIds);
    }

    public boolean isDineIn() {
        return orderType == OrderType.DINE_IN;
    }

    public boolean hasTable() {
        return tableId != 0;
    }

    public boolean hasExplicitSeats() {
        return !seatIds.isEmpty();
    }

    /**
     * Seat stored on the order header: the first selected seat, or null.
     */
    public Integer headerSeatId() {
        return seatIds.isEmpty() ? null : seatIds.get(0);
    }

    public OrderPayload withCustomerId(int resolvedCustomerId) {
        return new OrderPayload(orderNo, date, time, orderType, resolvedCustomerId, customerName, flatNo,
                address, contact, deliveryBoyId, tableId, tableNo, remarks, total, prefix, items, seatIds);
    }
}
