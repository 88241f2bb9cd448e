package com.dinepos.orderservice.command;

import com.dinepos.orderservice.dto.OrderItemRequest;
import com.dinepos.orderservice.dto.OrderSubmissionRequest;
import com.dinepos.orderservice.exception.InvalidOrderSubmissionException;
import com.dinepos.orderservice.model.OrderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a raw register submission into a typed command. Runs before any
 * database work, so a bad status never reaches the transaction.
 */
@Component
@Slf4j
public class OrderCommandFactory {

    public OrderCommand from(OrderSubmissionRequest request) {
        SubmissionStatus status = SubmissionStatus.parse(request.getStatus())
                .orElseThrow(() -> new InvalidOrderSubmissionException(
                        "Invalid order status: " + request.getStatus()));

        OrderType orderType = OrderType.fromCode(request.getOption())
                .orElseThrow(() -> new InvalidOrderSubmissionException(
                        "Invalid order option: " + request.getOption()));

        OrderPayload payload = new OrderPayload(
                parseInt(request.getOrderNo()),
                text(request.getDate()),
                text(request.getTime()),
                orderType,
                number(request.getCustId()),
                text(request.getCustName()),
                text(request.getFlatNo()),
                text(request.getAddress()),
                text(request.getContact()),
                number(request.getDeliveryBoyId()),
                number(request.getTableId()),
                text(request.getTableNo()),
                text(request.getRemarks()),
                request.getTotal() == null ? BigDecimal.ZERO : request.getTotal(),
                text(request.getPrefix()),
                items(request.getItems()),
                parseSeatIds(request.getSelectedSeats()));

        return switch (status) {
            case NEW -> new NewOrderCommand(payload, request.getHoldedOrder());
            case UPDATED -> new UpdateOrderCommand(payload);
            case KOT -> new KotCommand(payload);
        };
    }

    private static List<OrderItemRequest> items(List<OrderItemRequest> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .filter(Objects::nonNull)
                .toList();
    }

    static List<Integer> parseSeatIds(List<String> selectedSeats) {
        if (selectedSeats == null) {
            return List.of();
        }
        List<Integer> seatIds = new ArrayList<>();
        for (String raw : selectedSeats) {
            int seatId = parseInt(raw);
            if (seatId > 0) {
                seatIds.add(seatId);
            } else {
                log.debug("Ignoring invalid seat id: {}", raw);
            }
        }
        return seatIds;
    }

    static int parseInt(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int number(Integer value) {
        return value == null ? 0 : value;
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }
}
