package com.dinepos.orderservice.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The register's "option" selector. The label is what the order header and
 * KOT header store as their workflow status.
 */
public enum OrderType {
    DELIVERY(1, "Order"),
    DINE_IN(2, "DineIn"),
    TAKE_AWAY(3, "TakeAway");

    private final int code;
    private final String label;

    OrderType(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<OrderType> fromCode(Integer code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.code == code)
                .findFirst();
    }
}
