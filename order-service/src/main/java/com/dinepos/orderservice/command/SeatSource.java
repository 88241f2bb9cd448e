package com.dinepos.orderservice.command;

import java.util.List;

/**
 * Where the seats of a dine-in order come from: ids sent with the order, or
 * the selection an older register staged under its counter name.
 */
public sealed interface SeatSource {

    record ExplicitSeats(List<Integer> seatIds) implements SeatSource {
        public ExplicitSeats {
            seatIds = List.copyOf(seatIds);
        }
    }

    record StagedSeats(String counter) implements SeatSource {
    }

    static SeatSource of(OrderPayload payload, String counter) {
        if (payload.hasExplicitSeats()) {
            return new ExplicitSeats(payload.seatIds());
        }
        return new StagedSeats(counter);
    }
}
