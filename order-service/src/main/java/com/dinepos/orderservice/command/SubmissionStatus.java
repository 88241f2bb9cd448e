package com.dinepos.orderservice.command;

import java.util.Arrays;
import java.util.Optional;

public enum SubmissionStatus {
    NEW,
    UPDATED,
    KOT;

    // exact, case-sensitive match; registers send the bare constant name
    public static Optional<SubmissionStatus> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.name().equals(value))
                .findFirst();
    }
}
