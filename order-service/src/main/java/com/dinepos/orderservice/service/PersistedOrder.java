package com.dinepos.orderservice.service;

import com.dinepos.orderservice.model.PrinterAssignment;

import java.util.List;

/**
 * What one workflow wrote: the authoritative order number, the seats it claimed
 * and the printer routing it stored.
 */
public record PersistedOrder(int orderNo, List<Integer> claimedSeats, List<PrinterAssignment> printJobs) {

    public PersistedOrder {
        claimedSeats = List.copyOf(claimedSeats);
        printJobs = List.copyOf(printJobs);
    }
}
