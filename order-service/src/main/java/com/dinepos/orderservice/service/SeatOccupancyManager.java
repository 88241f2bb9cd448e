package com.dinepos.orderservice.service;

import com.dinepos.orderservice.command.SeatSource;
import com.dinepos.orderservice.model.OrderSeatAssignment;
import com.dinepos.orderservice.model.Seat;
import com.dinepos.orderservice.model.SeatStatus;
import com.dinepos.orderservice.model.StagedSeat;
import com.dinepos.orderservice.model.TableStatus;
import com.dinepos.orderservice.repository.DiningTableRepository;
import com.dinepos.orderservice.repository.OrderSeatAssignmentRepository;
import com.dinepos.orderservice.repository.SeatRepository;
import com.dinepos.orderservice.repository.StagedSeatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Seat and table occupancy for dine-in orders.
 * <p>
 * Seat labels and table ids on assignment rows always come from the seat master
 * record, never from the register.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SeatOccupancyManager {

    private static final int ASSIGNMENT_STATUS_OPEN = 0;

    private final SeatRepository seatRepository;
    private final DiningTableRepository diningTableRepository;
    private final OrderSeatAssignmentRepository orderSeatAssignmentRepository;
    private final StagedSeatRepository stagedSeatRepository;

    /**
     * Occupies the seats of a new order and records which seats it claimed.
     *
     * @return ids of the seats actually claimed
     */
    public List<Integer> claimSeats(int orderNo, int tableId, SeatSource source, String counter) {
        if (source instanceof SeatSource.ExplicitSeats explicit) {
            return claimExplicitSeats(orderNo, tableId, explicit.seatIds(), counter);
        }
        SeatSource.StagedSeats staged = (SeatSource.StagedSeats) source;
        return claimStagedSeats(orderNo, staged.counter());
    }

    /**
     * Replaces an open order's seat selection: every seat on the table is released,
     * the order's assignments are dropped, then the new selection is claimed.
     */
    public List<Integer> reassignSeats(int orderNo, int tableId, List<Integer> seatIds, String counter) {
        if (tableId != 0) {
            int released = seatRepository.releaseAllOnTable(tableId);
            log.debug("Released seats on table. tableId={}, seats={}", tableId, released);
        }
        int dropped = orderSeatAssignmentRepository.deleteByOrderNo(orderNo);
        log.debug("Dropped seat assignments. orderNo={}, assignments={}", orderNo, dropped);

        return claimExplicitSeats(orderNo, tableId, seatIds, counter);
    }

    /**
     * Kitchen tickets occupy seats without assignment bookkeeping.
     */
    public void occupySeats(int tableId, List<Integer> seatIds) {
        for (Integer seatId : seatIds) {
            findSeat(seatId, tableId).ifPresent(this::occupy);
        }
    }

    public void markTablePartiallyOccupied(int tableId) {
        diningTableRepository.updateStatus(tableId, TableStatus.PARTIALLY_OCCUPIED);
        log.debug("Table marked partially occupied. tableId={}", tableId);
    }

    /**
     * Partially occupied while any seat on the table is still free, otherwise fully occupied.
     */
    public TableStatus refreshTableStatus(int tableId) {
        long freeSeats = seatRepository.countByTableIdAndStatus(tableId, SeatStatus.FREE);
        TableStatus status = freeSeats > 0 ? TableStatus.PARTIALLY_OCCUPIED : TableStatus.FULLY_OCCUPIED;
        diningTableRepository.updateStatus(tableId, status);
        log.info("Table status recomputed. tableId={}, freeSeats={}, status={}", tableId, freeSeats, status);
        return status;
    }

    private List<Integer> claimExplicitSeats(int orderNo, int tableId, List<Integer> seatIds, String counter) {
        List<Integer> claimed = new ArrayList<>();
        for (Integer seatId : seatIds) {
            Optional<Seat> found = findSeat(seatId, tableId);
            if (found.isEmpty()) {
                continue;
            }
            Seat seat = found.get();
            occupy(seat);
            orderSeatAssignmentRepository.save(OrderSeatAssignment.builder()
                    .orderNo(orderNo)
                    .seatId(seat.getSeatId())
                    .tableId(seat.getTableId())
                    .seatLabel(seat.getLabel())
                    .status(ASSIGNMENT_STATUS_OPEN)
                    .counter(counter)
                    .build());
            claimed.add(seat.getSeatId());
        }
        return claimed;
    }

    private List<Integer> claimStagedSeats(int orderNo, String counter) {
        List<StagedSeat> stagedSeats = stagedSeatRepository.findByCounterOrderByIdAsc(counter);
        log.debug("Using staged seats. counter={}, seats={}", counter, stagedSeats.size());

        List<Integer> claimed = new ArrayList<>();
        for (StagedSeat staged : stagedSeats) {
            orderSeatAssignmentRepository.save(OrderSeatAssignment.builder()
                    .orderNo(orderNo)
                    .seatId(staged.getSeatId())
                    .tableId(staged.getTableId())
                    .seatLabel(staged.getSeatLabel())
                    .status(ASSIGNMENT_STATUS_OPEN)
                    .counter(counter)
                    .build());
            findSeat(staged.getSeatId(), staged.getTableId()).ifPresent(this::occupy);
            claimed.add(staged.getSeatId());
        }

        stagedSeatRepository.deleteByCounter(counter);
        return claimed;
    }

    private Optional<Seat> findSeat(Integer seatId, int tableId) {
        Optional<Seat> seat = seatRepository.findBySeatIdAndTableId(seatId, tableId);
        if (seat.isEmpty()) {
            log.warn("Seat not found on table, skipping. seatId={}, tableId={}", seatId, tableId);
        }
        return seat;
    }

    private void occupy(Seat seat) {
        seat.setStatus(SeatStatus.OCCUPIED);
        seatRepository.save(seat);
        log.debug("Seat occupied. seatId={}, tableId={}", seat.getSeatId(), seat.getTableId());
    }
}
