package com.dinepos.orderservice.service;

import com.dinepos.orderservice.model.OrderNumberSequence;
import com.dinepos.orderservice.repository.OrderHeaderRepository;
import com.dinepos.orderservice.repository.OrderNumberSequenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Counter-row allocator. The row is locked until the submission commits or rolls
 * back, so concurrent registers get consecutive numbers and a failed submission
 * gives its number back.
 * <p>
 * The counter never hands out a number at or below the current maximum order
 * number, so orders written by other means cannot collide with it.
 */
@Component
@ConditionalOnProperty(prefix = "pos.order-number", name = "strategy", havingValue = "sequence", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SequenceOrderNumberAllocator implements OrderNumberAllocator {

    private final OrderNumberSequenceRepository sequenceRepository;
    private final OrderHeaderRepository orderHeaderRepository;

    @Override
    public int allocate() {
        OrderNumberSequence sequence = sequenceRepository.findByNameForUpdate(OrderNumberSequence.ORDER)
                .orElseGet(this::seedSequence);

        int orderNo = Math.max(sequence.getNextValue(), orderHeaderRepository.findMaxOrderNo() + 1);
        sequence.setNextValue(orderNo + 1);
        sequenceRepository.save(sequence);

        log.info("Order number allocated. orderNo={}", orderNo);
        return orderNo;
    }

    /**
     * Creates the counter row before the first register connects. Parallel first
     * submissions on an empty database would otherwise race to insert it.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void ensureSequence() {
        if (!sequenceRepository.existsById(OrderNumberSequence.ORDER)) {
            seedSequence();
        }
    }

    @Override
    public int peek() {
        int fromSequence = sequenceRepository.findById(OrderNumberSequence.ORDER)
                .map(OrderNumberSequence::getNextValue)
                .orElse(0);
        return Math.max(fromSequence, orderHeaderRepository.findMaxOrderNo() + 1);
    }

    // first allocation on a fresh database, or after the counter row was removed
    private OrderNumberSequence seedSequence() {
        int start = orderHeaderRepository.findMaxOrderNo() + 1;
        log.info("Seeding order number sequence. nextValue={}", start);
        return sequenceRepository.saveAndFlush(new OrderNumberSequence(OrderNumberSequence.ORDER, start));
    }
}
