package com.dinepos.orderservice.service;

import com.dinepos.orderservice.command.KotCommand;
import com.dinepos.orderservice.command.NewOrderCommand;
import com.dinepos.orderservice.command.OrderCommand;
import com.dinepos.orderservice.command.OrderPayload;
import com.dinepos.orderservice.command.SeatSource;
import com.dinepos.orderservice.command.UpdateOrderCommand;
import com.dinepos.orderservice.config.PosConfig;
import com.dinepos.orderservice.dto.OrderItemRequest;
import com.dinepos.orderservice.exception.OrderNotFoundException;
import com.dinepos.orderservice.mapper.OrderLineMapper;
import com.dinepos.orderservice.model.KotHeader;
import com.dinepos.orderservice.model.OrderHeader;
import com.dinepos.orderservice.model.PrintChannel;
import com.dinepos.orderservice.model.PrinterAssignment;
import com.dinepos.orderservice.repository.HeldOrderLineRepository;
import com.dinepos.orderservice.repository.HeldOrderRepository;
import com.dinepos.orderservice.repository.KotHeaderRepository;
import com.dinepos.orderservice.repository.KotLineRepository;
import com.dinepos.orderservice.repository.OrderHeaderRepository;
import com.dinepos.orderservice.repository.OrderLineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Writes one submission: NEW inserts an order, UPDATED rewrites an open one,
 * KOT records a kitchen ticket next to the live order.
 * <p>
 * Expects the caller to hold a transaction and to have resolved the customer id
 * into the payload already.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderPersistenceEngine {

    private final OrderNumberAllocator orderNumberAllocator;
    private final OrderHeaderRepository orderHeaderRepository;
    private final OrderLineRepository orderLineRepository;
    private final KotHeaderRepository kotHeaderRepository;
    private final KotLineRepository kotLineRepository;
    private final HeldOrderRepository heldOrderRepository;
    private final HeldOrderLineRepository heldOrderLineRepository;
    private final OrderLineMapper orderLineMapper;
    private final SeatOccupancyManager seatOccupancyManager;
    private final PrintRoutingAssigner printRoutingAssigner;
    private final PosConfig posConfig;

    public PersistedOrder persist(OrderCommand command) {
        if (command instanceof NewOrderCommand newOrder) {
            return persistNew(newOrder);
        }
        if (command instanceof UpdateOrderCommand update) {
            return persistUpdate(update);
        }
        return persistKot((KotCommand) command);
    }

    PersistedOrder persistNew(NewOrderCommand command) {
        OrderPayload payload = command.payload();
        int allocated = orderNumberAllocator.allocate();

        OrderHeader header = new OrderHeader();
        header.setOrderNo(allocated);
        applyHeaderFields(header, payload);
        header.setTableId(payload.tableId());
        header.setTableNo(payload.tableNo());
        header.setSeatId(payload.headerSeatId());
        header.setSold(false);
        header.setPrefix(payload.prefix());
        header.setPrefixedNo(payload.prefix().isEmpty() ? "" : payload.prefix() + allocated);
        orderHeaderRepository.save(header);

        int orderNo = rederiveOrderNo(payload, allocated);
        insertLines(orderNo, payload.items());
        List<PrinterAssignment> printJobs = printRoutingAssigner.assign(orderNo, payload.items(), PrintChannel.ORDER);

        List<Integer> claimedSeats = List.of();
        if (payload.isDineIn()) {
            String counter = posConfig.getSeating().getCounterName();
            claimedSeats = seatOccupancyManager.claimSeats(orderNo, payload.tableId(),
                    SeatSource.of(payload, counter), counter);
            if (payload.hasTable()) {
                seatOccupancyManager.refreshTableStatus(payload.tableId());
            }
        }

        Integer heldOrderNo = command.heldOrderNo();
        if (heldOrderNo != null && heldOrderNo != 0) {
            heldOrderRepository.deleteByOrderNo(heldOrderNo);
            heldOrderLineRepository.deleteByOrderNo(heldOrderNo);
            log.info("Held order purged. heldOrderNo={}, orderNo={}", heldOrderNo, orderNo);
        }

        log.info("Order created. orderNo={}, type={}, lines={}", orderNo, payload.orderType(), payload.items().size());
        return new PersistedOrder(orderNo, claimedSeats, printJobs);
    }

    PersistedOrder persistUpdate(UpdateOrderCommand command) {
        OrderPayload payload = command.payload();
        int orderNo = payload.orderNo();

        OrderHeader header = orderHeaderRepository.findById(orderNo)
                .orElseThrow(() -> {
                    log.warn("Order not found for update. orderNo={}", orderNo);
                    return new OrderNotFoundException(orderNo);
                });
        boolean sold = header.isSold();

        applyHeaderFields(header, payload);
        if (sold) {
            log.warn("Order already sold, seats and table left unchanged. orderNo={}", orderNo);
        } else {
            header.setTableId(payload.tableId());
            header.setTableNo(payload.tableNo());
            header.setSeatId(payload.headerSeatId());
        }
        orderHeaderRepository.save(header);

        orderLineRepository.deleteByOrderNo(orderNo);
        insertLines(orderNo, payload.items());
        List<PrinterAssignment> printJobs = printRoutingAssigner.assign(orderNo, payload.items(), PrintChannel.ORDER);

        List<Integer> claimedSeats = List.of();
        if (payload.isDineIn() && !sold) {
            if (payload.hasExplicitSeats()) {
                claimedSeats = seatOccupancyManager.reassignSeats(orderNo, payload.tableId(), payload.seatIds(),
                        posConfig.getSeating().getCounterName());
            }
            if (payload.hasTable()) {
                seatOccupancyManager.refreshTableStatus(payload.tableId());
            }
        }

        log.info("Order updated. orderNo={}, sold={}, lines={}", orderNo, sold, payload.items().size());
        return new PersistedOrder(orderNo, claimedSeats, printJobs);
    }

    PersistedOrder persistKot(KotCommand command) {
        OrderPayload payload = command.payload();
        int orderNo = payload.orderNo();

        // the sold flag only guards UPDATED; a kitchen ticket always moves the order to its table
        Optional<OrderHeader> liveHeader = orderHeaderRepository.findById(orderNo);
        liveHeader.ifPresentOrElse(header -> {
            header.setTableId(payload.tableId());
            header.setTableNo(payload.tableNo());
            header.setSeatId(payload.headerSeatId());
            header.setCustomerId(payload.customerId());
            header.setCustomerName(payload.customerName());
            header.setContact(payload.contact());
            header.setAddress(payload.address());
            header.setFlat(payload.flatNo());
            orderHeaderRepository.save(header);
        }, () -> log.warn("Kitchen ticket for an order without header, header not updated. orderNo={}", orderNo));

        List<Integer> claimedSeats = List.of();
        if (payload.hasExplicitSeats()) {
            seatOccupancyManager.occupySeats(payload.tableId(), payload.seatIds());
            claimedSeats = payload.seatIds();
        } else if (payload.hasTable()) {
            seatOccupancyManager.markTablePartiallyOccupied(payload.tableId());
        }

        KotHeader kot = new KotHeader();
        kot.setOrderNo(orderNo);
        kot.setOrderDate(payload.date());
        kot.setOrderTime(payload.time());
        kot.setOrderType(payload.orderType());
        kot.setCustomerId(payload.customerId());
        kot.setCustomerName(payload.customerName());
        kot.setFlat(payload.flatNo());
        kot.setAddress(payload.address());
        kot.setContact(payload.contact());
        kot.setDeliveryBoyId(payload.deliveryBoyId());
        kot.setTableId(payload.tableId());
        kot.setTableNo(payload.tableNo());
        kot.setRemarks(payload.remarks());
        kot.setTotal(payload.total());
        kot.setSold(false);
        kot.setStatusLabel(payload.orderType().getLabel());
        KotHeader savedKot = kotHeaderRepository.save(kot);

        for (OrderItemRequest item : payload.items()) {
            kotLineRepository.save(orderLineMapper.toKotLine(item, savedKot.getKotId(), orderNo));
        }

        List<PrinterAssignment> printJobs = printRoutingAssigner.assign(orderNo, payload.items(), PrintChannel.KITCHEN);

        log.info("Kitchen ticket recorded. orderNo={}, kotId={}, lines={}",
                orderNo, savedKot.getKotId(), payload.items().size());
        return new PersistedOrder(orderNo, claimedSeats, printJobs);
    }

    // fields NEW and UPDATED both write; table and seat are decided by the caller
    private void applyHeaderFields(OrderHeader header, OrderPayload payload) {
        header.setOrderDate(payload.date());
        header.setOrderTime(payload.time());
        header.setOrderType(payload.orderType());
        header.setCustomerId(payload.customerId());
        header.setCustomerName(payload.customerName());
        header.setFlat(payload.flatNo());
        header.setAddress(payload.address());
        header.setContact(payload.contact());
        header.setDeliveryBoyId(payload.deliveryBoyId());
        header.setRemarks(payload.remarks());
        header.setTotal(payload.total());
        header.setStatusLabel(payload.orderType().getLabel());
    }

    private int rederiveOrderNo(OrderPayload payload, int allocated) {
        int orderNo = orderHeaderRepository
                .findFirstByOrderDateAndOrderTimeAndCustomerIdOrderByOrderNoDesc(
                        payload.date(), payload.time(), payload.customerId())
                .map(OrderHeader::getOrderNo)
                .orElse(allocated);
        if (orderNo != allocated) {
            log.warn("Stored order number differs from allocated one. allocated={}, stored={}", allocated, orderNo);
        }
        return orderNo;
    }

    private void insertLines(int orderNo, List<OrderItemRequest> items) {
        for (OrderItemRequest item : items) {
            orderLineRepository.save(orderLineMapper.toOrderLine(item, orderNo));
            log.debug("Order line written. orderNo={}, slNo={}, itemCode={}", orderNo, item.getSlNo(), item.getItemCode());
        }
    }
}
