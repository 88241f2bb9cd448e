package com.dinepos.orderservice.service;

import com.dinepos.orderservice.command.OrderCommand;
import com.dinepos.orderservice.command.OrderCommandFactory;
import com.dinepos.orderservice.command.OrderPayload;
import com.dinepos.orderservice.dto.NextOrderNumberResponse;
import com.dinepos.orderservice.dto.OrderDetailResponse;
import com.dinepos.orderservice.dto.OrderSubmissionRequest;
import com.dinepos.orderservice.dto.OrderSubmissionResponse;
import com.dinepos.orderservice.exception.OrderNotFoundException;
import com.dinepos.orderservice.mapper.OrderDetailMapper;
import com.dinepos.orderservice.model.OrderHeader;
import com.dinepos.orderservice.repository.OrderHeaderRepository;
import com.dinepos.orderservice.repository.OrderLineRepository;
import com.dinepos.orderservice.repository.OrderSeatAssignmentRepository;
import com.dinepos.orderservice.repository.PrinterAssignmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    private final OrderCommandFactory commandFactory;
    private final OrderTransactionCoordinator transactionCoordinator;
    private final OrderNumberAllocator orderNumberAllocator;
    private final OrderHeaderRepository orderHeaderRepository;
    private final OrderLineRepository orderLineRepository;
    private final OrderSeatAssignmentRepository seatAssignmentRepository;
    private final PrinterAssignmentRepository printerAssignmentRepository;
    private final OrderDetailMapper orderDetailMapper;

    @Override
    public OrderSubmissionResponse submitOrder(OrderSubmissionRequest request) {
        log.info("Order submission received. status={}, orderNo={}, option={}, tableId={}, items={}, seats={}",
                request.getStatus(), request.getOrderNo(), request.getOption(), request.getTableId(),
                request.getItems() == null ? 0 : request.getItems().size(),
                request.getSelectedSeats() == null ? 0 : request.getSelectedSeats().size());

        OrderCommand command = commandFactory.from(request);
        SubmissionResult result = transactionCoordinator.execute(command);

        return toResponse(result);
    }

    @Override
    @Transactional(readOnly = true)
    public NextOrderNumberResponse getNextOrderNumber() {
        return new NextOrderNumberResponse(String.valueOf(orderNumberAllocator.peek()));
    }

    @Override
    @Transactional(readOnly = true)
    public OrderDetailResponse getOrder(int orderNo) {
        OrderHeader header = orderHeaderRepository.findById(orderNo)
                .orElseThrow(() -> new OrderNotFoundException(orderNo));

        OrderDetailResponse response = orderDetailMapper.toOrderDetail(header);
        response.setLines(orderDetailMapper.toLineResponses(
                orderLineRepository.findByOrderNoOrderBySlNoAsc(orderNo)));
        response.setSeats(orderDetailMapper.toSeatResponses(
                seatAssignmentRepository.findByOrderNoOrderBySeatIdAsc(orderNo)));
        response.setPrintJobs(orderDetailMapper.toPrintJobResponses(
                printerAssignmentRepository.findByOrderNoOrderByChannelAscSlNoAsc(orderNo)));

        log.debug("Order {} loaded: {} lines, {} seats", orderNo,
                response.getLines().size(), response.getSeats().size());
        return response;
    }

    static OrderSubmissionResponse toResponse(SubmissionResult result) {
        OrderCommand command = result.command();
        OrderPayload payload = command.payload();
        String status = command.status().name();

        OrderSubmissionResponse.Details details = OrderSubmissionResponse.Details.builder()
                .orderType(payload.orderType().getLabel())
                .customerInfo(payload.customerId() != 0
                        ? OrderSubmissionResponse.CustomerInfo.builder()
                        .custId(payload.customerId())
                        .custName(payload.customerName())
                        .contact(payload.contact())
                        .build()
                        : null)
                .tableInfo(payload.hasTable()
                        ? OrderSubmissionResponse.TableInfo.builder()
                        .tableId(payload.tableId())
                        .tableNo(payload.tableNo())
                        .build()
                        : null)
                .selectedSeats(payload.hasExplicitSeats() ? payload.seatIds() : null)
                .itemsCount(payload.items().size())
                .total(payload.total())
                .build();

        return OrderSubmissionResponse.builder()
                .orderNo(result.orderNo())
                .custId(result.customerId())
                .status(status)
                .message("Order " + status.toLowerCase(Locale.ROOT) + " successfully")
                .details(details)
                .build();
    }
}
