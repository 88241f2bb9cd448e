package com.dinepos.orderservice.mapper;

import com.dinepos.orderservice.dto.OrderDetailResponse;
import com.dinepos.orderservice.dto.OrderLineResponse;
import com.dinepos.orderservice.dto.PrintJobResponse;
import com.dinepos.orderservice.dto.SeatAssignmentResponse;
import com.dinepos.orderservice.model.OrderHeader;
import com.dinepos.orderservice.model.OrderLine;
import com.dinepos.orderservice.model.OrderSeatAssignment;
import com.dinepos.orderservice.model.PrinterAssignment;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderDetailMapper {

    // lines, seats and print jobs live in their own tables, the caller attaches them
    @Mapping(target = "option", source = "orderType.code")
    @Mapping(target = "orderType", source = "orderType.label")
    @Mapping(target = "lines", ignore = true)
    @Mapping(target = "seats", ignore = true)
    @Mapping(target = "printJobs", ignore = true)
    OrderDetailResponse toOrderDetail(OrderHeader header);

    List<OrderLineResponse> toLineResponses(List<OrderLine> lines);

    List<SeatAssignmentResponse> toSeatResponses(List<OrderSeatAssignment> seats);

    List<PrintJobResponse> toPrintJobResponses(List<PrinterAssignment> printJobs);
}
