package com.dinepos.orderservice.mapper;

import com.dinepos.orderservice.dto.SeatResponse;
import com.dinepos.orderservice.dto.TableResponse;
import com.dinepos.orderservice.model.DiningTable;
import com.dinepos.orderservice.model.Seat;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TableMapper {

    // seats are attached by the caller, grouped by table
    @Mapping(target = "seats", ignore = true)
    TableResponse toTableResponse(DiningTable table);

    SeatResponse toSeatResponse(Seat seat);
}
