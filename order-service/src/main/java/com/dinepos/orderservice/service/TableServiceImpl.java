package com.dinepos.orderservice.service;

import com.dinepos.orderservice.dto.SeatResponse;
import com.dinepos.orderservice.dto.TableResponse;
import com.dinepos.orderservice.mapper.TableMapper;
import com.dinepos.orderservice.model.DiningTable;
import com.dinepos.orderservice.model.Seat;
import com.dinepos.orderservice.repository.DiningTableRepository;
import com.dinepos.orderservice.repository.SeatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class TableServiceImpl implements TableService {

    private final DiningTableRepository diningTableRepository;
    private final SeatRepository seatRepository;
    private final TableMapper tableMapper;

    @Override
    @Transactional(readOnly = true)
    public List<TableResponse> getTables() {
        List<DiningTable> tables = diningTableRepository.findAllByOrderByTableIdAsc();

        // Fetch all seats in a single query to avoid N+1
        Map<Integer, List<SeatResponse>> seatsByTable = seatRepository.findAllByOrderByTableIdAscSeatIdAsc().stream()
                .collect(Collectors.groupingBy(
                        Seat::getTableId,
                        Collectors.mapping(tableMapper::toSeatResponse, Collectors.toList())));

        log.debug("Listing {} tables with {} seated tables", tables.size(), seatsByTable.size());

        return tables.stream()
                .map(table -> {
                    TableResponse response = tableMapper.toTableResponse(table);
                    response.setSeats(seatsByTable.getOrDefault(table.getTableId(), List.of()));
                    return response;
                })
                .collect(Collectors.toList());
    }
}
