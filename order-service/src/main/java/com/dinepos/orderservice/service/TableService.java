package com.dinepos.orderservice.service;

import com.dinepos.orderservice.dto.TableResponse;

import java.util.List;

public interface TableService {

    /**
     * Floor plan: every table with its seats and their occupancy.
     */
    List<TableResponse> getTables();
}
