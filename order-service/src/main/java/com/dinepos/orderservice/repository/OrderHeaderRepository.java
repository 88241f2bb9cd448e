package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.OrderHeader;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface OrderHeaderRepository extends JpaRepository<OrderHeader, Integer> {

    @Query("SELECT COALESCE(MAX(o.orderNo), 0) FROM OrderHeader o")
    Integer findMaxOrderNo();

    // authoritative order number after an insert, newest wins
    Optional<OrderHeader> findFirstByOrderDateAndOrderTimeAndCustomerIdOrderByOrderNoDesc(
            String orderDate, String orderTime, Integer customerId);
}
