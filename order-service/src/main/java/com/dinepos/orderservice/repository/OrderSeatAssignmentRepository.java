package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.OrderSeatAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderSeatAssignmentRepository extends JpaRepository<OrderSeatAssignment, Long> {

    List<OrderSeatAssignment> findByOrderNoOrderBySeatIdAsc(Integer orderNo);

    long countByOrderNo(Integer orderNo);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM OrderSeatAssignment a WHERE a.orderNo = :orderNo")
    int deleteByOrderNo(@Param("orderNo") Integer orderNo);
}
