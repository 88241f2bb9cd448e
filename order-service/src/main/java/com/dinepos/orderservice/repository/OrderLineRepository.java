package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.OrderLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderLineRepository extends JpaRepository<OrderLine, Long> {

    List<OrderLine> findByOrderNoOrderBySlNoAsc(Integer orderNo);

    long countByOrderNo(Integer orderNo);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM OrderLine l WHERE l.orderNo = :orderNo")
    int deleteByOrderNo(@Param("orderNo") Integer orderNo);
}
