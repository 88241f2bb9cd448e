package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.HeldOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface HeldOrderRepository extends JpaRepository<HeldOrder, Integer> {

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM HeldOrder h WHERE h.orderNo = :orderNo")
    int deleteByOrderNo(@Param("orderNo") Integer orderNo);
}
