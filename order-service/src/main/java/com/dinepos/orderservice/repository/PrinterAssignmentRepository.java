package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.PrintChannel;
import com.dinepos.orderservice.model.PrinterAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PrinterAssignmentRepository extends JpaRepository<PrinterAssignment, Long> {

    List<PrinterAssignment> findByOrderNoAndChannelOrderBySlNoAsc(Integer orderNo, PrintChannel channel);

    List<PrinterAssignment> findByOrderNoOrderByChannelAscSlNoAsc(Integer orderNo);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM PrinterAssignment p WHERE p.orderNo = :orderNo AND p.channel = :channel")
    int deleteByOrderNoAndChannel(@Param("orderNo") Integer orderNo, @Param("channel") PrintChannel channel);

    /**
     * Replaces every blank printer of an order's channel with the given default.
     * Clears the persistence context afterwards so later reads see the new labels.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PrinterAssignment p SET p.printer = :printer " +
            "WHERE p.orderNo = :orderNo AND p.channel = :channel AND p.printer = ''")
    int assignDefaultPrinter(@Param("orderNo") Integer orderNo,
                             @Param("channel") PrintChannel channel,
                             @Param("printer") String printer);
}
