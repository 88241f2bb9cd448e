package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.Seat;
import com.dinepos.orderservice.model.SeatStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SeatRepository extends JpaRepository<Seat, Integer> {

    // a seat only counts when it belongs to the table the order is for
    Optional<Seat> findBySeatIdAndTableId(Integer seatId, Integer tableId);

    long countByTableIdAndStatus(Integer tableId, SeatStatus status);

    List<Seat> findAllByOrderByTableIdAscSeatIdAsc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Seat s SET s.status = com.dinepos.orderservice.model.SeatStatus.FREE WHERE s.tableId = :tableId")
    int releaseAllOnTable(@Param("tableId") Integer tableId);
}
