package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.StagedSeat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StagedSeatRepository extends JpaRepository<StagedSeat, Long> {

    List<StagedSeat> findByCounterOrderByIdAsc(String counter);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM StagedSeat s WHERE s.counter = :counter")
    int deleteByCounter(@Param("counter") String counter);
}
