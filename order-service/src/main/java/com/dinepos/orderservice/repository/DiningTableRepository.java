package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.DiningTable;
import com.dinepos.orderservice.model.TableStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DiningTableRepository extends JpaRepository<DiningTable, Integer> {

    List<DiningTable> findAllByOrderByTableIdAsc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DiningTable t SET t.status = :status WHERE t.tableId = :tableId")
    int updateStatus(@Param("tableId") Integer tableId, @Param("status") TableStatus status);
}
