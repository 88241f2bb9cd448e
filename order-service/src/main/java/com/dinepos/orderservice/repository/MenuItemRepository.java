package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MenuItemRepository extends JpaRepository<MenuItem, Integer> {

    @Query("SELECT m.printerName FROM MenuItem m WHERE m.itemId = :itemId")
    Optional<String> findPrinterNameByItemId(@Param("itemId") Integer itemId);
}
