package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.KotHeader;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface KotHeaderRepository extends JpaRepository<KotHeader, Long> {

    List<KotHeader> findByOrderNoOrderByKotIdAsc(Integer orderNo);
}
