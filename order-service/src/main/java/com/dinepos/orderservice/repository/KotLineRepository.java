package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.KotLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface KotLineRepository extends JpaRepository<KotLine, Long> {

    List<KotLine> findByKotIdOrderBySlNoAsc(Long kotId);

    long countByOrderNo(Integer orderNo);
}
