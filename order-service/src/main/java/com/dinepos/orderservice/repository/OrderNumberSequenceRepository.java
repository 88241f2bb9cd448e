package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.OrderNumberSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface OrderNumberSequenceRepository extends JpaRepository<OrderNumberSequence, String> {

    /**
     * SELECT ... FOR UPDATE on the counter row. Concurrent submissions queue
     * here until the holder commits or rolls back.
     *
     * Must be called inside a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM OrderNumberSequence s WHERE s.name = :name")
    Optional<OrderNumberSequence> findByNameForUpdate(@Param("name") String name);
}
