package com.dinepos.orderservice.repository;

import com.dinepos.orderservice.model.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, Integer> {

    // a contact may live in either legacy field
    @Query("SELECT c FROM Customer c WHERE c.custName = :name AND c.active = true " +
            "AND (c.contactNo = :contact OR c.phone = :contact) ORDER BY c.custCode DESC")
    List<Customer> findActiveByNameAndContact(@Param("name") String name, @Param("contact") String contact);

    Optional<Customer> findFirstByCustNameAndContactNoAndActiveTrueOrderByCustCodeDesc(String custName, String contactNo);

    long countByCustNameAndContactNo(String custName, String contactNo);
}
