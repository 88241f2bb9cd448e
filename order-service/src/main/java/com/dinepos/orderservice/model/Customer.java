package com.dinepos.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "customer", indexes = {
        @Index(name = "idx_customer_name_contact", columnList = "cust_name, contact_no")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cust_code")
    @ToString.Include
    private Integer custCode;

    @Column(name = "cust_name", nullable = false)
    @ToString.Include
    private String custName;

    // address line
    @Column(name = "add1")
    private String add1;

    // both contact fields hold the 10-digit normalized number
    @Column(name = "contact_no")
    @ToString.Include
    private String contactNo;

    private String phone;

    // legacy spare field, carries the flat number
    private String fax;

    @Column(nullable = false)
    private boolean active;
}
