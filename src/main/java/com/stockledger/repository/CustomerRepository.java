package com.stockledger.repository;

import com.stockledger.model.Customer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CustomerRepository extends JpaRepository<Customer, Long> {
    Optional<Customer> findByEmail(String email);

    // Names are not unique; the earliest customer wins
    Optional<Customer> findFirstByNameOrderByIdAsc(String name);

    List<Customer> findAllByOrderByNameAsc();
}
