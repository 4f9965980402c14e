package com.stockledger.service;

import com.stockledger.exception.DuplicateEntryException;
import com.stockledger.exception.ValidationException;
import com.stockledger.model.Customer;
import com.stockledger.repository.CustomerRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
public class CustomerService {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(CustomerService.class);

    static final String EMAIL_CONSTRAINT = "uk_customers_email";

    private static final int MAX_NAME_LENGTH = 255;
    private static final int MAX_EMAIL_LENGTH = 255;
    private static final int MAX_PHONE_LENGTH = 20;

    private final CustomerRepository customerRepository;

    public CustomerService(CustomerRepository customerRepository) {
        this.customerRepository = customerRepository;
    }

    @Transactional
    public Customer add(String name, String email, String phone) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Customer name cannot be empty.");
        }
        String normalizedName = checkLength("Customer name", name.strip(), MAX_NAME_LENGTH);
        String normalizedEmail = checkLength("Email", blankToNull(email), MAX_EMAIL_LENGTH);
        String normalizedPhone = checkLength("Phone", blankToNull(phone), MAX_PHONE_LENGTH);

        if (normalizedEmail != null && customerRepository.findByEmail(normalizedEmail).isPresent()) {
            throw duplicate(normalizedEmail, null);
        }

        Customer customer = new Customer();
        customer.setName(normalizedName);
        customer.setEmail(normalizedEmail);
        customer.setPhone(normalizedPhone);

        Customer saved;
        try {
            saved = customerRepository.saveAndFlush(customer);
        } catch (DataIntegrityViolationException e) {
            String cause = e.getMostSpecificCause().getMessage();
            logger.warn("Constraint violation saving customer '{}': {}", customer.getName(), cause);
            if (normalizedEmail != null && cause != null
                    && cause.toLowerCase(Locale.ROOT).contains(EMAIL_CONSTRAINT)) {
                throw duplicate(normalizedEmail, e);
            }
            throw new ValidationException("Customer '" + customer.getName() + "' was rejected by the database: "
                    + cause, e);
        }
        logger.info("Customer added: id={}, name='{}', email={}", saved.getId(), saved.getName(), saved.getEmail());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Customer> findAll() {
        return customerRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Optional<Customer> findById(Long id) {
        return customerRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<Customer> findByEmail(String email) {
        return customerRepository.findByEmail(email);
    }

    @Transactional(readOnly = true)
    public Optional<Customer> findByName(String name) {
        return customerRepository.findFirstByNameOrderByIdAsc(name);
    }

    private static DuplicateEntryException duplicate(String email, Throwable cause) {
        return new DuplicateEntryException("A customer with email '" + email + "' already exists.", cause);
    }

    private static String checkLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field + " cannot be longer than " + max + " characters.");
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
