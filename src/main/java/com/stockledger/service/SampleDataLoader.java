package com.stockledger.service;

import com.stockledger.exception.InventoryException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Demonstration products and customers. Entries that already exist are
 * skipped, so loading twice is harmless.
 */
@Service
public class SampleDataLoader {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SampleDataLoader.class);

    private record SampleProduct(String name, String price, int quantity, String category) {
    }

    private record SampleCustomer(String name, String email, String phone) {
    }

    private static final List<SampleProduct> PRODUCTS = List.of(
            new SampleProduct("Laptop", "999.99", 10, "Electronics"),
            new SampleProduct("Smartphone", "599.99", 20, "Electronics"),
            new SampleProduct("Headphones", "89.99", 30, "Accessories"),
            new SampleProduct("Mouse", "24.99", 50, "Accessories"),
            new SampleProduct("Keyboard", "49.99", 40, "Accessories"),
            new SampleProduct("Monitor", "299.99", 15, "Electronics"),
            new SampleProduct("USB Drive", "19.99", 100, "Storage"),
            new SampleProduct("External HDD", "79.99", 25, "Storage"));

    private static final List<SampleCustomer> CUSTOMERS = List.of(
            new SampleCustomer("John Smith", "john@example.com", "555-1234"),
            new SampleCustomer("Jane Doe", "jane@example.com", "555-5678"),
            new SampleCustomer("Bob Johnson", "bob@example.com", "555-9012"));

    private final ProductService productService;
    private final CustomerService customerService;

    public SampleDataLoader(ProductService productService, CustomerService customerService) {
        this.productService = productService;
        this.customerService = customerService;
    }

    /**
     * @return names of the products and customers that were actually added
     */
    public List<String> load() {
        List<String> added = new ArrayList<>();
        for (SampleProduct sample : PRODUCTS) {
            if (productService.findByName(sample.name()).isPresent()) {
                continue;
            }
            try {
                productService.add(sample.name(), new BigDecimal(sample.price()), sample.quantity(), sample.category());
                added.add(sample.name());
            } catch (InventoryException e) {
                logger.warn("Skipping sample product {}: {}", sample.name(), e.getMessage());
            }
        }
        for (SampleCustomer sample : CUSTOMERS) {
            if (customerService.findByEmail(sample.email()).isPresent()) {
                continue;
            }
            try {
                customerService.add(sample.name(), sample.email(), sample.phone());
                added.add(sample.name());
            } catch (InventoryException e) {
                logger.warn("Skipping sample customer {}: {}", sample.name(), e.getMessage());
            }
        }
        logger.info("Sample data loaded: {} new entries", added.size());
        return added;
    }
}
