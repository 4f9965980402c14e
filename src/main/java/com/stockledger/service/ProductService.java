package com.stockledger.service;

import com.stockledger.dto.ProductUpdate;
import com.stockledger.dto.ProductUpdateResult;
import com.stockledger.exception.DuplicateEntryException;
import com.stockledger.exception.InsufficientStockException;
import com.stockledger.exception.ResourceNotFoundException;
import com.stockledger.exception.ValidationException;
import com.stockledger.model.Product;
import com.stockledger.repository.ProductRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
public class ProductService {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ProductService.class);

    static final String NAME_CONSTRAINT = "uk_products_name";

    // Column limits from db/schema.sql
    private static final int MAX_NAME_LENGTH = 255;
    private static final int MAX_CATEGORY_LENGTH = 100;
    private static final BigDecimal MAX_PRICE = new BigDecimal("99999999.99");

    private final ProductRepository productRepository;

    public ProductService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    @Transactional
    public Product add(String name, BigDecimal price, int quantity, String category) {
        String productName = requireName(name);
        validatePrice(price);
        validateQuantity(quantity);

        // Quick check for a friendlier message; the unique constraint is what actually guards
        if (productRepository.findByName(productName).isPresent()) {
            throw duplicate(productName, null);
        }

        Product product = new Product();
        product.setName(productName);
        product.setPrice(price.setScale(2, RoundingMode.HALF_UP));
        product.setQuantity(quantity);
        product.setCategory(checkCategory(category));

        Product saved = saveChecked(product);
        logger.info("Product added: id={}, name='{}', price={}, quantity={}, category={}",
                saved.getId(), saved.getName(), saved.getPrice(), saved.getQuantity(), saved.getCategory());
        return saved;
    }

    /**
     * Overlays the non-null fields of {@code update} on the stored product and
     * rewrites it. Omitted fields keep their current values.
     */
    @Transactional
    public ProductUpdateResult update(Long id, ProductUpdate update) {
        Product product = productRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("No product found with ID " + id + "."));
        int previousQuantity = product.getQuantity();

        if (update.name() != null) {
            String newName = requireName(update.name());
            if (!newName.equals(product.getName())) {
                Optional<Product> clash = productRepository.findByName(newName);
                if (clash.isPresent() && !clash.get().getId().equals(id)) {
                    throw duplicate(newName, null);
                }
                product.setName(newName);
            }
        }
        if (update.price() != null) {
            validatePrice(update.price());
            product.setPrice(update.price().setScale(2, RoundingMode.HALF_UP));
        }
        if (update.quantity() != null) {
            validateQuantity(update.quantity());
            product.setQuantity(update.quantity());
        }
        if (update.category() != null) {
            product.setCategory(checkCategory(update.category()));
        }

        Product saved = saveChecked(product);
        logger.info("Product updated: id={}, name='{}', price={}, quantity={} (was {})",
                id, saved.getName(), saved.getPrice(), saved.getQuantity(), previousQuantity);
        return new ProductUpdateResult(saved, previousQuantity);
    }

    /**
     * Adds {@code delta} to the stored quantity (negative removes stock).
     * Read-modify-write: assumes a single user at a time.
     *
     * @throws InsufficientStockException if the result would be negative; the
     *                                    stored quantity is left as it was
     */
    @Transactional
    public Product adjustQuantity(Long id, int delta) {
        Product product = productRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("No product found with ID " + id + "."));

        int newQuantity = product.getQuantity() + delta;
        if (newQuantity < 0) {
            logger.warn("Rejected stock change for product #{}: {} {} would go negative",
                    id, product.getQuantity(), delta);
            throw new InsufficientStockException("Insufficient quantity for product #" + id
                    + " (available: " + product.getQuantity() + ", change: " + delta + ").");
        }

        product.setQuantity(newQuantity);
        return productRepository.saveAndFlush(product);
    }

    @Transactional(readOnly = true)
    public List<Product> findAll() {
        return productRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Optional<Product> findById(Long id) {
        return productRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<Product> findByName(String name) {
        return productRepository.findByName(name);
    }

    private Product saveChecked(Product product) {
        try {
            return productRepository.saveAndFlush(product);
        } catch (DataIntegrityViolationException e) {
            String cause = e.getMostSpecificCause().getMessage();
            logger.warn("Constraint violation saving product '{}': {}", product.getName(), cause);
            if (cause != null && cause.toLowerCase(Locale.ROOT).contains(NAME_CONSTRAINT)) {
                throw duplicate(product.getName(), e);
            }
            throw new ValidationException("Product '" + product.getName() + "' was rejected by the database: "
                    + cause, e);
        }
    }

    private static DuplicateEntryException duplicate(String name, Throwable cause) {
        return new DuplicateEntryException("A product with name '" + name + "' already exists.", cause);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Product name cannot be empty.");
        }
        String stripped = name.strip();
        if (stripped.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Product name cannot be longer than " + MAX_NAME_LENGTH + " characters.");
        }
        return stripped;
    }

    private static void validatePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new ValidationException("Price cannot be negative.");
        }
        if (price.setScale(2, RoundingMode.HALF_UP).compareTo(MAX_PRICE) > 0) {
            throw new ValidationException("Price cannot exceed $" + MAX_PRICE + ".");
        }
    }

    private static void validateQuantity(int quantity) {
        if (quantity < 0) {
            throw new ValidationException("Quantity cannot be negative.");
        }
    }

    private static String checkCategory(String category) {
        String value = category == null || category.isBlank() ? null : category.strip();
        if (value != null && value.length() > MAX_CATEGORY_LENGTH) {
            throw new ValidationException("Category cannot be longer than " + MAX_CATEGORY_LENGTH + " characters.");
        }
        return value;
    }
}
