package com.stockledger.service;

import com.stockledger.dto.LineItem;
import com.stockledger.dto.PurchaseItemRow;
import com.stockledger.dto.PurchaseLine;
import com.stockledger.dto.PurchaseReceipt;
import com.stockledger.dto.PurchaseSummaryRow;
import com.stockledger.exception.InsufficientStockException;
import com.stockledger.exception.ResourceNotFoundException;
import com.stockledger.exception.ValidationException;
import com.stockledger.model.Customer;
import com.stockledger.model.Product;
import com.stockledger.model.Purchase;
import com.stockledger.model.PurchaseItem;
import com.stockledger.persistence.StoreDatabase;
import com.stockledger.repository.CustomerRepository;
import com.stockledger.repository.ProductRepository;
import com.stockledger.repository.PurchaseRepository;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class PurchaseService {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PurchaseService.class);

    public static final String ANONYMOUS = "Anonymous";

    private static final String SUMMARY_SELECT = "SELECT p.id, p.customer_id, p.total_amount, p.purchase_date, "
            + "c.name AS customer_name FROM purchases p LEFT JOIN customers c ON p.customer_id = c.id ";

    private static final RowMapper<PurchaseSummaryRow> SUMMARY_ROW = (rs, rowNum) -> {
        Timestamp purchaseDate = rs.getTimestamp("purchase_date");
        return new PurchaseSummaryRow(
                rs.getLong("id"),
                rs.getObject("customer_id", Long.class),
                rs.getBigDecimal("total_amount"),
                purchaseDate != null ? purchaseDate.toLocalDateTime() : null,
                rs.getString("customer_name"));
    };

    private static final RowMapper<PurchaseItemRow> ITEM_ROW = (rs, rowNum) -> new PurchaseItemRow(
            rs.getLong("id"),
            rs.getLong("product_id"),
            rs.getInt("quantity"),
            rs.getBigDecimal("price_per_unit"),
            rs.getString("product_name"));

    private final PurchaseRepository purchaseRepository;
    private final ProductRepository productRepository;
    private final CustomerRepository customerRepository;
    private final ProductService productService;
    private final StoreDatabase storeDatabase;

    public PurchaseService(PurchaseRepository purchaseRepository, ProductRepository productRepository,
            CustomerRepository customerRepository, ProductService productService, StoreDatabase storeDatabase) {
        this.purchaseRepository = purchaseRepository;
        this.productRepository = productRepository;
        this.customerRepository = customerRepository;
        this.productService = productService;
        this.storeDatabase = storeDatabase;
    }

    /**
     * Records a purchase and takes its items out of stock.
     * <p>
     * Every item is validated before anything is written. The header row, the
     * item rows and the stock decrements then share one transaction, so any
     * failure leaves no trace of the purchase.
     *
     * @param customerId buying customer, or {@code null} for an anonymous sale
     * @param items      requested products and quantities
     */
    @Transactional
    public PurchaseReceipt create(Long customerId, List<LineItem> items) {
        if (items == null || items.isEmpty()) {
            throw new ValidationException("Purchase cancelled - no items selected.");
        }

        Customer customer = null;
        if (customerId != null) {
            customer = customerRepository.findById(customerId)
                    .orElseThrow(() -> new ResourceNotFoundException("No customer found with ID " + customerId + "."));
        }

        // Validate and price every line first
        Map<Long, Integer> requestedPerProduct = new HashMap<>();
        List<PurchaseItem> purchaseItems = new ArrayList<>();
        List<PurchaseLine> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (LineItem item : items) {
            if (item.quantity() <= 0) {
                throw new ValidationException("Quantity must be positive.");
            }
            Product product = productRepository.findById(item.productId())
                    .orElseThrow(() -> new ResourceNotFoundException("Product #" + item.productId() + " not found."));

            // The same product may appear on several lines
            int requested = requestedPerProduct.merge(product.getId(), item.quantity(), Integer::sum);
            if (product.getQuantity() < requested) {
                throw new InsufficientStockException("Insufficient quantity for " + product.getName()
                        + " (available: " + product.getQuantity() + ", requested: " + requested + ").");
            }

            PurchaseItem purchaseItem = new PurchaseItem();
            purchaseItem.setProduct(product);
            purchaseItem.setQuantity(item.quantity());
            purchaseItem.setPricePerUnit(product.getPrice());
            purchaseItems.add(purchaseItem);

            total = total.add(purchaseItem.lineTotal());
            lines.add(new PurchaseLine(product.getName(), item.quantity(), product.getPrice()));
        }

        Purchase purchase = new Purchase();
        purchase.setCustomer(customer);
        purchase.setTotalAmount(total);
        purchaseItems.forEach(purchase::addItem);
        Purchase saved = purchaseRepository.saveAndFlush(purchase);

        for (PurchaseItem purchaseItem : purchaseItems) {
            productService.adjustQuantity(purchaseItem.getProduct().getId(), -purchaseItem.getQuantity());
        }

        String customerName = customer != null ? customer.getName() : ANONYMOUS;
        logger.info("Purchase created: id={}, customer='{}', items={}, total={}",
                saved.getId(), customerName, purchaseItems.size(), total);
        return new PurchaseReceipt(saved.getId(), customerName, total, lines);
    }

    public Optional<PurchaseSummaryRow> findById(Long purchaseId) {
        return storeDatabase.fetchOne(SUMMARY_SELECT + "WHERE p.id = ?", SUMMARY_ROW, purchaseId);
    }

    public List<PurchaseSummaryRow> findRecent(int limit) {
        return storeDatabase.fetchAll(SUMMARY_SELECT + "ORDER BY p.purchase_date DESC, p.id DESC LIMIT ?",
                SUMMARY_ROW, limit);
    }

    public List<PurchaseItemRow> findItems(Long purchaseId) {
        return storeDatabase.fetchAll("SELECT pi.id, pi.product_id, pi.quantity, pi.price_per_unit, "
                + "pr.name AS product_name FROM purchase_items pi JOIN products pr ON pi.product_id = pr.id "
                + "WHERE pi.purchase_id = ? ORDER BY pi.id", ITEM_ROW, purchaseId);
    }
}
