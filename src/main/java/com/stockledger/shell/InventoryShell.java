package com.stockledger.shell;

import com.stockledger.audit.AuditLogMirror;
import com.stockledger.config.InventoryProperties;
import com.stockledger.dto.InventoryChange;
import com.stockledger.dto.LineItem;
import com.stockledger.dto.ProductUpdate;
import com.stockledger.dto.ProductUpdateResult;
import com.stockledger.dto.PurchaseItemRow;
import com.stockledger.dto.PurchaseReceipt;
import com.stockledger.dto.PurchaseSummaryRow;
import com.stockledger.exception.InventoryException;
import com.stockledger.model.Customer;
import com.stockledger.model.Product;
import com.stockledger.service.CustomerService;
import com.stockledger.service.ProductService;
import com.stockledger.service.PurchaseService;
import com.stockledger.service.SampleDataLoader;
import com.stockledger.util.TableRenderer;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Numbered text menu over the product, customer and purchase services.
 * Successful stock-affecting commands are mirrored to the audit repository.
 */
@Component
@Order(1)
@ConditionalOnProperty(prefix = "inventory.shell", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InventoryShell implements CommandLineRunner {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(InventoryShell.class);

    private static final List<String> PRODUCT_HEADERS = List.of("ID", "Name", "Price", "Quantity", "Category",
            "Created At", "Updated At");
    private static final List<String> CUSTOMER_HEADERS = List.of("ID", "Name", "Email", "Phone", "Created At");
    private static final List<String> PURCHASE_HEADERS = List.of("ID", "Customer ID", "Total Amount",
            "Purchase Date", "Customer Name");
    private static final List<String> ITEM_HEADERS = List.of("ID", "Product ID", "Quantity", "Price Per Unit",
            "Product Name");

    private final ProductService productService;
    private final CustomerService customerService;
    private final PurchaseService purchaseService;
    private final SampleDataLoader sampleDataLoader;
    private final AuditLogMirror auditLogMirror;
    private final InventoryProperties properties;
    private final ShellConsole console;

    public InventoryShell(ProductService productService, CustomerService customerService,
            PurchaseService purchaseService, SampleDataLoader sampleDataLoader, AuditLogMirror auditLogMirror,
            InventoryProperties properties, ShellConsole console) {
        this.productService = productService;
        this.customerService = customerService;
        this.purchaseService = purchaseService;
        this.sampleDataLoader = sampleDataLoader;
        this.auditLogMirror = auditLogMirror;
        this.properties = properties;
        this.console = console;
    }

    @Override
    public void run(String... args) {
        start();
    }

    public void start() {
        console.println();
        console.println("Welcome to the Inventory Management System!");
        if (!auditLogMirror.isAvailable()) {
            console.println("Warning: the audit repository is unavailable, changes will not be mirrored.");
        }

        try {
            if (properties.getSampleData().isPrompt()) {
                String answer = read("Would you like to add sample data for demonstration? (y/n): ");
                if (answer.strip().equalsIgnoreCase("y")) {
                    addSampleData();
                }
            }

            while (true) {
                displayMenu();
                String choice = read("\nEnter your choice (1-9): ").strip();
                if (choice.equals("9")) {
                    break;
                }
                dispatch(choice);
                read("\nPress Enter to continue...");
            }
        } catch (EndOfInput e) {
            logger.info("Console input closed, leaving the menu");
        }
        console.println();
        console.println("Exiting Inventory Management System. Goodbye!");
    }

    void dispatch(String choice) {
        try {
            if (choice.equals("1")) {
                viewProducts();
            } else if (choice.equals("2")) {
                addProduct();
            } else if (choice.equals("3")) {
                updateProduct();
            } else if (choice.equals("4")) {
                viewCustomers();
            } else if (choice.equals("5")) {
                addCustomer();
            } else if (choice.equals("6")) {
                makePurchase();
            } else if (choice.equals("7")) {
                viewPurchaseHistory();
            } else if (choice.equals("8")) {
                viewAuditHistory();
            } else {
                console.println("\nInvalid choice. Please try again.");
            }
        } catch (InventoryException e) {
            console.println(e.getMessage());
        } catch (DataAccessException e) {
            logger.error("Database error while running menu command {}: {}", choice, e.getMessage(), e);
            console.println("Database error: " + e.getMostSpecificCause().getMessage());
        }
    }

    private void displayMenu() {
        console.clear();
        console.println("=".repeat(50));
        console.println("           INVENTORY MANAGEMENT SYSTEM           ");
        console.println("=".repeat(50));
        console.println("1. View Products");
        console.println("2. Add Product");
        console.println("3. Update Product");
        console.println("4. View Customers");
        console.println("5. Add Customer");
        console.println("6. Make Purchase");
        console.println("7. View Purchase History");
        console.println("8. View Audit Purchase History");
        console.println("9. Exit");
        console.println("=".repeat(50));
    }

    private void viewProducts() {
        List<Product> products = productService.findAll();
        if (products.isEmpty()) {
            console.println("\nNo products found in inventory.");
            return;
        }
        List<List<?>> rows = new ArrayList<>();
        for (Product p : products) {
            rows.add(List.of(p.getId(), p.getName(), p.getPrice(), p.getQuantity(), valueOrEmpty(p.getCategory()),
                    valueOrEmpty(p.getCreatedAt()), valueOrEmpty(p.getUpdatedAt())));
        }
        console.println("\n" + TableRenderer.render(PRODUCT_HEADERS, rows));
    }

    private void addProduct() {
        console.println("\n=== Add New Product ===");
        String name = read("Enter product name: ").strip();
        if (name.isEmpty()) {
            console.println("Product name cannot be empty.");
            return;
        }
        if (productService.findByName(name).isPresent()) {
            console.println("A product with name '" + name + "' already exists.");
            return;
        }

        BigDecimal price;
        int quantity;
        try {
            price = new BigDecimal(read("Enter price: $").strip());
            quantity = Integer.parseInt(read("Enter quantity: ").strip());
        } catch (NumberFormatException e) {
            console.println("Invalid input. Price must be a number and quantity must be an integer.");
            return;
        }
        String category = read("Enter category (optional): ");

        Product product = productService.add(name, price, quantity, category);
        console.println("\nProduct '" + product.getName() + "' added successfully.");
        audited(auditLogMirror.recordInventoryChange(
                List.of(new InventoryChange(product.getName(), 0, product.getQuantity()))));
    }

    private void updateProduct() {
        viewProducts();
        Long id = readId("\nEnter product ID to update: ");
        if (id == null) {
            return;
        }
        Optional<Product> found = productService.findById(id);
        if (found.isEmpty()) {
            console.println("No product found with ID " + id + ".");
            return;
        }
        Product product = found.get();

        console.println("\nUpdating product: " + product.getName());
        console.println("(Press Enter to keep current value)");
        String name = emptyToNull(read("Name [" + product.getName() + "]: "));
        String priceText = emptyToNull(read("Price [$" + product.getPrice() + "]: "));
        String quantityText = emptyToNull(read("Quantity [" + product.getQuantity() + "]: "));
        String category = emptyToNull(read("Category [" + (product.getCategory() != null ? product.getCategory() : "None") + "]: "));

        BigDecimal price;
        Integer quantity;
        try {
            price = priceText != null ? new BigDecimal(priceText) : null;
            quantity = quantityText != null ? Integer.valueOf(quantityText) : null;
        } catch (NumberFormatException e) {
            console.println("Invalid input. Price must be a number and quantity must be an integer.");
            return;
        }

        ProductUpdateResult result = productService.update(id, new ProductUpdate(name, price, quantity, category));
        console.println("\nProduct #" + id + " updated successfully.");
        if (result.quantityChanged()) {
            audited(auditLogMirror.recordInventoryChange(List.of(new InventoryChange(
                    result.product().getName(), result.previousQuantity(), result.product().getQuantity()))));
        }
    }

    private void viewCustomers() {
        List<Customer> customers = customerService.findAll();
        if (customers.isEmpty()) {
            console.println("\nNo customers found.");
            return;
        }
        List<List<?>> rows = new ArrayList<>();
        for (Customer c : customers) {
            rows.add(List.of(c.getId(), c.getName(), valueOrEmpty(c.getEmail()), valueOrEmpty(c.getPhone()),
                    valueOrEmpty(c.getCreatedAt())));
        }
        console.println("\n" + TableRenderer.render(CUSTOMER_HEADERS, rows));
    }

    private void addCustomer() {
        console.println("\n=== Add New Customer ===");
        String name = read("Enter customer name: ").strip();
        if (name.isEmpty()) {
            console.println("Customer name cannot be empty.");
            return;
        }
        String email = emptyToNull(read("Enter email (optional): "));
        String phone = emptyToNull(read("Enter phone (optional): "));

        Customer customer = customerService.add(name, email, phone);
        console.println("\nCustomer '" + customer.getName() + "' added successfully.");
    }

    private void makePurchase() {
        viewCustomers();
        Long customerId = readId("\nEnter customer ID (0 for anonymous): ");
        if (customerId == null) {
            return;
        }
        if (customerId == 0) {
            customerId = null;
        } else if (customerService.findById(customerId).isEmpty()) {
            console.println("No customer found with ID " + customerId + ".");
            return;
        }

        viewProducts();
        List<LineItem> items = new ArrayList<>();
        Map<Long, Integer> inCart = new HashMap<>();

        console.println("\n=== Add Products to Purchase ===");
        console.println("(Enter 0 for product ID to finish)");
        while (true) {
            long productId;
            int quantity;
            try {
                productId = Long.parseLong(read("\nEnter product ID: ").strip());
                if (productId == 0) {
                    break;
                }
                Optional<Product> found = productService.findById(productId);
                if (found.isEmpty()) {
                    console.println("No product found with ID " + productId + ".");
                    continue;
                }
                Product product = found.get();
                int available = product.getQuantity() - inCart.getOrDefault(productId, 0);
                quantity = Integer.parseInt(read("Enter quantity for " + product.getName()
                        + " (available: " + available + "): ").strip());
                if (quantity <= 0) {
                    console.println("Quantity must be positive.");
                    continue;
                }
                if (quantity > available) {
                    console.println("Error: Only " + available + " units available.");
                    continue;
                }
                items.add(new LineItem(productId, quantity));
                inCart.merge(productId, quantity, Integer::sum);
                console.println("Added " + quantity + " x " + product.getName() + " to cart.");
            } catch (NumberFormatException e) {
                console.println("Invalid input. ID and quantity must be integers.");
            }
        }

        if (items.isEmpty()) {
            console.println("Purchase cancelled - no items selected.");
            return;
        }

        PurchaseReceipt receipt = purchaseService.create(customerId, items);
        console.println("\nPurchase completed successfully! Purchase ID: " + receipt.purchaseId()
                + " (total $" + receipt.totalAmount() + ")");
        audited(auditLogMirror.recordPurchase(receipt.customerName(), receipt.lines()));
    }

    private void viewPurchaseHistory() {
        List<PurchaseSummaryRow> purchases = purchaseService.findRecent(properties.getHistory().getLimit());
        if (purchases.isEmpty()) {
            console.println("\nNo purchase history found.");
            return;
        }
        List<List<?>> rows = new ArrayList<>();
        for (PurchaseSummaryRow p : purchases) {
            rows.add(List.of(p.purchaseId(), valueOrEmpty(p.customerId()), p.totalAmount(),
                    valueOrEmpty(p.purchaseDate()), p.customerName() != null ? p.customerName() : PurchaseService.ANONYMOUS));
        }
        console.println("\n" + TableRenderer.render(PURCHASE_HEADERS, rows));

        Long purchaseId = readId("\nEnter purchase ID to view details (0 to cancel): ");
        if (purchaseId == null || purchaseId == 0) {
            return;
        }
        List<PurchaseItemRow> items = purchaseService.findItems(purchaseId);
        if (items.isEmpty()) {
            console.println("No items found for purchase #" + purchaseId + ".");
            return;
        }
        List<List<?>> itemRows = new ArrayList<>();
        for (PurchaseItemRow item : items) {
            itemRows.add(List.of(item.itemId(), item.productId(), item.quantity(), item.pricePerUnit(),
                    item.productName()));
        }
        console.println("\n" + TableRenderer.render(ITEM_HEADERS, itemRows));
    }

    private void viewAuditHistory() {
        List<String> history = auditLogMirror.listEntries(AuditLogMirror.PURCHASE_TAG,
                properties.getAudit().getHistoryLimit());
        if (history.isEmpty()) {
            console.println("\nNo audit purchase history found.");
            return;
        }
        for (int i = 0; i < history.size(); i++) {
            console.println("\n" + (i + 1) + ". " + history.get(i));
        }
    }

    private void addSampleData() {
        console.println("\nAdding sample data for demonstration...");
        for (String name : sampleDataLoader.load()) {
            console.println("Added: " + name);
        }
        audited(auditLogMirror.recordInventoryChange(List.of(new InventoryChange("Sample Data", 0, 1))));
        console.println("\nSample data added successfully!");
    }

    private void audited(boolean recorded) {
        if (!recorded) {
            console.println("(Audit entry could not be recorded, see the log for details.)");
        }
    }

    private Long readId(String label) {
        try {
            return Long.valueOf(read(label).strip());
        } catch (NumberFormatException e) {
            console.println("Invalid input. ID must be an integer.");
            return null;
        }
    }

    private String read(String label) {
        String line = console.prompt(label);
        if (line == null) {
            throw new EndOfInput();
        }
        return line;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static Object valueOrEmpty(Object value) {
        return value != null ? value : "";
    }

    private static final class EndOfInput extends RuntimeException {
        EndOfInput() {
            super("console input closed", null, false, false);
        }
    }
}
