package com.stockledger.shell;

import com.stockledger.audit.AuditLogMirror;
import com.stockledger.config.InventoryProperties;
import com.stockledger.model.Customer;
import com.stockledger.model.Product;
import com.stockledger.service.CustomerService;
import com.stockledger.service.ProductService;
import com.stockledger.service.PurchaseService;
import com.stockledger.service.SampleDataLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

@SpringBootTest
@Transactional
public class InventoryShellTest {

    @Autowired
    private ProductService productService;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private PurchaseService purchaseService;

    @Autowired
    private SampleDataLoader sampleDataLoader;

    @TempDir
    Path auditDir;

    private AuditLogMirror mirror;
    private InventoryProperties properties;
    private ByteArrayOutputStream output;

    @BeforeEach
    public void setUp() {
        mirror = new AuditLogMirror("Tester", "tester@example.com", "audit-journal.log", Clock.systemDefaultZone());
        Assertions.assertTrue(mirror.ensureRepository(auditDir));
        properties = new InventoryProperties();
        properties.getSampleData().setPrompt(false);
        output = new ByteArrayOutputStream();
    }

    @AfterEach
    public void tearDown() {
        mirror.close();
    }

    private String run(String script) {
        ShellConsole console = new ShellConsole(new ByteArrayInputStream(script.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8), false);
        new InventoryShell(productService, customerService, purchaseService, sampleDataLoader, mirror,
                properties, console).start();
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testPurchaseThroughMenuUpdatesStockAndAuditLog() {
        Product mouse = productService.add("Mouse", new BigDecimal("24.99"), 50, "Accessories");
        Customer customer = customerService.add("Jane Doe", "jane.doe@example.com", null);

        String out = run("6\n" + customer.getId() + "\n" + mouse.getId() + "\n3\n0\n\n9\n");

        Assertions.assertTrue(out.contains("Purchase completed successfully!"));
        Assertions.assertTrue(out.contains("total $74.97"));
        Assertions.assertEquals(47, productService.findById(mouse.getId()).orElseThrow().getQuantity());

        List<String> entries = mirror.listEntries(AuditLogMirror.PURCHASE_TAG, 10);
        Assertions.assertEquals(1, entries.size());
        Assertions.assertTrue(entries.get(0).startsWith("Purchase: Jane Doe - "));
        Assertions.assertTrue(entries.get(0).contains("* Mouse x3 @ $24.99"));
        Assertions.assertTrue(out.endsWith("Exiting Inventory Management System. Goodbye!" + System.lineSeparator()));
    }

    @Test
    public void testOversizedQuantityIsRefusedAndPurchaseCancelled() {
        Product widget = productService.add("Widget", new BigDecimal("2.50"), 5, null);

        String out = run("6\n0\n" + widget.getId() + "\n6\n0\n\n9\n");

        Assertions.assertTrue(out.contains("Error: Only 5 units available."));
        Assertions.assertTrue(out.contains("Purchase cancelled - no items selected."));
        Assertions.assertEquals(5, productService.findById(widget.getId()).orElseThrow().getQuantity());
        Assertions.assertTrue(mirror.listEntries(AuditLogMirror.PURCHASE_TAG, 10).isEmpty());
    }

    @Test
    public void testAddProductRecordsInventoryEntry() {
        String out = run("2\nKeyboard Pro\n49.99\n40\nAccessories\n\n9\n");

        Assertions.assertTrue(out.contains("Product 'Keyboard Pro' added successfully."));
        Product added = productService.findByName("Keyboard Pro").orElseThrow();
        Assertions.assertEquals(40, added.getQuantity());
        Assertions.assertEquals("Accessories", added.getCategory());

        List<String> entries = mirror.listEntries(AuditLogMirror.INVENTORY_TAG, 10);
        Assertions.assertEquals(1, entries.size());
        Assertions.assertTrue(entries.get(0).contains("* Keyboard Pro: 0 -> 40"));
    }

    @Test
    public void testUpdateKeepsBlankFieldsAndAuditsQuantityChange() {
        Product mouse = productService.add("Mouse", new BigDecimal("24.99"), 50, "Accessories");

        run("3\n" + mouse.getId() + "\n\n\n60\n\n\n9\n");

        Product updated = productService.findById(mouse.getId()).orElseThrow();
        Assertions.assertEquals("Mouse", updated.getName());
        Assertions.assertEquals(0, new BigDecimal("24.99").compareTo(updated.getPrice()));
        Assertions.assertEquals(60, updated.getQuantity());
        Assertions.assertTrue(mirror.listEntries(AuditLogMirror.INVENTORY_TAG, 10).get(0)
                .contains("* Mouse: 50 -> 60"));
    }

    @Test
    public void testDuplicateCustomerEmailIsReportedAndMenuContinues() {
        customerService.add("Ann", "ann@example.com", null);

        String out = run("5\nAnn Again\nann@example.com\n\n\n9\n");

        Assertions.assertTrue(out.contains("A customer with email 'ann@example.com' already exists."));
        Assertions.assertTrue(out.contains("Goodbye!"));
    }

    @Test
    public void testInvalidChoiceAndClosedInput() {
        String out = run("42\n\n");

        Assertions.assertTrue(out.contains("Invalid choice. Please try again."));
        Assertions.assertTrue(out.contains("Exiting Inventory Management System. Goodbye!"));
    }

    @Test
    public void testAuditHistoryWithoutPurchases() {
        String out = run("8\n\n9\n");

        Assertions.assertTrue(out.contains("No audit purchase history found."));
    }
}
