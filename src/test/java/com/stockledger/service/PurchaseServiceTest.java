package com.stockledger.service;

import com.stockledger.dto.LineItem;
import com.stockledger.dto.PurchaseLine;
import com.stockledger.dto.PurchaseReceipt;
import com.stockledger.exception.InsufficientStockException;
import com.stockledger.exception.ResourceNotFoundException;
import com.stockledger.exception.ValidationException;
import com.stockledger.model.Customer;
import com.stockledger.model.Product;
import com.stockledger.model.Purchase;
import com.stockledger.persistence.StoreDatabase;
import com.stockledger.repository.CustomerRepository;
import com.stockledger.repository.ProductRepository;
import com.stockledger.repository.PurchaseRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PurchaseServiceTest {

    @Mock
    private PurchaseRepository purchaseRepository;
    @Mock
    private ProductRepository productRepository;
    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private ProductService productService;
    @Mock
    private StoreDatabase storeDatabase;

    @InjectMocks
    private PurchaseService purchaseService;

    private Customer customer;
    private Product mouse;
    private Product keyboard;

    @BeforeEach
    void setUp() {
        customer = new Customer();
        customer.setId(1L);
        customer.setName("Jane Doe");

        mouse = new Product();
        mouse.setId(10L);
        mouse.setName("Mouse");
        mouse.setPrice(new BigDecimal("24.99"));
        mouse.setQuantity(50);

        keyboard = new Product();
        keyboard.setId(11L);
        keyboard.setName("Keyboard");
        keyboard.setPrice(new BigDecimal("49.99"));
        keyboard.setQuantity(2);
    }

    private void stubSave() {
        when(purchaseRepository.saveAndFlush(any(Purchase.class))).thenAnswer(i -> {
            Purchase p = i.getArgument(0);
            p.setId(100L);
            return p;
        });
    }

    @Test
    void create_ShouldTotalLinesAndDecrementStock() {
        when(customerRepository.findById(1L)).thenReturn(Optional.of(customer));
        when(productRepository.findById(10L)).thenReturn(Optional.of(mouse));
        when(productRepository.findById(11L)).thenReturn(Optional.of(keyboard));
        stubSave();

        PurchaseReceipt receipt = purchaseService.create(1L,
                List.of(new LineItem(10L, 3), new LineItem(11L, 2)));

        assertEquals(100L, receipt.purchaseId());
        assertEquals("Jane Doe", receipt.customerName());
        // 3 x 24.99 + 2 x 49.99
        assertEquals(new BigDecimal("174.95"), receipt.totalAmount());
        assertEquals(List.of(new PurchaseLine("Mouse", 3, new BigDecimal("24.99")),
                new PurchaseLine("Keyboard", 2, new BigDecimal("49.99"))), receipt.lines());

        ArgumentCaptor<Purchase> saved = ArgumentCaptor.forClass(Purchase.class);
        verify(purchaseRepository).saveAndFlush(saved.capture());
        Purchase purchase = saved.getValue();
        assertEquals(customer, purchase.getCustomer());
        assertEquals(2, purchase.getItems().size());
        assertSame(purchase, purchase.getItems().get(0).getPurchase());
        assertEquals(new BigDecimal("24.99"), purchase.getItems().get(0).getPricePerUnit());

        verify(productService).adjustQuantity(10L, -3);
        verify(productService).adjustQuantity(11L, -2);
    }

    @Test
    void create_ShouldAllowAnonymousPurchase() {
        when(productRepository.findById(10L)).thenReturn(Optional.of(mouse));
        stubSave();

        PurchaseReceipt receipt = purchaseService.create(null, List.of(new LineItem(10L, 1)));

        assertEquals(PurchaseService.ANONYMOUS, receipt.customerName());
        verifyNoInteractions(customerRepository);
    }

    @Test
    void create_ShouldFailWholePurchase_WhenStockInsufficient() {
        when(productRepository.findById(10L)).thenReturn(Optional.of(mouse));
        when(productRepository.findById(11L)).thenReturn(Optional.of(keyboard));

        Exception exception = assertThrows(InsufficientStockException.class,
                () -> purchaseService.create(null, List.of(new LineItem(10L, 1), new LineItem(11L, 3))));

        assertTrue(exception.getMessage().contains("Keyboard"));
        verify(purchaseRepository, never()).saveAndFlush(any());
        verify(productService, never()).adjustQuantity(anyLong(), anyInt());
    }

    @Test
    void create_ShouldCountRepeatedLinesAgainstStock() {
        when(productRepository.findById(11L)).thenReturn(Optional.of(keyboard));

        assertThrows(InsufficientStockException.class,
                () -> purchaseService.create(null, List.of(new LineItem(11L, 1), new LineItem(11L, 2))));
        verify(purchaseRepository, never()).saveAndFlush(any());
    }

    @Test
    void create_ShouldFail_WhenProductMissing() {
        when(productRepository.findById(404L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> purchaseService.create(null, List.of(new LineItem(404L, 1))));
        verify(purchaseRepository, never()).saveAndFlush(any());
    }

    @Test
    void create_ShouldFail_WhenCustomerMissing() {
        when(customerRepository.findById(5L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class,
                () -> purchaseService.create(5L, List.of(new LineItem(10L, 1))));
        verifyNoInteractions(productRepository);
    }

    @Test
    void create_ShouldRejectEmptyOrNonPositiveItems() {
        assertThrows(ValidationException.class, () -> purchaseService.create(null, List.of()));
        assertThrows(ValidationException.class,
                () -> purchaseService.create(null, List.of(new LineItem(10L, 0))));
        verifyNoInteractions(purchaseRepository);
    }
}
