package com.stockledger.repository;

import com.stockledger.model.PurchaseItem;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PurchaseItemRepository extends JpaRepository<PurchaseItem, Long> {
    long countByProductId(Long productId);
}
