package com.stockledger.dto;

import com.stockledger.model.Product;

public record ProductUpdateResult(Product product, int previousQuantity) {

    public boolean quantityChanged() {
        return product.getQuantity() != previousQuantity;
    }
}
