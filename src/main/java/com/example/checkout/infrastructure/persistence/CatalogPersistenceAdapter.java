package com.example.checkout.infrastructure.persistence;

import com.example.checkout.application.port.out.CatalogPort;
import com.example.checkout.domain.model.Money;
import com.example.checkout.infrastructure.persistence.entity.ProductEntity;
import com.example.checkout.infrastructure.persistence.entity.ProductStatus;
import com.example.checkout.infrastructure.persistence.entity.ProductVariantEntity;
import com.example.checkout.infrastructure.persistence.repository.ProductJpaRepository;
import com.example.checkout.infrastructure.persistence.repository.ProductVariantJpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Reads product and variant rows for pricing. A variant without its own price falls back to the product price.
 */
@Component
public class CatalogPersistenceAdapter implements CatalogPort {

    private final ProductJpaRepository productRepository;
    private final ProductVariantJpaRepository variantRepository;

    public CatalogPersistenceAdapter(ProductJpaRepository productRepository,
                                     ProductVariantJpaRepository variantRepository) {
        this.productRepository = productRepository;
        this.variantRepository = variantRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CatalogEntry> find(UUID productId, UUID variantId) {
        Optional<ProductEntity> product = productRepository.findById(productId);
        if (product.isEmpty()) {
            return Optional.empty();
        }
        if (variantId == null) {
            return product.map(this::toEntry);
        }
        return variantRepository.findById(variantId)
                .filter(variant -> variant.getProductId().equals(productId))
                .map(variant -> toEntry(product.get(), variant));
    }

    private CatalogEntry toEntry(ProductEntity product) {
        return new CatalogEntry(product.getId(), null, product.getName(), null, product.getSku(),
                Money.of(product.getPrice(), product.getCurrency()),
                product.getStatus() == ProductStatus.ACTIVE);
    }

    private CatalogEntry toEntry(ProductEntity product, ProductVariantEntity variant) {
        Money price = Money.of(variant.getPrice() != null ? variant.getPrice() : product.getPrice(),
                product.getCurrency());
        return new CatalogEntry(product.getId(), variant.getId(), product.getName(), variant.getName(),
                variant.getSku(), price,
                product.getStatus() == ProductStatus.ACTIVE && variant.isActive());
    }
}
