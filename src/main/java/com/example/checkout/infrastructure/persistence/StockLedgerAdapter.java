package com.example.checkout.infrastructure.persistence;

import com.example.checkout.application.port.out.StockLedgerPort;
import com.example.checkout.domain.exception.InsufficientStockException;
import com.example.checkout.domain.exception.ValidationException;
import com.example.checkout.domain.model.StockUnitRef;
import com.example.checkout.infrastructure.persistence.entity.ProductEntity;
import com.example.checkout.infrastructure.persistence.entity.ProductVariantEntity;
import com.example.checkout.infrastructure.persistence.repository.ProductJpaRepository;
import com.example.checkout.infrastructure.persistence.repository.ProductVariantJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.IntUnaryOperator;

/**
 * Stock ledger over the product and variant rows.
 * <p>
 * Every mutation reads the row under {@code PESSIMISTIC_WRITE} and writes it back in the
 * caller's transaction, so the lock is released on commit or rollback. Products with inventory
 * tracking turned off are never decremented; variants always track their own stock.
 */
@Component
public class StockLedgerAdapter implements StockLedgerPort {

    private static final Logger log = LoggerFactory.getLogger(StockLedgerAdapter.class);

    private final ProductJpaRepository productRepository;
    private final ProductVariantJpaRepository variantRepository;

    public StockLedgerAdapter(ProductJpaRepository productRepository,
                              ProductVariantJpaRepository variantRepository) {
        this.productRepository = productRepository;
        this.variantRepository = variantRepository;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public StockChange reduce(StockUnitRef unit, int quantity) {
        requirePositive(quantity);
        return mutate(unit, current -> {
            if (quantity > current) {
                throw new InsufficientStockException(unit, quantity, current);
            }
            return current - quantity;
        }, true);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public StockChange increase(StockUnitRef unit, int quantity) {
        requirePositive(quantity);
        return mutate(unit, current -> current + quantity, true);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public StockChange set(StockUnitRef unit, int quantity) {
        if (quantity < 0) {
            throw new ValidationException("Stock quantity cannot be negative: " + quantity);
        }
        return mutate(unit, current -> quantity, false);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isInStock(StockUnitRef unit) {
        return !tracksInventory(unit) || currentQuantity(unit) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public int available(StockUnitRef unit) {
        return tracksInventory(unit) ? currentQuantity(unit) : Integer.MAX_VALUE;
    }

    private StockChange mutate(StockUnitRef unit, IntUnaryOperator operation, boolean onlyWhenTracked) {
        switch (unit.type()) {
            case PRODUCT -> {
                ProductEntity product = productRepository.findByIdForUpdate(unit.id())
                        .orElseThrow(() -> unknownUnit(unit));
                int oldQuantity = product.getStockQuantity();
                if (onlyWhenTracked && !product.isTrackInventory()) {
                    return new StockChange(unit, oldQuantity, oldQuantity);
                }
                product.setStockQuantity(operation.applyAsInt(oldQuantity));
                productRepository.save(product);
                return logged(new StockChange(unit, oldQuantity, product.getStockQuantity()));
            }
            case VARIANT -> {
                ProductVariantEntity variant = variantRepository.findByIdForUpdate(unit.id())
                        .orElseThrow(() -> unknownUnit(unit));
                int oldQuantity = variant.getStockQuantity();
                variant.setStockQuantity(operation.applyAsInt(oldQuantity));
                variantRepository.save(variant);
                return logged(new StockChange(unit, oldQuantity, variant.getStockQuantity()));
            }
            default -> throw new IllegalArgumentException("Unsupported stock unit type: " + unit.type());
        }
    }

    private boolean tracksInventory(StockUnitRef unit) {
        return switch (unit.type()) {
            case PRODUCT -> productRepository.findById(unit.id())
                    .map(ProductEntity::isTrackInventory)
                    .orElseThrow(() -> unknownUnit(unit));
            case VARIANT -> {
                if (!variantRepository.existsById(unit.id())) {
                    throw unknownUnit(unit);
                }
                yield true;
            }
        };
    }

    private int currentQuantity(StockUnitRef unit) {
        return switch (unit.type()) {
            case PRODUCT -> productRepository.findById(unit.id())
                    .map(ProductEntity::getStockQuantity)
                    .orElseThrow(() -> unknownUnit(unit));
            case VARIANT -> variantRepository.findById(unit.id())
                    .map(ProductVariantEntity::getStockQuantity)
                    .orElseThrow(() -> unknownUnit(unit));
        };
    }

    private static StockChange logged(StockChange change) {
        log.debug("Stock {} {} -> {}", change.unit(), change.oldQuantity(), change.newQuantity());
        return change;
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
    }

    private static ValidationException unknownUnit(StockUnitRef unit) {
        return new ValidationException("Unknown stock unit: " + unit);
    }
}
