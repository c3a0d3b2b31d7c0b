package com.example.checkout.application.pipeline.stage;

import com.example.checkout.application.pipeline.CheckoutRequest;
import com.example.checkout.application.pipeline.CheckoutStage;
import com.example.checkout.application.pipeline.CheckoutStep;
import com.example.checkout.application.pipeline.ValidatedCheckout;
import com.example.checkout.application.pipeline.ValidatedLine;
import com.example.checkout.application.port.out.CatalogPort;
import com.example.checkout.application.port.out.CatalogPort.CatalogEntry;
import com.example.checkout.application.port.out.StockLedgerPort;
import com.example.checkout.domain.exception.ValidationException;
import com.example.checkout.domain.model.CartLine;
import com.example.checkout.domain.model.StockUnitRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-checks every snapshot line against live catalog and stock data.
 * Fails on the first violation; the result is advisory and reserves nothing.
 */
@Component
public class ValidateInventoryStage implements CheckoutStage<CheckoutRequest, ValidatedCheckout> {

    private static final Logger log = LoggerFactory.getLogger(ValidateInventoryStage.class);

    private final CatalogPort catalog;
    private final StockLedgerPort stockLedger;
    private final Clock clock;

    public ValidateInventoryStage(CatalogPort catalog, StockLedgerPort stockLedger, Clock clock) {
        this.catalog = catalog;
        this.stockLedger = stockLedger;
        this.clock = clock;
    }

    @Override
    public CheckoutStep step() {
        return CheckoutStep.VALIDATE_INVENTORY;
    }

    @Override
    public Class<CheckoutRequest> inputType() {
        return CheckoutRequest.class;
    }

    @Override
    @Transactional(readOnly = true)
    public ValidatedCheckout execute(CheckoutRequest request) {
        if (request.lines().isEmpty()) {
            throw new ValidationException("Cart is empty");
        }

        List<ValidatedLine> validated = new ArrayList<>(request.lines().size());
        for (CartLine line : request.lines()) {
            CatalogEntry entry = catalog.find(line.productId(), line.variantId())
                    .orElseThrow(() -> new ValidationException("Product " + line.productId() + " no longer exists"));
            if (!entry.purchasable()) {
                throw new ValidationException(entry.displayName() + " is not available for purchase");
            }

            StockUnitRef unit = line.stockUnit();
            if (!stockLedger.isInStock(unit)) {
                throw new ValidationException(entry.displayName() + " is out of stock");
            }
            int available = stockLedger.available(unit);
            if (line.quantity() > available) {
                throw new ValidationException(String.format("Only %d unit(s) of %s available, %d requested",
                        available, entry.displayName(), line.quantity()));
            }

            validated.add(new ValidatedLine(unit.type(), unit.id(), line.productId(), line.variantId(),
                    line.quantity(), available));
        }

        log.info("Checkout {} validated: {} line(s)", request.checkoutId(), validated.size());
        return new ValidatedCheckout(request, validated, clock.instant());
    }
}
