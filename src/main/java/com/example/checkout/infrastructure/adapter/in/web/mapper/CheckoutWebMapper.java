package com.example.checkout.infrastructure.adapter.in.web.mapper;

import com.example.checkout.application.dto.CheckoutReceipt;
import com.example.checkout.application.dto.SubmitCheckoutCommand;
import com.example.checkout.application.port.out.StockLedgerPort.StockChange;
import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.StockUnitRef;
import com.example.checkout.domain.model.StockUnitType;
import com.example.checkout.infrastructure.adapter.in.web.dto.AddressRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse;
import com.example.checkout.infrastructure.adapter.in.web.dto.StockUpdateResponse;
import com.example.checkout.infrastructure.adapter.in.web.dto.SubmitCheckoutRequest;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Mapper between web DTOs and application DTOs.
 */
@Component
public class CheckoutWebMapper {

    public SubmitCheckoutCommand toCommand(UUID userId, String idempotencyKey, SubmitCheckoutRequest request) {
        return new SubmitCheckoutCommand(
                userId,
                idempotencyKey,
                toAddress(request.shippingAddress()),
                request.billingAddress() != null ? toAddress(request.billingAddress()) : null,
                request.notes());
    }

    public CheckoutResponse toResponse(CheckoutReceipt receipt) {
        return new CheckoutResponse(
                receipt.checkoutId(),
                receipt.status(),
                receipt.orderId(),
                receipt.failureReason(),
                receipt.createdAt(),
                receipt.updatedAt());
    }

    public StockUnitRef toStockUnit(String unitType, UUID unitId) {
        StockUnitType type;
        try {
            type = StockUnitType.valueOf(unitType.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown stock unit type: " + unitType);
        }
        return new StockUnitRef(type, unitId);
    }

    public StockUpdateResponse toResponse(StockChange change) {
        return new StockUpdateResponse(
                change.unit().type().name().toLowerCase(Locale.ROOT),
                change.unit().id(),
                change.oldQuantity(),
                change.newQuantity());
    }

    private Address toAddress(AddressRequest request) {
        return new Address(
                request.firstName(),
                request.lastName(),
                request.line1(),
                request.line2(),
                request.city(),
                request.state(),
                request.postalCode(),
                request.country(),
                request.phone());
    }
}
