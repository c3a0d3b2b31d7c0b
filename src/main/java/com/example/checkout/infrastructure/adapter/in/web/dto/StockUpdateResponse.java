package com.example.checkout.infrastructure.adapter.in.web.dto;

import java.util.UUID;

public record StockUpdateResponse(
        String unitType,
        UUID unitId,
        int oldQuantity,
        int newQuantity
) {
}
