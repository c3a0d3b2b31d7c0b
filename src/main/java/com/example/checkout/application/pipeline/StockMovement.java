package com.example.checkout.application.pipeline;

import com.example.checkout.domain.model.StockUnitType;

import java.util.UUID;

public record StockMovement(StockUnitType unitType, UUID unitId, int oldQuantity, int newQuantity) {
}
