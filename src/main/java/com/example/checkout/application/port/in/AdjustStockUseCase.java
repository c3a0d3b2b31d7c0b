package com.example.checkout.application.port.in;

import com.example.checkout.application.port.out.StockLedgerPort.StockChange;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.StockUnitRef;

public interface AdjustStockUseCase {

    /**
     * Sets a unit's stock to an absolute quantity and records an audit entry.
     */
    StockChange setStock(StockUnitRef unit, int quantity, Actor actor);
}
