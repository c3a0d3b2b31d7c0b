package com.example.checkout.application.service;

import com.example.checkout.application.port.in.AdjustStockUseCase;
import com.example.checkout.application.port.out.AuditPort;
import com.example.checkout.application.port.out.AuditPort.AuditEntry;
import com.example.checkout.application.port.out.StockLedgerPort;
import com.example.checkout.application.port.out.StockLedgerPort.StockChange;
import com.example.checkout.domain.exception.ValidationException;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.StockUnitRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * Direct stock edits from the back office. Always audited.
 */
@Service
public class StockAdminService implements AdjustStockUseCase {

    private static final Logger log = LoggerFactory.getLogger(StockAdminService.class);

    private final StockLedgerPort stockLedger;
    private final AuditPort auditPort;

    public StockAdminService(StockLedgerPort stockLedger, AuditPort auditPort) {
        this.stockLedger = stockLedger;
        this.auditPort = auditPort;
    }

    @Override
    @Transactional
    public StockChange setStock(StockUnitRef unit, int quantity, Actor actor) {
        if (quantity < 0) {
            throw new ValidationException("Stock quantity cannot be negative: " + quantity);
        }
        StockChange change = stockLedger.set(unit, quantity);
        auditPort.record(AuditEntry.stockChange(change, actor, "admin_adjustment", Map.of()));
        log.info("Stock for {} set {} -> {} by {}", unit, change.oldQuantity(), change.newQuantity(), actor);
        return change;
    }
}
