package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.StatusChange;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound port for the audit trail. Side-effecting observer; it writes in the caller's transaction.
 */
public interface AuditPort {

    void record(AuditEntry entry);

    enum AuditAction {
        CREATE("create"),
        UPDATE("update"),
        STOCK_CHANGE("stock_change"),
        STATUS_CHANGE("status_change");

        private final String wireValue;

        AuditAction(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }

    record AuditEntry(
            String modelName,
            String objectId,
            AuditAction action,
            String field,
            String oldValue,
            String newValue,
            String actorId,
            Map<String, Object> metadata
    ) {
        public AuditEntry {
            metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        }

        public static AuditEntry created(String modelName, String objectId, Actor actor, Map<String, Object> metadata) {
            return new AuditEntry(modelName, objectId, AuditAction.CREATE, null, null, null,
                    actor.auditId(), metadata);
        }

        public static AuditEntry statusChange(String objectId, StatusChange change) {
            return new AuditEntry("Order", objectId, AuditAction.STATUS_CHANGE, change.field().column(),
                    change.from(), change.to(), change.changedBy(), Map.of());
        }

        public static AuditEntry stockChange(StockLedgerPort.StockChange change, Actor actor,
                                             String reason, Map<String, Object> extra) {
            Map<String, Object> metadata = new LinkedHashMap<>(extra);
            metadata.put("reason", reason);
            metadata.put("quantity_delta", change.delta());
            String modelName = switch (change.unit().type()) {
                case PRODUCT -> "Product";
                case VARIANT -> "ProductVariant";
            };
            return new AuditEntry(modelName, change.unit().id().toString(), AuditAction.STOCK_CHANGE,
                    "stock_quantity", String.valueOf(change.oldQuantity()), String.valueOf(change.newQuantity()),
                    actor.auditId(), metadata);
        }
    }
}
