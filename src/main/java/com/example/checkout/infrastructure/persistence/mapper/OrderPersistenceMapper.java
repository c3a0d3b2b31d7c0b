package com.example.checkout.infrastructure.persistence.mapper;

import com.example.checkout.domain.model.*;
import com.example.checkout.infrastructure.persistence.entity.AddressEmbeddable;
import com.example.checkout.infrastructure.persistence.entity.OrderEntity;
import com.example.checkout.infrastructure.persistence.entity.OrderEventEntity;
import com.example.checkout.infrastructure.persistence.entity.OrderItemEntity;
import com.example.checkout.infrastructure.persistence.entity.OrderStatusHistoryEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Mapper between domain Order and persistence OrderEntity.
 */
@Component
public class OrderPersistenceMapper {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public OrderPersistenceMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Builds the entity for a new order, items included. History and events are appended separately.
     */
    public OrderEntity toNewEntity(Order order) {
        OrderEntity entity = new OrderEntity();
        entity.setId(order.getId().getValue());
        entity.setOrderNumber(order.getOrderNumber().getValue());
        entity.setUserId(order.getUserId());
        entity.setCheckoutId(order.getCheckoutId());
        entity.setSubtotal(order.getSubtotal().getAmount());
        entity.setTaxAmount(order.getTax().getAmount());
        entity.setShippingAmount(order.getShippingCost().getAmount());
        entity.setDiscountAmount(order.getDiscount().getAmount());
        entity.setTotalAmount(order.getTotal().getAmount());
        entity.setCurrency(order.getTotal().getCurrency());
        entity.setShippingAddress(toEmbeddable(order.getShippingAddress()));
        entity.setBillingAddress(toEmbeddable(order.getBillingAddress()));
        entity.setNotes(order.getNotes());
        entity.setCreatedAt(order.getCreatedAt());

        for (OrderItem item : order.getItems()) {
            OrderItemEntity itemEntity = new OrderItemEntity();
            itemEntity.setProductId(item.getProductId());
            itemEntity.setVariantId(item.getVariantId());
            itemEntity.setProductName(item.getProductName());
            itemEntity.setVariantName(item.getVariantName());
            itemEntity.setSku(item.getSku());
            itemEntity.setQuantity(item.getQuantity());
            itemEntity.setUnitPrice(item.getUnitPrice().getAmount());
            itemEntity.setTotalPrice(item.getTotalPrice().getAmount());
            entity.addItem(itemEntity);
        }
        return entity;
    }

    /**
     * Copies the mutable part of the aggregate onto the entity.
     */
    public void copyState(Order order, OrderEntity entity) {
        entity.setStatus(order.getStatus());
        entity.setPaymentStatus(order.getPaymentStatus());
        entity.setTrackingNumber(order.getTrackingNumber());
        entity.setShippedAt(order.getShippedAt());
        entity.setDeliveredAt(order.getDeliveredAt());
    }

    public OrderStatusHistoryEntity toEntity(StatusChange change) {
        OrderStatusHistoryEntity entity = new OrderStatusHistoryEntity();
        entity.setField(change.field().name());
        entity.setFromStatus(change.from());
        entity.setToStatus(change.to());
        entity.setNotes(change.notes());
        entity.setChangedBy(change.changedBy());
        entity.setCreatedAt(change.changedAt());
        return entity;
    }

    public OrderEventEntity toEntity(OrderEvent event) {
        OrderEventEntity entity = new OrderEventEntity();
        entity.setEventType(event.type().name());
        entity.setMessage(event.message());
        entity.setMetadata(writeMetadata(event.metadata()));
        entity.setCreatedAt(event.createdAt());
        return entity;
    }

    public Order toDomain(OrderEntity entity) {
        String currency = entity.getCurrency();
        List<OrderItem> items = entity.getItems().stream()
                .map(item -> OrderItem.reconstitute(
                        item.getProductId(),
                        item.getVariantId(),
                        item.getProductName(),
                        item.getVariantName(),
                        item.getSku(),
                        item.getQuantity(),
                        Money.of(item.getUnitPrice(), currency),
                        Money.of(item.getTotalPrice(), currency)))
                .toList();

        List<StatusChange> history = entity.getStatusHistory().stream()
                .map(h -> new StatusChange(StatusField.valueOf(h.getField()), h.getFromStatus(), h.getToStatus(),
                        h.getNotes(), h.getChangedBy(), h.getCreatedAt()))
                .toList();

        List<OrderEvent> events = entity.getEvents().stream()
                .map(e -> new OrderEvent(OrderEventType.valueOf(e.getEventType()), e.getMessage(),
                        readMetadata(e.getMetadata()), e.getCreatedAt()))
                .toList();

        return Order.reconstitute()
                .id(OrderId.of(entity.getId()))
                .orderNumber(OrderNumber.of(entity.getOrderNumber()))
                .userId(entity.getUserId())
                .checkoutId(entity.getCheckoutId())
                .items(items)
                .amounts(
                        Money.of(entity.getSubtotal(), currency),
                        Money.of(entity.getTaxAmount(), currency),
                        Money.of(entity.getShippingAmount(), currency),
                        Money.of(entity.getDiscountAmount(), currency),
                        Money.of(entity.getTotalAmount(), currency))
                .shippingAddress(toDomain(entity.getShippingAddress()))
                .billingAddress(toDomain(entity.getBillingAddress()))
                .notes(entity.getNotes())
                .createdAt(entity.getCreatedAt())
                .status(entity.getStatus())
                .paymentStatus(entity.getPaymentStatus())
                .tracking(entity.getTrackingNumber(), entity.getShippedAt(), entity.getDeliveredAt())
                .version(entity.getVersion())
                .statusHistory(history)
                .events(events)
                .build();
    }

    private AddressEmbeddable toEmbeddable(Address address) {
        AddressEmbeddable embeddable = new AddressEmbeddable();
        embeddable.setFirstName(address.firstName());
        embeddable.setLastName(address.lastName());
        embeddable.setLine1(address.line1());
        embeddable.setLine2(address.line2());
        embeddable.setCity(address.city());
        embeddable.setState(address.state());
        embeddable.setPostalCode(address.postalCode());
        embeddable.setCountry(address.country());
        embeddable.setPhone(address.phone());
        return embeddable;
    }

    private Address toDomain(AddressEmbeddable embeddable) {
        return new Address(embeddable.getFirstName(), embeddable.getLastName(), embeddable.getLine1(),
                embeddable.getLine2(), embeddable.getCity(), embeddable.getState(), embeddable.getPostalCode(),
                embeddable.getCountry(), embeddable.getPhone());
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event metadata", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize event metadata", e);
        }
    }
}
