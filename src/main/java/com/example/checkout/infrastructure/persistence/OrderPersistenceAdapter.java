package com.example.checkout.infrastructure.persistence;

import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderNumber;
import com.example.checkout.infrastructure.persistence.entity.OrderEntity;
import com.example.checkout.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.checkout.infrastructure.persistence.repository.OrderJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed order store. Items are written once on insert; history rows and events are appended.
 */
@Component
public class OrderPersistenceAdapter implements OrderStorePort {

    private static final Logger log = LoggerFactory.getLogger(OrderPersistenceAdapter.class);

    private final OrderJpaRepository orderRepository;
    private final OrderPersistenceMapper mapper;

    public OrderPersistenceAdapter(OrderJpaRepository orderRepository, OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findById(OrderId orderId) {
        return orderRepository.findById(orderId.getValue()).map(mapper::toDomain);
    }

    @Override
    @Transactional
    public Optional<Order> findByIdForUpdate(OrderId orderId) {
        return orderRepository.findByIdForUpdate(orderId.getValue()).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findByCheckoutId(UUID checkoutId) {
        return orderRepository.findByCheckoutId(checkoutId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findRecentByUser(UUID userId, int limit) {
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, limit)).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByOrderNumber(OrderNumber orderNumber) {
        return orderRepository.existsByOrderNumber(orderNumber.getValue());
    }

    @Override
    @Transactional
    public Order save(Order order) {
        OrderEntity entity;
        if (order.isNew()) {
            entity = mapper.toNewEntity(order);
        } else {
            entity = orderRepository.findById(order.getId().getValue())
                    .orElseThrow(() -> new IllegalStateException("Order vanished while saving: " + order.getId()));
        }

        mapper.copyState(order, entity);
        order.getNewStatusChanges().forEach(change -> entity.addStatusHistory(mapper.toEntity(change)));
        order.getNewEvents().forEach(event -> entity.addEvent(mapper.toEntity(event)));

        OrderEntity saved = orderRepository.saveAndFlush(entity);
        order.markPersisted(saved.getVersion());
        log.debug("Saved order {} (status={}, version={})", order.getOrderNumber(), order.getStatus(),
                saved.getVersion());
        return order;
    }
}
