package com.example.checkout.domain.model;

import com.example.checkout.domain.exception.InvalidTransitionException;
import com.example.checkout.domain.exception.ValidationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Aggregate Root representing a customer order.
 * <p>
 * Status and payment status are two independent state machines. Every accepted transition
 * appends a {@link StatusChange}; business milestones append an {@link OrderEvent}. Entries
 * added since the last save are exposed through {@link #getNewStatusChanges()} and
 * {@link #getNewEvents()} until {@link #markPersisted(Long)} is called.
 */
public final class Order {

    private static final BigDecimal MINIMUM_TOTAL = new BigDecimal("0.01");

    private final OrderId id;
    private final OrderNumber orderNumber;
    private final UUID userId;
    private final UUID checkoutId;
    private final List<OrderItem> items;
    private final Money subtotal;
    private final Money tax;
    private final Money shippingCost;
    private final Money discount;
    private final Money total;
    private final Address shippingAddress;
    private final Address billingAddress;
    private final String notes;
    private final Instant createdAt;
    private final List<StatusChange> statusHistory;
    private final List<OrderEvent> events;
    private final List<StatusChange> newStatusChanges = new ArrayList<>();
    private final List<OrderEvent> newEvents = new ArrayList<>();

    private OrderStatus status;
    private PaymentStatus paymentStatus;
    private String trackingNumber;
    private Instant shippedAt;
    private Instant deliveredAt;
    private Long version;
    private boolean persisted;

    private Order(Reconstitution r) {
        this.id = Objects.requireNonNull(r.id, "OrderId cannot be null");
        this.orderNumber = Objects.requireNonNull(r.orderNumber, "Order number cannot be null");
        this.userId = Objects.requireNonNull(r.userId, "UserId cannot be null");
        this.checkoutId = Objects.requireNonNull(r.checkoutId, "CheckoutId cannot be null");
        this.items = List.copyOf(Objects.requireNonNull(r.items, "Items cannot be null"));
        this.subtotal = Objects.requireNonNull(r.subtotal, "Subtotal cannot be null");
        this.tax = Objects.requireNonNull(r.tax, "Tax cannot be null");
        this.shippingCost = Objects.requireNonNull(r.shippingCost, "Shipping cannot be null");
        this.discount = Objects.requireNonNull(r.discount, "Discount cannot be null");
        this.total = Objects.requireNonNull(r.total, "Total cannot be null");
        this.shippingAddress = Objects.requireNonNull(r.shippingAddress, "Shipping address cannot be null");
        this.billingAddress = Objects.requireNonNull(r.billingAddress, "Billing address cannot be null");
        this.notes = r.notes;
        this.createdAt = Objects.requireNonNull(r.createdAt, "CreatedAt cannot be null");
        this.status = Objects.requireNonNull(r.status, "Status cannot be null");
        this.paymentStatus = Objects.requireNonNull(r.paymentStatus, "Payment status cannot be null");
        this.trackingNumber = r.trackingNumber;
        this.shippedAt = r.shippedAt;
        this.deliveredAt = r.deliveredAt;
        this.version = r.version;
        this.statusHistory = new ArrayList<>(r.statusHistory);
        this.events = new ArrayList<>(r.events);
        this.persisted = r.persisted;

        if (items.isEmpty()) {
            throw new IllegalArgumentException("Order must have at least one item");
        }
    }

    /**
     * Places a new pending order and records its {@code created} event.
     *
     * @throws ValidationException if the computed total is below 0.01
     */
    public static Order place(OrderId id, OrderNumber orderNumber, UUID userId, UUID checkoutId,
                              List<OrderItem> items, OrderCharges charges,
                              Address shippingAddress, Address billingAddress, String notes, Instant now) {
        Objects.requireNonNull(items, "Items cannot be null");
        if (items.isEmpty()) {
            throw new ValidationException("Cannot place an order without items");
        }
        String currency = items.get(0).getUnitPrice().getCurrency();
        Money subtotal = items.stream()
                .map(OrderItem::getTotalPrice)
                .reduce(Money.zero(currency), Money::add);
        Money gross = subtotal.add(charges.tax()).add(charges.shipping());
        if (gross.isLessThan(charges.discount().getAmount())) {
            throw new ValidationException("Discount exceeds order amount");
        }
        Money total = gross.subtract(charges.discount());
        if (total.isLessThan(MINIMUM_TOTAL)) {
            throw new ValidationException("Order total must be at least " + MINIMUM_TOTAL + ": " + total);
        }

        Order order = reconstitute()
                .id(id)
                .orderNumber(orderNumber)
                .userId(userId)
                .checkoutId(checkoutId)
                .items(items)
                .amounts(subtotal, charges.tax(), charges.shipping(), charges.discount(), total)
                .shippingAddress(shippingAddress)
                .billingAddress(billingAddress)
                .notes(notes)
                .createdAt(now)
                .status(OrderStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .persisted(false)
                .build();
        order.recordEvent(OrderEventType.CREATED, "Order " + orderNumber + " created",
                Map.of("checkout_id", checkoutId.toString()), now);
        return order;
    }

    /**
     * Starts rebuilding an order from stored state.
     */
    public static Reconstitution reconstitute() {
        return new Reconstitution();
    }

    public boolean canBeCancelled() {
        return status == OrderStatus.PENDING
                || status == OrderStatus.PROCESSING
                || status == OrderStatus.CONFIRMED;
    }

    /**
     * Moves a pending order into processing.
     */
    public void markProcessing(Actor actor, Instant now) {
        transitionTo(OrderStatus.PROCESSING, actor, null, now);
    }

    /**
     * Confirms the order once stock for every item has been deducted.
     */
    public void confirm(Actor actor, Instant now) {
        transitionTo(OrderStatus.CONFIRMED, actor, "Stock deducted", now);
        recordEvent(OrderEventType.CONFIRMED, "Order confirmed and stock deducted", Map.of(), now);
    }

    public void ship(String trackingNumber, Actor actor, Instant now) {
        if (trackingNumber == null || trackingNumber.isBlank()) {
            throw new ValidationException("Tracking number is required to ship an order");
        }
        transitionTo(OrderStatus.SHIPPED, actor, "Tracking " + trackingNumber, now);
        this.trackingNumber = trackingNumber;
        this.shippedAt = now;
        recordEvent(OrderEventType.SHIPPED, "Order shipped",
                Map.of("tracking_number", trackingNumber), now);
    }

    public void deliver(Actor actor, Instant now) {
        transitionTo(OrderStatus.DELIVERED, actor, null, now);
        this.deliveredAt = now;
        recordEvent(OrderEventType.DELIVERED, "Order delivered", Map.of(), now);
    }

    /**
     * Cancels the order.
     *
     * @return the items whose stock must be returned to the ledger; empty when stock was never deducted
     * @throws InvalidTransitionException if the order is shipped, delivered, refunded or already cancelled
     */
    public List<OrderItem> cancel(Actor actor, Instant now) {
        if (!canBeCancelled()) {
            throw new InvalidTransitionException(id, StatusField.STATUS,
                    status.wireValue(), OrderStatus.CANCELLED.wireValue());
        }
        boolean restock = status.holdsStock();
        transitionTo(OrderStatus.CANCELLED, actor, null, now);
        recordEvent(OrderEventType.CANCELLED, "Order cancelled",
                Map.of("restocked", restock), now);
        return restock ? items : List.of();
    }

    /**
     * Applies a payment status reported by the payment collaborator.
     */
    public void updatePaymentStatus(PaymentStatus target, Actor actor, Instant now) {
        Objects.requireNonNull(target, "Payment status cannot be null");
        if (!paymentStatus.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, StatusField.PAYMENT_STATUS,
                    paymentStatus.wireValue(), target.wireValue());
        }
        PaymentStatus previous = paymentStatus;
        paymentStatus = target;
        appendChange(new StatusChange(StatusField.PAYMENT_STATUS, previous.wireValue(), target.wireValue(),
                null, actor.auditId(), now));

        switch (target) {
            case PAID -> recordEvent(OrderEventType.PAYMENT_RECEIVED, "Payment received", Map.of(), now);
            case FAILED -> recordEvent(OrderEventType.PAYMENT_FAILED, "Payment failed", Map.of(), now);
            case REFUNDED, PARTIALLY_REFUNDED -> recordEvent(OrderEventType.REFUNDED,
                    "Payment " + target.wireValue().replace('_', ' '), Map.of(), now);
            default -> {
            }
        }
    }

    public void recordEvent(OrderEventType type, String message, Map<String, Object> metadata, Instant now) {
        OrderEvent event = new OrderEvent(type, message, metadata, now);
        events.add(event);
        newEvents.add(event);
    }

    public boolean hasEvent(OrderEventType type) {
        return events.stream().anyMatch(e -> e.type() == type);
    }

    public boolean isOwnedBy(UUID candidate) {
        return userId.equals(candidate);
    }

    /**
     * Clears the unsaved change buffers after the persistence layer has written them.
     */
    public void markPersisted(Long newVersion) {
        this.version = newVersion;
        this.persisted = true;
        newStatusChanges.clear();
        newEvents.clear();
    }

    private void transitionTo(OrderStatus target, Actor actor, String notes, Instant now) {
        Objects.requireNonNull(actor, "Actor cannot be null");
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, StatusField.STATUS, status.wireValue(), target.wireValue());
        }
        OrderStatus previous = status;
        status = target;
        appendChange(new StatusChange(StatusField.STATUS, previous.wireValue(), target.wireValue(),
                notes, actor.auditId(), now));
    }

    private void appendChange(StatusChange change) {
        statusHistory.add(change);
        newStatusChanges.add(change);
    }

    public OrderId getId() {
        return id;
    }

    public OrderNumber getOrderNumber() {
        return orderNumber;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getCheckoutId() {
        return checkoutId;
    }

    public List<OrderItem> getItems() {
        return items;
    }

    public Money getSubtotal() {
        return subtotal;
    }

    public Money getTax() {
        return tax;
    }

    public Money getShippingCost() {
        return shippingCost;
    }

    public Money getDiscount() {
        return discount;
    }

    public Money getTotal() {
        return total;
    }

    public Address getShippingAddress() {
        return shippingAddress;
    }

    public Address getBillingAddress() {
        return billingAddress;
    }

    public String getNotes() {
        return notes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public PaymentStatus getPaymentStatus() {
        return paymentStatus;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    public Instant getShippedAt() {
        return shippedAt;
    }

    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    public Long getVersion() {
        return version;
    }

    public boolean isNew() {
        return !persisted;
    }

    public List<StatusChange> getStatusHistory() {
        return Collections.unmodifiableList(statusHistory);
    }

    public List<OrderEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<StatusChange> getNewStatusChanges() {
        return List.copyOf(newStatusChanges);
    }

    public List<OrderEvent> getNewEvents() {
        return List.copyOf(newEvents);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((Order) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Order{id=" + id + ", orderNumber=" + orderNumber + ", status=" + status
                + ", paymentStatus=" + paymentStatus + ", total=" + total + "}";
    }

    /**
     * Builder used by the persistence layer to rebuild an order.
     */
    public static final class Reconstitution {

        private OrderId id;
        private OrderNumber orderNumber;
        private UUID userId;
        private UUID checkoutId;
        private List<OrderItem> items = List.of();
        private Money subtotal;
        private Money tax;
        private Money shippingCost;
        private Money discount;
        private Money total;
        private Address shippingAddress;
        private Address billingAddress;
        private String notes;
        private Instant createdAt;
        private OrderStatus status;
        private PaymentStatus paymentStatus;
        private String trackingNumber;
        private Instant shippedAt;
        private Instant deliveredAt;
        private Long version;
        private List<StatusChange> statusHistory = List.of();
        private List<OrderEvent> events = List.of();
        private boolean persisted = true;

        private Reconstitution() {
        }

        public Reconstitution id(OrderId id) {
            this.id = id;
            return this;
        }

        public Reconstitution orderNumber(OrderNumber orderNumber) {
            this.orderNumber = orderNumber;
            return this;
        }

        public Reconstitution userId(UUID userId) {
            this.userId = userId;
            return this;
        }

        public Reconstitution checkoutId(UUID checkoutId) {
            this.checkoutId = checkoutId;
            return this;
        }

        public Reconstitution items(List<OrderItem> items) {
            this.items = items;
            return this;
        }

        public Reconstitution amounts(Money subtotal, Money tax, Money shippingCost, Money discount, Money total) {
            this.subtotal = subtotal;
            this.tax = tax;
            this.shippingCost = shippingCost;
            this.discount = discount;
            this.total = total;
            return this;
        }

        public Reconstitution shippingAddress(Address shippingAddress) {
            this.shippingAddress = shippingAddress;
            return this;
        }

        public Reconstitution billingAddress(Address billingAddress) {
            this.billingAddress = billingAddress;
            return this;
        }

        public Reconstitution notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Reconstitution createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Reconstitution status(OrderStatus status) {
            this.status = status;
            return this;
        }

        public Reconstitution paymentStatus(PaymentStatus paymentStatus) {
            this.paymentStatus = paymentStatus;
            return this;
        }

        public Reconstitution tracking(String trackingNumber, Instant shippedAt, Instant deliveredAt) {
            this.trackingNumber = trackingNumber;
            this.shippedAt = shippedAt;
            this.deliveredAt = deliveredAt;
            return this;
        }

        public Reconstitution version(Long version) {
            this.version = version;
            return this;
        }

        public Reconstitution statusHistory(List<StatusChange> statusHistory) {
            this.statusHistory = statusHistory;
            return this;
        }

        public Reconstitution events(List<OrderEvent> events) {
            this.events = events;
            return this;
        }

        Reconstitution persisted(boolean persisted) {
            this.persisted = persisted;
            return this;
        }

        public Order build() {
            return new Order(this);
        }
    }
}
