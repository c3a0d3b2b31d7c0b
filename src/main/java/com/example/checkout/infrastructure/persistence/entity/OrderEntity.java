package com.example.checkout.infrastructure.persistence.entity;

import com.example.checkout.domain.model.OrderStatus;
import com.example.checkout.domain.model.PaymentStatus;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA Entity for Order persistence.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_user_created", columnList = "user_id, created_at")
})
public class OrderEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "order_number", length = 20, nullable = false, unique = true, updatable = false)
    private String orderNumber;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "checkout_id", nullable = false, unique = true, updatable = false)
    private UUID checkoutId;

    @Column(name = "status", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(name = "payment_status", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private PaymentStatus paymentStatus;

    @Column(name = "subtotal", precision = 12, scale = 2, nullable = false)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", precision = 12, scale = 2, nullable = false)
    private BigDecimal taxAmount;

    @Column(name = "shipping_amount", precision = 12, scale = 2, nullable = false)
    private BigDecimal shippingAmount;

    @Column(name = "discount_amount", precision = 12, scale = 2, nullable = false)
    private BigDecimal discountAmount;

    @Column(name = "total_amount", precision = 12, scale = 2, nullable = false)
    private BigDecimal totalAmount;

    @Column(name = "currency", length = 3, nullable = false)
    private String currency;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "firstName", column = @Column(name = "shipping_first_name", length = 100)),
        @AttributeOverride(name = "lastName", column = @Column(name = "shipping_last_name", length = 100)),
        @AttributeOverride(name = "line1", column = @Column(name = "shipping_address_line1", length = 255)),
        @AttributeOverride(name = "line2", column = @Column(name = "shipping_address_line2", length = 255)),
        @AttributeOverride(name = "city", column = @Column(name = "shipping_city", length = 100)),
        @AttributeOverride(name = "state", column = @Column(name = "shipping_state", length = 100)),
        @AttributeOverride(name = "postalCode", column = @Column(name = "shipping_postal_code", length = 20)),
        @AttributeOverride(name = "country", column = @Column(name = "shipping_country", length = 100)),
        @AttributeOverride(name = "phone", column = @Column(name = "shipping_phone", length = 30))
    })
    private AddressEmbeddable shippingAddress;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "firstName", column = @Column(name = "billing_first_name", length = 100)),
        @AttributeOverride(name = "lastName", column = @Column(name = "billing_last_name", length = 100)),
        @AttributeOverride(name = "line1", column = @Column(name = "billing_address_line1", length = 255)),
        @AttributeOverride(name = "line2", column = @Column(name = "billing_address_line2", length = 255)),
        @AttributeOverride(name = "city", column = @Column(name = "billing_city", length = 100)),
        @AttributeOverride(name = "state", column = @Column(name = "billing_state", length = 100)),
        @AttributeOverride(name = "postalCode", column = @Column(name = "billing_postal_code", length = 20)),
        @AttributeOverride(name = "country", column = @Column(name = "billing_country", length = 100)),
        @AttributeOverride(name = "phone", column = @Column(name = "billing_phone", length = 30))
    })
    private AddressEmbeddable billingAddress;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "tracking_number", length = 100)
    private String trackingNumber;

    @Column(name = "shipped_at")
    private Instant shippedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderItemEntity> items = new ArrayList<>();

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL)
    @OrderBy("id ASC")
    private List<OrderStatusHistoryEntity> statusHistory = new ArrayList<>();

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL)
    @OrderBy("id ASC")
    private List<OrderEventEntity> events = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void addItem(OrderItemEntity item) {
        item.setOrder(this);
        items.add(item);
    }

    public void addStatusHistory(OrderStatusHistoryEntity entry) {
        entry.setOrder(this);
        statusHistory.add(entry);
    }

    public void addEvent(OrderEventEntity event) {
        event.setOrder(this);
        events.add(event);
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public void setOrderNumber(String orderNumber) {
        this.orderNumber = orderNumber;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    public UUID getCheckoutId() {
        return checkoutId;
    }

    public void setCheckoutId(UUID checkoutId) {
        this.checkoutId = checkoutId;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public void setStatus(OrderStatus status) {
        this.status = status;
    }

    public PaymentStatus getPaymentStatus() {
        return paymentStatus;
    }

    public void setPaymentStatus(PaymentStatus paymentStatus) {
        this.paymentStatus = paymentStatus;
    }

    public BigDecimal getSubtotal() {
        return subtotal;
    }

    public void setSubtotal(BigDecimal subtotal) {
        this.subtotal = subtotal;
    }

    public BigDecimal getTaxAmount() {
        return taxAmount;
    }

    public void setTaxAmount(BigDecimal taxAmount) {
        this.taxAmount = taxAmount;
    }

    public BigDecimal getShippingAmount() {
        return shippingAmount;
    }

    public void setShippingAmount(BigDecimal shippingAmount) {
        this.shippingAmount = shippingAmount;
    }

    public BigDecimal getDiscountAmount() {
        return discountAmount;
    }

    public void setDiscountAmount(BigDecimal discountAmount) {
        this.discountAmount = discountAmount;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(BigDecimal totalAmount) {
        this.totalAmount = totalAmount;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public AddressEmbeddable getShippingAddress() {
        return shippingAddress;
    }

    public void setShippingAddress(AddressEmbeddable shippingAddress) {
        this.shippingAddress = shippingAddress;
    }

    public AddressEmbeddable getBillingAddress() {
        return billingAddress;
    }

    public void setBillingAddress(AddressEmbeddable billingAddress) {
        this.billingAddress = billingAddress;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    public void setTrackingNumber(String trackingNumber) {
        this.trackingNumber = trackingNumber;
    }

    public Instant getShippedAt() {
        return shippedAt;
    }

    public void setShippedAt(Instant shippedAt) {
        this.shippedAt = shippedAt;
    }

    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    public void setDeliveredAt(Instant deliveredAt) {
        this.deliveredAt = deliveredAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public List<OrderItemEntity> getItems() {
        return items;
    }

    public List<OrderStatusHistoryEntity> getStatusHistory() {
        return statusHistory;
    }

    public List<OrderEventEntity> getEvents() {
        return events;
    }
}
