package com.example.checkout.application.pipeline.stage;

import com.example.checkout.application.pipeline.CheckoutRequest;
import com.example.checkout.application.pipeline.CheckoutStage;
import com.example.checkout.application.pipeline.CheckoutStep;
import com.example.checkout.application.pipeline.CreatedOrder;
import com.example.checkout.application.pipeline.ValidatedCheckout;
import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.application.port.out.CatalogPort;
import com.example.checkout.application.port.out.CatalogPort.CatalogEntry;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.application.port.out.UserDirectoryPort;
import com.example.checkout.application.port.out.UserDirectoryPort.Customer;
import com.example.checkout.application.service.OrderNumberGenerator;
import com.example.checkout.application.service.OrderRecorder;
import com.example.checkout.domain.exception.ValidationException;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.CartLine;
import com.example.checkout.domain.model.CartSnapshot;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderCharges;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Builds the order from the cart's current contents in one transaction.
 * <p>
 * The checkout id is the idempotency key: a re-run finds the order already written for the
 * checkout and returns it instead of inserting a second one.
 */
@Component
public class CreateOrderStage implements CheckoutStage<ValidatedCheckout, CreatedOrder> {

    private static final Logger log = LoggerFactory.getLogger(CreateOrderStage.class);

    private final OrderStorePort orderStore;
    private final CartPort cartPort;
    private final CatalogPort catalog;
    private final UserDirectoryPort userDirectory;
    private final OrderNumberGenerator orderNumbers;
    private final OrderRecorder orderRecorder;
    private final Clock clock;

    public CreateOrderStage(
            OrderStorePort orderStore,
            CartPort cartPort,
            CatalogPort catalog,
            UserDirectoryPort userDirectory,
            OrderNumberGenerator orderNumbers,
            OrderRecorder orderRecorder,
            Clock clock) {
        this.orderStore = orderStore;
        this.cartPort = cartPort;
        this.catalog = catalog;
        this.userDirectory = userDirectory;
        this.orderNumbers = orderNumbers;
        this.orderRecorder = orderRecorder;
        this.clock = clock;
    }

    @Override
    public CheckoutStep step() {
        return CheckoutStep.CREATE_ORDER;
    }

    @Override
    public Class<ValidatedCheckout> inputType() {
        return ValidatedCheckout.class;
    }

    @Override
    @Transactional
    public CreatedOrder execute(ValidatedCheckout input) {
        CheckoutRequest request = input.request();

        Optional<Order> existing = orderStore.findByCheckoutId(request.checkoutId());
        if (existing.isPresent()) {
            log.info("Order {} already exists for checkout {}, skipping creation",
                    existing.get().getOrderNumber(), request.checkoutId());
            return toOutput(request, existing.get());
        }

        Customer customer = resolveCustomer(request.userId());

        CartSnapshot cart = cartPort.lockForCheckout(request.cartId())
                .orElseThrow(() -> new ValidationException("Cart " + request.cartId() + " no longer exists"));
        if (cart.isEmpty()) {
            throw new ValidationException("Cart is empty");
        }

        List<OrderItem> items = cart.lines().stream()
                .map(this::toOrderItem)
                .toList();
        String currency = items.get(0).getUnitPrice().getCurrency();

        Order order = Order.place(
                OrderId.generate(),
                orderNumbers.next(),
                customer.id(),
                request.checkoutId(),
                items,
                OrderCharges.none(currency),
                request.shippingAddress(),
                request.billingAddress(),
                request.notes(),
                clock.instant());

        orderRecorder.persist(order, Actor.system());

        log.info("Order {} created for checkout {}: {} item(s), total {}",
                order.getOrderNumber(), request.checkoutId(), items.size(), order.getTotal());
        return toOutput(request, order);
    }

    private OrderItem toOrderItem(CartLine line) {
        CatalogEntry entry = catalog.find(line.productId(), line.variantId())
                .orElseThrow(() -> new ValidationException("Product " + line.productId() + " no longer exists"));
        return OrderItem.snapshot(entry.productId(), entry.variantId(), entry.productName(), entry.variantName(),
                entry.sku(), line.quantity(), entry.unitPrice());
    }

    private Customer resolveCustomer(UUID userId) {
        Customer customer;
        try {
            customer = userDirectory.byId(userId).join()
                    .orElseThrow(() -> new ValidationException("User " + userId + " does not exist"));
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        if (!customer.active()) {
            throw new ValidationException("User " + userId + " is not active");
        }
        return customer;
    }

    private static CreatedOrder toOutput(CheckoutRequest request, Order order) {
        return new CreatedOrder(request.checkoutId(), request.userId(), request.cartId(),
                order.getId().getValue(), order.getOrderNumber().getValue());
    }
}
