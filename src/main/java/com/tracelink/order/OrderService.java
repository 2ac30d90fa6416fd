package com.tracelink.order;

import com.tracelink.config.TracelinkProperties;
import com.tracelink.logging.LogCorrelator;
import com.tracelink.simulator.Sleeper;
import com.tracelink.trace.Tracer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static com.tracelink.logging.LogCorrelator.fields;

/**
 * Demo order flow. Every step runs in its own child span of the request span
 * and logs through the {@link LogCorrelator}, so each log line can be joined
 * to the step that wrote it.
 */
@Service
public class OrderService {

    private final Tracer tracer;
    private final LogCorrelator correlator;
    private final Sleeper sleeper;
    private final Random random;
    private final TracelinkProperties.DemoProperties demo;

    @Autowired
    public OrderService(Tracer tracer, LogCorrelator correlator, Sleeper sleeper,
                        TracelinkProperties properties) {
        this(tracer, correlator, sleeper, new Random(), properties.getDemo());
    }

    OrderService(Tracer tracer, LogCorrelator correlator, Sleeper sleeper,
                 Random random, TracelinkProperties.DemoProperties demo) {
        requireProbability("demo.not-found-probability", demo.getNotFoundProbability());
        requireProbability("demo.slow-payment-probability", demo.getSlowPaymentProbability());
        if (demo.getSlowPaymentDelay() == null || demo.getSlowPaymentDelay().isNegative()) {
            throw new IllegalStateException("demo.slow-payment-delay must not be negative: "
                    + demo.getSlowPaymentDelay());
        }
        this.tracer = tracer;
        this.correlator = correlator;
        this.sleeper = sleeper;
        this.random = random;
        this.demo = demo;
    }

    public OrderConfirmation createOrder() {
        String orderId = "ORD-" + (1000 + random.nextInt(9000));
        correlator.info("Order creation started", fields("order_id", orderId));
        try {
            validate(orderId);
            checkInventory(orderId);
            processPayment(orderId);
        } catch (RuntimeException e) {
            correlator.error("Order creation failed", fields("order_id", orderId, "error", e.getMessage()));
            throw e;
        }
        correlator.info("Order created successfully", fields("order_id", orderId, "status", "completed"));
        return new OrderConfirmation(orderId, "created", "Order processed successfully");
    }

    public OrderDetails getOrder(String orderId) {
        correlator.info("Fetching order", fields("order_id", orderId));

        Optional<OrderDetails> order = tracer.inSpan("fetch-from-db",
                Map.of("db.system", "postgresql", "order.id", orderId), span -> {
                    correlator.info("Querying database", fields("order_id", orderId, "operation", "SELECT"));
                    pause(Duration.ofMillis(20), Duration.ofMillis(60));

                    if (random.nextDouble() < demo.getNotFoundProbability()) {
                        span.setAttribute("order.found", false);
                        correlator.warn("Order not found", fields("order_id", orderId));
                        return Optional.empty();
                    }
                    span.setAttribute("order.found", true);
                    return Optional.of(new OrderDetails(orderId, "completed",
                            1 + random.nextInt(5), money(10.0 + random.nextDouble() * 490.0)));
                });

        OrderDetails details = order.orElseThrow(() -> new OrderNotFoundException(orderId));
        correlator.info("Order retrieved", fields("order_id", orderId));
        return details;
    }

    /**
     * Always fails inside a {@code failing-operation} span.
     */
    public void triggerFailure() {
        correlator.warn("Error endpoint called - this will fail", Map.of());

        tracer.runInSpan("failing-operation", Map.of("error", true), span -> {
            correlator.error("About to raise exception", Map.of());
            SimulatedFailureException failure =
                    new SimulatedFailureException("Simulated error for demonstration");
            correlator.error("Exception occurred", fields(
                    "error", failure.getMessage(),
                    "error_type", failure.getClass().getSimpleName()));
            throw failure;
        });
    }

    private void validate(String orderId) {
        tracer.runInSpan("validate-order", Map.of("order.id", orderId), span -> {
            correlator.info("Validating order", fields("step", "validation", "order_id", orderId));
            pause(Duration.ofMillis(20), Duration.ofMillis(80));
            span.addEvent("validation_complete", Map.of("status", "passed"));
        });
    }

    private void checkInventory(String orderId) {
        tracer.runInSpan("check-inventory", Map.of("order.id", orderId), span -> {
            int itemsCount = 1 + random.nextInt(5);
            span.setAttribute("items.count", itemsCount);
            correlator.info("Checking inventory",
                    fields("step", "inventory", "order_id", orderId, "items", itemsCount));
            pause(Duration.ofMillis(30), Duration.ofMillis(100));

            tracer.runInSpan("db-query", Map.of("db.system", "postgresql", "db.operation", "SELECT"), db -> {
                correlator.info("Executing inventory query", fields("step", "db_query", "order_id", orderId));
                pause(Duration.ofMillis(10), Duration.ofMillis(30));
                db.addEvent("query_executed", Map.of("rows_returned", itemsCount));
            });
        });
    }

    private void processPayment(String orderId) {
        tracer.runInSpan("process-payment", span -> {
            double amount = 10.0 + random.nextDouble() * 490.0;
            span.setAttribute("payment.amount", amount);
            span.setAttribute("payment.currency", "USD");
            correlator.info("Processing payment",
                    fields("step", "payment", "order_id", orderId, "amount", money(amount)));
            pause(Duration.ofMillis(50), Duration.ofMillis(150));

            if (random.nextDouble() < demo.getSlowPaymentProbability()) {
                correlator.warn("Payment gateway slow", fields("step", "payment", "order_id", orderId));
                pause(demo.getSlowPaymentDelay(), demo.getSlowPaymentDelay());
            }
            span.addEvent("payment_processed",
                    Map.of("transaction_id", "TXN-" + (10000 + random.nextInt(90000))));
        });
    }

    private void pause(Duration min, Duration max) {
        long spread = max.toNanos() - min.toNanos();
        Duration pause = spread > 0 ? min.plusNanos((long) (random.nextDouble() * spread)) : min;
        try {
            sleeper.sleep(pause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during simulated work", e);
        }
    }

    private static void requireProbability(String key, double p) {
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new IllegalStateException(key + " must be within [0, 1]: " + p);
        }
    }

    private static String money(double amount) {
        return String.format(Locale.ROOT, "$%.2f", amount);
    }

    public static class OrderNotFoundException extends RuntimeException {
        private final String orderId;

        public OrderNotFoundException(String orderId) {
            super("Order not found");
            this.orderId = orderId;
        }

        public String getOrderId() {
            return orderId;
        }
    }

    public static class SimulatedFailureException extends RuntimeException {
        public SimulatedFailureException(String message) {
            super(message);
        }
    }
}
