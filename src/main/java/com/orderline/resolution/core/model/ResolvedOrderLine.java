package com.orderline.resolution.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A confirmed order line with reserved stock and a computed price.
 * Created on confirmation; fulfilled when the reservation is sold, voided when released.
 */
public class ResolvedOrderLine {

    private final String id;
    private final String parsedLineId;
    private final String productId;
    private final String productName;
    private final BigDecimal quantity;
    private final String unit;
    private final BigDecimal unitPrice;
    private final BigDecimal lineTotal;
    private final double confidence;
    private final FulfillmentMethod fulfillmentMethod;
    private final String reservationId;
    private final BigDecimal shortfall;
    private final Instant createdAt;
    private OrderLineStatus status;
    private Instant updatedAt;

    private ResolvedOrderLine(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.parsedLineId = builder.parsedLineId;
        this.productId = Objects.requireNonNull(builder.productId, "productId is required");
        this.productName = builder.productName;
        this.quantity = Objects.requireNonNull(builder.quantity, "quantity is required");
        this.unit = builder.unit;
        this.unitPrice = Objects.requireNonNull(builder.unitPrice, "unitPrice is required");
        this.lineTotal = unitPrice.multiply(quantity).setScale(2, RoundingMode.HALF_UP);
        this.confidence = builder.confidence;
        this.fulfillmentMethod = Objects.requireNonNull(builder.fulfillmentMethod, "fulfillmentMethod is required");
        this.reservationId = builder.reservationId;
        this.shortfall = builder.shortfall != null ? builder.shortfall : BigDecimal.ZERO;
        this.status = OrderLineStatus.RESERVED;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getParsedLineId() {
        return parsedLineId;
    }

    public String getProductId() {
        return productId;
    }

    public String getProductName() {
        return productName;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public String getUnit() {
        return unit;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public BigDecimal getLineTotal() {
        return lineTotal;
    }

    /**
     * Line total still owed: zero once the line is voided.
     */
    public synchronized BigDecimal getEffectiveTotal() {
        return status == OrderLineStatus.VOIDED ? BigDecimal.ZERO.setScale(2) : lineTotal;
    }

    public double getConfidence() {
        return confidence;
    }

    public FulfillmentMethod getFulfillmentMethod() {
        return fulfillmentMethod;
    }

    public String getReservationId() {
        return reservationId;
    }

    public BigDecimal getShortfall() {
        return shortfall;
    }

    public synchronized OrderLineStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized void markFulfilled() {
        requireReserved("fulfill");
        this.status = OrderLineStatus.FULFILLED;
        this.updatedAt = Instant.now();
    }

    public synchronized void markVoided() {
        requireReserved("void");
        this.status = OrderLineStatus.VOIDED;
        this.updatedAt = Instant.now();
    }

    private void requireReserved(String action) {
        if (status != OrderLineStatus.RESERVED) {
            throw new IllegalStateException("Cannot " + action + " order line " + id + " in status " + status);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResolvedOrderLine that = (ResolvedOrderLine) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ResolvedOrderLine{" +
                "id='" + id + '\'' +
                ", productId='" + productId + '\'' +
                ", quantity=" + quantity +
                ", unitPrice=" + unitPrice +
                ", fulfillmentMethod=" + fulfillmentMethod +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String parsedLineId;
        private String productId;
        private String productName;
        private BigDecimal quantity;
        private String unit;
        private BigDecimal unitPrice;
        private double confidence;
        private FulfillmentMethod fulfillmentMethod;
        private String reservationId;
        private BigDecimal shortfall;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder parsedLineId(String parsedLineId) {
            this.parsedLineId = parsedLineId;
            return this;
        }

        public Builder productId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder productName(String productName) {
            this.productName = productName;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder unitPrice(BigDecimal unitPrice) {
            this.unitPrice = unitPrice;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder fulfillmentMethod(FulfillmentMethod fulfillmentMethod) {
            this.fulfillmentMethod = fulfillmentMethod;
            return this;
        }

        public Builder reservationId(String reservationId) {
            this.reservationId = reservationId;
            return this;
        }

        public Builder shortfall(BigDecimal shortfall) {
            this.shortfall = shortfall;
            return this;
        }

        public ResolvedOrderLine build() {
            return new ResolvedOrderLine(this);
        }
    }
}
