package com.orderline.resolution.pricing;

/**
 * Pricing configuration error, such as a customer segment without an effective rule.
 * Fatal for the line being priced; never replaced by a default price.
 */
public class InvalidPricingContextException extends RuntimeException {

    public InvalidPricingContextException(String message) {
        super(message);
    }

    public InvalidPricingContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
