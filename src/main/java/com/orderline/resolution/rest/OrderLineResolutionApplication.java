package com.orderline.resolution.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Order Line Resolution API",
                version = "1.0.0",
                description = "Resolves free-text order and invoice lines to catalog products, " +
                        "reserves stock against lots and prices lines per customer segment."
        )
)
public class OrderLineResolutionApplication extends Application {
}
