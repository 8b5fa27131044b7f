package com.orderline.resolution.rest;

import com.orderline.resolution.api.OrderLineResolver;
import com.orderline.resolution.api.ProcessedLine;
import com.orderline.resolution.core.model.ResolutionResult;
import com.orderline.resolution.core.model.ResolvedOrderLine;
import com.orderline.resolution.lock.LockAcquisitionException;
import com.orderline.resolution.pricing.InvalidPricingContextException;
import com.orderline.resolution.rest.dto.ConfirmMatchRequest;
import com.orderline.resolution.rest.dto.ErrorResponse;
import com.orderline.resolution.rest.dto.InvoiceLineRequest;
import com.orderline.resolution.rest.dto.OrderLineResponse;
import com.orderline.resolution.rest.dto.ProcessLineRequest;
import com.orderline.resolution.rest.dto.ResolutionResponse;
import com.orderline.resolution.rest.dto.ResolveLineRequest;
import com.orderline.resolution.rest.dto.ResolveMessageRequest;
import com.orderline.resolution.rest.dto.ReviewItemResponse;
import com.orderline.resolution.stock.ConcurrentReservationConflictException;
import com.orderline.resolution.stock.InsufficientStockException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST resource for the order-line pipeline.
 *
 * <p>Resolution endpoints never touch stock. Confirmation reserves stock and prices the
 * line; fulfil sells the reservation and void releases it.</p>
 */
@Path("/api/v1/order-lines")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Order Lines", description = "Resolve free-text order lines to catalog products, reserve stock and price them")
public class OrderLineResource {
    private static final Logger log = LoggerFactory.getLogger(OrderLineResource.class);
    private static final String BASE = "/api/v1/order-lines";
    private static final String INTERNAL_ERROR = "An internal error occurred. Check server logs for details.";

    private final OrderLineResolver resolver;

    @Inject
    public OrderLineResource(OrderLineResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * POST /api/v1/order-lines/resolve
     */
    @POST
    @Path("/resolve")
    @Operation(summary = "Resolve an order line",
            description = "Parses a raw line and ranks catalog products. Returns the decision tier and suggestions.")
    @APIResponse(responseCode = "200", description = "Line resolved; check decisionTier")
    @APIResponse(responseCode = "400", description = "Missing rawText")
    public Response resolve(ResolveLineRequest request) {
        String path = BASE + "/resolve";
        try {
            ResolutionResult result = resolver.resolveLine(request.rawText());
            return Response.ok(ResolutionResponse.from(result)).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("resolve.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    /**
     * POST /api/v1/order-lines/resolve-message
     */
    @POST
    @Path("/resolve-message")
    @Operation(summary = "Resolve a multi-line message",
            description = "Splits a message on newlines, commas and semicolons and resolves every line against one catalog snapshot.")
    @APIResponse(responseCode = "200", description = "All lines resolved")
    @APIResponse(responseCode = "400", description = "Empty message or too many lines")
    public Response resolveMessage(ResolveMessageRequest request) {
        String path = BASE + "/resolve-message";
        try {
            List<ResolutionResponse> lines = resolver.resolveMessage(request.message()).stream()
                    .map(ResolutionResponse::from)
                    .toList();
            return Response.ok(Map.of("lines", lines, "totalLines", lines.size())).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("resolveMessage.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    /**
     * POST /api/v1/order-lines/resolve-invoice
     */
    @POST
    @Path("/resolve-invoice")
    @Operation(summary = "Resolve a supplier invoice line",
            description = "Explicit quantity and unit override the parsed description; the unit price becomes the cost basis on confirmation.")
    @APIResponse(responseCode = "200", description = "Invoice line resolved")
    @APIResponse(responseCode = "400", description = "Missing description or negative amounts")
    public Response resolveInvoice(InvoiceLineRequest request) {
        String path = BASE + "/resolve-invoice";
        try {
            ResolutionResult result = resolver.resolveInvoiceLine(request.toInvoiceLine());
            return Response.ok(ResolutionResponse.from(result)).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("resolveInvoice.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                    .build();
        }
    }

    /**
     * POST /api/v1/order-lines/process
     */
    @POST
    @Path("/process")
    @Operation(summary = "Resolve and confirm when confident",
            description = "AUTO lines are confirmed immediately; every other line is queued for review.")
    @APIResponse(responseCode = "200", description = "Line confirmed or queued")
    @APIResponse(responseCode = "409", description = "Stock changed or is insufficient")
    @APIResponse(responseCode = "500", description = "Pricing configuration error")
    public Response process(ProcessLineRequest request) {
        String path = BASE + "/process";
        try {
            ProcessedLine processed = resolver.processLine(request.rawText(), request.customerSegment());
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("resolution", ResolutionResponse.from(processed.resolution()));
            response.put("confirmed", processed.isConfirmed());
            processed.getOrderLine().ifPresent(line -> response.put("orderLine", OrderLineResponse.from(line)));
            processed.getReviewItem().ifPresent(item -> response.put("reviewItem", ReviewItemResponse.from(item)));
            return Response.ok(response).build();
        } catch (Exception e) {
            return failure(e, path, Response.Status.BAD_REQUEST);
        }
    }

    /**
     * POST /api/v1/order-lines/confirm-match
     */
    @POST
    @Path("/confirm-match")
    @Operation(summary = "Confirm a match",
            description = "Reserves stock for the chosen product and prices the line for the customer segment.")
    @APIResponse(responseCode = "200", description = "Order line created")
    @APIResponse(responseCode = "400", description = "Unknown or expired parsed line, or unknown product")
    @APIResponse(responseCode = "409", description = "Stock changed or is insufficient")
    @APIResponse(responseCode = "500", description = "Pricing configuration error")
    public Response confirmMatch(ConfirmMatchRequest request) {
        String path = BASE + "/confirm-match";
        try {
            ResolvedOrderLine line = resolver.confirmMatch(
                    request.parsedLineId(), request.chosenProductId(), request.customerSegment());
            return Response.ok(OrderLineResponse.from(line)).build();
        } catch (Exception e) {
            return failure(e, path, Response.Status.BAD_REQUEST);
        }
    }

    /**
     * POST /api/v1/order-lines/{id}/fulfill
     */
    @POST
    @Path("/{id}/fulfill")
    @Operation(summary = "Fulfil an order line", description = "Sells the line's reservation.")
    @APIResponse(responseCode = "200", description = "Order line fulfilled")
    @APIResponse(responseCode = "404", description = "Order line not found")
    @APIResponse(responseCode = "409", description = "Order line is not reserved")
    public Response fulfill(@Parameter(description = "Order line ID") @PathParam("id") String orderLineId) {
        try {
            return Response.ok(OrderLineResponse.from(resolver.fulfill(orderLineId))).build();
        } catch (Exception e) {
            return failure(e, BASE + "/" + orderLineId + "/fulfill", Response.Status.NOT_FOUND);
        }
    }

    /**
     * POST /api/v1/order-lines/{id}/void
     */
    @POST
    @Path("/{id}/void")
    @Operation(summary = "Void an order line",
            description = "Releases the line's reservation and zeroes its total.")
    @APIResponse(responseCode = "200", description = "Order line voided")
    @APIResponse(responseCode = "404", description = "Order line not found")
    @APIResponse(responseCode = "409", description = "Order line is not reserved")
    public Response voidLine(@Parameter(description = "Order line ID") @PathParam("id") String orderLineId) {
        try {
            return Response.ok(OrderLineResponse.from(resolver.voidLine(orderLineId))).build();
        } catch (Exception e) {
            return failure(e, BASE + "/" + orderLineId + "/void", Response.Status.NOT_FOUND);
        }
    }

    /**
     * GET /api/v1/order-lines/{id}
     */
    @GET
    @Path("/{id}")
    @Operation(summary = "Get an order line")
    @APIResponse(responseCode = "200", description = "Order line found")
    @APIResponse(responseCode = "404", description = "Order line not found")
    public Response getLine(@Parameter(description = "Order line ID") @PathParam("id") String orderLineId) {
        Optional<ResolvedOrderLine> line = resolver.findLine(orderLineId);
        if (line.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound("Order line not found: " + orderLineId,
                            BASE + "/" + orderLineId))
                    .build();
        }
        return Response.ok(OrderLineResponse.from(line.get())).build();
    }

    /**
     * Maps pipeline exceptions to responses. {@code onIllegalArgument} is 404 for
     * endpoints addressing an order line by id and 400 otherwise.
     */
    static Response failure(Exception e, String path, Response.Status onIllegalArgument) {
        if (e instanceof InsufficientStockException ise) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(ErrorResponse.insufficientStock(ise.getMessage(), path, ise.getProductId(),
                            ise.getRequested().toPlainString(), ise.getAvailable().toPlainString()))
                    .build();
        }
        if (e instanceof ConcurrentReservationConflictException || e instanceof LockAcquisitionException
                || e instanceof IllegalStateException) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(ErrorResponse.conflict(e.getMessage(), path))
                    .build();
        }
        if (e instanceof InvalidPricingContextException) {
            log.error("pricing.config.invalid path={} error={}", path, e.getMessage());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(e.getMessage(), path))
                    .build();
        }
        if (e instanceof IllegalArgumentException) {
            ErrorResponse body = onIllegalArgument == Response.Status.NOT_FOUND
                    ? ErrorResponse.notFound(e.getMessage(), path)
                    : ErrorResponse.badRequest(e.getMessage(), path);
            return Response.status(onIllegalArgument).entity(body).build();
        }
        log.error("request.failed path={} error={}", path, e.getMessage(), e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                .build();
    }
}
