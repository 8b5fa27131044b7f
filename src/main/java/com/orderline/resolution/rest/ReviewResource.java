package com.orderline.resolution.rest;

import com.orderline.resolution.api.Page;
import com.orderline.resolution.api.PageRequest;
import com.orderline.resolution.core.model.DecisionTier;
import com.orderline.resolution.core.model.ResolvedOrderLine;
import com.orderline.resolution.rest.dto.ErrorResponse;
import com.orderline.resolution.rest.dto.OrderLineResponse;
import com.orderline.resolution.rest.dto.ReviewDecisionRequest;
import com.orderline.resolution.rest.dto.ReviewItemResponse;
import com.orderline.resolution.review.ReviewItem;
import com.orderline.resolution.review.ReviewService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * REST resource for the manual review queue. Approving an item confirms its line,
 * which reserves stock.
 */
@Path("/api/v1/reviews")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Manual Review", description = "Review queue for order lines that need a human decision")
public class ReviewResource {
    private static final Logger log = LoggerFactory.getLogger(ReviewResource.class);
    private static final String BASE = "/api/v1/reviews";

    private final ReviewService reviewService;

    @Inject
    public ReviewResource(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    /**
     * GET /api/v1/reviews?page=0&size=20
     */
    @GET
    @Operation(summary = "List pending reviews",
            description = "Returns pending review items, optionally filtered by decision tier or score range.")
    @APIResponse(responseCode = "200", description = "One page of pending items")
    @APIResponse(responseCode = "400", description = "Unknown tier or invalid paging")
    public Response getPendingReviews(
            @QueryParam("page") @DefaultValue("0") int page,
            @QueryParam("size") @DefaultValue("20") int size,
            @QueryParam("tier") String tier,
            @QueryParam("minScore") Double minScore,
            @QueryParam("maxScore") Double maxScore) {
        try {
            PageRequest pageRequest = PageRequest.of(page, size);
            Page<ReviewItem> result;

            if (tier != null && !tier.isBlank()) {
                result = reviewService.getPendingReviewsByTier(DecisionTier.valueOf(tier.trim()), pageRequest);
            } else if (minScore != null && maxScore != null) {
                result = reviewService.getPendingReviewsByScoreRange(minScore, maxScore, pageRequest);
            } else {
                result = reviewService.getPendingReviews(pageRequest);
            }

            Page<ReviewItemResponse> body = new Page<>(
                    result.content().stream().map(ReviewItemResponse::from).toList(),
                    result.totalElements(), result.pageNumber(), result.pageSize());
            return Response.ok(body).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), BASE))
                    .build();
        } catch (Exception e) {
            log.error("getPendingReviews.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(e.getMessage(), BASE))
                    .build();
        }
    }

    /**
     * GET /api/v1/reviews/count
     */
    @GET
    @Path("/count")
    @Operation(summary = "Count pending reviews")
    public Response getPendingCount() {
        try {
            return Response.ok(Map.of("pendingCount", reviewService.getPendingCount())).build();
        } catch (Exception e) {
            log.error("getPendingCount.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(e.getMessage(), BASE + "/count"))
                    .build();
        }
    }

    /**
     * GET /api/v1/reviews/{id}
     */
    @GET
    @Path("/{id}")
    @Operation(summary = "Get review item")
    @APIResponse(responseCode = "200", description = "Review item found")
    @APIResponse(responseCode = "404", description = "Review item not found")
    public Response getReviewItem(@Parameter(description = "Review item ID") @PathParam("id") String reviewId) {
        Optional<ReviewItem> item = reviewService.getReviewItem(reviewId);
        if (item.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound("Review item not found: " + reviewId, BASE + "/" + reviewId))
                    .build();
        }
        return Response.ok(ReviewItemResponse.from(item.get())).build();
    }

    /**
     * POST /api/v1/reviews/{id}/approve
     */
    @POST
    @Path("/{id}/approve")
    @Operation(summary = "Approve review",
            description = "Confirms the line with the queued candidate or the reviewer's chosen product, reserving stock.")
    @APIResponse(responseCode = "200", description = "Line confirmed")
    @APIResponse(responseCode = "404", description = "Review item not found")
    @APIResponse(responseCode = "409", description = "Item no longer pending, or stock conflict")
    public Response approve(@Parameter(description = "Review item ID") @PathParam("id") String reviewId,
                            ReviewDecisionRequest request) {
        String path = BASE + "/" + reviewId + "/approve";
        try {
            ResolvedOrderLine line = reviewService.approve(reviewId, request.reviewerId(),
                    request.chosenProductId(), request.customerSegment(), request.notes());
            return Response.ok(OrderLineResponse.from(line)).build();
        } catch (Exception e) {
            return OrderLineResource.failure(e, path, Response.Status.NOT_FOUND);
        }
    }

    /**
     * POST /api/v1/reviews/{id}/reject
     */
    @POST
    @Path("/{id}/reject")
    @Operation(summary = "Reject review", description = "Closes the item without confirming the line.")
    @APIResponse(responseCode = "200", description = "Review rejected")
    @APIResponse(responseCode = "404", description = "Review item not found")
    @APIResponse(responseCode = "409", description = "Item no longer pending")
    public Response reject(@Parameter(description = "Review item ID") @PathParam("id") String reviewId,
                           ReviewDecisionRequest request) {
        String path = BASE + "/" + reviewId + "/reject";
        try {
            reviewService.reject(reviewId, request.reviewerId(), request.notes());
            return Response.ok(Map.of("status", "rejected", "reviewId", reviewId)).build();
        } catch (Exception e) {
            return OrderLineResource.failure(e, path, Response.Status.NOT_FOUND);
        }
    }
}
