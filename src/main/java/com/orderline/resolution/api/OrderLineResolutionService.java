package com.orderline.resolution.api;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.orderline.resolution.audit.AuditAction;
import com.orderline.resolution.audit.AuditService;
import com.orderline.resolution.cache.CandidateKey;
import com.orderline.resolution.cache.ResolutionCache;
import com.orderline.resolution.catalog.CatalogIndex;
import com.orderline.resolution.catalog.CatalogSnapshotHolder;
import com.orderline.resolution.catalog.UnitCompatibility;
import com.orderline.resolution.core.model.CatalogEntry;
import com.orderline.resolution.core.model.DecisionTier;
import com.orderline.resolution.core.model.FulfillmentMethod;
import com.orderline.resolution.core.model.InvoiceLine;
import com.orderline.resolution.core.model.MatchCandidate;
import com.orderline.resolution.core.model.OrderLineStatus;
import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.core.model.ResolutionResult;
import com.orderline.resolution.core.model.ResolvedOrderLine;
import com.orderline.resolution.logging.LogContext;
import com.orderline.resolution.metrics.MetricsService;
import com.orderline.resolution.parsing.LineParser;
import com.orderline.resolution.pricing.PricingContext;
import com.orderline.resolution.pricing.PricingResolver;
import com.orderline.resolution.pricing.PricingRuleStore;
import com.orderline.resolution.review.ReviewItem;
import com.orderline.resolution.review.ReviewQueue;
import com.orderline.resolution.scoring.CandidateGenerator;
import com.orderline.resolution.scoring.MatchScorer;
import com.orderline.resolution.stock.Reservation;
import com.orderline.resolution.stock.ReservationManager;
import com.orderline.resolution.stock.StockAvailabilityChecker;
import com.orderline.resolution.tracing.Span;
import com.orderline.resolution.tracing.SpanNames;
import com.orderline.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Runs the order-line pipeline: parse, generate candidates, score, assign a tier, and on
 * confirmation reserve stock and price the line.
 *
 * <p>Resolution never mutates stock. Every resolution is remembered by parsed-line id for
 * {@link ResolutionOptions#getPendingResultTtlSeconds()} so that a later
 * {@link #confirmMatch} can act on it; a parsed line can be confirmed once.</p>
 */
public class OrderLineResolutionService {
    private static final Logger log = LoggerFactory.getLogger(OrderLineResolutionService.class);

    private final CatalogSnapshotHolder catalog;
    private final LineParser parser;
    private final CandidateGenerator candidateGenerator;
    private final MatchScorer scorer;
    private final ResolutionPolicy policy;
    private final ReservationManager reservationManager;
    private final PricingResolver pricingResolver;
    private final PricingRuleStore pricingRuleStore;
    private final ReviewQueue reviewQueue;
    private final AuditService auditService;
    private final ResolutionCache resolutionCache;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ResolutionOptions options;
    private final Clock clock;

    private final Cache<String, PendingLine> pending;
    private final ConcurrentMap<String, ResolvedOrderLine> orderLines = new ConcurrentHashMap<>();

    public OrderLineResolutionService(
            CatalogSnapshotHolder catalog,
            LineParser parser,
            CandidateGenerator candidateGenerator,
            MatchScorer scorer,
            ResolutionPolicy policy,
            ReservationManager reservationManager,
            PricingResolver pricingResolver,
            PricingRuleStore pricingRuleStore,
            ReviewQueue reviewQueue,
            AuditService auditService,
            ResolutionCache resolutionCache,
            MetricsService metricsService,
            TracingService tracingService,
            Clock clock) {
        this.catalog = catalog;
        this.parser = parser;
        this.candidateGenerator = candidateGenerator;
        this.scorer = scorer;
        this.policy = policy;
        this.reservationManager = reservationManager;
        this.pricingResolver = pricingResolver;
        this.pricingRuleStore = pricingRuleStore;
        this.reviewQueue = reviewQueue;
        this.auditService = auditService;
        this.resolutionCache = resolutionCache;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.options = policy.getOptions();
        this.clock = clock;
        this.pending = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(options.getPendingResultTtlSeconds()))
                .build();
    }

    // ── Resolution ──────────────────────────────────────────────

    public ResolutionResult resolveLine(String rawText) {
        CatalogIndex snapshot = catalog.current();
        return resolve(parser.parse(rawText, snapshot), snapshot, null, LogContext.generateCorrelationId());
    }

    /**
     * Resolves every line of a free-text message against one catalog snapshot.
     *
     * @throws IllegalArgumentException if the message has more lines than allowed
     */
    public List<ResolutionResult> resolveMessage(String message) {
        List<String> rawLines = LineParser.splitMessage(message);
        if (rawLines.size() > options.getMaxMessageLines()) {
            throw new IllegalArgumentException("Message has " + rawLines.size()
                    + " lines, limit is " + options.getMaxMessageLines());
        }
        String correlationId = LogContext.generateCorrelationId();
        CatalogIndex snapshot = catalog.current();
        metricsService.recordMessageSize(rawLines.size());

        try (LogContext logCtx = LogContext.forOrder(correlationId);
             Span span = tracingService.startSpan(SpanNames.RESOLVE_MESSAGE)) {
            span.setAttribute(SpanNames.ATTR_LINES, rawLines.size());
            List<ResolutionResult> results = new ArrayList<>(rawLines.size());
            for (String rawLine : rawLines) {
                results.add(resolve(parser.parse(rawLine, snapshot), snapshot, null, correlationId));
            }
            log.info("message.resolved lines={} auto={} catalogVersion={}", results.size(),
                    results.stream().filter(r -> r.decisionTier() == DecisionTier.AUTO).count(),
                    snapshot.version());
            span.setStatus(Span.SpanStatus.OK);
            return results;
        }
    }

    /**
     * Resolves a supplier invoice line. Explicit quantity and unit win over the parsed
     * ones, and the invoice unit price becomes the cost basis when the line is confirmed.
     */
    public ResolutionResult resolveInvoiceLine(InvoiceLine invoiceLine) {
        CatalogIndex snapshot = catalog.current();
        String unit = invoiceLine.unit() != null && !invoiceLine.unit().isBlank()
                ? invoiceLine.unit().trim().toLowerCase(Locale.ROOT)
                : null;
        ParsedLine parsed = parser.parse(invoiceLine.description(), snapshot)
                .withOverrides(invoiceLine.quantity(), unit);
        return resolve(parsed, snapshot, invoiceLine.unitPrice(), LogContext.generateCorrelationId());
    }

    private ResolutionResult resolve(ParsedLine parsed, CatalogIndex snapshot, BigDecimal invoiceCost,
                                     String correlationId) {
        long start = System.nanoTime();
        try (LogContext logCtx = LogContext.forLine(correlationId, parsed.id());
             Span span = tracingService.startSpan(SpanNames.RESOLVE_LINE,
                     Map.of(SpanNames.ATTR_PARSED_LINE, parsed.id()))) {
            List<MatchCandidate> scored = scoredCandidates(parsed, snapshot);
            ResolutionResult result = flagUnavailable(policy.resolve(parsed, scored, snapshot.version()));
            pending.put(parsed.id(), new PendingLine(result, invoiceCost));

            DecisionTier tier = result.decisionTier();
            span.setAttribute(SpanNames.ATTR_CANDIDATES, scored.size());
            span.setAttribute(SpanNames.ATTR_TIER, tier.name());
            result.best().ifPresent(best -> {
                span.setAttribute(SpanNames.ATTR_PRODUCT, best.catalogEntryId());
                span.setAttribute(SpanNames.ATTR_SCORE, best.totalScore());
            });
            span.setStatus(Span.SpanStatus.OK);

            metricsService.recordResolutionDuration(tier, Duration.ofNanos(System.nanoTime() - start));
            metricsService.incrementLinesResolved(tier);
            if (!result.suggestions().isEmpty()) {
                metricsService.recordMatchScore(result.suggestions().get(0).totalScore());
            }
            auditService.record(AuditAction.LINE_RESOLVED, parsed.id(), options.getSourceSystem(),
                    resolutionDetails(result));
            return result;
        }
    }

    private List<MatchCandidate> scoredCandidates(ParsedLine parsed, CatalogIndex snapshot) {
        CandidateKey key = CandidateKey.of(parsed, snapshot.version());
        Optional<List<MatchCandidate>> cached = resolutionCache.get(key);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();
        List<CatalogEntry> candidates = candidateGenerator.generate(parsed, snapshot);
        List<MatchCandidate> scored = scorer.scoreAll(parsed, candidates);
        resolutionCache.put(key, scored);
        return scored;
    }

    private ResolutionResult flagUnavailable(ResolutionResult result) {
        if (!options.isFlagUnavailableSuggestions() || !result.hasSuggestions()) {
            return result;
        }
        StockAvailabilityChecker checker = reservationManager.getChecker();
        Set<String> unavailable = new LinkedHashSet<>();
        for (MatchCandidate candidate : result.suggestions()) {
            if (!checker.isAvailable(candidate.catalogEntryId())) {
                unavailable.add(candidate.catalogEntryId());
            }
        }
        return unavailable.isEmpty() ? result : result.withUnavailableProducts(unavailable);
    }

    // ── Confirmation ────────────────────────────────────────────

    public ResolvedOrderLine confirmMatch(String parsedLineId, String productId, String customerSegment) {
        return confirmMatch(parsedLineId, productId, customerSegment, options.getSourceSystem(), null);
    }

    /**
     * Confirms a resolved line against the chosen product: prices it, then reserves stock.
     * Allowed for any tier, since the caller made the choice. A pending review raised for
     * the same line is closed as approved.
     *
     * @throws IllegalArgumentException if the parsed line is unknown, expired or already
     *                                  confirmed, or the product is not in the catalog
     * @throws com.orderline.resolution.pricing.InvalidPricingContextException if no pricing
     *                                  rule applies to the segment
     * @throws com.orderline.resolution.stock.InsufficientStockException if stock falls short
     *                                  and shortfalls are not allowed
     */
    public ResolvedOrderLine confirmMatch(String parsedLineId, String productId, String customerSegment,
                                          String actorId, String notes) {
        PendingLine pendingLine = pending.asMap().remove(parsedLineId);
        if (pendingLine == null) {
            throw new IllegalArgumentException("Parsed line " + parsedLineId
                    + " is unknown, expired or already confirmed");
        }
        try (LogContext logCtx = LogContext.forLine(LogContext.generateCorrelationId(), parsedLineId);
             Span span = tracingService.startSpan(SpanNames.CONFIRM_MATCH,
                     Map.of(SpanNames.ATTR_PARSED_LINE, parsedLineId))) {
            try {
                ResolvedOrderLine line = confirm(pendingLine, productId, customerSegment, actorId);
                span.setAttribute(SpanNames.ATTR_PRODUCT, productId);
                span.setAttribute(SpanNames.ATTR_METHOD, line.getFulfillmentMethod().name());
                span.setStatus(Span.SpanStatus.OK);
                closeReview(parsedLineId, actorId, line, notes);
                return line;
            } catch (RuntimeException e) {
                pending.put(parsedLineId, pendingLine);
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    /**
     * The parsed unit when stock in the product's unit can serve it, otherwise the product's unit.
     */
    private static String reservationUnit(ParsedLine parsed, CatalogEntry product) {
        String requested = parsed.unitToken();
        if (requested == null) {
            return product.getUnit();
        }
        if (UnitCompatibility.areCompatible(requested, product.getUnit())
                || UnitCompatibility.convert(BigDecimal.ONE, requested, product.getUnit()).isPresent()) {
            return requested;
        }
        log.debug("line.unit_fallback parsedLine={} requested={} product={} productUnit={}",
                parsed.id(), requested, product.getId(), product.getUnit());
        return product.getUnit();
    }

    private ResolvedOrderLine confirm(PendingLine pendingLine, String productId, String customerSegment,
                                      String actorId) {
        ParsedLine parsed = pendingLine.result().parsedLine();
        CatalogEntry product = catalog.current().findById(productId)
                .orElseThrow(() -> new IllegalArgumentException("Product not found in catalog: " + productId));

        PricingContext context = pricingRuleStore.contextFor(customerSegment, product.getCategory(),
                product.getVolatility(), LocalDate.now(clock));
        BigDecimal cost = pendingLine.invoiceCost() != null ? pendingLine.invoiceCost() : product.getBasePrice();
        BigDecimal unitPrice = pricingResolver.price(cost, context);

        String unit = reservationUnit(parsed, product);
        Reservation reservation = reservationManager.reserve(productId, parsed.quantity(), unit,
                options.isAllowShortfall());

        double confidence = pendingLine.result().candidateFor(productId)
                .map(MatchCandidate::totalScore)
                .orElse(0.0);
        ResolvedOrderLine line = ResolvedOrderLine.builder()
                .parsedLineId(parsed.id())
                .productId(productId)
                .productName(product.getCanonicalName())
                .quantity(parsed.quantity())
                .unit(unit)
                .unitPrice(unitPrice)
                .confidence(confidence)
                .fulfillmentMethod(reservation.method())
                .reservationId(reservation.id())
                .shortfall(reservation.shortfall())
                .build();
        orderLines.put(line.getId(), line);

        metricsService.incrementLinesConfirmed();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orderLineId", line.getId());
        details.put("productId", productId);
        details.put("quantity", parsed.quantity().toPlainString());
        details.put("unitPrice", unitPrice.toPlainString());
        details.put("reservationId", reservation.id());
        details.put("method", reservation.method().name());
        details.put("confidence", confidence);
        auditService.record(AuditAction.MATCH_CONFIRMED, parsed.id(), actorId, details);
        if (reservation.method() == FulfillmentMethod.PROCUREMENT_NEEDED) {
            auditService.record(AuditAction.PROCUREMENT_REQUESTED, line.getId(), actorId, Map.of(
                    "productId", productId,
                    "shortfall", reservation.shortfall().toPlainString()));
        }

        log.info("line.confirmed orderLine={} product={} quantity={} unit={} unitPrice={} method={}",
                line.getId(), productId, parsed.quantity(), unit, unitPrice, reservation.method());
        return line;
    }

    private void closeReview(String parsedLineId, String actorId, ResolvedOrderLine line, String notes) {
        Optional<ReviewItem> review = reviewQueue.findPendingForLine(parsedLineId);
        if (review.isEmpty()) {
            return;
        }
        try {
            reviewQueue.approve(review.get().getId(), actorId, line.getProductId(), line.getId(), notes);
        } catch (IllegalStateException e) {
            log.warn("review.close.skipped reviewItemId={} reason={}", review.get().getId(), e.getMessage());
        }
    }

    /**
     * Resolves a line and confirms it without a human when the tier allows it: always for
     * AUTO, for TOP_SUGGESTION only when unattended automation is enabled. Every other
     * line goes to the review queue and touches neither stock nor prices.
     */
    public ProcessedLine processLine(String rawText, String customerSegment) {
        ResolutionResult result = resolveLine(rawText);
        if (!result.requiresConfirmation() && result.bestMatch() != null) {
            ResolvedOrderLine line = confirmMatch(result.parsedLine().id(),
                    result.bestMatch().catalogEntryId(), customerSegment);
            return ProcessedLine.confirmed(result, line);
        }
        return ProcessedLine.queued(result, submitForReview(result, customerSegment));
    }

    private ReviewItem submitForReview(ResolutionResult result, String customerSegment) {
        Optional<MatchCandidate> top = result.best().or(() -> result.suggestions().stream().findFirst());
        ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                .parsedLineId(result.parsedLine().id())
                .rawText(result.parsedLine().rawText())
                .candidateProductId(top.map(MatchCandidate::catalogEntryId).orElse(null))
                .candidateName(top.map(MatchCandidate::canonicalName).orElse(null))
                .score(top.map(MatchCandidate::totalScore).orElse(0.0))
                .tier(result.decisionTier())
                .customerSegment(customerSegment)
                .build());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reviewItemId", item.getId());
        details.put("tier", item.getTier().name());
        details.put("score", item.getScore());
        if (item.getCandidateProductId() != null) {
            details.put("candidateProductId", item.getCandidateProductId());
        }
        auditService.record(AuditAction.MANUAL_REVIEW_REQUESTED, item.getParsedLineId(),
                options.getSourceSystem(), details);
        log.info("review.submitted reviewItemId={} parsedLineId={} tier={} candidate={}",
                item.getId(), item.getParsedLineId(), item.getTier(), item.getCandidateProductId());
        return item;
    }

    // ── Order line lifecycle ────────────────────────────────────

    /**
     * Sells the line's reservation: reserved stock leaves the lots for good.
     *
     * @throws IllegalArgumentException if the order line is unknown
     * @throws IllegalStateException    if it is not RESERVED
     */
    public ResolvedOrderLine fulfill(String orderLineId) {
        ResolvedOrderLine line = requireLine(orderLineId);
        try (Span span = tracingService.startSpan(SpanNames.FULFILL_LINE,
                Map.of(SpanNames.ATTR_PRODUCT, line.getProductId()))) {
            synchronized (line) {
                requireReserved(line, "fulfill");
                reservationManager.sell(line.getReservationId());
                line.markFulfilled();
            }
            auditService.record(AuditAction.STOCK_SOLD, orderLineId, options.getSourceSystem(), Map.of(
                    "reservationId", line.getReservationId(),
                    "productId", line.getProductId()));
            log.info("line.fulfilled orderLine={} product={}", orderLineId, line.getProductId());
            span.setStatus(Span.SpanStatus.OK);
            return line;
        }
    }

    /**
     * Voids the line: its reservation is released and its price no longer counts.
     *
     * @throws IllegalArgumentException if the order line is unknown
     * @throws IllegalStateException    if it is not RESERVED
     */
    public ResolvedOrderLine voidLine(String orderLineId) {
        ResolvedOrderLine line = requireLine(orderLineId);
        try (Span span = tracingService.startSpan(SpanNames.VOID_LINE,
                Map.of(SpanNames.ATTR_PRODUCT, line.getProductId()))) {
            synchronized (line) {
                requireReserved(line, "void");
                reservationManager.release(line.getReservationId());
                line.markVoided();
            }
            metricsService.incrementLinesVoided();
            auditService.record(AuditAction.LINE_VOIDED, orderLineId, options.getSourceSystem(), Map.of(
                    "reservationId", line.getReservationId(),
                    "productId", line.getProductId()));
            log.info("line.voided orderLine={} product={}", orderLineId, line.getProductId());
            span.setStatus(Span.SpanStatus.OK);
            return line;
        }
    }

    public Optional<ResolvedOrderLine> findLine(String orderLineId) {
        return Optional.ofNullable(orderLines.get(orderLineId));
    }

    /**
     * The remembered resolution of a parsed line that has not been confirmed yet.
     */
    public Optional<ResolutionResult> findPending(String parsedLineId) {
        return Optional.ofNullable(pending.getIfPresent(parsedLineId)).map(PendingLine::result);
    }

    /**
     * Starts a two-phase order for one customer segment.
     */
    public OrderSession beginOrder(String customerSegment) {
        return new OrderSession(this, customerSegment, auditService, tracingService);
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public CatalogSnapshotHolder getCatalog() {
        return catalog;
    }

    private ResolvedOrderLine requireLine(String orderLineId) {
        ResolvedOrderLine line = orderLines.get(orderLineId);
        if (line == null) {
            throw new IllegalArgumentException("Order line not found: " + orderLineId);
        }
        return line;
    }

    private static void requireReserved(ResolvedOrderLine line, String action) {
        if (line.getStatus() != OrderLineStatus.RESERVED) {
            throw new IllegalStateException("Cannot " + action + " order line " + line.getId()
                    + " in status " + line.getStatus());
        }
    }

    private static Map<String, Object> resolutionDetails(ResolutionResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rawText", result.parsedLine().rawText());
        details.put("tier", result.decisionTier().name());
        details.put("suggestions", result.suggestions().size());
        details.put("catalogVersion", result.catalogVersion());
        result.best().ifPresent(best -> {
            details.put("productId", best.catalogEntryId());
            details.put("score", best.totalScore());
        });
        return details;
    }

    /**
     * A resolution awaiting confirmation, with the invoice cost when it came from an invoice.
     */
    private record PendingLine(ResolutionResult result, BigDecimal invoiceCost) {
    }
}
