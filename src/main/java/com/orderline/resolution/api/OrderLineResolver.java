package com.orderline.resolution.api;

import com.orderline.resolution.audit.AuditService;
import com.orderline.resolution.cache.CacheConfig;
import com.orderline.resolution.cache.CaffeineResolutionCache;
import com.orderline.resolution.cache.NoOpResolutionCache;
import com.orderline.resolution.cache.ResolutionCache;
import com.orderline.resolution.catalog.CatalogIndex;
import com.orderline.resolution.catalog.CatalogSnapshotHolder;
import com.orderline.resolution.catalog.CatalogSwapListener;
import com.orderline.resolution.core.model.CatalogEntry;
import com.orderline.resolution.core.model.InvoiceLine;
import com.orderline.resolution.core.model.ResolutionResult;
import com.orderline.resolution.core.model.ResolvedOrderLine;
import com.orderline.resolution.core.model.StockLot;
import com.orderline.resolution.core.model.StockPosition;
import com.orderline.resolution.lock.LocalProductLock;
import com.orderline.resolution.lock.ProductLock;
import com.orderline.resolution.metrics.MetricsService;
import com.orderline.resolution.metrics.NoOpMetricsService;
import com.orderline.resolution.parsing.LineParser;
import com.orderline.resolution.pricing.InMemoryPricingRuleStore;
import com.orderline.resolution.pricing.PricingResolver;
import com.orderline.resolution.pricing.PricingRuleStore;
import com.orderline.resolution.review.InMemoryReviewQueue;
import com.orderline.resolution.review.ReviewQueue;
import com.orderline.resolution.review.ReviewService;
import com.orderline.resolution.rules.AliasTable;
import com.orderline.resolution.rules.DefaultCleanupRules;
import com.orderline.resolution.rules.LineCleanupEngine;
import com.orderline.resolution.scoring.CandidateGenerator;
import com.orderline.resolution.scoring.MatchScorer;
import com.orderline.resolution.stock.InMemoryStockLedger;
import com.orderline.resolution.stock.LoggingProcurementGateway;
import com.orderline.resolution.stock.ProcurementGateway;
import com.orderline.resolution.stock.ReservationManager;
import com.orderline.resolution.stock.StockLedger;
import com.orderline.resolution.stock.StockMovementListener;
import com.orderline.resolution.tracing.NoOpTracingService;
import com.orderline.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point: wires the parser, scorer, policy, stock and pricing components
 * into an {@link OrderLineResolutionService} and exposes the order-line operations.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * OrderLineResolver resolver = OrderLineResolver.builder()
 *     .catalog(CatalogSnapshotHolder.of(entries))
 *     .pricingRuleStore(rules)
 *     .build();
 *
 * ResolutionResult result = resolver.resolveLine("2 kg tomatoes");
 * if (result.decisionTier() == DecisionTier.AUTO) {
 *     ResolvedOrderLine line = resolver.confirmMatch(result.parsedLine().id(),
 *             result.bestMatch().catalogEntryId(), "restaurant");
 *     resolver.fulfill(line.getId());
 * }
 * </pre>
 *
 * <p>Every collaborator has an in-process default, so a resolver needs only a catalog
 * to resolve lines, plus pricing rules to confirm them.</p>
 */
public class OrderLineResolver {
    private static final Logger log = LoggerFactory.getLogger(OrderLineResolver.class);

    private final OrderLineResolutionService service;
    private final ReviewService reviewService;
    private final CatalogSnapshotHolder catalog;
    private final StockLedger stockLedger;
    private final ReservationManager reservationManager;
    private final PricingRuleStore pricingRuleStore;
    private final AuditService auditService;
    private final ResolutionCache resolutionCache;

    private OrderLineResolver(Builder builder) {
        this.catalog = Objects.requireNonNull(builder.catalog, "catalog is required");
        this.stockLedger = builder.stockLedger != null ? builder.stockLedger : new InMemoryStockLedger();
        this.pricingRuleStore = builder.pricingRuleStore != null
                ? builder.pricingRuleStore : new InMemoryPricingRuleStore();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        AliasTable aliasTable = builder.aliasTable != null ? builder.aliasTable : AliasTable.defaults();
        LineCleanupEngine cleanupEngine = builder.cleanupEngine != null
                ? builder.cleanupEngine : DefaultCleanupRules.createDefaultEngine();
        ResolutionOptions options = builder.options;

        // ── Stock ───────────────────────────────────────────────
        ProductLock lock = builder.productLock != null ? builder.productLock : new LocalProductLock();
        ProcurementGateway procurementGateway = builder.procurementGateway != null
                ? builder.procurementGateway : new LoggingProcurementGateway();
        this.reservationManager = new ReservationManager(stockLedger, lock, procurementGateway, metricsService);
        for (StockMovementListener listener : builder.movementListeners) {
            reservationManager.addListener(listener);
        }

        // ── Cache ───────────────────────────────────────────────
        if (builder.resolutionCache != null) {
            this.resolutionCache = builder.resolutionCache;
        } else if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            this.resolutionCache = new CaffeineResolutionCache(builder.cacheConfig);
        } else {
            this.resolutionCache = new NoOpResolutionCache();
        }
        if (resolutionCache instanceof CatalogSwapListener swapListener) {
            catalog.addListener(swapListener);
        }

        // ── Review ──────────────────────────────────────────────
        ReviewQueue reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();

        this.service = new OrderLineResolutionService(
                catalog,
                new LineParser(cleanupEngine, aliasTable),
                new CandidateGenerator(aliasTable),
                new MatchScorer(aliasTable, options.getScoringWeights()),
                new ResolutionPolicy(options),
                reservationManager,
                new PricingResolver(),
                pricingRuleStore,
                reviewQueue,
                auditService,
                resolutionCache,
                metricsService,
                tracingService,
                builder.clock
        );
        this.reviewService = new ReviewService(reviewQueue, service, auditService);

        log.info("resolver.initialized catalogVersion={} entries={} options={}",
                catalog.current().version(), catalog.current().size(), options);
    }

    // ========== Resolution API ==========

    public ResolutionResult resolveLine(String rawText) {
        return service.resolveLine(rawText);
    }

    public List<ResolutionResult> resolveMessage(String message) {
        return service.resolveMessage(message);
    }

    public ResolutionResult resolveInvoiceLine(InvoiceLine invoiceLine) {
        return service.resolveInvoiceLine(invoiceLine);
    }

    public ProcessedLine processLine(String rawText, String customerSegment) {
        return service.processLine(rawText, customerSegment);
    }

    // ========== Order line API ==========

    public ResolvedOrderLine confirmMatch(String parsedLineId, String productId, String customerSegment) {
        return service.confirmMatch(parsedLineId, productId, customerSegment);
    }

    public ResolvedOrderLine fulfill(String orderLineId) {
        return service.fulfill(orderLineId);
    }

    public ResolvedOrderLine voidLine(String orderLineId) {
        return service.voidLine(orderLineId);
    }

    public Optional<ResolvedOrderLine> findLine(String orderLineId) {
        return service.findLine(orderLineId);
    }

    /**
     * Begins a two-phase order; see {@link OrderSession}.
     */
    public OrderSession beginOrder(String customerSegment) {
        return service.beginOrder(customerSegment);
    }

    // ========== Catalog and stock API ==========

    /**
     * Publishes a new catalog snapshot. Resolutions already returned keep the version
     * they were computed with.
     */
    public CatalogIndex reloadCatalog(Collection<CatalogEntry> entries) {
        return catalog.swap(entries);
    }

    public StockLot receiveStock(String lotId, String productId, String unit, BigDecimal quantity) {
        return stockLedger.receive(lotId, productId, unit, quantity);
    }

    public StockPosition stockPosition(String productId) {
        return reservationManager.getChecker().position(productId);
    }

    // ========== Review API ==========

    public ReviewService getReviewService() {
        return reviewService;
    }

    public ResolvedOrderLine approveReview(String reviewId, String reviewerId, String chosenProductId,
                                           String notes) {
        return reviewService.approve(reviewId, reviewerId, chosenProductId, null, notes);
    }

    public void rejectReview(String reviewId, String reviewerId, String notes) {
        reviewService.reject(reviewId, reviewerId, notes);
    }

    // ========== Service access ==========

    public OrderLineResolutionService getService() {
        return service;
    }

    public CatalogSnapshotHolder getCatalog() {
        return catalog;
    }

    public StockLedger getStockLedger() {
        return stockLedger;
    }

    public ReservationManager getReservationManager() {
        return reservationManager;
    }

    public PricingRuleStore getPricingRuleStore() {
        return pricingRuleStore;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public ResolutionCache getResolutionCache() {
        return resolutionCache;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogSnapshotHolder catalog;
        private StockLedger stockLedger;
        private PricingRuleStore pricingRuleStore;
        private AliasTable aliasTable;
        private LineCleanupEngine cleanupEngine;
        private ResolutionOptions options = ResolutionOptions.defaults();
        private ProductLock productLock;
        private ProcurementGateway procurementGateway;
        private final List<StockMovementListener> movementListeners = new ArrayList<>();
        private ReviewQueue reviewQueue;
        private AuditService auditService;
        private ResolutionCache resolutionCache;
        private CacheConfig cacheConfig;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock = Clock.systemDefaultZone();

        public Builder catalog(CatalogSnapshotHolder catalog) {
            this.catalog = catalog;
            return this;
        }

        /**
         * Starts from a fresh snapshot holder over the given entries.
         */
        public Builder catalogEntries(Collection<CatalogEntry> entries) {
            this.catalog = CatalogSnapshotHolder.of(entries);
            return this;
        }

        public Builder stockLedger(StockLedger stockLedger) {
            this.stockLedger = stockLedger;
            return this;
        }

        public Builder pricingRuleStore(PricingRuleStore pricingRuleStore) {
            this.pricingRuleStore = pricingRuleStore;
            return this;
        }

        public Builder aliasTable(AliasTable aliasTable) {
            this.aliasTable = aliasTable;
            return this;
        }

        public Builder cleanupEngine(LineCleanupEngine cleanupEngine) {
            this.cleanupEngine = cleanupEngine;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder productLock(ProductLock productLock) {
            this.productLock = productLock;
            return this;
        }

        public Builder procurementGateway(ProcurementGateway procurementGateway) {
            this.procurementGateway = procurementGateway;
            return this;
        }

        public Builder movementListener(StockMovementListener listener) {
            this.movementListeners.add(listener);
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder resolutionCache(ResolutionCache resolutionCache) {
            this.resolutionCache = resolutionCache;
            return this;
        }

        /**
         * Enables the Caffeine candidate cache. Ignored when a cache instance is set.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Clock that decides which pricing rules are in effect.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public OrderLineResolver build() {
            Objects.requireNonNull(catalog, "catalog is required");
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(clock, "clock is required");
            return new OrderLineResolver(this);
        }
    }
}
