package com.orderline.resolution.cdi;

import com.orderline.resolution.api.OrderLineResolver;
import com.orderline.resolution.api.ResolutionOptions;
import com.orderline.resolution.cache.CacheConfig;
import com.orderline.resolution.catalog.CatalogLoadException;
import com.orderline.resolution.catalog.CatalogSnapshotHolder;
import com.orderline.resolution.catalog.JsonCatalogLoader;
import com.orderline.resolution.lock.LocalProductLock;
import com.orderline.resolution.lock.LockConfig;
import com.orderline.resolution.metrics.MetricsService;
import com.orderline.resolution.metrics.MicrometerMetricsService;
import com.orderline.resolution.metrics.NoOpMetricsService;
import com.orderline.resolution.pricing.InMemoryPricingRuleStore;
import com.orderline.resolution.pricing.InvalidPricingContextException;
import com.orderline.resolution.pricing.JsonPricingRuleLoader;
import com.orderline.resolution.pricing.PricingRuleStore;
import com.orderline.resolution.review.ReviewService;
import com.orderline.resolution.scoring.ScoringWeights;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * CDI producer that wires the order-line resolver from MicroProfile Config properties.
 *
 * <p>The catalog and the pricing rules are read from JSON files at startup. A path
 * starting with {@code classpath:} is looked up as a resource.</p>
 *
 * <pre>
 * order-resolution.catalog.path=/srv/data/catalog.json
 * order-resolution.pricing.rules-path=classpath:pricing-rules.json
 * order-resolution.resolution.auto-threshold=50
 * </pre>
 *
 * <p>When the container provides a Micrometer {@link MeterRegistry}, pipeline metrics are
 * registered on it.</p>
 */
@ApplicationScoped
public class OrderLineResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(OrderLineResolutionProducer.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    // ── Data ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "order-resolution.catalog.path")
    Optional<String> catalogPath;

    @Inject
    @ConfigProperty(name = "order-resolution.pricing.rules-path")
    Optional<String> pricingRulesPath;

    // ── Resolution Thresholds ─────────────────────────────────

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.auto-threshold", defaultValue = "50")
    double autoThreshold;

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.top-suggestion-threshold", defaultValue = "25")
    double topSuggestionThreshold;

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.suggestion-list-threshold", defaultValue = "10")
    double suggestionListThreshold;

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.max-suggestions", defaultValue = "20")
    int maxSuggestions;

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.allow-unattended-top-suggestion", defaultValue = "false")
    boolean allowUnattendedTopSuggestion;

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.allow-shortfall", defaultValue = "true")
    boolean allowShortfall;

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.generous-weights", defaultValue = "false")
    boolean generousWeights;

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.max-message-lines", defaultValue = "500")
    int maxMessageLines;

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.pending-ttl-seconds", defaultValue = "3600")
    long pendingTtlSeconds;

    @Inject
    @ConfigProperty(name = "order-resolution.resolution.source-system", defaultValue = "SYSTEM")
    String sourceSystem;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "order-resolution.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "order-resolution.cache.max-size", defaultValue = "5000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "order-resolution.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ── Stock Lock ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "order-resolution.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "order-resolution.lock.fair", defaultValue = "true")
    boolean lockFair;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public OrderLineResolver orderLineResolver() {
        ResolutionOptions options = ResolutionOptions.builder()
                .autoThreshold(autoThreshold)
                .topSuggestionThreshold(topSuggestionThreshold)
                .suggestionListThreshold(suggestionListThreshold)
                .maxSuggestions(maxSuggestions)
                .allowUnattendedTopSuggestion(allowUnattendedTopSuggestion)
                .allowShortfall(allowShortfall)
                .scoringWeights(generousWeights ? ScoringWeights.generous() : ScoringWeights.defaults())
                .maxMessageLines(maxMessageLines)
                .pendingResultTtlSeconds(pendingTtlSeconds)
                .sourceSystem(sourceSystem)
                .build();

        CatalogSnapshotHolder catalog = new CatalogSnapshotHolder();
        catalogPath.ifPresentOrElse(
                path -> {
                    try (InputStream in = open(path)) {
                        new JsonCatalogLoader().loadInto(in, catalog);
                    } catch (IOException e) {
                        throw new CatalogLoadException("Failed to read catalog from " + path, e);
                    }
                },
                () -> log.warn("catalog.path.missing starting with an empty catalog"));

        PricingRuleStore ruleStore = new InMemoryPricingRuleStore();
        pricingRulesPath.ifPresentOrElse(
                path -> {
                    try (InputStream in = open(path)) {
                        new JsonPricingRuleLoader().loadInto(in, ruleStore);
                    } catch (IOException e) {
                        throw new InvalidPricingContextException("Failed to read pricing rules from " + path, e);
                    }
                },
                () -> log.warn("pricing.rules.missing confirmations will fail until rules are loaded"));

        MetricsService metrics = meterRegistry.isResolvable()
                ? new MicrometerMetricsService(meterRegistry.get())
                : new NoOpMetricsService();

        log.info("Producing OrderLineResolver: products={} autoThreshold={} cache={} lockTimeoutMs={}",
                catalog.current().size(), autoThreshold, cacheEnabled, lockTimeoutMs);

        return OrderLineResolver.builder()
                .catalog(catalog)
                .pricingRuleStore(ruleStore)
                .options(options)
                .cacheConfig(new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled))
                .productLock(new LocalProductLock(new LockConfig(lockTimeoutMs, lockFair)))
                .metricsService(metrics)
                .build();
    }

    @Produces
    @ApplicationScoped
    public ReviewService reviewService(OrderLineResolver resolver) {
        return resolver.getReviewService();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    static InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            InputStream in = OrderLineResolutionProducer.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("Classpath resource not found: " + resource);
            }
            return in;
        }
        return Files.newInputStream(Path.of(location));
    }
}
