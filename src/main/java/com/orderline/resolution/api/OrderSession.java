package com.orderline.resolution.api;

import com.orderline.resolution.audit.AuditAction;
import com.orderline.resolution.audit.AuditService;
import com.orderline.resolution.core.model.OrderLineStatus;
import com.orderline.resolution.core.model.ResolutionResult;
import com.orderline.resolution.core.model.ResolvedOrderLine;
import com.orderline.resolution.logging.LogContext;
import com.orderline.resolution.tracing.Span;
import com.orderline.resolution.tracing.SpanNames;
import com.orderline.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Two-phase order for one customer segment. Lines confirmed through the session hold
 * reserved stock until {@link #commit()} sells all of them; {@link #abort()} or closing
 * without a commit releases every reservation still held.
 *
 * <pre>
 * try (OrderSession order = resolver.beginOrder("restaurant")) {
 *     ResolutionResult tomatoes = order.resolve("2 kg tomatoes");
 *     order.confirm(tomatoes.parsedLine().id(), tomatoes.bestMatch().catalogEntryId());
 *     order.process("5 pcs lemons");
 *     OrderSummary summary = order.commit();
 * }
 * </pre>
 *
 * <p>Not thread-safe; one session belongs to one caller.</p>
 */
public class OrderSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OrderSession.class);

    private final OrderLineResolutionService service;
    private final String customerSegment;
    private final AuditService auditService;
    private final Span orderSpan;
    private final String orderId;
    private final List<ResolvedOrderLine> lines = new ArrayList<>();
    private final List<ProcessedLine> queued = new ArrayList<>();
    private boolean committed = false;
    private boolean closed = false;

    OrderSession(OrderLineResolutionService service, String customerSegment,
                 AuditService auditService, TracingService tracingService) {
        if (customerSegment == null || customerSegment.isBlank()) {
            throw new IllegalArgumentException("customerSegment is required for an order");
        }
        this.service = service;
        this.customerSegment = customerSegment;
        this.auditService = auditService;
        this.orderId = LogContext.generateCorrelationId();
        this.orderSpan = tracingService.startSpan(SpanNames.ORDER_SESSION, Map.of("orderId", orderId));
    }

    public ResolutionResult resolve(String rawText) {
        checkNotClosed();
        return service.resolveLine(rawText);
    }

    /**
     * Confirms a line resolved in this session; its stock stays reserved until commit.
     */
    public ResolvedOrderLine confirm(String parsedLineId, String productId) {
        checkNotClosed();
        ResolvedOrderLine line = service.confirmMatch(parsedLineId, productId, customerSegment);
        lines.add(line);
        return line;
    }

    /**
     * Resolves and, where the tier allows, confirms a line. Lines sent to review are
     * tracked but not part of the commit.
     */
    public ProcessedLine process(String rawText) {
        checkNotClosed();
        ProcessedLine processed = service.processLine(rawText, customerSegment);
        if (processed.isConfirmed()) {
            lines.add(processed.orderLine());
        } else {
            queued.add(processed);
        }
        return processed;
    }

    /**
     * Sells every reserved line. A line that fails to sell stays reserved and is reported
     * in the summary's errors.
     */
    public OrderSummary commit() {
        checkNotClosed();
        try (LogContext logCtx = LogContext.forOrder(orderId)) {
            List<String> errors = new ArrayList<>();
            int fulfilled = 0;
            for (ResolvedOrderLine line : lines) {
                if (line.getStatus() != OrderLineStatus.RESERVED) {
                    continue;
                }
                try {
                    service.fulfill(line.getId());
                    fulfilled++;
                } catch (RuntimeException e) {
                    log.warn("order.line.fulfill.failed orderLine={} reason={}", line.getId(), e.getMessage());
                    errors.add("Failed to fulfill order line " + line.getId() + ": " + e.getMessage());
                }
            }
            committed = true;
            closed = true;

            OrderSummary summary = summary(errors);
            auditService.record(AuditAction.ORDER_COMMITTED, orderId, service.getOptions().getSourceSystem(), Map.of(
                    "segment", customerSegment,
                    "lines", summary.lines().size(),
                    "fulfilled", fulfilled,
                    "total", summary.total().toPlainString()));
            orderSpan.setAttribute(SpanNames.ATTR_LINES, summary.lines().size());
            orderSpan.setStatus(errors.isEmpty() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            orderSpan.close();
            log.info("order.committed orderId={} lines={} fulfilled={} queuedForReview={} total={} errors={}",
                    orderId, summary.lines().size(), fulfilled, queued.size(), summary.total(), errors.size());
            return summary;
        }
    }

    /**
     * Releases every line still reserved.
     */
    public OrderSummary abort() {
        checkNotClosed();
        try (LogContext logCtx = LogContext.forOrder(orderId)) {
            List<String> errors = new ArrayList<>();
            for (ResolvedOrderLine line : lines) {
                if (line.getStatus() != OrderLineStatus.RESERVED) {
                    continue;
                }
                try {
                    service.voidLine(line.getId());
                } catch (RuntimeException e) {
                    log.warn("order.line.release.failed orderLine={} reason={}", line.getId(), e.getMessage());
                    errors.add("Failed to release order line " + line.getId() + ": " + e.getMessage());
                }
            }
            closed = true;

            auditService.record(AuditAction.ORDER_ABORTED, orderId, service.getOptions().getSourceSystem(),
                    Map.of("segment", customerSegment, "lines", lines.size()));
            orderSpan.setAttribute("aborted", "true");
            orderSpan.setStatus(errors.isEmpty() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            orderSpan.close();
            log.info("order.aborted orderId={} lines={} errors={}", orderId, lines.size(), errors.size());
            return summary(errors);
        }
    }

    @Override
    public void close() {
        if (!closed) {
            abort();
        }
    }

    public String getOrderId() {
        return orderId;
    }

    public String getCustomerSegment() {
        return customerSegment;
    }

    public List<ResolvedOrderLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public List<ProcessedLine> getQueuedForReview() {
        return Collections.unmodifiableList(queued);
    }

    public boolean isCommitted() {
        return committed;
    }

    private OrderSummary summary(List<String> errors) {
        BigDecimal total = lines.stream()
                .map(ResolvedOrderLine::getEffectiveTotal)
                .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
        return new OrderSummary(orderId, customerSegment, lines, queued.size(), total, errors);
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("Order session " + orderId + " is closed");
        }
    }
}
