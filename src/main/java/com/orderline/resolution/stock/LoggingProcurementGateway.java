package com.orderline.resolution.stock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default gateway: logs each shortfall for a downstream procurement process to pick up.
 */
public class LoggingProcurementGateway implements ProcurementGateway {
    private static final Logger log = LoggerFactory.getLogger(LoggingProcurementGateway.class);

    @Override
    public void requestProcurement(ShortfallNotice notice) {
        log.warn("procurement.requested product={} shortfall={} unit={} urgency={} reservation={}",
                notice.productId(), notice.shortfall(), notice.unit(), notice.urgency(), notice.reservationId());
    }
}
