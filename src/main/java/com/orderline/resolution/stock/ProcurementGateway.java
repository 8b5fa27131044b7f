package com.orderline.resolution.stock;

/**
 * Collaborator that turns shortfalls into procurement recommendations.
 */
public interface ProcurementGateway {

    void requestProcurement(ShortfallNotice notice);
}
