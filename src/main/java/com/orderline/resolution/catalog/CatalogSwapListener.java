package com.orderline.resolution.catalog;

/**
 * Listener notified after a new catalog snapshot has been published.
 * Caches holding results computed against the previous snapshot implement this
 * to invalidate themselves.
 */
@FunctionalInterface
public interface CatalogSwapListener {

    void onCatalogSwapped(CatalogIndex previous, CatalogIndex current);
}
