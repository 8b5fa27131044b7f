package com.orderline.resolution.catalog;

import com.orderline.resolution.core.model.CatalogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link CatalogIndex} and publishes rebuilt snapshots atomically.
 * Readers always see either the old or the new index in full, never a partial one.
 *
 * <p>The holder is passed explicitly to the components that need it; there is no
 * global catalog.</p>
 */
public class CatalogSnapshotHolder {
    private static final Logger log = LoggerFactory.getLogger(CatalogSnapshotHolder.class);

    private final AtomicReference<CatalogIndex> current;
    private final List<CatalogSwapListener> listeners = new CopyOnWriteArrayList<>();

    public CatalogSnapshotHolder() {
        this(CatalogIndex.empty());
    }

    public CatalogSnapshotHolder(CatalogIndex initial) {
        this.current = new AtomicReference<>(initial);
    }

    public static CatalogSnapshotHolder of(Collection<CatalogEntry> entries) {
        return new CatalogSnapshotHolder(CatalogIndex.of(entries, 1L));
    }

    public CatalogIndex current() {
        return current.get();
    }

    /**
     * Builds a new index from the given entries and publishes it.
     * The previous index stays in place if the entries are invalid.
     *
     * @return the published index
     */
    public CatalogIndex swap(Collection<CatalogEntry> entries) {
        CatalogIndex previous;
        CatalogIndex next;
        do {
            previous = current.get();
            next = CatalogIndex.of(entries, previous.version() + 1);
        } while (!current.compareAndSet(previous, next));

        log.info("catalog.swapped version={} entries={} units={}",
                next.version(), next.size(), next.unitVocabulary().size());
        for (CatalogSwapListener listener : listeners) {
            listener.onCatalogSwapped(previous, next);
        }
        return next;
    }

    public void addListener(CatalogSwapListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CatalogSwapListener listener) {
        listeners.remove(listener);
    }
}
