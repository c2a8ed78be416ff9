package ch.so.arp.nexa.ingest;

import java.util.Objects;
import java.util.concurrent.locks.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.index.IndexStats;
import ch.so.arp.nexa.index.VectorIndex;

/**
 * Maintenance operations on the vector index for the API layer. Clearing the
 * index also forgets the catalogued documents, so re-ingesting them indexes
 * them again instead of skipping them as unchanged. Both clear and rebuild
 * wait for in-flight document writes to finish.
 */
public class IndexManagementService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexManagementService.class);

    private final VectorIndex vectorIndex;
    private final DocumentCatalog catalog;
    private final IndexWriteGuard writeGuard;

    public IndexManagementService(VectorIndex vectorIndex, DocumentCatalog catalog, IndexWriteGuard writeGuard) {
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.writeGuard = Objects.requireNonNull(writeGuard, "writeGuard");
    }

    public IndexStats stats() {
        return vectorIndex.stats();
    }

    public IndexStats rebuild() {
        Lock exclusive = writeGuard.exclusive();
        exclusive.lock();
        try {
            return vectorIndex.rebuild();
        } finally {
            exclusive.unlock();
        }
    }

    public IndexStats clear() {
        Lock exclusive = writeGuard.exclusive();
        exclusive.lock();
        try {
            vectorIndex.clear();
            int forgotten = catalog.tombstoneAll();
            LOGGER.info("Index cleared, {} documents tombstoned", forgotten);
            return vectorIndex.stats();
        } finally {
            exclusive.unlock();
        }
    }
}
