package ch.so.arp.nexa.ingest;

import java.util.List;
import java.util.Optional;

/**
 * Provenance of everything that went into the vector index: the ingested
 * document versions and their chunks. At most one live document exists per
 * source path. Tombstoned documents are kept, their chunks are dropped.
 */
public interface DocumentCatalog {

    /**
     * The current version of a source, if it is not deleted.
     */
    Optional<Document> findLive(String source);

    Optional<Document> find(String documentId);

    /**
     * Record a new live document and make it the current version of its
     * source.
     *
     * @return the version it replaces, still live, if there was one
     */
    Optional<Document> register(Document document, List<Chunk> chunks);

    /**
     * Mark the document deleted and drop its chunks.
     *
     * @return the tombstoned document, empty if it was unknown or already
     *         deleted
     */
    Optional<Document> tombstone(String documentId);

    /**
     * Tombstone every live document.
     *
     * @return the number of documents tombstoned
     */
    int tombstoneAll();

    /**
     * Live documents ordered by source.
     */
    List<Document> liveDocuments();

    List<Chunk> chunks(String documentId);
}
