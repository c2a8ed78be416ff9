package ch.so.arp.nexa.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.nexa.embedding.EmbeddingService;
import ch.so.arp.nexa.error.ConfigurationException;
import ch.so.arp.nexa.error.RagException;
import ch.so.arp.nexa.index.VectorEntry;
import ch.so.arp.nexa.index.VectorIndex;
import ch.so.arp.nexa.ingest.IngestionSummary.IngestedDocument;
import ch.so.arp.nexa.ingest.IngestionSummary.IngestionFailure;

/**
 * Drives source files through loading, chunking and embedding into the
 * vector index and keeps the {@link DocumentCatalog} in sync.
 * <p>
 * Files are processed one by one. A file whose content is unchanged since it
 * was last ingested is skipped; a changed file replaces its previous version.
 * A failing file is reported in the summary and does not stop the batch,
 * and whatever it already wrote to the index is removed again. Writes for the
 * same source path never overlap, and no document write overlaps a clear or
 * rebuild of the whole index.
 */
public class IngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionService.class);

    private static final String IO_FAILURE = "IO";

    private static final String INTERNAL_FAILURE = "RAG-500";

    private final DocumentLoader documentLoader;
    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final DocumentCatalog catalog;
    private final IndexWriteGuard writeGuard;
    private final Clock clock;
    private final ConcurrentHashMap<String, ReentrantLock> sourceLocks = new ConcurrentHashMap<>();

    public IngestionService(DocumentLoader documentLoader, Chunker chunker, EmbeddingService embeddingService,
            VectorIndex vectorIndex, DocumentCatalog catalog, IndexWriteGuard writeGuard, Clock clock) {
        this.documentLoader = Objects.requireNonNull(documentLoader, "documentLoader");
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.writeGuard = Objects.requireNonNull(writeGuard, "writeGuard");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public IngestionSummary ingest(List<Path> paths, String version) {
        return ingest(paths, version, List.of());
    }

    /**
     * Ingest files and directories. Directories are walked recursively and
     * only files the loader supports are picked up.
     *
     * @param paths   files or directories, at least one
     * @param version optional version tag stored with every new document
     * @param tags    optional labels stored with every new document
     */
    public IngestionSummary ingest(List<Path> paths, String version, List<String> tags) {
        if (paths == null || paths.isEmpty()) {
            throw new ConfigurationException("at least one path is required for ingestion");
        }
        List<String> documentTags = normalizeTags(tags);
        List<IngestedDocument> succeeded = new ArrayList<>();
        List<IngestionFailure> failed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Path path : paths) {
            Path normalized = path.toAbsolutePath().normalize();
            List<Path> files;
            try {
                files = expand(normalized);
            } catch (IOException ex) {
                LOGGER.warn("Unable to read {}: {}", normalized, ex.getMessage());
                failed.add(new IngestionFailure(normalized.toString(), IO_FAILURE, describe(ex)));
                continue;
            }
            for (Path file : files) {
                ingestFile(file, version, documentTags, succeeded, failed, skipped);
            }
        }

        LOGGER.info("Ingestion finished: {} succeeded, {} failed, {} skipped", succeeded.size(), failed.size(),
                skipped.size());
        return new IngestionSummary(succeeded, failed, skipped);
    }

    /**
     * Delete a document: tombstone it in the catalog and drop its entries
     * from the index.
     *
     * @return {@code false} if no live document has this id
     */
    public boolean delete(String documentId) {
        Optional<Document> document = catalog.find(documentId).filter(found -> !found.deleted());
        if (document.isEmpty()) {
            return false;
        }
        Lock shared = writeGuard.shared();
        ReentrantLock lock = lockFor(document.get().source());
        shared.lock();
        lock.lock();
        try {
            if (catalog.tombstone(documentId).isEmpty()) {
                return false;
            }
            int removed = vectorIndex.remove(documentId);
            LOGGER.info("Deleted document {} ({}), {} index entries removed", documentId,
                    document.get().source(), removed);
            return true;
        } finally {
            lock.unlock();
            shared.unlock();
        }
    }

    public List<Document> documents() {
        return catalog.liveDocuments();
    }

    private List<Path> expand(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        if (!Files.isDirectory(path)) {
            return List.of(path);
        }
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                    .filter(documentLoader::supports)
                    .sorted()
                    .toList();
        }
    }

    private void ingestFile(Path file, String version, List<String> tags, List<IngestedDocument> succeeded,
            List<IngestionFailure> failed, List<String> skipped) {
        String source = file.toString();
        Lock shared = writeGuard.shared();
        ReentrantLock lock = lockFor(source);
        shared.lock();
        lock.lock();
        Document document = null;
        boolean indexed = false;
        try {
            byte[] content = Files.readAllBytes(file);
            String checksum = sha256(content);
            Optional<Document> existing = catalog.findLive(source);
            if (existing.isPresent() && existing.get().checksum().equals(checksum)) {
                LOGGER.debug("Skipping unchanged {}", source);
                skipped.add(source);
                return;
            }

            String text = documentLoader.load(file, content);
            document = new Document(UUID.randomUUID().toString(), source, version, tags, clock.instant(), checksum,
                    false);
            List<Chunk> chunks = chunker.chunk(document.id(), source, text);
            List<float[]> vectors = embeddingService.embedBatch(chunks.stream().map(Chunk::text).toList());
            List<VectorEntry> entries = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                entries.add(VectorEntry.of(chunks.get(i), vectors.get(i)));
            }
            indexed = true;
            vectorIndex.add(entries);

            String documentId = document.id();
            catalog.register(document, chunks).ifPresent(previous -> {
                catalog.tombstone(previous.id());
                vectorIndex.remove(previous.id());
                LOGGER.info("Replaced document {} of {} with {}", previous.id(), source, documentId);
            });
            succeeded.add(new IngestedDocument(document.id(), source, chunks.size()));
            LOGGER.info("Ingested {} as document {} with {} chunks", source, document.id(), chunks.size());
        } catch (RagException ex) {
            LOGGER.warn("Ingestion of {} failed: {}", source, ex.getMessage());
            failed.add(new IngestionFailure(source, ex.getErrorCode().code(), ex.getMessage()));
            rollback(document, indexed);
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.warn("Ingestion of {} failed: {}", source, ex.getMessage());
            failed.add(new IngestionFailure(source, IO_FAILURE, describe(ex)));
            rollback(document, indexed);
        } catch (RuntimeException ex) {
            LOGGER.error("Ingestion of {} failed unexpectedly", source, ex);
            failed.add(new IngestionFailure(source, INTERNAL_FAILURE, describe(ex)));
            rollback(document, indexed);
        } finally {
            lock.unlock();
            shared.unlock();
        }
    }

    /**
     * Remove the entries of a document that failed after its index write was
     * attempted. A document that reached the catalog is left alone.
     */
    private void rollback(Document document, boolean indexed) {
        if (document == null || !indexed) {
            return;
        }
        try {
            if (catalog.find(document.id()).isPresent()) {
                return;
            }
            int removed = vectorIndex.remove(document.id());
            if (removed > 0) {
                LOGGER.info("Rolled back {} index entries of failed document {}", removed, document.id());
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Rollback of document {} failed, its entries stay in the index", document.id(), ex);
        }
    }

    private static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(tag -> !tag.isEmpty())
                .distinct()
                .toList();
    }

    private ReentrantLock lockFor(String source) {
        return sourceLocks.computeIfAbsent(source, key -> new ReentrantLock());
    }

    private static String describe(Exception ex) {
        if (ex instanceof NoSuchFileException) {
            return "No such file: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
