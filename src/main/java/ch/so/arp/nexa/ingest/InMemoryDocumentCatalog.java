package ch.so.arp.nexa.ingest;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DocumentCatalog} held in memory. It is empty after a restart, like
 * the in-memory vector index it is paired with.
 */
public class InMemoryDocumentCatalog implements DocumentCatalog {

    private final Map<String, Document> documents = new ConcurrentHashMap<>();
    private final Map<String, List<Chunk>> chunks = new ConcurrentHashMap<>();
    private final Map<String, String> liveBySource = new ConcurrentHashMap<>();

    @Override
    public Optional<Document> findLive(String source) {
        return Optional.ofNullable(liveBySource.get(source)).map(documents::get).filter(document -> !document.deleted());
    }

    @Override
    public Optional<Document> find(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public synchronized Optional<Document> register(Document document, List<Chunk> documentChunks) {
        documents.put(document.id(), document);
        chunks.put(document.id(), List.copyOf(documentChunks));
        String previousId = liveBySource.put(document.source(), document.id());
        return Optional.ofNullable(previousId)
                .filter(id -> !id.equals(document.id()))
                .map(documents::get)
                .filter(previous -> !previous.deleted());
    }

    @Override
    public synchronized Optional<Document> tombstone(String documentId) {
        Document document = documents.get(documentId);
        if (document == null || document.deleted()) {
            return Optional.empty();
        }
        Document deleted = document.withDeleted();
        documents.put(documentId, deleted);
        chunks.remove(documentId);
        liveBySource.remove(document.source(), documentId);
        return Optional.of(deleted);
    }

    @Override
    public synchronized int tombstoneAll() {
        List<String> live = liveDocuments().stream().map(Document::id).toList();
        live.forEach(this::tombstone);
        return live.size();
    }

    @Override
    public List<Document> liveDocuments() {
        return documents.values().stream()
                .filter(document -> !document.deleted())
                .sorted(Comparator.comparing(Document::source))
                .toList();
    }

    @Override
    public List<Chunk> chunks(String documentId) {
        return chunks.getOrDefault(documentId, List.of());
    }
}
