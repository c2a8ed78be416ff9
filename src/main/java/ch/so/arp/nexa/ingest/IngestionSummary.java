package ch.so.arp.nexa.ingest;

import java.util.List;

/**
 * Outcome of one ingestion batch. Every source ends up in exactly one of the
 * three lists.
 */
public record IngestionSummary(
        List<IngestedDocument> succeeded,
        List<IngestionFailure> failed,
        List<String> skipped) {

    public IngestionSummary {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
        skipped = List.copyOf(skipped);
    }

    public record IngestedDocument(String documentId, String source, int chunkCount) {
    }

    /**
     * @param code    error code of the failure, {@code IO} for read errors
     */
    public record IngestionFailure(String source, String code, String message) {
    }
}
