package ch.so.arp.nexa.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ch.so.arp.nexa.embedding.EmbeddingService;
import ch.so.arp.nexa.embedding.HashingEmbeddingProvider;
import ch.so.arp.nexa.error.ConfigurationException;
import ch.so.arp.nexa.index.InMemoryVectorIndex;
import ch.so.arp.nexa.index.VectorEntry;
import ch.so.arp.nexa.ingest.Chunk;

class RetrievalPipelineTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider(384);
    private final InMemoryVectorIndex index = new InMemoryVectorIndex(384);
    private RetrievalPipeline pipeline;

    @BeforeEach
    void setUp() {
        EmbeddingService embeddingService = new EmbeddingService(provider, 16, index::dimension);
        pipeline = new RetrievalPipeline(embeddingService, index, new ContextAssembler(new TokenCounter(), 2000), 4,
                0.35);
        add("doc-deploy", "/docs/deploy.md", "Deploy by running ./deploy.sh.");
        add("doc-cafeteria", "/docs/cafeteria.txt", "The cafeteria opens at noon and closes at two.");
        add("doc-backup", "/docs/backup.txt", "Backup the database every night with the backup tool.");
    }

    @Test
    void findsRelevantChunkForQuestion() {
        RetrievalResult result = pipeline.retrieve("How do I deploy?");

        assertThat(result.hasContext()).isTrue();
        assertThat(result.chunks()).singleElement().satisfies(ranked -> {
            assertThat(ranked.chunk().documentId()).isEqualTo("doc-deploy");
            assertThat(ranked.score()).isGreaterThan(0.8);
        });
        assertThat(result.context()).isEqualTo("[Source: deploy.md]\nDeploy by running ./deploy.sh.");
    }

    @Test
    void reportsNoRelevantContextForUnrelatedQuestion() {
        RetrievalResult result = pipeline.retrieve("What is the weather?");

        assertThat(result.relevance()).isEqualTo(RetrievalResult.Relevance.NO_RELEVANT_CONTEXT);
        assertThat(result.chunks()).isEmpty();
        assertThat(result.context()).isEmpty();
    }

    @Test
    void thresholdIsInclusive() {
        double best = pipeline.retrieve("backup database", 1, -1.0).chunks().get(0).score();

        RetrievalResult atThreshold = pipeline.retrieve("backup database", 4, best);
        assertThat(atThreshold.chunks()).extracting(ranked -> ranked.chunk().documentId())
                .containsExactly("doc-backup");
        assertThat(pipeline.retrieve("backup database", 4, Math.nextUp(best)).hasContext()).isFalse();
    }

    @Test
    void negativeThresholdAdmitsUpToKHits() {
        RetrievalResult result = pipeline.retrieve("backup database", 2, -1.0);

        assertThat(result.chunks()).hasSize(2);
        assertThat(result.chunks().get(0).chunk().documentId()).isEqualTo("doc-backup");
    }

    @Test
    void emptyIndexGivesNoRelevantContext() {
        InMemoryVectorIndex empty = new InMemoryVectorIndex(384);
        RetrievalPipeline onEmpty = new RetrievalPipeline(new EmbeddingService(provider, 16, empty::dimension), empty,
                new ContextAssembler(new TokenCounter(), 2000), 4, 0.0);

        assertThat(onEmpty.retrieve("How do I deploy?").hasContext()).isFalse();
    }

    @Test
    void refusesWhenBestChunkDoesNotFitContextBudget() {
        RetrievalPipeline tightBudget = new RetrievalPipeline(new EmbeddingService(provider, 16, index::dimension),
                index, new ContextAssembler(new TokenCounter(), 5), 4, 0.35);

        RetrievalResult result = tightBudget.retrieve("How do I deploy?");

        assertThat(result.relevance()).isEqualTo(RetrievalResult.Relevance.NO_RELEVANT_CONTEXT);
        assertThat(result.context()).isEmpty();
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> pipeline.retrieve("deploy", 0, 0.3)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> pipeline.retrieve("deploy", 4, 1.5)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> pipeline.retrieve("deploy", 4, Double.NaN))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> pipeline.retrieve("  ")).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void updatedSettingsApplyToLaterRetrievals() {
        assertThat(pipeline.retrieve("What is the weather?").hasContext()).isFalse();

        RetrievalSettings updated = pipeline.updateSettings(new RetrievalSettings.Update(2, -1.0));

        assertThat(updated).isEqualTo(new RetrievalSettings(2, -1.0));
        assertThat(pipeline.retrieve("What is the weather?").chunks()).hasSize(2);
        assertThat(pipeline.updateSettings(new RetrievalSettings.Update(null, 0.35)))
                .isEqualTo(new RetrievalSettings(2, 0.35));
    }

    @Test
    void invalidSettingsUpdateKeepsCurrentSettings() {
        assertThatThrownBy(() -> pipeline.updateSettings(new RetrievalSettings.Update(0, null)))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> pipeline.updateSettings(new RetrievalSettings.Update(8, 1.5)))
                .isInstanceOf(ConfigurationException.class);

        assertThat(pipeline.settings()).isEqualTo(new RetrievalSettings(4, 0.35));
    }

    private void add(String documentId, String source, String text) {
        Chunk chunk = new Chunk(Chunk.idFor(documentId, 0), documentId, source, 0, text, 0, text.length());
        index.add(List.of(VectorEntry.of(chunk, provider.embed(text))));
    }
}
