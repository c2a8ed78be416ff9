package ch.so.arp.nexa.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import ch.so.arp.nexa.error.GlobalExceptionHandler;
import ch.so.arp.nexa.ingest.IngestionSummary.IngestedDocument;

class IngestControllerTest {

    private final IngestionService ingestionService = mock(IngestionService.class);
    private final IngestController controller = new IngestController(ingestionService);

    @Test
    void passesPathsVersionAndTagsToService() {
        IngestionSummary summary = new IngestionSummary(
                List.of(new IngestedDocument("doc-1", "/docs/a.txt", 3)), List.of(), List.of());
        when(ingestionService.ingest(List.of(Path.of("/docs/a.txt")), "2.1", List.of("release", "v2")))
                .thenReturn(summary);

        assertThat(controller.ingest(new IngestRequest(List.of("/docs/a.txt"), "2.1", List.of("release", "v2"))))
                .isSameAs(summary);
    }

    @Test
    void deleteAnswersNotFoundForUnknownDocument() {
        when(ingestionService.delete("doc-1")).thenReturn(true);
        when(ingestionService.delete("missing")).thenReturn(false);

        assertThat(controller.delete("doc-1").getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(controller.delete("missing").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void rejectsRequestWithoutPaths() throws Exception {
        MockMvc mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        mvc.perform(post("/api/ingest").contentType(MediaType.APPLICATION_JSON).content("{\"paths\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("RAG-400"));

        verifyNoInteractions(ingestionService);
    }

    @Test
    void summaryIsSerializedAsJson() throws Exception {
        when(ingestionService.ingest(any(), isNull(), isNull())).thenReturn(new IngestionSummary(
                List.of(new IngestedDocument("doc-1", "/docs/a.txt", 3)), List.of(), List.of("/docs/b.txt")));
        MockMvc mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        mvc.perform(post("/api/ingest").contentType(MediaType.APPLICATION_JSON)
                .content("{\"paths\":[\"/docs\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.succeeded[0].documentId").value("doc-1"))
                .andExpect(jsonPath("$.succeeded[0].chunkCount").value(3))
                .andExpect(jsonPath("$.skipped[0]").value("/docs/b.txt"));
    }
}
