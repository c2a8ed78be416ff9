package ch.so.arp.nexa;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.nexa.index.IndexStats;
import ch.so.arp.nexa.index.VectorIndex;
import ch.so.arp.nexa.llm.ProviderRouter;
import ch.so.arp.nexa.llm.ProviderStatus;

/**
 * Readiness of the service. The service is {@code degraded} while the active
 * language model cannot be reached; retrieval and refusals keep working then.
 */
@RestController
@RequestMapping(path = "/api/health", produces = MediaType.APPLICATION_JSON_VALUE)
public class HealthController {

    private final ProviderRouter providerRouter;
    private final VectorIndex vectorIndex;

    public HealthController(ProviderRouter providerRouter, VectorIndex vectorIndex) {
        this.providerRouter = providerRouter;
        this.vectorIndex = vectorIndex;
    }

    @GetMapping
    public HealthResponse health() {
        ProviderStatus provider = providerRouter.status();
        IndexStats index = vectorIndex.stats();
        return new HealthResponse(provider.ready() ? "ok" : "degraded", provider.ready(),
                provider.ready() ? "All systems operational" : "LLM service unreachable: " + provider.detail(),
                index.entryCount());
    }

    public record HealthResponse(String status, boolean llmConnected, String detail, long indexEntries) {
    }
}
