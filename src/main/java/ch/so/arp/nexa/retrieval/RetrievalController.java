package ch.so.arp.nexa.retrieval;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints to read and tune the retrieval settings at runtime. Fields
 * missing from an update keep their current value.
 */
@RestController
@RequestMapping(path = "/api/retrieval/settings", produces = MediaType.APPLICATION_JSON_VALUE)
public class RetrievalController {

    private final RetrievalPipeline retrievalPipeline;

    public RetrievalController(RetrievalPipeline retrievalPipeline) {
        this.retrievalPipeline = retrievalPipeline;
    }

    @GetMapping
    public RetrievalSettings settings() {
        return retrievalPipeline.settings();
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public RetrievalSettings update(@RequestBody RetrievalSettings.Update update) {
        return retrievalPipeline.updateSettings(update);
    }
}
