package ch.so.arp.nexa.chat;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints to read and replace the prompt templates. Changes are kept
 * in memory; a restart loads the configured templates again.
 */
@RestController
@RequestMapping(path = "/api/prompts", produces = MediaType.APPLICATION_JSON_VALUE)
public class PromptController {

    private final PromptBuilder promptBuilder;

    public PromptController(PromptBuilder promptBuilder) {
        this.promptBuilder = promptBuilder;
    }

    @GetMapping
    public PromptTemplates templates() {
        return promptBuilder.templates();
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public PromptTemplates update(@RequestBody PromptTemplates.Update update) {
        return promptBuilder.update(update);
    }
}
