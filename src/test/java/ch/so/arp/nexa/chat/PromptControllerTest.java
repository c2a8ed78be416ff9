package ch.so.arp.nexa.chat;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import ch.so.arp.nexa.error.GlobalExceptionHandler;

class PromptControllerTest {

    private final PromptBuilder promptBuilder = new PromptBuilder("You are the Nexa assistant.",
            "Context:\n{context}\n\nUser question: {question}");
    private final MockMvc mvc = MockMvcBuilders.standaloneSetup(new PromptController(promptBuilder))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();

    @Test
    void readsAndReplacesSystemPrompt() throws Exception {
        mvc.perform(put("/api/prompts").contentType(MediaType.APPLICATION_JSON)
                .content("{\"systemPrompt\":\"Answer in German.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.systemPrompt").value("Answer in German."))
                .andExpect(jsonPath("$.ragPrompt").value("Context:\n{context}\n\nUser question: {question}"));

        mvc.perform(get("/api/prompts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.systemPrompt").value("Answer in German."));
    }

    @Test
    void rejectsRagPromptWithoutQuestion() throws Exception {
        mvc.perform(put("/api/prompts").contentType(MediaType.APPLICATION_JSON)
                .content("{\"ragPrompt\":\"{context}\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("RAG-400"));
    }
}
