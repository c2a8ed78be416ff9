package ch.so.arp.nexa.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.util.StringUtils;

/**
 * Helpers shared by the backends that speak a message based chat protocol.
 */
final class ChatMessages {

    private ChatMessages() {
    }

    static List<Map<String, String>> of(GenerationRequest request) {
        List<Map<String, String>> messages = new ArrayList<>(2);
        if (StringUtils.hasText(request.systemPrompt())) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.prompt()));
        return messages;
    }

    static String join(String baseUrl, String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + path;
    }
}
