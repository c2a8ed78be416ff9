package ch.so.arp.nexa.retrieval;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Counts tokens with the {@code cl100k_base} encoding used by current OpenAI
 * models. For local models the count is an approximation, which is good
 * enough for budgeting the prompt context.
 */
public class TokenCounter {

    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final Encoding encoding;

    public TokenCounter() {
        this.encoding = REGISTRY.getEncoding(EncodingType.CL100K_BASE);
    }

    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }
}
