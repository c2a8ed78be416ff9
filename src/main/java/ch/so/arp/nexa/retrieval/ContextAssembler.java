package ch.so.arp.nexa.retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins ranked chunks into the context block of the prompt. Chunks are added
 * best first as long as the block stays within the token budget; the first
 * chunk that does not fit ends the block, so lower ranked chunks are the ones
 * dropped and no chunk is ever cut. The block never exceeds the budget: when
 * the best chunk alone is too large, the assembly is empty.
 */
public class ContextAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextAssembler.class);

    static final String SEPARATOR = "\n\n---\n\n";

    private final TokenCounter tokenCounter;
    private final int maxTokens;

    public ContextAssembler(TokenCounter tokenCounter, int maxTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
        this.maxTokens = maxTokens;
    }

    public Assembly assemble(List<RankedChunk> ranked) {
        List<RankedChunk> included = new ArrayList<>();
        StringBuilder context = new StringBuilder();
        for (RankedChunk candidate : ranked) {
            String block = format(candidate);
            String extended = context.length() == 0 ? block : context + SEPARATOR + block;
            int tokens = tokenCounter.count(extended);
            if (tokens > maxTokens) {
                if (included.isEmpty()) {
                    LOGGER.warn("Best chunk {} alone needs {} tokens, budget is {}; no context assembled",
                            candidate.chunk().id(), tokens, maxTokens);
                } else {
                    LOGGER.debug("Context budget of {} tokens reached after {} of {} chunks", maxTokens,
                            included.size(), ranked.size());
                }
                break;
            }
            included.add(candidate);
            context.setLength(0);
            context.append(extended);
        }
        return new Assembly(included, context.toString());
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    private static String format(RankedChunk ranked) {
        return "[Source: " + ranked.chunk().sourceName() + "]\n" + ranked.chunk().text();
    }

    public record Assembly(List<RankedChunk> included, String context) {
    }
}
