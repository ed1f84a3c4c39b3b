package ch.so.arp.rag.text2sql.query;

import java.util.List;
import java.util.Objects;

/**
 * A rendered prompt.
 *
 * @param mode initial generation or repair
 * @param text the prompt text sent to the model
 * @param tokens token count of {@code text}
 * @param includedChunkIds chunks rendered into the schema section
 * @param droppedChunkIds chunks left out to stay within the token budget
 */
public record Prompt(PromptMode mode, String text, int tokens, List<String> includedChunkIds,
        List<String> droppedChunkIds) {

    public Prompt {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(text, "text");
        includedChunkIds = List.copyOf(includedChunkIds);
        droppedChunkIds = List.copyOf(droppedChunkIds);
    }
}
