package ch.so.arp.rag.text2sql.web;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for questions. {@code showIntermediate} adds the intent,
 * retrieved chunks, prompts and candidates to the response.
 */
public record QueryRequest(@NotBlank String question, boolean showIntermediate) {
}
