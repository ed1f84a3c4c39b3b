package ch.so.arp.rag.text2sql.web;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Incoming payload for knowledge base builds. {@code rules} is an optional
 * business rules document in the same layout as the rules file.
 */
public record BuildRequest(boolean force, JsonNode rules) {
}
