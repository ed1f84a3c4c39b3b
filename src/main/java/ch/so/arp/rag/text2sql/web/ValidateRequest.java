package ch.so.arp.rag.text2sql.web;

import jakarta.validation.constraints.NotBlank;

public record ValidateRequest(@NotBlank String sql) {
}
