package ch.so.arp.rag.text2sql.validation;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tagged result of checking or executing one candidate statement.
 *
 * @param kind outcome tag
 * @param message parser, engine or policy message; empty on success
 * @param line 1-based line of a syntax error, {@code null} if unknown
 * @param column 1-based column of a syntax error, {@code null} if unknown
 * @param offset 0-based character offset of a syntax error, {@code -1} if unknown
 * @param result rows of a successful execution, {@code null} if not executed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationOutcome(Kind kind, String message, Integer line, Integer column, int offset,
        ExecutionResult result) {

    public ValidationOutcome {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }

    public static ValidationOutcome success(ExecutionResult result) {
        return new ValidationOutcome(Kind.SUCCESS, "", null, null, -1, result);
    }

    public static ValidationOutcome syntaxError(String message, Integer line, Integer column, int offset) {
        return new ValidationOutcome(Kind.SYNTAX_ERROR, message, line, column, offset, null);
    }

    public static ValidationOutcome executionError(String message) {
        return new ValidationOutcome(Kind.EXECUTION_ERROR, message, null, null, -1, null);
    }

    public static ValidationOutcome policyViolation(String message) {
        return new ValidationOutcome(Kind.POLICY_VIOLATION, message, null, null, -1, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /**
     * Whether another generation attempt may fix the failure.
     */
    @JsonIgnore
    public boolean isRepairable() {
        return kind == Kind.SYNTAX_ERROR || kind == Kind.EXECUTION_ERROR;
    }

    /**
     * Human readable location of a syntax error, empty if unknown.
     */
    public String position() {
        if (line == null) {
            return offset >= 0 ? "offset " + offset : "";
        }
        return "line " + line + ", column " + column + (offset >= 0 ? " (offset " + offset + ")" : "");
    }

    public enum Kind {
        SUCCESS("success"),
        SYNTAX_ERROR("syntax_error"),
        EXECUTION_ERROR("execution_error"),
        POLICY_VIOLATION("policy_violation");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}
