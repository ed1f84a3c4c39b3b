package ch.so.arp.rag.text2sql;

import com.fasterxml.jackson.annotation.JsonValue;

import ch.so.arp.rag.text2sql.validation.LoopState;
import ch.so.arp.rag.text2sql.validation.ValidationOutcome;

/**
 * Outcome tag of a query: success, the kind of the last failure, or
 * cancellation.
 */
public enum QueryOutcome {

    SUCCESS("success"),
    SYNTAX_ERROR("syntax_error"),
    EXECUTION_ERROR("execution_error"),
    POLICY_VIOLATION("policy_violation"),
    CANCELLED("cancelled");

    private final String label;

    QueryOutcome(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    static QueryOutcome of(LoopState state, ValidationOutcome lastOutcome) {
        switch (state) {
            case SUCCESS:
                return SUCCESS;
            case CANCELLED:
                return CANCELLED;
            case REJECTED:
                return POLICY_VIOLATION;
            case EXHAUSTED:
                if (lastOutcome != null && lastOutcome.kind() == ValidationOutcome.Kind.EXECUTION_ERROR) {
                    return EXECUTION_ERROR;
                }
                return SYNTAX_ERROR;
            default:
                throw new IllegalArgumentException("Not a terminal state: " + state);
        }
    }
}
