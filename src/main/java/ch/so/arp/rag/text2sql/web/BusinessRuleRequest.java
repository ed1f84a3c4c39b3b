package ch.so.arp.rag.text2sql.web;

import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.rules.RuleKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Incoming payload for a single business rule. A missing scope means the
 * rule is general.
 */
public record BusinessRuleRequest(String scope, @NotNull RuleKind kind, @NotBlank String key, String value) {

    BusinessRule toRule() {
        return new BusinessRule(scope, kind, key, value);
    }
}
