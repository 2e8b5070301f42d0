package com.herzen.dropout.classification;

import com.herzen.dropout.classification.ClassificationModels.DropoutType;
import com.herzen.dropout.classification.ClassificationModels.RuleContext;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One condition under which a dropout type is reported.
 *
 * @param reasonTemplate renders the human-readable reason when this rule is the first match for its type
 */
public record DropoutRule(DropoutType type,
                          String name,
                          Predicate<RuleContext> predicate,
                          Function<RuleContext, String> reasonTemplate) {
    public boolean matches(RuleContext context) {
        return predicate.test(context);
    }

    public String reason(RuleContext context) {
        return reasonTemplate.apply(context);
    }
}
