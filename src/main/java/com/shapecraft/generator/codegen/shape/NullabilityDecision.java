package com.shapecraft.generator.codegen.shape;

import com.shapecraft.generator.codegen.model.NullabilityRule;

import lombok.Value;

@Value
public class NullabilityDecision {
    boolean nullable;
    NullabilityRule rule;
    boolean defensiveGuards;
    boolean emptyCollectionFallback;

    static NullabilityDecision nullable(NullabilityRule rule) {
        return new NullabilityDecision(true, rule, false, false);
    }

    static NullabilityDecision nonNull(NullabilityRule rule) {
        return new NullabilityDecision(false, rule, false, false);
    }
}
