package com.tradelang.runner.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradelang.runner.translate.ConditionIr;

import java.util.List;

/**
 * A strategy as stored on disk. Either {@code dsl} holds the strategy text, or
 * {@code entry} and {@code exit} hold conditions in the JSON strategy form.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StrategyFile(
    String name,
    String description,
    String dsl,
    List<ConditionIr> entry,
    List<ConditionIr> exit
) {
    public static StrategyFile ofDsl(String name, String dsl) {
        return new StrategyFile(name, null, dsl, null, null);
    }

    public boolean hasDsl() {
        return dsl != null && !dsl.isBlank();
    }

    public boolean hasConditions() {
        return entry != null || exit != null;
    }
}
