package com.tradelang.runner.translate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON intermediate form of a strategy: flat lists of entry and exit conditions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategyIr(List<ConditionIr> entry, List<ConditionIr> exit) {

    public StrategyIr {
        entry = entry != null ? List.copyOf(entry) : List.of();
        exit = exit != null ? List.copyOf(exit) : List.of();
    }
}
