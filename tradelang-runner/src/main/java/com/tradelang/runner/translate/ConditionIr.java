package com.tradelang.runner.translate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One comparison of the JSON strategy form.
 *
 * @param left      field name, indicator call or expression text, or a number
 * @param operator  {@code > < >= <= ==} or {@code crosses_above}/{@code crosses_below}
 * @param right     same forms as {@code left}
 * @param connector AND or OR joining this condition to the next one, null for AND
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionIr(Object left, String operator, Object right, String connector) {}
