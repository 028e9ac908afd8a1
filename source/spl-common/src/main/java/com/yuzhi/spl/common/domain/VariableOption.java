package com.yuzhi.spl.common.domain;

/**
 * One selectable value for a dashboard variable.
 */
public record VariableOption(String text, String value) {

    public static VariableOption of(String value) {
        return new VariableOption(value, value);
    }
}
