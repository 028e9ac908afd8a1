package com.yuzhi.spl.common.service.util;

import com.yuzhi.spl.common.domain.VariableBindings;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites dashboard variable references in an SPL template.
 *
 * <p>Recognized reference forms are {@code $name}, {@code ${name}}, {@code ${name:format}} and
 * {@code [[name]]}. A single value is escaped and inserted as-is, so quotes written around the
 * reference in the template stay intact ({@code host="$h*"} becomes {@code host="web-1*"}). A
 * multi-value binding becomes {@code ("v1" OR "v2")}; one element degenerates to {@code "v1"}.
 * References to unbound variables are replaced by the empty string.
 */
public final class VariableInterpolator {

    private static final Pattern REFERENCE = Pattern.compile(
        "\\$(\\w+)|\\$\\{(\\w+)(?::[^}]*)?}|\\[\\[(\\w+)(?::[^\\]]*)?]]"
    );
    private static final Pattern SPECIAL = Pattern.compile("([\"\\\\])");

    private VariableInterpolator() {}

    public static String interpolate(String template, VariableBindings bindings) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        VariableBindings vars = bindings != null ? bindings : VariableBindings.empty();
        Matcher matcher = REFERENCE.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            String name = firstNonNull(matcher.group(1), matcher.group(2), matcher.group(3));
            matcher.appendReplacement(out, Matcher.quoteReplacement(format(name, vars)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Backslash-escapes double quotes and backslashes.
     */
    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        return SPECIAL.matcher(value).replaceAll("\\\\$1");
    }

    private static String format(String name, VariableBindings vars) {
        List<String> values = vars.get(name).orElse(null);
        if (values == null) {
            return "";
        }
        if (!vars.isMultiValued(name)) {
            return values.isEmpty() ? "" : escape(values.get(0));
        }
        List<String> quoted = values.stream().map(v -> "\"" + escape(v) + "\"").toList();
        if (quoted.isEmpty()) {
            return "";
        }
        if (quoted.size() == 1) {
            return quoted.get(0);
        }
        return quoted.stream().collect(Collectors.joining(" OR ", "(", ")"));
    }

    private static String firstNonNull(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return "";
    }
}
