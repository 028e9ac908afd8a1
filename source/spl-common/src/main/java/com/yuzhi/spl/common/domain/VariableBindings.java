package com.yuzhi.spl.common.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dashboard variable values keyed by variable name. A value is either a single string or an
 * ordered list of strings.
 */
public final class VariableBindings {

    private static final VariableBindings EMPTY = new VariableBindings(Collections.emptyMap());

    private final Map<String, List<String>> values;
    private final Map<String, Boolean> multi;

    private VariableBindings(Map<String, Object> raw) {
        Map<String, List<String>> v = new LinkedHashMap<>();
        Map<String, Boolean> m = new LinkedHashMap<>();
        raw.forEach((name, value) -> {
            if (name == null || value == null) {
                return;
            }
            if (value instanceof List<?> list) {
                v.put(name, list.stream().filter(o -> o != null).map(String::valueOf).toList());
                m.put(name, Boolean.TRUE);
            } else {
                v.put(name, List.of(String.valueOf(value)));
                m.put(name, Boolean.FALSE);
            }
        });
        this.values = Collections.unmodifiableMap(v);
        this.multi = Collections.unmodifiableMap(m);
    }

    public static VariableBindings empty() {
        return EMPTY;
    }

    /**
     * Builds bindings from a loosely typed map, as decoded from a JSON request. List values become
     * multi-valued bindings; anything else is converted with {@link String#valueOf(Object)}.
     */
    public static VariableBindings of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        return new VariableBindings(new LinkedHashMap<>(raw));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public boolean isMultiValued(String name) {
        return Boolean.TRUE.equals(multi.get(name));
    }

    public Optional<List<String>> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Map<String, List<String>> asMap() {
        return values;
    }
}
