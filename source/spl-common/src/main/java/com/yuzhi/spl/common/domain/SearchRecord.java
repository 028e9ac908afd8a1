package com.yuzhi.spl.common.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One raw result record returned by a search job. Field presence varies per query, so every
 * accessor is optional.
 */
public final class SearchRecord {

    public static final String FIELD_TIME = "_time";
    public static final String FIELD_RAW = "_raw";
    public static final String FIELD_HOST = "host";
    public static final String FIELD_SOURCE_HOST = "sourceHost";
    public static final String FIELD_HOSTS = "hosts";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_MSG = "_msg";

    private final Map<String, Object> fields;

    public SearchRecord(Map<String, ?> fields) {
        this.fields = fields == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<Object> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Optional<String> text(String name) {
        return field(name).map(String::valueOf);
    }

    public Optional<String> time() {
        return text(FIELD_TIME);
    }

    public Optional<String> raw() {
        return text(FIELD_RAW);
    }

    public Optional<String> host() {
        return text(FIELD_HOST);
    }

    public Optional<String> sourceHost() {
        return text(FIELD_SOURCE_HOST);
    }

    public Optional<String> hosts() {
        return text(FIELD_HOSTS);
    }

    public Optional<String> message() {
        return text(FIELD_MESSAGE);
    }

    public Optional<String> msg() {
        return text(FIELD_MSG);
    }

    public Optional<String> firstFieldName() {
        return fields.keySet().stream().findFirst();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return "SearchRecord" + fields;
    }
}
