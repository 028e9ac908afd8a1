package com.yuzhi.spl.common.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular result for one target: either log rows ({@code time, host, message}) or a single
 * diagnostic row ({@code time} plus {@code warning}, {@code error} or {@code message}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OutputTable {

    public static final String FIELD_TIME = "time";
    public static final String FIELD_HOST = "host";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_WARNING = "warning";
    public static final String FIELD_ERROR = "error";

    /** refId used for the batch-level time range diagnostic. */
    public static final String GUARDRAILS_REF_ID = "guardrails";

    public enum Kind {
        DATA,
        WARNING,
        ERROR,
        GUARDRAIL,
    }

    private final String refId;
    private final Kind kind;
    private final List<String> fields;
    private final List<Map<String, Object>> rows = new ArrayList<>();

    private OutputTable(String refId, Kind kind, List<String> fields) {
        this.refId = refId;
        this.kind = kind;
        this.fields = List.copyOf(fields);
    }

    public static OutputTable data(String refId) {
        return new OutputTable(refId, Kind.DATA, List.of(FIELD_TIME, FIELD_HOST, FIELD_MESSAGE));
    }

    public static OutputTable warning(String refId, String warning, Instant at) {
        return diagnostic(refId, Kind.WARNING, FIELD_WARNING, warning, at);
    }

    public static OutputTable error(String refId, String error, Instant at) {
        return diagnostic(refId, Kind.ERROR, FIELD_ERROR, error, at);
    }

    public static OutputTable rangeViolation(String message, Instant at) {
        return diagnostic(GUARDRAILS_REF_ID, Kind.GUARDRAIL, FIELD_MESSAGE, message, at);
    }

    private static OutputTable diagnostic(String refId, Kind kind, String field, String text, Instant at) {
        OutputTable table = new OutputTable(refId, kind, List.of(FIELD_TIME, field));
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(FIELD_TIME, at);
        row.put(field, text);
        table.rows.add(row);
        return table;
    }

    public void add(LogRow row) {
        if (kind != Kind.DATA) {
            throw new IllegalStateException("cannot append log rows to a " + kind + " table");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(FIELD_TIME, row.time());
        values.put(FIELD_HOST, row.host());
        values.put(FIELD_MESSAGE, row.message());
        rows.add(values);
    }

    public String getRefId() {
        return refId;
    }

    public Kind getKind() {
        return kind;
    }

    public List<String> getFields() {
        return fields;
    }

    public List<Map<String, Object>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    @JsonIgnore
    public int size() {
        return rows.size();
    }

    @JsonIgnore
    public boolean isDiagnostic() {
        return kind != Kind.DATA;
    }

    @Override
    public String toString() {
        return "OutputTable{refId=" + refId + ", kind=" + kind + ", rows=" + rows.size() + "}";
    }
}
