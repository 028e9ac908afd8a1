package com.yuzhi.spl.common.domain;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One slice of a job's result set.
 *
 * @param records records in engine order
 * @param fieldNames field names reported by the engine, possibly empty
 */
public record ResultPage(List<SearchRecord> records, List<String> fieldNames) {

    public ResultPage {
        records = records == null ? Collections.emptyList() : List.copyOf(records);
        fieldNames = fieldNames == null ? Collections.emptyList() : List.copyOf(fieldNames);
    }

    public static ResultPage of(List<SearchRecord> records) {
        return new ResultPage(records, null);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Optional<String> firstFieldName() {
        return fieldNames.stream().filter(name -> name != null && !name.isBlank()).findFirst();
    }
}
