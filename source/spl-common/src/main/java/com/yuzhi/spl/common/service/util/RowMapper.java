package com.yuzhi.spl.common.service.util;

import com.yuzhi.spl.common.domain.LogRow;
import com.yuzhi.spl.common.domain.SearchRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Maps raw search records onto {@code time, host, message} rows.
 *
 * <ul>
 *   <li>time: {@code _time}, or the current instant when missing or unparsable</li>
 *   <li>host: {@code host}, {@code sourceHost}, {@code hosts}, else empty</li>
 *   <li>message: {@code _raw}, {@code message}, {@code _msg}, else empty</li>
 * </ul>
 */
public class RowMapper {

    private static final List<Function<SearchRecord, Optional<String>>> HOST_CHAIN = List.of(
        SearchRecord::host,
        SearchRecord::sourceHost,
        SearchRecord::hosts
    );

    private static final List<Function<SearchRecord, Optional<String>>> MESSAGE_CHAIN = List.of(
        SearchRecord::raw,
        SearchRecord::message,
        SearchRecord::msg
    );

    private final Clock clock;

    public RowMapper() {
        this(Clock.systemUTC());
    }

    public RowMapper(Clock clock) {
        this.clock = clock;
    }

    public LogRow map(SearchRecord record) {
        return new LogRow(resolveTime(record), resolve(record, HOST_CHAIN), resolve(record, MESSAGE_CHAIN));
    }

    Instant resolveTime(SearchRecord record) {
        return record.time().flatMap(SplunkTimes::parse).orElseGet(clock::instant);
    }

    private static String resolve(SearchRecord record, List<Function<SearchRecord, Optional<String>>> chain) {
        for (Function<SearchRecord, Optional<String>> accessor : chain) {
            Optional<String> value = accessor.apply(record);
            if (value.isPresent()) {
                return value.get();
            }
        }
        return "";
    }
}
