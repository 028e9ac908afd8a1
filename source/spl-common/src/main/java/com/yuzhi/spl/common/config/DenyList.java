package com.yuzhi.spl.common.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled deny-list of SPL command patterns. Each fragment is a regular expression; the list is
 * matched as a single case-insensitive alternation bounded by word boundaries.
 */
public final class DenyList {

    public static final List<String> DEFAULT_FRAGMENTS = List.of(
        "outputlookup",
        "sendemail",
        "rest",
        "delete",
        "collect",
        "sendalert",
        "runshellscript",
        "script",
        "mcollect",
        "loadjob",
        "map\\s+\\["
    );

    private static final DenyList NONE = new DenyList(Collections.emptyList(), null);

    private final List<String> fragments;
    private final Pattern pattern;

    private DenyList(List<String> fragments, Pattern pattern) {
        this.fragments = fragments;
        this.pattern = pattern;
    }

    public static DenyList none() {
        return NONE;
    }

    public static DenyList defaults() {
        return of(DEFAULT_FRAGMENTS);
    }

    /**
     * Parses newline-separated fragments. Blank lines are ignored.
     *
     * @throws IllegalArgumentException if a fragment is not a valid regular expression
     */
    public static DenyList parse(String text) {
        if (text == null || text.isBlank()) {
            return NONE;
        }
        return of(List.of(text.split("\\r?\\n")));
    }

    public static DenyList of(List<String> rawFragments) {
        List<String> cleaned = new ArrayList<>();
        if (rawFragments != null) {
            int line = 0;
            for (String raw : rawFragments) {
                line++;
                String fragment = raw == null ? "" : raw.trim();
                if (fragment.isEmpty()) {
                    continue;
                }
                try {
                    Pattern.compile(fragment);
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException(
                        "Invalid banned command pattern on line " + line + ": '" + fragment + "' (" + e.getDescription() + ")",
                        e
                    );
                }
                cleaned.add(fragment);
            }
        }
        if (cleaned.isEmpty()) {
            return NONE;
        }
        Pattern compiled = Pattern.compile("\\b(" + String.join("|", cleaned) + ")\\b", Pattern.CASE_INSENSITIVE);
        return new DenyList(List.copyOf(cleaned), compiled);
    }

    public boolean isEmpty() {
        return pattern == null;
    }

    public List<String> fragments() {
        return fragments;
    }

    /**
     * Returns the first denied command found in the query, as written in the query.
     */
    public Optional<String> firstMatch(String query) {
        if (pattern == null || query == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(query);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    @Override
    public String toString() {
        return "DenyList" + fragments;
    }
}
