package com.yuzhi.spl.common.domain;

/**
 * One panel query in a batch.
 *
 * @param refId identifier of the target, unique within a batch
 * @param queryText raw SPL template, before variable interpolation
 * @param hide when true the target produces no output table
 */
public record QueryTarget(String refId, String queryText, boolean hide) {

    public QueryTarget {
        if (queryText == null) {
            queryText = "";
        }
    }

    public static QueryTarget of(String refId, String queryText) {
        return new QueryTarget(refId, queryText, false);
    }
}
