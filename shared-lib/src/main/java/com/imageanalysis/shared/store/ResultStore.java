package com.imageanalysis.shared.store;

import com.imageanalysis.shared.model.ResultFilter;
import com.imageanalysis.shared.model.ResultSummary;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Committed results, one per image id.
 */
public interface ResultStore {

    int MAX_LIST_LIMIT = 200;

    /**
     * Newest first; ties by id so listings are stable.
     */
    Comparator<ResultSummary> NEWEST_FIRST = Comparator
            .comparing(ResultSummary::getAnalyzedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ResultSummary::getId);

    /**
     * Insert or overwrite by id; repeating it with the same summary changes nothing.
     */
    void upsert(ResultSummary summary);

    Optional<ResultSummary> get(String id);

    List<ResultSummary> list(int limit, ResultFilter filter);

    static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
    }
}
