package com.imageanalysis.query;

import com.imageanalysis.shared.model.ResultFilter;
import com.imageanalysis.shared.model.ResultListResponse;
import com.imageanalysis.shared.model.ResultSummary;
import com.imageanalysis.shared.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Read side over the result store. Sees only committed results.
 */
public class QueryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    public static final int DEFAULT_LIMIT = 10;

    private final ResultStore resultStore;

    public QueryService(ResultStore resultStore) {
        this.resultStore = resultStore;
    }

    /**
     * Newest results first. The limit is clamped to the store's bounds.
     */
    public ResultListResponse list(int limit, ResultFilter filter) {
        List<ResultSummary> results = resultStore.list(limit, filter);
        logger.debug("Listed {} results (limit {})", results.size(), limit);
        return ResultListResponse.of(results);
    }

    public Optional<ResultSummary> get(String id) {
        return resultStore.get(id);
    }
}
