package com.imageanalysis.query;

import com.imageanalysis.shared.model.ResultFilter;
import com.imageanalysis.shared.model.ResultListResponse;
import com.imageanalysis.shared.model.ResultStatus;
import com.imageanalysis.shared.model.ResultSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * <ul>
 * <li>{@code GET /api/results?limit=&fileName=&status=&after=}</li>
 * <li>{@code GET /api/results/{id}}</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/results")
public class ResultController {

    private final QueryService queryService;

    public ResultController(QueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public ResultListResponse list(
            @RequestParam(name = "limit", defaultValue = "10") int limit,
            @RequestParam(name = "fileName", required = false) String fileName,
            @RequestParam(name = "status", required = false) ResultStatus status,
            @RequestParam(name = "after", required = false) Instant after) {
        return queryService.list(limit, new ResultFilter(fileName, after, status));
    }

    @GetMapping("/{id}")
    public ResultSummary get(@PathVariable("id") String id) {
        return queryService.get(id)
                .orElseThrow(() -> new ResultNotFoundException(id));
    }
}
