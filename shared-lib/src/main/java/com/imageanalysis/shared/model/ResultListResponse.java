package com.imageanalysis.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Body of the result listing: the count and a short form of each result.
 */
public class ResultListResponse {

    @JsonProperty("count")
    private final int count;

    @JsonProperty("results")
    private final List<Item> results;

    public ResultListResponse(List<Item> results) {
        this.results = List.copyOf(results);
        this.count = results.size();
    }

    public static ResultListResponse of(List<ResultSummary> summaries) {
        return new ResultListResponse(summaries.stream().map(Item::of).collect(Collectors.toList()));
    }

    public int getCount() {
        return count;
    }

    public List<Item> getResults() {
        return results;
    }

    public static class Item {
        @JsonProperty("id")
        private final String id;

        @JsonProperty("fileName")
        private final String fileName;

        @JsonProperty("analyzedAt")
        private final Instant analyzedAt;

        @JsonProperty("status")
        private final ResultStatus status;

        @JsonProperty("summary")
        private final Map<String, Object> summary;

        public Item(String id, String fileName, Instant analyzedAt, ResultStatus status,
                Map<String, Object> summary) {
            this.id = id;
            this.fileName = fileName;
            this.analyzedAt = analyzedAt;
            this.status = status;
            this.summary = summary;
        }

        static Item of(ResultSummary summary) {
            return new Item(summary.getId(), summary.getFileName(), summary.getAnalyzedAt(),
                    summary.getStatus(), summary.getSummary());
        }

        public String getId() {
            return id;
        }

        public String getFileName() {
            return fileName;
        }

        public Instant getAnalyzedAt() {
            return analyzedAt;
        }

        public ResultStatus getStatus() {
            return status;
        }

        public Map<String, Object> getSummary() {
            return summary;
        }
    }
}
