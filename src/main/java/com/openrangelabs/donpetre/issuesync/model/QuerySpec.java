package com.openrangelabs.donpetre.issuesync.model;

import java.util.List;

/**
 * Immutable description of a remote search: query text, fields, page size, result cap
 * and an optional "only items after key X" predicate used when resuming.
 */
public class QuerySpec {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int DEFAULT_MAX_RESULTS = 1000;
    public static final List<String> DEFAULT_FIELDS = List.of(
            "summary", "status", "assignee", "priority", "created",
            "updated", "description", "issuetype", "project");

    private final String query;
    private final List<String> fields;
    private final int pageSize;
    private final int maxResults;
    private final String resumeAfterKey;

    private QuerySpec(Builder builder) {
        this.query = builder.query.trim();
        this.fields = List.copyOf(builder.fields);
        this.pageSize = builder.pageSize;
        this.maxResults = builder.maxResults;
        this.resumeAfterKey = builder.resumeAfterKey;
    }

    public static Builder builder(String query) {
        return new Builder(query);
    }

    public static QuerySpec of(String query) {
        return builder(query).build();
    }

    /**
     * Same query restricted to items whose key sorts after {@code lastKey}
     */
    public QuerySpec resumingAfter(String lastKey) {
        return toBuilder().resumeAfterKey(lastKey).build();
    }

    public QuerySpec withMaxResults(int maxResults) {
        return toBuilder().maxResults(maxResults).build();
    }

    public boolean hasResumeKey() {
        return resumeAfterKey != null && !resumeAfterKey.isBlank();
    }

    public Builder toBuilder() {
        return new Builder(query)
                .fields(fields)
                .pageSize(pageSize)
                .maxResults(maxResults)
                .resumeAfterKey(resumeAfterKey);
    }

    // Getters
    public String getQuery() { return query; }
    public List<String> getFields() { return fields; }
    public int getPageSize() { return pageSize; }
    public int getMaxResults() { return maxResults; }
    public String getResumeAfterKey() { return resumeAfterKey; }

    public static class Builder {
        private final String query;
        private List<String> fields = DEFAULT_FIELDS;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private String resumeAfterKey;

        private Builder(String query) {
            if (query == null || query.isBlank()) {
                throw new IllegalArgumentException("Query must not be empty");
            }
            this.query = query;
        }

        public Builder fields(List<String> fields) {
            if (fields != null && !fields.isEmpty()) {
                this.fields = fields;
            }
            return this;
        }

        public Builder pageSize(int pageSize) {
            if (pageSize < 1) {
                throw new IllegalArgumentException("Page size must be positive: " + pageSize);
            }
            this.pageSize = pageSize;
            return this;
        }

        public Builder maxResults(int maxResults) {
            if (maxResults < 0) {
                throw new IllegalArgumentException("Result cap must not be negative: " + maxResults);
            }
            this.maxResults = maxResults;
            return this;
        }

        public Builder resumeAfterKey(String resumeAfterKey) {
            this.resumeAfterKey = resumeAfterKey;
            return this;
        }

        public QuerySpec build() {
            return new QuerySpec(this);
        }
    }

    @Override
    public String toString() {
        return "QuerySpec{" +
                "query='" + query + '\'' +
                ", pageSize=" + pageSize +
                ", maxResults=" + maxResults +
                (resumeAfterKey != null ? ", resumeAfterKey='" + resumeAfterKey + '\'' : "") +
                '}';
    }
}
