package com.openrangelabs.donpetre.issuesync.model;

import java.util.List;

/**
 * One page of search results
 */
public class PageResult {

    public static final long UNKNOWN_TOTAL = -1;

    private final List<IssueRecord> items;
    private final long total;
    private final boolean last;
    private final String nextPageToken;

    public PageResult(List<IssueRecord> items, long total, boolean last, String nextPageToken) {
        this.items = items != null ? List.copyOf(items) : List.of();
        this.total = total;
        this.last = last;
        this.nextPageToken = nextPageToken;
    }

    public static PageResult last(List<IssueRecord> items, long total) {
        return new PageResult(items, total, true, null);
    }

    public static PageResult more(List<IssueRecord> items, long total, String nextPageToken) {
        return new PageResult(items, total, false, nextPageToken);
    }

    // Getters
    public List<IssueRecord> getItems() { return items; }
    public long getTotal() { return total; }
    public boolean isLast() { return last; }
    public String getNextPageToken() { return nextPageToken; }

    public boolean hasKnownTotal() {
        return total >= 0;
    }

    @Override
    public String toString() {
        return "PageResult{" +
                "items=" + items.size() +
                ", total=" + total +
                ", last=" + last +
                ", nextPageToken='" + nextPageToken + '\'' +
                '}';
    }
}
