package com.openrangelabs.donpetre.issuesync.model;

/**
 * Item counters reported by a sink for one applied record, or accumulated over many
 */
public class ItemCounts {

    public static final ItemCounts NONE = new ItemCounts(0, 0, 0);

    private final long created;
    private final long updated;
    private final long skipped;

    public ItemCounts(long created, long updated, long skipped) {
        if (created < 0 || updated < 0 || skipped < 0) {
            throw new IllegalArgumentException("Item counts must not be negative");
        }
        this.created = created;
        this.updated = updated;
        this.skipped = skipped;
    }

    public static ItemCounts created() {
        return new ItemCounts(1, 0, 0);
    }

    public static ItemCounts updated() {
        return new ItemCounts(0, 1, 0);
    }

    public static ItemCounts skipped() {
        return new ItemCounts(0, 0, 1);
    }

    public ItemCounts plus(ItemCounts other) {
        return new ItemCounts(created + other.created, updated + other.updated, skipped + other.skipped);
    }

    public long total() {
        return created + updated + skipped;
    }

    // Getters
    public long getCreated() { return created; }
    public long getUpdated() { return updated; }
    public long getSkipped() { return skipped; }

    @Override
    public String toString() {
        return "ItemCounts{created=" + created + ", updated=" + updated + ", skipped=" + skipped + '}';
    }
}
