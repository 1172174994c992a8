package com.openrangelabs.donpetre.issuesync.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * One issue as returned by the remote tracker. The engine never interprets the fields.
 */
public class IssueRecord {

    private final String key;
    private final String id;
    private final JsonNode fields;

    public IssueRecord(String key, String id, JsonNode fields) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Issue key is required");
        }
        this.key = key;
        this.id = id;
        this.fields = fields != null ? fields : JsonNodeFactory.instance.objectNode();
    }

    public static IssueRecord of(String key) {
        return new IssueRecord(key, null, null);
    }

    // Getters
    public String getKey() { return key; }
    public String getId() { return id; }
    public JsonNode getFields() { return fields; }

    public String getField(String name) {
        JsonNode value = fields.get(name);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IssueRecord that)) return false;
        return key.equals(that.key) && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, id);
    }

    @Override
    public String toString() {
        return "IssueRecord{key='" + key + "', id='" + id + "'}";
    }
}
