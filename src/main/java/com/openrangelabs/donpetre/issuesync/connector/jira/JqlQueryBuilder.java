package com.openrangelabs.donpetre.issuesync.connector.jira;

import com.openrangelabs.donpetre.issuesync.model.QuerySpec;

import java.util.regex.Pattern;

/**
 * Builds the JQL sent for a {@link QuerySpec}.
 *
 * <p>Results are always ordered by key so that "items after key X" resumes exactly where
 * a previous run stopped; any ORDER BY clause of the caller is replaced.
 */
public final class JqlQueryBuilder {

    private static final Pattern ORDER_BY = Pattern.compile("(?i)(^|\\s+)order\\s+by\\s+.*$", Pattern.DOTALL);
    static final String KEY_ORDER = "ORDER BY key ASC";

    private JqlQueryBuilder() {
    }

    public static String build(QuerySpec spec) {
        String filter = stripOrderBy(spec.getQuery());
        StringBuilder jql = new StringBuilder();

        if (spec.hasResumeKey()) {
            if (!filter.isEmpty()) {
                jql.append('(').append(filter).append(") AND ");
            }
            jql.append("key > ").append(quoteKey(spec.getResumeAfterKey()));
        } else {
            jql.append(filter);
        }

        if (jql.length() > 0) {
            jql.append(' ');
        }
        return jql.append(KEY_ORDER).toString();
    }

    static String stripOrderBy(String jql) {
        return ORDER_BY.matcher(jql).replaceFirst("").trim();
    }

    private static String quoteKey(String key) {
        String trimmed = key.trim();
        if (trimmed.matches("[A-Za-z][A-Za-z0-9_]*-\\d+")) {
            return trimmed;
        }
        return '"' + trimmed.replace("\"", "\\\"") + '"';
    }
}
