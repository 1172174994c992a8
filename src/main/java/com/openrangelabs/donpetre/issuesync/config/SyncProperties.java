package com.openrangelabs.donpetre.issuesync.config;

import com.openrangelabs.donpetre.issuesync.fault.FaultCategory;
import com.openrangelabs.donpetre.issuesync.model.QuerySpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of the sync engine, bound from {@code issuesync.*}
 */
@ConfigurationProperties(prefix = "issuesync")
@Validated
@Getter
@Setter
public class SyncProperties {

    @Valid
    private Query query = new Query();

    @Valid
    private Importer importer = new Importer();

    @Valid
    private Backoff backoff = new Backoff();

    @Valid
    private Recovery recovery = new Recovery();

    @Valid
    private Jira jira = new Jira();

    /**
     * Query for the given JQL using the configured fields, page size and cap
     */
    public QuerySpec newQuery(String jql) {
        return QuerySpec.builder(jql)
                .fields(query.getDefaultFields())
                .pageSize(query.getPageSize())
                .maxResults(query.getMaxResults())
                .build();
    }

    @Getter
    @Setter
    public static class Query {

        /** Items requested per page. */
        @Min(1)
        @Max(5000)
        private int pageSize = 50;

        /** Absolute cap on items fetched by one query. */
        @Min(1)
        private int maxResults = 1000;

        @NotEmpty
        private List<String> defaultFields = new ArrayList<>(List.of(
                "summary", "status", "assignee", "priority", "created",
                "updated", "description", "issuetype", "project"));
    }

    @Getter
    @Setter
    public static class Importer {

        /** Items applied per chunk before a checkpoint is written. */
        @Min(1)
        private int batchSize = 25;
    }

    @Getter
    @Setter
    public static class Backoff {

        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);

        private boolean jitter = true;
    }

    @Getter
    @Setter
    public static class Recovery {

        /**
         * Total attempts per fault category, the first one included.
         * Categories not listed fall back to the category default.
         */
        private Map<FaultCategory, Integer> maxAttempts = new EnumMap<>(FaultCategory.class);

        public int maxAttemptsFor(FaultCategory category) {
            Integer configured = maxAttempts.get(category);
            if (configured == null || configured < 1) {
                return category.getDefaultMaxAttempts();
            }
            return configured;
        }
    }

    @Getter
    @Setter
    public static class Jira {

        @NotBlank
        private String baseUrl = "https://your-domain.atlassian.net";

        @NotBlank
        private String searchPath = "/rest/api/3/search/jql";

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        @Min(1)
        private int requestsPerMinute = 20;

        @Min(1)
        private int burst = 3;

        @Min(1)
        private int maxInMemoryMb = 16;
    }
}
