package com.openrangelabs.donpetre.issuesync.connector.jira;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openrangelabs.donpetre.issuesync.config.SyncProperties;
import com.openrangelabs.donpetre.issuesync.exception.RemoteApiException;
import com.openrangelabs.donpetre.issuesync.exception.SyncException;
import com.openrangelabs.donpetre.issuesync.model.IssueRecord;
import com.openrangelabs.donpetre.issuesync.model.PageResult;
import com.openrangelabs.donpetre.issuesync.model.QuerySpec;
import com.openrangelabs.donpetre.issuesync.query.PageFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Jira Cloud search client using token based pagination ({@code POST /rest/api/3/search/jql}).
 *
 * <p>Every request first takes a permit from the {@link RequestRateLimiter}. Non-success
 * answers become {@link RemoteApiException}s carrying the status, the messages found in
 * the body and, for 429 answers, the retry-after hint.
 */
@Slf4j
@Component
public class JiraSearchClient implements PageFetcher {

    static final String RETRY_AFTER = "Retry-After";
    static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";

    private final WebClient jiraWebClient;
    private final SyncProperties properties;
    private final RequestRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public JiraSearchClient(@Qualifier("jiraWebClient") WebClient jiraWebClient,
                            SyncProperties properties,
                            RequestRateLimiter rateLimiter,
                            ObjectMapper objectMapper) {
        this.jiraWebClient = jiraWebClient;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<PageResult> fetchPage(QuerySpec spec, int pageSize, String pageToken) {
        ObjectNode body = buildRequestBody(spec, pageSize, pageToken);

        return rateLimiter.acquire()
                .then(Mono.defer(() -> {
                    log.debug("Searching Jira: jql='{}', maxResults={}, token={}",
                            body.get("jql").asText(), pageSize, pageToken);
                    return jiraWebClient.post()
                            .uri(properties.getJira().getSearchPath())
                            .contentType(MediaType.APPLICATION_JSON)
                            .bodyValue(body)
                            .exchangeToMono(this::handleResponse);
                }))
                .timeout(properties.getJira().getTimeout())
                .map(this::toPageResult);
    }

    ObjectNode buildRequestBody(QuerySpec spec, int pageSize, String pageToken) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("jql", JqlQueryBuilder.build(spec));
        body.put("maxResults", pageSize);
        ArrayNode fields = body.putArray("fields");
        spec.getFields().forEach(fields::add);
        if (pageToken != null) {
            body.put("nextPageToken", pageToken);
        }
        return body;
    }

    private Mono<JsonNode> handleResponse(ClientResponse response) {
        int status = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(JsonNode.class)
                    .switchIfEmpty(Mono.error(() -> new SyncException("Jira returned an empty search response")));
        }
        HttpHeaders headers = response.headers().asHttpHeaders();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(text -> Mono.error(toRemoteError(status, headers, text)));
    }

    RemoteApiException toRemoteError(int status, HttpHeaders headers, String body) {
        List<String> remoteMessages = extractMessages(body);
        String message = remoteMessages.isEmpty() ? describeStatus(status) : String.join(", ", remoteMessages);

        Duration retryAfter = null;
        if (status == 429) {
            retryAfter = parseSeconds(headers.getFirst(RETRY_AFTER));
            if (retryAfter == null) {
                retryAfter = parseSeconds(headers.getFirst(RATE_LIMIT_RESET));
            }
        }

        log.warn("Jira search failed with status {}: {}", status, message);
        return new RemoteApiException(status, message, retryAfter, remoteMessages);
    }

    private PageResult toPageResult(JsonNode json) {
        List<IssueRecord> items = new ArrayList<>();
        JsonNode issues = json.path("issues");
        for (JsonNode issue : issues) {
            String key = issue.path("key").asText(null);
            if (key == null || key.isBlank()) {
                log.warn("Skipping issue without key in search response: id={}", issue.path("id").asText());
                continue;
            }
            items.add(new IssueRecord(key, issue.path("id").asText(null), issue.get("fields")));
        }

        JsonNode tokenNode = json.get("nextPageToken");
        String nextToken = tokenNode != null && !tokenNode.isNull() && !tokenNode.asText().isEmpty()
                ? tokenNode.asText()
                : null;
        boolean last = json.has("isLast") ? json.get("isLast").asBoolean() : nextToken == null;
        long total = json.has("total") ? json.get("total").asLong() : PageResult.UNKNOWN_TOTAL;

        return new PageResult(items, total, last, nextToken);
    }

    private List<String> extractMessages(String body) {
        List<String> messages = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return messages;
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            for (JsonNode message : json.path("errorMessages")) {
                messages.add(message.asText());
            }
            if (messages.isEmpty()) {
                Iterator<JsonNode> errors = json.path("errors").elements();
                errors.forEachRemaining(error -> messages.add(error.asText()));
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON, using status description: {}", e.getOriginalMessage());
        }
        return messages;
    }

    static String describeStatus(int status) {
        return switch (status) {
            case 400 -> "Invalid JQL syntax or bad request";
            case 401 -> "Authentication required - check your credentials";
            case 403 -> "You do not have permission to view these issues";
            case 404 -> "Jira endpoint not found - check your base URL";
            case 429 -> "Rate limit exceeded - too many requests";
            case 500, 502, 503 -> "Jira server error - please try again later";
            default -> "Jira API error (" + status + ")";
        };
    }

    private static Duration parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric rate limit header: {}", value);
            return null;
        }
    }
}
