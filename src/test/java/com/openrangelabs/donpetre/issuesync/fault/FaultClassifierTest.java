package com.openrangelabs.donpetre.issuesync.fault;

import com.fasterxml.jackson.core.JsonParseException;
import com.openrangelabs.donpetre.issuesync.exception.InvalidItemException;
import com.openrangelabs.donpetre.issuesync.exception.ItemConflictException;
import com.openrangelabs.donpetre.issuesync.exception.LocalWriteException;
import com.openrangelabs.donpetre.issuesync.exception.RemoteApiException;
import com.openrangelabs.donpetre.issuesync.exception.SyncConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FaultClassifierTest {

    private final FaultClassifier classifier = new FaultClassifier();
    private final ErrorContext pageContext = ErrorContext.forPageFetch("token-1");

    @Test
    void classify_Status429_IsRateLimitWithHint() {
        RemoteApiException error = new RemoteApiException(429, "Rate limit exceeded - too many requests",
                Duration.ofSeconds(7), List.of());

        Fault fault = classifier.classify(error, pageContext);

        assertThat(fault.getCategory()).isEqualTo(FaultCategory.RATE_LIMIT);
        assertThat(fault.getSeverity()).isEqualTo(FaultSeverity.LOW);
        assertThat(fault.getStrategy()).isEqualTo(RecoveryStrategy.RETRY);
        assertThat(fault.getRetryAfter()).isEqualTo(Duration.ofSeconds(7));
        assertThat(fault.getUserMessage()).contains("7 seconds");
        assertThat(fault.getContext().getPageToken()).isEqualTo("token-1");
    }

    @Test
    void classify_RetryAfterHintWithoutStatus429_StillRateLimit() {
        RemoteApiException error = new RemoteApiException(503, "busy", Duration.ofSeconds(2), List.of());

        assertThat(classifier.classify(error, pageContext).getCategory()).isEqualTo(FaultCategory.RATE_LIMIT);
    }

    @Test
    void classify_WebClientResponseWithRetryAfterHeader_IsRateLimit() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("Retry-After", "12");
        WebClientResponseException error = WebClientResponseException.create(
                429, "Too Many Requests", headers, new byte[0], StandardCharsets.UTF_8);

        Fault fault = classifier.classify(error, pageContext);

        assertThat(fault.getCategory()).isEqualTo(FaultCategory.RATE_LIMIT);
        assertThat(fault.getHttpStatus()).isEqualTo(429);
        assertThat(fault.getRetryAfter()).isEqualTo(Duration.ofSeconds(12));
    }

    @Test
    void classify_WrappedConnectivityFailures_AreNetwork() {
        assertThat(classifier.classify(new RuntimeException(new ConnectException("refused")), pageContext).getCategory())
                .isEqualTo(FaultCategory.NETWORK);
        assertThat(classifier.classify(new SocketTimeoutException("read timed out"), pageContext).getCategory())
                .isEqualTo(FaultCategory.NETWORK);
        assertThat(classifier.classify(new UnknownHostException("jira.example"), pageContext).getCategory())
                .isEqualTo(FaultCategory.NETWORK);
        assertThat(classifier.classify(new TimeoutException("no answer in 30s"), pageContext).getCategory())
                .isEqualTo(FaultCategory.NETWORK);
        assertThat(classifier.classify(new RemoteApiException(0, "no response"), pageContext).getCategory())
                .isEqualTo(FaultCategory.NETWORK);
    }

    @Test
    void classify_NetworkTakesPrecedenceOverLocalWrite() {
        LocalWriteException error = new LocalWriteException("ISSUE-1", "remote volume unreachable",
                new ConnectException("refused"));

        assertThat(classifier.classify(error, ErrorContext.forItem("ISSUE-1")).getCategory())
                .isEqualTo(FaultCategory.NETWORK);
    }

    @ParameterizedTest
    @ValueSource(ints = {500, 502, 503, 504})
    void classify_ServerErrors_AreRemote5xx(int status) {
        Fault fault = classifier.classify(new RemoteApiException(status, "server error"), pageContext);

        assertThat(fault.getCategory()).isEqualTo(FaultCategory.REMOTE_5XX);
        assertThat(fault.isTransient()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {401, 403})
    void classify_AuthStatuses_RequireIntervention(int status) {
        Fault fault = classifier.classify(new RemoteApiException(status, "denied"), pageContext);

        assertThat(fault.getCategory()).isEqualTo(FaultCategory.AUTH);
        assertThat(fault.getSeverity()).isEqualTo(FaultSeverity.HIGH);
        assertThat(fault.requiresIntervention()).isTrue();
        assertThat(fault.getUserMessage()).contains("credentials");
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 404, 409, 422})
    void classify_OtherClientErrors_AreQueued(int status) {
        Fault fault = classifier.classify(new RemoteApiException(status, "rejected"), pageContext);

        assertThat(fault.getCategory()).isEqualTo(FaultCategory.REMOTE_4XX);
        assertThat(fault.getStrategy()).isEqualTo(RecoveryStrategy.QUEUE);
    }

    @Test
    void classify_BadRequest_HasInvalidQueryMessage() {
        Fault fault = classifier.classify(new RemoteApiException(400, "Invalid JQL syntax or bad request"), pageContext);

        assertThat(fault.getUserMessage()).contains("Invalid query syntax");
    }

    @Test
    void classify_LocalWriteFailure_IsLocalIo() {
        Fault fault = classifier.classify(
                new IllegalStateException("apply failed", new LocalWriteException("ISSUE-9", "disk full")),
                ErrorContext.forItem("ISSUE-9"));

        assertThat(fault.getCategory()).isEqualTo(FaultCategory.LOCAL_IO);
        assertThat(fault.getItemKey()).isEqualTo("ISSUE-9");
        assertThat(fault.getStrategy()).isEqualTo(RecoveryStrategy.RETRY);
    }

    @Test
    void classify_MalformedRecord_IsValidation() {
        assertThat(classifier.classify(new InvalidItemException("ISSUE-2", "missing summary"), pageContext).getCategory())
                .isEqualTo(FaultCategory.VALIDATION);
        assertThat(classifier.classify(new JsonParseException(null, "Unexpected character"), pageContext).getCategory())
                .isEqualTo(FaultCategory.VALIDATION);
    }

    @Test
    void classify_Conflict_UsesFallback() {
        Fault fault = classifier.classify(new ItemConflictException("ISSUE-3", "local edits"), pageContext);

        assertThat(fault.getCategory()).isEqualTo(FaultCategory.CONFLICT);
        assertThat(fault.getStrategy()).isEqualTo(RecoveryStrategy.FALLBACK);
    }

    @Test
    void classify_Configuration_DegradesGracefully() {
        Fault fault = classifier.classify(new SyncConfigurationException("base URL missing"), pageContext);

        assertThat(fault.getCategory()).isEqualTo(FaultCategory.CONFIGURATION);
        assertThat(fault.getSeverity()).isEqualTo(FaultSeverity.CRITICAL);
        assertThat(fault.getStrategy()).isEqualTo(RecoveryStrategy.GRACEFUL_DEGRADATION);
    }

    @Test
    void classify_AnythingElse_IsUnknownAndRetried() {
        Fault fault = classifier.classify(new IllegalArgumentException("surprise"), pageContext);

        assertThat(fault.getCategory()).isEqualTo(FaultCategory.UNKNOWN);
        assertThat(fault.getStrategy()).isEqualTo(RecoveryStrategy.RETRY);
        assertThat(fault.getMessage()).isEqualTo("surprise");
    }

    @Test
    void classify_SelfReferencingCause_Terminates() {
        RuntimeException outer = new RuntimeException("outer");
        RuntimeException inner = new RuntimeException("inner", outer);
        outer.initCause(inner);

        assertThat(classifier.classify(outer, pageContext).getCategory()).isEqualTo(FaultCategory.UNKNOWN);
    }
}
