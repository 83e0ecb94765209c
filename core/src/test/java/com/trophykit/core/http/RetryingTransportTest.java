package com.trophykit.core.http;

import com.trophykit.core.error.ApiException;
import com.trophykit.core.support.RecordingSleeper;
import com.trophykit.core.support.ScriptedSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryingTransportTest {

    private static final URI URL = URI.create("https://api.example.test/v1/thing?key=SECRET&id=7");

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final List<RequestAttempt> attempts = new ArrayList<>();

    private static Supplier<HttpRequest> get() {
        return () -> HttpRequest.newBuilder(URL).GET().build();
    }

    private RetryingTransport transport(ScriptedSender sender, int maxRetries) {
        var policy = new DefaultRetryPolicy(maxRetries, Duration.ofMillis(100), Duration.ofSeconds(2), 0.0);
        return new RetryingTransport(sender, policy, sleeper, attempts::add);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void persistent_503_makes_maxRetries_plus_one_attempts_then_gives_up() {
        var sender = new ScriptedSender().respond(503, "busy");
        var t = transport(sender, 3);

        assertThatThrownBy(() -> t.execute(get()))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ApiException.Kind.RETRIES_EXHAUSTED);
                    assertThat(e.getStatusCode()).isEqualTo(503);
                    assertThat(e.getRawBody()).isEqualTo("busy");
                    assertThat(e.getMessage()).doesNotContain("SECRET");
                });

        assertThat(sender.calls()).isEqualTo(4);
        assertThat(sleeper.sleeps).containsExactly(
                Duration.ofMillis(200), Duration.ofMillis(400), Duration.ofMillis(800));
    }

    @Test
    void terminal_404_is_sent_once() {
        var sender = new ScriptedSender().respond(404, "{\"error\":\"nope\"}");
        var t = transport(sender, 3);

        assertThatThrownBy(() -> t.execute(get()))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ApiException.Kind.TERMINAL);
                    assertThat(e.getStatusCode()).isEqualTo(404);
                    assertThat(e.getRawBody()).contains("nope");
                    assertThat(e.isTransient()).isFalse();
                });
        assertThat(sender.calls()).isEqualTo(1);
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void redirect_is_terminal_for_execute() {
        var sender = new ScriptedSender().respond(302, Map.of("Location", List.of("https://elsewhere")), "");
        var t = transport(sender, 3);

        assertThatThrownBy(() -> t.execute(get()))
                .isInstanceOfSatisfying(ApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ApiException.Kind.TERMINAL));
        assertThat(sender.calls()).isEqualTo(1);
    }

    @Test
    void rate_limited_then_success() throws Exception {
        var sender = new ScriptedSender()
                .respond(429, Map.of("Retry-After", List.of("120")), "slow down")
                .respond(200, "{\"ok\":true}");
        var t = transport(sender, 3);

        RawResponse r = t.execute(get());

        assertThat(r.getStatusCode()).isEqualTo(200);
        assertThat(r.getBody()).isEqualTo("{\"ok\":true}");
        assertThat(sender.calls()).isEqualTo(2);
        // Retry-After is not honoured; the policy's own backoff applies
        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(200));
    }

    @Test
    void connection_failures_are_retried_and_surface_as_transport() {
        var sender = new ScriptedSender().fail(new ConnectException("refused"));
        var t = transport(sender, 2);

        assertThatThrownBy(() -> t.execute(get()))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ApiException.Kind.TRANSPORT);
                    assertThat(e.getStatusCode()).isEqualTo(-1);
                    assertThat(e.getCause()).isInstanceOf(ConnectException.class);
                    assertThat(e.isTransient()).isTrue();
                });
        assertThat(sender.calls()).isEqualTo(3);
    }

    @Test
    void connection_failure_then_success() throws Exception {
        var sender = new ScriptedSender()
                .fail(new IOException("reset"))
                .respond(200, "ok");
        var t = transport(sender, 3);

        assertThat(t.execute(get()).getBody()).isEqualTo("ok");
        assertThat(sender.calls()).isEqualTo(2);
    }

    @Test
    void listener_sees_every_attempt_with_its_delay() throws Exception {
        var sender = new ScriptedSender()
                .respond(500, "")
                .respond(502, "")
                .respond(200, "done");
        var t = transport(sender, 3);

        t.execute(get());

        assertThat(attempts).extracting(RequestAttempt::attemptNumber).containsExactly(1, 2, 3);
        assertThat(attempts.get(0).isRetry()).isFalse();
        assertThat(attempts.get(0).delayBeforeThisAttempt()).isEqualTo(Duration.ZERO);
        assertThat(attempts.get(1).delayBeforeThisAttempt()).isEqualTo(Duration.ofMillis(200));
        assertThat(attempts.get(2).delayBeforeThisAttempt()).isEqualTo(Duration.ofMillis(400));
        assertThat(attempts).allSatisfy(a -> assertThat(a.method()).isEqualTo("GET"));
    }

    @Test
    void interrupted_thread_aborts_before_sending() {
        var sender = new ScriptedSender().respond(200, "ok");
        var t = transport(sender, 3);

        Thread.currentThread().interrupt();
        assertThatThrownBy(() -> t.execute(get())).isInstanceOf(InterruptedException.class);
        assertThat(sender.calls()).isZero();
    }

    @Test
    void interrupted_backoff_stops_the_loop() {
        var sender = new ScriptedSender().respond(503, "");
        var policy = new DefaultRetryPolicy(5, Duration.ofMillis(100), Duration.ofSeconds(2), 0.0);
        var t = new RetryingTransport(sender, policy, d -> { throw new InterruptedException("cancel"); }, null);

        assertThatThrownBy(() -> t.execute(get())).isInstanceOf(InterruptedException.class);
        assertThat(sender.calls()).isEqualTo(1);
    }

    @Test
    void zero_retries_means_single_attempt() {
        var sender = new ScriptedSender().respond(500, "x");
        var t = transport(sender, 0);

        assertThatThrownBy(() -> t.execute(get()))
                .isInstanceOfSatisfying(ApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ApiException.Kind.RETRIES_EXHAUSTED));
        assertThat(sender.calls()).isEqualTo(1);
    }
}
