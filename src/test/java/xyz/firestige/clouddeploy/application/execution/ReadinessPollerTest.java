package xyz.firestige.clouddeploy.application.execution;

import org.junit.jupiter.api.Test;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.shared.exception.PollTimeoutException;
import xyz.firestige.clouddeploy.domain.shared.exception.SetupInterruptedException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadinessPollerTest {

    private final ReadinessPoller poller = new ReadinessPoller(Duration.ofMillis(5));
    private final CancellationToken token = new CancellationToken();

    @Test
    void testReturnsOnceProbeSucceeds() {
        AtomicInteger attempts = new AtomicInteger();

        String value = poller.await("endpoint", Duration.ofSeconds(5), token,
                () -> attempts.incrementAndGet() < 3 ? Optional.empty() : Optional.of("203.0.113.10"));

        assertThat(value).isEqualTo("203.0.113.10");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void testProbeErrorsAreRetried() {
        AtomicInteger attempts = new AtomicInteger();

        poller.awaitTrue("webhook", Duration.ofSeconds(5), token, () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("connection refused");
            }
            return true;
        });

        assertThat(attempts).hasValue(2);
    }

    @Test
    void testTimesOut() {
        assertThatThrownBy(() -> poller.await("endpoint", Duration.ofMillis(30), token, Optional::empty))
                .isInstanceOf(PollTimeoutException.class);
    }

    @Test
    void testCancellationStopsPolling() {
        token.cancel("Interrupted by user");

        assertThatThrownBy(() -> poller.await("endpoint", Duration.ofSeconds(5), token, Optional::empty))
                .isInstanceOf(SetupInterruptedException.class);
    }
}
