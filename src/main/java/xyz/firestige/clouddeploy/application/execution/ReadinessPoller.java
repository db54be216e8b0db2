package xyz.firestige.clouddeploy.application.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.shared.exception.PollTimeoutException;
import xyz.firestige.clouddeploy.domain.shared.exception.SetupInterruptedException;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 固定间隔 + 总截止时间的有界轮询。
 * 探测过程中的异常视为"尚未就绪"，取消除外。
 */
public class ReadinessPoller {

    private static final Logger log = LoggerFactory.getLogger(ReadinessPoller.class);

    private final Duration interval;

    public ReadinessPoller(Duration interval) {
        this.interval = interval;
    }

    public <T> T await(String what, Duration timeout, CancellationToken token, Supplier<Optional<T>> probe) {
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempt = 0;
        while (true) {
            attempt++;
            token.throwIfCancelled();
            try {
                Optional<T> value = probe.get();
                if (value.isPresent()) {
                    log.info("[ReadinessPoller] {} 就绪, attempts={}", what, attempt);
                    return value.get();
                }
                log.debug("[ReadinessPoller] {} 未就绪, attempt={}", what, attempt);
            } catch (SetupInterruptedException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[ReadinessPoller] {} 探测异常, attempt={}, error={}", what, attempt, e.getMessage());
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new PollTimeoutException(what, timeout);
            }
            token.sleep(Duration.ofNanos(Math.min(interval.toNanos(), remaining)));
        }
    }

    /**
     * 等待条件成立
     */
    public void awaitTrue(String what, Duration timeout, CancellationToken token, Supplier<Boolean> condition) {
        await(what, timeout, token, () -> Boolean.TRUE.equals(condition.get()) ? Optional.of(Boolean.TRUE) : Optional.empty());
    }
}
