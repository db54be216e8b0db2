package xyz.firestige.clouddeploy.domain.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.shared.exception.SetupInterruptedException;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 取消令牌：信号处理器只负责置位，真正的中断由各挂起点（子进程调用、轮询、提示读取）检查后返回。
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);
    private static final long SLEEP_SLICE_MS = 200;

    private volatile boolean cancelled;
    private volatile String reason;
    private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();

    public void cancel(String reason) {
        if (cancelled) {
            return;
        }
        this.reason = reason;
        this.cancelled = true;
        log.warn("收到取消请求: {}", reason);
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("取消回调执行失败: {}", e.getMessage(), e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new SetupInterruptedException(reason != null ? reason : "Interrupted by user");
        }
    }

    /**
     * 注册取消回调（例如结束正在运行的子进程），返回值关闭时注销
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * 可中断的等待：按小片段睡眠，每片检查一次取消标志
     */
    public void sleep(Duration duration) {
        long deadline = System.nanoTime() + duration.toNanos();
        while (true) {
            throwIfCancelled();
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                return;
            }
            try {
                Thread.sleep(Math.min(SLEEP_SLICE_MS, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel("Thread interrupted");
                throwIfCancelled();
            }
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
