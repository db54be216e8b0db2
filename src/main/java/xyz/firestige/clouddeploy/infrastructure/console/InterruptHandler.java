package xyz.firestige.clouddeploy.infrastructure.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ctrl+C 处理：JVM 关闭钩子只置位取消令牌（同时结束子进程），
 * 然后等待主线程完成备份恢复后再放行关闭。
 */
public class InterruptHandler {

    private static final Logger log = LoggerFactory.getLogger(InterruptHandler.class);

    private final CancellationToken token;
    private final Duration cleanupWait;
    private final CountDownLatch cleanupDone = new CountDownLatch(1);
    private final AtomicBoolean installed = new AtomicBoolean();
    private volatile boolean finished;

    public InterruptHandler(CancellationToken token, Duration cleanupWait) {
        this.token = token;
        this.cleanupWait = cleanupWait;
    }

    public void install() {
        if (!installed.compareAndSet(false, true)) {
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(this::onShutdown, "interrupt-handler"));
    }

    /**
     * 主线程的清理（恢复备份）完成，或运行正常结束
     */
    public void cleanupComplete() {
        finished = true;
        cleanupDone.countDown();
    }

    void onShutdown() {
        if (finished) {
            return;
        }
        log.warn("收到中断信号，等待回滚完成");
        token.cancel("Interrupted by user");
        try {
            if (!cleanupDone.await(cleanupWait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("回滚未在 {}s 内完成，强制退出", cleanupWait.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
