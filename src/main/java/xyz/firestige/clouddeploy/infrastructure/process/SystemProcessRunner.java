package xyz.firestige.clouddeploy.infrastructure.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 基于 ProcessBuilder 的实现：
 * - stdout/stderr 由两个读线程边读边缓存，需要时分别回显到两个输出流
 * - 超时后强制结束子进程
 * - 取消令牌触发时结束子进程
 */
public class SystemProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);
    private static final long DRAIN_WAIT_MS = 2_000;

    private final PrintStream outEcho;
    private final PrintStream errEcho;

    public SystemProcessRunner() {
        this(System.out, System.err);
    }

    public SystemProcessRunner(PrintStream outEcho, PrintStream errEcho) {
        this.outEcho = outEcho;
        this.errEcho = errEcho;
    }

    @Override
    public ProcessResult run(CommandSpec spec, CancellationToken token) {
        String display = spec.display();
        token.throwIfCancelled();

        ProcessBuilder pb = new ProcessBuilder(spec.commandLine());
        if (spec.getWorkDir() != null) {
            pb.directory(spec.getWorkDir().toFile());
        }
        pb.environment().putAll(spec.getEnv());

        log.info("执行命令: {} (timeout={}s)", display, spec.getTimeout().toSeconds());
        long startNanos = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("命令无法启动: {}, err={}", display, e.getMessage());
            return ProcessResult.notFound(display);
        }

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread outReader = pump(process.getInputStream(), stdout, spec.isStreamOutput() ? outEcho : null, "proc-stdout");
        Thread errReader = pump(process.getErrorStream(), stderr, spec.isStreamOutput() ? errEcho : null, "proc-stderr");

        try (CancellationToken.Registration ignored = token.onCancel(() -> kill(process))) {
            writeStdin(process, spec.getStdin());
            boolean finished = process.waitFor(spec.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("命令超时，强制结束: {}", display);
                kill(process);
                drain(outReader, errReader);
                return ProcessResult.timedOut(display, text(stdout), text(stderr), elapsed(startNanos));
            }
            drain(outReader, errReader);
            if (token.isCancelled()) {
                return ProcessResult.cancelled(display, text(stdout), text(stderr), elapsed(startNanos));
            }
            int exit = process.exitValue();
            Duration took = elapsed(startNanos);
            log.info("命令结束: {}, exitCode={}, duration={}ms", display, exit, took.toMillis());
            return ProcessResult.completed(display, exit, text(stdout), text(stderr), took);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            token.cancel("Thread interrupted while running " + display);
            return ProcessResult.cancelled(display, text(stdout), text(stderr), elapsed(startNanos));
        }
    }

    private Thread pump(InputStream in, StringBuilder sink, PrintStream echo, String name) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append('\n');
                    }
                    if (echo != null) {
                        echo.println("  " + line);
                    }
                }
            } catch (IOException e) {
                log.debug("输出流读取结束: {}", e.getMessage());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private void writeStdin(Process process, String stdin) {
        try (OutputStream os = process.getOutputStream()) {
            if (stdin != null) {
                os.write(stdin.getBytes(StandardCharsets.UTF_8));
                os.flush();
            }
        } catch (IOException e) {
            // 子进程可能不读取 stdin 就已退出
            log.debug("写入 stdin 失败: {}", e.getMessage());
        }
    }

    private void kill(Process process) {
        if (!process.isAlive()) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private void drain(Thread... readers) throws InterruptedException {
        for (Thread reader : readers) {
            reader.join(DRAIN_WAIT_MS);
        }
    }

    private static String text(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
