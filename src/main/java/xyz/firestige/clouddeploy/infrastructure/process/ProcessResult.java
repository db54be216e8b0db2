package xyz.firestige.clouddeploy.infrastructure.process;

import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;
import xyz.firestige.clouddeploy.domain.shared.exception.ExternalToolException;
import xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException;
import xyz.firestige.clouddeploy.domain.shared.exception.SetupInterruptedException;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * 外部命令执行结果：退出码与缓存的输出
 */
public record ProcessResult(String command,
                            int exitCode,
                            String stdout,
                            String stderr,
                            boolean timedOut,
                            boolean cancelled,
                            boolean notFound,
                            Duration duration) {

    private static final List<String> ABSENT_MARKERS = List.of(
            // kubectl: Error from server (NotFound)
            "(notfound)",
            // helm uninstall / status
            "release: not found",
            // aws
            "resourcenotfoundexception",
            "dbinstancenotfound",
            // az
            "(secretnotfound)",
            "(resourcenotfound)",
            "(resourcegroupnotfound)",
            // gcloud
            "not_found:",
            "httperror 404");

    public static ProcessResult completed(String command, int exitCode, String stdout, String stderr, Duration duration) {
        return new ProcessResult(command, exitCode, stdout, stderr, false, false, false, duration);
    }

    public static ProcessResult timedOut(String command, String stdout, String stderr, Duration duration) {
        return new ProcessResult(command, -1, stdout, stderr, true, false, false, duration);
    }

    public static ProcessResult cancelled(String command, String stdout, String stderr, Duration duration) {
        return new ProcessResult(command, -1, stdout, stderr, false, true, false, duration);
    }

    public static ProcessResult notFound(String command) {
        return new ProcessResult(command, 127, "", "", false, false, true, Duration.ZERO);
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut && !cancelled && !notFound;
    }

    public String combinedOutput() {
        if (stderr == null || stderr.isBlank()) {
            return stdout == null ? "" : stdout;
        }
        if (stdout == null || stdout.isBlank()) {
            return stderr;
        }
        return stdout + System.lineSeparator() + stderr;
    }

    /**
     * 输出是否为某个工具明确的"资源不存在"错误，用于拆除时的幂等判断。
     * 不匹配笼统的 not found：缺少 kube context、profile 等错误必须照常失败。
     */
    public boolean indicatesAbsent() {
        String out = combinedOutput().toLowerCase(Locale.ROOT);
        return ABSENT_MARKERS.stream().anyMatch(out::contains);
    }

    /**
     * 非成功结果转换为对应的异常
     */
    public ProcessResult orThrow() {
        if (isSuccess()) {
            return this;
        }
        if (cancelled) {
            throw new SetupInterruptedException("Interrupted while running '" + command + "'");
        }
        if (notFound) {
            throw new PreconditionException("Executable not found: " + command,
                    "Install the tool and make sure it is on PATH");
        }
        if (timedOut) {
            throw new DeployerException(ErrorType.TIMEOUT_ERROR,
                    "'" + command + "' did not finish within " + duration.toSeconds() + "s");
        }
        throw new ExternalToolException(command, exitCode, combinedOutput());
    }
}
