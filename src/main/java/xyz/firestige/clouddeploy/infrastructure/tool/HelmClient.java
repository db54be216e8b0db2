package xyz.firestige.clouddeploy.infrastructure.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.infrastructure.process.CommandSpec;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessResult;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessRunner;

import java.time.Duration;

/**
 * 包部署工具（helm）调用
 */
public class HelmClient {

    private static final Logger log = LoggerFactory.getLogger(HelmClient.class);
    private static final String EXECUTABLE = "helm";

    private final ProcessRunner runner;
    private final Duration timeout;

    public HelmClient(ProcessRunner runner, Duration timeout) {
        this.runner = runner;
        this.timeout = timeout;
    }

    public void addRepo(String name, String url, CancellationToken token) {
        run(token, false, "repo", "add", name, url, "--force-update").orThrow();
        run(token, false, "repo", "update", name).orThrow();
    }

    public void upgradeInstall(HelmUpgradeCommand command, CancellationToken token) {
        log.info("helm upgrade --install: release={}, namespace={}", command.getRelease(), command.getNamespace());
        CommandSpec spec = CommandSpec.of(EXECUTABLE)
                .args(command.arguments())
                .timeout(timeout)
                .streamOutput()
                .build();
        runner.run(spec, token).orThrow();
    }

    public boolean releaseExists(String release, String namespace, CancellationToken token) {
        ProcessResult result = run(token, false, "status", release, "--namespace", namespace);
        if (result.cancelled()) {
            result.orThrow();
        }
        return result.isSuccess();
    }

    /**
     * @return true 表示已卸载；false 表示 release 本就不存在
     */
    public boolean uninstall(String release, String namespace, CancellationToken token) {
        ProcessResult result = run(token, true, "uninstall", release, "--namespace", namespace, "--wait");
        if (result.isSuccess()) {
            return true;
        }
        if (!result.cancelled() && !result.timedOut() && result.indicatesAbsent()) {
            log.info("release 不存在，跳过: {}/{}", namespace, release);
            return false;
        }
        result.orThrow();
        return false;
    }

    private ProcessResult run(CancellationToken token, boolean stream, String... args) {
        CommandSpec.Builder spec = CommandSpec.of(EXECUTABLE, args).timeout(timeout);
        if (stream) {
            spec.streamOutput();
        }
        return runner.run(spec.build(), token);
    }
}
