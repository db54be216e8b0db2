package xyz.firestige.clouddeploy.infrastructure.cloud;

import com.fasterxml.jackson.databind.ObjectMapper;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException;
import xyz.firestige.clouddeploy.infrastructure.process.CommandSpec;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessResult;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessRunner;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 云 CLI 调用的公共部分
 */
public abstract class AbstractCloudPlatform implements CloudPlatform {

    public static final String APP_LABEL_KEY = "app";
    public static final String APP_LABEL_VALUE = "n8n";

    protected final ProcessRunner runner;
    protected final ObjectMapper json;
    protected final Duration identityTimeout;
    protected final Duration commandTimeout;

    protected AbstractCloudPlatform(ProcessRunner runner, ObjectMapper json, Duration identityTimeout, Duration commandTimeout) {
        this.runner = runner;
        this.json = json;
        this.identityTimeout = identityTimeout;
        this.commandTimeout = commandTimeout;
    }

    protected ProcessResult cli(DeploymentSession session, Map<String, String> env, Duration timeout, String stdin, String... args) {
        CommandSpec.Builder spec = CommandSpec.of(provider().getCliExecutable(), args)
                .timeout(timeout)
                .stdin(stdin);
        env.forEach(spec::env);
        return runner.run(spec.build(), session.getCancellationToken());
    }

    protected ProcessResult cli(DeploymentSession session, Map<String, String> env, String... args) {
        return cli(session, env, commandTimeout, null, args);
    }

    /**
     * 失败但输出表明资源不存在时返回 false，其他失败抛出
     */
    protected boolean succeededOrAbsent(ProcessResult result) {
        if (result.isSuccess()) {
            return true;
        }
        if (!result.cancelled() && !result.timedOut() && result.indicatesAbsent()) {
            return false;
        }
        result.orThrow();
        return false;
    }

    protected static List<String> lines(String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(text.split("\\R"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    protected String requireOutput(DeploymentSession session, String name) {
        return session.infraOutput(name)
                .orElseThrow(() -> new PreconditionException("Infrastructure output '" + name + "' is not available",
                        "Check 'terraform output' in terraform/" + provider().getId()));
    }
}
