package xyz.firestige.clouddeploy.infrastructure.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.shared.exception.ExternalToolException;
import xyz.firestige.clouddeploy.infrastructure.process.CommandSpec;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessResult;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessRunner;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * infra 引擎（terraform）调用
 */
public class TerraformClient {

    private static final Logger log = LoggerFactory.getLogger(TerraformClient.class);
    public static final String PLAN_FILE = "tfplan";
    private static final String EXECUTABLE = "terraform";

    private final ProcessRunner runner;
    private final Duration timeout;
    private final ObjectMapper json;

    public TerraformClient(ProcessRunner runner, Duration timeout, ObjectMapper json) {
        this.runner = runner;
        this.timeout = timeout;
        this.json = json;
    }

    public void init(Path dir, Map<String, String> env, CancellationToken token) {
        run(dir, env, token, true, "init", "-input=false");
    }

    public void plan(Path dir, Map<String, String> env, CancellationToken token) {
        run(dir, env, token, true, "plan", "-input=false", "-out=" + PLAN_FILE);
    }

    public void apply(Path dir, Map<String, String> env, CancellationToken token) {
        run(dir, env, token, true, "apply", "-input=false", PLAN_FILE);
    }

    public void destroy(Path dir, Map<String, String> env, CancellationToken token) {
        run(dir, env, token, true, "destroy", "-auto-approve", "-input=false");
    }

    /**
     * terraform output -json，值统一转成字符串（非字符串值保留 JSON 文本）
     */
    public Map<String, String> outputs(Path dir, Map<String, String> env, CancellationToken token) {
        ProcessResult result = run(dir, env, token, false, "output", "-json");
        return parseOutputs(result);
    }

    Map<String, String> parseOutputs(ProcessResult result) {
        Map<String, String> outputs = new LinkedHashMap<>();
        String stdout = result.stdout() == null ? "" : result.stdout().strip();
        if (stdout.isEmpty()) {
            return outputs;
        }
        try {
            JsonNode root = json.readTree(stdout);
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue().path("value");
                if (value.isMissingNode() || value.isNull()) {
                    continue;
                }
                outputs.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
        } catch (IOException e) {
            throw new ExternalToolException(result.command(), "Cannot parse terraform outputs: " + e.getMessage(), e);
        }
        log.info("terraform outputs: {}", outputs.keySet());
        return outputs;
    }

    private ProcessResult run(Path dir, Map<String, String> env, CancellationToken token, boolean stream, String... args) {
        CommandSpec.Builder spec = CommandSpec.of(EXECUTABLE, args)
                .workDir(dir)
                .timeout(timeout)
                .env("TF_IN_AUTOMATION", "1");
        env.forEach(spec::env);
        if (stream) {
            spec.streamOutput();
        }
        return runner.run(spec.build(), token).orThrow();
    }
}
