package xyz.firestige.clouddeploy.infrastructure.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.shared.exception.ExternalToolException;
import xyz.firestige.clouddeploy.infrastructure.process.CommandSpec;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessResult;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessRunner;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

/**
 * 集群客户端（kubectl）调用。Secret 内容以 manifest 形式经 stdin 传入。
 */
public class KubectlClient {

    private static final Logger log = LoggerFactory.getLogger(KubectlClient.class);
    private static final String EXECUTABLE = "kubectl";
    public static final String SECRET_TYPE_OPAQUE = "Opaque";
    public static final String SECRET_TYPE_TLS = "kubernetes.io/tls";

    private final ProcessRunner runner;
    private final Duration timeout;
    private final ObjectMapper json;

    public KubectlClient(ProcessRunner runner, Duration timeout, ObjectMapper json) {
        this.runner = runner;
        this.timeout = timeout;
        this.json = json;
    }

    public boolean clusterReachable(CancellationToken token) {
        ProcessResult result = run(token, null, "get", "namespaces", "-o", "name", "--request-timeout=15s");
        if (result.cancelled()) {
            result.orThrow();
        }
        return result.isSuccess();
    }

    public void ensureNamespace(String namespace, CancellationToken token) {
        ProcessResult existing = run(token, null, "get", "namespace", namespace, "-o", "name");
        if (existing.isSuccess()) {
            log.info("namespace 已存在: {}", namespace);
            return;
        }
        if (existing.cancelled()) {
            existing.orThrow();
        }
        run(token, null, "create", "namespace", namespace).orThrow();
        log.info("已创建 namespace: {}", namespace);
    }

    public void applyManifest(String manifest, CancellationToken token) {
        run(token, manifest, "apply", "-f", "-").orThrow();
    }

    /**
     * 创建或更新 Secret；数据只经 stdin 传递
     */
    public void applySecret(String namespace, String name, String type, Map<String, String> data, CancellationToken token) {
        ObjectNode manifest = json.createObjectNode();
        manifest.put("apiVersion", "v1");
        manifest.put("kind", "Secret");
        ObjectNode metadata = manifest.putObject("metadata");
        metadata.put("name", name);
        metadata.put("namespace", namespace);
        metadata.putObject("labels").put("app.kubernetes.io/managed-by", "cloud-deploy");
        manifest.put("type", type);
        ObjectNode encoded = manifest.putObject("data");
        data.forEach((k, v) -> encoded.put(k, Base64.getEncoder().encodeToString(v.getBytes(StandardCharsets.UTF_8))));
        try {
            applyManifest(json.writeValueAsString(manifest), token);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render secret manifest " + name, e);
        }
        log.info("已写入 secret: {}/{}", namespace, name);
    }

    /**
     * @return 资源不存在时返回 empty
     */
    public Optional<JsonNode> get(String kind, String name, String namespace, CancellationToken token) {
        ProcessResult result = namespace == null
                ? run(token, null, "get", kind, name, "-o", "json")
                : run(token, null, "get", kind, name, "-n", namespace, "-o", "json");
        if (!result.isSuccess()) {
            if (!result.cancelled() && !result.timedOut() && result.indicatesAbsent()) {
                return Optional.empty();
            }
            result.orThrow();
        }
        try {
            return Optional.of(json.readTree(result.stdout()));
        } catch (JsonProcessingException e) {
            throw new ExternalToolException(result.command(), "Cannot parse kubectl output: " + e.getMessage(), e);
        }
    }

    public int availableReplicas(String deployment, String namespace, CancellationToken token) {
        return get("deployment", deployment, namespace, token)
                .map(node -> node.path("status").path("availableReplicas").asInt(0))
                .orElse(0);
    }

    /**
     * LoadBalancer 分配的外部地址：优先 hostname，其次 ip
     */
    public Optional<String> loadBalancerAddress(String service, String namespace, CancellationToken token) {
        return get("service", service, namespace, token)
                .map(node -> node.path("status").path("loadBalancer").path("ingress").path(0))
                .flatMap(ingress -> {
                    String host = ingress.path("hostname").asText("");
                    if (!host.isBlank()) {
                        return Optional.of(host);
                    }
                    String ip = ingress.path("ip").asText("");
                    return ip.isBlank() ? Optional.empty() : Optional.of(ip);
                });
    }

    public void delete(String kind, String name, String namespace, CancellationToken token) {
        if (namespace == null) {
            run(token, null, "delete", kind, name, "--ignore-not-found", "--wait=true").orThrow();
        } else {
            run(token, null, "delete", kind, name, "-n", namespace, "--ignore-not-found", "--wait=true").orThrow();
        }
    }

    public void deleteAll(String kind, String namespace, CancellationToken token) {
        run(token, null, "delete", kind, "--all", "-n", namespace, "--ignore-not-found", "--wait=true").orThrow();
    }

    private ProcessResult run(CancellationToken token, String stdin, String... args) {
        return runner.run(CommandSpec.of(EXECUTABLE, args).timeout(timeout).stdin(stdin).build(), token);
    }
}
