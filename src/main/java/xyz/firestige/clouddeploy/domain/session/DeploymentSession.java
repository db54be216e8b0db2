package xyz.firestige.clouddeploy.domain.session;

import org.slf4j.MDC;
import xyz.firestige.clouddeploy.domain.backup.BackupRecord;
import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.phase.PhaseResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 一次运行的上下文：配置记录、Phase 结果、活动备份、取消令牌、infra 输出。
 * 由 Session Controller 独占创建并按引用传入各组件；不跨运行保存任何内存状态。
 */
public class DeploymentSession {

    private final String sessionId;
    private final DeployMode mode;
    private final CancellationToken cancellationToken;
    private final List<PhaseResult> phaseResults = new ArrayList<>();
    private final List<BackupRecord> activeBackups = new ArrayList<>();
    private final Map<String, String> infraOutputs = new LinkedHashMap<>();
    private DeploymentConfig config;
    private String endpoint;
    private boolean kubectlConfigured;

    public DeploymentSession(DeployMode mode, CancellationToken cancellationToken) {
        this(UUID.randomUUID().toString().substring(0, 8), mode, cancellationToken);
    }

    public DeploymentSession(String sessionId, DeployMode mode, CancellationToken cancellationToken) {
        this.sessionId = sessionId;
        this.mode = mode;
        this.cancellationToken = cancellationToken;
    }

    public void injectMdc(String phaseName) {
        MDC.put("sessionId", sessionId);
        MDC.put("mode", mode.name());
        if (phaseName != null) {
            MDC.put("phase", phaseName);
        } else {
            MDC.remove("phase");
        }
    }

    public void clearMdc() {
        MDC.clear();
    }

    public String getSessionId() {
        return sessionId;
    }

    public DeployMode getMode() {
        return mode;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public DeploymentConfig getConfig() {
        return config;
    }

    public void setConfig(DeploymentConfig config) {
        this.config = config;
    }

    public void addPhaseResult(PhaseResult result) {
        phaseResults.add(result);
    }

    public List<PhaseResult> getPhaseResults() {
        return Collections.unmodifiableList(phaseResults);
    }

    public void addBackups(List<BackupRecord> records) {
        activeBackups.addAll(records);
    }

    public List<BackupRecord> getActiveBackups() {
        return Collections.unmodifiableList(activeBackups);
    }

    public void clearBackups() {
        activeBackups.clear();
    }

    public Map<String, String> getInfraOutputs() {
        return Collections.unmodifiableMap(infraOutputs);
    }

    public void putInfraOutputs(Map<String, String> outputs) {
        infraOutputs.putAll(outputs);
    }

    public Optional<String> infraOutput(String name) {
        String v = infraOutputs.get(name);
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v);
    }

    public Optional<String> getEndpoint() {
        return Optional.ofNullable(endpoint);
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public boolean isKubectlConfigured() {
        return kubectlConfigured;
    }

    public void markKubectlConfigured() {
        this.kubectlConfigured = true;
    }
}
