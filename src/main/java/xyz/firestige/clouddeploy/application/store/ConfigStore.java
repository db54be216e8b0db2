package xyz.firestige.clouddeploy.application.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.config.DeployMode;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;

/**
 * 配置记录的持久化：
 * - .setup-current.json 保存最近一次确认的配置（不含密钥），供 --skip-terraform / --update-tls / --teardown 复用
 * - setup_history.log 追加式运行历史，敏感字段打码
 */
public class ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);
    public static final String REDACTED = "***REDACTED***";
    private static final DateTimeFormatter HISTORY_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final WorkspaceLayout layout;
    private final ObjectMapper mapper;

    public ConfigStore(WorkspaceLayout layout) {
        this.layout = layout;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void save(DeploymentConfig config) {
        StoredConfiguration stored = new StoredConfiguration(LocalDateTime.now().withNano(0), config.getCloudProvider(), config);
        Path file = layout.currentConfig();
        try {
            Files.createDirectories(file.getParent());
            mapper.writeValue(file.toFile(), stored);
            log.info("配置已保存: {}", file);
        } catch (IOException e) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Cannot write " + file + ": " + e.getMessage(), e);
        }
    }

    public Optional<StoredConfiguration> load() {
        Path file = layout.currentConfig();
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            StoredConfiguration stored = mapper.readValue(file.toFile(), StoredConfiguration.class);
            if (stored.configuration() != null && stored.configuration().getCloudProvider() == null) {
                stored.configuration().setCloudProvider(stored.cloudProvider());
            }
            return Optional.of(stored);
        } catch (IOException e) {
            throw new DeployerException(ErrorType.PRECONDITION_ERROR,
                    "Saved configuration " + file + " is unreadable: " + e.getMessage(), e)
                    .withHint("Run a full deployment to regenerate it");
        }
    }

    /**
     * 追加一条运行历史
     *
     * @param outcome 运行结论（SUCCEEDED / PARTIAL 等）
     */
    public void appendHistory(DeployMode mode, String outcome, DeploymentConfig config) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(60)).append('\n');
        sb.append("Timestamp: ").append(HISTORY_TS.format(LocalDateTime.now())).append('\n');
        sb.append("Cloud Provider: ").append(config.getCloudProvider().getId()).append('\n');
        sb.append("Mode: ").append(mode).append('\n');
        sb.append("Outcome: ").append(outcome).append('\n');
        sb.append("Configuration:").append('\n');
        for (Map.Entry<String, Object> e : config.toDisplayMap().entrySet()) {
            sb.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        }
        if (config.getEncryptionKey() != null) {
            sb.append("  encryption_key: ").append(REDACTED).append('\n');
        }
        sb.append('\n');

        Path file = layout.historyLog();
        try {
            Files.writeString(file, sb.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.info("运行历史已记录: {}", file);
        } catch (IOException e) {
            // 历史记录失败不影响部署结果
            log.warn("写入运行历史失败: {}", e.getMessage(), e);
        }
    }
}
