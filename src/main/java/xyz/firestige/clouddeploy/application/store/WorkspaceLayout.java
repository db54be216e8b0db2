package xyz.firestige.clouddeploy.application.store;

import xyz.firestige.clouddeploy.domain.config.CloudProvider;

import java.nio.file.Path;
import java.util.List;

/**
 * 工作目录下各持久化文件的位置
 */
public class WorkspaceLayout {

    public static final String CURRENT_CONFIG = ".setup-current.json";
    public static final String HISTORY_LOG = "setup_history.log";
    public static final String TFVARS = "terraform.tfvars";

    private final Path root;

    public WorkspaceLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path terraformDir(CloudProvider provider) {
        return root.resolve("terraform").resolve(provider.getId());
    }

    public Path tfvars(CloudProvider provider) {
        return terraformDir(provider).resolve(TFVARS);
    }

    public Path chartDir() {
        return root.resolve("helm");
    }

    public Path valuesOverride(CloudProvider provider) {
        return chartDir().resolve("values-" + provider.getId() + ".override.yaml");
    }

    public Path currentConfig() {
        return root.resolve(CURRENT_CONFIG);
    }

    public Path historyLog() {
        return root.resolve(HISTORY_LOG);
    }

    /**
     * 一次部署运行会改写的配置文件（写入前统一快照）
     */
    public List<Path> mutableFiles(CloudProvider provider) {
        return List.of(tfvars(provider), valuesOverride(provider), currentConfig());
    }
}
