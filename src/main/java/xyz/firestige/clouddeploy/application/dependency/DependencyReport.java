package xyz.firestige.clouddeploy.application.dependency;

import java.util.List;
import java.util.Optional;

/**
 * 依赖检查汇总
 */
public record DependencyReport(List<ToolCheckResult> results) {

    public DependencyReport {
        results = List.copyOf(results);
    }

    public boolean satisfied() {
        return results.stream().noneMatch(ToolCheckResult::blocking);
    }

    public List<ToolCheckResult> blocking() {
        return results.stream().filter(ToolCheckResult::blocking).toList();
    }

    public Optional<ToolCheckResult> find(String tool) {
        return results.stream().filter(r -> r.name().equals(tool)).findFirst();
    }

    /**
     * 可选工具是否可用（例如 openssl）
     */
    public boolean available(String tool) {
        return find(tool).map(ToolCheckResult::found).orElse(false);
    }
}
