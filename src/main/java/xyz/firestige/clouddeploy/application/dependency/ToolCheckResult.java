package xyz.firestige.clouddeploy.application.dependency;

import xyz.firestige.clouddeploy.infrastructure.catalog.ToolDefinition;

/**
 * 单个工具的检查结果
 *
 * @param tool             工具定义
 * @param found            是否可执行
 * @param version          解析出的版本；无法解析时为 null
 * @param satisfiesMinimum 是否满足最低版本（版本未知视为满足）
 */
public record ToolCheckResult(ToolDefinition tool, boolean found, String version, boolean satisfiesMinimum) {

    public String name() {
        return tool.getName();
    }

    public boolean required() {
        return tool.isRequired();
    }

    public boolean versionUnknown() {
        return found && version == null;
    }

    /**
     * 是否阻断运行：只有必需工具缺失或版本过低才阻断
     */
    public boolean blocking() {
        return tool.isRequired() && (!found || !satisfiesMinimum);
    }

    public String describe() {
        if (!found) {
            return name() + " - NOT installed";
        }
        if (version == null) {
            return name() + " - installed (could not determine version)";
        }
        if (!satisfiesMinimum) {
            return name() + " - outdated (v" + version + ", requires >=" + tool.getMinVersion() + ")";
        }
        return name() + " - installed (v" + version + ")";
    }
}
