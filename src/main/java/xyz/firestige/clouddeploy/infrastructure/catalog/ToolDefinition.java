package xyz.firestige.clouddeploy.infrastructure.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 外部工具定义：版本查询命令、版本号正则、最低版本
 */
public class ToolDefinition {

    private String name;

    /**
     * 版本查询参数（不含可执行文件名）
     */
    @JsonProperty("version-args")
    private List<String> versionArgs = new ArrayList<>();

    /**
     * 第一个捕获组为版本号
     */
    @JsonProperty("version-pattern")
    private String versionPattern;

    @JsonProperty("min-version")
    private String minVersion;

    @JsonProperty("install-url")
    private String installUrl;

    private String description;

    private boolean required = true;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getVersionArgs() {
        return versionArgs;
    }

    public void setVersionArgs(List<String> versionArgs) {
        this.versionArgs = versionArgs;
    }

    public String getVersionPattern() {
        return versionPattern;
    }

    public void setVersionPattern(String versionPattern) {
        this.versionPattern = versionPattern;
    }

    public String getMinVersion() {
        return minVersion;
    }

    public void setMinVersion(String minVersion) {
        this.minVersion = minVersion;
    }

    public String getInstallUrl() {
        return installUrl;
    }

    public void setInstallUrl(String installUrl) {
        this.installUrl = installUrl;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isRequired() {
        return required;
    }

    public void setRequired(boolean required) {
        this.required = required;
    }
}
