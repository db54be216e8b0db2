package xyz.firestige.clouddeploy.infrastructure.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * cloud-providers.yml 根节点
 */
public class ProviderCatalog {

    @JsonProperty("common-tools")
    private List<ToolDefinition> commonTools = new ArrayList<>();

    private Map<String, ProviderDefinition> providers = new LinkedHashMap<>();

    public List<ToolDefinition> getCommonTools() {
        return commonTools;
    }

    public void setCommonTools(List<ToolDefinition> commonTools) {
        this.commonTools = commonTools;
    }

    public Map<String, ProviderDefinition> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderDefinition> providers) {
        this.providers = providers;
    }
}
