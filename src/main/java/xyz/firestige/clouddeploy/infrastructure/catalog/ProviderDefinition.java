package xyz.firestige.clouddeploy.infrastructure.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个云厂商的目录条目
 */
public class ProviderDefinition {

    private List<ToolDefinition> tools = new ArrayList<>();
    private List<String> regions = new ArrayList<>();

    @JsonProperty("default-region")
    private String defaultRegion;

    @JsonProperty("node-types")
    private List<String> nodeTypes = new ArrayList<>();

    private Defaults defaults = new Defaults();

    public List<ToolDefinition> getTools() {
        return tools;
    }

    public void setTools(List<ToolDefinition> tools) {
        this.tools = tools;
    }

    public List<String> getRegions() {
        return regions;
    }

    public void setRegions(List<String> regions) {
        this.regions = regions;
    }

    public String getDefaultRegion() {
        return defaultRegion;
    }

    public void setDefaultRegion(String defaultRegion) {
        this.defaultRegion = defaultRegion;
    }

    public List<String> getNodeTypes() {
        return nodeTypes;
    }

    public void setNodeTypes(List<String> nodeTypes) {
        this.nodeTypes = nodeTypes;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    /**
     * 交互提示使用的默认值
     */
    public static class Defaults {

        @JsonProperty("cluster-name")
        private String clusterName;

        @JsonProperty("node-type")
        private String nodeType;

        @JsonProperty("database-instance-class")
        private String databaseInstanceClass;

        @JsonProperty("database-storage-gb")
        private int databaseStorageGb = 20;

        @JsonProperty("resource-group")
        private String resourceGroup;

        public String getClusterName() {
            return clusterName;
        }

        public void setClusterName(String clusterName) {
            this.clusterName = clusterName;
        }

        public String getNodeType() {
            return nodeType;
        }

        public void setNodeType(String nodeType) {
            this.nodeType = nodeType;
        }

        public String getDatabaseInstanceClass() {
            return databaseInstanceClass;
        }

        public void setDatabaseInstanceClass(String databaseInstanceClass) {
            this.databaseInstanceClass = databaseInstanceClass;
        }

        public int getDatabaseStorageGb() {
            return databaseStorageGb;
        }

        public void setDatabaseStorageGb(int databaseStorageGb) {
            this.databaseStorageGb = databaseStorageGb;
        }

        public String getResourceGroup() {
            return resourceGroup;
        }

        public void setResourceGroup(String resourceGroup) {
            this.resourceGroup = resourceGroup;
        }
    }
}
