package xyz.firestige.clouddeploy.infrastructure.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * YAML 目录加载器
 *
 * 职责：
 * 1. 从 classpath 加载 cloud-providers.yml
 * 2. 解析为目录对象并校验
 * 3. 按云厂商提供工具清单、区域列表和默认值
 */
public class CloudProviderCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CloudProviderCatalogLoader.class);
    public static final String CATALOG_FILE = "cloud-providers.yml";

    private final String resourceName;
    private final ObjectMapper yamlMapper;
    private ProviderCatalog catalog;

    public CloudProviderCatalogLoader() {
        this(CATALOG_FILE);
    }

    public CloudProviderCatalogLoader(String resourceName) {
        this.resourceName = resourceName;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @PostConstruct
    public void loadCatalog() {
        try {
            log.info("Loading cloud provider catalog from {}", resourceName);
            ClassPathResource resource = new ClassPathResource(resourceName);
            try (InputStream in = resource.getInputStream()) {
                this.catalog = yamlMapper.readValue(in, ProviderCatalog.class);
            }
            validateCatalog();
            log.info("Cloud provider catalog loaded: providers={}", catalog.getProviders().keySet());
        } catch (IOException e) {
            log.error("Failed to load cloud provider catalog", e);
            throw new IllegalStateException("Cannot load cloud provider catalog " + resourceName, e);
        }
    }

    /**
     * 公共工具 + 云厂商 CLI
     */
    public List<ToolDefinition> toolsFor(CloudProvider provider) {
        List<ToolDefinition> tools = new ArrayList<>(catalog().getCommonTools());
        tools.addAll(provider(provider).getTools());
        return List.copyOf(tools);
    }

    /**
     * 与云厂商无关的工具，尚未选定云厂商时先检查这些
     */
    public List<ToolDefinition> commonTools() {
        return List.copyOf(catalog().getCommonTools());
    }

    public List<String> regionsFor(CloudProvider provider) {
        return List.copyOf(provider(provider).getRegions());
    }

    public ProviderDefinition provider(CloudProvider provider) {
        ProviderDefinition def = catalog().getProviders().get(provider.getId());
        if (def == null) {
            throw new IllegalStateException("No catalog entry for provider " + provider.getId());
        }
        return def;
    }

    public ProviderDefinition.Defaults defaultsFor(CloudProvider provider) {
        return provider(provider).getDefaults();
    }

    private ProviderCatalog catalog() {
        if (catalog == null) {
            throw new IllegalStateException("Catalog not loaded");
        }
        return catalog;
    }

    private void validateCatalog() {
        for (CloudProvider provider : CloudProvider.values()) {
            ProviderDefinition def = catalog.getProviders().get(provider.getId());
            if (def == null) {
                throw new IllegalStateException("Catalog is missing provider " + provider.getId());
            }
            if (def.getRegions().isEmpty()) {
                throw new IllegalStateException("Catalog lists no regions for " + provider.getId());
            }
        }
        List<ToolDefinition> all = new ArrayList<>(catalog.getCommonTools());
        catalog.getProviders().values().forEach(p -> all.addAll(p.getTools()));
        for (ToolDefinition tool : all) {
            if (tool.getName() == null || tool.getName().isBlank()) {
                throw new IllegalStateException("Catalog tool without name");
            }
            if (tool.getVersionPattern() != null) {
                try {
                    Pattern.compile(tool.getVersionPattern());
                } catch (PatternSyntaxException e) {
                    throw new IllegalStateException("Invalid version pattern for " + tool.getName(), e);
                }
            }
        }
    }
}
