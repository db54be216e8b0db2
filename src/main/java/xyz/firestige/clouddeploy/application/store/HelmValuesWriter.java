package xyz.firestige.clouddeploy.application.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;
import xyz.firestige.clouddeploy.infrastructure.helm.HelmValues;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * values-&lt;provider&gt;.override.yaml 生成
 */
public class HelmValuesWriter {

    private static final Logger log = LoggerFactory.getLogger(HelmValuesWriter.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    public void write(Path file, HelmValues values) {
        try {
            Files.createDirectories(file.getParent());
            String yaml = "# Generated by cloud-deploy\n" + yamlMapper.writeValueAsString(values.toNestedMap());
            Files.writeString(file, yaml);
            log.info("已生成 {}", file);
        } catch (IOException e) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Cannot write " + file + ": " + e.getMessage(), e);
        }
    }
}
