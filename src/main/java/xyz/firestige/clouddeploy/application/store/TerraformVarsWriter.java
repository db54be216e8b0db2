package xyz.firestige.clouddeploy.application.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * terraform.tfvars 生成：纯 key = value，不写入任何密钥
 */
public class TerraformVarsWriter {

    private static final Logger log = LoggerFactory.getLogger(TerraformVarsWriter.class);

    public void write(Path file, Map<String, Object> variables) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, render(variables), StandardCharsets.UTF_8);
            log.info("已生成 {} ({} 个变量)", file, variables.size());
        } catch (IOException e) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Cannot write " + file + ": " + e.getMessage(), e);
        }
    }

    public String render(Map<String, Object> variables) {
        int width = variables.keySet().stream().mapToInt(String::length).max().orElse(0);
        StringBuilder sb = new StringBuilder("# Generated by cloud-deploy. Do not store secrets in this file.\n");
        for (Map.Entry<String, Object> e : variables.entrySet()) {
            sb.append(String.format("%-" + width + "s = %s%n", e.getKey(), literal(e.getValue())));
        }
        return sb.toString();
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(TerraformVarsWriter::literal).collect(Collectors.joining(", ", "[", "]"));
        }
        String s = value.toString()
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("${", "$${");
        return "\"" + s + "\"";
    }
}
