package xyz.firestige.clouddeploy.application.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.clouddeploy.infrastructure.cloud.AwsPlatform;
import xyz.firestige.clouddeploy.support.FakeProcessRunner;
import xyz.firestige.clouddeploy.support.TestConfigs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TerraformVarsWriterTest {

    @TempDir
    Path dir;

    private final TerraformVarsWriter writer = new TerraformVarsWriter();

    @Test
    void rendersHclLiterals() {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("region", "us-east-1");
        vars.put("node_min_size", 1);
        vars.put("enable_basic_auth", false);
        vars.put("node_instance_types", List.of("t3.medium"));
        vars.put("note", "say \"hi\" ${x}");

        String hcl = writer.render(vars);

        assertThat(hcl).contains("region              = \"us-east-1\"");
        assertThat(hcl).contains("node_min_size       = 1");
        assertThat(hcl).contains("enable_basic_auth   = false");
        assertThat(hcl).contains("node_instance_types = [\"t3.medium\"]");
        assertThat(hcl).contains("note                = \"say \\\"hi\\\" $${x}\"");
    }

    @Test
    void providerVariablesNeverContainTheEncryptionKey() throws IOException {
        AwsPlatform aws = new AwsPlatform(new FakeProcessRunner(), new ObjectMapper(),
                Duration.ofSeconds(30), Duration.ofMinutes(2));
        Path file = dir.resolve("terraform/aws/terraform.tfvars");

        writer.write(file, aws.terraformVariables(TestConfigs.awsWithEverything()));

        String content = Files.readString(file);
        assertThat(content).doesNotContain(TestConfigs.ENCRYPTION_KEY);
        assertThat(content).contains("cluster_name").contains("rds_instance_class").contains("database_type");
        assertThat(content).containsPattern("rds_multi_az\\s+= true");
    }
}
