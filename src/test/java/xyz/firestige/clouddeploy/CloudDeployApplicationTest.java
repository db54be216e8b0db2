package xyz.firestige.clouddeploy;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CloudDeployApplicationTest {

    @Test
    void testWorkDirBecomesDefaultProperty() {
        assertThat(CloudDeployApplication.defaultProperties(new String[]{"--cloud", "aws", "--work-dir", "/srv/n8n"}))
                .containsEntry("deployer.work-dir", "/srv/n8n");
        assertThat(CloudDeployApplication.defaultProperties(new String[]{"--work-dir=/srv/other"}))
                .containsEntry("deployer.work-dir", "/srv/other");
    }

    @Test
    void testNoWorkDirLeavesDefaults() {
        Map<String, Object> props = CloudDeployApplication.defaultProperties(new String[]{"--teardown"});

        assertThat(props).isEmpty();
    }
}
