package xyz.firestige.clouddeploy.infrastructure.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import xyz.firestige.clouddeploy.domain.shared.exception.ExternalToolException;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessResultTest {

    private static ProcessResult failed(String stderr) {
        return ProcessResult.completed("tool", 1, "", stderr, Duration.ZERO);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Error from server (NotFound): persistentvolumeclaims \"data\" not found",
            "Error: uninstall: Release not loaded: n8n: release: not found",
            "An error occurred (ResourceNotFoundException) when calling the DescribeSecret operation",
            "An error occurred (DBInstanceNotFound) when calling the DescribeDBInstances operation",
            "ERROR: (SecretNotFound) A secret with (name/id) n8n-encryption-key was not found in this key vault",
            "ERROR: (gcloud.secrets.describe) NOT_FOUND: Secret [n8n-encryption-key] not found"
    })
    void testToolSpecificAbsenceIsRecognised(String stderr) {
        assertThat(failed(stderr).indicatesAbsent()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "error: context \"n8n-eks-cluster\" not found",
            "The config profile (staging) could not be found",
            "Error: Kubernetes cluster unreachable: stat /root/.kube/config: no such file or directory",
            "ERROR: (gcloud.container.clusters.get-credentials) project does not exist"
    })
    void testUnrelatedErrorsAreNotAbsence(String stderr) {
        assertThat(failed(stderr).indicatesAbsent()).isFalse();
    }

    @Test
    void testFailureCarriesToolOutput() {
        assertThatThrownBy(() -> failed("Error: AccessDenied").orThrow())
                .isInstanceOfSatisfying(ExternalToolException.class,
                        e -> assertThat(e.getToolOutput()).isEqualTo("Error: AccessDenied"));
    }
}
