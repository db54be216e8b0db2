package xyz.firestige.clouddeploy.infrastructure.helm;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HelmValuesTest {

    @Test
    void rejectsValuesOfTheWrongType() {
        assertThatThrownBy(() -> HelmValues.create().put(HelmValue.TLS_ENABLED, "true"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Boolean");
    }

    @Test
    void annotationKeysAreEscapedInSetArguments() {
        HelmValues values = HelmValues.create()
                .put(HelmValue.CLUSTER_ISSUER, "letsencrypt-production")
                .put(HelmValue.TLS_ENABLED, true);

        assertThat(values.toSetArguments()).containsExactly(
                "--set", "ingress.tls.enabled=true",
                "--set-string", "ingress.annotations.cert-manager\\.io/cluster-issuer=letsencrypt-production");
    }

    @Test
    void commasInValuesAreEscaped() {
        HelmValues values = HelmValues.create().put(HelmValue.AUTH_REALM, "Restricted, please log in");

        assertThat(values.toSetArguments()).containsExactly(
                "--set-string", "ingress.annotations.nginx\\.ingress\\.kubernetes\\.io/auth-realm=Restricted\\, please log in");
    }

    @Test
    @SuppressWarnings("unchecked")
    void nestedMapKeepsDottedAnnotationAsSingleKey() {
        HelmValues values = HelmValues.create()
                .put(HelmValue.INGRESS_HOST, "n8n.example.com")
                .put(HelmValue.AUTH_TYPE, "basic");

        Map<String, Object> ingress = (Map<String, Object>) values.toNestedMap().get("ingress");
        Map<String, Object> annotations = (Map<String, Object>) ingress.get("annotations");

        assertThat(ingress).containsEntry("host", "n8n.example.com");
        assertThat(annotations).containsOnlyKeys("nginx.ingress.kubernetes.io/auth-type");
    }

    @Test
    void nullRemovesValue() {
        HelmValues values = HelmValues.create().put(HelmValue.DATABASE_HOST, "db").put(HelmValue.DATABASE_HOST, null);
        assertThat(values.isEmpty()).isTrue();
    }
}
