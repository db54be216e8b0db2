package xyz.firestige.clouddeploy.domain.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * 目标云厂商
 */
public enum CloudProvider {

    AWS("aws", "AWS (Amazon EKS)", "aws"),
    AZURE("azure", "Azure (AKS)", "az"),
    GCP("gcp", "Google Cloud (GKE)", "gcloud");

    private final String id;
    private final String displayName;
    private final String cliExecutable;

    CloudProvider(String id, String displayName, String cliExecutable) {
        this.id = id;
        this.displayName = displayName;
        this.cliExecutable = cliExecutable;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getCliExecutable() {
        return cliExecutable;
    }

    @JsonCreator
    public static CloudProvider fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("cloud provider id is required");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cloud provider: " + id));
    }
}
