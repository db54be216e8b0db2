package xyz.firestige.clouddeploy.infrastructure.tool;

import xyz.firestige.clouddeploy.infrastructure.helm.HelmValues;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * helm upgrade --install 的参数构建
 */
public final class HelmUpgradeCommand {

    private final String release;
    private final String chart;
    private final String namespace;
    private final boolean createNamespace;
    private final boolean reuseValues;
    private final Duration waitTimeout;
    private final List<Path> valuesFiles;
    private final HelmValues values;
    private final List<String> extraArgs;

    private HelmUpgradeCommand(Builder b) {
        this.release = Objects.requireNonNull(b.release, "release");
        this.chart = Objects.requireNonNull(b.chart, "chart");
        this.namespace = Objects.requireNonNull(b.namespace, "namespace");
        this.createNamespace = b.createNamespace;
        this.reuseValues = b.reuseValues;
        this.waitTimeout = b.waitTimeout;
        this.valuesFiles = List.copyOf(b.valuesFiles);
        this.values = b.values;
        this.extraArgs = List.copyOf(b.extraArgs);
    }

    public static Builder release(String release, String chart) {
        return new Builder(release, chart);
    }

    public String getRelease() {
        return release;
    }

    public String getNamespace() {
        return namespace;
    }

    public List<String> arguments() {
        List<String> args = new ArrayList<>(List.of("upgrade", "--install", release, chart, "--namespace", namespace));
        if (createNamespace) {
            args.add("--create-namespace");
        }
        if (reuseValues) {
            args.add("--reuse-values");
        }
        for (Path file : valuesFiles) {
            args.add("--values");
            args.add(file.toString());
        }
        if (waitTimeout != null) {
            args.add("--wait");
            args.add("--timeout");
            args.add(waitTimeout.toSeconds() + "s");
        }
        args.addAll(extraArgs);
        if (values != null) {
            args.addAll(values.toSetArguments());
        }
        return args;
    }

    public static final class Builder {
        private final String release;
        private final String chart;
        private String namespace;
        private boolean createNamespace;
        private boolean reuseValues;
        private Duration waitTimeout;
        private final List<Path> valuesFiles = new ArrayList<>();
        private HelmValues values;
        private final List<String> extraArgs = new ArrayList<>();

        private Builder(String release, String chart) {
            this.release = release;
            this.chart = chart;
        }

        public Builder namespace(String ns) {
            this.namespace = ns;
            return this;
        }

        public Builder createNamespace() {
            this.createNamespace = true;
            return this;
        }

        public Builder reuseValues() {
            this.reuseValues = true;
            return this;
        }

        public Builder waitFor(Duration timeout) {
            this.waitTimeout = timeout;
            return this;
        }

        public Builder valuesFile(Path file) {
            this.valuesFiles.add(file);
            return this;
        }

        public Builder values(HelmValues v) {
            this.values = v;
            return this;
        }

        public Builder extraArgs(String... args) {
            this.extraArgs.addAll(List.of(args));
            return this;
        }

        public HelmUpgradeCommand build() {
            return new HelmUpgradeCommand(this);
        }
    }
}
