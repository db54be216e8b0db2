package xyz.firestige.clouddeploy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 全局配置（application.yml 覆盖默认值）
 * prefix: deployer
 */
@Validated
@ConfigurationProperties(prefix = "deployer")
public class DeployerProperties {

    /**
     * 工作目录：包含 terraform/、helm/ 以及持久化的配置文件
     */
    @NotBlank
    private String workDir = ".";

    /**
     * 拆除前可中止的倒计时
     */
    @Min(0)
    private int countdownSeconds = 5;

    @Valid
    @NestedConfigurationProperty
    private Timeouts timeouts = new Timeouts();

    @Valid
    @NestedConfigurationProperty
    private Polling polling = new Polling();

    @Valid
    @NestedConfigurationProperty
    private Releases releases = new Releases();

    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }

    public int getCountdownSeconds() { return countdownSeconds; }
    public void setCountdownSeconds(int countdownSeconds) { this.countdownSeconds = countdownSeconds; }

    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }

    public Polling getPolling() { return polling; }
    public void setPolling(Polling polling) { this.polling = polling; }

    public Releases getReleases() { return releases; }
    public void setReleases(Releases releases) { this.releases = releases; }

    /**
     * 每类外部工具调用的硬超时
     */
    public static class Timeouts {
        @NotNull
        private Duration identity = Duration.ofSeconds(30);
        @NotNull
        private Duration version = Duration.ofSeconds(10);
        @NotNull
        private Duration infrastructure = Duration.ofMinutes(60);
        @NotNull
        private Duration helm = Duration.ofMinutes(15);
        @NotNull
        private Duration kubectl = Duration.ofMinutes(2);

        public Duration getIdentity() { return identity; }
        public void setIdentity(Duration identity) { this.identity = identity; }

        public Duration getVersion() { return version; }
        public void setVersion(Duration version) { this.version = version; }

        public Duration getInfrastructure() { return infrastructure; }
        public void setInfrastructure(Duration infrastructure) { this.infrastructure = infrastructure; }

        public Duration getHelm() { return helm; }
        public void setHelm(Duration helm) { this.helm = helm; }

        public Duration getKubectl() { return kubectl; }
        public void setKubectl(Duration kubectl) { this.kubectl = kubectl; }
    }

    /**
     * 就绪/端点轮询：固定间隔 + 总截止时间
     */
    public static class Polling {
        @NotNull
        private Duration interval = Duration.ofSeconds(10);
        @NotNull
        private Duration readiness = Duration.ofMinutes(5);
        @NotNull
        private Duration endpoint = Duration.ofMinutes(5);
        @NotNull
        private Duration loadBalancerDrain = Duration.ofMinutes(5);

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public Duration getReadiness() { return readiness; }
        public void setReadiness(Duration readiness) { this.readiness = readiness; }

        public Duration getEndpoint() { return endpoint; }
        public void setEndpoint(Duration endpoint) { this.endpoint = endpoint; }

        public Duration getLoadBalancerDrain() { return loadBalancerDrain; }
        public void setLoadBalancerDrain(Duration loadBalancerDrain) { this.loadBalancerDrain = loadBalancerDrain; }
    }

    /**
     * helm release 名称与 chart 仓库
     */
    public static class Releases {
        @NotBlank
        private String application = "n8n";
        @NotBlank
        private String ingress = "ingress-nginx";
        @NotBlank
        private String ingressNamespace = "ingress-nginx";
        @NotBlank
        private String ingressRepo = "https://kubernetes.github.io/ingress-nginx";
        @NotBlank
        private String certManager = "cert-manager";
        @NotBlank
        private String certManagerNamespace = "cert-manager";
        @NotBlank
        private String certManagerRepo = "https://charts.jetstack.io";

        public String getApplication() { return application; }
        public void setApplication(String application) { this.application = application; }

        public String getIngress() { return ingress; }
        public void setIngress(String ingress) { this.ingress = ingress; }

        public String getIngressNamespace() { return ingressNamespace; }
        public void setIngressNamespace(String ingressNamespace) { this.ingressNamespace = ingressNamespace; }

        public String getIngressRepo() { return ingressRepo; }
        public void setIngressRepo(String ingressRepo) { this.ingressRepo = ingressRepo; }

        public String getCertManager() { return certManager; }
        public void setCertManager(String certManager) { this.certManager = certManager; }

        public String getCertManagerNamespace() { return certManagerNamespace; }
        public void setCertManagerNamespace(String certManagerNamespace) { this.certManagerNamespace = certManagerNamespace; }

        public String getCertManagerRepo() { return certManagerRepo; }
        public void setCertManagerRepo(String certManagerRepo) { this.certManagerRepo = certManagerRepo; }
    }
}
