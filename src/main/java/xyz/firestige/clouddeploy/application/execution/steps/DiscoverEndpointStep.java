package xyz.firestige.clouddeploy.application.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.application.execution.ClusterResources;
import xyz.firestige.clouddeploy.application.execution.ReadinessPoller;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;
import xyz.firestige.clouddeploy.domain.shared.exception.PollTimeoutException;
import xyz.firestige.clouddeploy.infrastructure.console.Console;
import xyz.firestige.clouddeploy.infrastructure.tool.KubectlClient;

import java.time.Duration;

/**
 * 轮询 ingress 控制器 Service 的外部地址。超时为软失败：资源已存在，只是地址尚未分配。
 */
public class DiscoverEndpointStep extends AbstractPhaseStep {

    private static final Logger log = LoggerFactory.getLogger(DiscoverEndpointStep.class);

    private final KubectlClient kubectl;
    private final ReadinessPoller poller;
    private final Console console;
    private final String ingressNamespace;
    private final Duration timeout;

    public DiscoverEndpointStep(KubectlClient kubectl, ReadinessPoller poller, Console console,
                                String ingressNamespace, Duration timeout) {
        super("discover-endpoint");
        this.kubectl = kubectl;
        this.poller = poller;
        this.console = console;
        this.ingressNamespace = ingressNamespace;
        this.timeout = timeout;
    }

    @Override
    public void execute(DeploymentSession session) {
        String address;
        try {
            address = poller.await("LoadBalancer address", timeout, session.getCancellationToken(),
                    () -> kubectl.loadBalancerAddress(ClusterResources.INGRESS_CONTROLLER_SERVICE, ingressNamespace,
                            session.getCancellationToken()));
        } catch (PollTimeoutException e) {
            throw e.recoverable().withHint("The load balancer may still be provisioning. Check it with: kubectl get svc "
                    + ClusterResources.INGRESS_CONTROLLER_SERVICE + " -n " + ingressNamespace);
        }
        session.setEndpoint(address);
        log.info("[DiscoverEndpointStep] endpoint: {}", address);
        console.success("LoadBalancer endpoint: " + address);
        console.info("Point DNS for " + session.getConfig().getHost() + " at this address");
    }
}
