package xyz.firestige.clouddeploy.domain.shared.exception;

/**
 * 自动 TLS 的 DNS 确认被拒绝。基础设施与应用已部署，不回滚。
 */
public class DnsNotConfirmedException extends DeployerException {

    public DnsNotConfirmedException(String host) {
        super(ErrorType.PRECONDITION_ERROR, "DNS for " + host + " was not confirmed, certificate issuance skipped");
        markRecoverable();
        withHint("Point DNS for " + host + " at the LoadBalancer endpoint, then run again with --update-tls");
    }
}
