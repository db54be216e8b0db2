package xyz.firestige.clouddeploy.infrastructure.cloud;

import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DeploymentConfig;
import xyz.firestige.clouddeploy.domain.session.DeploymentSession;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 云厂商相关操作：身份、kubeconfig、infra 变量、密钥存储、删除保护。
 * 密钥值一律通过子进程 stdin 传递。
 */
public interface CloudPlatform {

    CloudProvider provider();

    /**
     * 可选的身份配置（AWS profile / Azure subscription / GCP project）
     */
    List<String> listProfiles(DeploymentSession session);

    /**
     * 校验身份可用
     *
     * @return 身份描述（账号、用户）
     * @throws xyz.firestige.clouddeploy.domain.shared.exception.PreconditionException 校验失败
     */
    String verifyIdentity(String profile, String region, DeploymentSession session);

    /**
     * 传给 infra 引擎的环境变量
     */
    Map<String, String> toolEnvironment(DeploymentConfig config);

    Map<String, Object> terraformVariables(DeploymentConfig config);

    List<String> requiredOutputs(DeploymentConfig config);

    void configureKubectl(DeploymentSession session);

    String encryptionKeySecretName();

    String basicAuthSecretName();

    boolean secretExists(DeploymentSession session, String name);

    void putSecret(DeploymentSession session, String name, String value, String description);

    Optional<String> readSecret(DeploymentSession session, String name);

    /**
     * 带有应用标签的密钥条目
     */
    List<String> listAppSecrets(DeploymentSession session);

    /**
     * @return true 已删除；false 本就不存在
     */
    boolean deleteSecret(DeploymentSession session, String name);

    /**
     * 如托管数据库开启了删除保护则关闭
     *
     * @return 是否做了修改
     */
    boolean clearDatabaseDeletionProtection(DeploymentSession session);
}
