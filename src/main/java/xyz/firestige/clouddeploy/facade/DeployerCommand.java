package xyz.firestige.clouddeploy.facade;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import xyz.firestige.clouddeploy.application.SessionController;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;
import xyz.firestige.clouddeploy.domain.config.DeployMode;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * 命令行入口。无参数时进入交互式完整部署，其余模式互斥。
 */
@Command(
        name = "cloud-deploy",
        description = "Deploy n8n to a managed Kubernetes cluster on AWS, Azure or GCP",
        mixinStandardHelpOptions = true,
        version = "cloud-deploy 1.0.0",
        exitCodeListHeading = "%nExit codes:%n",
        exitCodeList = {
                "0:success",
                "1:phase failure, aborted configuration or unexpected error",
                "2:precondition failure (tools, identity, region state, missing saved configuration)",
                "3:partial success (endpoint or DNS follow-up required)",
                "130:interrupted"
        }
)
public class DeployerCommand implements Callable<Integer> {

    @Option(
            names = "--cloud",
            paramLabel = "<provider>",
            description = "Cloud provider: aws, azure or gcp (prompted when omitted)",
            converter = CloudProviderConverter.class
    )
    CloudProvider cloud;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    ModeOptions mode = new ModeOptions();

    @Option(
            names = "--work-dir",
            paramLabel = "<dir>",
            description = "Project directory containing terraform/ and helm/ (default: current directory)"
    )
    Path workDir;

    private final SessionController sessionController;

    public DeployerCommand(SessionController sessionController) {
        this.sessionController = sessionController;
    }

    static class ModeOptions {

        @Option(names = "--teardown", description = "Destroy the saved deployment")
        boolean teardown;

        @Option(names = "--skip-terraform", description = "Reuse applied infrastructure and deploy the application")
        boolean skipTerraform;

        @Option(names = "--update-tls", description = "Only configure TLS and basic authentication")
        boolean updateTls;

        @Option(names = "--list-states", description = "List saved region state snapshots")
        boolean listStates;

        DeployMode toMode() {
            if (teardown) {
                return DeployMode.TEARDOWN;
            }
            if (skipTerraform) {
                return DeployMode.SKIP_INFRASTRUCTURE;
            }
            if (updateTls) {
                return DeployMode.UPDATE_TLS;
            }
            if (listStates) {
                return DeployMode.LIST_STATES;
            }
            return DeployMode.DEPLOY;
        }
    }

    DeployMode resolveMode() {
        return mode == null ? DeployMode.DEPLOY : mode.toMode();
    }

    @Override
    public Integer call() {
        return sessionController.run(resolveMode(), cloud);
    }
}
