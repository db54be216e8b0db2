package xyz.firestige.clouddeploy.facade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import picocli.CommandLine;
import xyz.firestige.clouddeploy.application.SessionController;
import xyz.firestige.clouddeploy.infrastructure.console.InterruptHandler;

/**
 * Spring 启动后解析命令行并运行一次会话，退出码交给 SpringApplication.exit
 */
public class DeployerCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(DeployerCommandRunner.class);

    private final SessionController sessionController;
    private final InterruptHandler interruptHandler;
    private int exitCode;

    public DeployerCommandRunner(SessionController sessionController, InterruptHandler interruptHandler) {
        this.sessionController = sessionController;
        this.interruptHandler = interruptHandler;
    }

    @Override
    public void run(String... args) {
        interruptHandler.install();
        CommandLine commandLine = new CommandLine(new DeployerCommand(sessionController));
        exitCode = commandLine.execute(args);
        log.info("[DeployerCommandRunner] 退出码: {}", exitCode);
        // 参数错误、--help 时会话没有运行
        interruptHandler.cleanupComplete();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
