package xyz.firestige.clouddeploy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.HashMap;
import java.util.Map;

/**
 * n8n 多云部署工具入口
 */
@SpringBootApplication
public class CloudDeployApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CloudDeployApplication.class);
        app.setDefaultProperties(defaultProperties(args));
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * --work-dir 需要在容器创建前生效（工作区布局是单例 bean）
     */
    static Map<String, Object> defaultProperties(String[] args) {
        Map<String, Object> props = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--work-dir=")) {
                props.put("deployer.work-dir", arg.substring("--work-dir=".length()));
            } else if (arg.equals("--work-dir") && i + 1 < args.length) {
                props.put("deployer.work-dir", args[i + 1]);
            }
        }
        return props;
    }
}
