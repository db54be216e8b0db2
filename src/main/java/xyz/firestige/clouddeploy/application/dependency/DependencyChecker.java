package xyz.firestige.clouddeploy.application.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.infrastructure.catalog.ToolDefinition;
import xyz.firestige.clouddeploy.infrastructure.process.CommandSpec;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessResult;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessRunner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 外部工具依赖检查：运行版本查询命令，按工具的正则解析版本并与最低版本比较。
 * 只读，不做任何修改。
 */
public class DependencyChecker {

    private static final Logger log = LoggerFactory.getLogger(DependencyChecker.class);

    private final ProcessRunner processRunner;
    private final Duration versionTimeout;

    public DependencyChecker(ProcessRunner processRunner, Duration versionTimeout) {
        this.processRunner = processRunner;
        this.versionTimeout = versionTimeout;
    }

    public DependencyReport check(List<ToolDefinition> tools, CancellationToken token) {
        List<ToolCheckResult> results = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            token.throwIfCancelled();
            ToolCheckResult result = checkTool(tool, token);
            log.info("依赖检查: {}", result.describe());
            results.add(result);
        }
        DependencyReport report = new DependencyReport(results);
        if (!report.satisfied()) {
            log.warn("依赖检查未通过: {}", report.blocking().stream().map(ToolCheckResult::name).toList());
        }
        return report;
    }

    ToolCheckResult checkTool(ToolDefinition tool, CancellationToken token) {
        CommandSpec spec = CommandSpec.of(tool.getName())
                .args(tool.getVersionArgs())
                .timeout(versionTimeout)
                .build();
        ProcessResult result = processRunner.run(spec, token);
        if (result.notFound()) {
            return new ToolCheckResult(tool, false, null, false);
        }
        if (result.cancelled()) {
            token.throwIfCancelled();
        }
        String version = parseVersion(tool, result);
        if (version == null) {
            // 已安装但无法识别版本，不阻断
            return new ToolCheckResult(tool, true, null, true);
        }
        boolean ok = tool.getMinVersion() == null || VersionComparator.atLeast(version, tool.getMinVersion());
        return new ToolCheckResult(tool, true, version, ok);
    }

    static String parseVersion(ToolDefinition tool, ProcessResult result) {
        if (tool.getVersionPattern() == null) {
            return null;
        }
        Pattern pattern = Pattern.compile(tool.getVersionPattern());
        for (String text : new String[]{result.stdout(), result.stderr()}) {
            if (text == null) {
                continue;
            }
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return m.group(1);
            }
        }
        return null;
    }
}
