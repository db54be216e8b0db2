package xyz.firestige.clouddeploy.support;

import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.infrastructure.process.CommandSpec;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessResult;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessRunner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 按命令行前缀返回预设结果的进程执行器，记录所有调用。
 * 后注册的规则优先；未匹配的命令返回退出码 0、空输出。
 */
public class FakeProcessRunner implements ProcessRunner {

    private final List<Rule> rules = new ArrayList<>();
    private final List<CommandSpec> calls = new ArrayList<>();

    public FakeProcessRunner on(String prefix, int exitCode, String stdout) {
        return on(prefix, spec -> ProcessResult.completed(spec.display(), exitCode, stdout, "", Duration.ZERO));
    }

    public FakeProcessRunner onFailure(String prefix, int exitCode, String stderr) {
        return on(prefix, spec -> ProcessResult.completed(spec.display(), exitCode, "", stderr, Duration.ZERO));
    }

    public FakeProcessRunner onMissing(String executable) {
        return on(executable, spec -> ProcessResult.notFound(spec.display()));
    }

    public FakeProcessRunner on(String prefix, Function<CommandSpec, ProcessResult> answer) {
        rules.add(0, new Rule(prefix, answer));
        return this;
    }

    @Override
    public synchronized ProcessResult run(CommandSpec spec, CancellationToken token) {
        calls.add(spec);
        String line = spec.display();
        for (Rule rule : rules) {
            if (line.startsWith(rule.prefix)) {
                return rule.answer.apply(spec);
            }
        }
        return ProcessResult.completed(line, 0, "", "", Duration.ZERO);
    }

    public List<CommandSpec> calls() {
        return new ArrayList<>(calls);
    }

    public List<String> commands() {
        return calls.stream().map(CommandSpec::display).toList();
    }

    public boolean ran(String prefix) {
        return commands().stream().anyMatch(c -> c.startsWith(prefix));
    }

    public long count(String prefix) {
        return commands().stream().filter(c -> c.startsWith(prefix)).count();
    }

    private record Rule(String prefix, Function<CommandSpec, ProcessResult> answer) {
    }
}
