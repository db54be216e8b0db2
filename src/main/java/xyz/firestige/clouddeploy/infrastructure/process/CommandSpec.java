package xyz.firestige.clouddeploy.infrastructure.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 一次外部命令调用的描述。敏感值只允许通过 stdin 传入，不能出现在参数中。
 */
public final class CommandSpec {

    private final String executable;
    private final List<String> args;
    private final Map<String, String> env;
    private final Path workDir;
    private final Duration timeout;
    private final String stdin;
    private final boolean streamOutput;

    private CommandSpec(Builder b) {
        this.executable = Objects.requireNonNull(b.executable, "executable");
        this.args = Collections.unmodifiableList(new ArrayList<>(b.args));
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(b.env));
        this.workDir = b.workDir;
        this.timeout = Objects.requireNonNull(b.timeout, "timeout");
        this.stdin = b.stdin;
        this.streamOutput = b.streamOutput;
    }

    public static Builder of(String executable, String... args) {
        return new Builder(executable).args(args);
    }

    public String getExecutable() {
        return executable;
    }

    public List<String> getArgs() {
        return args;
    }

    public List<String> commandLine() {
        List<String> cmd = new ArrayList<>(args.size() + 1);
        cmd.add(executable);
        cmd.addAll(args);
        return cmd;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getStdin() {
        return stdin;
    }

    public boolean isStreamOutput() {
        return streamOutput;
    }

    /**
     * 用于日志和错误提示；stdin 内容永不出现
     */
    public String display() {
        return String.join(" ", commandLine());
    }

    @Override
    public String toString() {
        return display();
    }

    public static final class Builder {
        private final String executable;
        private final List<String> args = new ArrayList<>();
        private final Map<String, String> env = new LinkedHashMap<>();
        private Path workDir;
        private Duration timeout = Duration.ofMinutes(2);
        private String stdin;
        private boolean streamOutput;

        private Builder(String executable) {
            this.executable = executable;
        }

        public Builder args(String... values) {
            Collections.addAll(args, values);
            return this;
        }

        public Builder args(List<String> values) {
            args.addAll(values);
            return this;
        }

        public Builder env(String key, String value) {
            env.put(key, value);
            return this;
        }

        public Builder workDir(Path dir) {
            this.workDir = dir;
            return this;
        }

        public Builder timeout(Duration value) {
            this.timeout = value;
            return this;
        }

        public Builder stdin(String value) {
            this.stdin = value;
            return this;
        }

        /**
         * 实时把输出回显给用户（同时仍然缓存）
         */
        public Builder streamOutput() {
            this.streamOutput = true;
            return this;
        }

        public CommandSpec build() {
            return new CommandSpec(this);
        }
    }
}
