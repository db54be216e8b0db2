package xyz.firestige.clouddeploy.infrastructure.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.shared.exception.SetupInterruptedException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 标准输入/输出终端实现。
 * 读取在后台线程完成，主线程按固定间隔检查取消令牌，因此 Ctrl+C 不会卡在阻塞读上。
 */
public class TerminalConsole implements Console {

    private static final Logger log = LoggerFactory.getLogger(TerminalConsole.class);
    private static final long POLL_MS = 200;

    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String GREEN = "\u001B[92m";
    private static final String YELLOW = "\u001B[93m";
    private static final String RED = "\u001B[91m";
    private static final String CYAN = "\u001B[96m";
    private static final String MAGENTA = "\u001B[95m";

    private final BufferedReader in;
    private final PrintStream out;
    private final CancellationToken token;
    private final boolean colors;
    private final ExecutorService reader;
    private Future<String> pendingRead;

    public TerminalConsole(CancellationToken token) {
        this(System.in, System.out, token, System.console() != null && System.getenv("NO_COLOR") == null);
    }

    public TerminalConsole(InputStream in, PrintStream out, CancellationToken token, boolean colors) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.token = token;
        this.colors = colors;
        this.reader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "console-reader");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void println(String line) {
        out.println(line);
    }

    @Override
    public void info(String message) {
        out.println(style(CYAN, "ℹ  " + message));
    }

    @Override
    public void success(String message) {
        out.println(style(GREEN, "✓ " + message));
    }

    @Override
    public void warn(String message) {
        out.println(style(YELLOW, "⚠  " + message));
    }

    @Override
    public void error(String message) {
        out.println(style(RED, "✗ " + message));
    }

    @Override
    public void header(String title) {
        String rule = "=".repeat(60);
        out.println();
        out.println(style(MAGENTA, rule));
        out.println(style(BOLD, "  " + title));
        out.println(style(MAGENTA, rule));
        out.println();
    }

    @Override
    public String prompt(String question, String defaultValue) {
        String text = defaultValue != null && !defaultValue.isEmpty()
                ? question + " [" + style(CYAN, defaultValue) + "]: "
                : question + ": ";
        out.print(text);
        out.flush();
        String line = readLine(false).strip();
        if (line.isEmpty() && defaultValue != null) {
            return defaultValue;
        }
        return line;
    }

    @Override
    public String promptSecret(String question) {
        out.print(question + ": ");
        out.flush();
        return readLine(true).strip();
    }

    @Override
    public boolean confirm(String question, boolean defaultYes) {
        String hint = defaultYes ? "Y/n" : "y/N";
        while (true) {
            out.print(question + " [" + hint + "]: ");
            out.flush();
            String answer = readLine(false).strip().toLowerCase(Locale.ROOT);
            if (answer.isEmpty()) {
                return defaultYes;
            }
            if (answer.equals("y") || answer.equals("yes")) {
                return true;
            }
            if (answer.equals("n") || answer.equals("no")) {
                return false;
            }
            error("Please answer 'y' or 'n'.");
        }
    }

    @Override
    public int choose(String question, List<String> choices, int defaultIndex) {
        out.println();
        out.println(question);
        for (int i = 0; i < choices.size(); i++) {
            String marker = i == defaultIndex ? " (default)" : "";
            out.println("  " + (i + 1) + ". " + choices.get(i) + marker);
        }
        while (true) {
            out.print("Enter choice [1-" + choices.size() + "]: ");
            out.flush();
            String answer = readLine(false).strip();
            if (answer.isEmpty() && defaultIndex >= 0) {
                return defaultIndex;
            }
            int exact = choices.indexOf(answer);
            if (exact >= 0) {
                return exact;
            }
            try {
                int index = Integer.parseInt(answer) - 1;
                if (index >= 0 && index < choices.size()) {
                    return index;
                }
            } catch (NumberFormatException e) {
                log.debug("非数字选项: {}", answer);
            }
            error("Invalid choice. Please enter a number between 1 and " + choices.size() + ".");
        }
    }

    private String readLine(boolean secret) {
        token.throwIfCancelled();
        if (pendingRead == null) {
            java.io.Console terminal = System.console();
            Callable<String> task = secret && terminal != null
                    ? () -> {
                        char[] chars = terminal.readPassword();
                        return chars == null ? null : new String(chars);
                    }
                    : this::readRaw;
            pendingRead = reader.submit(task);
        }
        while (true) {
            try {
                String line = pendingRead.get(POLL_MS, TimeUnit.MILLISECONDS);
                pendingRead = null;
                if (line == null) {
                    token.cancel("End of input");
                    throw new SetupInterruptedException("End of input while waiting for an answer");
                }
                return line;
            } catch (TimeoutException e) {
                token.throwIfCancelled();
            } catch (ExecutionException e) {
                pendingRead = null;
                throw new SetupInterruptedException("Cannot read from terminal: " + e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                token.cancel("Thread interrupted");
                token.throwIfCancelled();
            }
        }
    }

    private String readRaw() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String style(String code, String text) {
        return colors ? code + text + RESET : text;
    }
}
