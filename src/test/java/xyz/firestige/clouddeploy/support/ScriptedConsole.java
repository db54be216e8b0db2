package xyz.firestige.clouddeploy.support;

import xyz.firestige.clouddeploy.infrastructure.console.Console;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 预置回答的控制台。
 * prompt：空串取默认值；confirm：y / n / 空串；choose：从 1 开始的序号或空串。
 */
public class ScriptedConsole implements Console {

    private final Deque<String> answers = new ArrayDeque<>();
    private final List<String> questions = new ArrayList<>();
    private final List<String> output = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public ScriptedConsole answer(String... values) {
        answers.addAll(List.of(values));
        return this;
    }

    private String next(String question) {
        questions.add(question);
        String value = answers.poll();
        if (value == null) {
            throw new IllegalStateException("No scripted answer for: " + question);
        }
        return value;
    }

    @Override
    public void println(String line) {
        output.add(line);
    }

    @Override
    public void info(String message) {
        output.add(message);
    }

    @Override
    public void success(String message) {
        output.add(message);
    }

    @Override
    public void warn(String message) {
        output.add(message);
    }

    @Override
    public void error(String message) {
        output.add(message);
        errors.add(message);
    }

    @Override
    public void header(String title) {
        output.add(title);
    }

    @Override
    public String prompt(String question, String defaultValue) {
        String value = next(question).trim();
        return value.isEmpty() && defaultValue != null ? defaultValue : value;
    }

    @Override
    public String promptSecret(String question) {
        return next(question);
    }

    @Override
    public boolean confirm(String question, boolean defaultYes) {
        String value = next(question).trim().toLowerCase();
        if (value.isEmpty()) {
            return defaultYes;
        }
        return value.startsWith("y");
    }

    @Override
    public int choose(String question, List<String> choices, int defaultIndex) {
        String value = next(question).trim();
        return value.isEmpty() ? defaultIndex : Integer.parseInt(value) - 1;
    }

    public List<String> questions() {
        return questions;
    }

    public List<String> output() {
        return output;
    }

    public List<String> errors() {
        return errors;
    }

    public int remainingAnswers() {
        return answers.size();
    }
}
