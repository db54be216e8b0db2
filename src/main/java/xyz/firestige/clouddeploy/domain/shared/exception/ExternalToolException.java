package xyz.firestige.clouddeploy.domain.shared.exception;

/**
 * 外部工具（terraform / helm / kubectl / 云 CLI）非零退出
 */
public class ExternalToolException extends DeployerException {

    private static final int MAX_OUTPUT_CHARS = 4000;

    private final String command;
    private final int exitCode;
    private final String toolOutput;

    public ExternalToolException(String command, int exitCode, String toolOutput) {
        super(ErrorType.EXTERNAL_TOOL_ERROR, "'" + command + "' exited with code " + exitCode);
        this.command = command;
        this.exitCode = exitCode;
        this.toolOutput = truncate(toolOutput);
    }

    public ExternalToolException(String command, String message, Throwable cause) {
        super(ErrorType.EXTERNAL_TOOL_ERROR, message, cause);
        this.command = command;
        this.exitCode = -1;
        this.toolOutput = "";
    }

    public String getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getToolOutput() {
        return toolOutput;
    }

    private static String truncate(String output) {
        if (output == null) {
            return "";
        }
        String trimmed = output.strip();
        if (trimmed.length() <= MAX_OUTPUT_CHARS) {
            return trimmed;
        }
        return "..." + trimmed.substring(trimmed.length() - MAX_OUTPUT_CHARS);
    }
}
