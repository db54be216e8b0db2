package xyz.firestige.clouddeploy.infrastructure.console;

import java.util.List;

/**
 * 面向用户的终端交互。所有读取方法在 EOF 或取消时抛出 SetupInterruptedException。
 */
public interface Console {

    void println(String line);

    void info(String message);

    void success(String message);

    void warn(String message);

    void error(String message);

    void header(String title);

    /**
     * @param defaultValue 空输入时返回的默认值，可为 null
     * @return 去掉首尾空白后的输入
     */
    String prompt(String question, String defaultValue);

    /**
     * 不回显的输入（终端可用时）
     */
    String promptSecret(String question);

    boolean confirm(String question, boolean defaultYes);

    /**
     * @return 选中项的下标
     */
    int choose(String question, List<String> choices, int defaultIndex);
}
