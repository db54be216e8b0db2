package xyz.firestige.clouddeploy.infrastructure.process;

import xyz.firestige.clouddeploy.domain.session.CancellationToken;

/**
 * 外部可执行程序的统一调用入口。
 * 只负责执行和收集结果；是否重试由调用方根据退出码/输出判断。
 */
public interface ProcessRunner {

    ProcessResult run(CommandSpec spec, CancellationToken token);
}
