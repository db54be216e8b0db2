package xyz.firestige.clouddeploy.application.execution.listener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import xyz.firestige.clouddeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.clouddeploy.infrastructure.console.Console;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseCompletedEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseFailedEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseSkippedEvent;
import xyz.firestige.clouddeploy.infrastructure.event.PhaseStartedEvent;

/**
 * 把 Phase 生命周期事件渲染到终端
 */
@Component
public class PhaseProgressListener {

    private static final Logger logger = LoggerFactory.getLogger(PhaseProgressListener.class);

    private final Console console;

    public PhaseProgressListener(Console console) {
        this.console = console;
    }

    @EventListener
    public void onStarted(PhaseStartedEvent event) {
        console.header("Phase " + event.getIndex() + "/" + event.getTotal() + ": " + event.getPhaseName());
    }

    @EventListener
    public void onCompleted(PhaseCompletedEvent event) {
        console.success(event.getPhaseName() + " completed in " + event.getDuration().toSeconds() + "s");
    }

    @EventListener
    public void onSkipped(PhaseSkippedEvent event) {
        console.info("Phase " + event.getIndex() + "/" + event.getTotal() + " " + event.getPhaseName()
                + " skipped: " + event.getReason());
    }

    @EventListener
    public void onFailed(PhaseFailedEvent event) {
        FailureInfo failure = event.getFailureInfo();
        logger.debug("[PhaseProgressListener] {} failed at {}", event.getPhaseName(), failure.getFailedAt());
        if (failure.isRecoverable()) {
            console.warn(event.getPhaseName() + " did not finish: " + failure.getErrorMessage());
        } else {
            console.error(event.getPhaseName() + " failed: " + failure.getErrorMessage());
        }
        if (failure.getToolOutput() != null && !failure.getToolOutput().isBlank()) {
            console.println(failure.getToolOutput());
        }
        if (failure.getRemediationHint() != null) {
            console.info("Hint: " + failure.getRemediationHint());
        }
    }
}
