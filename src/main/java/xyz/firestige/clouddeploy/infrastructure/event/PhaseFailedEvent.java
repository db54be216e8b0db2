package xyz.firestige.clouddeploy.infrastructure.event;

import xyz.firestige.clouddeploy.domain.shared.exception.FailureInfo;

public class PhaseFailedEvent extends PhaseEvent {
    private final FailureInfo failureInfo;

    public PhaseFailedEvent(String sessionId, String phaseName, int index, int total, FailureInfo failureInfo) {
        super(sessionId, phaseName, index, total);
        this.failureInfo = failureInfo;
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
