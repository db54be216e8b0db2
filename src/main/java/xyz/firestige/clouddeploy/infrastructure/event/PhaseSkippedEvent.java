package xyz.firestige.clouddeploy.infrastructure.event;

public class PhaseSkippedEvent extends PhaseEvent {
    private final String reason;

    public PhaseSkippedEvent(String sessionId, String phaseName, int index, int total, String reason) {
        super(sessionId, phaseName, index, total);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
