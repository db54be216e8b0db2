package xyz.firestige.clouddeploy.infrastructure.event;

public class PhaseStartedEvent extends PhaseEvent {
    public PhaseStartedEvent(String sessionId, String phaseName, int index, int total) {
        super(sessionId, phaseName, index, total);
    }
}
