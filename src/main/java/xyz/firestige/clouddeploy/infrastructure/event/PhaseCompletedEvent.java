package xyz.firestige.clouddeploy.infrastructure.event;

import java.time.Duration;

public class PhaseCompletedEvent extends PhaseEvent {
    private final Duration duration;

    public PhaseCompletedEvent(String sessionId, String phaseName, int index, int total, Duration duration) {
        super(sessionId, phaseName, index, total);
        this.duration = duration;
    }

    public Duration getDuration() {
        return duration;
    }
}
