package xyz.firestige.clouddeploy.infrastructure.event;

/**
 * 阶段生命周期事件
 */
public abstract class PhaseEvent extends DomainEvent {
    private final String phaseName;
    private final int index;
    private final int total;

    protected PhaseEvent(String sessionId, String phaseName, int index, int total) {
        super(sessionId);
        this.phaseName = phaseName;
        this.index = index;
        this.total = total;
    }

    public String getPhaseName() {
        return phaseName;
    }

    /**
     * 从 1 开始
     */
    public int getIndex() {
        return index;
    }

    public int getTotal() {
        return total;
    }
}
