package xyz.firestige.clouddeploy.domain.phase;

/**
 * Phase 状态：pending → running → {succeeded | failed | skipped}
 */
public enum PhaseStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
