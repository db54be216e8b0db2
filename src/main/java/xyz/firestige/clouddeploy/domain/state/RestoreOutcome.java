package xyz.firestige.clouddeploy.domain.state;

public enum RestoreOutcome {
    RESTORED,
    NOT_FOUND
}
