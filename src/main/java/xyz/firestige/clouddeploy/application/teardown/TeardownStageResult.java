package xyz.firestige.clouddeploy.application.teardown;

import xyz.firestige.clouddeploy.domain.shared.exception.FailureInfo;

public record TeardownStageResult(String stage, TeardownStatus status, String message, FailureInfo failureInfo) {

    public static TeardownStageResult succeeded(String stage, String message) {
        return new TeardownStageResult(stage, TeardownStatus.SUCCEEDED, message, null);
    }

    public static TeardownStageResult alreadyAbsent(String stage, String message) {
        return new TeardownStageResult(stage, TeardownStatus.ALREADY_ABSENT, message, null);
    }

    public static TeardownStageResult skipped(String stage, String message) {
        return new TeardownStageResult(stage, TeardownStatus.SKIPPED, message, null);
    }

    public static TeardownStageResult failed(String stage, FailureInfo failureInfo) {
        return new TeardownStageResult(stage, TeardownStatus.FAILED, failureInfo.getErrorMessage(), failureInfo);
    }

    public boolean isFailed() {
        return status == TeardownStatus.FAILED;
    }
}
