package xyz.firestige.clouddeploy.application.teardown;

import java.util.List;
import java.util.Optional;

/**
 * @param aborted 用户在确认环节放弃，未做任何改动
 */
public record TeardownResult(boolean aborted, List<TeardownStageResult> stages) {

    public TeardownResult {
        stages = List.copyOf(stages);
    }

    public static TeardownResult abortedByUser() {
        return new TeardownResult(true, List.of());
    }

    public Optional<TeardownStageResult> failedStage() {
        return stages.stream().filter(TeardownStageResult::isFailed).findFirst();
    }

    public boolean isSuccess() {
        return !aborted && failedStage().isEmpty();
    }
}
