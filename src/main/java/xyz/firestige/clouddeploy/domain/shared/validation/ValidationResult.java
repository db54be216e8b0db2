package xyz.firestige.clouddeploy.domain.shared.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验结果
 */
public class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(List.of());

    /**
     * 校验错误列表
     */
    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    /**
     * 创建成功的校验结果
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * 创建失败的校验结果
     */
    public static ValidationResult failure(String error) {
        return new ValidationResult(List.of(error));
    }

    public static ValidationResult failure(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return SUCCESS;
        }
        return new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * 第一条错误，用于重新提示时展示
     */
    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    /**
     * 合并两个校验结果
     */
    public ValidationResult merge(ValidationResult other) {
        if (other == null || other.isValid()) {
            return this;
        }
        if (isValid()) {
            return other;
        }
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return new ValidationResult(merged);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult{errors=" + errors + '}';
    }
}
