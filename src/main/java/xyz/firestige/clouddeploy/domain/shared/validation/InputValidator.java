package xyz.firestige.clouddeploy.domain.shared.validation;

/**
 * 单个输入值的校验规则
 */
@FunctionalInterface
public interface InputValidator {

    ValidationResult validate(String value);

    static InputValidator any() {
        return value -> ValidationResult.success();
    }

    default InputValidator and(InputValidator next) {
        return value -> {
            ValidationResult first = validate(value);
            return first.isValid() ? next.validate(value) : first;
        };
    }
}
