package io.revisor.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import java.util.regex.Pattern;

/// Accepts task ids in the canonical UUID form the registry issues, in either letter case.
public class TaskIdValidator implements ConstraintValidator<ValidTaskId, String> {

    private static final Pattern CANONICAL_UUID =
            Pattern.compile(
                    "\\p{XDigit}{8}-\\p{XDigit}{4}-\\p{XDigit}{4}-\\p{XDigit}{4}-\\p{XDigit}{12}");

    @Override
    public boolean isValid(String taskId, ConstraintValidatorContext context) {
        return taskId != null && CANONICAL_UUID.matcher(taskId).matches();
    }
}
