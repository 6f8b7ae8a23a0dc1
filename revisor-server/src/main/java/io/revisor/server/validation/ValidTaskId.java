package io.revisor.server.validation;

import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Rejects a `taskId` path parameter that the registry cannot have issued.
///
/// Task ids are random UUIDs in their canonical 36 character form. Anything else is
/// answered with 400 before it reaches the service or a log line.
///
/// @see TaskIdValidator
@Target(PARAMETER)
@Retention(RUNTIME)
@Constraint(validatedBy = TaskIdValidator.class)
@Documented
public @interface ValidTaskId {

    String message() default "is not a review task id (expected a UUID as returned on upload)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
