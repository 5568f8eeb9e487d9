package com.infomedia.abacox.nation.db.util;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Construction-time validation for entities. Uses the same Bean Validation constraints
 * Hibernate checks again before insert and update.
 */
public final class EntityValidator {

    private static final Validator VALIDATOR;

    static {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        VALIDATOR = factory.getValidator();
    }

    private EntityValidator() {
    }

    /**
     * Validates all constraints declared on the entity.
     *
     * @param entity the fully assigned entity
     * @throws ConstraintViolationException listing every violated constraint
     */
    public static <E> E validate(E entity) {
        Set<ConstraintViolation<E>> violations = VALIDATOR.validate(entity);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new ConstraintViolationException(
                    "Invalid " + entity.getClass().getSimpleName() + ": " + message, violations);
        }
        return entity;
    }
}
