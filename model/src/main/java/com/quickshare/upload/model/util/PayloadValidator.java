package com.quickshare.upload.model.util;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks request and response payloads against their Bean Validation constraints.
 *
 * <p>
 * Backed by Hibernate Validator. Messages are interpolated from the constraint
 * parameters only, so no expression language is evaluated. Instances are
 * thread-safe; {@link #getDefault()} returns a shared one.
 */
public class PayloadValidator {

    private static final PayloadValidator DEFAULT = new PayloadValidator();

    private final Validator validator;

    public PayloadValidator() {
        ValidatorFactory factory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        this.validator = factory.getValidator();
    }

    public static PayloadValidator getDefault() {
        return DEFAULT;
    }

    /**
     * Validates the given payload.
     *
     * @param payload object annotated with {@code jakarta.validation} constraints
     * @return violation messages formatted as {@code "property: message"}, sorted; empty when valid
     */
    public List<String> validate(Object payload) {
        if (payload == null) {
            return List.of("payload: must not be null");
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(payload);
        return violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.toList());
    }
}
