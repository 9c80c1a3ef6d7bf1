package com.cityevents.infrastructure.web.validation;

import com.cityevents.domain.model.CityEventsQuery;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns raw query parameters into a {@link CityEventsQuery}, or into the list of parameter errors.
 */
@Component
public class CityEventsRequestValidator {

    private static final Map<String, String> QUERY_PARAMETERS = Map.of(
            "apiKey", "api_key",
            "city", "city",
            "postalCode", "postal_code",
            "searchId", "search_id"
    );

    private static final Map<Class<?>, String> ERROR_TYPES = Map.of(
            NotBlank.class, "value_error.missing"
    );

    private static final ValidationResult.ParameterError INVALID_SEARCH_ID = new ValidationResult.ParameterError(
            "search_id", "value is not a valid integer", "type_error.integer");

    private final Validator validator;

    public CityEventsRequestValidator(Validator validator) {
        this.validator = validator;
    }

    public ValidationResult validate(CityEventsRequest request) {
        List<ValidationResult.ParameterError> errors = new ArrayList<>();
        validator.validate(request).forEach(violation -> errors.add(toParameterError(violation)));

        Long searchId = null;
        if (request.searchId() != null) {
            try {
                searchId = Long.valueOf(request.searchId());
            } catch (NumberFormatException e) {
                errors.add(INVALID_SEARCH_ID);
            }
        }

        if (!errors.isEmpty()) {
            errors.sort(Comparator.comparing(ValidationResult.ParameterError::parameter));
            return ValidationResult.invalid(List.copyOf(errors));
        }

        return ValidationResult.valid(new CityEventsQuery(
                request.apiKey(),
                request.city(),
                request.postalCode(),
                searchId
        ));
    }

    private ValidationResult.ParameterError toParameterError(ConstraintViolation<CityEventsRequest> violation) {
        String property = violation.getPropertyPath().toString();
        Class<?> constraint = violation.getConstraintDescriptor().getAnnotation().annotationType();
        return new ValidationResult.ParameterError(
                QUERY_PARAMETERS.getOrDefault(property, property),
                violation.getMessage(),
                ERROR_TYPES.getOrDefault(constraint, "value_error")
        );
    }
}
