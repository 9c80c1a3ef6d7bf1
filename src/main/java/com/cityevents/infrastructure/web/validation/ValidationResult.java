package com.cityevents.infrastructure.web.validation;

import com.cityevents.domain.model.CityEventsQuery;
import java.util.List;

/**
 * Either a validated query or the parameter errors that prevented building one.
 */
public record ValidationResult(
        CityEventsQuery query,
        List<ParameterError> errors
) {
    public static ValidationResult valid(CityEventsQuery query) {
        return new ValidationResult(query, List.of());
    }

    public static ValidationResult invalid(List<ParameterError> errors) {
        return new ValidationResult(null, List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public record ParameterError(
            String parameter,
            String message,
            String type
    ) {}
}
