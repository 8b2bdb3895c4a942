package com.gridcast.core.capability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Contract for one named capability parameter.
 *
 * @param name          parameter name
 * @param type          expected value type
 * @param required      whether the argument must be present and non-null
 * @param description   text shown to the reasoning oracle
 * @param min           inclusive lower bound for numeric types, or {@code null}
 * @param max           inclusive upper bound for numeric types, or {@code null}
 * @param allowedValues permitted values for {@link ParameterType#ENUM}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterSpec(
    String name,
    ParameterType type,
    boolean required,
    String description,
    Double min,
    Double max,
    @JsonProperty("allowed_values") List<String> allowedValues
) {

    public ParameterSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        allowedValues = allowedValues == null ? null : List.copyOf(allowedValues);
        if (type == ParameterType.ENUM && (allowedValues == null || allowedValues.isEmpty())) {
            throw new IllegalArgumentException("ENUM parameter '" + name + "' must declare allowed values");
        }
    }

    public static ParameterSpec required(String name, ParameterType type, String description) {
        return new ParameterSpec(name, type, true, description, null, null, null);
    }

    public static ParameterSpec optional(String name, ParameterType type, String description) {
        return new ParameterSpec(name, type, false, description, null, null, null);
    }

    public ParameterSpec range(double minimum, double maximum) {
        return new ParameterSpec(name, type, required, description, minimum, maximum, allowedValues);
    }

    public ParameterSpec allowed(String... values) {
        return new ParameterSpec(name, type, required, description, min, max, Arrays.asList(values));
    }

    public static <E extends Enum<E>> String[] namesOf(Class<E> enumType) {
        return Arrays.stream(enumType.getEnumConstants()).map(Enum::name).toArray(String[]::new);
    }
}
