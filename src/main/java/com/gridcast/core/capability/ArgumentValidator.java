package com.gridcast.core.capability;

import com.gridcast.core.model.PlannedInvocation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks invocation arguments against a capability's parameter schema.
 * <p>
 * Unknown argument names, missing required arguments, wrongly typed values and
 * out-of-range numbers are all reported; nothing is coerced here.
 */
@Component
public class ArgumentValidator {

    /**
     * @param descriptor       capability contract
     * @param arguments        arguments to check
     * @param allowReferences  when true, {@code $ref:} placeholders are accepted for any parameter
     *                         (their values are only known once the referenced invocation has run)
     * @return validation errors; empty when the arguments are acceptable
     */
    public List<String> validate(CapabilityDescriptor descriptor, Map<String, Object> arguments,
                                 boolean allowReferences) {
        var errors = new ArrayList<String>();
        Map<String, Object> args = arguments == null ? Map.of() : arguments;

        for (String name : args.keySet()) {
            if (descriptor.parameter(name).isEmpty()) {
                errors.add(descriptor.name() + ": unknown argument '" + name + "'");
            }
        }

        for (ParameterSpec spec : descriptor.parameters()) {
            Object value = args.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    errors.add(descriptor.name() + ": missing required argument '" + spec.name() + "'");
                }
                continue;
            }
            if (allowReferences && isReference(value)) {
                continue;
            }
            String problem = checkValue(spec, value);
            if (problem != null) {
                errors.add(descriptor.name() + ": argument '" + spec.name() + "' " + problem);
            }
        }
        return errors;
    }

    public static boolean isReference(Object value) {
        return value instanceof String text && text.startsWith(PlannedInvocation.REFERENCE_PREFIX);
    }

    private String checkValue(ParameterSpec spec, Object value) {
        return switch (spec.type()) {
            case STRING -> value instanceof CharSequence ? null : "must be a string";
            case INTEGER -> {
                if (!isIntegral(value)) {
                    yield "must be an integer";
                }
                yield checkRange(spec, ((Number) value).doubleValue());
            }
            case NUMBER -> {
                if (!(value instanceof Number number)) {
                    yield "must be a number";
                }
                double d = number.doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    yield "must be a finite number";
                }
                yield checkRange(spec, d);
            }
            case BOOLEAN -> {
                if (value instanceof Boolean) {
                    yield null;
                }
                String text = value.toString().trim().toLowerCase(Locale.ROOT);
                yield "true".equals(text) || "false".equals(text) ? null : "must be a boolean";
            }
            case DATE -> {
                if (value instanceof LocalDate) {
                    yield null;
                }
                try {
                    LocalDate.parse(value.toString().trim());
                    yield null;
                } catch (DateTimeParseException e) {
                    yield "must be an ISO date (YYYY-MM-DD), got '" + value + "'";
                }
            }
            case TIMESTAMP -> {
                if (value instanceof Instant) {
                    yield null;
                }
                try {
                    CapabilityArguments.parseTimestamp(value.toString().trim());
                    yield null;
                } catch (DateTimeParseException e) {
                    yield "must be an ISO-8601 timestamp, got '" + value + "'";
                }
            }
            case ENUM -> {
                String text = value.toString().trim();
                boolean allowed = spec.allowedValues().stream().anyMatch(a -> a.equalsIgnoreCase(text));
                yield allowed ? null : "must be one of " + spec.allowedValues() + ", got '" + value + "'";
            }
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static String checkRange(ParameterSpec spec, double value) {
        if (spec.min() != null && value < spec.min()) {
            return "must be >= " + formatBound(spec.min()) + ", got " + value;
        }
        if (spec.max() != null && value > spec.max()) {
            return "must be <= " + formatBound(spec.max()) + ", got " + value;
        }
        return null;
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
