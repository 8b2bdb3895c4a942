package com.gridcast.core.capability;

import com.gridcast.core.model.ResultEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentValidatorTest {

    private final ArgumentValidator validator = new ArgumentValidator();

    private final CapabilityDescriptor descriptor = new CapabilityDescriptor(
            "produce_forecast", "Forecast demand", List.of(
                    ParameterSpec.required("horizon", ParameterType.INTEGER, "steps").range(1, 336),
                    ParameterSpec.optional("strategy", ParameterType.ENUM, "strategy").allowed("FALLBACK", "BEST"),
                    ParameterSpec.optional("start_date", ParameterType.DATE, "first day"),
                    ParameterSpec.optional("require_fresh", ParameterType.BOOLEAN, "refuse stale data"),
                    ParameterSpec.optional("confidence", ParameterType.NUMBER, "z").range(0.5, 4)),
            "forecast", null, (args, ctx) -> ResultEnvelope.ok("x", "ok"));

    @Test
    @DisplayName("accepts well-formed arguments")
    void acceptsValid() {
        var errors = validator.validate(descriptor,
                Map.of("horizon", 24, "strategy", "best", "start_date", "2025-01-31", "require_fresh", "true"),
                false);
        assertTrue(errors.isEmpty(), errors.toString());
    }

    @Test
    @DisplayName("reports missing required and unknown arguments")
    void missingAndUnknown() {
        var errors = validator.validate(descriptor, Map.of("horizn", 24), false);
        assertEquals(2, errors.size());
        assertTrue(errors.stream().anyMatch(e -> e.contains("unknown argument 'horizn'")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("missing required argument 'horizon'")));
    }

    @Test
    @DisplayName("rejects wrong types without coercion")
    void wrongTypes() {
        assertFalse(validator.validate(descriptor, Map.of("horizon", "24"), false).isEmpty());
        assertFalse(validator.validate(descriptor, Map.of("horizon", 2.5), false).isEmpty());
        assertTrue(validator.validate(descriptor, Map.of("horizon", 24.0), false).isEmpty());
        assertFalse(validator.validate(descriptor, Map.of("horizon", 24, "start_date", "31/01/2025"), false).isEmpty());
        assertFalse(validator.validate(descriptor, Map.of("horizon", 24, "require_fresh", "yes"), false).isEmpty());
    }

    @Test
    @DisplayName("enforces numeric ranges")
    void ranges() {
        var errors = validator.validate(descriptor, Map.of("horizon", 0), false);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("must be >= 1"));
        assertFalse(validator.validate(descriptor, Map.of("horizon", 24, "confidence", 9.0), false).isEmpty());
        assertFalse(validator.validate(descriptor, Map.of("horizon", 24, "confidence", Double.NaN), false).isEmpty());
    }

    @Test
    @DisplayName("rejects enum values outside the allowed set")
    void enumValues() {
        var errors = validator.validate(descriptor, Map.of("horizon", 24, "strategy", "RANDOM"), false);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("must be one of"));
    }

    @Test
    @DisplayName("references are accepted only when allowed")
    void references() {
        var args = Map.<String, Object>of("horizon", "$ref:inv-1.horizon");
        assertTrue(validator.validate(descriptor, args, true).isEmpty());
        assertFalse(validator.validate(descriptor, args, false).isEmpty());
    }

    @Test
    @DisplayName("null required argument counts as missing")
    void nullRequired() {
        var args = new HashMap<String, Object>();
        args.put("horizon", null);
        var errors = validator.validate(descriptor, args, false);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("missing required argument"));
    }
}
