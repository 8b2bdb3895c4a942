package com.gridcast.core.capability;

import com.gridcast.core.model.ResultEnvelope;

/**
 * The executable part of a capability. Receives arguments that already passed
 * schema validation. Any exception thrown is converted by the dispatcher into an
 * {@code INTERNAL_CAPABILITY_ERROR} envelope.
 */
@FunctionalInterface
public interface CapabilityExecutor {

    ResultEnvelope execute(CapabilityArguments arguments, InvocationContext context) throws Exception;
}
