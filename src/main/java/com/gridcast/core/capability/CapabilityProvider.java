package com.gridcast.core.capability;

import java.util.List;

/**
 * Source of capabilities. Every provider bean is collected into the
 * {@link CapabilityRegistry} once at startup.
 */
public interface CapabilityProvider {

    List<CapabilityDescriptor> capabilities();
}
