package org.javai.runner.capability;

import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source of capability definitions. How definitions are stored is up to the implementation.
 */
public interface CapabilityProvider {

    /**
     * @throws RunnerException {@link RunnerError#CAPABILITY_NOT_FOUND} if no capability has that name
     */
    Capability load(String name) throws RunnerException;

    /**
     * Names of every available capability. Called once during bootstrap.
     */
    List<String> discover() throws RunnerException;

    /**
     * A fixed, in-memory set of capabilities.
     */
    static CapabilityProvider of(Capability... capabilities) {
        Map<String, Capability> byName = new LinkedHashMap<>();
        for (Capability capability : capabilities) {
            byName.put(capability.name(), capability);
        }
        return new CapabilityProvider() {
            @Override
            public Capability load(String name) throws RunnerException {
                Capability capability = byName.get(name);
                if (capability == null) {
                    throw new RunnerException(RunnerError.CAPABILITY_NOT_FOUND, "capability not found: " + name);
                }
                return capability;
            }

            @Override
            public List<String> discover() {
                return List.copyOf(byName.keySet());
            }
        };
    }
}
