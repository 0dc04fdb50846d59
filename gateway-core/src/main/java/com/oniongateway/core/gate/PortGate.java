package com.oniongateway.core.gate;

import com.oniongateway.core.config.GateConfig;
import com.oniongateway.core.transport.RequestDescriptor;
import com.oniongateway.core.transport.StreamKind;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Admission predicate over the destination port a stream request declares.
 * <p>
 * The overlay multiplexes arbitrary virtual ports onto one service; only
 * {@link StreamKind#BEGIN} streams to an allowed port are worth a TLS
 * handshake. Instances are immutable and safe to share.
 */
public final class PortGate {

    private final Set<Integer> allowedPorts;

    public PortGate(Collection<Integer> allowedPorts) {
        if (allowedPorts.isEmpty()) {
            throw new IllegalArgumentException("At least one port must be allowed");
        }
        this.allowedPorts = Collections.unmodifiableSet(new TreeSet<>(allowedPorts));
    }

    public static PortGate httpAndHttps() {
        return new PortGate(Set.of(80, 443));
    }

    public static PortGate fromConfig(GateConfig config) {
        config.validate();
        return new PortGate(config.getAllowedPorts());
    }

    public boolean admit(RequestDescriptor descriptor) {
        return descriptor.getKind() == StreamKind.BEGIN && allowedPorts.contains(descriptor.getPort());
    }

    public Set<Integer> allowedPorts() {
        return allowedPorts;
    }

    @Override
    public String toString() {
        return "PortGate" + allowedPorts;
    }
}
