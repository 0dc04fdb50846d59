package com.oniongateway.core.transport;

import lombok.NonNull;
import lombok.Value;

/**
 * Readiness report of a launched hidden service. The service name is the
 * externally reachable address and is safe to print.
 */
@Value
public class ServiceIdentity {

    @NonNull
    String nickname;

    @NonNull
    String serviceName;
}
