package com.fleetdiag.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves the fleet-wide identity of this instance: the configured id, else the
 * platform's {@code WEBSITE_INSTANCE_ID}, else the host name.
 */
public final class InstanceIdentity {

    private static final Logger log = LoggerFactory.getLogger(InstanceIdentity.class);

    public static final String INSTANCE_ID_ENV = "WEBSITE_INSTANCE_ID";

    private InstanceIdentity() {
    }

    public static String resolve(String configured) {
        return resolve(configured, System::getenv, InstanceIdentity::hostName);
    }

    static String resolve(String configured, Function<String, String> env, Supplier<String> hostName) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String fromEnv = env.apply(INSTANCE_ID_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        return hostName.get();
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fallback = "instance-" + ProcessHandle.current().pid();
            log.warn("Cannot resolve host name ({}), using {}", e.getMessage(), fallback);
            return fallback;
        }
    }
}
