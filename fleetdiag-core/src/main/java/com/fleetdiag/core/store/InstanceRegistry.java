package com.fleetdiag.core.store;

import java.util.Set;

/**
 * Fleet membership as seen through shared storage.
 * Resolves the "all instances" participation scope.
 */
public interface InstanceRegistry {

    /**
     * Identity of the instance this process runs on.
     */
    String localInstanceId();

    /**
     * Record that the local instance is alive.
     */
    void heartbeat();

    /**
     * Instances that have been seen alive recently, always including the local one.
     */
    Set<String> liveInstances();
}
