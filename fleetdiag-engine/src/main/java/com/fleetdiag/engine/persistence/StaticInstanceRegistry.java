package com.fleetdiag.engine.persistence;

import com.fleetdiag.core.store.InstanceRegistry;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fixed fleet membership. Useful for single-node deployments and tests.
 */
public class StaticInstanceRegistry implements InstanceRegistry {

    private final String localInstanceId;
    private final Set<String> instances;

    public StaticInstanceRegistry(String localInstanceId, Collection<String> fleet) {
        this.localInstanceId = localInstanceId;
        Set<String> all = new LinkedHashSet<>(fleet);
        all.add(localInstanceId);
        this.instances = Set.copyOf(all);
    }

    public static StaticInstanceRegistry single(String localInstanceId) {
        return new StaticInstanceRegistry(localInstanceId, Set.of());
    }

    @Override
    public String localInstanceId() {
        return localInstanceId;
    }

    @Override
    public void heartbeat() {
    }

    @Override
    public Set<String> liveInstances() {
        return instances;
    }
}
