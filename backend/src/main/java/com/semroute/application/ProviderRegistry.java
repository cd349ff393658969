/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.application;

import com.semroute.domain.model.Capability;
import com.semroute.domain.model.ProviderDescriptor;
import com.semroute.domain.model.ProviderId;
import com.semroute.infrastructure.backend.BackendClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of backend instances per capability.
 *
 * <p>Registration happens at startup and is rare; lookups happen on every request. Writers
 * publish a fresh immutable map through a volatile field so readers never lock.
 */
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private volatile Map<ProviderId, Registration> registrations = Map.of();

    public synchronized void register(ProviderDescriptor descriptor, BackendClient<?, ?> client) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor must not be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client must not be null for provider " + descriptor.id());
        }
        Map<ProviderId, Registration> current = registrations;
        if (current.containsKey(descriptor.id())) {
            throw new DuplicateProviderException(descriptor.id());
        }
        Map<ProviderId, Registration> next = new LinkedHashMap<>(current);
        next.put(descriptor.id(), new Registration(descriptor, client));
        registrations = Collections.unmodifiableMap(next);
        log.info("Provider registered provider={} weight={} quality={} client={}",
                descriptor.id(), descriptor.weight(), descriptor.quality(), client.getClass().getSimpleName());
    }

    /** Descriptors for the capability, possibly empty. */
    public List<ProviderDescriptor> list(Capability capability) {
        return registrations.values().stream()
                .map(Registration::descriptor)
                .filter(d -> d.capability() == capability)
                .toList();
    }

    public List<ProviderDescriptor> require(Capability capability) {
        List<ProviderDescriptor> descriptors = list(capability);
        if (descriptors.isEmpty()) {
            throw new UnknownCapabilityException(capability);
        }
        return descriptors;
    }

    public List<ProviderDescriptor> all() {
        return registrations.values().stream().map(Registration::descriptor).toList();
    }

    public Set<Capability> capabilities() {
        Set<Capability> result = EnumSet.noneOf(Capability.class);
        registrations.keySet().forEach(id -> result.add(id.capability()));
        return Collections.unmodifiableSet(result);
    }

    public Optional<ProviderDescriptor> find(ProviderId id) {
        Registration registration = registrations.get(id);
        return registration == null ? Optional.empty() : Optional.of(registration.descriptor());
    }

    public ProviderDescriptor descriptor(ProviderId id) {
        return getRequired(id).descriptor();
    }

    public BackendClient<?, ?> client(ProviderId id) {
        return getRequired(id).client();
    }

    private Registration getRequired(ProviderId id) {
        Registration registration = registrations.get(id);
        if (registration == null) {
            throw new IllegalArgumentException("No provider registered under " + id);
        }
        return registration;
    }

    private record Registration(ProviderDescriptor descriptor, BackendClient<?, ?> client) {}
}
