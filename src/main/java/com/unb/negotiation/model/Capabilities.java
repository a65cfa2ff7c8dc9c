package com.unb.negotiation.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Protocols and profile types a party can work with.
 */
public final class Capabilities {
    private final Set<String> protocols;
    private final Set<String> profiles;

    public Capabilities(Set<String> protocols, Set<String> profiles) {
        this.protocols = Collections.unmodifiableSet(new LinkedHashSet<>(protocols));
        this.profiles = Collections.unmodifiableSet(new LinkedHashSet<>(profiles));
    }

    public Set<String> getProtocols() {
        return protocols;
    }

    public Set<String> getProfiles() {
        return profiles;
    }

    @Override
    public String toString() {
        return "Capabilities[protocols=" + protocols + ", profiles=" + profiles + "]";
    }
}
