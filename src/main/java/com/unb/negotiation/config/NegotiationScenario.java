package com.unb.negotiation.config;

import com.unb.negotiation.model.Domain;
import com.unb.negotiation.model.LinearAdditiveUtilitySpace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A loaded scenario: the shared domain, one profile per party and the deadline.
 *
 * <p>Exactly one of {@link #getRounds()} and {@link #getDurationMillis()} is positive.</p>
 */
public class NegotiationScenario {
    private final Domain domain;
    private final Map<String, LinearAdditiveUtilitySpace> parties;
    private final int rounds;
    private final long durationMillis;

    private NegotiationScenario(Domain domain, Map<String, LinearAdditiveUtilitySpace> parties, int rounds, long durationMillis) {
        if (parties.size() != 2) {
            throw new IllegalArgumentException("A bilateral scenario needs exactly 2 parties, got " + parties.size());
        }
        this.domain = domain;
        this.parties = Collections.unmodifiableMap(new LinkedHashMap<>(parties));
        this.rounds = rounds;
        this.durationMillis = durationMillis;
    }

    public static NegotiationScenario withRounds(Domain domain, Map<String, LinearAdditiveUtilitySpace> parties, int rounds) {
        if (rounds <= 0) {
            throw new IllegalArgumentException("Rounds must be positive, got " + rounds);
        }
        return new NegotiationScenario(domain, parties, rounds, 0L);
    }

    public static NegotiationScenario withDuration(Domain domain, Map<String, LinearAdditiveUtilitySpace> parties, long durationMillis) {
        if (durationMillis <= 0) {
            throw new IllegalArgumentException("Duration must be positive, got " + durationMillis);
        }
        return new NegotiationScenario(domain, parties, 0, durationMillis);
    }

    public Domain getDomain() {
        return domain;
    }

    /**
     * @return party name to profile, in declaration order
     */
    public Map<String, LinearAdditiveUtilitySpace> getParties() {
        return parties;
    }

    public int getRounds() {
        return rounds;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public boolean isRoundBased() {
        return rounds > 0;
    }
}
