package com.unb.negotiation.session;

import com.unb.negotiation.agents.FrankenAgent;
import com.unb.negotiation.config.NegotiationScenario;
import com.unb.negotiation.config.StrategyConfig;
import com.unb.negotiation.model.Action;
import com.unb.negotiation.model.Bid;
import com.unb.negotiation.model.Inform;
import com.unb.negotiation.model.LinearAdditiveUtilitySpace;
import com.unb.negotiation.model.NegotiationResult;
import com.unb.negotiation.model.Progress;
import com.unb.negotiation.model.ProgressRounds;
import com.unb.negotiation.model.ProgressTime;
import com.unb.negotiation.model.UtilitySpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.LongSupplier;

/**
 * Runs one bilateral alternating-offers session between two agents.
 *
 * <p>Parties take turns, starting with the first. Every action is broadcast to both parties.
 * The session ends when a party accepts the other's last offer or when progress reaches the
 * deadline; both parties then receive a finished notification.</p>
 *
 * <p>With a round deadline one round is two turns, one per party. A time deadline starts
 * counting when {@link #run()} is called.</p>
 */
public class NegotiationSession {
    private static final Logger log = LoggerFactory.getLogger(NegotiationSession.class);

    private final List<FrankenAgent> parties;
    private final Progress progress;
    private final RoundCounter roundCounter;
    private final TimeKeeper timeKeeper;
    private final LongSupplier clock;

    private NegotiationSession(List<FrankenAgent> parties, Progress progress, RoundCounter roundCounter,
                               TimeKeeper timeKeeper, LongSupplier clock) {
        if (parties.size() != 2) {
            throw new IllegalArgumentException("A bilateral session needs exactly 2 parties, got " + parties.size());
        }
        this.parties = new ArrayList<>(parties);
        this.progress = progress;
        this.roundCounter = roundCounter;
        this.timeKeeper = timeKeeper;
        this.clock = clock;
    }

    /**
     * Build a session with one {@link FrankenAgent} per scenario party.
     *
     * @param scenario   domain, profiles and deadline
     * @param config     strategy parameters shared by both agents
     * @param storageDir root directory for session notes, each party writes to its own subdirectory; may be {@code null}
     * @param random     random source shared by both agents
     * @return the session, ready to {@link #run()}
     */
    public static NegotiationSession fromScenario(NegotiationScenario scenario, StrategyConfig config,
                                                  Path storageDir, Random random) {
        LongSupplier clock = System::currentTimeMillis;
        RoundCounter counter = null;
        TimeKeeper keeper = null;
        Progress progress;
        if (scenario.isRoundBased()) {
            counter = new RoundCounter(scenario.getRounds());
            progress = counter;
        } else {
            keeper = new TimeKeeper(scenario.getDurationMillis());
            progress = keeper;
        }

        List<FrankenAgent> agents = new ArrayList<>();
        int position = 1;
        for (Map.Entry<String, LinearAdditiveUtilitySpace> party : scenario.getParties().entrySet()) {
            String id = party.getKey() + "_" + position++;
            Path dir = storageDir == null ? null : storageDir.resolve(id);
            agents.add(new FrankenAgent(id, party.getValue(), progress, clock, config, dir, random));
        }
        return new NegotiationSession(agents, progress, counter, keeper, clock);
    }

    /**
     * Run the session to completion.
     *
     * @return the outcome
     */
    public NegotiationResult run() {
        FrankenAgent first = parties.get(0);
        FrankenAgent second = parties.get(1);
        if (timeKeeper != null) {
            timeKeeper.start(clock.getAsLong());
        }
        log.info("Session started: {} vs {} on {}", first.getId(), second.getId(), first.getProfile().getDomain().getName());

        Bid agreement = null;
        Bid lastOffer = null;
        int turns = 0;
        while (!progress.isPastDeadline(clock.getAsLong())) {
            FrankenAgent active = parties.get(turns % 2);
            Action action = active.notifyChange(Inform.yourTurn())
                    .orElseThrow(() -> new IllegalStateException(active.getId() + " did not act on its turn"));
            turns++;

            if (action.isAccept() && !action.getBid().equals(lastOffer)) {
                log.error("{} accepted {} which is not the last offer {}; ending without agreement",
                        active.getId(), action.getBid(), lastOffer);
                break;
            }
            for (FrankenAgent party : parties) {
                party.notifyChange(Inform.actionDone(action));
            }
            if (action.isAccept()) {
                agreement = action.getBid();
                break;
            }
            lastOffer = action.getBid();

            if (roundCounter != null && turns % 2 == 0) {
                roundCounter.advance();
            }
        }

        for (FrankenAgent party : parties) {
            party.notifyChange(Inform.finished(agreement));
        }

        NegotiationResult result = new NegotiationResult(agreement, turns, first.getId(), second.getId(),
                outcomeUtility(first.getProfile(), agreement), outcomeUtility(second.getProfile(), agreement));
        log.info("Session ended: {}", result);
        return result;
    }

    public List<FrankenAgent> getParties() {
        return parties;
    }

    /** Utility of the agreement, or of the reservation bid without one; 0 when neither exists. */
    static double outcomeUtility(UtilitySpace profile, Bid agreement) {
        if (agreement != null) {
            return profile.getUtility(agreement);
        }
        Bid reservation = profile.getReservationBid();
        return reservation == null ? 0.0 : profile.getUtility(reservation);
    }

    /**
     * Round-based progress shared by both parties and advanced by the session.
     */
    static final class RoundCounter implements Progress {
        private ProgressRounds current;

        RoundCounter(int rounds) {
            this.current = new ProgressRounds(rounds);
        }

        void advance() {
            current = current.advance();
        }

        @Override
        public double get(long currentTimeMillis) {
            return current.get(currentTimeMillis);
        }
    }

    /**
     * Time-based progress that stays at 0 until the session starts it.
     */
    static final class TimeKeeper implements Progress {
        private final long durationMillis;
        private ProgressTime current;

        TimeKeeper(long durationMillis) {
            this.durationMillis = durationMillis;
        }

        void start(long startMillis) {
            current = new ProgressTime(durationMillis, startMillis);
        }

        @Override
        public double get(long currentTimeMillis) {
            return current == null ? 0.0 : current.get(currentTimeMillis);
        }
    }
}
