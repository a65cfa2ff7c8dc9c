package com.unb.negotiation.agents;

import com.unb.negotiation.config.StrategyConfig;
import com.unb.negotiation.logic.AcceptanceService;
import com.unb.negotiation.logic.BidScoringService;
import com.unb.negotiation.logic.BidSearchService;
import com.unb.negotiation.logic.FrequencyOpponentModel;
import com.unb.negotiation.model.Action;
import com.unb.negotiation.model.Bid;
import com.unb.negotiation.model.Capabilities;
import com.unb.negotiation.model.Inform;
import com.unb.negotiation.model.Progress;
import com.unb.negotiation.model.UtilitySpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Optional;
import java.util.Random;
import java.util.function.LongSupplier;

/**
 * Bilateral negotiation party.
 *
 * <p>On each turn the agent searches a bid to offer and then decides whether the opponent's
 * last offer is good enough to accept instead. Every opponent offer first updates a frequency
 * opponent model, created when the first offer arrives, and then becomes the last received bid.</p>
 *
 * <p>Session lifecycle:
 * <ul>
 *   <li>{@link Inform.Kind#ACTION_DONE}: record opponent offers, ignore own actions.</li>
 *   <li>{@link Inform.Kind#YOUR_TURN}: answer with exactly one offer or accept.</li>
 *   <li>{@link Inform.Kind#FINISHED}: write the session note and stop reacting.</li>
 * </ul>
 *
 * <p>Not thread-safe; the turn protocol delivers informs one at a time.</p>
 */
public class FrankenAgent {
    private static final Logger log = LoggerFactory.getLogger(FrankenAgent.class);

    static final String NOTE_FILE = "data.md";
    static final String NOTE_TEXT = "Data for learning (see README.md)";

    private final String me;
    private final UtilitySpace profile;
    private final Progress progress;
    private final LongSupplier clock;
    private final Path storageDir;

    private final BidSearchService bidSearch;
    private final BidScoringService bidScoring;
    private final AcceptanceService acceptance;

    private Bid lastReceivedBid;
    private FrequencyOpponentModel opponentModel;
    private String other;
    private boolean finished;

    /**
     * Create the agent.
     *
     * @param me         this party's id
     * @param profile    own preferences
     * @param progress   progress towards the deadline
     * @param clock      source of the current time in milliseconds, handed to {@code progress}
     * @param config     strategy parameters
     * @param storageDir directory for the session note, or {@code null} to skip writing it
     * @param random     random source for the bid search
     */
    public FrankenAgent(String me, UtilitySpace profile, Progress progress, LongSupplier clock,
                        StrategyConfig config, Path storageDir, Random random) {
        this.me = me;
        this.profile = profile;
        this.progress = progress;
        this.clock = clock;
        this.storageDir = storageDir;
        this.bidSearch = new BidSearchService(profile, config.getSampleSize(), config.getConcessionMargin(), random);
        this.bidScoring = new BidScoringService(profile, config.getAlpha(), config.getEps());
        this.acceptance = new AcceptanceService(profile, config.getAcceptanceTime());
        log.info("{} is initialized with {} on domain {}", me, config, profile.getDomain().getName());
    }

    public FrankenAgent(String me, UtilitySpace profile, Progress progress, StrategyConfig config, Path storageDir) {
        this(me, profile, progress, System::currentTimeMillis, config, storageDir, new Random());
    }

    /**
     * Entry point of all interaction with the agent.
     *
     * @param info notification from the turn protocol
     * @return the action to perform for {@link Inform.Kind#YOUR_TURN}, empty otherwise
     */
    public Optional<Action> notifyChange(Inform info) {
        if (finished) {
            log.warn("{} ignoring {} after the session finished", me, info);
            return Optional.empty();
        }
        switch (info.getKind()) {
            case ACTION_DONE:
                Action action = info.getAction();
                // ignore action if it is our own
                if (!me.equals(action.getActor())) {
                    other = opponentName(action.getActor());
                    opponentAction(action);
                }
                return Optional.empty();
            case YOUR_TURN:
                return Optional.of(myTurn());
            case FINISHED:
                log.info("{} finished: {}", me, info);
                saveData();
                finished = true;
                log.info("{} is terminating", me);
                return Optional.empty();
            default:
                log.warn("{} ignoring unknown info {}", me, info);
                return Optional.empty();
        }
    }

    /**
     * @return the protocols and profile types this agent supports
     */
    public Capabilities getCapabilities() {
        return new Capabilities(Collections.singleton("SAOP"), Collections.singleton("LinearAdditive"));
    }

    public String getDescription() {
        return "FrankenAgent: random concession search with combined next-bid and time acceptance";
    }

    private void opponentAction(Action action) {
        if (!action.isOffer()) {
            return;
        }
        if (opponentModel == null) {
            opponentModel = new FrequencyOpponentModel(profile.getDomain());
        }
        Bid bid = action.getBid();
        // the model sees the bid before it becomes the baseline for the next turn
        opponentModel.update(bid);
        lastReceivedBid = bid;
        log.debug("{} received offer from {}: {}", me, other, bid);
    }

    private Action myTurn() {
        double now = progress.get(clock.getAsLong());
        Bid bid = bidSearch.findBid(lastReceivedBid);

        if (acceptance.accept(bid, lastReceivedBid, now)) {
            log.info("{} accepts {} at progress {} (utility {})", me, lastReceivedBid, now,
                    profile.getUtility(lastReceivedBid));
            return Action.accept(me, lastReceivedBid);
        }
        log.debug("{} offers {} at progress {} (utility {}, score {})", me, bid, now,
                profile.getUtility(bid), bidScoring.scoreBid(bid, now, opponentModel));
        return Action.offer(me, bid);
    }

    /**
     * Store the end-of-session note. Best effort: failures are logged and never propagated.
     */
    private void saveData() {
        if (storageDir == null) {
            log.debug("{} has no storage directory, skipping session note", me);
            return;
        }
        Path file = storageDir.resolve(NOTE_FILE);
        try {
            Files.createDirectories(storageDir);
            Files.write(file, NOTE_TEXT.getBytes(StandardCharsets.UTF_8));
            log.info("{} wrote session note to {}", me, file);
        } catch (IOException e) {
            log.warn("{} failed to write session note to {}", me, file, e);
        }
    }

    /** Party ids carry a position suffix, e.g. {@code party_2}; the name is what precedes it. */
    static String opponentName(String actor) {
        int cut = actor.lastIndexOf('_');
        return cut > 0 ? actor.substring(0, cut) : actor;
    }

    public String getId() {
        return me;
    }

    public UtilitySpace getProfile() {
        return profile;
    }

    /** @return the opponent's last offer, or {@code null} before the first one */
    public Bid getLastReceivedBid() {
        return lastReceivedBid;
    }

    /** @return the opponent model, or {@code null} before the first opponent offer */
    public FrequencyOpponentModel getOpponentModel() {
        return opponentModel;
    }

    /** @return the opponent's name without position suffix, or {@code null} before it acted */
    public String getOpponentName() {
        return other;
    }

    public boolean isFinished() {
        return finished;
    }
}
