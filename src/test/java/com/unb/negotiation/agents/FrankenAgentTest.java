package com.unb.negotiation.agents;

import com.unb.negotiation.TestFixtures;
import com.unb.negotiation.config.StrategyConfig;
import com.unb.negotiation.logic.FrequencyOpponentModel;
import com.unb.negotiation.model.Action;
import com.unb.negotiation.model.Bid;
import com.unb.negotiation.model.Inform;
import com.unb.negotiation.model.LinearAdditiveUtilitySpace;
import com.unb.negotiation.model.Progress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FrankenAgentTest {

    private static final String ME = "franken_1";
    private static final String OPPONENT = "boulware_2";

    @TempDir
    Path tempDir;

    private LinearAdditiveUtilitySpace profile;
    private double[] now;
    private Progress progress;

    // utilities 1.0, 0.5 and 0.0 for this agent
    private final Bid best = TestFixtures.bid("color", "red", "size", "small");
    private final Bid middle = TestFixtures.bid("color", "red", "size", "large");
    private final Bid worst = TestFixtures.bid("color", "blue", "size", "large");

    @BeforeEach
    public void setUp() {
        profile = TestFixtures.preferFirstValues(TestFixtures.twoByTwo());
        now = new double[]{0.0};
        progress = time -> now[0];
    }

    private FrankenAgent agent(Path storageDir) {
        return new FrankenAgent(ME, profile, progress, () -> 0L, StrategyConfig.defaults(), storageDir, new Random(17));
    }

    private Action turn(FrankenAgent agent) {
        Optional<Action> action = agent.notifyChange(Inform.yourTurn());
        assertTrue(action.isPresent(), "an action is required on every turn");
        return action.get();
    }

    @Test
    void testFirstTurn_OffersWithoutOpponentModel() {
        FrankenAgent agent = agent(null);
        now[0] = 0.99;

        Action action = turn(agent);
        assertTrue(action.isOffer(), "nothing to accept yet");
        assertEquals(ME, action.getActor());
        assertTrue(profile.getDomain().isComplete(action.getBid()));
        assertNull(agent.getOpponentModel());
        assertNull(agent.getLastReceivedBid());
    }

    @Test
    void testOpponentOffer_CreatesModelOnceAndUpdatesBeforeStoring() {
        FrankenAgent agent = agent(null);

        assertFalse(agent.notifyChange(Inform.actionDone(Action.offer(OPPONENT, worst))).isPresent());
        FrequencyOpponentModel model = agent.getOpponentModel();
        assertEquals(1, model.getObservationCount());
        assertEquals(worst, agent.getLastReceivedBid());

        agent.notifyChange(Inform.actionDone(Action.offer(OPPONENT, middle)));
        assertSame(model, agent.getOpponentModel());
        assertEquals(2, model.getObservationCount());
        assertEquals(2, model.getCount("size", "large"));
        assertEquals(middle, agent.getLastReceivedBid());
        assertEquals("boulware", agent.getOpponentName());
    }

    @Test
    void testOwnActions_AreIgnored() {
        FrankenAgent agent = agent(null);
        agent.notifyChange(Inform.actionDone(Action.offer(ME, worst)));
        assertNull(agent.getOpponentModel());
        assertNull(agent.getLastReceivedBid());
        assertNull(agent.getOpponentName());
    }

    @Test
    void testOpponentAccept_DoesNotChangeLastReceivedBid() {
        FrankenAgent agent = agent(null);
        agent.notifyChange(Inform.actionDone(Action.offer(OPPONENT, worst)));
        agent.notifyChange(Inform.actionDone(Action.accept(OPPONENT, best)));
        assertEquals(worst, agent.getLastReceivedBid());
        assertEquals(1, agent.getOpponentModel().getObservationCount());
    }

    @Test
    void testTurn_AcceptsAnythingPastTimeThreshold() {
        FrankenAgent agent = agent(null);
        agent.notifyChange(Inform.actionDone(Action.offer(OPPONENT, worst)));
        now[0] = 0.96;

        Action action = turn(agent);
        assertTrue(action.isAccept());
        assertEquals(worst, action.getBid());
    }

    @Test
    void testTurn_EarlyOffersNeverWorseThanOpponentOffer() {
        FrankenAgent agent = agent(null);
        agent.notifyChange(Inform.actionDone(Action.offer(OPPONENT, middle)));
        now[0] = 0.2;

        int accepts = 0;
        for (int i = 0; i < 50; i++) {
            Action action = turn(agent);
            if (action.isAccept()) {
                assertEquals(middle, action.getBid());
                accepts++;
            } else {
                assertTrue(profile.getUtility(action.getBid()) >= profile.getUtility(middle));
            }
        }
        assertTrue(accepts > 0, "a worse upcoming bid must lead to acceptance");
    }

    @Test
    void testFinished_WritesNoteAndStops(@TempDir Path storage) throws IOException {
        Path dir = storage.resolve("franken");
        FrankenAgent agent = agent(dir);
        agent.notifyChange(Inform.actionDone(Action.offer(OPPONENT, middle)));

        assertFalse(agent.notifyChange(Inform.finished(middle)).isPresent());
        assertTrue(agent.isFinished());
        assertEquals("Data for learning (see README.md)",
                new String(Files.readAllBytes(dir.resolve("data.md")), StandardCharsets.UTF_8));

        assertFalse(agent.notifyChange(Inform.yourTurn()).isPresent());
    }

    @Test
    void testFinished_WithoutStorageDir() {
        FrankenAgent agent = agent(null);
        agent.notifyChange(Inform.finished(null));
        assertTrue(agent.isFinished());
    }

    @Test
    void testFinished_NoteFailureIsNotFatal() throws IOException {
        Path notADirectory = Files.createFile(tempDir.resolve("occupied"));
        FrankenAgent agent = agent(notADirectory);
        agent.notifyChange(Inform.finished(null));
        assertTrue(agent.isFinished());
    }

    @Test
    void testOpponentName_StripsPositionSuffix() {
        assertEquals("seller", FrankenAgent.opponentName("seller_2"));
        assertEquals("agent_smith", FrankenAgent.opponentName("agent_smith_12"));
        assertEquals("solo", FrankenAgent.opponentName("solo"));
    }

    @Test
    void testCapabilities() {
        FrankenAgent agent = agent(null);
        assertTrue(agent.getCapabilities().getProtocols().contains("SAOP"));
        assertTrue(agent.getCapabilities().getProfiles().contains("LinearAdditive"));
        assertFalse(agent.getDescription().isEmpty());
    }
}
