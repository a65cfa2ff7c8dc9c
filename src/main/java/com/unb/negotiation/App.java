package com.unb.negotiation;

import com.unb.negotiation.config.ConfigLoader;
import com.unb.negotiation.config.NegotiationScenario;
import com.unb.negotiation.config.StrategyConfig;
import com.unb.negotiation.model.NegotiationResult;
import com.unb.negotiation.session.NegotiationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;

/**
 * Application entry point.
 *
 * <p>Loads the strategy parameters and a negotiation scenario, then runs one session
 * between two FrankenAgents and logs the outcome.</p>
 *
 * <p>Arguments, all optional:
 * <ol>
 *   <li>scenario file name (default {@code negotiation.json})</li>
 *   <li>storage directory for session notes (default: no notes)</li>
 *   <li>random seed</li>
 * </ol>
 */
public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        String scenarioName = args.length > 0 ? args[0] : ConfigLoader.DEFAULT_SCENARIO;
        Path storageDir = args.length > 1 ? Paths.get(args[1]) : null;
        Random random = args.length > 2 ? new Random(Long.parseLong(args[2])) : new Random();

        StrategyConfig config = StrategyConfig.load(StrategyConfig.DEFAULT_RESOURCE);
        NegotiationScenario scenario = ConfigLoader.loadScenario(scenarioName);
        log.info("Loaded scenario {} with parties {}", scenarioName, scenario.getParties().keySet());

        NegotiationResult result = NegotiationSession.fromScenario(scenario, config, storageDir, random).run();
        log.info("{}", result);
    }
}
