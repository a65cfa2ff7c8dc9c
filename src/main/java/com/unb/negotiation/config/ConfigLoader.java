package com.unb.negotiation.config;

import com.unb.negotiation.model.Bid;
import com.unb.negotiation.model.Domain;
import com.unb.negotiation.model.LinearAdditiveUtilitySpace;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads negotiation scenarios (domain, party profiles and deadline) from JSON.
 *
 * <p>Loading strategy:
 * <ol>
 *   <li>Attempt to read the file at {@code resources/<name>} relative to the working
 *       directory, so a scenario can be edited without rebuilding.</li>
 *   <li>If that file does not exist, load {@code <name>} from the classpath.</li>
 * </ol>
 *
 * <p>Expected layout:
 * <pre>
 * {
 *   "domain":   { "name": "...", "issues": [ { "name": "...", "values": ["...", ...] }, ... ] },
 *   "deadline": { "type": "rounds", "rounds": 200 }   or   { "type": "time", "durationMs": 3000 },
 *   "parties":  [ { "name": "...", "profile": { "name": "...",
 *                    "weights": { issue: w, ... },
 *                    "utilities": { issue: { value: u, ... }, ... },
 *                    "reservationBid": { issue: value, ... } } }, ... ]
 * }
 * </pre>
 * Any error encountered while locating, reading or parsing is wrapped in a {@link RuntimeException}.
 */
public class ConfigLoader {

    public static final String DEFAULT_SCENARIO = "negotiation.json";

    /**
     * Loads a JSON configuration file.
     *
     * @param name file name, looked up under {@code resources/} and then on the classpath
     * @return the parsed JSON object
     * @throws RuntimeException if the file cannot be found, read or parsed
     */
    public static JSONObject loadConfig(String name) {
        try {
            Path path = Paths.get("resources", name); // relative when running from project root
            String content;
            if (Files.exists(path)) {
                content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            } else { // fallback to classpath
                try (InputStream input = Thread.currentThread().getContextClassLoader().getResourceAsStream(name)) {
                    if (input == null) {
                        throw new IOException("not found on the classpath");
                    }
                    content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
            return new JSONObject(content);
        } catch (IOException | JSONException e) {
            throw new RuntimeException("Failed to load config " + name + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads and parses a complete scenario.
     *
     * @param name scenario file name
     * @return the scenario
     * @throws RuntimeException if the file cannot be loaded or does not describe a valid scenario
     */
    public static NegotiationScenario loadScenario(String name) {
        return parseScenario(loadConfig(name));
    }

    public static NegotiationScenario parseScenario(JSONObject config) {
        try {
            Domain domain = parseDomain(config.getJSONObject("domain"));

            JSONArray partiesConfig = config.getJSONArray("parties");
            Map<String, LinearAdditiveUtilitySpace> parties = new LinkedHashMap<>();
            for (int i = 0; i < partiesConfig.length(); i++) {
                JSONObject partyConfig = partiesConfig.getJSONObject(i);
                parties.put(partyConfig.getString("name"), parseProfile(domain, partyConfig.getJSONObject("profile")));
            }

            JSONObject deadline = config.getJSONObject("deadline");
            String type = deadline.getString("type");
            if ("rounds".equals(type)) {
                return NegotiationScenario.withRounds(domain, parties, deadline.getInt("rounds"));
            } else if ("time".equals(type)) {
                return NegotiationScenario.withDuration(domain, parties, deadline.getLong("durationMs"));
            }
            throw new IllegalArgumentException("Unknown deadline type '" + type + "'");
        } catch (JSONException | IllegalArgumentException e) {
            throw new RuntimeException("Invalid negotiation scenario: " + e.getMessage(), e);
        }
    }

    /**
     * @param config JSON object with {@code name} and an ordered {@code issues} array
     * @return the domain
     */
    public static Domain parseDomain(JSONObject config) {
        Map<String, List<String>> issues = new LinkedHashMap<>();
        JSONArray issuesConfig = config.getJSONArray("issues");
        for (int i = 0; i < issuesConfig.length(); i++) {
            JSONObject issueConfig = issuesConfig.getJSONObject(i);
            JSONArray valuesConfig = issueConfig.getJSONArray("values");
            List<String> values = new ArrayList<>();
            for (int j = 0; j < valuesConfig.length(); j++) {
                values.add(valuesConfig.getString(j));
            }
            issues.put(issueConfig.getString("name"), values);
        }
        return new Domain(config.getString("name"), issues);
    }

    /**
     * @param domain domain the profile refers to
     * @param config JSON object with {@code name}, {@code weights}, {@code utilities} and optionally {@code reservationBid}
     * @return the utility space
     */
    public static LinearAdditiveUtilitySpace parseProfile(Domain domain, JSONObject config) {
        Map<String, Double> weights = new HashMap<>();
        JSONObject weightsConfig = config.getJSONObject("weights");
        for (String issue : weightsConfig.keySet()) {
            weights.put(issue, weightsConfig.getDouble(issue));
        }

        Map<String, Map<String, Double>> utilities = new HashMap<>();
        JSONObject utilitiesConfig = config.getJSONObject("utilities");
        for (String issue : utilitiesConfig.keySet()) {
            JSONObject valueConfig = utilitiesConfig.getJSONObject(issue);
            Map<String, Double> valueUtilities = new HashMap<>();
            for (String value : valueConfig.keySet()) {
                valueUtilities.put(value, valueConfig.getDouble(value));
            }
            utilities.put(issue, valueUtilities);
        }

        Bid reservationBid = null;
        JSONObject reservationConfig = config.optJSONObject("reservationBid");
        if (reservationConfig != null) {
            Map<String, String> assignment = new LinkedHashMap<>();
            for (String issue : domain.getIssues()) {
                assignment.put(issue, reservationConfig.getString(issue));
            }
            reservationBid = new Bid(assignment);
        }

        return new LinearAdditiveUtilitySpace(config.getString("name"), domain, weights, utilities, reservationBid);
    }
}
