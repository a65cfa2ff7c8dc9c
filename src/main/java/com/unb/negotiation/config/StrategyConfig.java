package com.unb.negotiation.config;

import com.unb.negotiation.logic.AcceptanceService;
import com.unb.negotiation.logic.BidScoringService;
import com.unb.negotiation.logic.BidSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Tunable parameters of the negotiation strategy, read from a properties file.
 *
 * <p>Recognised keys:
 * <ul>
 *   <li>{@code strategy.alpha} - self-interest weight of the scoring function</li>
 *   <li>{@code strategy.eps} - time pressure shape of the scoring function</li>
 *   <li>{@code strategy.acceptance.time} - progress after which any offer is accepted</li>
 *   <li>{@code strategy.concession.margin} - concession margin of the bid search</li>
 *   <li>{@code strategy.sample.size} - number of bids sampled per bid search</li>
 * </ul>
 * Missing or unparsable keys fall back to the built-in defaults.</p>
 */
public class StrategyConfig {
    private static final Logger log = LoggerFactory.getLogger(StrategyConfig.class);

    public static final String DEFAULT_RESOURCE = "strategy.properties";

    private final double alpha;
    private final double eps;
    private final double acceptanceTime;
    private final double concessionMargin;
    private final int sampleSize;

    public StrategyConfig(double alpha, double eps, double acceptanceTime, double concessionMargin, int sampleSize) {
        this.alpha = alpha;
        this.eps = eps;
        this.acceptanceTime = acceptanceTime;
        this.concessionMargin = concessionMargin;
        this.sampleSize = sampleSize;
    }

    /**
     * @return configuration holding the built-in defaults
     */
    public static StrategyConfig defaults() {
        return new StrategyConfig(BidScoringService.DEFAULT_ALPHA, BidScoringService.DEFAULT_EPS,
                AcceptanceService.DEFAULT_TIME_THRESHOLD, BidSearchService.DEFAULT_CONCESSION_MARGIN,
                BidSearchService.DEFAULT_SAMPLE_SIZE);
    }

    /**
     * Load the configuration from a classpath resource. A missing resource yields the defaults.
     *
     * @param resource classpath resource name
     * @return loaded configuration
     * @throws RuntimeException if the resource exists but cannot be read
     */
    public static StrategyConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream input = StrategyConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                log.warn("Unable to find {} on the classpath, using default strategy parameters", resource);
                return defaults();
            }
            properties.load(input);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read strategy config " + resource + ": " + e.getMessage(), e);
        }
        return fromProperties(properties);
    }

    /**
     * @param properties strategy properties
     * @return configuration, with defaults for keys that are absent or invalid
     */
    public static StrategyConfig fromProperties(Properties properties) {
        StrategyConfig d = defaults();
        return new StrategyConfig(
                getDouble(properties, "strategy.alpha", d.alpha),
                getDouble(properties, "strategy.eps", d.eps),
                getDouble(properties, "strategy.acceptance.time", d.acceptanceTime),
                getDouble(properties, "strategy.concession.margin", d.concessionMargin),
                getInt(properties, "strategy.sample.size", d.sampleSize));
    }

    private static double getDouble(Properties properties, String key, double fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.warn("Missing strategy parameter '{}', using {}", key, fallback);
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for strategy parameter '{}', using {}", value, key, fallback);
            return fallback;
        }
    }

    private static int getInt(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.warn("Missing strategy parameter '{}', using {}", key, fallback);
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for strategy parameter '{}', using {}", value, key, fallback);
            return fallback;
        }
    }

    public double getAlpha() {
        return alpha;
    }

    public double getEps() {
        return eps;
    }

    public double getAcceptanceTime() {
        return acceptanceTime;
    }

    public double getConcessionMargin() {
        return concessionMargin;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    @Override
    public String toString() {
        return String.format("StrategyConfig[alpha=%s, eps=%s, acceptanceTime=%s, concessionMargin=%s, sampleSize=%d]",
                alpha, eps, acceptanceTime, concessionMargin, sampleSize);
    }
}
