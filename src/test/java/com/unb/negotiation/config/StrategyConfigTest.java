package com.unb.negotiation.config;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class StrategyConfigTest {

    @Test
    void testDefaults() {
        StrategyConfig config = StrategyConfig.defaults();
        assertEquals(0.95, config.getAlpha(), 1e-12);
        assertEquals(0.1, config.getEps(), 1e-12);
        assertEquals(0.95, config.getAcceptanceTime(), 1e-12);
        assertEquals(0.9, config.getConcessionMargin(), 1e-12);
        assertEquals(500, config.getSampleSize());
    }

    @Test
    void testLoad_FromClasspath() {
        StrategyConfig config = StrategyConfig.load(StrategyConfig.DEFAULT_RESOURCE);
        assertEquals(0.95, config.getAlpha(), 1e-12);
        assertEquals(0.1, config.getEps(), 1e-12);
        assertEquals(0.95, config.getAcceptanceTime(), 1e-12);
        assertEquals(0.9, config.getConcessionMargin(), 1e-12);
        assertEquals(500, config.getSampleSize());
    }

    @Test
    void testLoad_MissingResourceGivesDefaults() {
        StrategyConfig config = StrategyConfig.load("no-such-strategy.properties");
        assertEquals(500, config.getSampleSize());
        assertEquals(0.9, config.getConcessionMargin(), 1e-12);
    }

    @Test
    void testFromProperties_OverridesAndFallbacks() {
        Properties properties = new Properties();
        properties.setProperty("strategy.alpha", "0.8");
        properties.setProperty("strategy.concession.margin", " 0.05 ");
        properties.setProperty("strategy.sample.size", "many");

        StrategyConfig config = StrategyConfig.fromProperties(properties);
        assertEquals(0.8, config.getAlpha(), 1e-12);
        assertEquals(0.05, config.getConcessionMargin(), 1e-12);
        // invalid and missing keys keep their defaults
        assertEquals(500, config.getSampleSize());
        assertEquals(0.1, config.getEps(), 1e-12);
        assertEquals(0.95, config.getAcceptanceTime(), 1e-12);
    }
}
