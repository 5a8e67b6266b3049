package org.solsmt.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run settings for the reader and translator. Immutable.
 */
@Getter
public final class SolSmtConfig {

    private static final Logger logger = LoggerFactory.getLogger(SolSmtConfig.class);

    public static final String MAX_DEPTH_PROPERTY = "solsmt.maxDepth";
    public static final String STRICT_PARENTHESES_PROPERTY = "solsmt.strictParentheses";

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final SolSmtConfig DEFAULTS = new SolSmtConfig(DEFAULT_MAX_DEPTH, false);

    // Deepest list nesting accepted by the reader and the translator
    private final int maxDepth;
    // Reject input that ends inside an open list instead of returning the partial list
    private final boolean strictParentheses;

    private SolSmtConfig(int maxDepth, boolean strictParentheses) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.strictParentheses = strictParentheses;
    }

    public static SolSmtConfig defaults() {
        return DEFAULTS;
    }

    public static SolSmtConfig of(int maxDepth, boolean strictParentheses) {
        return new SolSmtConfig(maxDepth, strictParentheses);
    }

    /**
     * Reads {@value #MAX_DEPTH_PROPERTY} and {@value #STRICT_PARENTHESES_PROPERTY}.
     * Missing or invalid values keep their defaults.
     */
    public static SolSmtConfig fromSystemProperties() {
        int maxDepth = DEFAULT_MAX_DEPTH;
        String depthValue = System.getProperty(MAX_DEPTH_PROPERTY);
        if (depthValue != null) {
            try {
                int parsed = Integer.parseInt(depthValue.trim());
                if (parsed >= 1) {
                    maxDepth = parsed;
                } else {
                    logger.warn("Ignoring non-positive {}={}, using {}", MAX_DEPTH_PROPERTY, depthValue, DEFAULT_MAX_DEPTH);
                }
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid {}={}, using {}", MAX_DEPTH_PROPERTY, depthValue, DEFAULT_MAX_DEPTH);
            }
        }
        boolean strict = Boolean.parseBoolean(System.getProperty(STRICT_PARENTHESES_PROPERTY, "false"));
        SolSmtConfig config = new SolSmtConfig(maxDepth, strict);
        logger.debug("Loaded {}", config);
        return config;
    }

    @Override
    public String toString() {
        return "SolSmtConfig{maxDepth=" + maxDepth + ", strictParentheses=" + strictParentheses + "}";
    }
}
