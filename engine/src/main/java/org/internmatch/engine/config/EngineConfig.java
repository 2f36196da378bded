package org.internmatch.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.internmatch.engine.domain.model.ScoringRequest;
import org.internmatch.engine.domain.scoring.SkillMatcher;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration for the allocation engine.
 * Values come from environment variables, then a {@code .env} file, then the defaults below.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_CATALOG_URL = "http://localhost:5000";
    public static final String DEFAULT_LOG_FILE = "logs/intern-match.log";

    // Catalog API
    private final String catalogApiUrl;
    private final boolean catalogEnabled;
    private final String catalogApiToken;

    // Ranking
    private final int topK;
    private final double skillFuzzyThreshold;
    private final double skillPartialCredit;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.catalogApiUrl = builder.catalogApiUrl;
        this.catalogEnabled = builder.catalogEnabled;
        this.catalogApiToken = builder.catalogApiToken;
        this.topK = builder.topK;
        this.skillFuzzyThreshold = builder.skillFuzzyThreshold;
        this.skillPartialCredit = builder.skillPartialCredit;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from environment variables, falling back to a {@code .env} file
     * in the working directory.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        return fromSource(key -> {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = dotenv.get(key);
            }
            return value;
        });
    }

    /**
     * Creates configuration from an arbitrary key lookup. Blank or missing values use the defaults.
     */
    public static EngineConfig fromSource(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup must not be null");
        return new Builder()
                .catalogApiUrl(getString(lookup, "CATALOG_API_URL", DEFAULT_CATALOG_URL))
                .catalogEnabled(getBoolean(lookup, "CATALOG_ENABLED", false))
                .catalogApiToken(getString(lookup, "CATALOG_API_TOKEN", ""))
                .topK(getInt(lookup, "RECOMMENDATION_TOP_K", ScoringRequest.DEFAULT_TOP_K))
                .skillFuzzyThreshold(getDouble(lookup, "SKILL_FUZZY_THRESHOLD", SkillMatcher.DEFAULT_FUZZY_THRESHOLD))
                .skillPartialCredit(getDouble(lookup, "SKILL_PARTIAL_CREDIT", SkillMatcher.DEFAULT_PARTIAL_CREDIT))
                .logFilePath(getString(lookup, "ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, "ENGINE_FILE_LOGGING_ENABLED", false))
                .build();
    }

    // Getters
    public String getCatalogApiUrl() {
        return catalogApiUrl;
    }

    public boolean isCatalogEnabled() {
        return catalogEnabled;
    }

    public String getCatalogApiToken() {
        return catalogApiToken;
    }

    public int getTopK() {
        return topK;
    }

    public double getSkillFuzzyThreshold() {
        return skillFuzzyThreshold;
    }

    public double getSkillPartialCredit() {
        return skillPartialCredit;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Lookup helpers
    private static String getString(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static double getDouble(Function<String, String> lookup, String key, double defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid number for %s: %s, using default: %s", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(Function<String, String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "catalogApiUrl='" + catalogApiUrl + '\'' +
                ", catalogEnabled=" + catalogEnabled +
                ", topK=" + topK +
                ", skillFuzzyThreshold=" + skillFuzzyThreshold +
                ", skillPartialCredit=" + skillPartialCredit +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String catalogApiUrl = DEFAULT_CATALOG_URL;
        private boolean catalogEnabled = false;
        private String catalogApiToken = "";
        private int topK = ScoringRequest.DEFAULT_TOP_K;
        private double skillFuzzyThreshold = SkillMatcher.DEFAULT_FUZZY_THRESHOLD;
        private double skillPartialCredit = SkillMatcher.DEFAULT_PARTIAL_CREDIT;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = false;

        public Builder catalogApiUrl(String catalogApiUrl) {
            this.catalogApiUrl = Objects.requireNonNull(catalogApiUrl, "catalogApiUrl must not be null");
            return this;
        }

        public Builder catalogEnabled(boolean catalogEnabled) {
            this.catalogEnabled = catalogEnabled;
            return this;
        }

        public Builder catalogApiToken(String catalogApiToken) {
            this.catalogApiToken = catalogApiToken;
            return this;
        }

        public Builder topK(int topK) {
            if (topK < 1) {
                throw new IllegalArgumentException("topK must be at least 1");
            }
            this.topK = topK;
            return this;
        }

        public Builder skillFuzzyThreshold(double skillFuzzyThreshold) {
            if (!(skillFuzzyThreshold > 0.0 && skillFuzzyThreshold <= 1.0)) {
                throw new IllegalArgumentException("skillFuzzyThreshold must be in (0, 1]");
            }
            this.skillFuzzyThreshold = skillFuzzyThreshold;
            return this;
        }

        public Builder skillPartialCredit(double skillPartialCredit) {
            if (!(skillPartialCredit >= 0.0 && skillPartialCredit <= 1.0)) {
                throw new IllegalArgumentException("skillPartialCredit must be in [0, 1]");
            }
            this.skillPartialCredit = skillPartialCredit;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
