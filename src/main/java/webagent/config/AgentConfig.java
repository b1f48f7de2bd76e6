package webagent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import webagent.ai.DecisionSource;
import webagent.ai.LLMClient;
import webagent.extract.CandidateExtractor;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed agent
 * settings with safe defaults, plus factory methods for the extractor and the
 * reasoning-service client.
 *
 * <p>Values in an optional {@code config.local.properties} (not committed to VCS)
 * override the base file. A missing base file is not an error: every getter has
 * a default.
 */
public class AgentConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentConfig.class);

    static final String CONFIG_FILE       = "config.properties";
    static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_MAX_CANDIDATES = "extractor.max.candidates";
    static final String KEY_BASE_URL       = "ai.llm.base.url";
    static final String KEY_API_KEY        = "ai.llm.api.key";
    static final String KEY_MODEL          = "ai.llm.model";
    static final String KEY_TEMPERATURE    = "ai.llm.temperature";
    static final String KEY_MAX_TOKENS     = "ai.llm.max.tokens";
    static final String KEY_TIMEOUT_SEC    = "ai.llm.timeout.sec";
    static final String KEY_RETRY_COUNT    = "ai.llm.retry.count";
    static final String KEY_RETRY_DELAY_MS = "ai.llm.retry.delay.ms";
    static final String KEY_JSON_MODE      = "ai.llm.json.mode";

    // Defaults
    private static final String  DEFAULT_BASE_URL       = "http://localhost:11434/v1";
    private static final String  DEFAULT_MODEL          = "qwen2.5:14b";
    private static final double  DEFAULT_TEMPERATURE    = 0.1;
    private static final int     DEFAULT_MAX_TOKENS     = 1024;
    private static final int     DEFAULT_TIMEOUT_SEC    = 60;
    private static final int     DEFAULT_RETRY_COUNT    = 2;
    private static final long    DEFAULT_RETRY_DELAY_MS = 2000L;
    private static final boolean DEFAULT_JSON_MODE      = true;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     */
    public AgentConfig() {
        props = new Properties();
        load(CONFIG_FILE, true);
        load(CONFIG_LOCAL_FILE, false);
    }

    /** Uses the given properties as-is; nothing is read from the classpath. */
    public AgentConfig(Properties props) {
        this.props = new Properties();
        this.props.putAll(Objects.requireNonNull(props, "props"));
    }

    private void load(String resource, boolean warnIfMissing) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
                log.debug("Loaded {} from classpath", resource);
            } else if (warnIfMissing) {
                log.warn("{} not found on classpath, using defaults", resource);
            }
        } catch (IOException e) {
            log.warn("Could not load {}: {}", resource, e.getMessage());
        }
    }

    // ── Property accessors ────────────────────────────────────────────────

    /** Maximum candidates per page; negative values fall back to the default. */
    public int getMaxCandidates() {
        int value = parseInt(KEY_MAX_CANDIDATES, CandidateExtractor.DEFAULT_MAX_CANDIDATES);
        if (value < 0) {
            log.warn("Negative value for '{}': {}, using default {}",
                    KEY_MAX_CANDIDATES, value, CandidateExtractor.DEFAULT_MAX_CANDIDATES);
            return CandidateExtractor.DEFAULT_MAX_CANDIDATES;
        }
        return value;
    }

    /** Base URL of the OpenAI-compatible endpoint. */
    public String getLlmBaseUrl()   { return props.getProperty(KEY_BASE_URL, DEFAULT_BASE_URL).trim(); }

    /** Bearer token; empty when unset. */
    public String getLlmApiKey()    { return props.getProperty(KEY_API_KEY, "").trim(); }

    public String getLlmModel()     { return props.getProperty(KEY_MODEL, DEFAULT_MODEL).trim(); }
    public double getTemperature()  { return parseDouble(KEY_TEMPERATURE, DEFAULT_TEMPERATURE); }
    public int    getMaxTokens()    { return parseInt(KEY_MAX_TOKENS, DEFAULT_MAX_TOKENS); }
    public int    getTimeoutSec()   { return parseInt(KEY_TIMEOUT_SEC, DEFAULT_TIMEOUT_SEC); }
    public int    getRetryCount()   { return parseInt(KEY_RETRY_COUNT, DEFAULT_RETRY_COUNT); }
    public long   getRetryDelayMs() { return parseLong(KEY_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS); }

    /** Whether requests ask for {@code response_format: json_object}. */
    public boolean isJsonMode() {
        String val = props.getProperty(KEY_JSON_MODE);
        if (val == null || val.isBlank()) return DEFAULT_JSON_MODE;
        return Boolean.parseBoolean(val.trim());
    }

    // ── Factory methods ───────────────────────────────────────────────────

    public CandidateExtractor createCandidateExtractor() {
        return new CandidateExtractor(getMaxCandidates());
    }

    /**
     * Creates a fully configured {@link LLMClient} using the current properties.
     */
    public LLMClient createLLMClient() {
        log.info("LLM endpoint {} model={} jsonMode={}", getLlmBaseUrl(), getLlmModel(), isJsonMode());
        return new LLMClient(
                getLlmBaseUrl(),
                getLlmApiKey(),
                getLlmModel(),
                getTemperature(),
                getMaxTokens(),
                isJsonMode(),
                getTimeoutSec(),
                getRetryCount(),
                getRetryDelayMs()
        );
    }

    /** Creates a {@link DecisionSource} backed by a fresh {@link LLMClient}. */
    public DecisionSource createDecisionSource() {
        return new DecisionSource(createLLMClient());
    }

    // ── Property parsing helpers ──────────────────────────────────────────

    private double parseDouble(String key, double defaultVal) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultVal;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for '{}': '{}', using default {}", key, val, defaultVal);
            return defaultVal;
        }
    }

    private int parseInt(String key, int defaultVal) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultVal;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for '{}': '{}', using default {}", key, val, defaultVal);
            return defaultVal;
        }
    }

    private long parseLong(String key, long defaultVal) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultVal;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for '{}': '{}', using default {}", key, val, defaultVal);
            return defaultVal;
        }
    }
}
