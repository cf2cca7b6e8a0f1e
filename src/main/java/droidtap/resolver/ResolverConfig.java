package droidtap.resolver;

import droidtap.device.AdbClient;
import droidtap.device.AdbDevice;
import droidtap.device.DeviceCommands;
import droidtap.device.DeviceException;
import droidtap.ocr.TesseractRecognizer;
import droidtap.ocr.TextRecognizer;
import droidtap.tree.AccessibilityTree;
import droidtap.tree.UiAutomatorTree;
import droidtap.vision.OllamaVisionClient;
import droidtap.vision.ScreenshotCache;
import droidtap.vision.ScreenshotPrefetcher;
import droidtap.vision.StubVisionService;
import droidtap.vision.VisionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed resolver
 * settings, plus factory methods that wire a complete {@link ResolutionCascade}.
 *
 * <p>Values in an optional {@code config.local.properties} on the classpath win
 * over the base file.
 */
public class ResolverConfig {

    private static final Logger log = LoggerFactory.getLogger(ResolverConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    private static final String KEY_ADB_PATH              = "adb.path";
    private static final String KEY_ADB_SERIAL            = "adb.serial";
    private static final String KEY_CACHE_TTL             = "screenshot.cache.ttl.ms";
    private static final String KEY_TAP_SETTLE            = "tap.settle.ms";
    private static final String KEY_OVERLAP_FLOOR         = "tree.overlap.floor";
    private static final String KEY_LONG_TEXT_CHARS       = "tree.long.text.chars";
    private static final String KEY_LONG_TEXT_BONUS       = "tree.long.text.bonus";
    private static final String KEY_CLICKABLE_BONUS       = "tree.clickable.bonus";
    private static final String KEY_OCR_ENABLED           = "ocr.enabled";
    private static final String KEY_OCR_TESSDATA          = "ocr.tessdata.path";
    private static final String KEY_OCR_LANGUAGE          = "ocr.language";
    private static final String KEY_OCR_FUZZY_THRESHOLD   = "ocr.fuzzy.threshold";
    private static final String KEY_OCR_MIN_CONFIDENCE    = "ocr.min.confidence";
    private static final String KEY_VISION_ENABLED        = "vision.enabled";
    private static final String KEY_VISION_BASE_URL       = "vision.ollama.base.url";
    private static final String KEY_VISION_MODEL          = "vision.ollama.model";
    private static final String KEY_VISION_TIMEOUT        = "vision.ollama.timeout.sec";
    private static final String KEY_VISION_MIN_CONFIDENCE = "vision.min.confidence";
    private static final String KEY_VISION_EDGE_MARGIN    = "vision.edge.margin.px";
    private static final String KEY_VISION_PREFETCH       = "vision.prefetch.interval.ms";

    // Defaults
    private static final String  DEFAULT_ADB_PATH              = "adb";
    private static final long    DEFAULT_CACHE_TTL             = 3000L;
    private static final long    DEFAULT_TAP_SETTLE            = 300L;
    private static final double  DEFAULT_OVERLAP_FLOOR         = 0.5;
    private static final int     DEFAULT_LONG_TEXT_CHARS       = 20;
    private static final double  DEFAULT_LONG_TEXT_BONUS       = 0.1;
    private static final double  DEFAULT_CLICKABLE_BONUS       = 0.05;
    private static final boolean DEFAULT_OCR_ENABLED           = true;
    private static final String  DEFAULT_OCR_TESSDATA          = "tessdata";
    private static final String  DEFAULT_OCR_LANGUAGE          = "eng";
    private static final double  DEFAULT_OCR_FUZZY_THRESHOLD   = 0.7;
    private static final double  DEFAULT_OCR_MIN_CONFIDENCE    = 0.6;
    private static final boolean DEFAULT_VISION_ENABLED        = false;
    private static final String  DEFAULT_VISION_BASE_URL       = "http://localhost:11434";
    private static final String  DEFAULT_VISION_MODEL          = "llava-phi3";
    private static final int     DEFAULT_VISION_TIMEOUT        = 60;
    private static final double  DEFAULT_VISION_MIN_CONFIDENCE = 0.4;
    private static final int     DEFAULT_VISION_EDGE_MARGIN    = 10;
    private static final long    DEFAULT_VISION_PREFETCH       = 2000L;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     *
     * @throws IllegalStateException if the base config.properties cannot be loaded
     */
    public ResolverConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** For tests: uses the given properties as is. */
    ResolverConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    public String getAdbPath() {
        return getString(KEY_ADB_PATH, DEFAULT_ADB_PATH);
    }

    /** Device serial, or blank for whichever single device adb sees. */
    public String getAdbSerial() {
        return getString(KEY_ADB_SERIAL, "");
    }

    /** How long a screenshot is reused before a new capture (default: 3000 ms). */
    public long getScreenshotCacheTtlMs() {
        return getLong(KEY_CACHE_TTL, DEFAULT_CACHE_TTL);
    }

    /** Pause after a tap so the UI can react (default: 300 ms). */
    public long getTapSettleMs() {
        return getLong(KEY_TAP_SETTLE, DEFAULT_TAP_SETTLE);
    }

    public double getOverlapFloor() {
        return getDouble(KEY_OVERLAP_FLOOR, DEFAULT_OVERLAP_FLOOR);
    }

    public int getLongTextChars() {
        return getInt(KEY_LONG_TEXT_CHARS, DEFAULT_LONG_TEXT_CHARS);
    }

    public double getLongTextBonus() {
        return getDouble(KEY_LONG_TEXT_BONUS, DEFAULT_LONG_TEXT_BONUS);
    }

    public double getClickableBonus() {
        return getDouble(KEY_CLICKABLE_BONUS, DEFAULT_CLICKABLE_BONUS);
    }

    public boolean isOcrEnabled() {
        return getBool(KEY_OCR_ENABLED, DEFAULT_OCR_ENABLED);
    }

    /** Directory with Tesseract {@code *.traineddata} files (default: "tessdata"). */
    public String getOcrTessdataPath() {
        return getString(KEY_OCR_TESSDATA, DEFAULT_OCR_TESSDATA);
    }

    public String getOcrLanguage() {
        return getString(KEY_OCR_LANGUAGE, DEFAULT_OCR_LANGUAGE);
    }

    public double getOcrFuzzyThreshold() {
        return getDouble(KEY_OCR_FUZZY_THRESHOLD, DEFAULT_OCR_FUZZY_THRESHOLD);
    }

    public double getOcrMinConfidence() {
        return getDouble(KEY_OCR_MIN_CONFIDENCE, DEFAULT_OCR_MIN_CONFIDENCE);
    }

    /** Whether the Ollama vision tier is used at all (default: false). */
    public boolean isVisionEnabled() {
        return getBool(KEY_VISION_ENABLED, DEFAULT_VISION_ENABLED);
    }

    public String getVisionBaseUrl() {
        return getString(KEY_VISION_BASE_URL, DEFAULT_VISION_BASE_URL);
    }

    public String getVisionModel() {
        return getString(KEY_VISION_MODEL, DEFAULT_VISION_MODEL);
    }

    public int getVisionTimeoutSec() {
        return getInt(KEY_VISION_TIMEOUT, DEFAULT_VISION_TIMEOUT);
    }

    /** Vision answers at or below this confidence are ignored (default: 0.4). */
    public double getVisionMinConfidence() {
        return getDouble(KEY_VISION_MIN_CONFIDENCE, DEFAULT_VISION_MIN_CONFIDENCE);
    }

    public int getVisionEdgeMarginPx() {
        return getInt(KEY_VISION_EDGE_MARGIN, DEFAULT_VISION_EDGE_MARGIN);
    }

    public long getVisionPrefetchIntervalMs() {
        return getLong(KEY_VISION_PREFETCH, DEFAULT_VISION_PREFETCH);
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public AdbClient createAdbClient() {
        return new AdbClient(getAdbPath(), getAdbSerial());
    }

    public DeviceCommands createDevice() {
        return new AdbDevice(createAdbClient());
    }

    public ScreenshotCache createScreenshotCache(DeviceCommands device) {
        return new ScreenshotCache(device, Duration.ofMillis(getScreenshotCacheTtlMs()));
    }

    public TextRecognizer createTextRecognizer() {
        return new TesseractRecognizer(isOcrEnabled(), getOcrTessdataPath(), getOcrLanguage(), getOcrMinConfidence());
    }

    /**
     * Returns the Ollama client when vision is enabled, otherwise a stub that
     * reports itself unavailable.
     */
    public VisionService createVisionService(ScreenshotCache cache) {
        if (!isVisionEnabled()) {
            log.info("Vision disabled (vision.enabled=false), using stub");
            return new StubVisionService();
        }
        log.info("Vision via Ollama model '{}' at {}", getVisionModel(), getVisionBaseUrl());
        return new OllamaVisionClient(getVisionBaseUrl(), getVisionModel(), getVisionTimeoutSec(),
                cache, new ScreenshotPrefetcher(cache, getVisionPrefetchIntervalMs()));
    }

    public WordOverlapScorer createScorer() {
        return new WordOverlapScorer(getOverlapFloor(), getLongTextChars(), getLongTextBonus(), getClickableBonus());
    }

    /** Wires every tier against a live adb device. */
    public ResolutionCascade createCascade() {
        return createCascade(createDevice(), createTextRecognizer(), ResolverVocabulary.load());
    }

    /**
     * Wires every tier against the given device and recognizer. The vision
     * service gets the device's screen size as its coordinate hint when the
     * device can report it.
     */
    public ResolutionCascade createCascade(DeviceCommands device, TextRecognizer recognizer,
                                           ResolverVocabulary vocabulary) {
        AccessibilityTree tree = new UiAutomatorTree(device);
        ScreenshotCache cache = createScreenshotCache(device);
        VisionService vision = createVisionService(cache);
        if (vision.isAvailable()) {
            try {
                vision.setScreenSize(device.screenSize());
            } catch (DeviceException e) {
                log.warn("Could not read the screen size, vision keeps its default: {}", e.getMessage());
            }
        }

        VisionMatcher visionMatcher = new VisionMatcher(vision, getVisionMinConfidence(), getVisionEdgeMarginPx());
        List<TierMatcher> tiers = List.of(
                new KnowledgeMapMatcher(tree, vocabulary),
                new AccessibilityTreeMatcher(tree, createScorer()),
                new OpticalTextMatcher(recognizer, cache, getOcrFuzzyThreshold()),
                visionMatcher);
        return new ResolutionCascade(device, tree, new QueryNormalizer(vocabulary), tiers, visionMatcher,
                new OrdinalItemFinder(tree, visionMatcher, vocabulary), vision, getTapSettleMs());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String getString(String key, String defaultValue) {
        String raw = props.getProperty(key);
        return raw == null || raw.isBlank() ? defaultValue : raw.trim();
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
