package droidtap.vision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import droidtap.device.DeviceException;
import droidtap.model.Coordinates;
import droidtap.model.ScreenSize;
import droidtap.model.VisionResult;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link VisionService} backed by a local Ollama vision model (LLaVA family).
 *
 * <p>Screenshots come from the shared {@link ScreenshotCache}; with background
 * capture running the slot is usually fresh, so a call costs one model round
 * trip and no device round trip. The model is asked for a JSON answer; free-text
 * answers are mined for a coordinate pair as a fallback.
 */
public class OllamaVisionClient implements VisionService {

    private static final Logger log = LoggerFactory.getLogger(OllamaVisionClient.class);
    private static final MediaType JSON_MT = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Confidence assigned when coordinates had to be pulled out of prose. */
    static final double TEXT_COORDINATES_CONFIDENCE = 0.6;
    /** Confidence assigned to an answer with no usable location. */
    static final double UNPARSEABLE_CONFIDENCE = 0.3;

    private static final List<Pattern> COORDINATE_PATTERNS = List.of(
            Pattern.compile("coordinates?\\s*\\(?\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("position\\s*\\(?\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("x\\s*[:=]\\s*(\\d+).*?y\\s*[:=]\\s*(\\d+)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("\\((\\d+)\\s*,\\s*(\\d+)\\)"));

    private final String baseUrl;
    private final String model;
    private final ScreenshotCache cache;
    private final ScreenshotPrefetcher prefetcher;
    private final OkHttpClient http;

    private volatile ScreenSize screenSize = new ScreenSize(1080, 2400);
    private volatile Boolean modelPresent;

    /**
     * @param baseUrl    Ollama server, e.g. {@code http://localhost:11434}
     * @param model      vision model tag, e.g. {@code llava-phi3}
     * @param timeoutSec read timeout for one model call
     * @param cache      shared screenshot slot
     * @param prefetcher background loop feeding {@code cache}
     */
    public OllamaVisionClient(String baseUrl, String model, int timeoutSec,
                              ScreenshotCache cache, ScreenshotPrefetcher prefetcher) {
        this.baseUrl    = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model      = model;
        this.cache      = cache;
        this.prefetcher = prefetcher;
        this.http = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Checks once, via {@code /api/tags}, that the server is up and has the model pulled.
     */
    @Override
    public boolean isAvailable() {
        Boolean present = modelPresent;
        if (present == null) {
            present = probeModel();
            modelPresent = present;
        }
        return present;
    }

    @Override
    public VisionResult findElement(String description) {
        if (!isAvailable()) {
            return VisionResult.notFound("Vision model not available");
        }
        try {
            Screenshot shot = cache.get();
            String answer = chat(buildLocatePrompt(description), shot.base64());
            VisionResult result = parseLocation(answer, description);
            log.debug("Vision answer for '{}': {} (confidence {})",
                    description, result.coordinates(), result.confidence());
            return result;
        } catch (IOException | DeviceException e) {
            log.warn("Vision analysis failed for '{}': {}", description, e.getMessage());
            return VisionResult.notFound("Error: " + e.getMessage());
        }
    }

    @Override
    public void setScreenSize(ScreenSize size) {
        this.screenSize = size;
    }

    @Override
    public void startBackgroundCapture() {
        prefetcher.start();
    }

    @Override
    public void stopBackgroundCapture() {
        prefetcher.stop();
    }

    // ── HTTP ──────────────────────────────────────────────────────────────

    private boolean probeModel() {
        Request request = new Request.Builder().url(baseUrl + "/api/tags").get().build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("Ollama at {} answered {}, vision disabled", baseUrl, response.code());
                return false;
            }
            JsonNode models = MAPPER.readTree(response.body().string()).path("models");
            for (JsonNode m : models) {
                if (m.path("name").asText("").contains(model)) {
                    log.info("Vision model '{}' available at {}", model, baseUrl);
                    return true;
                }
            }
            log.warn("Model '{}' not pulled on {} (run: ollama pull {}), vision disabled", model, baseUrl, model);
            return false;
        } catch (IOException e) {
            log.warn("Could not reach Ollama at {}: {}, vision disabled", baseUrl, e.getMessage());
            return false;
        }
    }

    private String chat(String prompt, String base64Png) throws IOException {
        ObjectNode message = MAPPER.createObjectNode();
        message.put("role", "user");
        message.put("content", prompt);
        message.putArray("images").add(base64Png);

        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", model);
        body.set("messages", MAPPER.createArrayNode().add(message));
        body.put("stream", false);
        body.putObject("options").put("temperature", 0.1);

        Request request = new Request.Builder()
                .url(baseUrl + "/api/chat")
                .post(RequestBody.create(MAPPER.writeValueAsString(body), JSON_MT))
                .build();

        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Ollama API error: " + response.code() + " " + response.message());
            }
            String raw = response.body() != null ? response.body().string() : "";
            return MAPPER.readTree(raw).path("message").path("content").asText("").trim();
        }
    }

    // ── Prompt and answer parsing ─────────────────────────────────────────

    String buildLocatePrompt(String description) {
        ScreenSize size = screenSize;
        return """
                You are analyzing a mobile app screenshot (resolution: %1$dx%2$d).

                Find the element: "%3$s"

                Respond ONLY with valid JSON in this exact format:
                {
                    "found": true/false,
                    "x": pixel_x_coordinate,
                    "y": pixel_y_coordinate,
                    "confidence": 0-100,
                    "description": "brief description of what you found"
                }

                Rules:
                - x must be between 0 and %1$d
                - y must be between 0 and %2$d
                - If not found, set found=false and omit x,y
                - Return ONLY the JSON, no other text
                """.formatted(size.width(), size.height(), description);
    }

    /**
     * Turns the model's answer into a {@link VisionResult}.
     *
     * <p>Confidence is reported on a 0-100 scale and clamped to [0, 1]. A found
     * answer without both coordinates counts as not found.
     */
    VisionResult parseLocation(String answer, String description) {
        JsonNode node = extractJson(answer);
        if (node != null && node.isObject()) {
            if (!node.path("found").asBoolean(false)) {
                return VisionResult.notFound("Could not find: " + description);
            }
            if (!node.path("x").isNumber() || !node.path("y").isNumber()) {
                log.debug("Vision answer claims a match without coordinates: {}", node);
                return VisionResult.notFound("No coordinates for: " + description);
            }
            double raw = node.path("confidence").asDouble(50);
            double confidence = Math.max(0.0, Math.min(1.0, raw / 100.0));
            return new VisionResult(
                    node.path("description").asText(description),
                    new Coordinates(node.path("x").asInt(), node.path("y").asInt()),
                    confidence);
        }

        Coordinates fromText = extractCoordinates(answer);
        if (fromText != null) {
            return new VisionResult(description, fromText, TEXT_COORDINATES_CONFIDENCE);
        }
        return new VisionResult(answer, null, UNPARSEABLE_CONFIDENCE);
    }

    /** Reads the outermost {...} span of the answer, tolerating code fences and chatter. */
    private static JsonNode extractJson(String answer) {
        int open = answer.indexOf('{');
        int close = answer.lastIndexOf('}');
        if (open < 0 || close <= open) return null;
        try {
            return MAPPER.readTree(answer.substring(open, close + 1));
        } catch (JsonProcessingException e) {
            log.debug("Vision answer is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Coordinates extractCoordinates(String text) {
        ScreenSize size = screenSize;
        for (Pattern p : COORDINATE_PATTERNS) {
            Matcher m = p.matcher(text);
            if (!m.find()) continue;
            try {
                int x = Integer.parseInt(m.group(1));
                int y = Integer.parseInt(m.group(2));
                if (x <= size.width() && y <= size.height()) {
                    return new Coordinates(x, y);
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring out-of-range number in vision answer: {}", m.group());
            }
        }
        return null;
    }
}
