package survey.model.service.nlp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import survey.model.domain.LanguageLabel;
import survey.model.domain.Polarity;
import survey.model.domain.SentimentResult;
import survey.model.service.config.AppConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hosted text-classification models (HuggingFace inference API), one model per language.
 * Any transport problem, non-200 status or unexpected body raises {@link SentimentModelException}.
 */
public class RemoteSentimentModel implements SentimentModel {
    private static final Pattern POSITIVE = Pattern.compile("pos|\\b[45] stars?\\b");
    private static final Pattern NEGATIVE = Pattern.compile("neg|\\b[12] stars?\\b");

    private final HttpClient client;
    private final ObjectMapper om = new ObjectMapper();
    private final AppConfig.Sentiment settings;

    public RemoteSentimentModel(AppConfig.Sentiment settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(settings.timeout()).build());
    }

    RemoteSentimentModel(AppConfig.Sentiment settings, HttpClient client) {
        this.settings = settings;
        this.client = client;
    }

    @Override public String modelId() { return "hf-inference"; }

    @Override
    public SentimentResult analyze(String text, LanguageLabel language) {
        String model = settings.modelFor(language == null ? LanguageLabel.FR : language);
        String payload = truncate(text, settings.maxChars());

        String body;
        try {
            ObjectNode root = om.createObjectNode();
            root.put("inputs", payload);
            var req = HttpRequest.newBuilder(modelUri(model))
                    .timeout(settings.timeout())
                    .header("Content-Type", "application/json");
            if (settings.apiKey() != null && !settings.apiKey().isBlank()) {
                req.header("Authorization", "Bearer " + settings.apiKey());
            }
            req.POST(HttpRequest.BodyPublishers.ofString(om.writeValueAsString(root), StandardCharsets.UTF_8));
            HttpResponse<String> res = client.send(req.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (res.statusCode() != 200) {
                throw new SentimentModelException("HTTP " + res.statusCode() + " from " + model + ": " + abbreviate(res.body()));
            }
            body = res.body();
        } catch (IOException e) {
            throw new SentimentModelException("call to " + model + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SentimentModelException("call to " + model + " interrupted", e);
        }

        JsonNode top = firstPrediction(body);
        return normalize(model, top.get("label").asText(), top.get("score").asDouble(), settings.confidenceThreshold());
    }

    private URI modelUri(String model) {
        String base = settings.endpoint();
        return URI.create(base.endsWith("/") ? base + model : base + "/" + model);
    }

    /** Accepts {@code [{label, score}, ...]} and {@code [[{label, score}, ...]]}. */
    JsonNode firstPrediction(String body) {
        JsonNode json;
        try {
            json = om.readTree(body);
        } catch (IOException e) {
            throw new SentimentModelException("malformed response: " + abbreviate(body), e);
        }
        if (json == null || !json.isArray() || json.isEmpty()) {
            throw new SentimentModelException("unexpected response: " + abbreviate(body));
        }
        JsonNode first = json.get(0);
        if (first.isArray()) {
            if (first.isEmpty()) throw new SentimentModelException("empty prediction list");
            first = first.get(0);
        }
        if (!first.isObject() || !first.path("label").isTextual() || !first.path("score").isNumber()) {
            throw new SentimentModelException("prediction without label/score: " + abbreviate(body));
        }
        return first;
    }

    static SentimentResult normalize(String model, String rawLabel, double rawConfidence, double threshold) {
        String label = rawLabel.toLowerCase(Locale.ROOT).replace('_', ' ');
        double confidence = Math.max(0.0, Math.min(1.0, rawConfidence));
        String source = model + ":" + rawLabel;

        if (POSITIVE.matcher(label).find()) {
            return confidence >= threshold
                    ? new SentimentResult(Polarity.POSITIVE, confidence, confidence, source, SentimentResult.STRATEGY_REMOTE)
                    : neutral(confidence, source);
        }
        if (NEGATIVE.matcher(label).find()) {
            return confidence >= threshold
                    ? new SentimentResult(Polarity.NEGATIVE, -confidence, confidence, source, SentimentResult.STRATEGY_REMOTE)
                    : neutral(confidence, source);
        }
        // explicit neutral ("neutral", "3 stars") and unknown labels
        return neutral(confidence, source);
    }

    private static SentimentResult neutral(double confidence, String source) {
        return new SentimentResult(Polarity.NEUTRAL, 0.0, confidence, source, SentimentResult.STRATEGY_REMOTE);
    }

    /** Cuts to at most {@code max} chars without splitting a surrogate pair. */
    static String truncate(String text, int max) {
        if (text.length() <= max) return text;
        int end = max > 0 && Character.isHighSurrogate(text.charAt(max - 1)) ? max - 1 : max;
        return text.substring(0, end);
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 200 ? s : s.substring(0, 200) + "…";
    }
}
