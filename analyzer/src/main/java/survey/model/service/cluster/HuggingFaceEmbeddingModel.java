package survey.model.service.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survey.model.service.config.AppConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Sentence embeddings from the HuggingFace feature-extraction pipeline. Inputs are sent in
 * batches; token-level outputs are mean-pooled into one vector per text.
 */
public class HuggingFaceEmbeddingModel implements EmbeddingModel {
    private static final Logger log = LoggerFactory.getLogger(HuggingFaceEmbeddingModel.class);

    private final AppConfig.Embedding settings;
    private final HttpClient client;
    private final ObjectMapper om = new ObjectMapper();

    public HuggingFaceEmbeddingModel(AppConfig.Embedding settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(settings.timeout()).build());
    }

    HuggingFaceEmbeddingModel(AppConfig.Embedding settings, HttpClient client) {
        this.settings = settings;
        this.client = client;
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
        List<Embedding> out = new ArrayList<>(segments.size());
        for (int from = 0; from < segments.size(); from += settings.batchSize()) {
            List<TextSegment> batch = segments.subList(from, Math.min(segments.size(), from + settings.batchSize()));
            for (float[] v : call(batch)) out.add(Embedding.from(v));
        }
        log.debug("embedded {} texts with {}", out.size(), settings.model());
        return Response.from(out);
    }

    private List<float[]> call(List<TextSegment> batch) {
        ObjectNode root = om.createObjectNode();
        ArrayNode inputs = root.putArray("inputs");
        batch.forEach(s -> inputs.add(s.text()));
        root.putObject("options").put("wait_for_model", true);

        String base = settings.endpoint();
        URI uri = URI.create(base.endsWith("/") ? base + settings.model() : base + "/" + settings.model());
        try {
            var req = HttpRequest.newBuilder(uri)
                    .timeout(settings.timeout())
                    .header("Content-Type", "application/json");
            if (settings.apiKey() != null && !settings.apiKey().isBlank()) {
                req.header("Authorization", "Bearer " + settings.apiKey());
            }
            req.POST(HttpRequest.BodyPublishers.ofString(om.writeValueAsString(root), StandardCharsets.UTF_8));
            HttpResponse<String> res = client.send(req.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (res.statusCode() != 200) {
                throw new EmbeddingException("HTTP " + res.statusCode() + " from " + settings.model());
            }
            return parse(om.readTree(res.body()), batch.size());
        } catch (IOException e) {
            throw new EmbeddingException("embedding call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("embedding call interrupted", e);
        }
    }

    /** One entry per input: either a vector, or a token-by-dimension matrix to mean-pool. */
    static List<float[]> parse(JsonNode json, int expected) {
        if (json == null || !json.isArray() || json.size() != expected) {
            throw new EmbeddingException("expected " + expected + " embeddings, got "
                    + (json == null || !json.isArray() ? "no array" : json.size()));
        }
        List<float[]> out = new ArrayList<>(expected);
        for (JsonNode item : json) {
            if (!item.isArray() || item.isEmpty()) throw new EmbeddingException("empty embedding");
            out.add(item.get(0).isArray() ? meanPool(item) : vector(item));
        }
        return out;
    }

    private static float[] meanPool(JsonNode tokens) {
        float[] sum = null;
        for (JsonNode token : tokens) {
            float[] v = vector(token);
            if (sum == null) sum = new float[v.length];
            else if (v.length != sum.length) throw new EmbeddingException("ragged token matrix");
            for (int j = 0; j < v.length; j++) sum[j] += v[j];
        }
        for (int j = 0; j < sum.length; j++) sum[j] /= tokens.size();
        return sum;
    }

    private static float[] vector(JsonNode arr) {
        float[] v = new float[arr.size()];
        for (int j = 0; j < v.length; j++) {
            JsonNode n = arr.get(j);
            if (!n.isNumber()) throw new EmbeddingException("non-numeric embedding component");
            v[j] = (float) n.asDouble();
        }
        return v;
    }
}
