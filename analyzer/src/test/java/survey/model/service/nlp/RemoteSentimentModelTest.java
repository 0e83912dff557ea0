package survey.model.service.nlp;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import survey.model.domain.LanguageLabel;
import survey.model.domain.Polarity;
import survey.model.domain.SentimentResult;
import survey.model.service.config.AppConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteSentimentModelTest {

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> reply = new AtomicReference<>("[]");
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            lastPath.set(ex.getRequestURI().getPath());
            lastAuth.set(ex.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] out = reply.get().getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(status.get(), out.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private RemoteSentimentModel model(String apiKey, int maxChars) {
        var settings = new AppConfig.Sentiment(
                "http://127.0.0.1:" + server.getAddress().getPort() + "/models/",
                apiKey, Duration.ofSeconds(5), maxChars, 0.55,
                Map.of(LanguageLabel.FR, "fr-model", LanguageLabel.AR, "ar-model"));
        return new RemoteSentimentModel(settings);
    }

    @Test
    void analyze_shouldReadNestedPredictionListAndSendBearerToken() {
        reply.set("[[{\"label\":\"5 stars\",\"score\":0.93},{\"label\":\"4 stars\",\"score\":0.05}]]");

        SentimentResult r = model("secret", 512).analyze("Formation excellente", LanguageLabel.FR);

        assertThat(r.polarity()).isEqualTo(Polarity.POSITIVE);
        assertThat(r.score()).isEqualTo(0.93);
        assertThat(r.strategy()).isEqualTo(SentimentResult.STRATEGY_REMOTE);
        assertThat(r.sourceLabel()).isEqualTo("fr-model:5 stars");
        assertThat(lastPath.get()).isEqualTo("/models/fr-model");
        assertThat(lastAuth.get()).isEqualTo("Bearer secret");
        assertThat(lastBody.get()).contains("\"inputs\":\"Formation excellente\"");
    }

    @Test
    void analyze_shouldPickModelOfLanguageAndFallBackToFrench() {
        reply.set("[{\"label\":\"negative\",\"score\":0.8}]");

        SentimentResult ar = model("", 512).analyze("سيء", LanguageLabel.AR);
        assertThat(lastPath.get()).isEqualTo("/models/ar-model");
        assertThat(lastAuth.get()).isNull();
        assertThat(ar.polarity()).isEqualTo(Polarity.NEGATIVE);
        assertThat(ar.score()).isEqualTo(-0.8);

        model("", 512).analyze("khayb", LanguageLabel.DARIJA);
        assertThat(lastPath.get()).isEqualTo("/models/fr-model");
    }

    @Test
    void analyze_shouldTruncateLongInput() {
        reply.set("[{\"label\":\"neutral\",\"score\":0.7}]");

        model("", 10).analyze("abcdefghijklmnopqrstuvwxyz", LanguageLabel.FR);

        assertThat(lastBody.get()).contains("\"inputs\":\"abcdefghij\"");
    }

    @Test
    void analyze_shouldNotSplitSurrogatePairWhenTruncating() {
        reply.set("[{\"label\":\"neutral\",\"score\":0.7}]");

        // the emoji occupies chars 9 and 10
        model("", 10).analyze("abcdefghi\uD83D\uDE00xyz", LanguageLabel.FR);

        assertThat(lastBody.get()).contains("\"inputs\":\"abcdefghi\"");
    }

    @Test
    void truncate_shouldKeepWholeCodePoints() {
        String text = "ab\uD83D\uDE00cd";

        assertThat(RemoteSentimentModel.truncate(text, 3)).isEqualTo("ab");
        assertThat(RemoteSentimentModel.truncate(text, 4)).isEqualTo("ab\uD83D\uDE00");
        assertThat(RemoteSentimentModel.truncate(text, 2)).isEqualTo("ab");
        assertThat(RemoteSentimentModel.truncate(text, 50)).isSameAs(text);
    }

    @Test
    void analyze_shouldThrowOnErrorStatus() {
        status.set(503);
        reply.set("{\"error\":\"Model is currently loading\"}");

        assertThatThrownBy(() -> model("", 512).analyze("texte", LanguageLabel.FR))
                .isInstanceOf(SentimentModelException.class)
                .hasMessageContaining("503");
    }

    @Test
    void analyze_shouldThrowOnMalformedBody() {
        reply.set("not json at all {");

        assertThatThrownBy(() -> model("", 512).analyze("texte", LanguageLabel.FR))
                .isInstanceOf(SentimentModelException.class);
    }

    @Test
    void scorer_shouldFallBackToRulesWhenServerFails() {
        status.set(500);
        reply.set("boom");
        SentimentScorer scorer = SentimentScorer.remoteThenRules(model("", 512));

        SentimentResult r = scorer.analyze("formation décevante, mal organisée", LanguageLabel.FR);

        assertThat(r.strategy()).isEqualTo(SentimentResult.STRATEGY_RULES);
        assertThat(r.polarity()).isEqualTo(Polarity.NEGATIVE);
    }

    @Test
    void normalize_shouldMapLabelFamilies() {
        assertThat(RemoteSentimentModel.normalize("m", "POSITIVE", 0.9, 0.55).polarity()).isEqualTo(Polarity.POSITIVE);
        assertThat(RemoteSentimentModel.normalize("m", "1 star", 0.9, 0.55).polarity()).isEqualTo(Polarity.NEGATIVE);
        assertThat(RemoteSentimentModel.normalize("m", "2 stars", 0.9, 0.55).polarity()).isEqualTo(Polarity.NEGATIVE);
        assertThat(RemoteSentimentModel.normalize("m", "3 stars", 0.9, 0.55).polarity()).isEqualTo(Polarity.NEUTRAL);
        assertThat(RemoteSentimentModel.normalize("m", "LABEL_7", 0.9, 0.55).polarity()).isEqualTo(Polarity.NEUTRAL);
    }

    @Test
    void normalize_shouldTreatLowConfidenceAsNeutral() {
        SentimentResult r = RemoteSentimentModel.normalize("m", "positive", 0.4, 0.55);

        assertThat(r.polarity()).isEqualTo(Polarity.NEUTRAL);
        assertThat(r.score()).isZero();
        assertThat(r.confidence()).isEqualTo(0.4);
    }

    @Test
    void firstPrediction_shouldRejectEmptyAndUnlabelledAnswers() {
        RemoteSentimentModel m = model("", 512);

        for (String body : List.of("[]", "[[]]", "[{\"score\":0.3}]", "{}")) {
            assertThatThrownBy(() -> m.firstPrediction(body)).isInstanceOf(SentimentModelException.class);
        }
    }
}
