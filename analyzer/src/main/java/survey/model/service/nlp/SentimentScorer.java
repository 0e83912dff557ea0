package survey.model.service.nlp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survey.model.domain.LanguageLabel;
import survey.model.domain.Polarity;
import survey.model.domain.SentimentResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Tries each {@link SentimentModel} in order; a {@link RuntimeException} from one link moves on to
 * the next. The produced {@link SentimentResult#strategy()} tells which link answered.
 */
public class SentimentScorer {
    private static final Logger log = LoggerFactory.getLogger(SentimentScorer.class);

    private final List<SentimentModel> chain;

    public SentimentScorer(List<SentimentModel> chain) {
        if (chain.isEmpty()) throw new IllegalArgumentException("sentiment chain is empty");
        this.chain = List.copyOf(chain);
    }

    public static SentimentScorer remoteThenRules(RemoteSentimentModel remote) {
        return new SentimentScorer(List.of(remote, new RuleBasedSentimentModel()));
    }

    public SentimentResult analyze(String text, LanguageLabel language) {
        if (text == null || text.isBlank()) return SentimentResult.emptyText();

        for (SentimentModel model : chain) {
            try {
                return model.analyze(text, language);
            } catch (RuntimeException e) {
                log.warn("sentiment model {} failed, falling back: {}", model.modelId(), e.getMessage());
                log.debug("sentiment failure detail", e);
            }
        }
        return new SentimentResult(Polarity.NEUTRAL, 0.0, 0.0, "neutral (no model answered)", SentimentResult.STRATEGY_NONE);
    }

    /** Items are scored independently; a failing remote call only degrades its own item. */
    public List<SentimentResult> analyzeBatch(List<String> texts, List<LanguageLabel> languages) {
        if (texts.size() != languages.size()) {
            throw new IllegalArgumentException("texts and languages differ in size: " + texts.size() + " vs " + languages.size());
        }
        List<SentimentResult> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) out.add(analyze(texts.get(i), languages.get(i)));
        return out;
    }
}
