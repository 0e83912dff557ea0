package survey.model.service.nlp;

import survey.model.domain.LanguageLabel;
import survey.model.domain.Polarity;
import survey.model.domain.SentimentResult;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Offline lexicon scoring, the last link of the sentiment chain. Never throws for non-null text.
 * Equal non-zero hit counts resolve to negative.
 */
public class RuleBasedSentimentModel implements SentimentModel {
    private final Map<LanguageLabel, SentimentLexicon> lexicons;

    public RuleBasedSentimentModel() {
        this(defaultLexicons());
    }

    public RuleBasedSentimentModel(Map<LanguageLabel, SentimentLexicon> lexicons) {
        this.lexicons = new EnumMap<>(lexicons);
    }

    /** Latin-script Darija shows up in French-classified text, so FR also carries the Darija entries. */
    public static Map<LanguageLabel, SentimentLexicon> defaultLexicons() {
        Map<LanguageLabel, SentimentLexicon> m = new EnumMap<>(LanguageLabel.class);
        m.put(LanguageLabel.FR, SentimentLexicon.load("fr", "darija"));
        m.put(LanguageLabel.AR, SentimentLexicon.load("ar"));
        m.put(LanguageLabel.DARIJA, SentimentLexicon.load("darija", "fr", "ar"));
        return m;
    }

    @Override public String modelId() { return "rule-lexicon-v1"; }

    @Override
    public SentimentResult analyze(String text, LanguageLabel language) {
        SentimentLexicon lex = lexicons.getOrDefault(language == null ? LanguageLabel.FR : language,
                lexicons.get(LanguageLabel.FR));
        if (lex == null) throw new SentimentModelException("no lexicon for " + language);

        String lowered = text.toLowerCase(Locale.ROOT);
        int pos = lex.positiveHits(lowered);
        int neg = lex.negativeHits(lowered);

        if (neg > 0 && neg >= pos) {
            return new SentimentResult(Polarity.NEGATIVE, -Math.min(0.8, 0.5 + neg * 0.15),
                    Math.min(0.75, 0.5 + neg * 0.1), "negative (rule-based)", SentimentResult.STRATEGY_RULES);
        }
        if (pos > neg) {
            return new SentimentResult(Polarity.POSITIVE, Math.min(0.8, 0.5 + pos * 0.15),
                    Math.min(0.75, 0.5 + pos * 0.1), "positive (rule-based)", SentimentResult.STRATEGY_RULES);
        }
        return new SentimentResult(Polarity.NEUTRAL, 0.0, 0.5, "neutral (rule-based)", SentimentResult.STRATEGY_RULES);
    }
}
