package survey.model.service.nlp;

import survey.model.domain.LanguageLabel;
import survey.model.domain.SentimentResult;

/**
 * One link of the sentiment fallback chain. Throwing {@link SentimentModelException} hands the
 * text to the next link.
 */
public interface SentimentModel {
    String modelId();

    SentimentResult analyze(String text, LanguageLabel language);
}
