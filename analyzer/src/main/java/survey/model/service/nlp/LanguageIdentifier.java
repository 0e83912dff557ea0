package survey.model.service.nlp;

import java.util.Optional;
import java.util.OptionalDouble;

/** Statistical language identifier speaking ISO 639-1 codes ("fr", "ar", ...). */
public interface LanguageIdentifier {

    /** Most likely language; empty when the identifier cannot decide. */
    Optional<String> identify(String text);

    /** Probability of {@code isoCode} for the text; empty when not reported. */
    OptionalDouble probability(String text, String isoCode);
}
