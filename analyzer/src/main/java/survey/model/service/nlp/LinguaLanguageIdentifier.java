package survey.model.service.nlp;

import com.github.pemistahl.lingua.api.IsoCode639_1;
import com.github.pemistahl.lingua.api.Language;
import com.github.pemistahl.lingua.api.LanguageDetector;
import com.github.pemistahl.lingua.api.LanguageDetectorBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Lingua-backed identifier. The detector holds its n-gram models in memory, so build one
 * per process and share it.
 */
public class LinguaLanguageIdentifier implements LanguageIdentifier {
    private static final Logger log = LoggerFactory.getLogger(LinguaLanguageIdentifier.class);

    private final LanguageDetector detector;

    public LinguaLanguageIdentifier(Collection<String> isoCodes) {
        List<Language> langs = resolve(isoCodes);
        if (langs.size() < 2) throw new IllegalArgumentException("need at least two languages, got " + isoCodes);
        this.detector = LanguageDetectorBuilder.fromLanguages(langs.toArray(new Language[0]))
                .withLowAccuracyMode()
                .build();
        log.info("Lingua identifier ready for {}", langs);
    }

    @Override
    public Optional<String> identify(String text) {
        Language best = detector.detectLanguageOf(text);
        if (best == null || best == Language.UNKNOWN) return Optional.empty();
        return Optional.of(iso(best));
    }

    @Override
    public OptionalDouble probability(String text, String isoCode) {
        Map<Language, Double> values = detector.computeLanguageConfidenceValues(text);
        for (var e : values.entrySet()) {
            if (iso(e.getKey()).equalsIgnoreCase(isoCode)) return OptionalDouble.of(e.getValue());
        }
        return OptionalDouble.empty();
    }

    private static String iso(Language l) {
        return l.getIsoCode639_1().name().toLowerCase(Locale.ROOT);
    }

    private static List<Language> resolve(Collection<String> isoCodes) {
        List<Language> out = new ArrayList<>();
        for (String code : isoCodes) {
            for (Language l : Language.values()) {
                if (l == Language.UNKNOWN || l.getIsoCode639_1() == IsoCode639_1.NONE) continue;
                if (l.getIsoCode639_1().name().equalsIgnoreCase(code.trim())) { out.add(l); break; }
            }
        }
        return out;
    }
}
