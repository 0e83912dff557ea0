package survey.model.service.nlp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survey.model.domain.LanguageLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Decides FR / AR / DARIJA for a comment.
 *
 * <ol>
 *   <li>blank text defaults to FR;</li>
 *   <li>Darija markers and constructs win before any statistics;</li>
 *   <li>the statistical identifier decides between French and Arabic, Latin languages map to FR;</li>
 *   <li>if the identifier fails, the Arabic vs Latin letter count decides.</li>
 * </ol>
 * Nothing here throws on bad input.
 */
public class LanguageClassifier {
    private static final Logger log = LoggerFactory.getLogger(LanguageClassifier.class);

    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double FRENCH_FALLBACK_CONFIDENCE = 0.7;
    static final double DARIJA_MIN_CONFIDENCE = 0.6;

    private final LanguageIdentifier identifier;

    public LanguageClassifier(LanguageIdentifier identifier) {
        this.identifier = identifier;
    }

    public LanguageLabel detect(String text) {
        if (text == null || text.isBlank()) return LanguageLabel.FR;

        String lower = text.toLowerCase(Locale.ROOT);
        if (isDarija(lower)) return LanguageLabel.DARIJA;

        Optional<String> code;
        try {
            code = identifier.identify(text);
        } catch (RuntimeException e) {
            log.debug("identifier failed, using script heuristic: {}", e.toString());
            code = Optional.empty();
        }
        if (code.isEmpty()) return detectByScript(text);

        return switch (code.get().toLowerCase(Locale.ROOT)) {
            case "fr" -> LanguageLabel.FR;
            case "ar" -> DarijaMarkers.countMarkers(lower) >= 1 ? LanguageLabel.DARIJA : LanguageLabel.AR;
            default -> LanguageLabel.FR;
        };
    }

    public List<LanguageLabel> detectBatch(List<String> texts) {
        List<LanguageLabel> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(detect(t));
        return out;
    }

    public double confidence(String text, LanguageLabel label) {
        if (text == null || text.isBlank()) return DEFAULT_CONFIDENCE;
        String lower = text.toLowerCase(Locale.ROOT);

        switch (label) {
            case DARIJA -> {
                int hits = DarijaMarkers.countMarkers(lower) + DarijaMarkers.countPatterns(lower);
                return Math.max(DARIJA_MIN_CONFIDENCE, Math.min(1.0, hits / 5.0));
            }
            case AR -> {
                int[] counts = scriptCounts(text);
                int letters = counts[2];
                return letters > 0 ? Math.min(1.0, (double) counts[0] / letters) : DEFAULT_CONFIDENCE;
            }
            default -> {
                try {
                    OptionalDouble p = identifier.probability(text, "fr");
                    return p.isPresent() ? clamp(p.getAsDouble()) : FRENCH_FALLBACK_CONFIDENCE;
                } catch (RuntimeException e) {
                    return FRENCH_FALLBACK_CONFIDENCE;
                }
            }
        }
    }

    static boolean isDarija(String lowered) {
        return DarijaMarkers.countMarkers(lowered) >= 2 || DarijaMarkers.countPatterns(lowered) >= 1;
    }

    static LanguageLabel detectByScript(String text) {
        int[] counts = scriptCounts(text);
        if (counts[0] > counts[1]) {
            return DarijaMarkers.countMarkers(text.toLowerCase(Locale.ROOT)) >= 1 ? LanguageLabel.DARIJA : LanguageLabel.AR;
        }
        return LanguageLabel.FR;
    }

    /** [arabic, latin, allLetters] */
    private static int[] scriptCounts(String text) {
        int arabic = 0, latin = 0, letters = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (cp >= 0x0600 && cp <= 0x06FF) arabic++;
            if (Character.isLetter(cp)) {
                letters++;
                if (cp < 0x0600) latin++;
            }
        }
        return new int[]{arabic, latin, letters};
    }

    private static double clamp(double v) { return Math.max(0.0, Math.min(1.0, v)); }
}
