package survey.model.service.theme;

import survey.model.domain.LanguageLabel;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Stop words and n-gram range used when vectorising one comment. Supporting another language means
 * adding a row to {@link #PROFILES}.
 */
public record LanguageProfile(Set<String> stopWords, int minN, int maxN) {

    private static final Set<String> FRENCH_STOP_WORDS = Set.of(
            "le", "la", "les", "un", "une", "des", "de", "du", "à", "au",
            "et", "ou", "mais", "donc", "or", "ni", "car", "que", "qui",
            "est", "sont", "était", "ont", "a", "as", "avez", "ai",
            "ce", "cet", "cette", "ces", "mon", "ma", "mes", "ton", "ta", "tes",
            "son", "sa", "ses", "notre", "nos", "votre", "vos", "leur", "leurs",
            "je", "tu", "il", "elle", "nous", "vous", "ils", "elles",
            "pour", "par", "avec", "sans", "sur", "sous", "dans", "en",
            // too generic to be a theme
            "tous", "tout", "toute", "toutes", "bien", "très", "plus", "moins",
            "comme", "aucun", "aucune", "beaucoup", "peu", "assez", "trop",
            "même", "aussi", "encore", "déjà", "jamais", "toujours", "souvent",
            "rien", "quelque", "plusieurs", "quelques", "certains", "certaines",
            "pas", "non", "oui", "si", "ne", "n", "y", "d");

    private static final Set<String> ARABIC_STOP_WORDS = Set.of(
            "في", "من", "إلى", "على", "عن", "هذا", "ذلك", "التي", "الذي",
            "هو", "هي", "أن", "كان", "لم", "لن", "قد", "لكن", "أو", "و");

    private static final Set<String> DARIJA_STOP_WORDS = Set.of(
            "dyal", "dial", "w", "wla", "ola", "bach", "bla",
            "hadi", "hadak", "hadik", "hna", "nta", "nti", "howa", "hia");

    private static final Map<LanguageLabel, LanguageProfile> PROFILES = new EnumMap<>(Map.of(
            LanguageLabel.FR, new LanguageProfile(FRENCH_STOP_WORDS, 1, 3),
            LanguageLabel.AR, new LanguageProfile(ARABIC_STOP_WORDS, 1, 2),
            LanguageLabel.DARIJA, new LanguageProfile(DARIJA_STOP_WORDS, 1, 3)));

    public LanguageProfile {
        stopWords = Set.copyOf(stopWords);
        if (minN < 1 || maxN < minN) throw new IllegalArgumentException("bad n-gram range " + minN + ".." + maxN);
    }

    /** Unknown or missing language falls back to the French profile. */
    public static LanguageProfile of(LanguageLabel language) {
        return PROFILES.getOrDefault(language, PROFILES.get(LanguageLabel.FR));
    }
}
