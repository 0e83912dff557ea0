package survey.model.service.theme;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survey.model.domain.GlobalTheme;
import survey.model.domain.LanguageLabel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword themes for single comments. Each text is vectorised on its own with the language's
 * {@link LanguageProfile}; a term needs at least {@value #MIN_TERM_COUNT} occurrences to count.
 * Texts where nothing qualifies go through a plain frequency count instead.
 */
public class ThemeExtractor {
    private static final Logger log = LoggerFactory.getLogger(ThemeExtractor.class);

    public static final int MIN_TERM_COUNT = 2;
    public static final int DEFAULT_TOP_N = 5;

    private static final Pattern TOKEN = Pattern.compile("\\w{2,}", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_PUNCT = Pattern.compile("^[\\p{P}\\p{S}]+|[\\p{P}\\p{S}]+$");
    private static final Set<String> UNIVERSAL_STOP_WORDS = Set.of(
            "le", "la", "les", "un", "une", "de", "du", "et", "ou", "à", "au", "en", "pour");

    private final int topN;

    public ThemeExtractor() { this(DEFAULT_TOP_N); }

    public ThemeExtractor(int topN) {
        if (topN < 1) throw new IllegalArgumentException("topN must be positive");
        this.topN = topN;
    }

    public int topN() { return topN; }

    public record BatchResult(List<List<String>> themes, Map<String, Object> info) {}

    public List<String> extractOne(String text, LanguageLabel language, int topN) {
        if (text == null || text.isBlank()) return List.of();
        try {
            List<String> themes = vectorize(text, LanguageProfile.of(language), topN);
            if (!themes.isEmpty()) return themes;
            log.debug("no term reached count {}, using frequency fallback", MIN_TERM_COUNT);
        } catch (RuntimeException e) {
            log.debug("vectorisation failed, using frequency fallback: {}", e.getMessage());
        }
        return frequencyFallback(text, topN);
    }

    public BatchResult extractBatch(List<String> texts, List<LanguageLabel> languages) {
        if (texts.size() != languages.size()) {
            throw new IllegalArgumentException("texts and languages differ in size");
        }
        if (texts.isEmpty()) return new BatchResult(List.of(), Map.of());

        List<List<String>> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) out.add(extractOne(texts.get(i), languages.get(i), topN));

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("method", "term-frequency");
        info.put("n_texts", texts.size());
        return new BatchResult(out, info);
    }

    /**
     * Counts, per (theme, language), how many texts carry the theme, highest first.
     * Equal counts keep first-seen order.
     */
    public List<GlobalTheme> globalThemes(List<String> texts, List<LanguageLabel> languages, int limit) {
        BatchResult batch = extractBatch(texts, languages);
        Map<Map.Entry<String, LanguageLabel>, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < batch.themes().size(); i++) {
            LanguageLabel lang = languages.get(i) == null ? LanguageLabel.FR : languages.get(i);
            for (String theme : batch.themes().get(i)) {
                counts.merge(Map.entry(theme, lang), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<Map.Entry<String, LanguageLabel>, Integer>comparingByValue().reversed())
                .limit(limit)
                .map(e -> new GlobalTheme(null, e.getKey().getKey(), e.getKey().getValue(), e.getValue(),
                        List.of(e.getKey().getKey())))
                .toList();
    }

    static List<String> tokenize(String text, Set<String> stopWords) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String t = m.group();
            if (!stopWords.contains(t)) tokens.add(t);
        }
        return tokens;
    }

    /** Terms ranked by count, ties in alphabetical order. */
    static List<String> vectorize(String text, LanguageProfile profile, int topN) {
        List<String> tokens = tokenize(text, profile.stopWords());
        Map<String, Integer> counts = new TreeMap<>();
        for (int n = profile.minN(); n <= profile.maxN(); n++) {
            for (int i = 0; i + n <= tokens.size(); i++) {
                counts.merge(String.join(" ", tokens.subList(i, i + n)), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .filter(e -> e.getValue() >= MIN_TERM_COUNT)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(topN)
                .map(Map.Entry::getKey)
                .toList();
    }

    static List<String> frequencyFallback(String text, int topN) {
        Map<String, Integer> freq = new LinkedHashMap<>();
        for (String raw : text.toLowerCase(Locale.ROOT).split("\\s+")) {
            String w = EDGE_PUNCT.matcher(raw).replaceAll("");
            if (w.length() <= 3 || UNIVERSAL_STOP_WORDS.contains(w)) continue;
            freq.merge(w, 1, Integer::sum);
        }
        return freq.entrySet().stream()
                .sorted(Comparator.comparing(Map.Entry<String, Integer>::getValue).reversed())
                .limit(topN)
                .map(Map.Entry::getKey)
                .toList();
    }
}
