package survey.model.service.nlp;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Lexical markers and constructs typical of Latin-script Moroccan Darija. */
final class DarijaMarkers {

    static final List<String> MARKERS = List.of(
            "daba", "bezzaf", "mezyan", "mzyan", "dyal", "kayn", "makaynch",
            "wakha", "ach", "chno", "kifach", "fach", "wach", "smiya",
            "kheddam", "khdam", "bach", "hna", "nta", "ntina",
            "ghir", "bghit", "bgha", "machi", "yallah", "safi",
            "had chi", "dial", "rah", "ghi", "bhal", "w-", "u"
    );

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(ach|chno|kifach|fach|wach)\\b", FLAGS),
            Pattern.compile("\\b(daba|bezzaf|mezyan|mzyan)\\b", FLAGS),
            Pattern.compile("\\b(dyal|dial)\\s+\\w+", FLAGS),
            Pattern.compile("\\b(kayn|makaynch)\\b", FLAGS),
            Pattern.compile("\\b(ghir|ghi)\\s+\\w+", FLAGS),
            Pattern.compile("\\w+\\s+(dyal|dial)\\s+\\w+", FLAGS)
    );

    private static final List<Pattern> MARKER_PATTERNS = compileMarkers();

    private DarijaMarkers() {}

    /** Number of distinct markers present as whole words (a trailing '-' marks a prefix). */
    static int countMarkers(String lowered) {
        int n = 0;
        for (Pattern p : MARKER_PATTERNS) if (p.matcher(lowered).find()) n++;
        return n;
    }

    static int countPatterns(String lowered) {
        int n = 0;
        for (Pattern p : PATTERNS) if (p.matcher(lowered).find()) n++;
        return n;
    }

    private static List<Pattern> compileMarkers() {
        List<Pattern> out = new ArrayList<>(MARKERS.size());
        for (String m : MARKERS) {
            String body = Pattern.quote(m.toLowerCase(Locale.ROOT));
            String tail = m.endsWith("-") ? "" : "(?![\\p{L}\\p{N}_])";
            out.add(Pattern.compile("(?<![\\p{L}\\p{N}_])" + body + tail));
        }
        return List.copyOf(out);
    }
}
