package survey.model.service.nlp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Positive and negative entries read from {@code lexicons/<dir>/sentiment_pos.txt} and
 * {@code sentiment_neg.txt} on the classpath. Several directories can be merged into one lexicon.
 */
public final class SentimentLexicon {
    private static final Logger log = LoggerFactory.getLogger(SentimentLexicon.class);

    private final Set<String> positive;
    private final Set<String> negative;

    public SentimentLexicon(Set<String> positive, Set<String> negative) {
        this.positive = Collections.unmodifiableSet(new LinkedHashSet<>(positive));
        this.negative = Collections.unmodifiableSet(new LinkedHashSet<>(negative));
    }

    public static SentimentLexicon load(String... dirs) {
        Set<String> pos = new LinkedHashSet<>();
        Set<String> neg = new LinkedHashSet<>();
        for (String dir : dirs) {
            readEntries("lexicons/" + dir + "/sentiment_pos.txt", pos);
            readEntries("lexicons/" + dir + "/sentiment_neg.txt", neg);
        }
        log.debug("lexicon {} loaded: pos={} neg={}", String.join("+", dirs), pos.size(), neg.size());
        return new SentimentLexicon(pos, neg);
    }

    private static void readEntries(String resource, Set<String> into) {
        InputStream in = SentimentLexicon.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.warn("lexicon resource missing: {}", resource);
            return;
        }
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                String s = line.strip();
                if (s.isEmpty() || s.startsWith("#")) continue;
                into.add(s.toLowerCase(Locale.ROOT));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + resource, e);
        }
    }

    /** Number of positive entries occurring as substrings of {@code lowered}. */
    public int positiveHits(String lowered) { return hits(positive, lowered); }

    public int negativeHits(String lowered) { return hits(negative, lowered); }

    private static int hits(Set<String> entries, String lowered) {
        int n = 0;
        for (String e : entries) if (lowered.contains(e)) n++;
        return n;
    }

    public Set<String> positive() { return positive; }

    public Set<String> negative() { return negative; }
}
