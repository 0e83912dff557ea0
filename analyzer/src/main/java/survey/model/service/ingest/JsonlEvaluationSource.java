package survey.model.service.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survey.model.domain.EvaluationText;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Reads evaluations from a {@code .jsonl} file, or from every {@code .jsonl} file under a directory.
 * Both the French column names of the survey export ({@code commentaire}, {@code formateur_id}...)
 * and their English forms are accepted. Lines that are not JSON objects are skipped and counted.
 */
public class JsonlEvaluationSource {
    private static final Logger log = LoggerFactory.getLogger(JsonlEvaluationSource.class);

    private final Path root;
    private final ObjectMapper mapper = new ObjectMapper();

    public JsonlEvaluationSource(Path root) {
        this.root = root;
    }

    public List<EvaluationText> read() {
        if (root == null || !Files.exists(root)) {
            throw new IllegalArgumentException("input not found: " + root);
        }
        List<Path> files;
        if (Files.isDirectory(root)) {
            try (Stream<Path> walk = Files.walk(root)) {
                files = walk.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".jsonl"))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("cannot list " + root, e);
            }
        } else {
            files = List.of(root);
        }

        List<EvaluationText> out = new ArrayList<>();
        for (Path f : files) out.addAll(readFile(f));
        log.info("read {} evaluations from {} file(s) under {}", out.size(), files.size(), root.toAbsolutePath());
        return out;
    }

    private List<EvaluationText> readFile(Path file) {
        List<EvaluationText> out = new ArrayList<>();
        int lines = 0;
        int skipped = 0;
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                if (line.isBlank()) continue;
                lines++;
                Optional<EvaluationText> e = parse(line, file.getFileName().toString());
                if (e.isPresent()) out.add(e.get());
                else skipped++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + file, e);
        }
        if (skipped > 0) log.warn("{}: skipped {} of {} lines", file.getFileName(), skipped, lines);
        return out;
    }

    Optional<EvaluationText> parse(String line, String sourceFile) {
        JsonNode n;
        try {
            n = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("unparseable line: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (n == null || !n.isObject()) return Optional.empty();

        return Optional.of(new EvaluationText(
                null,
                text(n, "evaluation_id", "evaluationId", "id"),
                text(n, "formation_id", "formationId"),
                text(n, "type_formation", "formation_type", "formationType"),
                text(n, "formateur_id", "trainer_id", "trainerId"),
                rating(n, "satisfaction"),
                rating(n, "contenu", "content"),
                rating(n, "logistique", "logistics"),
                rating(n, "applicabilite", "applicability"),
                text(n, "commentaire", "comment", "text"),
                text(n, "langue", "language", "lang"),
                parseInstant(text(n, "date", "createdAt")).orElse(null),
                sourceFile));
    }

    private static String text(JsonNode n, String... fields) {
        for (String f : fields) {
            JsonNode v = n.get(f);
            if (v != null && !v.isNull()) {
                String s = v.asText();
                if (!s.isBlank()) return s;
            }
        }
        return null;
    }

    /** 1..5, anything else is treated as missing. */
    private static Integer rating(JsonNode n, String... fields) {
        String s = text(n, fields);
        if (s == null) return null;
        try {
            int v = (int) Math.round(Double.parseDouble(s.trim()));
            return v >= 1 && v <= 5 ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"));

    /** Epoch millis/seconds, ISO instants, a few local date-time layouts (UTC) or a plain date. */
    static Optional<Instant> parseInstant(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        String x = s.trim();

        if (x.matches("^\\d{13}$")) return Optional.of(Instant.ofEpochMilli(Long.parseLong(x)));
        if (x.matches("^\\d{10}$")) return Optional.of(Instant.ofEpochSecond(Long.parseLong(x)));

        Optional<Instant> iso = attempt(() -> Instant.parse(x));
        if (iso.isPresent()) return iso;
        for (DateTimeFormatter fmt : LOCAL_FORMATS) {
            Optional<Instant> t = attempt(() -> LocalDateTime.parse(x, fmt).toInstant(ZoneOffset.UTC));
            if (t.isPresent()) return t;
        }
        return attempt(() -> LocalDate.parse(x).atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
