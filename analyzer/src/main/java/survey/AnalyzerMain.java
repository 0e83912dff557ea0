package survey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survey.model.domain.CategorySummary;
import survey.model.domain.EvaluationText;
import survey.model.domain.Insight;
import survey.model.domain.ThemeCategory;
import survey.model.repository.PersistenceException;
import survey.model.service.config.AppConfig;
import survey.model.service.ingest.JsonlEvaluationSource;
import survey.model.service.pipeline.AnalysisPipeline;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code AnalyzerMain --input evaluations.jsonl [--insights] [--themes N] [--db path]}
 */
public final class AnalyzerMain {
    private static final Logger log = LoggerFactory.getLogger(AnalyzerMain.class);

    private AnalyzerMain() {}

    public static void main(String[] args) {
        Map<String, String> m = parseArgs(args);
        if (!m.containsKey("--input") || "true".equals(m.get("--input"))) {
            System.err.println("usage: AnalyzerMain --input <file.jsonl|dir> [--insights] [--themes N] [--db path]");
            System.exit(2);
            return;
        }

        AppConfig cfg = AppConfig.load();
        if (m.containsKey("--db")) cfg = cfg.withDbPath(m.get("--db"));
        int topThemes = Integer.parseInt(m.getOrDefault("--themes", String.valueOf(cfg.categoryTopThemes)));

        try (AnalysisPipeline pipeline = AnalysisPipeline.createDefault(cfg)) {
            List<EvaluationText> rows = new JsonlEvaluationSource(Path.of(m.get("--input"))).read();
            List<EvaluationText> stored = pipeline.evaluations().saveAll(rows);
            pipeline.processBatch(stored);
            System.out.println("[Analyzer] " + pipeline.lastSummary());

            if (m.containsKey("--insights")) {
                List<Insight> insights = pipeline.insightMiner().generate();
                for (Insight i : insights) {
                    System.out.printf("[Insight] %s | %s | %s%n", i.kind(), i.title(), i.description());
                }
            }

            Map<ThemeCategory, CategorySummary> categories = pipeline.themeCategorizer().getCategorizedThemes(topThemes);
            categories.forEach((c, s) -> System.out.printf("[Themes] %-28s %5.1f%%  themes=%d  frequency=%d%n",
                    c.displayName(), s.percentage(), s.count(), s.totalFrequency()));
        } catch (PersistenceException e) {
            log.error("analysis not stored: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String v = (i + 1 < args.length && !args[i + 1].startsWith("--")) ? args[++i] : "true";
                m.put(a, v);
            }
        }
        return m;
    }
}
