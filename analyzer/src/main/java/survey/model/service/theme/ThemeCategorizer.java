package survey.model.service.theme;

import survey.model.domain.CategorySummary;
import survey.model.domain.GlobalTheme;
import survey.model.domain.LanguageLabel;
import survey.model.domain.ThemeCategory;
import survey.model.repository.ThemesRepo;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Buckets global themes into the four {@link ThemeCategory} values by keyword overlap.
 * Themes matching no keyword land in {@link ThemeCategory#FORMATION_QUALITY}.
 */
public class ThemeCategorizer {

    private static final Map<ThemeCategory, Map<LanguageLabel, List<String>>> KEYWORDS = new EnumMap<>(ThemeCategory.class);

    static {
        KEYWORDS.put(ThemeCategory.FORMATION_QUALITY, Map.of(
                LanguageLabel.FR, List.of("formation", "contenu", "qualité", "niveau", "profondeur", "structuré",
                        "organisé", "excellent", "bon", "mauvais", "nul", "obsolète", "périmé", "nouveau", "clair",
                        "théorique", "pratique", "exemples", "exercices", "cas"),
                LanguageLabel.AR, List.of("تدريب", "محتوى", "المحتوى", "جودة", "ممتاز", "جيد", "سيء", "قديم",
                        "جداً", "واضح", "مفيد", "نظري", "عملي", "أمثلة"),
                LanguageLabel.DARIJA, List.of("formation", "contenu", "niveau", "mezyana", "mzyana", "khayba", "top",
                        "zina", "practique", "exemples")));
        KEYWORDS.put(ThemeCategory.TRAINER_COMPETENCE, Map.of(
                LanguageLabel.FR, List.of("formateur", "instructeur", "prof", "enseignant", "compétent",
                        "incompétent", "préparé", "professionnel", "dynamique", "passionné", "engageant",
                        "monotone", "maîtrise", "expert", "expérience", "pédagogique", "communication"),
                LanguageLabel.AR, List.of("مدرب", "المدرب", "معلم", "محترف", "مؤهل", "خبرة", "شرح", "يشرح",
                        "تفسير", "مستعد", "جاهز"),
                LanguageLabel.DARIJA, List.of("formateur", "prof", "instructor", "maalem", "professionnel", "kamel",
                        "ma3arafch", "khatar")));
        KEYWORDS.put(ThemeCategory.LOGISTICS_ORGANIZATION, Map.of(
                LanguageLabel.FR, List.of("logistique", "organisation", "organisé", "salle", "équipement",
                        "matériel", "supports", "horaire", "temps", "durée", "pause", "accueil", "réservation",
                        "planification", "coordination", "infrastructure"),
                LanguageLabel.AR, List.of("تنظيم", "قاعة", "القاعة", "مكان", "وقت", "الوقت", "ساعات", "مدة",
                        "مرافق", "معدات", "صوت"),
                LanguageLabel.DARIJA, List.of("organisation", "qa3a", "blassa", "waqt", "lwaqt", "ma9an")));
        KEYWORDS.put(ThemeCategory.APPLICABILITY_USEFULNESS, Map.of(
                LanguageLabel.FR, List.of("applicable", "applicabilité", "utile", "pratique", "concret", "réaliste",
                        "pertinent", "efficace", "recommande", "valeur", "bénéfice", "impact", "résultat",
                        "amélioration", "compétences", "apprises", "acquérir"),
                LanguageLabel.AR, List.of("تطبيق", "التطبيق", "عملي", "مفيد", "فائدة", "نتيجة", "تحسين", "مهارات",
                        "استفدت", "استفادة", "واقعي"),
                LanguageLabel.DARIJA, List.of("practique", "fayda", "nafed", "ستفدت", "3jbni", "mazyan", "t3allemt",
                        "استفدت")));
    }

    private final ThemesRepo themes;

    public ThemeCategorizer(ThemesRepo themes) { this.themes = themes; }

    /** First category, in declaration order, with a keyword contained in the theme or containing it. */
    public static ThemeCategory categorize(String themeName, LanguageLabel language) {
        String theme = themeName.toLowerCase(Locale.ROOT);
        LanguageLabel lang = language == null ? LanguageLabel.FR : language;
        for (ThemeCategory category : ThemeCategory.values()) {
            for (String keyword : KEYWORDS.get(category).getOrDefault(lang, List.of())) {
                if (theme.contains(keyword) || keyword.contains(theme)) return category;
            }
        }
        return ThemeCategory.FORMATION_QUALITY;
    }

    /** Categorises the {@code topN} most frequent global themes. */
    public Map<ThemeCategory, CategorySummary> getCategorizedThemes(int topN) {
        return summarize(themes.top(topN));
    }

    static Map<ThemeCategory, CategorySummary> summarize(List<GlobalTheme> population) {
        Map<ThemeCategory, List<CategorySummary.ThemeRef>> grouped = new EnumMap<>(ThemeCategory.class);
        for (ThemeCategory c : ThemeCategory.values()) grouped.put(c, new ArrayList<>());
        for (GlobalTheme t : population) {
            grouped.get(categorize(t.name(), t.language()))
                    .add(new CategorySummary.ThemeRef(t.name(), t.frequency(), t.language()));
        }

        Map<ThemeCategory, Long> totals = new EnumMap<>(ThemeCategory.class);
        grouped.forEach((c, refs) -> totals.put(c, refs.stream().mapToLong(CategorySummary.ThemeRef::frequency).sum()));
        Map<ThemeCategory, Long> tenths = shareInTenths(totals);

        Map<ThemeCategory, CategorySummary> out = new LinkedHashMap<>();
        for (var e : grouped.entrySet()) {
            out.put(e.getKey(), new CategorySummary(e.getValue().size(), totals.get(e.getKey()),
                    List.copyOf(e.getValue()), tenths.get(e.getKey()) / 10.0));
        }
        return out;
    }

    /**
     * Largest-remainder apportionment of 1000 tenths of a percent, so the shares add up to exactly 100.0.
     * Equal remainders go to the earlier category.
     */
    static Map<ThemeCategory, Long> shareInTenths(Map<ThemeCategory, Long> totals) {
        long grandTotal = totals.values().stream().mapToLong(Long::longValue).sum();
        Map<ThemeCategory, Long> tenths = new EnumMap<>(ThemeCategory.class);
        if (grandTotal <= 0) {
            totals.keySet().forEach(c -> tenths.put(c, 0L));
            return tenths;
        }
        Map<ThemeCategory, Long> remainders = new EnumMap<>(ThemeCategory.class);
        long assigned = 0;
        for (var e : totals.entrySet()) {
            long scaled = e.getValue() * 1000L;
            tenths.put(e.getKey(), scaled / grandTotal);
            remainders.put(e.getKey(), scaled % grandTotal);
            assigned += scaled / grandTotal;
        }
        List<ThemeCategory> byRemainder = new ArrayList<>(remainders.keySet());
        byRemainder.sort((a, b) -> Long.compare(remainders.get(b), remainders.get(a)));
        for (int i = 0; i < 1000L - assigned; i++) {
            tenths.merge(byRemainder.get(i), 1L, Long::sum);
        }
        return tenths;
    }
}
