package survey.model.domain;

import java.util.List;

public record CategorySummary(int count, long totalFrequency, List<ThemeRef> themes, double percentage) {
    public record ThemeRef(String name, int frequency, LanguageLabel language) {}
}
