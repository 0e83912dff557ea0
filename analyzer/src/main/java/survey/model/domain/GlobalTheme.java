package survey.model.domain;

import java.util.List;

public record GlobalTheme(Long id, String name, LanguageLabel language, int frequency, List<String> keywords) {}
