package survey.model.domain;

public enum ThemeCategory {
    FORMATION_QUALITY("Formation Quality"),
    TRAINER_COMPETENCE("Trainer Competence"),
    LOGISTICS_ORGANIZATION("Logistics & Organization"),
    APPLICABILITY_USEFULNESS("Applicability & Usefulness");

    private final String displayName;

    ThemeCategory(String displayName) { this.displayName = displayName; }

    public String displayName() { return displayName; }
}
