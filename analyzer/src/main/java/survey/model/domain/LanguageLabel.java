package survey.model.domain;

import java.util.Locale;
import java.util.Optional;

public enum LanguageLabel {
    FR, AR, DARIJA;

    /** Lenient parse of a declared language code ("fr", "AR", "darija"...). */
    public static Optional<LanguageLabel> parse(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        String c = code.trim().toUpperCase(Locale.ROOT);
        return switch (c) {
            case "FR", "FRENCH", "FRANCAIS", "FRANÇAIS" -> Optional.of(FR);
            case "AR", "ARABIC", "ARABE" -> Optional.of(AR);
            case "DARIJA", "ARY", "MA" -> Optional.of(DARIJA);
            default -> Optional.empty();
        };
    }
}
