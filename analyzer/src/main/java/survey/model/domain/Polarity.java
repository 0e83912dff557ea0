package survey.model.domain;

import java.util.Locale;

public enum Polarity {
    POSITIVE, NEGATIVE, NEUTRAL;

    public String code() { return name().toLowerCase(Locale.ROOT); }

    public static Polarity fromCode(String code) {
        return code == null ? NEUTRAL : valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
