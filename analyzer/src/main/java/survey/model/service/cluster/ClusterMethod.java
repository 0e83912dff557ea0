package survey.model.service.cluster;

import java.util.Locale;
import java.util.Optional;

public enum ClusterMethod {
    KMEANS, DBSCAN;

    public String code() { return name().toLowerCase(Locale.ROOT); }

    public static Optional<ClusterMethod> parse(String s) {
        if (s == null) return Optional.empty();
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "kmeans", "k-means" -> Optional.of(KMEANS);
            case "dbscan" -> Optional.of(DBSCAN);
            default -> Optional.empty();
        };
    }
}
