package survey.model.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/** JSON column codec shared by the repositories. */
final class Json {
    private static final ObjectMapper OM = new ObjectMapper();
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    private Json() {}

    static String write(Object value) {
        try {
            return OM.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("cannot serialise " + value.getClass().getSimpleName(), e);
        }
    }

    static List<String> strings(String json) {
        if (json == null || json.isBlank()) return List.of();
        return read(json, STRINGS);
    }

    static Map<String, Object> object(String json) {
        if (json == null || json.isBlank()) return Map.of();
        return read(json, OBJECT);
    }

    static float[] floats(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return OM.readValue(json, float[].class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("bad vector column", e);
        }
    }

    private static <T> T read(String json, TypeReference<T> type) {
        try {
            return OM.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("bad JSON column: " + json, e);
        }
    }
}
