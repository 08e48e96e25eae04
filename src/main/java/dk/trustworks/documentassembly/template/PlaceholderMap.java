package dk.trustworks.documentassembly.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Replacement values keyed by placeholder name.
 *
 * <p>Keys may be given bare ({@code total_amount}) or braced ({@code {{total_amount}}}); both
 * address the template token {@code {{total_amount}}}. Keys are case-sensitive. A {@code null}
 * value renders as the empty string and Windows line endings are normalised to {@code \n}.
 */
public final class PlaceholderMap {

    private static final PlaceholderMap EMPTY = new PlaceholderMap(Map.of());

    private final Map<String, String> values;

    private PlaceholderMap(Map<String, String> values) {
        this.values = values;
    }

    public static PlaceholderMap empty() {
        return EMPTY;
    }

    public static PlaceholderMap of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            String name = normalizeKey(key);
            if (name != null) {
                normalized.put(name, normalizeValue(value));
            }
        });
        return new PlaceholderMap(Collections.unmodifiableMap(normalized));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * @return the replacement for a bare key, or {@code null} when the key is unknown
     */
    public String get(String key) {
        return values.get(key);
    }

    static String normalizeKey(String key) {
        if (key == null) {
            return null;
        }
        String name = key.trim();
        if (name.startsWith("{{") && name.endsWith("}}") && name.length() >= 4) {
            name = name.substring(2, name.length() - 2).trim();
        }
        return name.isEmpty() ? null : name;
    }

    private static String normalizeValue(Object value) {
        if (value == null) {
            return "";
        }
        return String.valueOf(value).replace("\r\n", "\n").replace('\r', '\n');
    }

    @Override
    public String toString() {
        return "PlaceholderMap" + values.keySet();
    }
}
