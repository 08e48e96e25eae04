package dk.trustworks.documentassembly.template;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Compiled placeholder patterns, one per placeholder key.
 *
 * <p>Safe for concurrent use. The first caller that needs a key compiles its pattern; later
 * callers get the same instance. Entries are never evicted, so the cache is bounded by the
 * number of distinct keys the templates use, not by the combinations callers send.
 */
@JBossLog
@ApplicationScoped
public class PlaceholderPatternCache {

    private final ConcurrentMap<String, Pattern> patterns = new ConcurrentHashMap<>();

    /**
     * Returns the pattern matching the literal token {@code {{key}}}.
     */
    public Pattern patternFor(String key) {
        return patterns.computeIfAbsent(key, PlaceholderPatternCache::compile);
    }

    /**
     * Returns the patterns for several keys, in the iteration order of {@code keys}.
     */
    public Map<String, Pattern> patternsFor(Collection<String> keys) {
        Map<String, Pattern> result = new LinkedHashMap<>();
        for (String key : keys) {
            result.put(key, patternFor(key));
        }
        return result;
    }

    int size() {
        return patterns.size();
    }

    private static Pattern compile(String key) {
        log.debugf("Compiling placeholder pattern for %s", key);
        return Pattern.compile(Pattern.quote("{{" + key + "}}"));
    }
}
