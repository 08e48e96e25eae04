package dk.trustworks.documentassembly.template;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes placeholders across a span of adjacent text runs.
 *
 * <p>The run texts are joined and matched as one string. Each replacement lands in the run where
 * its token starts; text before the token stays in that run, text after it stays in the run where
 * the token ends, and runs the token passes through are left empty. Keeping trailing text in its
 * own run keeps that run's formatting; when the span is exactly one token this is the same as
 * writing the value into the first run and blanking the others.
 */
final class RunSpanSubstitutor {

    private RunSpanSubstitutor() {
    }

    /**
     * @param texts    text of each run, in document order
     * @param patterns one pattern per placeholder key
     * @param values   replacement values
     * @return for each run the fragments to emit, separated by line breaks; {@code null} when no
     *         placeholder matched
     */
    static List<List<String>> substitute(List<String> texts, Map<String, Pattern> patterns, PlaceholderMap values) {
        int[] starts = new int[texts.size() + 1];
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < texts.size(); i++) {
            starts[i] = sb.length();
            sb.append(texts.get(i));
        }
        starts[texts.size()] = sb.length();
        String joined = sb.toString();
        if (joined.indexOf("{{") < 0) {
            return null;
        }

        List<Match> matches = findMatches(joined, patterns);
        if (matches.isEmpty()) {
            return null;
        }

        List<List<String>> result = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            List<String> fragments = new ArrayList<>();
            fragments.add("");
            result.add(fragments);
        }

        int position = 0;
        for (Match match : matches) {
            copyLiteral(joined, starts, position, match.start(), result);
            appendValue(result.get(runAt(starts, match.start())), values.get(match.key()));
            position = match.end();
        }
        copyLiteral(joined, starts, position, joined.length(), result);

        return result;
    }

    /**
     * All non-overlapping token occurrences, leftmost first; on equal starts the longer token wins.
     */
    private static List<Match> findMatches(String joined, Map<String, Pattern> patterns) {
        List<Match> candidates = new ArrayList<>();
        patterns.forEach((key, pattern) -> {
            Matcher matcher = pattern.matcher(joined);
            while (matcher.find()) {
                candidates.add(new Match(key, matcher.start(), matcher.end()));
            }
        });
        candidates.sort(Comparator.comparingInt(Match::start)
                .thenComparing(Comparator.comparingInt(Match::end).reversed()));

        List<Match> matches = new ArrayList<>();
        int covered = 0;
        for (Match candidate : candidates) {
            if (candidate.start() >= covered) {
                matches.add(candidate);
                covered = candidate.end();
            }
        }
        return matches;
    }

    private static int runAt(int[] starts, int offset) {
        for (int i = 0; i < starts.length - 1; i++) {
            if (offset < starts[i + 1]) {
                return i;
            }
        }
        return starts.length - 2;
    }

    private static void copyLiteral(String joined, int[] starts, int from, int to, List<List<String>> result) {
        for (int i = 0; i < result.size() && from < to; i++) {
            int begin = Math.max(from, starts[i]);
            int end = Math.min(to, starts[i + 1]);
            if (begin < end) {
                append(result.get(i), joined.substring(begin, end));
            }
        }
    }

    private static void appendValue(List<String> fragments, String value) {
        String[] lines = value.split("\n", -1);
        append(fragments, lines[0]);
        for (int i = 1; i < lines.length; i++) {
            fragments.add(lines[i]);
        }
    }

    private static void append(List<String> fragments, String text) {
        int last = fragments.size() - 1;
        fragments.set(last, fragments.get(last) + text);
    }

    private record Match(String key, int start, int end) {
    }
}
