package dk.trustworks.documentassembly.exceptions;

import dk.trustworks.documentassembly.merge.model.MergeFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when every registered PDF merge strategy failed.
 * Contains one failure per attempted strategy, in the order they were tried.
 */
public class MergeStrategyExhaustedException extends DocumentAssemblyException {

    private final List<MergeFailure> failures;

    public MergeStrategyExhaustedException(List<MergeFailure> failures) {
        super(buildMessage(failures));
        this.failures = List.copyOf(failures);
    }

    public List<MergeFailure> getFailures() {
        return failures;
    }

    private static String buildMessage(List<MergeFailure> failures) {
        if (failures.isEmpty()) {
            return "Failed to merge PDF files: no merge strategy available";
        }
        return failures.stream()
                .map(MergeFailure::toString)
                .collect(Collectors.joining("; ", "Failed to merge PDF files: ", ""));
    }
}
