package com.raditha.staleflag.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of cleaning one unit.
 *
 * @param unitName        unit name
 * @param path            originating file, may be null
 * @param originalSource  text before the run
 * @param rewrittenSource text after the run; equals the original when nothing changed
 * @param edits           non-overlapping edits turning the original into the rewritten text
 * @param matchCount      number of flag-query sites found
 * @param rewrittenCount  number of sites actually rewritten
 * @param unsupported     sites or nodes left untouched, with the reason
 * @param errors          unit-level errors (these skip the unit)
 */
public record UnitResult(
        String unitName,
        Path path,
        String originalSource,
        String rewrittenSource,
        List<Edit> edits,
        int matchCount,
        int rewrittenCount,
        List<CleanupError> unsupported,
        List<CleanupError> errors) {

    public UnitResult {
        edits = List.copyOf(edits);
        unsupported = List.copyOf(unsupported);
        errors = List.copyOf(errors);
    }

    public boolean isChanged() {
        return !edits.isEmpty();
    }

    public boolean isSkipped() {
        return errors.stream().anyMatch(e -> e.kind().skipsUnit());
    }
}
