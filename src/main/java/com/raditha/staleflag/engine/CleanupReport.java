package com.raditha.staleflag.engine;

import com.raditha.staleflag.model.FlagSpec;
import com.raditha.staleflag.model.UnitResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of cleaning one flag out of a set of units.
 *
 * @param flag                   the flag that was cleaned
 * @param startedAt              when the run started
 * @param elapsed                wall time of the run
 * @param units                  per-unit results in input order
 * @param deletedConstants       keys of the shared constants that were deleted
 * @param initialReferenceCounts project-wide constant reference counts before rewriting
 */
public record CleanupReport(
        FlagSpec flag,
        Instant startedAt,
        Duration elapsed,
        List<UnitResult> units,
        List<String> deletedConstants,
        Map<String, Integer> initialReferenceCounts) {

    public CleanupReport {
        units = List.copyOf(units);
        deletedConstants = List.copyOf(deletedConstants);
        initialReferenceCounts = Map.copyOf(initialReferenceCounts);
    }

    public int totalMatches() {
        return units.stream().mapToInt(UnitResult::matchCount).sum();
    }

    public int totalRewritten() {
        return units.stream().mapToInt(UnitResult::rewrittenCount).sum();
    }

    public List<UnitResult> changedUnits() {
        return units.stream().filter(UnitResult::isChanged).toList();
    }

    public List<UnitResult> skippedUnits() {
        return units.stream().filter(UnitResult::isSkipped).toList();
    }

    public boolean hasErrors() {
        return units.stream().anyMatch(u -> !u.errors().isEmpty() || !u.unsupported().isEmpty());
    }

    /**
     * Result for a unit by name, or null.
     */
    public UnitResult unit(String name) {
        return units.stream().filter(u -> u.unitName().equals(name)).findFirst().orElse(null);
    }
}
