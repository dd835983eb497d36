package io.stencil.core.pipeline;

import io.stencil.core.error.ErrorRecord;
import io.stencil.core.render.StructuralHint;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Everything one render invocation produced.
///
/// Units appear in input order regardless of the order in which they finished.
///
/// @param units per-unit results in input order, immutable, not null
/// @param errors every diagnostic collected during the invocation, immutable, not null
/// @param startedAt when the invocation started, not null
/// @param finishedAt when the last unit was collected, not null
public record RenderReport(
        List<RenderedUnit> units, List<ErrorRecord> errors, Instant startedAt, Instant finishedAt) {

    public RenderReport {
        units = List.copyOf(units);
        errors = List.copyOf(errors);
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
    }

    /// Returns the output text of every unit that has one, keyed by unit id in input order.
    ///
    /// @return ordered map, never null
    public Map<String, String> outputs() {
        Map<String, String> outputs = new LinkedHashMap<>();
        for (RenderedUnit unit : units) {
            if (unit.status().hasOutput()) {
                outputs.put(unit.id(), unit.text());
            }
        }
        return outputs;
    }

    /// Returns the structural hints of every unit that emitted at least one.
    public Map<String, List<StructuralHint>> hints() {
        Map<String, List<StructuralHint>> hints = new LinkedHashMap<>();
        for (RenderedUnit unit : units) {
            if (!unit.hints().isEmpty()) {
                hints.put(unit.id(), unit.hints());
            }
        }
        return hints;
    }

    public Optional<RenderedUnit> unit(String id) {
        return units.stream().filter(u -> u.id().equals(id)).findFirst();
    }

    /// Returns the output of one unit.
    ///
    /// @param id unit id, not null
    /// @return the text, or empty if the unit is unknown or produced no output
    public Optional<String> text(String id) {
        return unit(id).flatMap(RenderedUnit::output);
    }

    /// Returns the ids of units that produced no output, in input order.
    public List<String> abandonedUnits() {
        return units.stream().filter(u -> !u.status().hasOutput()).map(RenderedUnit::id).toList();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasFatal() {
        return errors.stream().anyMatch(ErrorRecord::isFatal);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
