package io.stencil.core.pipeline;

import io.stencil.core.render.StructuralHint;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Result for a single content unit.
///
/// @param id content unit id, not null
/// @param fileType content unit file type, may be null
/// @param status outcome, not null
/// @param text output text, null unless {@link UnitStatus#hasOutput()}
/// @param hints structural hints emitted while rendering, immutable, not null
public record RenderedUnit(
        String id, String fileType, UnitStatus status, String text, List<StructuralHint> hints) {

    public RenderedUnit {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    static RenderedUnit rendered(ContentUnit unit, String text, List<StructuralHint> hints) {
        return new RenderedUnit(unit.id(), unit.fileType(), UnitStatus.RENDERED, text, hints);
    }

    static RenderedUnit passedThrough(ContentUnit unit) {
        return new RenderedUnit(
                unit.id(), unit.fileType(), UnitStatus.PASSED_THROUGH, unit.rawText(), List.of());
    }

    static RenderedUnit aborted(ContentUnit unit) {
        return new RenderedUnit(unit.id(), unit.fileType(), UnitStatus.ABORTED, null, List.of());
    }

    static RenderedUnit cancelled(ContentUnit unit) {
        return new RenderedUnit(unit.id(), unit.fileType(), UnitStatus.CANCELLED, null, List.of());
    }

    public Optional<String> output() {
        return Optional.ofNullable(text);
    }
}
