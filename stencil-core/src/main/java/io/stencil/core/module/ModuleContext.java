package io.stencil.core.module;

import io.stencil.core.asset.AssetIdAllocator;
import io.stencil.core.asset.AssetSink;
import io.stencil.core.context.ContextValue;
import io.stencil.core.error.ErrorSink;
import io.stencil.core.render.RenderOptions;

/// Everything a module phase may need about the unit being processed and its invocation.
///
/// Created once per content unit. The context value, allocator and sink are shared by every
/// unit of the same render invocation.
///
/// @param context data snapshot of the invocation, read-only, not null
/// @param fileType file type of the unit, may be null
/// @param unitId id of the unit, may be null
/// @param options rendering policy of the invocation, not null
/// @param errors sink stamping records with this unit's id, not null
/// @param assetIds invocation-scoped asset id counter, not null
/// @param assets format-layer asset embedding handle, not null
public record ModuleContext(
        ContextValue context,
        String fileType,
        String unitId,
        RenderOptions options,
        ErrorSink errors,
        AssetIdAllocator assetIds,
        AssetSink assets) {

    public boolean strict() {
        return options.strict();
    }
}
