package io.stencil.core.asset;

import java.io.IOException;

/// Handle through which modules embed binary assets in the output document.
///
/// Supplied by the container/format layer for each render invocation. The returned reference
/// is opaque to the core: modules splice it into the text as the format expects.
///
/// @implNote Implementations must be thread-safe: units of the same invocation embed
/// concurrently.
@FunctionalInterface
public interface AssetSink {

    /// Embeds an asset.
    ///
    /// @param data asset bytes, not null
    /// @param desiredName preferred file name inside the container, not null
    /// @param assetId invocation-unique id allocated by the caller, not null
    /// @return opaque reference to the embedded asset, never null
    /// @throws IOException if the asset cannot be written
    String embed(byte[] data, String desiredName, String assetId) throws IOException;

    /// Returns a sink that refuses every asset. Used when the caller supplies none.
    static AssetSink unsupported() {
        return (data, desiredName, assetId) -> {
            throw new UnsupportedOperationException(
                    "No asset sink configured; cannot embed " + desiredName);
        };
    }
}
