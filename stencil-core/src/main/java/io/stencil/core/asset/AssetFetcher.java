package io.stencil.core.asset;

import java.io.IOException;

/// Loads asset bytes from a source location such as a URL or a file path.
@FunctionalInterface
public interface AssetFetcher {

    /// Fetches the bytes behind a source.
    ///
    /// @param source location, not null
    /// @return the bytes, never null
    /// @throws IOException if the source cannot be read
    byte[] fetch(String source) throws IOException;
}
