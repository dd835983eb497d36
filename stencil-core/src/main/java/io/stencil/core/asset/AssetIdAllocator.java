package io.stencil.core.asset;

import java.util.concurrent.atomic.AtomicInteger;

/// Hands out asset ids that are unique within one render invocation.
///
/// One allocator is created per invocation and shared by every content unit, so two units
/// embedding images concurrently never receive the same id.
///
/// @implNote Thread-safe. Backed by an {@link AtomicInteger}.
public final class AssetIdAllocator {

    public static final String DEFAULT_PREFIX = "rId";

    private final AtomicInteger counter;

    public AssetIdAllocator() {
        this(1);
    }

    /// Creates an allocator whose first id is `firstId`.
    ///
    /// @param firstId first numeric id handed out
    public AssetIdAllocator(int firstId) {
        this.counter = new AtomicInteger(firstId);
    }

    /// Returns the next numeric id.
    public int next() {
        return counter.getAndIncrement();
    }

    /// Returns the next id with the given prefix, e.g. `rId7`.
    ///
    /// @param prefix id prefix, not null
    /// @return prefixed id, never null
    public String nextId(String prefix) {
        return prefix + next();
    }

    /// Returns the next id with {@link #DEFAULT_PREFIX}.
    public String nextId() {
        return nextId(DEFAULT_PREFIX);
    }

    /// Returns the id the next call to {@link #next()} will hand out.
    public int peek() {
        return counter.get();
    }
}
