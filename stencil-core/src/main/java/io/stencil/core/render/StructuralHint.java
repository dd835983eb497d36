package io.stencil.core.render;

/// A request for the format layer to change markup structure the core does not understand.
///
/// @param kind what to do, not null
/// @param position offset of the originating tag in the template text
/// @param path context path of the originating tag, not null
public record StructuralHint(HintKind kind, int position, String path) {

    public static StructuralHint removeEnclosingBlock(int position, String path) {
        return new StructuralHint(HintKind.REMOVE_ENCLOSING_BLOCK, position, path);
    }
}
