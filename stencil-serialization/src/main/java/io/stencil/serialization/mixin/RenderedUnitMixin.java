package io.stencil.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin for `RenderedUnit`: aborted and cancelled units carry no `text` field, and a
/// unit without a file type carries no `fileType` field.
///
/// @see io.stencil.serialization.StencilJacksonModule
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class RenderedUnitMixin {}
