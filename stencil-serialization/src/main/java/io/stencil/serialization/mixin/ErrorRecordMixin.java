package io.stencil.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin for `ErrorRecord`.
///
/// Drops the derived `fatal` flag (it duplicates `severity`) and omits a null `position`,
/// so invocation-level records serialize without a location.
///
/// @see io.stencil.serialization.StencilJacksonModule
@JsonIgnoreProperties(value = {"fatal"}, ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class ErrorRecordMixin {}
