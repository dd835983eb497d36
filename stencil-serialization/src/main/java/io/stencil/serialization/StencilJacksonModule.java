package io.stencil.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.stencil.core.context.ContextValue;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.pipeline.RenderedUnit;
import io.stencil.serialization.mixin.ErrorRecordMixin;
import io.stencil.serialization.mixin.RenderedUnitMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Stencil serialization configuration in one place.
///
/// **Custom serializer/deserializer pair**:
/// - `ContextValue` - `ContextValueSerializer` / `ContextValueDeserializer`, plain JSON
///   with no type discriminator (the JSON shape decides the variant)
///
/// **Mixins** for the report records, which Jackson otherwise binds through their canonical
/// constructors:
/// - `ErrorRecord` - drops the derived `fatal` flag, omits a null position
/// - `RenderedUnit` - omits null text and file type
///
/// `RenderReport` itself needs no configuration beyond `JavaTimeModule` for its timestamps.
///
/// @see ContextJson for the convenience factory API
public class StencilJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3409816275019246573L;

    public StencilJacksonModule() {
        super("StencilJacksonModule");

        addSerializer(ContextValue.class, new ContextValueSerializer());
        addDeserializer(ContextValue.class, new ContextValueDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(ErrorRecord.class, ErrorRecordMixin.class);
        context.setMixInAnnotations(RenderedUnit.class, RenderedUnitMixin.class);
    }
}
