package io.stencil.core.asset;

import io.stencil.core.context.ContextResolver;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValue.Mapping;
import io.stencil.core.context.ContextValue.Scalar;
import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.module.AbstractTagModule;
import io.stencil.core.module.ModuleContext;
import io.stencil.core.module.ModuleDescriptor;
import io.stencil.core.module.ModulePhase;
import io.stencil.core.module.ModuleTags;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/// Replaces `{% image path %}` tags with references to embedded images.
///
/// The path resolves either to a source string, or to a mapping with a `src` entry and an
/// optional `name` entry. The bytes come from the {@link AssetFetcher}; the module allocates
/// an id from the invocation's {@link AssetIdAllocator}, hands everything to the
/// {@link AssetSink}, and splices the returned reference into the text.
///
/// In lenient mode an unresolvable path or a failed fetch removes the tag and records a
/// RECOVERABLE MODULE error. In strict mode both abort through the pipeline.
///
/// ### Contracts
/// - **Invariant**: ids are never reused within one invocation, even across units
///   rendered concurrently
///
/// @implNote Thread-safe. The module holds no per-invocation state.
public class ImageModule extends AbstractTagModule {

    private static final Logger logger = Logger.getLogger(ImageModule.class.getName());

    public static final String NAME = "image";
    public static final int PRIORITY = 60;
    static final String DEFAULT_EXTENSION = ".png";

    private final AssetFetcher fetcher;

    public ImageModule(AssetFetcher fetcher) {
        this(fetcher, new String[0]);
    }

    /// Creates a module restricted to the given file types.
    ///
    /// @param fetcher source of image bytes, not null
    /// @param supportedFileTypes file types to process; none means every type
    public ImageModule(AssetFetcher fetcher, String... supportedFileTypes) {
        super(
                ModuleDescriptor.builder(NAME)
                        .tags(NAME)
                        .supportedFileTypes(supportedFileTypes)
                        .priority(PRIORITY)
                        .phases(ModulePhase.RENDER)
                        .build());
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
    }

    @Override
    protected String renderTag(String tag, String data, int position, ModuleContext context)
            throws Exception {
        Optional<ImageSource> source = resolveSource(data, context.context());
        if (source.isEmpty()) {
            String message = "Image module: no image source for '" + data + "'";
            if (context.strict()) {
                throw new IllegalArgumentException(message);
            }
            context.errors().add(ErrorRecord.recoverable(ErrorKind.MODULE, message, null, position));
            return "";
        }

        ImageSource image = source.get();
        byte[] bytes;
        try {
            bytes = fetcher.fetch(image.src());
        } catch (IOException e) {
            if (context.strict()) {
                throw e;
            }
            logger.warning("Failed to fetch image " + image.src() + ": " + e.getMessage());
            context.errors()
                    .add(
                            ErrorRecord.recoverable(
                                    ErrorKind.MODULE,
                                    "Image module: failed to fetch '" + image.src() + "': " + e.getMessage(),
                                    null,
                                    position));
            return "";
        }

        int id = context.assetIds().next();
        String assetId = AssetIdAllocator.DEFAULT_PREFIX + id;
        String desiredName = image.name() != null ? image.name() : "image" + id + extension(image.src());
        String reference = context.assets().embed(bytes, desiredName, assetId);
        logger.fine("Embedded image " + desiredName + " as " + assetId + " in unit " + context.unitId());
        return reference;
    }

    /// Reports image tags without data.
    @Override
    public List<ErrorRecord> validate(String text) {
        List<ErrorRecord> records = new ArrayList<>();
        Matcher matcher = ModuleTags.pattern(NAME).matcher(text);
        while (matcher.find()) {
            if (matcher.group(1) == null || matcher.group(1).isBlank()) {
                records.add(
                        ErrorRecord.recoverable(
                                ErrorKind.MODULE,
                                "Image tag without a data path",
                                null,
                                matcher.start()));
            }
        }
        return records;
    }

    static Optional<ImageSource> resolveSource(String path, ContextValue context) {
        if (path.isEmpty()) {
            return Optional.empty();
        }
        Optional<ContextValue> value = ContextResolver.resolve(context, path);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.get() instanceof Scalar scalar && scalar.isString() && !scalar.isEmpty()) {
            return Optional.of(new ImageSource(scalar.asText(), null));
        }
        if (value.get() instanceof Mapping mapping) {
            Optional<String> src = text(mapping, "src");
            if (src.isPresent()) {
                return Optional.of(new ImageSource(src.get(), text(mapping, "name").orElse(null)));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> text(Mapping mapping, String key) {
        return mapping.get(key)
                .filter(v -> v instanceof Scalar scalar && scalar.isString() && !scalar.isEmpty())
                .map(v -> ((Scalar) v).asText());
    }

    static String extension(String src) {
        int query = src.indexOf('?');
        String path = query >= 0 ? src.substring(0, query) : src;
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot > slash && dot < path.length() - 1) {
            return path.substring(dot).toLowerCase(Locale.ROOT);
        }
        return DEFAULT_EXTENSION;
    }

    record ImageSource(String src, String name) {}
}
