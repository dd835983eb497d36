package io.stencil.core.asset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.stencil.core.context.ContextValues;
import io.stencil.core.error.ErrorCollector;
import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.Severity;
import io.stencil.core.module.ModuleContext;
import io.stencil.core.module.ModulePhase;
import io.stencil.core.render.RenderOptions;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ImageModuleTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    @Mock private AssetFetcher fetcher;

    @Mock private AssetSink sink;

    private ImageModule module;
    private ErrorCollector errors;
    private AssetIdAllocator assetIds;

    @BeforeEach
    void setUp() {
        module = new ImageModule(fetcher, "docx");
        errors = new ErrorCollector();
        assetIds = new AssetIdAllocator();
    }

    @Test
    void shouldDescribeItselfAsRenderPhaseImageModule() {
        assertThat(module.descriptor().name()).isEqualTo(ImageModule.NAME);
        assertThat(module.descriptor().tags()).containsExactly("image");
        assertThat(module.descriptor().priority()).isEqualTo(60);
        assertThat(module.descriptor().phases()).containsExactly(ModulePhase.RENDER);
        assertThat(module.descriptor().supports("docx")).isTrue();
    }

    @Nested
    class EmbedTest {

        @Test
        void shouldEmbedImageFromSourceString() throws Exception {
            // Given
            when(fetcher.fetch("https://example.com/logo.png")).thenReturn(PNG);
            when(sink.embed(PNG, "image1.png", "rId1")).thenReturn("<img rId1>");

            // When
            String result =
                    module.render(
                            "Logo: {% image logo %}!",
                            context(Map.of("logo", "https://example.com/logo.png"), false));

            // Then
            assertThat(result).isEqualTo("Logo: <img rId1>!");
            assertThat(errors.all()).isEmpty();
            assertThat(assetIds.peek()).isEqualTo(2);
        }

        @Test
        void shouldUseNameFromMapping() throws Exception {
            // Given
            Map<String, Object> chart = new LinkedHashMap<>();
            chart.put("src", "charts/q3.jpeg");
            chart.put("name", "q3-chart.jpeg");
            when(fetcher.fetch("charts/q3.jpeg")).thenReturn(PNG);
            when(sink.embed(PNG, "q3-chart.jpeg", "rId1")).thenReturn("[chart]");

            // When
            String result = module.render("{% image chart %}", context(Map.of("chart", chart), false));

            // Then
            assertThat(result).isEqualTo("[chart]");
        }

        @Test
        void shouldAllocateDistinctIdsForEveryTag() throws Exception {
            // Given
            when(fetcher.fetch(anyString())).thenReturn(PNG);
            when(sink.embed(any(), anyString(), anyString()))
                    .thenAnswer(invocation -> "<" + invocation.getArgument(2) + ">");

            // When
            String result =
                    module.render(
                            "{% image a %}{% image b %}{% image a %}",
                            context(Map.of("a", "a.gif", "b", "b.svg"), false));

            // Then
            assertThat(result).isEqualTo("<rId1><rId2><rId3>");
            verify(sink).embed(PNG, "image2.svg", "rId2");
        }

        @Test
        void shouldKeepReferenceWithDollarSignsLiteral() throws Exception {
            when(fetcher.fetch("x.png")).thenReturn(PNG);
            when(sink.embed(any(), anyString(), anyString())).thenReturn("$1\\ref");

            String result = module.render("{% image x %}", context(Map.of("x", "x.png"), false));

            assertThat(result).isEqualTo("$1\\ref");
        }
    }

    @Nested
    class FailureTest {

        @Test
        void shouldRemoveTagAndRecordWhenSourceMissingInLenientMode() throws Exception {
            String result = module.render("A{% image missing %}B", context(Map.of(), false));

            assertThat(result).isEqualTo("AB");
            assertThat(errors.all())
                    .singleElement()
                    .satisfies(
                            record -> {
                                assertThat(record.kind()).isEqualTo(ErrorKind.MODULE);
                                assertThat(record.severity()).isEqualTo(Severity.RECOVERABLE);
                                assertThat(record.position()).isEqualTo(1);
                            });
            verify(fetcher, never()).fetch(anyString());
        }

        @Test
        void shouldThrowWhenSourceMissingInStrictMode() {
            assertThatThrownBy(() -> module.render("{% image missing %}", context(Map.of(), true)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void shouldRecordFetchFailureInLenientMode() throws Exception {
            when(fetcher.fetch("gone.png")).thenThrow(new IOException("404"));

            String result = module.render("{% image x %}", context(Map.of("x", "gone.png"), false));

            assertThat(result).isEmpty();
            assertThat(errors.all())
                    .singleElement()
                    .satisfies(record -> assertThat(record.message()).contains("404"));
            verify(sink, never()).embed(any(), anyString(), eq("rId1"));
        }

        @Test
        void shouldPropagateFetchFailureInStrictMode() throws Exception {
            when(fetcher.fetch("gone.png")).thenThrow(new IOException("404"));

            assertThatThrownBy(
                            () -> module.render("{% image x %}", context(Map.of("x", "gone.png"), true)))
                    .isInstanceOf(IOException.class);
        }
    }

    @Nested
    class ValidateTest {

        @Test
        void shouldFlagTagsWithoutData() {
            assertThat(module.validate("ok {% image logo %} bad {% image %}"))
                    .singleElement()
                    .satisfies(record -> assertThat(record.position()).isEqualTo(24));
        }
    }

    @ParameterizedTest
    @CsvSource({
        "logo.PNG, .png",
        "https://cdn.example.com/a/b.jpg?size=2, .jpg",
        "https://cdn.example.com/a.dir/file, .png",
        "noextension., .png"
    })
    void shouldDeriveExtensionFromSource(String src, String expected) {
        assertThat(ImageModule.extension(src)).isEqualTo(expected);
    }

    private ModuleContext context(Map<String, ?> data, boolean strict) {
        return new ModuleContext(
                ContextValues.mapping(data),
                "docx",
                "unit-1",
                RenderOptions.DEFAULTS.withStrict(strict),
                errors,
                assetIds,
                sink);
    }
}
