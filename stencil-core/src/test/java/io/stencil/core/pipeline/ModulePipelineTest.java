package io.stencil.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

import io.stencil.core.asset.ImageModule;
import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValues;
import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.error.Severity;
import io.stencil.core.exception.ModuleNotFoundException;
import io.stencil.core.exception.RenderAbortedException;
import io.stencil.core.module.AbstractTagModule;
import io.stencil.core.module.DefaultModuleRegistry;
import io.stencil.core.module.ModuleContext;
import io.stencil.core.module.ModuleDescriptor;
import io.stencil.core.module.ModulePhase;
import io.stencil.core.module.TemplateModule;
import io.stencil.core.render.RenderOptions;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ModulePipelineTest {

    private static final ContextValue CONTEXT =
            ContextValues.mapping(Map.of("name", "Ada", "logo", "logo.png"));

    private DefaultModuleRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        registry = new DefaultModuleRegistry();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    class PhaseOrderTest {

        @Test
        void shouldRunPhasesAroundCoreRender() {
            // Given
            registry.register(new MarkerModule("marker", 100));
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            // When
            RenderReport report =
                    pipeline.run(List.of(ContentUnit.of("body", "Hi {{name}}")), CONTEXT);

            // Then
            assertThat(report.text("body")).contains("P:Hi Ada:R:Q");
            assertThat(report.unit("body")).get().extracting(RenderedUnit::status)
                    .isEqualTo(UnitStatus.RENDERED);
            assertThat(report.errors()).isEmpty();
        }

        @Test
        void shouldRunModulesInPriorityOrder() {
            // Given
            registry.register(new SuffixModule("second", 20, "b"));
            registry.register(new SuffixModule("first", 10, "a"));
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            // When
            RenderReport report = pipeline.run(List.of(ContentUnit.of("body", "x")), CONTEXT);

            // Then
            assertThat(report.text("body")).contains("xab");
        }

        @Test
        void shouldSkipModulesForUnsupportedFileTypes() {
            registry.register(new SuffixModule("docx-only", 10, "!", "docx"));
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            RenderReport report =
                    pipeline.run(
                            List.of(
                                    new ContentUnit("word", "docx", "a"),
                                    new ContentUnit("sheet", "xlsx", "b")),
                            CONTEXT);

            assertThat(report.outputs())
                    .containsExactly(Map.entry("word", "a!"), Map.entry("sheet", "b"));
        }

        @Test
        void shouldReportUnitsInInputOrder() {
            registry.register(new SlowTagModule());
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            RenderReport report =
                    pipeline.run(
                            List.of(
                                    ContentUnit.of("first", "{% slow %}1"),
                                    ContentUnit.of("second", "2"),
                                    ContentUnit.of("third", "3")),
                            CONTEXT);

            assertThat(report.outputs().keySet()).containsExactly("first", "second", "third");
            assertThat(report.outputs().values()).containsExactly("1", "2", "3");
        }
    }

    @Nested
    class LenientFailureTest {

        @Test
        void shouldKeepPrePhaseTextWhenModuleFails() {
            // Given
            registry.register(new BoomModule());
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            // When
            RenderReport report =
                    pipeline.run(List.of(ContentUnit.of("body", "{{name}} {% boom %}")), CONTEXT);

            // Then
            assertThat(report.text("body")).contains("Ada {% boom %}");
            assertThat(report.errors())
                    .singleElement()
                    .satisfies(
                            record -> {
                                assertThat(record.kind()).isEqualTo(ErrorKind.MODULE);
                                assertThat(record.severity()).isEqualTo(Severity.RECOVERABLE);
                                assertThat(record.contentUnitId()).isEqualTo("body");
                                assertThat(record.message()).contains("boom").contains("render");
                            });
        }

        @Test
        void shouldPassThroughUnitWithSyntaxError() {
            // Given
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            // When
            RenderReport report =
                    pipeline.run(
                            List.of(
                                    ContentUnit.of("broken", "{%if name%}never closed"),
                                    ContentUnit.of("fine", "{{name}}")),
                            CONTEXT);

            // Then
            assertThat(report.unit("broken")).get().satisfies(
                    unit -> {
                        assertThat(unit.status()).isEqualTo(UnitStatus.PASSED_THROUGH);
                        assertThat(unit.text()).isEqualTo("{%if name%}never closed");
                    });
            assertThat(report.text("fine")).contains("Ada");
            assertThat(report.errors())
                    .singleElement()
                    .satisfies(
                            record -> {
                                assertThat(record.kind()).isEqualTo(ErrorKind.SYNTAX);
                                assertThat(record.severity()).isEqualTo(Severity.FATAL);
                                assertThat(record.contentUnitId()).isEqualTo("broken");
                            });
        }

        @Test
        void shouldRecordMissingPlaceholdersPerUnit() {
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            RenderReport report =
                    pipeline.run(
                            List.of(ContentUnit.of("a", "{{nope}}"), ContentUnit.of("b", "{{name}}")),
                            CONTEXT);

            assertThat(report.outputs()).containsEntry("a", "").containsEntry("b", "Ada");
            assertThat(report.errors())
                    .extracting(ErrorRecord::contentUnitId, ErrorRecord::kind)
                    .containsExactly(tuple("a", ErrorKind.RESOLUTION));
        }
    }

    @Nested
    class StrictFailureTest {

        @Test
        void shouldAbortOnlyFailingUnitWithUnitScope() {
            // Given
            registry.register(new BoomModule());
            ModulePipeline pipeline = pipeline(true, FailureScope.UNIT, null);

            // When
            RenderReport report =
                    pipeline.run(
                            List.of(ContentUnit.of("bad", "{% boom %}"), ContentUnit.of("ok", "{{name}}")),
                            CONTEXT);

            // Then
            assertThat(report.unit("bad")).get().extracting(RenderedUnit::status)
                    .isEqualTo(UnitStatus.ABORTED);
            assertThat(report.text("ok")).contains("Ada");
            assertThat(report.abandonedUnits()).containsExactly("bad");
            assertThat(report.hasFatal()).isTrue();
        }

        @Test
        void shouldAbortInvocationWithPartialReport() {
            // Given
            registry.register(new BoomModule());
            executor.shutdownNow();
            executor = Executors.newSingleThreadExecutor();
            ModulePipeline pipeline = pipeline(true, FailureScope.INVOCATION, null);

            // When
            RenderAbortedException thrown =
                    catchThrowableOfType(
                            () ->
                                    pipeline.run(
                                            List.of(
                                                    ContentUnit.of("bad", "{% boom %}"),
                                                    ContentUnit.of("later", "{{name}}")),
                                            CONTEXT),
                            RenderAbortedException.class);

            // Then
            assertThat(thrown).isNotNull();
            assertThat(thrown.getKind()).isEqualTo(ErrorKind.MODULE);
            assertThat(thrown.getFatalRecord().contentUnitId()).isEqualTo("bad");
            RenderReport partial = thrown.getReport();
            assertThat(partial.units()).extracting(RenderedUnit::id).containsExactly("bad", "later");
            assertThat(partial.unit("bad")).get().extracting(RenderedUnit::status)
                    .isEqualTo(UnitStatus.ABORTED);
            assertThat(partial.unit("later")).get().extracting(RenderedUnit::status)
                    .isEqualTo(UnitStatus.CANCELLED);
        }

        @Test
        void shouldAbortInvocationOnSyntaxErrorEvenWithUnitScope() {
            ModulePipeline pipeline = pipeline(true, FailureScope.UNIT, null);

            assertThatThrownBy(
                            () ->
                                    pipeline.run(
                                            List.of(ContentUnit.of("broken", "{%loop x%}")),
                                            CONTEXT))
                    .isInstanceOf(RenderAbortedException.class)
                    .satisfies(
                            e ->
                                    assertThat(((RenderAbortedException) e).getKind())
                                            .isEqualTo(ErrorKind.SYNTAX));
        }

        @Test
        void shouldAbortOnMissingPlaceholder() {
            ModulePipeline pipeline = pipeline(true, FailureScope.INVOCATION, null);

            assertThatThrownBy(
                            () -> pipeline.run(List.of(ContentUnit.of("a", "{{nope}}")), CONTEXT))
                    .isInstanceOf(RenderAbortedException.class)
                    .satisfies(
                            e ->
                                    assertThat(((RenderAbortedException) e).getKind())
                                            .isEqualTo(ErrorKind.RESOLUTION));
        }
    }

    @Nested
    class ConcurrencyTest {

        @Test
        void shouldRenderUnitsConcurrently() {
            // Given
            CountDownLatch bothRunning = new CountDownLatch(2);
            registry.register(new RendezvousModule(bothRunning));
            ModulePipeline pipeline = pipeline(true, FailureScope.INVOCATION, null);

            // When
            RenderReport report =
                    pipeline.run(
                            List.of(ContentUnit.of("a", "{{name}}"), ContentUnit.of("b", "{{name}}")),
                            CONTEXT);

            // Then
            assertThat(report.outputs()).containsEntry("a", "Ada").containsEntry("b", "Ada");
        }

        @Test
        void shouldAllocateUniqueAssetIdsAcrossUnits() {
            // Given
            registry.register(new ImageModule(source -> new byte[] {1}));
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            // When
            RenderReport report =
                    pipeline.run(
                            List.of(
                                    ContentUnit.of("a", "{% image logo %}"),
                                    ContentUnit.of("b", "{% image logo %}"),
                                    ContentUnit.of("c", "{% image logo %}{% image logo %}")),
                            CONTEXT,
                            (data, name, assetId) -> assetId + ";",
                            CancellationSignal.none());

            // Then
            String all = String.join("", report.outputs().values());
            assertThat(all.split(";")).containsExactlyInAnyOrder("rId1", "rId2", "rId3", "rId4");
        }

        @Test
        void shouldRejectDuplicateUnitIds() {
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            assertThatThrownBy(
                            () ->
                                    pipeline.run(
                                            List.of(ContentUnit.of("a", "1"), ContentUnit.of("a", "2")),
                                            CONTEXT))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("a");
        }
    }

    @Nested
    class CancellationTest {

        @Test
        void shouldReturnCancelledUnitsWhenSignalled() throws Exception {
            // Given
            CountDownLatch started = new CountDownLatch(1);
            registry.register(new BlockingModule(started));
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);
            CancellationSignal signal = new CancellationSignal();

            // When
            CompletableFuture<RenderReport> running =
                    CompletableFuture.supplyAsync(
                            () ->
                                    pipeline.run(
                                            List.of(ContentUnit.of("stuck", "{% block %}")),
                                            CONTEXT,
                                            (data, name, id) -> id,
                                            signal));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            signal.cancel();
            RenderReport report = running.get(5, TimeUnit.SECONDS);

            // Then
            assertThat(signal.isCancelled()).isTrue();
            assertThat(report.unit("stuck")).get().extracting(RenderedUnit::status)
                    .isEqualTo(UnitStatus.CANCELLED);
            assertThat(report.errors()).extracting(ErrorRecord::kind).contains(ErrorKind.CANCELLED);
        }

        @Test
        void shouldCancelUnitExceedingTimeout() {
            // Given
            registry.register(new BlockingModule(new CountDownLatch(1)));
            ModulePipeline pipeline =
                    pipeline(false, FailureScope.INVOCATION, Duration.ofMillis(100));

            // When
            RenderReport report =
                    pipeline.run(
                            List.of(ContentUnit.of("stuck", "{% block %}"), ContentUnit.of("ok", "{{name}}")),
                            CONTEXT);

            // Then
            assertThat(report.unit("stuck")).get().extracting(RenderedUnit::status)
                    .isEqualTo(UnitStatus.CANCELLED);
            assertThat(report.text("ok")).contains("Ada");
            assertThat(report.errors())
                    .filteredOn(record -> "stuck".equals(record.contentUnitId()))
                    .singleElement()
                    .satisfies(
                            record -> {
                                assertThat(record.kind()).isEqualTo(ErrorKind.MODULE);
                                assertThat(record.severity()).isEqualTo(Severity.FATAL);
                                assertThat(record.message()).contains("timed out");
                            });
        }
    }

    @Nested
    class ModuleApplicabilityTest {

        @Test
        void shouldRenderTagEmittedByEarlierModule() {
            // Given
            registry.register(new EmitterModule(10, "{% wrap x %}"));
            registry.register(new BracketModule("wrap", 20));
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            // When
            RenderReport report = pipeline.run(List.of(ContentUnit.of("body", "t")), CONTEXT);

            // Then
            assertThat(report.text("body")).contains("t[wrap:x]");
            assertThat(report.errors()).isEmpty();
        }

        @Test
        void shouldRenderTagProducedByPlaceholderData() {
            // Given
            registry.register(new BracketModule("wrap", 20));
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);
            ContextValue context = ContextValues.mapping(Map.of("pic", "{% wrap y %}"));

            // When
            RenderReport report =
                    pipeline.run(List.of(ContentUnit.of("body", "{{pic}}")), context);

            // Then
            assertThat(report.text("body")).contains("[wrap:y]");
        }

        @Test
        void shouldPassPercentSignsInTagData() {
            // Given
            registry.register(new BracketModule("pct", 10));
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            // When
            RenderReport report =
                    pipeline.run(List.of(ContentUnit.of("body", "w={% pct 50% %}")), CONTEXT);

            // Then
            assertThat(report.text("body")).contains("w=[pct:50%]");
            assertThat(report.errors()).isEmpty();
        }
    }

    @Nested
    class RunModuleTest {

        @Test
        void shouldRunSingleModuleWithoutCoreRender() throws Exception {
            // Given
            registry.register(new ShoutModule());
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            // When
            RenderReport report =
                    pipeline.runModule(
                            "shout",
                            ContentUnit.of("body", "{{name}} {% shout hi %}"),
                            CONTEXT,
                            (data, name, id) -> id);

            // Then
            assertThat(report.text("body")).contains("{{name}} HI");
        }

        @Test
        void shouldThrowForUnknownModule() {
            ModulePipeline pipeline = pipeline(false, FailureScope.INVOCATION, null);

            assertThatThrownBy(
                            () ->
                                    pipeline.runModule(
                                            "missing",
                                            ContentUnit.of("body", "x"),
                                            CONTEXT,
                                            (data, name, id) -> id))
                    .isInstanceOf(ModuleNotFoundException.class);
        }
    }

    private ModulePipeline pipeline(boolean strict, FailureScope scope, Duration timeout) {
        return new ModulePipeline(
                registry, executor, RenderOptions.DEFAULTS.withStrict(strict), scope, timeout);
    }

    private static final class MarkerModule implements TemplateModule {
        private final ModuleDescriptor descriptor;

        MarkerModule(String name, int priority) {
            this.descriptor = ModuleDescriptor.builder(name).priority(priority).build();
        }

        @Override
        public ModuleDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public String preparse(String text, ModuleContext context) {
            return "P:" + text;
        }

        @Override
        public String render(String text, ModuleContext context) {
            return text + ":R";
        }

        @Override
        public String postrender(String text, ModuleContext context) {
            return text + ":Q";
        }
    }

    private static final class SuffixModule implements TemplateModule {
        private final ModuleDescriptor descriptor;
        private final String suffix;

        SuffixModule(String name, int priority, String suffix, String... fileTypes) {
            this.descriptor =
                    ModuleDescriptor.builder(name)
                            .priority(priority)
                            .supportedFileTypes(fileTypes)
                            .phases(ModulePhase.POSTRENDER)
                            .build();
            this.suffix = suffix;
        }

        @Override
        public ModuleDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public String postrender(String text, ModuleContext context) {
            return text + suffix;
        }
    }

    private static final class BoomModule extends AbstractTagModule {
        BoomModule() {
            super(ModuleDescriptor.builder("boom").tags("boom").phases(ModulePhase.RENDER).build());
        }

        @Override
        protected String renderTag(String tag, String data, int position, ModuleContext context) {
            throw new IllegalStateException("boom failed");
        }
    }

    private static final class ShoutModule extends AbstractTagModule {
        ShoutModule() {
            super(ModuleDescriptor.builder("shout").tags("shout").build());
        }

        @Override
        protected String renderTag(String tag, String data, int position, ModuleContext context) {
            return data.toUpperCase(Locale.ROOT);
        }
    }

    private static final class EmitterModule implements TemplateModule {
        private final ModuleDescriptor descriptor;
        private final String emitted;

        EmitterModule(int priority, String emitted) {
            this.descriptor =
                    ModuleDescriptor.builder("emitter")
                            .priority(priority)
                            .phases(ModulePhase.RENDER)
                            .build();
            this.emitted = emitted;
        }

        @Override
        public ModuleDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public String render(String text, ModuleContext context) {
            return text + emitted;
        }
    }

    private static final class BracketModule extends AbstractTagModule {
        BracketModule(String tag, int priority) {
            super(
                    ModuleDescriptor.builder(tag)
                            .tags(tag)
                            .priority(priority)
                            .phases(ModulePhase.RENDER)
                            .build());
        }

        @Override
        protected String renderTag(String tag, String data, int position, ModuleContext context) {
            return "[" + tag + ":" + data + "]";
        }
    }

    private static final class SlowTagModule extends AbstractTagModule {
        SlowTagModule() {
            super(ModuleDescriptor.builder("slow").tags("slow").phases(ModulePhase.RENDER).build());
        }

        @Override
        protected String renderTag(String tag, String data, int position, ModuleContext context)
                throws InterruptedException {
            Thread.sleep(100);
            return "";
        }
    }

    private static final class BlockingModule extends AbstractTagModule {
        private final CountDownLatch started;

        BlockingModule(CountDownLatch started) {
            super(ModuleDescriptor.builder("block").tags("block").phases(ModulePhase.RENDER).build());
            this.started = started;
        }

        @Override
        protected String renderTag(String tag, String data, int position, ModuleContext context)
                throws InterruptedException {
            started.countDown();
            new CountDownLatch(1).await(30, TimeUnit.SECONDS);
            return "finished";
        }
    }

    private static final class RendezvousModule implements TemplateModule {
        private final CountDownLatch latch;

        RendezvousModule(CountDownLatch latch) {
            this.latch = latch;
        }

        @Override
        public ModuleDescriptor descriptor() {
            return ModuleDescriptor.builder("rendezvous").phases(ModulePhase.PREPARSE).build();
        }

        @Override
        public String preparse(String text, ModuleContext context) throws InterruptedException {
            latch.countDown();
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("units did not run concurrently");
            }
            return text;
        }
    }
}
