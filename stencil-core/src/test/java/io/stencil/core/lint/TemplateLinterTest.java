package io.stencil.core.lint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.stencil.core.context.ContextValue;
import io.stencil.core.context.ContextValues;
import io.stencil.core.error.ErrorKind;
import io.stencil.core.error.ErrorRecord;
import io.stencil.core.error.Severity;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TemplateLinterTest {

    private static final ContextValue CONTEXT =
            ContextValues.mapping(
                    Map.of(
                            "name", "Ada",
                            "items", List.of(Map.of("title", "one")),
                            "logo", "logo.png"));

    private final TemplateLinter linter = new TemplateLinter();

    @Test
    void shouldReportNothingForValidTemplate() {
        List<ErrorRecord> records =
                linter.lint(
                        "{{name}}{%loop x in items%}{{x.title}}{{$index}}{%endloop%}"
                                + "{%if name%}{{?missing}}{@ raw }{%endif%}{% image logo %}",
                        CONTEXT);

        assertThat(records).isEmpty();
    }

    @Nested
    class SyntaxTest {

        @Test
        void shouldReportUnclosedTag() {
            List<ErrorRecord> records = linter.lint("Hi {{ name", CONTEXT);

            assertThat(records)
                    .extracting(ErrorRecord::kind, ErrorRecord::severity, ErrorRecord::position)
                    .containsExactly(tuple(ErrorKind.SYNTAX, Severity.FATAL, 3));
        }

        @Test
        void shouldReportUnbalancedBlockAndStop() {
            List<ErrorRecord> records = linter.lint("{{missing}}{%loop x in items%}", CONTEXT);

            assertThat(records)
                    .singleElement()
                    .satisfies(
                            record -> {
                                assertThat(record.kind()).isEqualTo(ErrorKind.SYNTAX);
                                assertThat(record.isFatal()).isTrue();
                            });
        }
    }

    @Nested
    class DataTest {

        @Test
        void shouldReportMissingPlaceholderWithPosition() {
            List<ErrorRecord> records = linter.lint("Dear {{user.name}},", CONTEXT);

            assertThat(records)
                    .extracting(ErrorRecord::kind, ErrorRecord::severity, ErrorRecord::position)
                    .containsExactly(tuple(ErrorKind.RESOLUTION, Severity.RECOVERABLE, 5));
        }

        @Test
        void shouldReportLoopOverMissingOrScalarValue() {
            List<ErrorRecord> records =
                    linter.lint(
                            "{%loop x in nope%}{%endloop%}{%loop y in name%}{%endloop%}", CONTEXT);

            assertThat(records)
                    .extracting(ErrorRecord::kind, ErrorRecord::position)
                    .containsExactly(tuple(ErrorKind.TYPE, 0), tuple(ErrorKind.TYPE, 29));
        }

        @Test
        void shouldNotCheckPathsBoundByLoopVariable() {
            List<ErrorRecord> records =
                    linter.lint(
                            "{%loop x in items%}{%loop y in x.children%}{{y}}{%endloop%}{%endloop%}",
                            CONTEXT);

            assertThat(records).isEmpty();
        }

        @Test
        void shouldReportModuleTagWithMissingData() {
            List<ErrorRecord> records = linter.lint("{% image banner %}", CONTEXT);

            assertThat(records)
                    .extracting(ErrorRecord::kind)
                    .containsExactly(ErrorKind.MODULE);
        }

        @Test
        void shouldIgnoreModuleTagWithFreeFormData() {
            assertThat(linter.lint("{% toc levels 1 to 3 %}", CONTEXT)).isEmpty();
        }

        @Test
        void shouldCheckBothConditionalBranches() {
            List<ErrorRecord> records =
                    linter.lint("{%if name%}{{a}}{%else%}{{b}}{%endif%}", CONTEXT);

            assertThat(records).extracting(ErrorRecord::kind)
                    .containsExactly(ErrorKind.RESOLUTION, ErrorKind.RESOLUTION);
        }
    }
}
