package io.stencil.core.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stencil.core.error.ErrorKind;
import io.stencil.core.exception.TemplateSyntaxException;
import io.stencil.core.token.Tokenizer;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TreeBuilderTest {

    private final Tokenizer tokenizer = new Tokenizer();
    private final TreeBuilder builder = new TreeBuilder();

    @Nested
    class StructureTest {

        @Test
        void shouldNestLoopsInsideLoops() {
            List<AstNode> nodes =
                    build("{%loop a in b%}{%loop c in a%}{{c}}{%endloop%}{%endloop%}");

            assertThat(nodes).hasSize(1);
            LoopNode outer = (LoopNode) nodes.get(0);
            assertThat(outer.variable()).isEqualTo("a");
            assertThat(outer.collectionPath()).isEqualTo("b");
            assertThat(outer.body()).hasSize(1);

            LoopNode inner = (LoopNode) outer.body().get(0);
            assertThat(inner.variable()).isEqualTo("c");
            assertThat(inner.body()).singleElement().isInstanceOf(PlaceholderNode.class);
        }

        @Test
        void shouldSplitConditionalIntoThenAndElseBodies() {
            List<AstNode> nodes = build("{%if ok%}yes{{x}}{%else%}no{%endif%}");

            ConditionalNode conditional = (ConditionalNode) nodes.get(0);
            assertThat(conditional.expression()).isEqualTo("ok");
            assertThat(conditional.thenBody()).hasSize(2);
            assertThat(conditional.elseBody()).hasSize(1);
            assertThat(conditional.hasElse()).isTrue();
        }

        @Test
        void shouldBuildConditionalWithoutElse() {
            ConditionalNode conditional = (ConditionalNode) build("{%if ok%}yes{%endif%}").get(0);

            assertThat(conditional.hasElse()).isFalse();
            assertThat(conditional.elseBody()).isEmpty();
        }

        @Test
        void shouldKeepModuleTagsAsNodes() {
            List<AstNode> nodes = build("a{% image logo %}b");

            assertThat(nodes.get(1)).isInstanceOf(ModuleTagNode.class);
            ModuleTagNode tag = (ModuleTagNode) nodes.get(1);
            assertThat(tag.name()).isEqualTo("image");
            assertThat(tag.data()).isEqualTo("logo");
            assertThat(tag.position()).isEqualTo(1);
        }

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "Hello {{name}}!",
                    "{%loop x in items%}{{x}}, {%endloop%}",
                    "{% if a == 'b' %}{{? p }}{% else %}{@ raw }{% endif %}",
                    "{%loop a in b%}{%if a%}{%loop c in a%}{{c}}{%endloop%}{%endif%}{%endloop%}",
                    "trailing {{ unclosed"
                })
        void shouldReproduceSourceFromTree(String template) {
            assertThat(AstNode.source(build(template))).isEqualTo(template);
        }
    }

    @Nested
    class SyntaxErrorTest {

        @Test
        void shouldRejectUnterminatedLoopAtItsOpener() {
            assertThatThrownBy(() -> build("ab{%loop x in items%}{{x}}"))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .satisfies(
                            e -> {
                                TemplateSyntaxException ex = (TemplateSyntaxException) e;
                                assertThat(ex.getKind()).isEqualTo(ErrorKind.SYNTAX);
                                assertThat(ex.getPosition()).isEqualTo(2);
                            });
        }

        @Test
        void shouldRejectEndWithoutOpener() {
            assertThatThrownBy(() -> build("x{%endloop%}"))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .hasMessageContaining("position 1");
        }

        @Test
        void shouldRejectMismatchedEnd() {
            assertThatThrownBy(() -> build("{%loop x in items%}{%endif%}"))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .hasMessageContaining("inside loop");
        }

        @Test
        void shouldRejectElseOutsideConditional() {
            assertThatThrownBy(() -> build("{%loop x in items%}{%else%}{%endloop%}"))
                    .isInstanceOf(TemplateSyntaxException.class);
        }

        @Test
        void shouldRejectDuplicateElse() {
            assertThatThrownBy(() -> build("{%if a%}1{%else%}2{%else%}3{%endif%}"))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .hasMessageContaining("Duplicate else");
        }

        @Test
        void shouldRejectMalformedLoopHeader() {
            assertThatThrownBy(() -> build("{%loop items%}{%endloop%}"))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .hasMessageContaining("Malformed loop");
        }

        @Test
        void shouldRejectConditionWithoutExpression() {
            assertThatThrownBy(() -> build("{%if%}x{%endif%}"))
                    .isInstanceOf(TemplateSyntaxException.class);
        }
    }

    // --- Helpers ---

    private List<AstNode> build(String template) {
        return builder.build(tokenizer.tokenize(template));
    }
}
