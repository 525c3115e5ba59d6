package io.shortcode.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.shortcode.core.model.Literal;
import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy. Verifies the two-tier structure, common fields, and all
 * concrete exception types.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void shortcodeExceptionIsAbstractAndRoot() {
        assertThat(ShortcodeException.class).isAbstract();
        assertThat(ShortcodeException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void shortcodeLoadExceptionIsAbstract() {
        assertThat(ShortcodeLoadException.class).isAbstract();
        assertThat(ShortcodeLoadException.class.getSuperclass()).isEqualTo(ShortcodeException.class);
    }

    @Test
    void shortcodeRenderExceptionIsAbstract() {
        assertThat(ShortcodeRenderException.class).isAbstract();
        assertThat(ShortcodeRenderException.class.getSuperclass()).isEqualTo(ShortcodeException.class);
    }

    // --- Load-time ---

    @Test
    void configLoadExceptionExtendsLoadException() {
        var ex = new ConfigLoadException("bad yaml", "/etc/shortcode.yaml");

        assertThat(ex).isInstanceOf(ShortcodeLoadException.class);
        assertThat(ex.phase()).isEqualTo(ShortcodeException.Phase.LOAD);
        assertThat(ex.source()).isEqualTo("/etc/shortcode.yaml");
        assertThat(ex.directive()).isNull();
        assertThat(ex.detail()).isEqualTo("bad yaml");
    }

    // --- Render-time ---

    @Test
    void unknownDirectiveExceptionExtendsRenderException() {
        var ex = new UnknownDirectiveException("gallery", 4);

        assertThat(ex).isInstanceOf(ShortcodeRenderException.class);
        assertThat(ex.phase()).isEqualTo(ShortcodeException.Phase.RENDER);
        assertThat(ex.directive()).isEqualTo("gallery");
        assertThat(ex.nodeIndex()).isEqualTo(4);
        assertThat(ex.getMessage()).isEqualTo("Unknown directive: 'gallery'");
    }

    @Test
    void directiveFailedExceptionPreservesCause() {
        var root = new IllegalStateException("template not found");
        var ex = new DirectiveFailedException("figure", root, 1);

        assertThat(ex).isInstanceOf(ShortcodeRenderException.class);
        assertThat(ex.getCause()).isSameAs(root);
        assertThat(ex.getMessage()).isEqualTo("Directive 'figure' failed: template not found");
    }

    @Test
    void budgetExceptionMayLackNodeIndex() {
        var ex = new RenderBudgetExceededException("Rendered output exceeds 10 characters", null, null);

        assertThat(ex).isInstanceOf(ShortcodeRenderException.class);
        assertThat(ex.nodeIndex()).isNull();
        assertThat(ex.directive()).isNull();
    }

    @Test
    void placeholderMismatchCarriesCounts() {
        var ex = new PlaceholderMismatchException(3, 2);

        assertThat(ex).isInstanceOf(ShortcodeRenderException.class);
        assertThat(ex.expected()).isEqualTo(3);
        assertThat(ex.found()).isEqualTo(2);
        assertThat(ex.getMessage()).isEqualTo("Expected 3 placeholder(s) in processed text, found 2");
    }

    // --- Handler-side ---

    @Test
    void invalidArgumentIsOutsideTheEngineHierarchy() {
        assertThat(ShortcodeException.class.isAssignableFrom(InvalidArgumentException.class))
                .isFalse();
    }

    @Test
    void invalidArgumentMessages() {
        assertThat(InvalidArgumentException.missing("src").getMessage()).isEqualTo("Missing required argument 'src'");
        assertThat(InvalidArgumentException.duplicate("src").getMessage())
                .isEqualTo("Argument 'src' given more than once");

        var wrongType = InvalidArgumentException.wrongType("n", Literal.Type.INT, Literal.of("x"));
        assertThat(wrongType.getMessage()).isEqualTo("Argument 'n' must be INT, got STR");
        assertThat(wrongType.argument()).isEqualTo("n");
    }
}
