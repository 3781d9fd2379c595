package com.warehousesentinel.core.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExpressionCompiler}.
 */
class ExpressionCompilerTest {

    @Test
    @DisplayName("Should produce identical SQL when compiling the same text twice")
    void shouldBeIdempotent() {
        String expression = "spend > 0 && (conversions == 0 || clicks < 10)";
        Map<String, String> aliases = Map.of("spend", "total_spend");

        assertThat(ExpressionCompiler.compile(expression, aliases))
                .isEqualTo(ExpressionCompiler.compile(expression, aliases));
    }

    @Test
    @DisplayName("Should rewrite equality against null to IS NULL")
    void shouldRewriteNullEquality() {
        assertThat(ExpressionCompiler.compile("keyword_text == null")).isEqualTo("keyword_text IS NULL");
        assertThat(ExpressionCompiler.compile("keyword_text = null")).isEqualTo("keyword_text IS NULL");
        assertThat(ExpressionCompiler.compile("null == keyword_text")).isEqualTo("keyword_text IS NULL");
    }

    @Test
    @DisplayName("Should rewrite inequality against null to IS NOT NULL")
    void shouldRewriteNullInequality() {
        assertThat(ExpressionCompiler.compile("keyword_text != null")).isEqualTo("keyword_text IS NOT NULL");
        assertThat(ExpressionCompiler.compile("keyword_text <> null")).isEqualTo("keyword_text IS NOT NULL");
        assertThat(ExpressionCompiler.compile("null != keyword_text")).isEqualTo("keyword_text IS NOT NULL");
    }

    @Test
    @DisplayName("Should substitute aliased identifiers")
    void shouldSubstituteAliases() {
        String sql = ExpressionCompiler.compile("spend > 100", Map.of("spend", "total_spend"));

        assertThat(sql).isEqualTo("(total_spend > 100)");
    }

    @Test
    @DisplayName("Should leave qualified paths untouched by alias substitution")
    void shouldNotAliasQualifiedPaths() {
        String sql = ExpressionCompiler.compile("t.spend > 0", Map.of("spend", "total_spend"));

        assertThat(sql).isEqualTo("(t.spend > 0)");
    }

    @Test
    @DisplayName("Should parenthesize every logical and comparison node")
    void shouldParenthesizeBinaryNodes() {
        assertThat(ExpressionCompiler.compile("spend > 0 AND conversions = 0"))
                .isEqualTo("((spend > 0) AND (conversions = 0))");
        assertThat(ExpressionCompiler.compile("a > 1 && b == 0 || c < 2"))
                .isEqualTo("(((a > 1) AND (b = 0)) OR (c < 2))");
        assertThat(ExpressionCompiler.compile("a > 1 and (b == 0 or c < 2)"))
                .isEqualTo("((a > 1) AND ((b = 0) OR (c < 2)))");
    }

    @Test
    @DisplayName("Should render inequality as <>")
    void shouldRenderInequality() {
        assertThat(ExpressionCompiler.compile("status != 'PAUSED'")).isEqualTo("(status <> 'PAUSED')");
        assertThat(ExpressionCompiler.compile("status <> 'PAUSED'")).isEqualTo("(status <> 'PAUSED')");
    }

    @Test
    @DisplayName("Should render arithmetic, negation and NOT")
    void shouldRenderArithmeticAndUnary() {
        assertThat(ExpressionCompiler.compile("-spend + 3 * clicks")).isEqualTo("((-spend) + (3 * clicks))");
        assertThat(ExpressionCompiler.compile("!(a == 1)")).isEqualTo("(NOT (a = 1))");
        assertThat(ExpressionCompiler.compile("not archived")).isEqualTo("(NOT archived)");
        assertThat(ExpressionCompiler.compile("clicks % 7 == 0")).isEqualTo("(MOD(clicks, 7) = 0)");
    }

    @Test
    @DisplayName("Should render function calls with their name as written")
    void shouldRenderFunctionCalls() {
        String sql = ExpressionCompiler.compile("SAFE_DIVIDE(conversions, clicks) < 0.01");

        assertThat(sql).isEqualTo("(SAFE_DIVIDE(conversions, clicks) < 0.01)");
    }

    @Test
    @DisplayName("Should render IN lists from brackets or parentheses")
    void shouldRenderInLists() {
        assertThat(ExpressionCompiler.compile("platform in ['google', \"meta\"]"))
                .isEqualTo("platform IN ('google', 'meta')");
        assertThat(ExpressionCompiler.compile("platform not in ('google', 'meta')"))
                .isEqualTo("platform NOT IN ('google', 'meta')");
    }

    @Test
    @DisplayName("Should escape quotes and backslashes in string literals")
    void shouldEscapeStrings() {
        assertThat(ExpressionCompiler.compile("name == \"O'Brien\""))
                .isEqualTo("(name = 'O\\'Brien')");
        assertThat(ExpressionCompiler.compile("path == 'a\\\\b'"))
                .isEqualTo("(path = 'a\\\\b')");
    }

    @Test
    @DisplayName("Should reject IN without a list literal")
    void shouldRejectInWithoutList() {
        assertThatThrownBy(() -> ExpressionCompiler.compile("platform in 'google'"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("list literal")
                .hasMessageContaining("platform in 'google'");
    }

    @Test
    @DisplayName("Should reject a list literal outside IN")
    void shouldRejectBareList() {
        assertThatThrownBy(() -> ExpressionCompiler.compile("[1, 2]"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("Unsupported expression node");
    }

    @Test
    @DisplayName("Should report syntax errors with position and text")
    void shouldReportSyntaxErrors() {
        assertThatThrownBy(() -> ExpressionCompiler.compile("spend > "))
                .isInstanceOf(CompileException.class)
                .satisfies(e -> {
                    CompileException ce = (CompileException) e;
                    assertThat(ce.getExpression()).isEqualTo("spend > ");
                    assertThat(ce.getPosition()).isEqualTo(8);
                });

        assertThatThrownBy(() -> ExpressionCompiler.compile("name == 'abc"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("Unterminated string");

        assertThatThrownBy(() -> ExpressionCompiler.compile("a & b"))
                .isInstanceOf(CompileException.class);

        assertThatThrownBy(() -> ExpressionCompiler.compile("a > 1 b"))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("trailing input");
    }

    @Test
    @DisplayName("Should reject blank expressions")
    void shouldRejectBlank() {
        assertThatThrownBy(() -> ExpressionCompiler.compile("   "))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("blank");
    }

    @Test
    @DisplayName("Should split top-level conjuncts and collect identifiers")
    void shouldSplitConjunctsAndCollectIdentifiers() {
        Expression root = ExpressionCompiler.parse("a > 1 AND (b < 2 OR c = 3) AND SAFE_DIVIDE(x, y) > z");

        assertThat(ExpressionCompiler.conjuncts(root)).hasSize(3);
        assertThat(ExpressionCompiler.identifiers(root)).containsExactly("a", "b", "c", "x", "y", "z");
    }

    @Test
    @DisplayName("Should cache compiled fragments per expression and alias map")
    void shouldCachePerAliasMap() {
        CompiledExpressionCache cache = new CompiledExpressionCache();

        String first = cache.compile("spend > 0", Map.of());
        String second = cache.compile("spend > 0", Map.of());
        String aliased = cache.compile("spend > 0", Map.of("spend", "total_spend"));

        assertThat(first).isEqualTo(second).isEqualTo("(spend > 0)");
        assertThat(aliased).isEqualTo("(total_spend > 0)");
        assertThat(cache.size()).isEqualTo(2);
    }
}
