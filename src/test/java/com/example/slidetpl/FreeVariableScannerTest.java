package com.example.slidetpl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FreeVariableScanner")
class FreeVariableScannerTest {

    private JinjaEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new JinjaEvaluator(new TemplateEngineConfig().jinjava());
    }

    private Set<String> scan(String template) {
        return evaluator.freeVariables(template);
    }

    @Test
    void simpleExpression() {
        assertThat(scan("<a:t>{{ name }}</a:t>")).containsExactly("name");
    }

    @Test
    @DisplayName("attribute names and filter names are not variables")
    void attributesAndFilters() {
        assertThat(scan("{{ user.name | upper }} {{ x | default(y) }}"))
                .containsExactlyInAnyOrder("user", "x", "y");
    }

    @Test
    @DisplayName("loop targets are declared")
    void loopTargets() {
        assertThat(scan("{% for k, v in data.items() %}{{ k }}={{ v }}{% endfor %}"))
                .containsExactly("data");
    }

    @Test
    void setTargets() {
        assertThat(scan("{% set total = price * qty %}{{ total }}"))
                .containsExactlyInAnyOrder("price", "qty");
    }

    @Test
    void macroParameters() {
        assertThat(scan("{% macro row(cell) %}{{ cell }}{% endmacro %}{{ row(item) }}"))
                .containsExactly("item");
    }

    @Test
    @DisplayName("keywords, literals, tests and keyword arguments are skipped")
    void skipped() {
        assertThat(scan(
                "{% if a is defined and not b %}{{ 'x' ~ c if d else none }}{{ fmt(e, sep=f) }}{{ loop.index }}{% endif %}"))
                .containsExactlyInAnyOrder("a", "b", "c", "d", "fmt", "e", "f");
    }

    @Test
    void comparisonIsNotKeywordArgument() {
        assertThat(scan("{% if x == y %}{% elif z %}{% else %}{% endif %}"))
                .containsExactlyInAnyOrder("x", "y", "z");
    }

    @Test
    void commentsAndWhitespaceControl() {
        assertThat(scan("{# {{ hidden }} #}{%- if shown -%}{%- endif -%}"))
                .containsExactly("shown");
    }

    @Test
    void stringLiteralsAreNotVariables() {
        assertThat(scan("{{ \"name\" }}{{ 'a b' }}{{ 42 }}")).isEmpty();
    }

    @Test
    @DisplayName("raw blocks are literal text")
    void rawBlocks() {
        assertThat(scan("{% raw %}{{ literal }}{% endraw %}{{ real }}")).containsExactly("real");
    }

    @Test
    @DisplayName("elif conditions nested under if are scanned")
    void nestedBranches() {
        assertThat(scan("{% for row in rows %}{% if row.a %}{{ p }}{% elif q %}{{ r }}{% endif %}{% endfor %}"))
                .containsExactlyInAnyOrder("rows", "p", "q", "r");
    }
}
