package com.example.slidetpl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TagElevator")
class TagElevatorTest {

    @Test
    @DisplayName("paragraph directive replaces its paragraph")
    void paragraph() {
        String xml = "<a:p><a:r><a:t>{%pp if show %}</a:t></a:r></a:p>";
        assertThat(TagElevator.elevate(xml)).isEqualTo("{% if show %}");
    }

    @Test
    @DisplayName("elevates the second of two sibling paragraphs, not the first")
    void secondSibling() {
        String xml = "<a:p><a:r><a:t>first</a:t></a:r></a:p><a:p><a:r><a:t>{{pp x }}</a:t></a:r></a:p>";
        assertThat(TagElevator.elevate(xml))
                .isEqualTo("<a:p><a:r><a:t>first</a:t></a:r></a:p>{{ x }}");
    }

    @Test
    @DisplayName("paragraph properties are not mistaken for a paragraph")
    void paragraphPropertiesIgnored() {
        String xml = "<a:p><a:pPr algn=\"ctr\"/><a:r><a:t>{%pp if a %}</a:t></a:r></a:p>";
        assertThat(TagElevator.elevate(xml)).isEqualTo("{% if a %}");
    }

    @Test
    @DisplayName("self-closing siblings are skipped")
    void selfClosingIgnored() {
        String xml = "<p:txBody><a:p/><a:p><a:r><a:t>{%pp if a %}</a:t></a:r></a:p><a:p/></p:txBody>";
        assertThat(TagElevator.elevate(xml)).isEqualTo("<p:txBody><a:p/>{% if a %}<a:p/></p:txBody>");
    }

    @Test
    @DisplayName("row directive replaces the whole row including nested cells")
    void row() {
        String xml = "<a:tbl><a:tr h=\"1\"><a:tc><a:txBody><a:p><a:r><a:t>{%tr for r in rows %}</a:t></a:r></a:p>"
                + "</a:txBody><a:tcPr/></a:tc></a:tr><a:tr h=\"1\"><a:tc><a:txBody><a:p><a:r><a:t>{{ r }}</a:t></a:r></a:p>"
                + "</a:txBody></a:tc></a:tr></a:tbl>";
        assertThat(TagElevator.elevate(xml)).isEqualTo("<a:tbl>{% for r in rows %}<a:tr h=\"1\"><a:tc><a:txBody>"
                + "<a:p><a:r><a:t>{{ r }}</a:t></a:r></a:p></a:txBody></a:tc></a:tr></a:tbl>");
    }

    @Test
    @DisplayName("cell directive replaces only the cell")
    void cell() {
        String xml = "<a:tr><a:tc><a:txBody><a:p><a:r><a:t>keep</a:t></a:r></a:p></a:txBody></a:tc>"
                + "<a:tc><a:txBody><a:p><a:r><a:t>{%tc if x %}</a:t></a:r></a:p></a:txBody><a:tcPr/></a:tc></a:tr>";
        assertThat(TagElevator.elevate(xml)).isEqualTo("<a:tr><a:tc><a:txBody><a:p><a:r><a:t>keep</a:t></a:r></a:p>"
                + "</a:txBody></a:tc>{% if x %}</a:tr>");
    }

    @Test
    @DisplayName("shape directive replaces the shape")
    void shape() {
        String xml = "<p:spTree><p:sp><p:nvSpPr/><p:txBody><a:p><a:r><a:t>{%sp if logo %}</a:t></a:r></a:p></p:txBody></p:sp>"
                + "<p:sp><p:nvSpPr/></p:sp></p:spTree>";
        assertThat(TagElevator.elevate(xml)).isEqualTo("<p:spTree>{% if logo %}<p:sp><p:nvSpPr/></p:sp></p:spTree>");
    }

    @Test
    @DisplayName("without an enclosing element only the prefix is removed")
    void noEnclosingElement() {
        assertThat(TagElevator.elevate("<a:t>{%tc if x %}</a:t>")).isEqualTo("<a:t>{% if x %}</a:t>");
        assertThat(TagElevator.elevate("<a:t>{{tr value }}</a:t>")).isEqualTo("<a:t>{{ value }}</a:t>");
    }

    @Test
    @DisplayName("unprefixed directives are untouched")
    void unprefixed() {
        String xml = "<a:p><a:r><a:t>{% if show %}{{ pp }}</a:t></a:r></a:p>";
        assertThat(TagElevator.elevate(xml)).isEqualTo(xml);
    }

    @Test
    @DisplayName("stripPrefixes keeps the structure")
    void stripPrefixes() {
        String xml = "<a:p><a:r><a:t>{%pp if a %}{{sp title }}</a:t></a:r></a:p>";
        assertThat(TagElevator.stripPrefixes(xml)).isEqualTo("<a:p><a:r><a:t>{% if a %}{{ title }}</a:t></a:r></a:p>");
    }

    @Test
    @DisplayName("balanced scans find the innermost enclosing element")
    void balancedScans() {
        String xml = "<a:p><a:r/></a:p><a:p><a:p>X</a:p>Y</a:p>";
        int y = xml.indexOf('Y');
        assertThat(TagElevator.findEnclosingOpen(xml, y, "a:p")).isEqualTo(xml.indexOf("<a:p><a:p>"));
        assertThat(TagElevator.findEnclosingClose(xml, y, "a:p")).isEqualTo(xml.length());
        int x = xml.indexOf('X');
        assertThat(TagElevator.findEnclosingOpen(xml, x, "a:p")).isEqualTo(xml.indexOf("<a:p>X"));
        assertThat(TagElevator.findEnclosingOpen("<a:t>X</a:t>", 5, "a:p")).isEqualTo(-1);
        assertThat(TagElevator.findEnclosingClose("<a:p>X", 5, "a:p")).isEqualTo(-1);
    }
}
