package org.iconoglott.compiler.backend.emit;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class MarkupTest {

    @Test
    void testEscapeText() {
        assertThat(Markup.escapeText("<a & b>")).isEqualTo("&lt;a &amp; b&gt;");
        assertThat(Markup.escapeText("say \"hi\"")).isEqualTo("say \"hi\"");
    }

    @Test
    void testEscapeAttribute() {
        assertThat(Markup.escapeAttribute("say \"<hi>\"")).isEqualTo("say &quot;&lt;hi&gt;&quot;");
    }

    @Test
    void testAttr() {
        assertThat(Markup.attr("fill", "#f00")).isEqualTo(" fill=\"#f00\"");
        assertThat(Markup.attr("x", 12.0)).isEqualTo(" x=\"12\"");
        assertThat(Markup.attr("opacity", 0.25)).isEqualTo(" opacity=\"0.25\"");
    }
}
