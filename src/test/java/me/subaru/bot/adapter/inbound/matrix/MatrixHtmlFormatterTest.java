package me.subaru.bot.adapter.inbound.matrix;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatrixHtmlFormatterTest {

    @Test
    void plainTextNeedsNoFormatting() {
        assertEquals(MatrixHtmlFormatter.NO_FORMATTING, MatrixHtmlFormatter.format("Pong!"));
        assertEquals(MatrixHtmlFormatter.NO_FORMATTING, MatrixHtmlFormatter.format("a < b && c"));
        assertEquals(MatrixHtmlFormatter.NO_FORMATTING, MatrixHtmlFormatter.format(null));
        assertEquals(MatrixHtmlFormatter.NO_FORMATTING, MatrixHtmlFormatter.format("  "));
    }

    @Test
    void shouldFormatBoldAndItalic() {
        assertEquals("<strong>bold</strong> and <em>it</em>",
                MatrixHtmlFormatter.format("**bold** and *it*"));
        assertEquals("<strong>also</strong>", MatrixHtmlFormatter.format("__also__"));
    }

    @Test
    void shouldNotItalicizeSnakeCase() {
        assertEquals(MatrixHtmlFormatter.NO_FORMATTING, MatrixHtmlFormatter.format("see file_name_path"));
    }

    @Test
    void shouldEscapeRawHtml() {
        assertEquals("&lt;b&gt;x&lt;/b&gt; <strong>y</strong>",
                MatrixHtmlFormatter.format("<b>x</b> **y**"));
    }

    @Test
    void shouldEscapeInsideInlineCode() {
        assertEquals("run <code>x &lt; y</code>", MatrixHtmlFormatter.format("run `x < y`"));
    }

    @Test
    void shouldKeepNewlinesInsideCodeBlock() {
        assertEquals("<pre><code class=\"language-java\">int a = 1;\nint b = 2;\n</code></pre>",
                MatrixHtmlFormatter.format("```java\nint a = 1;\nint b = 2;\n```"));
    }

    @Test
    void shouldConvertNewlinesOutsideCode() {
        assertEquals("line one<br/><strong>two</strong>", MatrixHtmlFormatter.format("line one\n**two**"));
    }

    @Test
    void shouldOnlyLinkHttpUrls() {
        assertEquals("<a href=\"https://example.org\">site</a>",
                MatrixHtmlFormatter.format("[site](https://example.org)"));
        assertEquals(MatrixHtmlFormatter.NO_FORMATTING,
                MatrixHtmlFormatter.format("[x](javascript:alert)"));
    }

    @Test
    void shouldFormatHeadersAndStrikethrough() {
        assertEquals("<h1>Title</h1>", MatrixHtmlFormatter.format("# Title"));
        assertEquals("<del>gone</del>", MatrixHtmlFormatter.format("~~gone~~"));
    }
}
