package test.io.shadycss;

import io.shadycss.ShadyCssParser;
import io.shadycss.ast.Stylesheet;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class SyntaxTreeInvariantsTest {

    private final ShadyCssParser parser = new ShadyCssParser();

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "/* hi */",
        "a{}",
        "a:hover { color: red; }",
        "a { b { c: d; } }",
        "@media (min-width: 1px) { a { color: red; } } ",
        "@import url(foo.css);\n@import 'bar.css' screen;",
        "--foo: { color: red; };",
        "url(http://x:80/a) { color: red; }",
        "}}} a { color: red; }",
        ":host { --x: { color: red; }; @apply --x; }\n:host([disabled]) ::slotted(*) { opacity: .5 }",
        "x { y: url(a:b); z: 'a;b'; }",
        "a /* c */ { /* d */ }",
        "\r\n\ta\r\n{\r\n  b : c\r\n}\r\n",
        "@supports (display: grid) and (not (display: inline-grid)) { .a { display: grid } }",
        "html { --primary: { color: #333; background: url(data:image/png;base64,AAA=); }; }",
        "@keyframes spin { from { transform: rotate(0deg) } to { transform: rotate(360deg) } }",
        "a { ;} b { c: d;; } }",
        "color: red",
        "@media screen"
    })
    public void testSyntaxTreeInvariants(String text) {
        Stylesheet stylesheet = parser.parse(text);
        SyntaxTreeAssertions.assertWellFormed(stylesheet, text);
        SyntaxTreeAssertions.assertCoversText(stylesheet, text);
    }
}
