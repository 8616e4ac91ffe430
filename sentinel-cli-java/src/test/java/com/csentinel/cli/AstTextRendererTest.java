package com.csentinel.cli;

import com.csentinel.cli.render.AstJsonConverter;
import com.csentinel.cli.render.AstTextRenderer;
import com.csentinel.cli.report.ReportModel.AstJson;
import com.csentinel.core.SentinelConfig;
import com.csentinel.core.ast.Program;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AstTextRendererTest {

    private static Program parse(String source) {
        return new Parser(SentinelConfig.defaults(), Diagnostics.silent()).parse(source);
    }

    @Test
    void rendersBoxDrawingTree() {
        String text = new AstTextRenderer().render(parse("int main() { return 0; }"));

        String expected = """
            Program
            └── external_declarations:
                └── FunctionDef
                    ├── return_type: 'int'
                    ├── name: 'main'
                    ├── body:
                    └── Compound
                        ├── items:
                        └── Return
                            ├── expr:
                            └── Constant
                                ├── value: '0'
                                └── ctype: 'int'""";
        assertEquals(expected, text);
    }

    @Test
    void emptyListsAndNullFieldsAreOmitted() {
        String text = new AstTextRenderer().render(parse("void f() { }"));
        assertFalse(text.contains("params"));
        assertFalse(text.contains("variadic"));
        assertFalse(text.contains("items"));
    }

    @Test
    void nullTreeRendersEmpty() {
        assertEquals("", new AstTextRenderer().render(null));
    }

    @Test
    void jsonCarriesScalarsAsAttributes() {
        AstJson root = new AstJsonConverter().convert(parse("int main() { return 0; }"));
        assertEquals("Program", root.node);
        assertNull(root.attributes);

        AstJson function = root.children.get(0);
        assertEquals("FunctionDef", function.node);
        assertEquals(Integer.valueOf(1), function.line);
        assertEquals(Map.of("return_type", "int", "name", "main"), function.attributes);
        assertEquals("Compound", function.children.get(0).node);
    }

    @Test
    void jsonStopsAtDepthLimit() {
        AstJson root = new AstJsonConverter(1).convert(parse("int main() { return 0; }"));
        AstJson function = root.children.get(0);
        assertEquals("FunctionDef", function.node);
        assertTrue(function.children.isEmpty());
    }
}
