package com.codeabbrev.core.syntax;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class PythonParserTest {

    private static final Path SCRIPTS = Paths.get(System.getProperty("user.dir"))
            .getParent()
            .resolve("test-fixtures/python-scripts");

    private final PythonParser parser = new PythonParser();

    private void assertRoundTrip(String source) throws ParseException {
        assertEquals(source, parser.parse(source).code());
    }

    @Test
    void fixturesRoundTripExactly() throws Exception {
        for (String name : new String[] {"nested_classes.py", "simple_script.py"}) {
            String source = Files.readString(SCRIPTS.resolve(name), StandardCharsets.UTF_8);
            assertRoundTrip(source);
        }
    }

    @Test
    void trickySourceRoundTripsExactly() throws ParseException {
        assertRoundTrip("");
        assertRoundTrip("\n\n# only a comment");
        assertRoundTrip("x = 1");
        assertRoundTrip("def f(a, b=lambda y: y, *, c: int = 3) -> dict[str, int]:\n    return {a: b}\n");
        assertRoundTrip("if (n := len(items)) > 5:  # walrus\n    print(n)\n");
        assertRoundTrip("result = call(\n    first,\n    second,\n)\nvalue = 1 + \\\n    2\n");
        assertRoundTrip("text = \"\"\"\nif fake:\n  not code\n\"\"\"\nname = rb'raw\\'quote'\n");
        assertRoundTrip("class A: pass\nif x: y = 1; z = 2\nelse: w = 3\n");
        assertRoundTrip("@decorator(arg)\n# between\n@other\nasync def handler():\n    async with lock:\n        async for item in stream:\n            yield item\n");
        assertRoundTrip("def f():\n\tif x:\n\t\treturn 1\n\t# trailing comment\n\n# module footer\n");
        assertRoundTrip("\uFEFFimport os\r\ndef f():\r\n    return os.sep\r\n");
        assertRoundTrip("match command:\n    case [x, y]:\n        go(x, y)\n    case _:\n        pass\nmatch = 3\n");
        assertRoundTrip("try:\n    a()\nexcept* ValueError:\n    b()\nelse:\n    c()\nfinally:\n    d()\n");
    }

    @Test
    void elifIsNestedIfInElsePosition() throws ParseException {
        Module module = parser.parse("if a:\n    x()\nelif b:\n    y()\nelse:\n    z()\n");
        IfStatement top = (IfStatement) module.body().get(0);
        assertNull(top.orElse());
        assertNotNull(top.elif());
        assertTrue(top.elif().clause().header().startsWith("elif b"));
        assertNotNull(top.elif().orElse());
    }

    @Test
    void tryCollectsEveryHandler() throws ParseException {
        TryStatement stmt = (TryStatement) parser.parse(
                "try:\n    a()\nexcept OSError:\n    b()\nexcept ValueError:\n    c()\nfinally:\n    d()\n")
                .body().get(0);
        assertEquals(2, stmt.handlers().size());
        assertNull(stmt.orElse());
        assertNotNull(stmt.finallyClause());
    }

    @Test
    void decoratorsBelongToTheDefinitionHeader() throws ParseException {
        FunctionDef def = (FunctionDef) parser.parse("@cache\ndef f():\n    return 1\n").body().get(0);
        assertTrue(def.clause().header().startsWith("@cache\n"));
        assertEquals("", def.clause().indent());
    }

    @Test
    void inlineSuiteIsKeptAsText() throws ParseException {
        WhileStatement loop = (WhileStatement) parser.parse("while busy(): wait()\n").body().get(0);
        assertInstanceOf(InlineSuite.class, loop.clause().suite());
        assertEquals(" wait()\n", loop.clause().suite().code());
    }

    @Test
    void matchIsUntrackedCompoundStatement() throws ParseException {
        Module module = parser.parse("match x:\n    case 1:\n        pass\n");
        assertInstanceOf(CompoundStatement.class, module.body().get(0));
    }

    @Test
    void detectsIndentUnitAndNewline() throws ParseException {
        Module tabs = parser.parse("def f():\n\treturn 1\n");
        assertEquals("\t", tabs.indentUnit());
        Module crlf = parser.parse("x = 1\r\n");
        assertEquals("\r\n", crlf.newline());
        assertEquals(PythonParser.DEFAULT_INDENT, crlf.indentUnit());
    }

    @Test
    void unclosedBracketReportsOpeningLine() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("x = 1\ncall(a,\n  b\n"));
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void mismatchedBracketIsRejected() {
        assertThrows(ParseException.class, () -> parser.parse("x = (1]\n"));
        assertThrows(ParseException.class, () -> parser.parse("x = 1)\n"));
    }

    @Test
    void unterminatedStringsAreRejected() {
        assertThrows(ParseException.class, () -> parser.parse("x = 'abc\n"));
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("a = 1\nb = \"\"\"never closed\n"));
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void inconsistentDedentIsRejected() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parse("if x:\n    a = 1\n  b = 2\n"));
        assertEquals(3, e.getLineNumber());
    }

    @Test
    void missingIndentedBlockIsRejected() {
        assertThrows(ParseException.class, () -> parser.parse("def f():\n"));
        assertThrows(ParseException.class, () -> parser.parse("def f():\nreturn 1\n"));
    }

    @Test
    void orphanContinuationClausesAreRejected() {
        assertThrows(ParseException.class, () -> parser.parse("else:\n    x = 1\n"));
        assertThrows(ParseException.class, () -> parser.parse("x = 1\nexcept ValueError:\n    pass\n"));
        assertThrows(ParseException.class, () -> parser.parse("try:\n    x = 1\ny = 2\n"));
        assertThrows(ParseException.class, () -> parser.parse("try:\n    x = 1\nelse:\n    y = 2\nfinally:\n    z = 3\n"));
    }

    @Test
    void invalidStatementInsideNestedBodyIsRejected() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parse("def outer():\n    def inner():\n        x = = 1\n        return x\n"));
        assertEquals(3, e.getLineNumber());
    }

    @Test
    void nestedQuotesInsideFStringRoundTrip() throws ParseException {
        assertRoundTrip("if f\"{d[\"#\"]}\":\n    x = f'{a[\'k\']!r:>{width}}'\n");
    }

    @Test
    void legacyPrintStatementIsRejected() {
        assertThrows(ParseException.class, () -> parser.parse("print \"a\"\n"));
        assertThrows(ParseException.class, () -> parser.parse("def f():\n    print \"a\"\n"));
    }

    @Test
    void headerWithoutColonIsRejected() {
        assertThrows(ParseException.class, () -> parser.parse("def f()\n    return 1\n"));
    }
}
