package me.christianrobert.plpgcheck.diagnostic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the output formats of DiagnosticReporter.
 */
class DiagnosticReporterTest {

    private final DiagnosticReporter reporter = new DiagnosticReporter();

    private static Diagnostic queryError() {
        return Diagnostic.builder(Severity.ERROR, "column \"zz\" does not exist")
                .sqlState("42703")
                .statement(4, "SQL statement")
                .query("SELECT zz", 8)
                .hint("Check the name.")
                .build();
    }

    private static Diagnostic routineWarning() {
        return Diagnostic.builder(Severity.WARNING_OTHERS, "unused variable \"x\"")
                .statement(2, null)
                .build();
    }

    // ========== Text ==========

    @Test
    void toTextLines_headLineAndQueryCaret() {
        List<String> lines = reporter.toTextLines(List.of(queryError()));

        assertEquals("error:42703:4:SQL statement:column \"zz\" does not exist", lines.get(0));
        assertEquals("Query: SELECT zz", lines.get(1));
        assertEquals("--" + " ".repeat(12) + "^", lines.get(2), "caret under the eighth query character");
        assertEquals("Hint: Check the name.", lines.get(3));
        assertEquals(4, lines.size());
    }

    @Test
    void toTextLines_withoutStatement() {
        List<String> lines = reporter.toTextLines(List.of(routineWarning()));
        assertEquals(List.of("warning:00000:2::unused variable \"x\""), lines);
    }

    @Test
    void render_textJoinsLines() {
        String text = reporter.render("public.f1()", List.of(routineWarning(), routineWarning()), OutputFormat.TEXT);
        assertEquals(2, text.split("\n").length);
    }

    // ========== Tabular ==========

    @Test
    void toTabular_mapsFields() {
        List<TabularRow> rows = reporter.toTabular("public.f1()", List.of(queryError(), routineWarning()));

        TabularRow first = rows.get(0);
        assertEquals("public.f1()", first.getFunctionId());
        assertEquals(4, first.getLineno());
        assertEquals("error", first.getLevel());
        assertEquals(8, first.getPosition());

        TabularRow second = rows.get(1);
        assertNull(second.getPosition(), "no query, no position");
        assertNull(second.getStatement());
    }

    @Test
    void render_tabularHasHeader() {
        String text = reporter.render("public.f1()", List.of(routineWarning()), OutputFormat.TABULAR);
        String[] lines = text.split("\n");
        assertTrue(lines[0].startsWith("functionid|lineno|statement"));
        assertTrue(lines[1].startsWith("public.f1()|2||00000|unused variable"));
    }

    // ========== JSON and XML ==========

    @Test
    void toJson_issueStructure() throws Exception {
        JsonNode root = new ObjectMapper().readTree(reporter.toJson("public.f1()", List.of(queryError())));

        assertEquals("public.f1()", root.get("function").asText());
        JsonNode issue = root.get("issues").get(0);
        assertEquals("error", issue.get("level").asText());
        assertEquals("4", issue.get("statement").get("lineNumber").asText());
        assertEquals("SELECT zz", issue.get("query").get("text").asText());
        assertEquals("42703", issue.get("sqlState").asText());
        assertFalse(issue.has("detail"), "absent fields are omitted");
    }

    @Test
    void toXml_escapesText() {
        Diagnostic diagnostic = Diagnostic.builder(Severity.ERROR, "operator does not exist: date < boolean").build();
        String xml = reporter.toXml("public.f1()", List.of(diagnostic));

        assertTrue(xml.startsWith("<Function oid=\"public.f1()\">"));
        assertTrue(xml.contains("<Message>operator does not exist: date &lt; boolean</Message>"));
        assertTrue(xml.endsWith("</Function>"));
    }

    @Test
    void toXml_parsesBackToTheSameValues() throws Exception {
        Diagnostic diagnostic = Diagnostic.builder(Severity.ERROR, "column \"zz\" does not exist")
                .sqlState("42703")
                .statement(4, "SQL statement")
                .query("SELECT zz FROM t1 WHERE a < 1 AND b = 'x & y'", 8)
                .build();
        String xml = reporter.toXml("public.f1(\"p\" text)", List.of(diagnostic, routineWarning()));

        Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        Element root = document.getDocumentElement();
        assertEquals("public.f1(\"p\" text)", root.getAttribute("oid"));
        assertEquals(2, root.getElementsByTagName("Issue").getLength());

        Element stmt = (Element) root.getElementsByTagName("Stmt").item(0);
        assertEquals("4", stmt.getAttribute("lineno"));
        assertEquals("SQL statement", stmt.getTextContent());

        Element query = (Element) root.getElementsByTagName("Query").item(0);
        assertEquals("8", query.getAttribute("position"));
        assertEquals("SELECT zz FROM t1 WHERE a < 1 AND b = 'x & y'", query.getTextContent());
        assertEquals("column \"zz\" does not exist",
                root.getElementsByTagName("Message").item(0).getTextContent());
        assertEquals(1, root.getElementsByTagName("Stmt").getLength(), "the routine warning has no statement");
    }

    // ========== Format names ==========

    @Test
    void outputFormat_fromString() {
        assertEquals(OutputFormat.JSON, OutputFormat.fromString("json"));
        assertEquals(OutputFormat.TEXT, OutputFormat.fromString(null));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.fromString("yaml"));
    }
}
