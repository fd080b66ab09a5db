package me.christianrobert.plpgcheck.diagnostic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a diagnostic list in one of the supported output formats.
 */
public class DiagnosticReporter {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticReporter.class);

    private static final XMLOutputFactory XML_OUTPUT = XMLOutputFactory.newFactory();

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String render(String functionId, List<Diagnostic> diagnostics, OutputFormat format) {
        switch (format) {
            case JSON:
                return toJson(functionId, diagnostics);
            case XML:
                return toXml(functionId, diagnostics);
            case TABULAR:
                return toTabularText(functionId, diagnostics);
            case TEXT:
            default:
                return String.join("\n", toTextLines(diagnostics));
        }
    }

    /**
     * Text lines as {@code plpgsql_check_function} returns them, one diagnostic usually
     * spanning several lines.
     */
    public List<String> toTextLines(List<Diagnostic> diagnostics) {
        List<String> lines = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            StringBuilder head = new StringBuilder();
            head.append(diagnostic.getSeverity().getLabel()).append(':')
                    .append(diagnostic.getSqlState()).append(':');
            if (diagnostic.getLineno() > 0) {
                head.append(diagnostic.getLineno());
            }
            head.append(':');
            if (diagnostic.getStatement() != null) {
                head.append(diagnostic.getStatement());
            }
            head.append(':').append(diagnostic.getMessage());
            lines.add(head.toString());

            if (diagnostic.getQuery() != null) {
                addQueryLines(lines, diagnostic.getQuery(), diagnostic.getPosition());
            }
            if (diagnostic.getDetail() != null) {
                lines.add("Detail: " + diagnostic.getDetail());
            }
            if (diagnostic.getHint() != null) {
                lines.add("Hint: " + diagnostic.getHint());
            }
            if (diagnostic.getContext() != null) {
                lines.add("Context: " + diagnostic.getContext());
            }
        }
        return lines;
    }

    private void addQueryLines(List<String> lines, String query, int position) {
        String[] queryLines = query.split("\n", -1);
        int offset = 0;
        for (int i = 0; i < queryLines.length; i++) {
            String prefix = i == 0 ? "Query: " : "       ";
            lines.add(prefix + queryLines[i]);
            int lineEnd = offset + queryLines[i].length();
            if (position > 0 && position - 1 >= offset && position - 1 <= lineEnd) {
                int column = prefix.length() + (position - 1 - offset);
                lines.add("--" + " ".repeat(Math.max(0, column - 2)) + "^");
            }
            offset = lineEnd + 1;
        }
    }

    public List<TabularRow> toTabular(String functionId, List<Diagnostic> diagnostics) {
        List<TabularRow> rows = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            rows.add(TabularRow.of(functionId, diagnostic));
        }
        return rows;
    }

    private String toTabularText(String functionId, List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        sb.append("functionid|lineno|statement|sqlstate|message|detail|hint|level|position|query|context");
        for (TabularRow row : toTabular(functionId, diagnostics)) {
            sb.append('\n')
                    .append(nullToEmpty(row.getFunctionId())).append('|')
                    .append(row.getLineno() != null ? row.getLineno() : "").append('|')
                    .append(nullToEmpty(row.getStatement())).append('|')
                    .append(nullToEmpty(row.getSqlState())).append('|')
                    .append(nullToEmpty(row.getMessage())).append('|')
                    .append(nullToEmpty(row.getDetail())).append('|')
                    .append(nullToEmpty(row.getHint())).append('|')
                    .append(nullToEmpty(row.getLevel())).append('|')
                    .append(row.getPosition() != null ? row.getPosition() : "").append('|')
                    .append(nullToEmpty(row.getQuery())).append('|')
                    .append(nullToEmpty(row.getContext()));
        }
        return sb.toString();
    }

    public String toJson(String functionId, List<Diagnostic> diagnostics) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("function", functionId);
        ArrayNode issues = root.putArray("issues");
        for (Diagnostic diagnostic : diagnostics) {
            ObjectNode issue = issues.addObject();
            issue.put("level", diagnostic.getSeverity().getLabel());
            issue.put("message", diagnostic.getMessage());
            if (diagnostic.getStatement() != null) {
                ObjectNode statement = issue.putObject("statement");
                statement.put("lineNumber", String.valueOf(diagnostic.getLineno()));
                statement.put("text", diagnostic.getStatement());
            }
            if (diagnostic.getQuery() != null) {
                ObjectNode query = issue.putObject("query");
                query.put("position", String.valueOf(diagnostic.getPosition()));
                query.put("text", diagnostic.getQuery());
            }
            putIfPresent(issue, "detail", diagnostic.getDetail());
            putIfPresent(issue, "hint", diagnostic.getHint());
            putIfPresent(issue, "context", diagnostic.getContext());
            issue.put("sqlState", diagnostic.getSqlState());
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize diagnostics of {}", functionId, e);
            throw new IllegalStateException("Failed to serialize diagnostics", e);
        }
    }

    public String toXml(String functionId, List<Diagnostic> diagnostics) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = XML_OUTPUT.createXMLStreamWriter(out);
            xml.writeStartElement("Function");
            xml.writeAttribute("oid", nullToEmpty(functionId));
            for (Diagnostic diagnostic : diagnostics) {
                xml.writeCharacters("\n  ");
                xml.writeStartElement("Issue");
                element(xml, "Level", diagnostic.getSeverity().getLabel());
                element(xml, "Sqlstate", diagnostic.getSqlState());
                element(xml, "Message", diagnostic.getMessage());
                if (diagnostic.getStatement() != null) {
                    startElement(xml, "Stmt");
                    xml.writeAttribute("lineno", String.valueOf(diagnostic.getLineno()));
                    xml.writeCharacters(diagnostic.getStatement());
                    xml.writeEndElement();
                }
                if (diagnostic.getHint() != null) {
                    element(xml, "Hint", diagnostic.getHint());
                }
                if (diagnostic.getDetail() != null) {
                    element(xml, "Detail", diagnostic.getDetail());
                }
                if (diagnostic.getQuery() != null) {
                    startElement(xml, "Query");
                    xml.writeAttribute("position", String.valueOf(diagnostic.getPosition()));
                    xml.writeCharacters(diagnostic.getQuery());
                    xml.writeEndElement();
                }
                if (diagnostic.getContext() != null) {
                    element(xml, "Context", diagnostic.getContext());
                }
                xml.writeCharacters("\n  ");
                xml.writeEndElement();
            }
            xml.writeCharacters("\n");
            xml.writeEndElement();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            log.error("Failed to serialize diagnostics of {}", functionId, e);
            throw new IllegalStateException("Failed to serialize diagnostics", e);
        }
        return out.toString();
    }

    private static void startElement(XMLStreamWriter xml, String name) throws XMLStreamException {
        xml.writeCharacters("\n    ");
        xml.writeStartElement(name);
    }

    private static void element(XMLStreamWriter xml, String name, String value) throws XMLStreamException {
        startElement(xml, name);
        xml.writeCharacters(nullToEmpty(value));
        xml.writeEndElement();
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
