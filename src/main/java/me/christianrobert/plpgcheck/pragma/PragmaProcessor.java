package me.christianrobert.plpgcheck.pragma;

import me.christianrobert.plpgcheck.ast.Datum;
import me.christianrobert.plpgcheck.ast.Namespace;
import me.christianrobert.plpgcheck.ast.RecordDatum;
import me.christianrobert.plpgcheck.catalog.ColumnInfo;
import me.christianrobert.plpgcheck.catalog.PgType;
import me.christianrobert.plpgcheck.catalog.QualifiedName;
import me.christianrobert.plpgcheck.checker.CheckState;
import me.christianrobert.plpgcheck.diagnostic.Diagnostic;
import me.christianrobert.plpgcheck.diagnostic.Severity;
import me.christianrobert.plpgcheck.parser.SqlText;
import me.christianrobert.plpgcheck.routine.RoutineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies {@code plpgsql_check_pragma('...')} directives met during the walk: feature
 * switches, record type hints, run scoped tables and sequences, and echo notices.
 * A directive that cannot be applied leaves a warning and the walk goes on.
 */
public class PragmaProcessor {

    private static final Logger log = LoggerFactory.getLogger(PragmaProcessor.class);

    public static final String PRAGMA_FUNCTION = "plpgsql_check_pragma";

    private static final Pattern PRAGMA_CALL = Pattern.compile(
            "(?is)^\\s*(?:select\\s+)?(?:pg_catalog\\.|public\\.)?" + PRAGMA_FUNCTION + "\\s*\\((.*)\\)\\s*$");
    private static final String IDENT = "(?:\"(?:[^\"]|\"\")+\"|[A-Za-z_][A-Za-z_0-9$]*)";
    private static final Pattern TARGET = Pattern.compile(
            "(?s)^\\s*(" + IDENT + "(?:\\s*\\.\\s*" + IDENT + ")*)\\s*(.*)$");

    private final CheckState state;
    private boolean routineWide;

    public PragmaProcessor(CheckState state) {
        this.state = state;
    }

    /**
     * Extracts the directives of a pragma call.
     *
     * @param expressionText a PERFORM query or an initializer expression
     * @return the directive strings, empty when the text is not a pragma call
     */
    public static List<String> directives(String expressionText) {
        List<String> directives = new ArrayList<>();
        if (expressionText == null) {
            return directives;
        }
        Matcher call = PRAGMA_CALL.matcher(expressionText);
        if (!call.matches()) {
            return directives;
        }
        for (String argument : SqlText.splitTopLevel(call.group(1), ',')) {
            String value = SqlText.literalValue(argument);
            if (value != null) {
                directives.add(value);
            }
        }
        return directives;
    }

    /**
     * Applies all directives of a pragma call.
     *
     * @return {@code true} when the text was a pragma call
     */
    public boolean process(String expressionText, Namespace namespace, int lineno) {
        List<String> directives = directives(expressionText);
        for (String directive : directives) {
            apply(directive, namespace, lineno);
        }
        return !directives.isEmpty();
    }

    /**
     * Applies a pragma call of a declaration section. Its feature switches hold for the
     * rest of the routine, including the checks made after the last statement.
     */
    public boolean processDeclaration(String expressionText, Namespace namespace, int lineno) {
        routineWide = true;
        try {
            return process(expressionText, namespace, lineno);
        } finally {
            routineWide = false;
        }
    }

    public void apply(String directive, Namespace namespace, int lineno) {
        int colon = directive.indexOf(':');
        String keyword = (colon >= 0 ? directive.substring(0, colon) : directive).trim().toLowerCase(Locale.ROOT);
        String argument = colon >= 0 ? directive.substring(colon + 1).trim() : "";
        log.debug("Applying pragma \"{}\" on line {}", directive, lineno);
        try {
            switch (keyword) {
                case "enable":
                    setFeature(argument, true);
                    break;
                case "disable":
                    setFeature(argument, false);
                    break;
                case "status":
                    status(argument);
                    break;
                case "type":
                    typeHint(argument, namespace);
                    break;
                case "table":
                    table(argument);
                    break;
                case "sequence":
                    sequence(argument);
                    break;
                case "echo":
                    state.addNotice(echo(directive.substring(colon + 1)));
                    break;
                default:
                    throw new PragmaException("unknown pragma \"" + keyword + "\"");
            }
        } catch (PragmaException e) {
            state.report(Diagnostic.builder(Severity.WARNING_OTHERS,
                    "Pragma \"" + keyword + "\" on line " + lineno + " is not processed.")
                    .detail(e.getMessage()));
        }
    }

    private void setFeature(String feature, boolean enabled) throws PragmaException {
        String name = feature.toLowerCase(Locale.ROOT);
        boolean known = routineWide ? state.setRoutineFeature(name, enabled) : state.getFlags().set(name, enabled);
        if (!known) {
            throw new PragmaException("unknown feature \"" + feature + "\"");
        }
    }

    private void status(String feature) throws PragmaException {
        Boolean enabled = state.getFlags().get(feature.toLowerCase(Locale.ROOT));
        if (enabled == null) {
            throw new PragmaException("unknown feature \"" + feature + "\"");
        }
        state.addNotice(feature + " is " + (enabled ? "active" : "disabled"));
    }

    private String echo(String text) {
        RoutineDefinition routine = state.getRoutine();
        return text.trim()
                .replace("@@id", String.valueOf(routine.getId()))
                .replace("@@name", routine.getName())
                .replace("@@signature", routine.getSignature());
    }

    // ------------------------------------------------------------------ type hints

    private void typeHint(String argument, Namespace namespace) throws PragmaException {
        Matcher target = TARGET.matcher(argument);
        if (!target.matches() || target.group(2).isEmpty()) {
            throw new PragmaException("Syntax error (expected identifier)");
        }
        List<String> names = new ArrayList<>();
        for (String part : target.group(1).split("\\s*\\.\\s*")) {
            names.add(QualifiedName.normalizeIdentifier(part.trim()));
        }
        int varno = -1;
        if (namespace != null) {
            varno = names.size() == 1
                    ? namespace.lookupVariable(names.get(0))
                    : names.size() == 2 ? namespace.lookupQualified(names.get(0), names.get(1)) : -1;
        }
        if (varno < 0) {
            throw new PragmaException("Cannot to find variable \"" + String.join(".", names)
                    + "\" used in settype pragma");
        }
        Datum datum = state.getCompiled().getDatum(varno);
        if (!(datum instanceof RecordDatum) || ((RecordDatum) datum).isTyped()) {
            throw new PragmaException("Pragma \"settype\" can be applied only on variable of record type");
        }
        state.getRecords().hint(varno, new TypeSpecParser(state.getCatalog()).parseFields(target.group(2)));
    }

    // ------------------------------------------------------------------ run scoped relations

    private void table(String argument) throws PragmaException {
        Matcher target = TARGET.matcher(argument);
        if (!target.matches()) {
            throw new PragmaException("Syntax error (expected identifier)");
        }
        if (!target.group(2).startsWith("(")) {
            throw new PragmaException("Syntax error (expected table specification)");
        }
        String name = QualifiedName.parse(target.group(1)).getName();
        List<ColumnInfo> columns = new TypeSpecParser(state.getCatalog()).parseFields(target.group(2));
        state.getCatalog().addTemporaryTable(name, columns);
    }

    private void sequence(String argument) throws PragmaException {
        Matcher target = TARGET.matcher(argument);
        if (!target.matches() || !target.group(2).isEmpty()) {
            throw new PragmaException("Syntax error (expected identifier)");
        }
        state.getCatalog().addTemporarySequence(QualifiedName.parse(target.group(1)).getName());
    }

    /**
     * Resolves a type spelled in a pragma; used by the parser helpers.
     */
    static PgType requireType(PgType type, String text) throws PragmaException {
        if (type == null) {
            throw new PragmaException("type \"" + text + "\" does not exist");
        }
        return type;
    }
}
