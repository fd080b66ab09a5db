package me.christianrobert.plpgcheck.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.plpgcheck.antlr.PlPgSqlLexer;
import me.christianrobert.plpgcheck.antlr.PlPgSqlParser;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionContextCache;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the generated PL/pgSQL parser.
 *
 * Uses a two-stage strategy: SLL(*) with a bail-out error strategy first, then LL(*) with
 * full error recovery when SLL fails. The static DFA and prediction context caches are
 * cleared after every parse so that batch checks over many routines do not accumulate them.
 */
@Dependent
public class RoutineParser {

    private static final Logger log = LoggerFactory.getLogger(RoutineParser.class);

    /**
     * Parses a routine body, the text between the dollar quotes of CREATE FUNCTION.
     *
     * @param source routine body
     * @return ParseResult containing the parse tree and any errors
     */
    public ParseResult parseBody(String source) {
        if (source == null || source.trim().isEmpty()) {
            throw new RoutineCompileException("42601", "routine body is empty", 0);
        }

        log.debug("Parsing routine body: {}", source.substring(0, Math.min(100, source.length())));

        CharStream input = CharStreams.fromString(source);
        PlPgSqlLexer lexer = new PlPgSqlLexer(input);
        lexer.removeErrorListeners();
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        List<String> errors = new ArrayList<>();
        int[] firstErrorLine = {0};
        PlPgSqlParser parser = null;
        PlPgSqlParser.PlFunctionContext tree;

        try {
            parser = new PlPgSqlParser(tokens);
            parser.getInterpreter().clearDFA();
            parser.removeErrorListeners();
            parser.setErrorHandler(new BailErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

            try {
                tree = parser.plFunction();
                log.trace("SLL(*) parse succeeded");
            } catch (ParseCancellationException sllException) {
                log.trace("SLL(*) parse failed, falling back to LL(*)");

                tokens.seek(0);
                parser.reset();
                parser.removeErrorListeners();
                parser.setErrorHandler(new DefaultErrorStrategy());
                parser.getInterpreter().setPredictionMode(PredictionMode.LL);
                parser.addErrorListener(new BaseErrorListener() {
                    @Override
                    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                            int line, int charPositionInLine, String msg,
                                            RecognitionException e) {
                        String error = String.format("Line %d:%d - %s", line, charPositionInLine, msg);
                        if (errors.isEmpty()) {
                            firstErrorLine[0] = line;
                        }
                        errors.add(error);
                        log.debug("Parse error: {}", error);
                    }
                });

                tree = parser.plFunction();
            }

            return new ParseResult(tree, tokens, errors, firstErrorLine[0], source);

        } finally {
            if (parser != null) {
                parser.getInterpreter().clearDFA();
                clearPredictionContextCache(parser.getInterpreter().getSharedContextCache());
            }
        }
    }

    /**
     * Clears the PredictionContextCache via reflection; it has no public clear method.
     */
    private void clearPredictionContextCache(PredictionContextCache cache) {
        if (cache == null) {
            return;
        }
        try {
            Field cacheField = PredictionContextCache.class.getDeclaredField("cache");
            cacheField.setAccessible(true);
            Map<?, ?> internalCache = (Map<?, ?>) cacheField.get(cache);
            if (internalCache != null) {
                internalCache.clear();
            }
        } catch (NoSuchFieldException | IllegalAccessException e) {
            log.warn("Failed to clear PredictionContextCache via reflection: {}", e.getMessage());
        }
    }
}
