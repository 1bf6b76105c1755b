package logiceval.frontend.lexer;

import logiceval.exception.LexicalException;
import logiceval.frontend.grammar.LogicLexer;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.Interval;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns source text into tokens, ending with a single EOF token.
 * Whitespace is skipped; there are no comments or string literals.
 */
public class Scanner {
    private final String source;

    public Scanner(String source) {
        this.source = source;
    }

    public List<Token> scan() {
        LogicLexer lexer = new LogicLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg, RecognitionException e) {
                throw new LexicalException(offendingText(e, msg), line, charPositionInLine + 1);
            }
        });

        List<Token> tokens = new ArrayList<>();
        while (true) {
            org.antlr.v4.runtime.Token t = lexer.nextToken();
            TokenKind kind = TokenKind.fromAntlrType(t.getType());
            String text = kind == TokenKind.EOF ? "" : t.getText();
            tokens.add(new Token(kind, text, t.getLine(), t.getCharPositionInLine() + 1));
            if (kind == TokenKind.EOF) {
                return tokens;
            }
        }
    }

    private static String offendingText(RecognitionException e, String msg) {
        if (e instanceof LexerNoViableAltException) {
            LexerNoViableAltException noViableAlt = (LexerNoViableAltException) e;
            int start = noViableAlt.getStartIndex();
            return noViableAlt.getInputStream().getText(Interval.of(start, start));
        }
        return msg;
    }
}
