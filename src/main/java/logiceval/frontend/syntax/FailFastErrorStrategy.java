package logiceval.frontend.syntax;

import logiceval.exception.SyntaxException;
import logiceval.frontend.grammar.LogicParser;
import logiceval.frontend.lexer.TokenKind;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Error strategy that gives up on the first bad token. ANTLR's default single-token
 * insertion and deletion is never attempted.
 */
class FailFastErrorStrategy extends DefaultErrorStrategy {

    @Override
    public void reportError(org.antlr.v4.runtime.Parser recognizer, RecognitionException e) {
        throw syntaxError(e.getOffendingToken(), e.getExpectedTokens());
    }

    @Override
    public void recover(org.antlr.v4.runtime.Parser recognizer, RecognitionException e) {
        throw syntaxError(e.getOffendingToken(), e.getExpectedTokens());
    }

    @Override
    public Token recoverInline(org.antlr.v4.runtime.Parser recognizer) {
        throw syntaxError(recognizer.getCurrentToken(), recognizer.getExpectedTokens());
    }

    @Override
    public void sync(org.antlr.v4.runtime.Parser recognizer) {
    }

    private static SyntaxException syntaxError(Token found, IntervalSet expected) {
        return new SyntaxException(describe(expected), kindOf(found.getType()).name(),
                found.getLine(), found.getCharPositionInLine() + 1);
    }

    private static String describe(IntervalSet expected) {
        if (expected == null || expected.isNil()) {
            return "a statement";
        }
        Set<TokenKind> kinds = new LinkedHashSet<>();
        for (int type : expected.toList()) {
            if (type != Token.EPSILON) {
                kinds.add(kindOf(type));
            }
        }
        StringJoiner joined = new StringJoiner(" or ");
        for (TokenKind kind : kinds) {
            joined.add(kind.name());
        }
        return joined.toString();
    }

    // An expression name is an identifier to the user.
    private static TokenKind kindOf(int antlrType) {
        if (antlrType == LogicParser.EXPR_NAME) {
            return TokenKind.IDENTIFIER;
        }
        return TokenKind.fromAntlrType(antlrType);
    }
}
