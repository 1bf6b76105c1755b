package logiceval.frontend.syntax;

import logiceval.frontend.grammar.LogicParser;
import logiceval.frontend.lexer.Token;
import logiceval.frontend.lexer.TokenKind;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ListTokenSource;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parses a scanned token list into a {@link Ast.Program}. Stops at the first error with a
 * {@link logiceval.exception.SyntaxException} naming the expected and the found token kinds.
 */
public class Parser {
    private static final Set<TokenKind> EXPRESSION_START =
            EnumSet.of(TokenKind.IDENTIFIER, TokenKind.BOOL, TokenKind.NOT, TokenKind.LPAREN);

    private final List<Token> tokens;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public Ast.Program parse() {
        List<org.antlr.v4.runtime.Token> antlrTokens = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            CommonToken token = (CommonToken) tokens.get(i).toAntlrToken();
            if (isExpressionName(i)) {
                token.setType(LogicParser.EXPR_NAME);
            }
            antlrTokens.add(token);
        }
        LogicParser parser = new LogicParser(new CommonTokenStream(new ListTokenSource(antlrTokens)));
        parser.removeErrorListeners();
        parser.setErrorHandler(new FailFastErrorStrategy());
        return new StatementBuilder().buildProgram(parser.program());
    }

    // expr NAME <expression>: the identifier after 'expr' names the statement only if
    // the token after it can start an expression.
    private boolean isExpressionName(int i) {
        return i > 0 && i + 1 < tokens.size()
                && tokens.get(i - 1).getKind() == TokenKind.KW_EXPR
                && tokens.get(i).getKind() == TokenKind.IDENTIFIER
                && EXPRESSION_START.contains(tokens.get(i + 1).getKind());
    }
}
