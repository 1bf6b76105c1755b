package logiceval.frontend.lexer;

import logiceval.frontend.grammar.LogicLexer;

import java.util.HashMap;
import java.util.Map;

/**
 * Token kinds of the logic language, each tied to the token type the generated lexer emits.
 */
public enum TokenKind {
    IDENTIFIER(LogicLexer.ID),
    BOOL(LogicLexer.BOOL),
    KW_EXPR(LogicLexer.KW_EXPR),
    KW_SET(LogicLexer.KW_SET),
    KW_TABLE(LogicLexer.KW_TABLE),
    KW_EVAL(LogicLexer.KW_EVAL),
    KW_INFER(LogicLexer.KW_INFER),
    AND(LogicLexer.AND),
    OR(LogicLexer.OR),
    NOT(LogicLexer.NOT),
    XOR(LogicLexer.XOR),
    IMPLIES(LogicLexer.IMPLIES),
    LPAREN(LogicLexer.LPAREN),
    RPAREN(LogicLexer.RPAREN),
    SEMICOLON(LogicLexer.SEMI),
    EQUAL(LogicLexer.EQUAL),
    COLON(LogicLexer.COLON),
    COMMA(LogicLexer.COMMA),
    EOF(LogicLexer.EOF);

    private static final Map<Integer, TokenKind> BY_ANTLR_TYPE = new HashMap<>();

    static {
        for (TokenKind kind : values()) {
            BY_ANTLR_TYPE.put(kind.antlrType, kind);
        }
    }

    private final int antlrType;

    TokenKind(int antlrType) {
        this.antlrType = antlrType;
    }

    public int getAntlrType() {
        return antlrType;
    }

    public static TokenKind fromAntlrType(int antlrType) {
        TokenKind kind = BY_ANTLR_TYPE.get(antlrType);
        if (kind == null) {
            throw new IllegalArgumentException("No token kind for lexer type " + antlrType);
        }
        return kind;
    }
}
