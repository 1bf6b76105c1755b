package logiceval.frontend.lexer;

import org.antlr.v4.runtime.CommonToken;

public final class Token {
    private final TokenKind kind;
    private final String text;
    private final int line;
    private final int column;

    public Token(TokenKind kind, String text, int line, int column) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    // 1-based
    public int getColumn() {
        return column;
    }

    /**
     * Rebuilds the token in the form the generated parser consumes.
     */
    public org.antlr.v4.runtime.Token toAntlrToken() {
        CommonToken token = new CommonToken(kind.getAntlrType(), kind == TokenKind.EOF ? "<EOF>" : text);
        token.setLine(line);
        token.setCharPositionInLine(column - 1);
        return token;
    }

    @Override
    public String toString() {
        return "<" + kind + " " + text + " " + line + ":" + column + ">";
    }
}
