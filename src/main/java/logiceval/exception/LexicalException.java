package logiceval.exception;

public class LexicalException extends PositionedException {
    private final String offending;

    public LexicalException(String offending, int line, int column) {
        super(ErrorKind.LEXICAL, "Lexical error", line, column, "unexpected character '" + offending + "'");
        this.offending = offending;
    }

    public String getOffending() {
        return offending;
    }
}
