package logiceval.exception;

/**
 * Raised by the parser on the first token that does not fit the grammar.
 */
public class SyntaxException extends PositionedException {
    private final String expected;
    private final String found;

    public SyntaxException(String expected, String found, int line, int column) {
        super(ErrorKind.PARSE, "Parse error", line, column, "expected " + expected + ", found " + found);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
