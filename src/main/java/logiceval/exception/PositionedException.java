package logiceval.exception;

/**
 * Failure tied to a place in the source text. Columns are 1-based.
 */
public abstract class PositionedException extends LogicEvalException {
    private final int line;
    private final int column;

    protected PositionedException(ErrorKind kind, String stage, int line, int column, String detail) {
        super(kind, stage + " at " + line + ":" + column + ": " + detail);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
