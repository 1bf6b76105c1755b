package logiceval.ir;

import java.util.Objects;

/**
 * Argument or target of an instruction: the literal {@code 0}/{@code 1}, a temporary, or a
 * user-visible name (variable or rule).
 */
public final class Operand {
    public enum Kind {
        LITERAL,
        TEMP,
        NAME
    }

    public static final Operand ZERO = new Operand(Kind.LITERAL, "0");
    public static final Operand ONE = new Operand(Kind.LITERAL, "1");

    /**
     * Target that keeps a bare variable or literal expression from lowering to an empty block.
     */
    public static final Operand NO_OP_RESULT = new Operand(Kind.TEMP, "t_res");

    private final Kind kind;
    private final String text;

    private Operand(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static Operand literal(boolean value) {
        return value ? ONE : ZERO;
    }

    public static Operand temp(int index) {
        return new Operand(Kind.TEMP, "t" + index);
    }

    public static Operand name(String name) {
        return new Operand(Kind.NAME, name);
    }

    /**
     * Reads an operand from its printed form. {@code t<digits>} and {@code t_res} are taken to
     * be temporaries, so user names of that shape cannot be written textually.
     */
    public static Operand parse(String text) {
        if ("0".equals(text)) {
            return ZERO;
        }
        if ("1".equals(text)) {
            return ONE;
        }
        if (text.matches("t\\d+") || NO_OP_RESULT.text.equals(text)) {
            return new Operand(Kind.TEMP, text);
        }
        return name(text);
    }

    public Kind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public boolean isTemp() {
        return kind == Kind.TEMP;
    }

    public boolean isName() {
        return kind == Kind.NAME;
    }

    public boolean isLiteral(int value) {
        return isLiteral() && literalValue() == value;
    }

    public int literalValue() {
        if (!isLiteral()) {
            throw new IllegalStateException("Not a literal: " + text);
        }
        return ONE.text.equals(text) ? 1 : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Operand)) {
            return false;
        }
        Operand other = (Operand) o;
        return kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
