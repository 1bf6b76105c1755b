package logiceval.ir;

/**
 * Logic operators of three-address code with their truth functions over 0/1.
 */
public enum Opcode {
    AND(2) {
        @Override
        public int apply(int a, int b) {
            return a == 1 && b == 1 ? 1 : 0;
        }
    },
    OR(2) {
        @Override
        public int apply(int a, int b) {
            return a == 1 || b == 1 ? 1 : 0;
        }
    },
    XOR(2) {
        @Override
        public int apply(int a, int b) {
            return a != b ? 1 : 0;
        }
    },
    IMPLIES(2) {
        @Override
        public int apply(int a, int b) {
            return a == 0 || b == 1 ? 1 : 0;
        }
    },
    NOT(1) {
        // second argument ignored
        @Override
        public int apply(int a, int b) {
            return a == 0 ? 1 : 0;
        }
    };

    private final int arity;

    Opcode(int arity) {
        this.arity = arity;
    }

    public int getArity() {
        return arity;
    }

    public abstract int apply(int a, int b);

    public static boolean isOpcode(String word) {
        for (Opcode op : values()) {
            if (op.name().equals(word)) {
                return true;
            }
        }
        return false;
    }
}
