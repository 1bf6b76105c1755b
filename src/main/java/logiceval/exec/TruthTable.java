package logiceval.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * Truth table over sorted input variables. Rows run in binary counting order with the
 * first variable as the most significant bit.
 */
public final class TruthTable {
    private final List<String> variables;
    private final List<int[]> inputs = new ArrayList<>();
    private final List<Integer> results = new ArrayList<>();

    TruthTable(List<String> variables) {
        this.variables = List.copyOf(variables);
    }

    void addRow(int[] values, int result) {
        inputs.add(values.clone());
        results.add(result);
    }

    public List<String> getVariables() {
        return variables;
    }

    public int getRowCount() {
        return results.size();
    }

    public int[] getInputs(int row) {
        return inputs.get(row).clone();
    }

    public int getResult(int row) {
        return results.get(row);
    }

    public String header() {
        return String.join(" | ", variables) + " | Result";
    }

    public List<String> render() {
        List<String> lines = new ArrayList<>();
        String header = header();
        lines.add(header);
        lines.add("-".repeat(header.length()));
        for (int row = 0; row < results.size(); row++) {
            StringBuilder sb = new StringBuilder();
            for (int value : inputs.get(row)) {
                sb.append(value).append(" | ");
            }
            sb.append(results.get(row));
            lines.add(sb.toString());
        }
        return lines;
    }
}
