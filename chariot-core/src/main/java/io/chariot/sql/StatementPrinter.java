package io.chariot.sql;

import java.io.PrintStream;

/**
 * Prints statements reindented and, when enabled, colored. Bound parameters follow as a comment
 * line.
 */
public final class StatementPrinter {

    private final PrintStream out;
    private final boolean color;

    public StatementPrinter(PrintStream out, boolean color) {
        if (out == null) {
            throw new IllegalArgumentException("out required");
        }
        this.out = out;
        this.color = color;
    }

    public void print(Statement statement) {
        out.println(render(statement));
    }

    public String render(Statement statement) {
        String text = SqlFormatter.format(statement.sql());
        if (!statement.parameters().isEmpty()) {
            text = text + "\n-- parameters: " + statement.parameters();
        }
        return color ? SqlHighlighter.highlight(text) : text;
    }
}
