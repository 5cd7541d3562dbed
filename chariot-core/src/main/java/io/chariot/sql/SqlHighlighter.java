package io.chariot.sql;

import io.chariot.sql.SqlLexer.Token;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/**
 * ANSI syntax coloring of SQL text for the terminal.
 */
public final class SqlHighlighter {

    private static final AttributedStyle KEYWORD = AttributedStyle.BOLD.foreground(AttributedStyle.BLUE);
    private static final AttributedStyle QUOTED = AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN);
    private static final AttributedStyle STRING = AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN);
    private static final AttributedStyle NUMBER = AttributedStyle.DEFAULT.foreground(AttributedStyle.MAGENTA);
    private static final AttributedStyle PARAMETER = AttributedStyle.BOLD.foreground(AttributedStyle.YELLOW);
    private static final AttributedStyle COMMENT = AttributedStyle.DEFAULT.italic().faint();

    private SqlHighlighter() {
    }

    public static String highlight(String sql) {
        AttributedStringBuilder builder = new AttributedStringBuilder(sql.length() * 2);
        for (Token token : SqlLexer.tokenize(sql)) {
            AttributedStyle style = switch (token.type()) {
                case KEYWORD -> KEYWORD;
                case QUOTED_IDENTIFIER -> QUOTED;
                case STRING -> STRING;
                case NUMBER -> NUMBER;
                case PARAMETER -> PARAMETER;
                case COMMENT -> COMMENT;
                default -> null;
            };
            if (style == null) {
                builder.append(token.text());
            } else {
                builder.styled(style, token.text());
            }
        }
        return builder.toAnsi();
    }
}
