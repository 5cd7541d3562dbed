package io.chariot.sql;

import io.chariot.sql.SqlLexer.Token;
import io.chariot.sql.SqlLexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reindents SQL for reading: one select column per line, and a new line for each FROM, JOIN,
 * WHERE and AND clause outside parentheses. Text inside parentheses stays on one line.
 */
public final class SqlFormatter {

    private static final String SELECT_INDENT = "       ";
    private static final String AND_INDENT = "  ";
    private static final Set<String> CLAUSES = Set.of("FROM", "WHERE", "LEFT", "RIGHT", "INNER", "JOIN", "ORDER",
            "GROUP", "LIMIT", "VALUES");

    private SqlFormatter() {
    }

    public static String format(String sql) {
        List<Token> tokens = new ArrayList<>();
        for (Token token : SqlLexer.tokenize(sql)) {
            if (token.type() != TokenType.WHITESPACE) {
                tokens.add(token);
            }
        }
        StringBuilder out = new StringBuilder(sql.length() + 64);
        int depth = 0;
        boolean inSelectList = false;
        Token previous = null;
        for (Token token : tokens) {
            String text = token.text();
            if (depth == 0 && previous != null && startsClause(token, previous)) {
                out.append('\n');
                inSelectList = false;
            } else if (depth == 0 && token.isKeyword("AND")) {
                out.append('\n').append(AND_INDENT);
            } else if (previous != null
                    && (previous.type() == TokenType.COMMENT || token.type() == TokenType.COMMENT)) {
                out.append('\n');
            } else if (previous != null && needsSpace(previous, token)) {
                out.append(' ');
            }
            out.append(token.type() == TokenType.KEYWORD ? text.toUpperCase(Locale.ROOT) : text);

            if (token.isKeyword("SELECT") && depth == 0) {
                inSelectList = true;
            } else if (text.equals("(")) {
                depth++;
            } else if (text.equals(")")) {
                depth = Math.max(0, depth - 1);
            } else if (text.equals(",") && depth == 0 && inSelectList) {
                out.append('\n').append(SELECT_INDENT);
                previous = null;
                continue;
            }
            previous = token;
        }
        return out.toString();
    }

    private static boolean startsClause(Token token, Token previous) {
        if (token.type() != TokenType.KEYWORD || !CLAUSES.contains(token.text().toUpperCase(Locale.ROOT))) {
            return false;
        }
        // LEFT OUTER JOIN and INNER JOIN break before the first word only
        if (token.isKeyword("JOIN")) {
            return !(previous.isKeyword("LEFT") || previous.isKeyword("RIGHT") || previous.isKeyword("INNER")
                    || previous.isKeyword("OUTER"));
        }
        return true;
    }

    private static boolean needsSpace(Token previous, Token token) {
        String text = token.text();
        if (text.equals(",") || text.equals(")") || text.equals(".") || text.equals(";")) {
            return false;
        }
        String before = previous.text();
        return !before.equals("(") && !before.equals(".");
    }
}
