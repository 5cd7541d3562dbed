package io.chariot.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits SQL text into tokens for formatting and highlighting. Whitespace is kept as tokens so the
 * text can be rebuilt unchanged.
 */
public final class SqlLexer {
    private SqlLexer() {
    }

    public enum TokenType {
        KEYWORD,
        IDENTIFIER,
        QUOTED_IDENTIFIER,
        STRING,
        NUMBER,
        PARAMETER,
        OPERATOR,
        PUNCTUATION,
        COMMENT,
        WHITESPACE
    }

    public record Token(TokenType type, String text, int position) {
        public Token {
            if (type == null) {
                throw new IllegalArgumentException("type required");
            }
            if (text == null || text.isEmpty()) {
                throw new IllegalArgumentException("text required");
            }
        }

        public boolean isKeyword(String keyword) {
            return type == TokenType.KEYWORD && text.equalsIgnoreCase(keyword);
        }
    }

    private static final Set<String> KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "AND", "OR", "NOT", "JOIN", "LEFT", "RIGHT", "INNER", "OUTER", "ON", "AS",
            "IS", "NULL", "IN", "INSERT", "INTO", "VALUES", "ORDER", "GROUP", "BY", "LIMIT", "OFFSET", "DISTINCT",
            "BEGIN", "COMMIT", "ROLLBACK");

    public static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int length = input.length();
        int i = 0;
        while (i < length) {
            char c = input.charAt(i);
            int pos = i;
            if (Character.isWhitespace(c)) {
                while (i < length && Character.isWhitespace(input.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.WHITESPACE, input.substring(pos, i), pos));
                continue;
            }
            switch (c) {
                case '(', ')', ',', '.', ';' -> {
                    tokens.add(new Token(TokenType.PUNCTUATION, String.valueOf(c), pos));
                    i++;
                }
                case '?' -> {
                    tokens.add(new Token(TokenType.PARAMETER, "?", pos));
                    i++;
                }
                case '\'' -> {
                    i = quoted(input, i, '\'');
                    tokens.add(new Token(TokenType.STRING, input.substring(pos, i), pos));
                }
                case '"' -> {
                    i = quoted(input, i, '"');
                    tokens.add(new Token(TokenType.QUOTED_IDENTIFIER, input.substring(pos, i), pos));
                }
                case '=', '<', '>', '!', '+', '*', '/', '%' -> {
                    i++;
                    if (i < length && (input.charAt(i) == '=' || (c == '<' && input.charAt(i) == '>'))) {
                        i++;
                    }
                    tokens.add(new Token(TokenType.OPERATOR, input.substring(pos, i), pos));
                }
                case '-' -> {
                    if (i + 1 < length && input.charAt(i + 1) == '-') {
                        while (i < length && input.charAt(i) != '\n') {
                            i++;
                        }
                        tokens.add(new Token(TokenType.COMMENT, input.substring(pos, i), pos));
                    } else {
                        i++;
                        tokens.add(new Token(TokenType.OPERATOR, "-", pos));
                    }
                }
                default -> {
                    if (Character.isDigit(c)) {
                        while (i < length && (Character.isDigit(input.charAt(i)) || input.charAt(i) == '.')) {
                            i++;
                        }
                        tokens.add(new Token(TokenType.NUMBER, input.substring(pos, i), pos));
                    } else if (isIdentifierStart(c)) {
                        while (i < length && isIdentifierPart(input.charAt(i))) {
                            i++;
                        }
                        String word = input.substring(pos, i);
                        TokenType type = KEYWORDS.contains(word.toUpperCase(Locale.ROOT))
                                ? TokenType.KEYWORD
                                : TokenType.IDENTIFIER;
                        tokens.add(new Token(type, word, pos));
                    } else {
                        throw new IllegalArgumentException("Unexpected character '" + c + "' at position " + pos);
                    }
                }
            }
        }
        return tokens;
    }

    /**
     * End of a quoted token starting at {@code start}; a doubled quote is an escaped quote.
     */
    private static int quoted(String input, int start, char quote) {
        int i = start + 1;
        while (i < input.length()) {
            if (input.charAt(i) == quote) {
                if (i + 1 < input.length() && input.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw new IllegalArgumentException("Unterminated " + quote + " at position " + start);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
