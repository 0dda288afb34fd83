package io.cortexr.sandbox;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for plan code. Produces Python-style NEWLINE, INDENT and DEDENT tokens;
 * line breaks inside brackets are ignored.
 */
final class PlanLexer {

    enum Type { NAME, NUMBER, STRING, FSTRING, OP, NEWLINE, INDENT, DEDENT, EOF }

    record Token(Type type, String text, int line) {
        boolean is(Type t, String value) {
            return type == t && text.equals(value);
        }

        boolean isOp(String value) {
            return is(Type.OP, value);
        }

        boolean isKeyword(String value) {
            return is(Type.NAME, value);
        }
    }

    private static final Set<String> TWO_CHAR_OPS = Set.of(
            "==", "!=", "<=", ">=", "//", "**", "->", "+=", "-=", "*=");
    private static final String SINGLE_CHAR_OPS = "+-*/%<>=()[]{},:.";

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int depth;

    private PlanLexer(String src) {
        this.src = src.replace("\r\n", "\n").replace('\r', '\n');
        indents.push(0);
    }

    static List<Token> tokenize(String src) {
        PlanLexer lexer = new PlanLexer(src);
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        boolean atLineStart = true;
        while (pos < src.length()) {
            if (atLineStart && depth == 0) {
                if (!handleIndentation()) {
                    continue;
                }
                atLineStart = false;
            }
            char c = src.charAt(pos);
            if (c == '\n') {
                if (depth == 0) {
                    emitNewline();
                    atLineStart = true;
                }
                pos++;
                line++;
            } else if (c == ' ' || c == '\t') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && peek(1) == '\n') {
                pos += 2;
                line++;
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readNameOrPrefixedString();
            } else if (c == '"' || c == '\'') {
                tokens.add(new Token(Type.STRING, readString(false), line));
            } else {
                readOperator();
            }
        }
        emitNewline();
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token(Type.DEDENT, "", line));
        }
        tokens.add(new Token(Type.EOF, "", line));
    }

    /**
     * Measures the indentation of the current line and emits INDENT/DEDENT tokens.
     * Returns false when the line is blank or a comment and has been consumed.
     */
    private boolean handleIndentation() {
        int col = 0;
        while (pos < src.length() && (src.charAt(pos) == ' ' || src.charAt(pos) == '\t')) {
            col += src.charAt(pos) == '\t' ? 4 : 1;
            pos++;
        }
        if (pos >= src.length()) {
            return false;
        }
        char c = src.charAt(pos);
        if (c == '\n' || c == '#') {
            if (c == '#') {
                skipComment();
            }
            if (pos < src.length()) {
                pos++;
                line++;
            }
            return false;
        }
        if (col > indents.peek()) {
            indents.push(col);
            tokens.add(new Token(Type.INDENT, "", line));
        }
        while (col < indents.peek()) {
            indents.pop();
            tokens.add(new Token(Type.DEDENT, "", line));
        }
        if (col != indents.peek()) {
            throw new PlanSyntaxException("inconsistent indentation", line);
        }
        return true;
    }

    private void emitNewline() {
        if (!tokens.isEmpty()) {
            Type last = tokens.get(tokens.size() - 1).type();
            if (last != Type.NEWLINE && last != Type.INDENT && last != Type.DEDENT) {
                tokens.add(new Token(Type.NEWLINE, "", line));
            }
        }
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
        }
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private void readNumber() {
        int start = pos;
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        if (pos < src.length() && src.charAt(pos) == '.' && Character.isDigit(peek(1))) {
            pos++;
            while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                pos++;
            }
        } else if (pos < src.length() && src.charAt(pos) == '.' && !Character.isLetter(peek(1))) {
            pos++;
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        tokens.add(new Token(Type.NUMBER, src.substring(start, pos).replace("_", ""), line));
    }

    private void readNameOrPrefixedString() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        String name = src.substring(start, pos);
        char next = pos < src.length() ? src.charAt(pos) : '\0';
        if ((next == '"' || next == '\'') && isStringPrefix(name)) {
            String lower = name.toLowerCase();
            boolean raw = lower.contains("r");
            String value = readString(raw);
            tokens.add(new Token(lower.contains("f") ? Type.FSTRING : Type.STRING, value, line));
            return;
        }
        tokens.add(new Token(Type.NAME, name, line));
    }

    private static boolean isStringPrefix(String name) {
        String lower = name.toLowerCase();
        return lower.equals("f") || lower.equals("r") || lower.equals("fr") || lower.equals("rf")
                || lower.equals("b") || lower.equals("u");
    }

    private String readString(boolean raw) {
        char quote = src.charAt(pos);
        boolean triple = peek(1) == quote && peek(2) == quote;
        pos += triple ? 3 : 1;
        int startLine = line;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw new PlanSyntaxException("unterminated string literal", startLine);
            }
            char c = src.charAt(pos);
            if (c == quote) {
                if (!triple) {
                    pos++;
                    return sb.toString();
                }
                if (peek(1) == quote && peek(2) == quote) {
                    pos += 3;
                    return sb.toString();
                }
            }
            if (c == '\n') {
                if (!triple) {
                    throw new PlanSyntaxException("unterminated string literal", startLine);
                }
                line++;
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char e = src.charAt(pos + 1);
                if (raw) {
                    sb.append(c).append(e);
                } else {
                    switch (e) {
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        case 'r' -> sb.append('\r');
                        case '0' -> sb.append('\0');
                        case '\\' -> sb.append('\\');
                        case '\'' -> sb.append('\'');
                        case '"' -> sb.append('"');
                        case '\n' -> line++;
                        default -> sb.append(c).append(e);
                    }
                }
                pos += 2;
                continue;
            }
            sb.append(c);
            pos++;
        }
    }

    private void readOperator() {
        String two = pos + 2 <= src.length() ? src.substring(pos, pos + 2) : "";
        if (TWO_CHAR_OPS.contains(two)) {
            tokens.add(new Token(Type.OP, two, line));
            pos += 2;
            return;
        }
        char c = src.charAt(pos);
        if (SINGLE_CHAR_OPS.indexOf(c) < 0) {
            throw new PlanSyntaxException("unexpected character '" + c + "'", line);
        }
        if (c == '(' || c == '[' || c == '{') {
            depth++;
        } else if (c == ')' || c == ']' || c == '}') {
            depth = Math.max(0, depth - 1);
        }
        tokens.add(new Token(Type.OP, String.valueOf(c), line));
        pos++;
    }
}
