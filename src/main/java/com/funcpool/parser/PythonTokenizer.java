package com.funcpool.parser;

import com.funcpool.exception.PythonSyntaxException;
import com.funcpool.parser.PythonToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tokenizer for Python source files.
 *
 * Produces NEWLINE at the end of each logical line and INDENT/DEDENT when the indentation of a
 * logical line changes. Comments, blank lines and line continuations produce no tokens.
 */
public class PythonTokenizer {
    private static final Logger log = LoggerFactory.getLogger(PythonTokenizer.class);

    // Longest first, so that a prefix never shadows a longer operator.
    private static final List<String> OPERATORS = List.of(
        "**=", "//=", ">>=", "<<=", "...",
        "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
        "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "="
    );

    private static final Set<String> STRING_PREFIXES = Set.of(
        "r", "u", "b", "br", "rb", "f", "fr", "rf"
    );

    private static final int TAB_SIZE = 8;

    private final String source;
    private final String fileName;
    private final List<PythonToken> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<PythonToken> brackets = new ArrayDeque<>();
    private int pos = 0;
    private int line;
    private int column = 1;
    private boolean atLineStart = true;

    public PythonTokenizer(String source, String fileName) {
        this(source, fileName, 1);
    }

    public PythonTokenizer(String source, String fileName, int firstLine) {
        this.source = normalizeLineEndings(source);
        this.fileName = fileName;
        this.line = firstLine;
    }

    private static String normalizeLineEndings(String src) {
        String text = src.startsWith("\uFEFF") ? src.substring(1) : src;
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Tokenize the entire source file.
     */
    public List<PythonToken> tokenize() {
        indents.push(0);

        while (pos < source.length()) {
            if (atLineStart && brackets.isEmpty()) {
                if (!readIndentation()) {
                    continue;
                }
            }
            if (pos >= source.length()) {
                break;
            }

            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                advance();
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                readContinuation();
            } else if (c == '\n') {
                if (brackets.isEmpty()) {
                    add(TokenType.NEWLINE, "", line, column);
                    atLineStart = true;
                }
                advance();
            } else if (isIdentifierStart(c)) {
                readNameOrString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length()
                    && Character.isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '\'' || c == '"') {
                readString("", line, column);
            } else {
                readOperator();
            }
        }

        if (!brackets.isEmpty()) {
            PythonToken open = brackets.peek();
            throw new PythonSyntaxException("'" + open.getValue() + "' was never closed",
                    fileName, open.getLine(), open.getColumn());
        }
        if (!tokens.isEmpty() && last().getType() != TokenType.NEWLINE
                && last().getType() != TokenType.DEDENT) {
            add(TokenType.NEWLINE, "", line, column);
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenType.DEDENT, "", line, column);
        }
        add(TokenType.ENDMARKER, "", line, column);
        log.trace("Tokenized {} into {} tokens", fileName, tokens.size());
        return tokens;
    }

    /**
     * Measures the indentation of a new line and emits INDENT/DEDENT tokens. Returns false when
     * the line is blank or comment-only and has been consumed.
     */
    private boolean readIndentation() {
        int width = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            advance();
        }
        if (pos >= source.length()) {
            return false;
        }
        char c = source.charAt(pos);
        if (c == '\n') {
            advance();
            return false;
        }
        if (c == '#') {
            skipComment();
            if (pos < source.length()) {
                advance();
            }
            return false;
        }

        atLineStart = false;
        if (width > indents.peek()) {
            indents.push(width);
            add(TokenType.INDENT, "", line, column);
        } else {
            while (width < indents.peek()) {
                indents.pop();
                add(TokenType.DEDENT, "", line, column);
            }
            if (width != indents.peek()) {
                throw error("unindent does not match any outer indentation level");
            }
        }
        return true;
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            advance();
        }
    }

    private void readContinuation() {
        if (pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
            advance();
            advance();
            return;
        }
        throw error("unexpected character after line continuation character");
    }

    private void readNameOrString() {
        int startLine = line;
        int startCol = column;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            sb.append(source.charAt(pos));
            advance();
        }
        String value = sb.toString();

        if (pos < source.length() && (source.charAt(pos) == '\'' || source.charAt(pos) == '"')
                && STRING_PREFIXES.contains(value.toLowerCase(Locale.ROOT))) {
            readString(value, startLine, startCol);
            return;
        }
        add(TokenType.NAME, value, startLine, startCol);
    }

    private void readNumber() {
        int startLine = line;
        int startCol = column;
        int start = pos;

        if (source.charAt(pos) == '0' && pos + 1 < source.length()
                && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            advance();
            advance();
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                advance();
            }
        } else {
            skipDigits();
            if (pos < source.length() && source.charAt(pos) == '.') {
                advance();
                skipDigits();
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                advance();
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    advance();
                }
                if (pos >= source.length() || !Character.isDigit(source.charAt(pos))) {
                    pos = mark;
                    throw error("invalid decimal literal");
                }
                skipDigits();
            }
            if (pos < source.length() && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
                advance();
            }
        }
        if (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            throw error("invalid decimal literal");
        }
        add(TokenType.NUMBER, source.substring(start, pos), startLine, startCol);
    }

    private void skipDigits() {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            advance();
        }
    }

    /**
     * Reads a string literal whose prefix has already been consumed. The token value is the full
     * literal text including prefix and quotes; decoding is left to the parser.
     */
    private void readString(String prefix, int startLine, int startCol) {
        int start = pos;
        char quote = source.charAt(pos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), pos);
        String closing = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
        boolean formatted = prefix.toLowerCase(Locale.ROOT).contains("f");
        for (int i = 0; i < closing.length(); i++) {
            advance();
        }

        int depth = 0;
        while (true) {
            if (pos >= source.length()) {
                throw new PythonSyntaxException(triple ? "unterminated triple-quoted string literal"
                        : "unterminated string literal", fileName, startLine, startCol);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < source.length()) {
                    advance();
                }
            } else if (c == '\n' && !triple && depth == 0) {
                throw new PythonSyntaxException("unterminated string literal", fileName, startLine, startCol);
            } else if (formatted && c == '{') {
                if (depth == 0 && source.startsWith("{{", pos)) {
                    advance();
                } else {
                    depth++;
                }
                advance();
            } else if (formatted && c == '}' && depth > 0) {
                depth--;
                advance();
            } else if (formatted && depth > 0 && (c == '\'' || c == '"')) {
                skipNestedString();
            } else if (depth == 0 && source.startsWith(closing, pos)) {
                for (int i = 0; i < closing.length(); i++) {
                    advance();
                }
                break;
            } else {
                advance();
            }
        }
        add(TokenType.STRING, prefix + source.substring(start, pos), startLine, startCol);
    }

    private void skipNestedString() {
        char quote = source.charAt(pos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), pos);
        String closing = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
        for (int i = 0; i < closing.length(); i++) {
            advance();
        }
        while (pos < source.length() && !source.startsWith(closing, pos)) {
            if (source.charAt(pos) == '\\') {
                advance();
            }
            if (pos < source.length()) {
                advance();
            }
        }
        for (int i = 0; i < closing.length() && pos < source.length(); i++) {
            advance();
        }
    }

    private void readOperator() {
        int startLine = line;
        int startCol = column;
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                for (int i = 0; i < op.length(); i++) {
                    advance();
                }
                PythonToken token = add(TokenType.OP, op, startLine, startCol);
                trackBracket(token);
                return;
            }
        }
        throw error("invalid character '" + source.charAt(pos) + "'");
    }

    private void trackBracket(PythonToken token) {
        switch (token.getValue()) {
            case "(", "[", "{" -> brackets.push(token);
            case ")", "]", "}" -> {
                if (brackets.isEmpty()) {
                    throw new PythonSyntaxException("unmatched '" + token.getValue() + "'",
                            fileName, token.getLine(), token.getColumn());
                }
                PythonToken open = brackets.pop();
                if (!matches(open.getValue(), token.getValue())) {
                    throw new PythonSyntaxException("closing parenthesis '" + token.getValue()
                            + "' does not match opening parenthesis '" + open.getValue() + "'",
                            fileName, token.getLine(), token.getColumn());
                }
            }
            default -> {
            }
        }
    }

    private static boolean matches(String open, String close) {
        return (open.equals("(") && close.equals(")"))
                || (open.equals("[") && close.equals("]"))
                || (open.equals("{") && close.equals("}"));
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private PythonToken add(TokenType type, String value, int tokenLine, int tokenColumn) {
        PythonToken token = new PythonToken(type, value, tokenLine, tokenColumn);
        tokens.add(token);
        return token;
    }

    private PythonToken last() {
        return tokens.get(tokens.size() - 1);
    }

    private PythonSyntaxException error(String message) {
        return new PythonSyntaxException(message, fileName, line, column);
    }
}
