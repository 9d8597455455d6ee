package com.funcpool.parser;

import com.funcpool.exception.PythonSyntaxException;
import com.funcpool.model.syntax.ConstantKind;
import com.funcpool.model.syntax.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes string literal tokens, joins implicitly concatenated literals and parses f-string
 * replacement fields.
 */
class StringLiteralParser {

    private final String fileName;

    StringLiteralParser(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Combines adjacent string tokens into one constant, or into a JoinedStr when any of them is
     * an f-string.
     */
    Expr combine(List<PythonToken> parts) {
        boolean anyBytes = false;
        boolean anyText = false;
        boolean anyFormatted = false;
        for (PythonToken part : parts) {
            String prefix = prefixOf(part.getValue());
            if (prefix.contains("b")) {
                anyBytes = true;
            } else {
                anyText = true;
            }
            anyFormatted |= prefix.contains("f");
        }
        if (anyBytes && anyText) {
            throw error(parts.get(0), "cannot mix bytes and nonbytes literals");
        }

        if (!anyFormatted) {
            StringBuilder value = new StringBuilder();
            for (PythonToken part : parts) {
                value.append(decodePlain(part, anyBytes));
            }
            return new Expr.Constant(anyBytes ? ConstantKind.BYTES : ConstantKind.STRING, value.toString());
        }

        List<Expr> values = new ArrayList<>();
        for (PythonToken part : parts) {
            String prefix = prefixOf(part.getValue());
            if (prefix.contains("f")) {
                String body = bodyOf(part.getValue(), prefix);
                FieldScanner scanner = new FieldScanner(body, prefix.contains("r"), part);
                appendAll(values, scanner.parseUntil(false));
            } else {
                appendAll(values, List.of(Expr.Constant.string(decodePlain(part, false))));
            }
        }
        return new Expr.JoinedStr(values);
    }

    /**
     * Appends values, merging adjacent string constants and dropping empty ones.
     */
    private static void appendAll(List<Expr> values, List<Expr> additions) {
        for (Expr addition : additions) {
            if (addition instanceof Expr.Constant constant) {
                if (constant.getValue().isEmpty()) {
                    continue;
                }
                if (!values.isEmpty() && values.get(values.size() - 1) instanceof Expr.Constant previous) {
                    previous.setValue(previous.getValue() + constant.getValue());
                    continue;
                }
                values.add(Expr.Constant.string(constant.getValue()));
            } else {
                values.add(addition);
            }
        }
    }

    private String decodePlain(PythonToken token, boolean bytes) {
        String prefix = prefixOf(token.getValue());
        String body = bodyOf(token.getValue(), prefix);
        if (bytes && body.chars().anyMatch(c -> c > 0x7f)) {
            throw error(token, "bytes can only contain ASCII literal characters");
        }
        if (prefix.contains("r")) {
            return body;
        }
        try {
            return PythonLiterals.decodeEscapes(body, bytes);
        } catch (IllegalArgumentException e) {
            throw error(token, e.getMessage());
        }
    }

    private static String prefixOf(String literal) {
        int i = 0;
        while (literal.charAt(i) != '\'' && literal.charAt(i) != '"') {
            i++;
        }
        return literal.substring(0, i).toLowerCase(Locale.ROOT);
    }

    private static String bodyOf(String literal, String prefix) {
        String quoted = literal.substring(prefix.length());
        char quote = quoted.charAt(0);
        int width = quoted.startsWith(String.valueOf(quote).repeat(3)) && quoted.length() >= 6 ? 3 : 1;
        return quoted.substring(width, quoted.length() - width);
    }

    private PythonSyntaxException error(PythonToken token, String message) {
        return new PythonSyntaxException(message, fileName, token.getLine(), token.getColumn());
    }

    /**
     * Scans the body of one f-string (or a nested format spec) into constants and formatted
     * values.
     */
    private class FieldScanner {
        private final String body;
        private final boolean raw;
        private final PythonToken token;
        private int pos = 0;

        FieldScanner(String body, boolean raw, PythonToken token) {
            this.body = body;
            this.raw = raw;
            this.token = token;
        }

        /**
         * Scans literal text and replacement fields. Inside a format spec the scan stops, without
         * consuming it, at the closing brace of the enclosing field.
         */
        List<Expr> parseUntil(boolean formatSpec) {
            List<Expr> values = new ArrayList<>();
            StringBuilder literal = new StringBuilder();
            while (pos < body.length()) {
                char c = body.charAt(pos);
                if (c == '{') {
                    if (!formatSpec && body.startsWith("{{", pos)) {
                        literal.append('{');
                        pos += 2;
                        continue;
                    }
                    flush(literal, values);
                    values.addAll(parseField());
                } else if (c == '}') {
                    if (formatSpec) {
                        break;
                    }
                    if (!body.startsWith("}}", pos)) {
                        throw error(token, "f-string: single '}' is not allowed");
                    }
                    literal.append('}');
                    pos += 2;
                } else if (c == '\\' && !raw && pos + 1 < body.length()) {
                    if (body.startsWith("\\N{", pos)) {
                        int close = body.indexOf('}', pos);
                        if (close < 0) {
                            throw error(token, "malformed \\N character escape");
                        }
                        literal.append(body, pos, close + 1);
                        pos = close + 1;
                    } else {
                        literal.append(body, pos, pos + 2);
                        pos += 2;
                    }
                } else {
                    literal.append(c);
                    pos++;
                }
            }
            flush(literal, values);
            return values;
        }

        private void flush(StringBuilder literal, List<Expr> values) {
            if (literal.length() == 0) {
                return;
            }
            String text = literal.toString();
            if (!raw) {
                try {
                    text = PythonLiterals.decodeEscapes(text, false);
                } catch (IllegalArgumentException e) {
                    throw error(token, e.getMessage());
                }
            }
            values.add(Expr.Constant.string(text));
            literal.setLength(0);
        }

        /**
         * Parses one replacement field. A self-documenting field {@code {expr=}} yields its source
         * text as a constant ahead of the formatted value.
         */
        private List<Expr> parseField() {
            pos++;
            int start = pos;
            int end = -1;
            int depth = 0;
            while (pos < body.length()) {
                char c = body.charAt(pos);
                if (c == '\'' || c == '"') {
                    skipString();
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || (c == '}' && depth > 0)) {
                    depth--;
                } else if (depth == 0 && (c == '}' || c == ':'
                        || (c == '!' && !body.startsWith("!=", pos)))) {
                    break;
                } else if (depth == 0 && c == '=' && isSelfDocumenting()) {
                    end = pos;
                    pos++;
                    while (pos < body.length() && Character.isWhitespace(body.charAt(pos))) {
                        pos++;
                    }
                    if (pos < body.length() && "}!:".indexOf(body.charAt(pos)) < 0) {
                        throw error(token, "f-string: expecting '}'");
                    }
                    break;
                }
                pos++;
            }
            String expressionText = body.substring(start, end < 0 ? pos : end);
            if (expressionText.isBlank()) {
                throw error(token, "f-string: valid expression required before '}'");
            }
            Expr value = parseExpression(expressionText);

            int conversion = -1;
            if (pos < body.length() && body.charAt(pos) == '!') {
                if (pos + 1 >= body.length() || "sra".indexOf(body.charAt(pos + 1)) < 0) {
                    throw error(token, "f-string: invalid conversion character: expected 's', 'r', or 'a'");
                }
                conversion = body.charAt(pos + 1);
                pos += 2;
            }
            Expr.JoinedStr formatSpec = null;
            if (pos < body.length() && body.charAt(pos) == ':') {
                pos++;
                List<Expr> specValues = new ArrayList<>();
                appendAll(specValues, parseUntil(true));
                formatSpec = new Expr.JoinedStr(specValues);
            }
            if (pos >= body.length() || body.charAt(pos) != '}') {
                throw error(token, "f-string: expecting '}'");
            }
            pos++;
            if (end < 0) {
                return List.of(new Expr.FormattedValue(value, conversion, formatSpec));
            }
            if (conversion == -1 && formatSpec == null) {
                conversion = 'r';
            }
            String echoed = body.substring(start, end + 1);
            return List.of(Expr.Constant.string(echoed + whitespaceAfter(end + 1)),
                    new Expr.FormattedValue(value, conversion, formatSpec));
        }

        private String whitespaceAfter(int from) {
            int to = from;
            while (to < body.length() && Character.isWhitespace(body.charAt(to))) {
                to++;
            }
            return body.substring(from, to);
        }

        private boolean isSelfDocumenting() {
            char previous = pos > 0 ? body.charAt(pos - 1) : ' ';
            char next = pos + 1 < body.length() ? body.charAt(pos + 1) : '}';
            return "=!<>".indexOf(previous) < 0 && next != '=';
        }

        private void skipString() {
            char quote = body.charAt(pos);
            boolean triple = body.startsWith(String.valueOf(quote).repeat(3), pos);
            String closing = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
            pos += closing.length();
            while (pos < body.length() && !body.startsWith(closing, pos)) {
                pos += body.charAt(pos) == '\\' ? 2 : 1;
            }
            pos = Math.min(body.length(), pos + closing.length());
        }

        private Expr parseExpression(String text) {
            List<PythonToken> tokens = new PythonTokenizer("(" + text + ")", fileName, token.getLine()).tokenize();
            return new PythonParser(tokens, fileName).parseStandaloneExpression();
        }
    }
}
