package com.funcpool.parser;

import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Conversions between Python literal syntax and literal values: escape decoding on the way in,
 * {@code repr}-style rendering on the way out.
 */
public final class PythonLiterals {

    public static final List<String> SINGLE_QUOTES = List.of("'", "\"");
    public static final List<String> MULTI_QUOTES = List.of("\"\"\"", "'''");
    public static final List<String> ALL_QUOTES = List.of("'", "\"", "\"\"\"", "'''");

    private PythonLiterals() {
    }

    /**
     * Outcome of escaping a string for a given set of acceptable quote types.
     */
    @Value
    public static class QuotedText {
        String text;
        List<String> quoteTypes;
    }

    // ---------------------------------------------------------------- decoding

    /**
     * Decodes backslash escapes of a non-raw string or bytes literal body.
     *
     * @throws IllegalArgumentException with a Python-style message for malformed escapes
     */
    public static String decodeEscapes(String body, boolean bytes) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> {
                }
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000b');
                case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                    int end = i - 1;
                    while (end < body.length() && end < i + 2 && isOctal(body.charAt(end))) {
                        end++;
                    }
                    int value = Integer.parseInt(body.substring(i - 1, end), 8);
                    out.appendCodePoint(value);
                    i = end;
                }
                case 'x' -> {
                    out.appendCodePoint(hexEscape(body, i, 2, "\\xXX"));
                    i += 2;
                }
                case 'u' -> {
                    if (bytes) {
                        out.append("\\u");
                    } else {
                        out.appendCodePoint(hexEscape(body, i, 4, "\\uXXXX"));
                        i += 4;
                    }
                }
                case 'U' -> {
                    if (bytes) {
                        out.append("\\U");
                    } else {
                        int value = hexEscape(body, i, 8, "\\UXXXXXXXX");
                        if (value > Character.MAX_CODE_POINT) {
                            throw new IllegalArgumentException("illegal Unicode character");
                        }
                        out.appendCodePoint(value);
                        i += 8;
                    }
                }
                case 'N' -> {
                    if (bytes) {
                        out.append("\\N");
                    } else {
                        int close = body.indexOf('}', i);
                        if (i >= body.length() || body.charAt(i) != '{' || close < 0) {
                            throw new IllegalArgumentException("malformed \\N character escape");
                        }
                        String name = body.substring(i + 1, close);
                        try {
                            out.appendCodePoint(Character.codePointOf(name));
                        } catch (IllegalArgumentException e) {
                            throw new IllegalArgumentException("unknown Unicode character name", e);
                        }
                        i = close + 1;
                    }
                }
                default -> out.append('\\').append(next);
            }
        }
        return out.toString();
    }

    private static boolean isOctal(char c) {
        return c >= '0' && c <= '7';
    }

    private static int hexEscape(String body, int start, int digits, String form) {
        if (start + digits > body.length()) {
            throw new IllegalArgumentException("truncated " + form + " escape");
        }
        String hex = body.substring(start, start + digits);
        for (int k = 0; k < hex.length(); k++) {
            if (Character.digit(hex.charAt(k), 16) < 0) {
                throw new IllegalArgumentException("truncated " + form + " escape");
            }
        }
        return (int) Long.parseLong(hex, 16);
    }

    // ---------------------------------------------------------------- numbers

    /**
     * Decimal text of an integer literal (any base, underscores allowed).
     */
    public static String integerValue(String literal) {
        String text = literal.replace("_", "").toLowerCase(Locale.ROOT);
        if (text.startsWith("0x")) {
            return new BigInteger(text.substring(2), 16).toString();
        }
        if (text.startsWith("0o")) {
            return new BigInteger(text.substring(2), 8).toString();
        }
        if (text.startsWith("0b")) {
            return new BigInteger(text.substring(2), 2).toString();
        }
        if (text.length() > 1 && text.startsWith("0") && !text.chars().allMatch(ch -> ch == '0')) {
            throw new IllegalArgumentException(
                    "leading zeros in decimal integer literals are not permitted; use an 0o prefix for octal integers");
        }
        return new BigInteger(text).toString();
    }

    public static boolean isIntegerLiteral(String literal) {
        String text = literal.toLowerCase(Locale.ROOT);
        if (text.startsWith("0x") || text.startsWith("0o") || text.startsWith("0b")) {
            return true;
        }
        return !text.contains(".") && !text.contains("e") && !text.endsWith("j");
    }

    /**
     * Shortest round-trip representation of a float, as Python's {@code repr} renders it.
     */
    public static String floatRepr(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return 1.0 / value < 0 ? "-0.0" : "0.0";
        }

        BigDecimal exact = new BigDecimal(value);
        BigDecimal shortest = exact;
        for (int precision = 1; precision <= 17; precision++) {
            BigDecimal rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == value) {
                shortest = rounded;
                break;
            }
        }
        BigDecimal stripped = shortest.stripTrailingZeros();
        String digits = stripped.unscaledValue().abs().toString();
        int decimalPoint = digits.length() - stripped.scale();
        String sign = value < 0 ? "-" : "";

        if (decimalPoint > -4 && decimalPoint <= 16) {
            if (decimalPoint <= 0) {
                return sign + "0." + "0".repeat(-decimalPoint) + digits;
            }
            if (decimalPoint >= digits.length()) {
                return sign + digits + "0".repeat(decimalPoint - digits.length()) + ".0";
            }
            return sign + digits.substring(0, decimalPoint) + "." + digits.substring(decimalPoint);
        }
        int exponent = decimalPoint - 1;
        String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        return String.format("%s%se%s%02d", sign, mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
    }

    public static String floatValue(String literal) {
        return floatRepr(Double.parseDouble(literal.replace("_", "")));
    }

    // ---------------------------------------------------------------- rendering

    /**
     * Python {@code repr} of a str value.
     */
    public static String reprString(String value) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder out = new StringBuilder(value.length() + 2).append(quote);
        value.codePoints().forEach(cp -> {
            if (cp == quote || cp == '\\') {
                out.append('\\').appendCodePoint(cp);
            } else if (cp == '\t') {
                out.append("\\t");
            } else if (cp == '\n') {
                out.append("\\n");
            } else if (cp == '\r') {
                out.append("\\r");
            } else if (cp < 0x20 || cp == 0x7f) {
                out.append(String.format("\\x%02x", cp));
            } else if (cp < 0x7f || isPrintable(cp)) {
                out.appendCodePoint(cp);
            } else {
                out.append(hexCodeEscape(cp));
            }
        });
        return out.append(quote).toString();
    }

    /**
     * Python {@code repr} of a bytes value whose chars are byte values 0-255.
     */
    public static String reprBytes(String value) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder out = new StringBuilder(value.length() + 3).append('b').append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == quote || c == '\\') {
                out.append('\\').append(c);
            } else if (c == '\t') {
                out.append("\\t");
            } else if (c == '\n') {
                out.append("\\n");
            } else if (c == '\r') {
                out.append("\\r");
            } else if (c < 0x20 || c >= 0x7f) {
                out.append(String.format("\\x%02x", (int) c));
            } else {
                out.append(c);
            }
        }
        return out.append(quote).toString();
    }

    /**
     * Escapes a string for a literal that should avoid backslashes where possible, and narrows the
     * given quote types to those that can delimit the result. Falls back to {@code repr} when no
     * quote type fits.
     */
    public static QuotedText quoteAvoidingBackslashes(String value, List<String> quoteTypes,
                                                      boolean escapeSpecialWhitespace) {
        StringBuilder escaped = new StringBuilder();
        value.codePoints().forEach(cp -> {
            if (!escapeSpecialWhitespace && (cp == '\n' || cp == '\t')) {
                escaped.appendCodePoint(cp);
            } else if (cp == '\\' || !isPrintable(cp)) {
                escaped.append(unicodeEscape(cp));
            } else {
                escaped.appendCodePoint(cp);
            }
        });
        String text = escaped.toString();

        List<String> possible = new ArrayList<>();
        for (String quote : quoteTypes) {
            if (text.contains("\n") && !MULTI_QUOTES.contains(quote)) {
                continue;
            }
            if (!text.contains(quote)) {
                possible.add(quote);
            }
        }
        if (possible.isEmpty()) {
            String repr = reprString(value);
            String delimiter = String.valueOf(repr.charAt(0));
            String chosen = quoteTypes.stream().filter(q -> q.contains(delimiter)).findFirst().orElse(delimiter);
            return new QuotedText(repr.substring(1, repr.length() - 1), List.of(chosen));
        }
        if (!text.isEmpty()) {
            char lastChar = text.charAt(text.length() - 1);
            List<String> sorted = new ArrayList<>();
            possible.stream().filter(q -> q.charAt(0) != lastChar).forEach(sorted::add);
            possible.stream().filter(q -> q.charAt(0) == lastChar).forEach(sorted::add);
            possible = sorted;
            if (possible.get(0).charAt(0) == lastChar) {
                text = text.substring(0, text.length() - 1) + "\\" + lastChar;
            }
        }
        return new QuotedText(text, possible);
    }

    /**
     * Python's notion of a printable character: everything except the "Other" and "Separator"
     * categories, with the ASCII space counted as printable.
     */
    public static boolean isPrintable(int codePoint) {
        if (codePoint == ' ') {
            return true;
        }
        switch (Character.getType(codePoint)) {
            case Character.CONTROL, Character.FORMAT, Character.SURROGATE, Character.PRIVATE_USE,
                    Character.UNASSIGNED, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR,
                    Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    private static String unicodeEscape(int cp) {
        switch (cp) {
            case '\\':
                return "\\\\";
            case '\t':
                return "\\t";
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            default:
                if (cp < 0x20 || (cp >= 0x7f && cp < 0x100)) {
                    return String.format("\\x%02x", cp);
                }
                return hexCodeEscape(cp);
        }
    }

    private static String hexCodeEscape(int cp) {
        if (cp < 0x100) {
            return String.format("\\x%02x", cp);
        }
        if (cp < 0x10000) {
            return String.format("\\u%04x", cp);
        }
        return String.format("\\U%08x", cp);
    }
}
