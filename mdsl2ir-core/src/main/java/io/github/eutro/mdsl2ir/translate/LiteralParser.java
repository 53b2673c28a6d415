package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ast.Expr;
import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import io.github.eutro.mdsl2ir.types.ScalarType;
import org.intellij.lang.annotations.PrintFormat;

import java.util.regex.Pattern;

/**
 * Parses the text of literals into constant values.
 * <p>
 * Values are boxed the way {@link io.github.eutro.mdsl2ir.ops.CommonOps#CONST} holds them.
 */
public final class LiteralParser {
    private static final Pattern INT = Pattern.compile("[0-9][0-9_']*(?:ull|u|l|z)?");
    private static final Pattern FLOAT = Pattern.compile(
            "nan|nanf|inf|inff|-inf|-inff"
                    + "|(?:[0-9][0-9_']*\\.[0-9_']*|\\.[0-9][0-9_']*)(?:[eE][+-]?[0-9]+)?f?"
                    + "|[0-9][0-9_']*[eE][+-]?[0-9]+f?");
    private static final Pattern SEPARATORS = Pattern.compile("[_']");

    private LiteralParser() {
    }

    /**
     * A parsed constant and its type.
     */
    public static final class Constant {
        public final Object value;
        public final ScalarType type;

        public Constant(Object value, ScalarType type) {
            this.value = value;
            this.type = type;
        }

        @Override
        public String toString() {
            return value + " : " + type;
        }
    }

    /**
     * Parse a literal node.
     *
     * @param literal The literal.
     * @return The constant.
     * @throws TranslationException If the literal is malformed.
     */
    public static Constant parse(Expr.Literal literal) {
        return parse(literal.literalKind, literal.text, literal.location);
    }

    public static Constant parse(Expr.LiteralKind kind, String text, SourceLocation location) {
        switch (kind) {
            case INT:
                return parseInt(text, location);
            case FLOAT:
                return parseFloat(text, location);
            case BOOL:
                if ("true".equals(text)) return new Constant(true, ScalarType.BOOL);
                if ("false".equals(text)) return new Constant(false, ScalarType.BOOL);
                throw invalid(location, "malformed boolean literal `%s`", text);
            case STRING:
                if (text.length() < 2 || text.charAt(0) != '"' || text.charAt(text.length() - 1) != '"') {
                    throw invalid(location, "malformed string literal `%s`", text);
                }
                return new Constant(unescape(text.substring(1, text.length() - 1)), ScalarType.STR);
            default:
                throw new IllegalArgumentException("unknown literal kind " + kind);
        }
    }

    /**
     * Parse the value of a script argument, which must be exactly one literal, optionally
     * preceded by a minus sign.
     *
     * @param name     The name of the argument, for errors.
     * @param text     The value of the argument.
     * @param location The location of the reference to the argument.
     * @return The constant, without the minus sign applied.
     * @throws TranslationException If the value is not exactly one literal.
     */
    public static Constant parseArgument(String name, String text, SourceLocation location) {
        Expr.LiteralKind kind = classify(text.trim());
        if (kind == null) {
            throw invalid(location, "invalid literal value for argument '%s': %s", name, text);
        }
        try {
            return parse(kind, text.trim(), location);
        } catch (TranslationException e) {
            throw new TranslationException(new TranslationError(
                    TranslationError.Kind.INVALID_LITERAL,
                    location,
                    String.format("invalid literal value for argument '%s': %s", name, text)), e);
        }
    }

    private static Expr.LiteralKind classify(String text) {
        if ("true".equals(text) || "false".equals(text)) return Expr.LiteralKind.BOOL;
        if (text.length() >= 2 && text.charAt(0) == '"' && text.charAt(text.length() - 1) == '"') {
            // a single token: every other quote is escaped
            for (int i = 1; i < text.length() - 1; i++) {
                char c = text.charAt(i);
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    return null;
                }
            }
            // the closing quote must not itself be escaped
            int backslashes = 0;
            for (int i = text.length() - 2; i > 0 && text.charAt(i) == '\\'; i--) backslashes++;
            return backslashes % 2 == 0 ? Expr.LiteralKind.STRING : null;
        }
        if (FLOAT.matcher(text).matches()) return Expr.LiteralKind.FLOAT;
        if (INT.matcher(text).matches()) return Expr.LiteralKind.INT;
        return null;
    }

    private static Constant parseInt(String text, SourceLocation location) {
        String digits = SEPARATORS.matcher(text).replaceAll("");
        try {
            if (digits.endsWith("ull")) {
                return new Constant(Long.parseUnsignedLong(digits.substring(0, digits.length() - 3)), ScalarType.UI64);
            } else if (digits.endsWith("u")) {
                return new Constant(Long.parseUnsignedLong(digits.substring(0, digits.length() - 1)), ScalarType.UI64);
            } else if (digits.endsWith("l")) {
                return new Constant(Long.parseLong(digits.substring(0, digits.length() - 1)), ScalarType.SI64);
            } else if (digits.endsWith("z")) {
                return new Constant(Long.parseLong(digits.substring(0, digits.length() - 1)), ScalarType.SIZE);
            }
            long value = Long.parseUnsignedLong(digits);
            // 2^63 only fits when negated, which happens after parsing
            if (value < 0 && value != Long.MIN_VALUE) {
                throw invalid(location, "integer literal `%s` is out of range", text);
            }
            return new Constant(value, ScalarType.SI64);
        } catch (NumberFormatException e) {
            throw new TranslationException(new TranslationError(
                    TranslationError.Kind.INVALID_LITERAL,
                    location,
                    String.format("malformed integer literal `%s`", text)), e);
        }
    }

    private static Constant parseFloat(String text, SourceLocation location) {
        switch (text) {
            case "nan":
            case "nanf":
                return new Constant(Double.NaN, ScalarType.F64);
            case "inf":
            case "inff":
                return new Constant(Double.POSITIVE_INFINITY, ScalarType.F64);
            case "-inf":
            case "-inff":
                return new Constant(Double.NEGATIVE_INFINITY, ScalarType.F64);
        }
        String digits = SEPARATORS.matcher(text).replaceAll("");
        try {
            if (digits.endsWith("f")) {
                return new Constant(Float.parseFloat(digits.substring(0, digits.length() - 1)), ScalarType.F32);
            }
            return new Constant(Double.parseDouble(digits), ScalarType.F64);
        } catch (NumberFormatException e) {
            throw new TranslationException(new TranslationError(
                    TranslationError.Kind.INVALID_LITERAL,
                    location,
                    String.format("malformed floating point literal `%s`", text)), e);
        }
    }

    /**
     * Replace the escape sequences {@code \b \f \n \r \t \" \\} in a string.
     * Other backslashes are kept as they are.
     *
     * @param s The string, without quotes.
     * @return The unescaped string.
     */
    private static String unescape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 == s.length()) {
                sb.append(c);
                continue;
            }
            char e = s.charAt(++i);
            switch (e) {
                case 'b':
                    sb.append('\b');
                    break;
                case 'f':
                    sb.append('\f');
                    break;
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case '"':
                    sb.append('"');
                    break;
                case '\\':
                    sb.append('\\');
                    break;
                default:
                    sb.append('\\').append(e);
            }
        }
        return sb.toString();
    }

    private static TranslationException invalid(SourceLocation location, @PrintFormat String fmt, Object... args) {
        return TranslationException.of(TranslationError.Kind.INVALID_LITERAL, location, fmt, args);
    }
}
