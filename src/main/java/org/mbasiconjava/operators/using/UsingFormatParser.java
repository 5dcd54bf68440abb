package org.mbasiconjava.operators.using;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a PRINT USING format string into literal text and field
 * specifiers.
 */
public class UsingFormatParser {

    public static ParseResult parse(String format) {
        ParseResult result = new ParseResult();
        Parser parser = new Parser(format);
        StringBuilder literal = new StringBuilder();

        while (!parser.isAtEnd()) {
            char c = parser.current();
            if (c == '_') {
                // escaped literal
                parser.advance();
                if (!parser.isAtEnd()) {
                    literal.append(parser.current());
                    parser.advance();
                } else {
                    literal.append('_');
                }
                continue;
            }
            UsingFieldSpecifier spec = parser.parseField();
            if (spec != null) {
                result.addLiteral(literal.toString());
                literal.setLength(0);
                result.addSpecifier(spec);
            } else {
                literal.append(c);
                parser.advance();
            }
        }
        result.addLiteral(literal.toString());
        return result;
    }

    public static class ParseResult {
        public final List<Object> elements = new ArrayList<>(); // String or UsingFieldSpecifier

        public void addLiteral(String text) {
            if (!text.isEmpty()) {
                elements.add(text);
            }
        }

        public void addSpecifier(UsingFieldSpecifier spec) {
            elements.add(spec);
        }

        public boolean hasFields() {
            for (Object element : elements) {
                if (element instanceof UsingFieldSpecifier) {
                    return true;
                }
            }
            return false;
        }
    }

    private static class Parser {
        private final String input;
        private int pos = 0;

        Parser(String input) {
            this.input = input;
        }

        boolean isAtEnd() {
            return pos >= input.length();
        }

        char current() {
            return isAtEnd() ? '\0' : input.charAt(pos);
        }

        char peek(int ahead) {
            int index = pos + ahead;
            return index >= input.length() ? '\0' : input.charAt(index);
        }

        void advance() {
            if (!isAtEnd()) pos++;
        }

        boolean match(String text) {
            if (input.startsWith(text, pos)) {
                pos += text.length();
                return true;
            }
            return false;
        }

        /**
         * Parses a field at the current position, or returns null (position
         * unchanged) when the text there is literal.
         */
        UsingFieldSpecifier parseField() {
            int start = pos;
            UsingFieldSpecifier spec = switch (current()) {
                case '!' -> stringField(UsingFieldSpecifier.Kind.FIRST_CHARACTER, 1);
                case '&' -> stringField(UsingFieldSpecifier.Kind.WHOLE_STRING, 1);
                case '\\' -> fixedStringField();
                default -> startsNumericField() ? numericField() : null;
            };
            if (spec != null) {
                spec.raw = input.substring(start, pos);
            }
            return spec;
        }

        private UsingFieldSpecifier stringField(UsingFieldSpecifier.Kind kind, int length) {
            UsingFieldSpecifier spec = new UsingFieldSpecifier();
            spec.kind = kind;
            spec.stringWidth = length;
            pos += length;
            return spec;
        }

        private UsingFieldSpecifier fixedStringField() {
            int end = pos + 1;
            while (end < input.length() && input.charAt(end) == ' ') {
                end++;
            }
            if (end >= input.length() || input.charAt(end) != '\\') {
                return null;
            }
            UsingFieldSpecifier spec = new UsingFieldSpecifier();
            spec.kind = UsingFieldSpecifier.Kind.FIXED_STRING;
            spec.stringWidth = end - pos + 1;
            pos = end + 1;
            return spec;
        }

        private boolean startsNumericField() {
            char c = current();
            if (c == '#') {
                return true;
            }
            if (c == '.') {
                return peek(1) == '#';
            }
            if (c == '$') {
                return peek(1) == '$';
            }
            if (c == '*') {
                return peek(1) == '*';
            }
            if (c == '+') {
                char next = peek(1);
                return next == '#'
                        || (next == '.' && peek(2) == '#')
                        || (next == '$' && peek(2) == '$')
                        || (next == '*' && peek(2) == '*');
            }
            return false;
        }

        private UsingFieldSpecifier numericField() {
            UsingFieldSpecifier spec = new UsingFieldSpecifier();
            if (current() == '+') {
                spec.leadingSign = true;
                advance();
            }
            if (match("**$")) {
                spec.asteriskFill = true;
                spec.floatingDollar = true;
                spec.digitPositions += 3;
            } else if (match("**")) {
                spec.asteriskFill = true;
                spec.digitPositions += 2;
            } else if (match("$$")) {
                spec.floatingDollar = true;
                spec.digitPositions += 2;
            }
            while (current() == '#' || (current() == ',' && spec.digitPositions > 0)) {
                if (current() == ',') {
                    spec.commas = true;
                }
                spec.digitPositions++;
                advance();
            }
            if (current() == '.') {
                spec.decimalPoint = true;
                advance();
                while (current() == '#') {
                    spec.decimalPositions++;
                    advance();
                }
            }
            if (match("^^^^")) {
                spec.exponential = true;
            }
            if (!spec.leadingSign && (current() == '-' || current() == '+')) {
                spec.trailingSign = current();
                advance();
            }
            return spec;
        }
    }
}
