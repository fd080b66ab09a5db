package me.christianrobert.plpgcheck.checker;

import java.util.ArrayList;
import java.util.List;

/**
 * Placeholder analysis of RAISE messages and {@code format()} format strings.
 */
final class FormatStrings {

    /**
     * Outcome of scanning a {@code format()} format string.
     */
    static final class FormatCheck {
        private final String error;
        private final int requiredArgs;
        private final List<Integer> plainStringArgs;

        private FormatCheck(String error, int requiredArgs, List<Integer> plainStringArgs) {
            this.error = error;
            this.requiredArgs = requiredArgs;
            this.plainStringArgs = plainStringArgs;
        }

        /**
         * Message of the first problem, {@code null} when the string is valid.
         */
        String getError() {
            return error;
        }

        /**
         * Number of value arguments consumed; -1 when positional references make it unknown.
         */
        int getRequiredArgs() {
            return requiredArgs;
        }

        /**
         * 1-based numbers of the value arguments interpolated with {@code %s}.
         */
        List<Integer> getPlainStringArgs() {
            return plainStringArgs;
        }
    }

    private FormatStrings() {
    }

    /**
     * Counts the {@code %} placeholders of a RAISE message; {@code %%} is a literal percent.
     */
    static int countRaisePlaceholders(String message) {
        if (message == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < message.length(); i++) {
            if (message.charAt(i) == '%') {
                if (i + 1 < message.length() && message.charAt(i + 1) == '%') {
                    i++;
                } else {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Scans a format string the way {@code format()} does at run time.
     *
     * @param valueArgs number of arguments following the format string
     */
    static FormatCheck checkFormat(String format, int valueArgs) {
        List<Integer> plain = new ArrayList<>();
        int required = 0;
        int arg = 0;
        int length = format.length();
        int i = 0;
        while (i < length) {
            if (format.charAt(i) != '%') {
                i++;
                continue;
            }
            i++;
            if (i >= length) {
                return failure("unterminated format() type specifier");
            }
            if (format.charAt(i) == '%') {
                i++;
                continue;
            }

            int argpos = 0;
            int digitsEnd = skipDigits(format, i);
            if (digitsEnd > i && digitsEnd < length && format.charAt(digitsEnd) == '$') {
                argpos = Integer.parseInt(format.substring(i, digitsEnd));
                if (argpos == 0) {
                    return failure("format specifies argument 0, but arguments are numbered from 1");
                }
                i = digitsEnd + 1;
            }
            while (i < length && format.charAt(i) == '-') {
                i++;
            }
            int widthpos = -1;
            if (i < length && format.charAt(i) == '*') {
                i++;
                widthpos = 0;
                digitsEnd = skipDigits(format, i);
                if (digitsEnd > i) {
                    if (digitsEnd >= length || format.charAt(digitsEnd) != '$') {
                        return failure("width argument position must be ended by \"$\"");
                    }
                    widthpos = Integer.parseInt(format.substring(i, digitsEnd));
                    if (widthpos == 0) {
                        return failure("format specifies argument 0, but arguments are numbered from 1");
                    }
                    i = digitsEnd + 1;
                }
            } else {
                i = skipDigits(format, i);
            }
            if (i >= length) {
                return failure("unterminated format() type specifier");
            }

            char type = format.charAt(i);
            if ("sIL".indexOf(type) < 0) {
                return failure("unrecognized format() type specifier \"" + type + "\"");
            }
            if (widthpos > 0) {
                if (widthpos > valueArgs) {
                    return failure("too few arguments for format()");
                }
                required = -1;
            } else if (widthpos == 0) {
                if (++arg > valueArgs) {
                    return failure("too few arguments for format()");
                }
                if (required != -1) {
                    required++;
                }
            }

            int valueArg;
            if (argpos > 0) {
                if (argpos > valueArgs) {
                    return failure("too few arguments for format()");
                }
                required = -1;
                valueArg = argpos;
            } else {
                if (++arg > valueArgs) {
                    return failure("too few arguments for format()");
                }
                if (required != -1) {
                    required++;
                }
                valueArg = arg;
            }
            if (type == 's') {
                plain.add(valueArg);
            }
            i++;
        }
        return new FormatCheck(null, required, plain);
    }

    private static FormatCheck failure(String message) {
        return new FormatCheck(message, -1, List.of());
    }

    private static int skipDigits(String text, int start) {
        int i = start;
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
