package com.brainrot.script.stdrot;

import java.util.List;
import java.util.Locale;

import com.brainrot.script.core.BrainrotRuntimeException;
import com.brainrot.script.core.ErrorKind;
import com.brainrot.script.core.TypeRules;
import com.brainrot.script.core.Value;
import com.brainrot.script.core.VarType;

/**
 * C printf-style formatting over interpreter values.
 *
 * Conversions: d i o u x X f F e E g G a A c s b %. Flags, width and precision follow C.
 * Length modifiers (h, l, ll, L, ...) are accepted and ignored. %b prints W for a true value
 * and L otherwise. A conversion with no argument left is copied to the output unchanged, as
 * is an unknown conversion.
 */
public final class PrintfFormatter {

    private static final String FLAGS = "-+ #0";
    private static final String LENGTH_MODIFIERS = "hlLqjzt";
    private static final String CONVERSIONS = "diouxXfFeEgGaAcsb";

    /** Largest accepted field width or precision. */
    public static final int MAX_FIELD_SIZE = 4096;

    private PrintfFormatter() {}

    private static final class Conversion {
        boolean left;
        boolean plus;
        boolean space;
        boolean alt;
        boolean zero;
        int width = -1;
        int precision = -1;
        char conversion;
    }

    public static String format(String fmt, List<FormatArg> args) {
        StringBuilder out = new StringBuilder(fmt.length() + 16);
        int next = 0;
        int n = fmt.length();
        int i = 0;
        while (i < n) {
            char c = fmt.charAt(i);
            if (c != '%') {
                out.append(c);
                i++;
                continue;
            }

            int start = i++;
            Conversion conv = new Conversion();
            while (i < n && FLAGS.indexOf(fmt.charAt(i)) >= 0) {
                switch (fmt.charAt(i)) {
                    case '-': conv.left = true; break;
                    case '+': conv.plus = true; break;
                    case ' ': conv.space = true; break;
                    case '#': conv.alt = true; break;
                    default: conv.zero = true; break;
                }
                i++;
            }
            int digitsStart = i;
            while (i < n && Character.isDigit(fmt.charAt(i))) i++;
            if (i > digitsStart) conv.width = fieldSize(fmt.substring(digitsStart, i), "width");
            if (i < n && fmt.charAt(i) == '.') {
                i++;
                int precStart = i;
                while (i < n && Character.isDigit(fmt.charAt(i))) i++;
                conv.precision = (i > precStart) ? fieldSize(fmt.substring(precStart, i), "precision") : 0;
            }
            while (i < n && LENGTH_MODIFIERS.indexOf(fmt.charAt(i)) >= 0) i++;

            if (i >= n) {
                out.append(fmt, start, n);
                break;
            }
            conv.conversion = fmt.charAt(i++);
            if (conv.conversion == '%') {
                out.append('%');
                continue;
            }
            if (CONVERSIONS.indexOf(conv.conversion) < 0 || next >= args.size()) {
                out.append(fmt, start, i);
                continue;
            }
            out.append(convert(conv, args.get(next++)));
        }
        return out.toString();
    }

    private static int fieldSize(String digits, String what) {
        int size;
        try {
            size = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            size = Integer.MAX_VALUE;
        }
        if (size > MAX_FIELD_SIZE) {
            throw new BrainrotRuntimeException(ErrorKind.UNSUPPORTED_OPERATION,
                    "printf " + what + " " + digits + " exceeds " + MAX_FIELD_SIZE);
        }
        return size;
    }

    private static String convert(Conversion conv, FormatArg arg) {
        Value v = arg.value;
        switch (conv.conversion) {
            case 'd':
            case 'i': {
                long x = integral(conv, v);
                if (arg.unsigned) x = unsigned(v, x);
                return padNumber(conv, x < 0 ? "-" : signOf(conv), limitDigits(conv, Long.toString(Math.abs(x))), "");
            }
            case 'u':
                return padNumber(conv, "", limitDigits(conv, Long.toString(unsigned(v, integral(conv, v)))), "");
            case 'o': {
                String digits = limitDigits(conv, Long.toOctalString(unsigned(v, integral(conv, v))));
                String prefix = (conv.alt && !digits.startsWith("0")) ? "0" : "";
                return padNumber(conv, "", digits, prefix);
            }
            case 'x':
            case 'X': {
                long x = unsigned(v, integral(conv, v));
                String digits = limitDigits(conv, Long.toHexString(x));
                String prefix = (conv.alt && x != 0) ? "0x" : "";
                String s = padNumber(conv, "", digits, prefix);
                return conv.conversion == 'X' ? s.toUpperCase(Locale.ROOT) : s;
            }
            case 'f':
            case 'F':
            case 'e':
            case 'E':
            case 'g':
            case 'G':
            case 'a':
            case 'A':
                return floating(conv, floatingValue(conv, v));
            case 'c': {
                int code;
                if (v.type == Value.Type.CHAR) {
                    code = v.asChar();
                } else {
                    code = (int) integral(conv, v) & 0xFF;
                }
                return padText(conv, String.valueOf((char) code));
            }
            case 's': {
                String s;
                if (v.type == Value.Type.STRING) {
                    s = v.asString();
                } else if (v.type == Value.Type.ARRAY && v.asArray().elementType() == VarType.CHAR) {
                    s = v.asArray().asCString();
                } else {
                    throw mismatch(conv, "a string", v);
                }
                if (conv.precision >= 0 && conv.precision < s.length()) s = s.substring(0, conv.precision);
                return padText(conv, s);
            }
            default: {
                if (v.type == Value.Type.STRING || v.type == Value.Type.ARRAY) throw mismatch(conv, "a scalar", v);
                return padText(conv, TypeRules.isTruthy(v) ? "W" : "L");
            }
        }
    }

    // -------------------------
    // Integers
    // -------------------------

    private static long integral(Conversion conv, Value v) {
        if (v.type == Value.Type.STRING || v.type == Value.Type.ARRAY) throw mismatch(conv, "an integer", v);
        return TypeRules.toLong(v);
    }

    /** Reinterprets as the unsigned counterpart of the value's width. */
    private static long unsigned(Value v, long x) {
        if (v.type == Value.Type.SHORT) return x & 0xFFFFL;
        return x & 0xFFFFFFFFL;
    }

    private static String signOf(Conversion conv) {
        if (conv.plus) return "+";
        if (conv.space) return " ";
        return "";
    }

    /** Applies the minimum digit count of an integer precision. */
    private static String limitDigits(Conversion conv, String digits) {
        if (conv.precision < 0) return digits;
        if (conv.precision == 0 && digits.equals("0")) return "";
        StringBuilder sb = new StringBuilder();
        for (int k = digits.length(); k < conv.precision; k++) sb.append('0');
        return sb.append(digits).toString();
    }

    private static String padNumber(Conversion conv, String sign, String digits, String prefix) {
        String body = sign + prefix + digits;
        if (conv.width <= body.length()) return body;
        int fill = conv.width - body.length();
        if (conv.left) return body + repeat(' ', fill);
        boolean zeroPad = conv.zero && (conv.precision < 0 || isFloating(conv.conversion));
        if (zeroPad) return sign + prefix + repeat('0', fill) + digits;
        return repeat(' ', fill) + body;
    }

    // -------------------------
    // Floating point
    // -------------------------

    private static boolean isFloating(char c) {
        return "fFeEgGaA".indexOf(c) >= 0;
    }

    private static double floatingValue(Conversion conv, Value v) {
        if (!v.isNumeric() && v.type != Value.Type.BOOL) throw mismatch(conv, "a number", v);
        return TypeRules.toDouble(v);
    }

    private static String floating(Conversion conv, double d) {
        boolean upper = Character.isUpperCase(conv.conversion);
        boolean negative = Math.copySign(1.0, d) < 0;
        String sign = negative ? "-" : signOf(conv);

        if (Double.isNaN(d) || Double.isInfinite(d)) {
            String text = Double.isNaN(d) ? "nan" : "inf";
            if (Double.isNaN(d)) sign = signOf(conv);
            text = sign + (upper ? text.toUpperCase(Locale.ROOT) : text);
            return padText(conv, text);
        }

        double abs = Math.abs(d);
        String body;
        switch (Character.toLowerCase(conv.conversion)) {
            case 'f':
                body = String.format(Locale.ROOT, "%" + (conv.alt ? "#" : "") + "." + precisionOr6(conv) + "f", abs);
                break;
            case 'e':
                body = String.format(Locale.ROOT, "%" + (conv.alt ? "#" : "") + "." + precisionOr6(conv) + "e", abs);
                break;
            case 'g':
                body = general(conv, abs);
                break;
            default:
                String prefix = upper ? "0X" : "0x";
                body = hexFloat(abs, conv.precision, conv.alt);
                return padNumber(conv, sign, upper ? body.toUpperCase(Locale.ROOT) : body, prefix);
        }
        if (upper) body = body.toUpperCase(Locale.ROOT);
        return padNumber(conv, sign, body, "");
    }

    /**
     * %a digits after the "0x" prefix, as C prints them: "1p+0", "1.4p+3", "0p+0".
     * Without a precision trailing zero digits are dropped; a precision rounds half to even.
     */
    private static String hexFloat(double abs, int precision, boolean alt) {
        long bits = Double.doubleToRawLongBits(abs);
        int biased = (int) ((bits >>> 52) & 0x7FF);
        long fraction = bits & 0xFFFFFFFFFFFFFL;
        long lead;
        int exponent;
        if (biased == 0) {
            lead = 0;
            exponent = (fraction == 0) ? 0 : -1022;
        } else {
            lead = 1;
            exponent = biased - 1023;
        }

        int digits = 13;
        if (precision >= 0 && precision < 13) {
            int drop = (13 - precision) * 4;
            long kept = fraction >>> drop;
            long rest = fraction & ((1L << drop) - 1);
            long half = 1L << (drop - 1);
            long last = (precision == 0) ? lead : kept;
            if (rest > half || (rest == half && (last & 1) == 1)) kept++;
            if ((kept >>> (precision * 4)) != 0) {
                lead++;
                kept &= (1L << (precision * 4)) - 1;
            }
            fraction = kept;
            digits = precision;
        }

        StringBuilder hex = new StringBuilder();
        String raw = Long.toHexString(fraction);
        if (digits > 0) {
            for (int k = raw.length(); k < digits; k++) hex.append('0');
            hex.append(raw);
        }
        if (precision < 0) {
            int end = hex.length();
            while (end > 0 && hex.charAt(end - 1) == '0') end--;
            hex.setLength(end);
        } else {
            while (hex.length() < precision) hex.append('0');
        }

        StringBuilder sb = new StringBuilder().append(lead);
        if (hex.length() > 0) sb.append('.').append(hex);
        else if (alt) sb.append('.');
        sb.append('p').append(exponent >= 0 ? "+" : "").append(exponent);
        return sb.toString();
    }

    private static int precisionOr6(Conversion conv) {
        return conv.precision < 0 ? 6 : conv.precision;
    }

    /** %g: shortest of %e and %f for the precision, trailing zeros removed unless '#'. */
    private static String general(Conversion conv, double abs) {
        int p = conv.precision < 0 ? 6 : Math.max(conv.precision, 1);
        int exponent = 0;
        if (abs != 0.0) {
            String e = String.format(Locale.ROOT, "%." + (p - 1) + "e", abs);
            exponent = Integer.parseInt(e.substring(e.indexOf('e') + 1));
        }
        String body;
        if (exponent < p && exponent >= -4) {
            body = String.format(Locale.ROOT, "%." + (p - 1 - exponent) + "f", abs);
            if (!conv.alt) body = stripZeros(body);
        } else {
            body = String.format(Locale.ROOT, "%." + (p - 1) + "e", abs);
            if (!conv.alt) {
                int at = body.indexOf('e');
                body = stripZeros(body.substring(0, at)) + body.substring(at);
            }
        }
        return body;
    }

    private static String stripZeros(String s) {
        if (s.indexOf('.') < 0) return s;
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '0') end--;
        if (end > 0 && s.charAt(end - 1) == '.') end--;
        return s.substring(0, end);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private static String padText(Conversion conv, String text) {
        if (conv.width <= text.length()) return text;
        String fill = repeat(' ', conv.width - text.length());
        return conv.left ? text + fill : fill + text;
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int k = 0; k < count; k++) sb.append(c);
        return sb.toString();
    }

    private static BrainrotRuntimeException mismatch(Conversion conv, String expected, Value v) {
        String got = v.type == Value.Type.ARRAY ? "array" : v.varType().keyword();
        return new BrainrotRuntimeException(ErrorKind.TYPE_MISMATCH,
                "%" + conv.conversion + " expects " + expected + ", got " + got);
    }
}
