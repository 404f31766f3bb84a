import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.brainrot.script.core.ArrayStorage;
import com.brainrot.script.core.BrainrotRuntimeException;
import com.brainrot.script.core.ErrorKind;
import com.brainrot.script.core.Value;
import com.brainrot.script.core.VarType;
import com.brainrot.script.stdrot.FormatArg;
import com.brainrot.script.stdrot.PrintfFormatter;

public class PrintfFormatterTest {

    private static String fmt(String format, Value... values) {
        List<FormatArg> args = new ArrayList<>();
        for (Value v : values) args.add(FormatArg.of(v));
        return PrintfFormatter.format(format, args);
    }

    @Test
    void integers() {
        assertEquals("42", fmt("%d", Value.int32(42)));
        assertEquals("   42", fmt("%5d", Value.int32(42)));
        assertEquals("42   |", fmt("%-5d|", Value.int32(42)));
        assertEquals("-0042", fmt("%05d", Value.int32(-42)));
        assertEquals("+5", fmt("%+d", Value.int32(5)));
        assertEquals(" 5", fmt("% d", Value.int32(5)));
        assertEquals("007", fmt("%.3d", Value.int32(7)));
        assertEquals("7", fmt("%ld", Value.int32(7)));
        assertEquals("-3", fmt("%i", Value.int16((short) -3)));
    }

    @Test
    void unsignedOctalAndHex() {
        assertEquals("4294967295", fmt("%u", Value.int32(-1)));
        assertEquals("65535", fmt("%u", Value.int16((short) -1)));
        assertEquals("10", fmt("%o", Value.int32(8)));
        assertEquals("010", fmt("%#o", Value.int32(8)));
        assertEquals("ff", fmt("%x", Value.int32(255)));
        assertEquals("FF", fmt("%X", Value.int32(255)));
        assertEquals("0xff", fmt("%#x", Value.int32(255)));
        assertEquals("0XFF", fmt("%#X", Value.int32(255)));
        assertEquals("ffffffff", fmt("%x", Value.int32(-1)));
    }

    @Test
    void unsignedVariablesPrintWithoutSign() {
        List<FormatArg> args = List.of(new FormatArg(Value.int32(-1), true));
        assertEquals("4294967295", PrintfFormatter.format("%d", args));
    }

    @Test
    void floatingPoint() {
        assertEquals("3.140000", fmt("%f", Value.float64(3.14)));
        assertEquals("3.14", fmt("%.2f", Value.float64(3.14159)));
        assertEquals("   3.142", fmt("%8.3f", Value.float64(3.14159)));
        assertEquals("-1.50", fmt("%.2f", Value.float32(-1.5f)));
        assertEquals("2.000000", fmt("%f", Value.int32(2)));
        assertEquals("1.234568e+04", fmt("%e", Value.float64(12345.678)));
        assertEquals("1.234568E+04", fmt("%E", Value.float64(12345.678)));
    }

    @Test
    void generalFormatPicksShortestForm() {
        assertEquals("0.0001", fmt("%g", Value.float64(0.0001)));
        assertEquals("1.23457e+06", fmt("%g", Value.float64(1234567.0)));
        assertEquals("100", fmt("%g", Value.float64(100.0)));
        assertEquals("0", fmt("%g", Value.float64(0.0)));
        assertEquals("2.5", fmt("%g", Value.float64(2.5)));
    }

    @Test
    void nanAndInfinity() {
        assertEquals("nan", fmt("%f", Value.float64(Double.NaN)));
        assertEquals("-inf", fmt("%f", Value.float64(Double.NEGATIVE_INFINITY)));
        assertEquals("INF", fmt("%F", Value.float64(Double.POSITIVE_INFINITY)));
    }

    @Test
    void charactersAndStrings() {
        assertEquals("A", fmt("%c", Value.character('A')));
        assertEquals("B", fmt("%c", Value.int32(66)));
        assertEquals("hi", fmt("%s", Value.string("hi")));
        assertEquals("   hi", fmt("%5s", Value.string("hi")));
        assertEquals("h", fmt("%.1s", Value.string("hi")));

        ArrayStorage chars = new ArrayStorage(VarType.CHAR, 6);
        chars.storeCString("yeet");
        assertEquals("[yeet]", fmt("[%s]", Value.array(chars)));
    }

    @Test
    void boolConversionPrintsWOrL() {
        assertEquals("W L", fmt("%b %b", Value.bool(true), Value.int32(0)));
        assertEquals("W", fmt("%b", Value.float64(0.5)));
    }

    @Test
    void literalPercentAndLeftovers() {
        assertEquals("100%", fmt("100%%"));
        assertEquals("1 and %d", fmt("%d and %d", Value.int32(1)));
        assertEquals("%y", fmt("%y", Value.int32(1)));
        assertEquals("tail %", fmt("tail %"));
    }

    @Test
    void hexFloatFollowsCNotation() {
        assertEquals("0x1p+0|0X1P-1", fmt("%a|%A", Value.float64(1.0), Value.float64(0.5)));
        assertEquals("0x1.4p+3", fmt("%a", Value.float64(10.0)));
        assertEquals("-0x1p+1", fmt("%a", Value.float64(-2.0)));
        assertEquals("0x0p+0", fmt("%a", Value.float64(0.0)));
        assertEquals("0x1.00p+0", fmt("%.2a", Value.float64(1.0)));
        assertEquals("0x1.2p+0", fmt("%.1a", Value.float64(1.1)));
        assertEquals("0x2p+0", fmt("%.0a", Value.float64(1.5)));
        assertEquals("0x1.p+0", fmt("%#a", Value.float64(1.0)));
        assertEquals("0x0001p+0", fmt("%010a", Value.float64(1.0)));
        assertEquals("0x0.0000000000001p-1022", fmt("%a", Value.float64(Double.MIN_VALUE)));
    }

    @Test
    void oversizedWidthOrPrecisionIsRejected() {
        BrainrotRuntimeException ex = assertThrows(BrainrotRuntimeException.class,
                () -> fmt("%99999999999d", Value.int32(1)));
        assertEquals(ErrorKind.UNSUPPORTED_OPERATION, ex.kind());

        ex = assertThrows(BrainrotRuntimeException.class, () -> fmt("%.5000f", Value.float64(1.0)));
        assertEquals(ErrorKind.UNSUPPORTED_OPERATION, ex.kind());

        assertEquals(PrintfFormatter.MAX_FIELD_SIZE,
                fmt("%" + PrintfFormatter.MAX_FIELD_SIZE + "d", Value.int32(1)).length());
    }

    @Test
    void wrongArgumentTypeIsATypeMismatch() {
        BrainrotRuntimeException ex = assertThrows(BrainrotRuntimeException.class,
                () -> fmt("%d", Value.string("x")));
        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());

        ex = assertThrows(BrainrotRuntimeException.class, () -> fmt("%s", Value.int32(1)));
        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
    }
}
