package co.fanki.codemap.analysis.domain.python;

import co.fanki.codemap.analysis.domain.python.PythonLiterals.StringValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PythonLiterals}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PythonLiteralsTest {

    // -- decoding ----------------------------------------------------------

    @Test
    void whenDecoding_givenEscapes_shouldResolveThem() {
        final StringValue value = PythonLiterals.decode(
                "'tab\\tnew\\nhex\\x41 octal\\101 uni\\u00e9 keep\\d'");

        assertEquals("tab\tnew\nhex" + "A octalA unié keep\\d",
                value.text());
        assertFalse(value.bytes());
    }

    @Test
    void whenDecoding_givenRawAndTripleQuoted_shouldKeepBody() {
        assertEquals("a\\nb", PythonLiterals.decode("r'a\\nb'").text());
        assertEquals("line one\nline two",
                PythonLiterals.decode("\"\"\"line one\nline two\"\"\"").text());
    }

    @Test
    void whenDecoding_givenLineContinuation_shouldJoinLines() {
        assertEquals("joined", PythonLiterals.decode("'joi\\\nned'").text());
    }

    @Test
    void whenDecoding_givenNamedEscape_shouldResolveCharacter() {
        assertEquals("é",
                PythonLiterals.decode("'\\N{LATIN SMALL LETTER E WITH ACUTE}'")
                        .text());
    }

    @Test
    void whenDecoding_givenBytesLiteral_shouldFlagBytes() {
        final StringValue value = PythonLiterals.decode("b'\\xff\\u00e9'");

        assertTrue(value.bytes());
        assertEquals("ÿ\\u00e9", value.text());
    }

    @Test
    void whenDecoding_givenFormattedString_shouldNotEvaluate() {
        assertNull(PythonLiterals.decode("f'{name}'"));
        assertNull(PythonLiterals.decode("rF'{name}'"));
    }

    // -- repr --------------------------------------------------------------

    @Test
    void whenRepresenting_givenStrings_shouldQuoteLikePython() {
        assertEquals("'hello'", PythonLiterals.repr(
                new StringValue("hello", false)));
        assertEquals("\"it's\"", PythonLiterals.repr(
                new StringValue("it's", false)));
        assertEquals("'say \"hi\" it\\'s'", PythonLiterals.repr(
                new StringValue("say \"hi\" it's", false)));
        assertEquals("'a\\nb\\\\c\\x00'", PythonLiterals.repr(
                new StringValue("a\nb\\c\u0000", false)));
        assertEquals("'café'", PythonLiterals.repr(
                new StringValue("café", false)));
    }

    @Test
    void whenRepresenting_givenBytes_shouldEscapeNonAscii() {
        assertEquals("b'\\xffok'", PythonLiterals.repr(
                new StringValue("ÿok", true)));
    }

    @Test
    void whenRepresenting_givenUnprintableCharacters_shouldEscapeThem() {
        assertEquals("'a\\u200bb'", PythonLiterals.repr(
                new StringValue("a\u200bb", false)));
        assertEquals("'no\\xa0break'", PythonLiterals.repr(
                new StringValue("no\u00a0break", false)));
        assertEquals("'\\U000f0000'", PythonLiterals.repr(
                new StringValue(new String(Character.toChars(0xf0000)),
                        false)));
        assertEquals("'\u00e9 ok'", PythonLiterals.repr(
                new StringValue("\u00e9 ok", false)));
    }

    @Test
    void whenRepresenting_givenImaginaryLiterals_shouldFollowComplexRepr() {
        assertEquals("1000j", PythonLiterals.reprFloat("1e3j"));
        assertEquals("1.5j", PythonLiterals.reprFloat("1.5J"));
        assertEquals("1e+20j", PythonLiterals.reprFloat("1e20j"));
        assertEquals("10j", PythonLiterals.reprInteger("1_0j"));
    }

    @Test
    void whenRepresenting_givenIntegers_shouldPrintDecimalValue() {
        assertEquals("255", PythonLiterals.reprInteger("0xFF"));
        assertEquals("8", PythonLiterals.reprInteger("0o10"));
        assertEquals("5", PythonLiterals.reprInteger("0b101"));
        assertEquals("1000000", PythonLiterals.reprInteger("1_000_000"));
        assertEquals("3j", PythonLiterals.reprInteger("3J"));
    }

    @Test
    void whenRepresenting_givenFloats_shouldFollowPythonFloatRepr() {
        assertEquals("1.5", PythonLiterals.reprFloat("1.50"));
        assertEquals("10.0", PythonLiterals.reprFloat("1e1"));
        assertEquals("0.0001", PythonLiterals.reprFloat("1e-4"));
        assertEquals("1e-05", PythonLiterals.reprFloat("0.00001"));
        assertEquals("1e+16", PythonLiterals.reprFloat("1e16"));
        assertEquals("1234.5", PythonLiterals.reprFloat("1_234.5"));
        assertEquals("0.0", PythonLiterals.reprFloat("0."));
        assertEquals("inf", PythonLiterals.reprFloat("1e400"));
    }

    // -- cleandoc ----------------------------------------------------------

    @Test
    void whenCleaning_givenIndentedBody_shouldRemoveCommonMargin() {
        assertEquals("First.\n\nSecond.\n  Deeper.",
                PythonLiterals.cleandoc("  First.\n\n    Second.\n      Deeper.\n    "));
    }

    @Test
    void whenCleaning_givenLeadingBlankLines_shouldDropThem() {
        assertEquals("Body.", PythonLiterals.cleandoc("\n\n    Body.\n"));
    }

    @Test
    void whenCleaning_givenSingleLine_shouldStripLeadingWhitespace() {
        assertEquals("One liner.", PythonLiterals.cleandoc("   One liner."));
    }

}
