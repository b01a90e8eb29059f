package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.services.FormulaEngine;
import com.spreadsheet.engine.values.BooleanValue;
import com.spreadsheet.engine.values.ErrorType;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for string functions, TEXT formatting and VALUE parsing.
 */
class TextFunctionsTest {

    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
        engine.setCellValue("A1", "Hello World");
        engine.setCellValue("A2", "42");
    }

    private Value eval(String formula) {
        return engine.setFormula("Z99", formula).get("Z99");
    }

    private static void assertError(ErrorType expected, Value actual) {
        assertInstanceOf(FormulaError.class, actual);
        assertEquals(expected, ((FormulaError) actual).getErrorType());
    }

    /**
     * Case changes, trimming and length.
     */
    @Test
    void testBasics() {
        assertEquals(Value.of(11), eval("=LEN(A1)"));
        assertEquals(Value.of(2), eval("=LEN(A2)"));
        assertEquals(Value.of("HELLO WORLD"), eval("=UPPER(A1)"));
        assertEquals(Value.of("hello world"), eval("=LOWER(A1)"));
        assertEquals(Value.of("a b c"), eval("=TRIM(\"  a   b c \")"));
        assertEquals(Value.of("John O'Neil"), eval("=PROPER(\"jOHN o'neil\")"));
        assertEquals(Value.of("ab42TRUE"), eval("=CONCATENATE(\"a\", \"b\", A2, TRUE)"));
        assertEquals(Value.of("Hello World42"), eval("=CONCAT(A1:A2)"));
        assertEquals(BooleanValue.FALSE, eval("=EXACT(\"a\", \"A\")"));
        assertEquals(Value.of("ababab"), eval("=REPT(\"ab\", 3)"));
        assertError(ErrorType.VALUE, eval("=REPT(\"ab\", -1)"));
    }

    /**
     * REPT stops at the longest text a cell can hold.
     */
    @Test
    void testReptLimit() {
        assertEquals(Value.of(32767), eval("=LEN(REPT(\"x\", 32767))"));
        assertError(ErrorType.VALUE, eval("=REPT(\"x\", 32768)"));
        assertError(ErrorType.VALUE, eval("=REPT(\"abc\", 10000000000)"));
        assertEquals(Value.of(""), eval("=REPT(\"\", 10000000000)"));
    }

    /**
     * LEFT / RIGHT / MID clamp to the text and reject negative counts.
     */
    @Test
    void testSlicing() {
        assertEquals(Value.of("Hello"), eval("=LEFT(A1, 5)"));
        assertEquals(Value.of("H"), eval("=LEFT(A1)"));
        assertEquals(Value.of("World"), eval("=RIGHT(A1, 5)"));
        assertEquals(Value.of("Hello World"), eval("=RIGHT(A1, 50)"));
        assertEquals(Value.of("lo W"), eval("=MID(A1, 4, 4)"));
        assertEquals(Value.of(""), eval("=MID(A1, 40, 4)"));
        assertError(ErrorType.VALUE, eval("=MID(A1, 0, 4)"));
        assertError(ErrorType.VALUE, eval("=LEFT(A1, -1)"));
    }

    /**
     * FIND is case-sensitive; SEARCH is not and supports wildcards.
     */
    @Test
    void testFindAndSearch() {
        assertEquals(Value.of(7), eval("=FIND(\"World\", A1)"));
        assertError(ErrorType.VALUE, eval("=FIND(\"world\", A1)"));
        assertEquals(Value.of(8), eval("=FIND(\"o\", A1, 6)"));
        assertEquals(Value.of(7), eval("=SEARCH(\"world\", A1)"));
        assertEquals(Value.of(7), eval("=SEARCH(\"w?r\", A1)"));
        assertError(ErrorType.VALUE, eval("=SEARCH(\"x\", A1)"));
        assertError(ErrorType.VALUE, eval("=SEARCH(\"o\", A1, 20)"));
    }

    /**
     * SUBSTITUTE replaces all or the n-th occurrence; REPLACE works by position.
     */
    @Test
    void testSubstituteAndReplace() {
        assertEquals(Value.of("a-b-c"), eval("=SUBSTITUTE(\"a b c\", \" \", \"-\")"));
        assertEquals(Value.of("a b-c"), eval("=SUBSTITUTE(\"a b c\", \" \", \"-\", 2)"));
        assertEquals(Value.of("a b c"), eval("=SUBSTITUTE(\"a b c\", \" \", \"-\", 5)"));
        assertEquals(Value.of("Hello There"), eval("=REPLACE(A1, 7, 5, \"There\")"));
    }

    /**
     * TEXT supports percentages, currency, fixed decimals, grouping, dates and padding.
     */
    @Test
    void testTextFormats() {
        assertEquals(Value.of("25.6%"), eval("=TEXT(0.256, \"0.0%\")"));
        assertEquals(Value.of("$1234.50"), eval("=TEXT(1234.5, \"$#,##0.00\")"));
        assertEquals(Value.of("3.14"), eval("=TEXT(3.14159, \"0.00\")"));
        assertEquals(Value.of("1,234,568"), eval("=TEXT(1234567.891, \"#,##0\")"));
        assertEquals(Value.of("2024-03-15"), eval("=TEXT(45366, \"yyyy-mm-dd\")"));
        assertEquals(Value.of("03/15/2024"), eval("=TEXT(45366, \"mm/dd/yyyy\")"));
        assertEquals(Value.of("007"), eval("=TEXT(7, \"000\")"));
        assertEquals(Value.of("12.5"), eval("=TEXT(12.5, \"General\")"));
    }

    /**
     * VALUE reads percentages, currency, grouping and leading numbers.
     */
    @Test
    void testValue() {
        assertEquals(Value.of(0.12), eval("=VALUE(\"12%\")"));
        assertEquals(Value.of(1234.5), eval("=VALUE(\"$1,234.50\")"));
        assertEquals(Value.of(1000), eval("=VALUE(\"1,000\")"));
        assertEquals(Value.of(0), eval("=VALUE(\"\")"));
        assertError(ErrorType.VALUE, eval("=VALUE(\"abc\")"));
    }
}
