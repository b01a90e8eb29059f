package com.spreadsheet.engine.evaluation;

import com.spreadsheet.engine.values.ArrayValue;
import com.spreadsheet.engine.values.BooleanValue;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for number/text/boolean conversions and value ordering.
 */
class TypeCoercionTest {

    private TypeCoercion coercion;

    @BeforeEach
    void setUp() {
        coercion = new TypeCoercion();
    }

    /**
     * Raw cell input is classified into blank, number, boolean or text.
     */
    @Test
    void testParseInput() {
        assertTrue(coercion.parseInput("").isEmpty());
        assertTrue(coercion.parseInput(null).isEmpty());
        assertEquals(Value.of(42), coercion.parseInput("42"));
        assertEquals(Value.of(-0.5), coercion.parseInput("-.5"));
        assertEquals(Value.of(1000), coercion.parseInput("1e3"));
        assertEquals(BooleanValue.TRUE, coercion.parseInput("true"));
        assertEquals(Value.of("12abc"), coercion.parseInput("12abc"));
    }

    /**
     * Numbers come from booleans, numeric text and blanks; other text is 0.
     */
    @Test
    void testToNumber() {
        assertEquals(1, coercion.toNumber(BooleanValue.TRUE));
        assertEquals(3.5, coercion.toNumber(Value.of(" 3.5 ")));
        assertEquals(0, coercion.toNumber(Value.of("abc")));
        assertEquals(0, coercion.toNumber(Value.empty()));
        assertEquals(7, coercion.toNumber(ArrayValue.column(Arrays.asList(Value.of(7), Value.of(8)))));
    }

    /**
     * Whole numbers lose their ".0"; errors become their code.
     */
    @Test
    void testToText() {
        assertEquals("5", coercion.toText(Value.of(5.0)));
        assertEquals("2.5", coercion.toText(Value.of(2.5)));
        assertEquals("FALSE", coercion.toText(BooleanValue.FALSE));
        assertEquals("", coercion.toText(Value.empty()));
        assertEquals("#DIV/0!", coercion.toText(FormulaError.divZero()));
    }

    /**
     * Any non-empty text is truthy, even "FALSE".
     */
    @Test
    void testToBoolean() {
        assertFalse(coercion.toBoolean(Value.of(0)));
        assertTrue(coercion.toBoolean(Value.of(-2)));
        assertTrue(coercion.toBoolean(Value.of("FALSE")));
        assertFalse(coercion.toBoolean(Value.of("")));
        assertFalse(coercion.toBoolean(Value.empty()));
    }

    /**
     * Numeric text compares as a number; text compares case-insensitively; blanks adapt.
     */
    @Test
    void testCompare() {
        assertEquals(0, coercion.compare(Value.of(10), Value.of("10")));
        assertTrue(coercion.compare(Value.of(9), Value.of("10")) < 0);
        assertEquals(0, coercion.compare(Value.of("Apple"), Value.of("apple")));
        assertTrue(coercion.compare(Value.of("apple"), Value.of("banana")) < 0);
        assertEquals(0, coercion.compare(Value.empty(), Value.of(0)));
        assertEquals(0, coercion.compare(Value.empty(), Value.of("")));
        assertTrue(coercion.compare(BooleanValue.TRUE, BooleanValue.FALSE) > 0);
    }

    /**
     * Arrays are expanded in place.
     */
    @Test
    void testFlatten() {
        List<Value> flat = coercion.flatten(Arrays.asList(
                Value.of(1), ArrayValue.row(Arrays.asList(Value.of(2), Value.of(3))), Value.of(4)));
        assertEquals(Arrays.asList(Value.of(1), Value.of(2), Value.of(3), Value.of(4)), flat);
    }
}
