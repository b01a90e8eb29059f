package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.TypeCoercion;
import com.spreadsheet.engine.values.BooleanValue;
import com.spreadsheet.engine.values.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SUMIF-style criteria matching.
 */
class CriteriaTest {

    private TypeCoercion coercion;

    @BeforeEach
    void setUp() {
        coercion = new TypeCoercion();
    }

    private Predicate<Value> criteria(String text) {
        return Criteria.parse(Value.of(text), coercion);
    }

    /**
     * Numeric operators only match numbers, except "<>".
     */
    @Test
    void testNumericComparison() {
        Predicate<Value> greater = criteria(">20");
        assertTrue(greater.test(Value.of(30)));
        assertTrue(greater.test(Value.of("25")));
        assertFalse(greater.test(Value.of(20)));
        assertFalse(greater.test(Value.of("zzz")));

        Predicate<Value> notZero = criteria("<>0");
        assertTrue(notZero.test(Value.of("text")));
        assertFalse(notZero.test(Value.of(0)));
    }

    /**
     * Plain text is an exact, case-insensitive match; numbers match numerically.
     */
    @Test
    void testEquality() {
        assertTrue(criteria("apple").test(Value.of("APPLE")));
        assertFalse(criteria("apple").test(Value.of("apples")));
        assertTrue(criteria("5").test(Value.of(5)));
        assertTrue(Criteria.parse(Value.of(5), coercion).test(Value.of("5")));
        assertTrue(Criteria.parse(BooleanValue.TRUE, coercion).test(BooleanValue.TRUE));
        assertFalse(Criteria.parse(BooleanValue.TRUE, coercion).test(Value.of(1)));
    }

    /**
     * "*" and "?" are ordinary characters in plain-text criteria.
     */
    @Test
    void testNoWildcards() {
        assertTrue(criteria("a*").test(Value.of("A*")));
        assertFalse(criteria("a*").test(Value.of("apple")));
        assertFalse(criteria("c?t").test(Value.of("cat")));
        assertTrue(criteria("c?t").test(Value.of("c?t")));
        assertFalse(criteria("*.txt").test(Value.of("notes.txt")));
    }

    /**
     * Text ordering ignores numbers and blanks.
     */
    @Test
    void testTextComparison() {
        Predicate<Value> afterM = criteria(">m");
        assertTrue(afterM.test(Value.of("pear")));
        assertFalse(afterM.test(Value.of("apple")));
        assertFalse(afterM.test(Value.of(99)));
        assertFalse(afterM.test(Value.empty()));
        assertTrue(criteria("=Pear").test(Value.of("pear")));
    }
}
