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
 * Tests for IF-style selection, boolean connectives and error fallbacks.
 */
class LogicalFunctionsTest {

    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
        engine.setCellValue("A1", "5");
        engine.setFormula("A2", "=1/0");
        engine.setFormula("A3", "=NA()");
    }

    private Value eval(String formula) {
        return engine.setFormula("Z99", formula).get("Z99");
    }

    private static void assertError(ErrorType expected, Value actual) {
        assertInstanceOf(FormulaError.class, actual);
        assertEquals(expected, ((FormulaError) actual).getErrorType());
    }

    /**
     * IF picks a branch; a missing false branch is FALSE; an unused error branch is harmless.
     */
    @Test
    void testIf() {
        assertEquals(Value.of("big"), eval("=IF(A1>3, \"big\", \"small\")"));
        assertEquals(BooleanValue.FALSE, eval("=IF(A1>10, 1)"));
        assertEquals(Value.of(1), eval("=IF(TRUE, 1, A2)"));
        assertError(ErrorType.DIV_ZERO, eval("=IF(A2, 1, 2)"));
        assertEquals(Value.of(2), eval("=IF(\"\", 1, 2)"));
    }

    /**
     * IFS returns the first true pair, #N/A when none is true.
     */
    @Test
    void testIfs() {
        assertEquals(Value.of("B"), eval("=IFS(A1>8, \"A\", A1>4, \"B\", TRUE, \"C\")"));
        assertError(ErrorType.NOT_AVAILABLE, eval("=IFS(A1>8, \"A\")"));
        assertError(ErrorType.VALUE, eval("=IFS(TRUE, 1, FALSE)"));
    }

    /**
     * IFERROR catches every error, IFNA only #N/A.
     */
    @Test
    void testErrorFallbacks() {
        assertEquals(Value.of("oops"), eval("=IFERROR(A2, \"oops\")"));
        assertEquals(Value.of(5), eval("=IFERROR(A1, \"oops\")"));
        assertEquals(Value.of("missing"), eval("=IFNA(A3, \"missing\")"));
        assertError(ErrorType.DIV_ZERO, eval("=IFNA(A2, \"missing\")"));
    }

    /**
     * SWITCH matches case-insensitively and falls back to its default.
     */
    @Test
    void testSwitchAndChoose() {
        assertEquals(Value.of(2), eval("=SWITCH(\"b\", \"A\", 1, \"B\", 2)"));
        assertEquals(Value.of("other"), eval("=SWITCH(A1, 1, \"one\", \"other\")"));
        assertError(ErrorType.NOT_AVAILABLE, eval("=SWITCH(9, 1, \"one\")"));
        assertEquals(Value.of("c"), eval("=CHOOSE(3, \"a\", \"b\", \"c\")"));
        assertError(ErrorType.VALUE, eval("=CHOOSE(4, \"a\", \"b\", \"c\")"));
    }

    /**
     * AND / OR / XOR ignore blanks and plain text; NOT negates.
     */
    @Test
    void testConnectives() {
        assertEquals(BooleanValue.TRUE, eval("=AND(TRUE, 1, \"x\", B9)"));
        assertEquals(BooleanValue.FALSE, eval("=AND(TRUE, 0)"));
        assertEquals(BooleanValue.TRUE, eval("=AND()"));
        assertEquals(BooleanValue.FALSE, eval("=OR()"));
        assertEquals(BooleanValue.TRUE, eval("=OR(FALSE, \"true\")"));
        assertEquals(BooleanValue.TRUE, eval("=XOR(TRUE, FALSE, FALSE)"));
        assertEquals(BooleanValue.FALSE, eval("=XOR(TRUE, 1)"));
        assertEquals(BooleanValue.FALSE, eval("=NOT(A1)"));
        assertError(ErrorType.DIV_ZERO, eval("=AND(TRUE, A2)"));
    }
}
