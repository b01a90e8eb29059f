package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.TypeCoercion;
import com.spreadsheet.engine.models.LoadOrder;
import com.spreadsheet.engine.services.FormulaEngine;
import com.spreadsheet.engine.values.ErrorType;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.NumberValue;
import com.spreadsheet.engine.values.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for serial-date functions, with the clock fixed at 2024-03-15 10:30 UTC.
 */
class DateTimeFunctionsTest {

    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC);
        engine = new FormulaEngine(FunctionRegistry.withBuiltins(), new TypeCoercion(), clock, LoadOrder.LENGTH);
    }

    private Value eval(String formula) {
        return engine.setFormula("Z99", formula).get("Z99");
    }

    private double number(String formula) {
        Value value = eval(formula);
        assertInstanceOf(NumberValue.class, value, formula + " gave " + value);
        return ((NumberValue) value).getNumber();
    }

    private static void assertError(ErrorType expected, Value actual) {
        assertInstanceOf(FormulaError.class, actual);
        assertEquals(expected, ((FormulaError) actual).getErrorType());
    }

    /**
     * Serial 25569 is 1970-01-01, so 1900-01-01 is 2.
     */
    @Test
    void testSerialDates() {
        assertEquals(25569, SerialDates.toSerial(LocalDate.of(1970, 1, 1)));
        assertEquals(2, number("=DATE(1900, 1, 1)"));
        assertEquals(LocalDate.of(2024, 2, 29), SerialDates.toDate(45351));
    }

    /**
     * TODAY and NOW read the injected clock.
     */
    @Test
    void testTodayAndNow() {
        assertEquals(45366, number("=TODAY()"));
        assertEquals(45366.4375, number("=NOW()"), 1e-9);
        assertEquals(10, number("=HOUR(NOW())"));
        assertEquals(30, number("=MINUTE(NOW())"));
    }

    /**
     * DATE maps two-digit years and rolls month/day overflow forward.
     */
    @Test
    void testDate() {
        assertEquals(45351, number("=DATE(2024, 2, 29)"));
        assertEquals(2025, number("=YEAR(DATE(2024, 13, 1))"));
        assertEquals(1, number("=MONTH(DATE(2024, 13, 1))"));
        assertEquals(31, number("=DAY(DATE(2024, 1, 0))"));
        assertEquals(1999, number("=YEAR(DATE(99, 6, 1))"));
        assertError(ErrorType.NUM, eval("=DATE(1850, 1, 1)"));
    }

    /**
     * Dates stop at 9999-12-31 however the arguments overflow.
     */
    @Test
    void testDateRange() {
        assertEquals(SerialDates.MAX_SERIAL, number("=DATE(9999, 12, 31)"));
        assertEquals(9999, number("=YEAR(2958465)"));
        assertError(ErrorType.NUM, eval("=DATE(9999, 13, 1)"));
        assertError(ErrorType.NUM, eval("=DATE(9999, 12, 32)"));
        assertError(ErrorType.NUM, eval("=DATE(2024, 99999999999999, 1)"));
        assertError(ErrorType.NUM, eval("=DATE(2024, -99999999999999, 1)"));
        assertError(ErrorType.NUM, eval("=DATE(2024, 1, 99999999999999)"));
        assertError(ErrorType.NUM, eval("=DATE(1900, 1, -5)"));
        assertError(ErrorType.NUM, eval("=YEAR(99999999999)"));
        assertError(ErrorType.NUM, eval("=WEEKDAY(2958466)"));
        assertError(ErrorType.NUM, eval("=DATEDIF(1, 99999999999, \"D\")"));
    }

    /**
     * Components of a serial and TIME fractions.
     */
    @Test
    void testComponentsAndTime() {
        assertEquals(0.5, number("=TIME(12, 0, 0)"));
        assertEquals(18, number("=HOUR(0.75)"));
        assertEquals(15, number("=DAY(45366)"));
        assertEquals(45, number("=SECOND(TIME(1, 2, 45))"));
        assertError(ErrorType.NUM, eval("=YEAR(-1)"));
        assertError(ErrorType.NUM, eval("=TIME(-1, 0, 0)"));
    }

    /**
     * WEEKDAY numbering schemes; 2024-03-15 is a Friday.
     */
    @Test
    void testWeekday() {
        assertEquals(6, number("=WEEKDAY(45366)"));
        assertEquals(5, number("=WEEKDAY(45366, 2)"));
        assertEquals(4, number("=WEEKDAY(45366, 3)"));
        assertError(ErrorType.NUM, eval("=WEEKDAY(45366, 9)"));
    }

    /**
     * DATEDIF counts whole units between two dates.
     */
    @Test
    void testDatedif() {
        assertEquals(3, number("=DATEDIF(DATE(2020,2,29), DATE(2024,2,28), \"Y\")"));
        assertEquals(47, number("=DATEDIF(DATE(2020,2,29), DATE(2024,2,28), \"M\")"));
        assertEquals(1460, number("=DATEDIF(DATE(2020,2,29), DATE(2024,2,28), \"D\")"));
        assertEquals(14, number("=DATEDIF(DATE(2024,1,20), DATE(2024,3,5), \"MD\")"));
        assertEquals(2, number("=DATEDIF(DATE(2023,11,20), DATE(2024,2,10), \"YM\")"));
        assertEquals(60, number("=DATEDIF(DATE(2023,1,15), DATE(2024,3,15), \"YD\")"));
        assertError(ErrorType.NUM, eval("=DATEDIF(DATE(2024,1,2), DATE(2024,1,1), \"D\")"));
        assertError(ErrorType.VALUE, eval("=DATEDIF(DATE(2024,1,1), DATE(2024,1,2), \"W\")"));
    }

    /**
     * EDATE clamps to the month's length; EOMONTH gives the last day.
     */
    @Test
    void testMonthShifts() {
        assertEquals(45351, number("=EDATE(DATE(2024,1,31), 1)"));
        assertEquals(45351, number("=EOMONTH(DATE(2024,1,15), 1)"));
        assertEquals(31, number("=DAY(EOMONTH(DATE(2024,1,15), -1))"));
        assertEquals(12, number("=MONTH(EOMONTH(DATE(2024,1,15), -1))"));
    }

    /**
     * Month shifts that leave the date range are #NUM!.
     */
    @Test
    void testMonthShiftRange() {
        assertError(ErrorType.NUM, eval("=EDATE(1, 99999999999999)"));
        assertError(ErrorType.NUM, eval("=EOMONTH(1, -99999999999999)"));
        assertError(ErrorType.NUM, eval("=EDATE(DATE(9999, 12, 1), 1)"));
        assertError(ErrorType.NUM, eval("=EDATE(99999999999, 1)"));
        assertEquals(SerialDates.MAX_SERIAL, number("=EOMONTH(DATE(9999, 11, 15), 1)"));
    }
}
