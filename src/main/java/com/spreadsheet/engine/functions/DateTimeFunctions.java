package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.EvalContext;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.function.ToIntFunction;

/**
 * Date and time functions over serial dates (see {@link SerialDates}).
 * Serials below 0 or past 9999-12-31 are #NUM!. TODAY and NOW read the context clock.
 */
public final class DateTimeFunctions {

    /** More months, and days, than lie between 1900 and 9999. */
    private static final double MAX_MONTH_SHIFT = 120_000;
    private static final double MAX_DAY_SHIFT = 3_700_000;

    private DateTimeFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("TODAY", 0, 0, (args, ctx) -> Value.of(SerialDates.toSerial(LocalDate.now(ctx.getClock()))));
        registry.register("NOW", 0, 0, (args, ctx) -> Value.of(SerialDates.toSerial(LocalDateTime.now(ctx.getClock()))));
        registry.register("DATE", 3, 3, DateTimeFunctions::date);
        registry.register("TIME", 3, 3, DateTimeFunctions::time);
        registry.register("YEAR", 1, 1, component(LocalDateTime::getYear));
        registry.register("MONTH", 1, 1, component(LocalDateTime::getMonthValue));
        registry.register("DAY", 1, 1, component(LocalDateTime::getDayOfMonth));
        registry.register("HOUR", 1, 1, component(LocalDateTime::getHour));
        registry.register("MINUTE", 1, 1, component(LocalDateTime::getMinute));
        registry.register("SECOND", 1, 1, component(LocalDateTime::getSecond));
        registry.register("WEEKDAY", 1, 2, DateTimeFunctions::weekday);
        registry.register("DATEDIF", 3, 3, DateTimeFunctions::dateDif);
        registry.register("EDATE", 2, 2, (args, ctx) -> shiftMonths(args, false));
        registry.register("EOMONTH", 2, 2, (args, ctx) -> shiftMonths(args, true));
    }

    /**
     * DATE(year, month, day). Years 0-99 mean 1900-1999; month and day overflow
     * roll into the following months and years. The result must fall in 1900-9999.
     */
    private static Value date(FunctionArgs args, EvalContext ctx) {
        long year = (long) Math.floor(args.number(0));
        double month = Math.floor(args.number(1));
        double day = Math.floor(args.number(2));
        if (year >= 0 && year <= 99) {
            year += 1900;
        }
        if (year < 1900 || year > 9999) {
            return FormulaError.num("Year must be between 1900 and 9999");
        }
        if (Math.abs(month) > MAX_MONTH_SHIFT || Math.abs(day) > MAX_DAY_SHIFT) {
            return outOfRange();
        }
        LocalDate date = LocalDate.of((int) year, 1, 1).plusMonths((long) month - 1).plusDays((long) day - 1);
        return serialInRange(SerialDates.toSerial(date));
    }

    /** TIME(hour, minute, second) as a fraction of a day. */
    private static Value time(FunctionArgs args, EvalContext ctx) {
        double hour = args.number(0);
        if (hour < 0 || hour >= 32768) {
            return FormulaError.num("Hour out of range");
        }
        return Value.of((hour * 3600 + args.number(1) * 60 + args.number(2)) / 86400);
    }

    private static FormulaFunction component(ToIntFunction<LocalDateTime> field) {
        return (args, ctx) -> {
            double serial = args.number(0);
            if (!SerialDates.isInRange(serial)) {
                return outOfRange();
            }
            return Value.of(field.applyAsInt(SerialDates.toDateTime(serial)));
        };
    }

    /**
     * WEEKDAY(serial, [type]): type 1 Sunday=1..Saturday=7, type 2 Monday=1..Sunday=7,
     * type 3 Monday=0..Sunday=6.
     */
    private static Value weekday(FunctionArgs args, EvalContext ctx) {
        double serial = args.number(0);
        if (!SerialDates.isInRange(serial)) {
            return outOfRange();
        }
        int isoDay = SerialDates.toDate(serial).getDayOfWeek().getValue(); // Monday=1
        switch ((int) args.number(1, 1)) {
            case 1:
                return Value.of(isoDay % 7 + 1);
            case 2:
                return Value.of(isoDay);
            case 3:
                return Value.of(isoDay - 1);
            default:
                return FormulaError.num("Invalid return_type for WEEKDAY");
        }
    }

    /**
     * DATEDIF(start, end, unit) with unit Y, M, D, MD, YM or YD.
     */
    private static Value dateDif(FunctionArgs args, EvalContext ctx) {
        double startSerial = args.number(0);
        double endSerial = args.number(1);
        String unit = args.text(2).toUpperCase(Locale.ROOT);
        if (!SerialDates.isInRange(startSerial) || !SerialDates.isInRange(endSerial)) {
            return outOfRange();
        }
        if (startSerial > endSerial) {
            return FormulaError.num("Start date must be before end date");
        }
        LocalDate start = SerialDates.toDate(startSerial);
        LocalDate end = SerialDates.toDate(endSerial);
        boolean dayNotReached = end.getDayOfMonth() < start.getDayOfMonth();

        switch (unit) {
            case "Y": {
                int years = end.getYear() - start.getYear();
                if (end.getMonthValue() < start.getMonthValue()
                        || (end.getMonthValue() == start.getMonthValue() && dayNotReached)) {
                    years--;
                }
                return Value.of(Math.max(0, years));
            }
            case "M": {
                int months = (end.getYear() - start.getYear()) * 12 + end.getMonthValue() - start.getMonthValue();
                if (dayNotReached) {
                    months--;
                }
                return Value.of(Math.max(0, months));
            }
            case "D":
                return Value.of(Math.floor(endSerial - startSerial));
            case "MD": {
                int days = end.getDayOfMonth() - start.getDayOfMonth();
                if (days < 0) {
                    days += end.withDayOfMonth(1).minusDays(1).getDayOfMonth();
                }
                return Value.of(days);
            }
            case "YM": {
                int months = end.getMonthValue() - start.getMonthValue();
                if (dayNotReached) {
                    months--;
                }
                return Value.of(months < 0 ? months + 12 : months);
            }
            case "YD": {
                long days = ChronoUnit.DAYS.between(anniversary(start, end.getYear()), end);
                if (days < 0) {
                    days = ChronoUnit.DAYS.between(anniversary(start, end.getYear() - 1), end);
                }
                return Value.of(days);
            }
            default:
                return FormulaError.value("Invalid unit for DATEDIF");
        }
    }

    /** The start date's month and day in another year; Feb 29 rolls to Mar 1. */
    private static LocalDate anniversary(LocalDate start, int year) {
        return LocalDate.of(year, start.getMonthValue(), 1).plusDays(start.getDayOfMonth() - 1L);
    }

    /**
     * EDATE(start, months) keeps the day, clamped to the target month's length;
     * EOMONTH(start, months) returns the last day of the target month.
     */
    private static Value shiftMonths(FunctionArgs args, boolean endOfMonth) {
        double serial = args.number(0);
        double months = Math.floor(args.number(1));
        if (!SerialDates.isInRange(serial) || Math.abs(months) > MAX_MONTH_SHIFT) {
            return outOfRange();
        }
        LocalDate shifted = SerialDates.toDate(serial).plusMonths((long) months);
        if (endOfMonth) {
            shifted = shifted.withDayOfMonth(shifted.lengthOfMonth());
        }
        return serialInRange(SerialDates.toSerial(shifted));
    }

    private static Value serialInRange(double serial) {
        return SerialDates.isInRange(serial) ? Value.of(serial) : outOfRange();
    }

    private static Value outOfRange() {
        return FormulaError.num("Date serial number out of range");
    }
}
