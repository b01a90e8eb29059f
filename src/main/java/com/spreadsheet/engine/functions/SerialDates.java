package com.spreadsheet.engine.functions;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Serial date arithmetic: whole days since the spreadsheet epoch, time of day as
 * the fraction. Serial 25569 is 1970-01-01, so DATE(1900,1,1) is 2, matching the
 * serials spreadsheets show for dates after February 1900.
 * All conversions are UTC.
 */
public final class SerialDates {

    public static final int EPOCH_OFFSET = 25569;
    public static final long MILLIS_PER_DAY = 86_400_000L;
    /** 9999-12-31, the last representable date. */
    public static final int MAX_SERIAL = 2958465;

    private SerialDates() {
    }

    /** True for serials from 0 up to the end of 9999-12-31. */
    public static boolean isInRange(double serial) {
        return serial >= 0 && serial < MAX_SERIAL + 1;
    }

    public static double toSerial(LocalDate date) {
        return date.toEpochDay() + EPOCH_OFFSET;
    }

    public static double toSerial(LocalDateTime dateTime) {
        long millis = dateTime.toInstant(ZoneOffset.UTC).toEpochMilli();
        return (double) millis / MILLIS_PER_DAY + EPOCH_OFFSET;
    }

    public static LocalDateTime toDateTime(double serial) {
        long millis = Math.round((serial - EPOCH_OFFSET) * MILLIS_PER_DAY);
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
    }

    public static LocalDate toDate(double serial) {
        return toDateTime(serial).toLocalDate();
    }
}
