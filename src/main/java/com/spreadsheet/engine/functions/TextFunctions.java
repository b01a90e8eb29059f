package com.spreadsheet.engine.functions;

import com.spreadsheet.engine.evaluation.EvalContext;
import com.spreadsheet.engine.values.FormulaError;
import com.spreadsheet.engine.values.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.spreadsheet.engine.functions.FunctionRegistry.VARIADIC;

/**
 * String functions. Positions are 1-based throughout.
 */
public final class TextFunctions {

    private static final Pattern FIXED_DECIMAL = Pattern.compile("^(#+)?(0+)?(\\.)(0+)$");
    private static final Pattern CURRENCY_DECIMALS = Pattern.compile("\\.([0#]+)");
    private static final Pattern ZERO_PADDING = Pattern.compile("^0+$");
    private static final Pattern CURRENCY_TEXT = Pattern.compile("^[$€£¥]?\\s*([\\d,.-]+)\\s*[$€£¥]?$");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /** Longest string a cell may hold. */
    static final int MAX_TEXT_LENGTH = 32767;

    private TextFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("LEN", 1, 1, (args, ctx) -> Value.of(args.text(0).length()));
        registry.register("UPPER", 1, 1, (args, ctx) -> Value.of(args.text(0).toUpperCase(Locale.ROOT)));
        registry.register("LOWER", 1, 1, (args, ctx) -> Value.of(args.text(0).toLowerCase(Locale.ROOT)));
        registry.register("TRIM", 1, 1, (args, ctx) -> Value.of(args.text(0).trim().replaceAll("\\s+", " ")));
        registry.register("PROPER", 1, 1, (args, ctx) -> Value.of(proper(args.text(0))));
        registry.register("CONCATENATE", 1, VARIADIC, TextFunctions::concatenate);
        registry.register("CONCAT", 1, VARIADIC, TextFunctions::concatenate);
        registry.register("EXACT", 2, 2, (args, ctx) -> Value.of(args.text(0).equals(args.text(1))));
        registry.register("REPT", 2, 2, TextFunctions::rept);
        registry.register("LEFT", 1, 2, TextFunctions::left);
        registry.register("RIGHT", 1, 2, TextFunctions::right);
        registry.register("MID", 3, 3, TextFunctions::mid);
        registry.register("FIND", 2, 3, TextFunctions::find);
        registry.register("SEARCH", 2, 3, TextFunctions::search);
        registry.register("SUBSTITUTE", 3, 4, TextFunctions::substitute);
        registry.register("REPLACE", 4, 4, TextFunctions::replace);
        registry.register("TEXT", 2, 2, TextFunctions::text);
        registry.register("VALUE", 1, 1, TextFunctions::value);
    }

    private static Value concatenate(FunctionArgs args, EvalContext ctx) {
        StringBuilder result = new StringBuilder();
        for (Value value : args.flatten()) {
            result.append(ctx.getCoercion().toText(value));
        }
        return Value.of(result.toString());
    }

    private static String proper(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            result.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
            startOfWord = !Character.isLetter(c);
        }
        return result.toString();
    }

    private static Value rept(FunctionArgs args, EvalContext ctx) {
        double times = Math.floor(args.number(1));
        if (times < 0) {
            return FormulaError.value("REPT count must be non-negative");
        }
        String text = args.text(0);
        if (times * text.length() > MAX_TEXT_LENGTH) {
            return FormulaError.value("REPT result is longer than " + MAX_TEXT_LENGTH + " characters");
        }
        return Value.of(text.repeat((int) times));
    }

    private static Value left(FunctionArgs args, EvalContext ctx) {
        String text = args.text(0);
        double count = args.number(1, 1);
        if (count < 0) {
            return FormulaError.value("num_chars must be non-negative");
        }
        return Value.of(text.substring(0, (int) Math.min(Math.floor(count), text.length())));
    }

    private static Value right(FunctionArgs args, EvalContext ctx) {
        String text = args.text(0);
        double count = args.number(1, 1);
        if (count < 0) {
            return FormulaError.value("num_chars must be non-negative");
        }
        int start = (int) Math.max(0, text.length() - Math.floor(count));
        return Value.of(text.substring(start));
    }

    private static Value mid(FunctionArgs args, EvalContext ctx) {
        String text = args.text(0);
        double start = args.number(1);
        double count = args.number(2);
        if (start < 1) {
            return FormulaError.value("start_num must be at least 1");
        }
        if (count < 0) {
            return FormulaError.value("num_chars must be non-negative");
        }
        int from = (int) Math.min(Math.floor(start) - 1, text.length());
        int to = (int) Math.min((double) from + Math.floor(count), text.length());
        return Value.of(text.substring(from, to));
    }

    /**
     * FIND(find_text, within_text, [start_num]): case-sensitive.
     */
    private static Value find(FunctionArgs args, EvalContext ctx) {
        String needle = args.text(0);
        String haystack = args.text(1);
        double start = args.number(2, 1);
        Value invalid = checkStart(start, haystack);
        if (invalid != null) {
            return invalid;
        }
        int position = haystack.indexOf(needle, (int) start - 1);
        if (position < 0) {
            return FormulaError.value("Text not found");
        }
        return Value.of(position + 1);
    }

    /**
     * SEARCH(find_text, within_text, [start_num]): case-insensitive, ? and * wildcards.
     */
    private static Value search(FunctionArgs args, EvalContext ctx) {
        String needle = args.text(0);
        String haystack = args.text(1);
        double start = args.number(2, 1);
        Value invalid = checkStart(start, haystack);
        if (invalid != null) {
            return invalid;
        }
        int from = (int) start - 1;
        Matcher matcher = wildcard(needle).matcher(haystack.substring(from));
        if (!matcher.find()) {
            return FormulaError.value("Text not found");
        }
        return Value.of(matcher.start() + start);
    }

    /** Case-insensitive regex for a pattern where ? is one character and * any run. */
    private static Pattern wildcard(String pattern) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    private static Value checkStart(double start, String haystack) {
        if (start < 1) {
            return FormulaError.value("start_num must be at least 1");
        }
        if (start > haystack.length()) {
            return FormulaError.value("start_num exceeds text length");
        }
        return null;
    }

    /**
     * SUBSTITUTE(text, old_text, new_text, [instance_num]): all occurrences,
     * or only the given 1-based occurrence.
     */
    private static Value substitute(FunctionArgs args, EvalContext ctx) {
        String text = args.text(0);
        String oldText = args.text(1);
        String newText = args.text(2);
        if (oldText.isEmpty()) {
            return Value.of(text);
        }
        if (!args.has(3)) {
            return Value.of(text.replace(oldText, newText));
        }
        double instance = args.number(3);
        if (instance < 1) {
            return FormulaError.value("instance_num must be at least 1");
        }
        int position = -1;
        for (int i = 0; i < (int) instance; i++) {
            position = text.indexOf(oldText, position + (i == 0 ? 1 : oldText.length()));
            if (position < 0) {
                return Value.of(text);
            }
        }
        return Value.of(text.substring(0, position) + newText + text.substring(position + oldText.length()));
    }

    private static Value replace(FunctionArgs args, EvalContext ctx) {
        String text = args.text(0);
        double start = args.number(1);
        double count = args.number(2);
        String newText = args.text(3);
        if (start < 1) {
            return FormulaError.value("start_num must be at least 1");
        }
        if (count < 0) {
            return FormulaError.value("num_chars must be non-negative");
        }
        int from = (int) Math.min(Math.floor(start) - 1, text.length());
        int to = (int) Math.min((double) from + Math.floor(count), text.length());
        return Value.of(text.substring(0, from) + newText + text.substring(to));
    }

    /**
     * TEXT(value, format) for a fixed set of layouts:
     * "0.0%", "$#,##0.00", "0.00", "#,##0", "yyyy-mm-dd", "mm/dd/yyyy", "dd/mm/yyyy", "0000".
     */
    private static Value text(FunctionArgs args, EvalContext ctx) {
        double number = args.number(0);
        String format = args.text(1);
        String lower = format.toLowerCase(Locale.ROOT);

        if (format.contains("%")) {
            int decimals = Math.max(0, count(format, '0') - 1);
            return Value.of(fixed(number * 100, decimals) + "%");
        }
        if (format.startsWith("$")) {
            Matcher decimals = CURRENCY_DECIMALS.matcher(format);
            return Value.of("$" + fixed(number, decimals.find() ? decimals.group(1).length() : 2));
        }
        Matcher fixedDecimal = FIXED_DECIMAL.matcher(format);
        if (fixedDecimal.matches()) {
            return Value.of(fixed(number, fixedDecimal.group(4).length()));
        }
        if (format.contains(",")) {
            String[] parts = format.split("\\.", -1);
            int decimals = parts.length > 1 ? parts[1].replaceAll("[^0#]", "").length() : 0;
            NumberFormat grouped = NumberFormat.getNumberInstance(Locale.US);
            grouped.setMinimumFractionDigits(decimals);
            grouped.setMaximumFractionDigits(decimals);
            grouped.setRoundingMode(RoundingMode.HALF_UP);
            return Value.of(grouped.format(number));
        }
        if (lower.equals("yyyy-mm-dd") || lower.equals("mm/dd/yyyy") || lower.equals("dd/mm/yyyy")) {
            LocalDate date = SerialDates.toDate(number);
            String year = String.valueOf(date.getYear());
            String month = String.format("%02d", date.getMonthValue());
            String day = String.format("%02d", date.getDayOfMonth());
            if (lower.equals("yyyy-mm-dd")) {
                return Value.of(year + "-" + month + "-" + day);
            }
            if (lower.equals("mm/dd/yyyy")) {
                return Value.of(month + "/" + day + "/" + year);
            }
            return Value.of(day + "/" + month + "/" + year);
        }
        if (ZERO_PADDING.matcher(format).matches()) {
            String digits = String.valueOf((long) Math.floor(Math.abs(number)));
            StringBuilder padded = new StringBuilder();
            for (int i = digits.length(); i < format.length(); i++) {
                padded.append('0');
            }
            return Value.of(padded.append(digits).toString());
        }
        return Value.of(ctx.getCoercion().toText(Value.of(number)));
    }

    /**
     * VALUE(text): plain numbers, "12%", "$1,234.50", "1,000". #VALUE! otherwise.
     */
    private static Value value(FunctionArgs args, EvalContext ctx) {
        String text = args.text(0).trim();
        if (text.isEmpty()) {
            return Value.of(0);
        }
        if (text.endsWith("%")) {
            Double number = leadingNumber(text.substring(0, text.length() - 1));
            return number == null ? notANumber() : Value.of(number / 100);
        }
        Matcher currency = CURRENCY_TEXT.matcher(text);
        if (currency.matches()) {
            Double number = leadingNumber(currency.group(1).replace(",", ""));
            if (number != null) {
                return Value.of(number);
            }
        }
        Double number = leadingNumber(text.replace(",", ""));
        return number == null ? notANumber() : Value.of(number);
    }

    private static Value notANumber() {
        return FormulaError.value("Cannot convert text to number");
    }

    /** The number at the start of the text ("12abc" reads as 12), or null. */
    private static Double leadingNumber(String text) {
        Matcher matcher = LEADING_NUMBER.matcher(text.trim());
        return matcher.find() ? Double.valueOf(matcher.group()) : null;
    }

    private static String fixed(double number, int decimals) {
        return new BigDecimal(number).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }

    private static int count(String text, char c) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}
