package com.hunt.jobtracker.ingest.jobs;

import com.hunt.jobtracker.ingest.model.PayRange;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds an annual USD pay range in posting text. Patterns are tried from most to least
 * specific and the first hit wins; a loose dollar-amount scan is the last resort.
 */
@Component
public class PayRangeExtractor {
    /** Working hours per year used to annualize hourly rates. */
    public static final int HOURS_PER_YEAR = 2080;

    private static final String SEPARATOR = "\\s*(?:-|–|—|to)\\s*";

    private static final Pattern THOUSANDS_RANGE = Pattern.compile(
        "\\$(\\d{1,3}(?:\\.\\d+)?)[kK](?:\\s*/\\s*yr)?" + SEPARATOR + "\\$(\\d{1,3}(?:\\.\\d+)?)[kK](?:\\s*/\\s*yr)?"
    );
    private static final Pattern LABELLED_COMMA_RANGE = Pattern.compile(
        "(?is)compensation.{0,300}?\\$(\\d{1,3},\\d{3})(?:\\.\\d{2})?" + SEPARATOR + "\\$(\\d{1,3},\\d{3})(?:\\.\\d{2})?"
    );
    private static final Pattern COMMA_RANGE = Pattern.compile(
        "\\$(\\d{1,3},\\d{3})(?:\\.\\d{2})?" + SEPARATOR + "\\$(\\d{1,3},\\d{3})(?:\\.\\d{2})?"
    );
    private static final Pattern HOURLY_RANGE = Pattern.compile(
        "(?i)\\$(\\d{1,3}(?:\\.\\d{1,2})?)\\s*/\\s*(?:hr|hour)" + SEPARATOR + "\\$(\\d{1,3}(?:\\.\\d{1,2})?)\\s*/\\s*(?:hr|hour)"
    );

    /** Longest digit run the fallback scanner will parse. */
    private static final int MAX_SCANNED_DIGITS = 15;

    public PayRange extractPayRange(String text) {
        if (text == null || text.isBlank()) {
            return PayRange.EMPTY;
        }

        Matcher matcher = THOUSANDS_RANGE.matcher(text);
        if (matcher.find()) {
            return new PayRange(scaled(matcher.group(1), 1000), scaled(matcher.group(2), 1000));
        }
        matcher = LABELLED_COMMA_RANGE.matcher(text);
        if (matcher.find()) {
            return new PayRange(commaGrouped(matcher.group(1)), commaGrouped(matcher.group(2)));
        }
        matcher = COMMA_RANGE.matcher(text);
        if (matcher.find()) {
            return new PayRange(commaGrouped(matcher.group(1)), commaGrouped(matcher.group(2)));
        }
        matcher = HOURLY_RANGE.matcher(text);
        if (matcher.find()) {
            return new PayRange(scaled(matcher.group(1), HOURS_PER_YEAR), scaled(matcher.group(2), HOURS_PER_YEAR));
        }
        return scanDollarAmounts(text);
    }

    /**
     * Reads the first two {@code $} amounts in the text. A trailing {@code k}, or a value
     * under 1000, is taken to be in thousands.
     */
    PayRange scanDollarAmounts(String text) {
        Long min = null;
        Long max = null;
        int length = text.length();
        for (int i = 0; i < length && max == null; i++) {
            if (text.charAt(i) != '$') {
                continue;
            }
            int j = i + 1;
            StringBuilder digits = new StringBuilder();
            while (j < length && isAmountChar(text.charAt(j))) {
                if (Character.isDigit(text.charAt(j))) {
                    digits.append(text.charAt(j));
                }
                j++;
            }
            if (digits.length() == 0 || digits.length() > MAX_SCANNED_DIGITS) {
                continue;
            }
            long value = Long.parseLong(digits.toString());
            boolean thousandsSuffix = j < length && Character.toLowerCase(text.charAt(j)) == 'k';
            if (thousandsSuffix || value < 1000) {
                value *= 1000;
            }
            if (min == null) {
                min = value;
            } else {
                max = value;
            }
        }
        return min == null ? PayRange.EMPTY : new PayRange(min, max);
    }

    private static boolean isAmountChar(char c) {
        return (c >= '0' && c <= '9') || c == ',' || c == '.';
    }

    private static long scaled(String amount, int factor) {
        return new BigDecimal(amount)
            .multiply(BigDecimal.valueOf(factor))
            .setScale(0, RoundingMode.HALF_UP)
            .longValueExact();
    }

    private static long commaGrouped(String amount) {
        return Long.parseLong(amount.replace(",", ""));
    }
}
