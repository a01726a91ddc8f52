package com.soundledger.domain.model.royalty;

import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * A calendar quarter that revenue and payouts are computed over.
 * <p>
 * Canonical form is {@code 2025-Q4}; the finance team's {@code Q4 2025} spelling is accepted on input.
 */
public record AccountingPeriod(int year, int quarter) implements Comparable<AccountingPeriod> {
    private static final Pattern CANONICAL = Pattern.compile("^(\\d{4})-Q([1-4])$");
    private static final Pattern SPOKEN = Pattern.compile("^Q([1-4])\\s+(\\d{4})$");

    public AccountingPeriod {
        if (year < 1900 || year > 9999) {
            throw new IllegalArgumentException("Period year must be between 1900 and 9999, got " + year);
        }
        if (quarter < 1 || quarter > 4) {
            throw new IllegalArgumentException("Period quarter must be between 1 and 4, got " + quarter);
        }
    }

    public static AccountingPeriod of(int year, int quarter) {
        return new AccountingPeriod(year, quarter);
    }

    public static AccountingPeriod containing(LocalDate date) {
        return new AccountingPeriod(date.getYear(), (date.getMonthValue() - 1) / 3 + 1);
    }

    public static AccountingPeriod parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("Period is required");

        var value = raw.trim().toUpperCase();

        var canonical = CANONICAL.matcher(value);
        if (canonical.matches()) {
            return new AccountingPeriod(Integer.parseInt(canonical.group(1)), Integer.parseInt(canonical.group(2)));
        }

        var spoken = SPOKEN.matcher(value);
        if (spoken.matches()) {
            return new AccountingPeriod(Integer.parseInt(spoken.group(2)), Integer.parseInt(spoken.group(1)));
        }

        throw new IllegalArgumentException("Invalid period format, expected yyyy-Qn: " + raw);
    }

    public LocalDate firstDay() {
        return LocalDate.of(year, (quarter - 1) * 3 + 1, 1);
    }

    public LocalDate lastDay() {
        return firstDay().plusMonths(3).minusDays(1);
    }

    public String label() {
        return "%d-Q%d".formatted(year, quarter);
    }

    @Override
    public int compareTo(AccountingPeriod o) {
        return year != o.year ? Integer.compare(year, o.year) : Integer.compare(quarter, o.quarter);
    }

    @Override
    public String toString() {
        return label();
    }
}
