package com.mediaanalytics.etl.load;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * One calendar-month range partition of the interactions table: {@code [from, to)} on {@code event_date}.
 */
public final class MonthlyPartition implements Comparable<MonthlyPartition> {
    private final String parentTable;
    private final YearMonth month;

    private MonthlyPartition(String parentTable, YearMonth month) {
        this.parentTable = parentTable;
        this.month = month;
    }

    /**
     * The partition whose range covers {@code date}.
     */
    public static MonthlyPartition forDate(String parentTable, LocalDate date) {
        return new MonthlyPartition(parentTable, YearMonth.from(date));
    }

    /**
     * Distinct partitions covering the given dates, oldest first.
     */
    public static Set<MonthlyPartition> covering(String parentTable, Collection<LocalDate> dates) {
        Set<MonthlyPartition> partitions = new TreeSet<>();
        for (LocalDate date : dates) {
            partitions.add(forDate(parentTable, date));
        }
        return partitions;
    }

    /**
     * {@code <parent>_<yyyy>_<MM>}, e.g. {@code user_interactions_2025_03}.
     */
    public String name() {
        return String.format("%s_%04d_%02d", parentTable, month.getYear(), month.getMonthValue());
    }

    /**
     * First day of the month (inclusive).
     */
    public LocalDate from() {
        return month.atDay(1);
    }

    /**
     * First day of the next month (exclusive).
     */
    public LocalDate to() {
        return month.plusMonths(1).atDay(1);
    }

    public String getParentTable() {
        return parentTable;
    }

    public YearMonth getMonth() {
        return month;
    }

    @Override
    public int compareTo(MonthlyPartition other) {
        int byTable = parentTable.compareTo(other.parentTable);
        return byTable != 0 ? byTable : month.compareTo(other.month);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MonthlyPartition)) return false;
        MonthlyPartition that = (MonthlyPartition) o;
        return parentTable.equals(that.parentTable) && month.equals(that.month);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentTable, month);
    }

    @Override
    public String toString() {
        return name() + " [" + from() + ", " + to() + ")";
    }
}
