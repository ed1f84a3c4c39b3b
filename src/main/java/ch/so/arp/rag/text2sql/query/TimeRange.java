package ch.so.arp.rag.text2sql.query;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive date range a question refers to.
 *
 * @param expression the words of the question the range was derived from
 * @param start first day of the range
 * @param end last day of the range, equal to {@code start} for a single day
 */
public record TimeRange(String expression, LocalDate start, LocalDate end) {

    public TimeRange {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range ends before it starts: " + start + " > " + end);
        }
    }

    public boolean singleDay() {
        return start.equals(end);
    }

    public String describe() {
        return singleDay() ? expression + " (" + start + ")" : expression + " (" + start + " to " + end + ")";
    }
}
