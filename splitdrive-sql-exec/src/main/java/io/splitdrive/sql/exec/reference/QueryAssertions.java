package io.splitdrive.sql.exec.reference;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import io.splitdrive.sql.commons.types.JavaRow;
import org.apache.arrow.vector.util.Text;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Row level comparisons used by {@link DuckDbQueryRunner}. Values are normalized first so that
 * integers of any width compare equal, as do floats and doubles.
 */
public final class QueryAssertions {

    private static final int MAX_REPORTED_ROWS = 20;

    private QueryAssertions() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Both lists must hold the same rows the same number of times, in any order.
     */
    public static void assertEqualIgnoringOrder(List<JavaRow> expected, List<JavaRow> actual) {
        var expectedRows = normalizedRows(expected);
        var actualRows = normalizedRows(actual);
        var missing = Multisets.difference(expectedRows, actualRows);
        var unexpected = Multisets.difference(actualRows, expectedRows);
        if (!missing.isEmpty() || !unexpected.isEmpty()) {
            throw new AssertionError("Expected %d rows, got %d%n%s%s".formatted(
                    expected.size(), actual.size(), describe("L-> ", missing), describe("R-> ", unexpected)));
        }
    }

    /**
     * The rows must be equal position by position.
     */
    public static void assertEqualOrdered(List<JavaRow> expected, List<JavaRow> actual) {
        int common = Math.min(expected.size(), actual.size());
        for (int i = 0; i < common; i++) {
            var e = normalize(expected.get(i));
            var a = normalize(actual.get(i));
            if (!e.equals(a)) {
                throw new AssertionError("Row %d differs: expected %s, got %s".formatted(i, e, a));
            }
        }
        if (expected.size() != actual.size()) {
            throw new AssertionError("Expected %d rows, got %d".formatted(expected.size(), actual.size()));
        }
    }

    /**
     * The values of the key columns must appear in the same sequence in both lists.
     */
    public static void assertSortedOn(List<JavaRow> expected, List<JavaRow> actual, List<Integer> sortingKeys) {
        assertEqualOrdered(project(expected, sortingKeys), project(actual, sortingKeys));
    }

    static List<Object> normalize(JavaRow row) {
        var values = new Object[row.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = normalizeValue(row.get(i));
        }
        return Arrays.asList(values);
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof Double) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros();
        }
        if (value instanceof Text text) {
            return text.toString();
        }
        return value;
    }

    private static List<JavaRow> project(List<JavaRow> rows, List<Integer> columns) {
        var result = new ArrayList<JavaRow>(rows.size());
        for (var row : rows) {
            var values = new Object[columns.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = row.get(columns.get(i));
            }
            result.add(new JavaRow(values));
        }
        return result;
    }

    private static Multiset<List<Object>> normalizedRows(List<JavaRow> rows) {
        Multiset<List<Object>> result = HashMultiset.create();
        for (var row : rows) {
            result.add(normalize(row));
        }
        return result;
    }

    private static String describe(String prefix, Multiset<List<Object>> rows) {
        var sb = new StringBuilder();
        int reported = 0;
        for (var entry : rows.entrySet()) {
            if (reported++ == MAX_REPORTED_ROWS) {
                sb.append("...\n");
                break;
            }
            sb.append(prefix).append(entry.getElement());
            if (entry.getCount() > 1) {
                sb.append(" x").append(entry.getCount());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
