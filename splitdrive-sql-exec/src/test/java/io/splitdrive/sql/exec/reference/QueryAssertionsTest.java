package io.splitdrive.sql.exec.reference;

import io.splitdrive.sql.commons.types.JavaRow;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QueryAssertionsTest {

    @Test
    public void testNumbersAreNormalized() {
        QueryAssertions.assertEqualIgnoringOrder(
                List.of(JavaRow.of((short) 1, 2.5f, new BigDecimal("1.50"))),
                List.of(JavaRow.of(1L, 2.5d, new BigDecimal("1.5"))));
    }

    @Test
    public void testDuplicatesCount() {
        var twice = List.of(JavaRow.of(1), JavaRow.of(1));
        assertThrows(AssertionError.class,
                () -> QueryAssertions.assertEqualIgnoringOrder(twice, List.of(JavaRow.of(1))));
        QueryAssertions.assertEqualIgnoringOrder(twice, List.of(JavaRow.of(1L), JavaRow.of(1)));
    }

    @Test
    public void testDifferenceReportsBothSides() {
        var expected = List.of(JavaRow.of(1, "a"), JavaRow.of(2, "b"), JavaRow.of(2, "b"));
        var actual = List.of(JavaRow.of(1L, "a"), JavaRow.of(9, "z"));
        var error = assertThrows(AssertionError.class, () -> QueryAssertions.assertEqualIgnoringOrder(expected, actual));
        assertTrue(error.getMessage().contains("L-> [2, b] x2"), error.getMessage());
        assertTrue(error.getMessage().contains("R-> [9, z]"), error.getMessage());
        assertFalse(error.getMessage().contains("[1, a]"), error.getMessage());
    }

    @Test
    public void testNulls() {
        QueryAssertions.assertEqualOrdered(List.of(JavaRow.of(null, "x")), List.of(JavaRow.of(null, "x")));
        assertThrows(AssertionError.class,
                () -> QueryAssertions.assertEqualOrdered(List.of(JavaRow.of((Object) null)), List.of(JavaRow.of(0))));
    }

    @Test
    public void testSortedOnKeysOnly() {
        var expected = List.of(JavaRow.of(1, "a"), JavaRow.of(1, "b"), JavaRow.of(2, "c"));
        var tiesSwapped = List.of(JavaRow.of(1, "b"), JavaRow.of(1, "a"), JavaRow.of(2, "c"));
        QueryAssertions.assertSortedOn(expected, tiesSwapped, List.of(0));
        assertThrows(AssertionError.class, () -> QueryAssertions.assertSortedOn(expected, tiesSwapped, List.of(1)));
    }
}
