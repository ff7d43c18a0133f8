package io.splitdrive.sql.exec.split;

import io.splitdrive.sql.exec.TestSchemas;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RowsSplitTest {

    @Test
    public void testSplitIdDependsOnRows() {
        var first = new RowsSplit("s1", TestSchemas.ID_NAME, TestSchemas.S1_ROWS);
        var same = new RowsSplit("s1", TestSchemas.ID_NAME, TestSchemas.S1_ROWS);
        var other = new RowsSplit("s1", TestSchemas.ID_NAME, TestSchemas.S2_ROWS);
        assertEquals(first.splitId(), same.splitId());
        assertNotEquals(first.splitId(), other.splitId());
        assertTrue(first.splitId().startsWith("rows:s1:"));
    }
}
