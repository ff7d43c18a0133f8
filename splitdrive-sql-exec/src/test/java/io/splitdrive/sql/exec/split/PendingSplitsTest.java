package io.splitdrive.sql.exec.split;

import io.splitdrive.sql.exec.TestSchemas;
import io.splitdrive.sql.exec.UnknownOrClosedNodeException;
import io.splitdrive.sql.exec.task.ScriptedTask;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class PendingSplitsTest {

    private static final Split S1 = Split.of(new RowsSplit("s1", TestSchemas.ID_NAME, TestSchemas.S1_ROWS));
    private static final Split S2 = Split.of(new RowsSplit("s2", TestSchemas.ID_NAME, TestSchemas.S2_ROWS));

    @Test
    public void testDeliverInOrderThenClose() {
        var task = new ScriptedTask(TestSchemas.ID_NAME, Set.of("0"));
        var pending = PendingSplits.forNode("0", List.of(S1, S2));
        assertFalse(pending.isDelivered());
        pending.deliver(task);
        assertTrue(pending.isDelivered());
        assertEquals(List.of("addSplit:0:rows:s1", "addSplit:0:rows:s2", "noMoreSplits:0"), task.events());
    }

    @Test
    public void testSecondDeliveryIsIgnored() {
        var task = new ScriptedTask(TestSchemas.ID_NAME, Set.of("0"));
        var pending = PendingSplits.forNode("0", List.of(S1));
        pending.accept(task);
        pending.accept(task);
        pending.deliver(task);
        assertEquals(List.of("addSplit:0:rows:s1", "noMoreSplits:0"), task.events());
    }

    @Test
    public void testNodesInMapOrder() {
        var task = new ScriptedTask(TestSchemas.ID_NAME, Set.of("1", "2"));
        var map = new LinkedHashMap<String, List<Split>>();
        map.put("2", List.of(S2));
        map.put("1", List.of(S1));
        PendingSplits.of(map).deliver(task);
        assertEquals(List.of("addSplit:2:rows:s2", "noMoreSplits:2", "addSplit:1:rows:s1", "noMoreSplits:1"),
                task.events());
    }

    @Test
    public void testNodeWithoutSplitsIsStillClosed() {
        var task = new ScriptedTask(TestSchemas.ID_NAME, Set.of("0"));
        PendingSplits.forNode("0", List.of()).deliver(task);
        assertEquals(List.of("noMoreSplits:0"), task.events());
    }

    @Test
    public void testNoneDeliversNothing() {
        var task = new ScriptedTask(TestSchemas.ID_NAME, Set.of("0"));
        var pending = PendingSplits.none();
        pending.deliver(task);
        assertTrue(pending.isDelivered());
        assertTrue(task.events().isEmpty());
    }

    @Test
    public void testRejectedSplitPropagatesAndStaysConsumed() {
        var task = new ScriptedTask(TestSchemas.ID_NAME, Set.of("0"));
        var pending = PendingSplits.forNode("7", List.of(S1));
        var e = assertThrows(UnknownOrClosedNodeException.class, () -> pending.deliver(task));
        assertEquals("7", e.getNodeId());
        assertTrue(pending.isDelivered());
        pending.deliver(task);
        assertTrue(task.events().isEmpty());
    }
}
