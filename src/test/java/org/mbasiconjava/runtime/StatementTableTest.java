package org.mbasiconjava.runtime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mbasiconjava.ProgramBuilder.*;

public class StatementTableTest {

    private StatementTable table;

    @BeforeEach
    void setUp() {
        table = new StatementTable();
        table.build(program(
                line(30, end()),
                line(10, let("a", num(1)), let("b", num(2))),
                line(20)));
    }

    @Test
    void testFirstSkipsNothingAndOrdersLines() {
        assertEquals(List.of(10, 20, 30), table.lineNumbers());
        assertTrue(table.first().samePosition(ProgramCounter.running(10, 0)));
    }

    @Test
    void testNextWalksStatementsThenSkipsEmptyLines() {
        ProgramCounter pc = ProgramCounter.running(10, 0);
        pc = table.next(pc);
        assertTrue(pc.samePosition(ProgramCounter.running(10, 1)));
        pc = table.next(pc);
        assertTrue(pc.samePosition(ProgramCounter.running(30, 0)), "line 20 has no statements");
        pc = table.next(pc);
        assertTrue(pc.isHalted());
        assertEquals(StopReason.END, pc.reason());
    }

    @Test
    void testFindLine() {
        assertTrue(table.findLine(30).isRunning());
        ProgramCounter missing = table.findLine(25);
        assertTrue(missing.isHalted());
        assertEquals(StopReason.ERROR, missing.reason());
    }

    @Test
    void testGetAndValid() {
        assertNotNull(table.get(ProgramCounter.running(10, 1)));
        assertNull(table.get(ProgramCounter.running(10, 2)));
        assertFalse(table.valid(ProgramCounter.halted(StopReason.END)));
    }

    @Test
    void testMergeReplacesAndInserts() {
        table.merge(program(line(10, stop()), line(15, end())));
        assertEquals(List.of(10, 15, 20, 30), table.lineNumbers());
        assertEquals(1, table.line(10).statements().size());
    }

    @Test
    void testDeleteRange() {
        table.deleteRange(10, 20);
        assertEquals(List.of(30), table.lineNumbers());
        table.deleteRange(40, 35);
        assertEquals(1, table.size());
    }
}
