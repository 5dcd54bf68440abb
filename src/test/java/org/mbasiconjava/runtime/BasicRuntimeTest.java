package org.mbasiconjava.runtime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mbasiconjava.frontend.astnode.Statement;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;
import org.mbasiconjava.runtime.runtimetypes.VarType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mbasiconjava.ProgramBuilder.*;

public class BasicRuntimeTest {

    private BasicRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new BasicRuntime();
        runtime.load(program(
                line(10, new Statement.Data(List.of(BasicValue.ofDouble(1), BasicValue.ofDouble(2)))),
                line(20, new Statement.Data(List.of(BasicValue.ofString("THREE")))),
                line(30, end())));
    }

    @Test
    void testLoadPositionsAtFirstStatement() {
        assertTrue(runtime.getPc().samePosition(ProgramCounter.running(10, 0)));
        assertEquals(3, runtime.data().size());
    }

    @Test
    void testLoadRejectsLineNumbersOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> runtime.load(program(line(65530, end()))));
    }

    @Test
    void testVariablesTakeTypeFromSuffixOrDefault() {
        assertEquals(VarType.STRING, runtime.resolveType("a$"));
        assertEquals(VarType.SINGLE, runtime.resolveType("a"));
        runtime.setDefaultType('a', VarType.INTEGER);
        assertEquals(VarType.INTEGER, runtime.resolveType("alpha"));
        runtime.setVariable("alpha", BasicValue.ofDouble(2.6));
        assertEquals(BasicValue.ofInteger(3), runtime.getVariable("alpha"));
        assertEquals("", runtime.getVariable("unset$").getString());
    }

    @Test
    void testArraysAutoDimensionToTen() {
        runtime.setArrayElement("a", new int[]{10}, BasicValue.ofDouble(5));
        assertEquals(5.0, runtime.getArrayElement("a", new int[]{10}).toNumber());
        BasicRuntimeException e = assertThrows(BasicRuntimeException.class,
                () -> runtime.getArrayElement("a", new int[]{11}));
        assertEquals(ErrorCode.SUBSCRIPT_OUT_OF_RANGE, e.getCode());
    }

    @Test
    void testDimTwiceIsDuplicateDefinition() {
        runtime.dimArray("m", new int[]{3, 4});
        assertEquals(20, runtime.getArray("m").size());
        BasicRuntimeException e = assertThrows(BasicRuntimeException.class,
                () -> runtime.dimArray("m", new int[]{2}));
        assertEquals(ErrorCode.DUPLICATE_DEFINITION, e.getCode());
    }

    @Test
    void testOptionBaseAfterDimIsRejected() {
        runtime.setArrayBase(1);
        runtime.dimArray("b", new int[]{3});
        assertThrows(BasicRuntimeException.class, () -> runtime.getArrayElement("b", new int[]{0}));
        BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> runtime.setArrayBase(0));
        assertEquals(ErrorCode.DUPLICATE_DEFINITION, e.getCode());
    }

    @Test
    void testEraseUnknownArray() {
        BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> runtime.eraseArray("nope"));
        assertEquals(ErrorCode.ILLEGAL_FUNCTION_CALL, e.getCode());
    }

    @Test
    void testDataReadAndRestore() {
        assertEquals(1.0, runtime.data().read().toNumber());
        runtime.data().restore(20);
        assertEquals("THREE", runtime.data().read().getString());
        BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> runtime.data().read());
        assertEquals(ErrorCode.OUT_OF_DATA, e.getCode());
        runtime.data().restore(15);
        assertEquals("THREE", runtime.data().read().getString(), "restore goes to the next DATA line");
        runtime.data().restore();
        assertEquals(1.0, runtime.data().read().toNumber());
    }

    @Test
    void testRestorePastLastDataLeavesNothingToRead() {
        runtime.data().restore(1000);
        assertFalse(runtime.data().hasMore());
        BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> runtime.data().read());
        assertEquals(ErrorCode.OUT_OF_DATA, e.getCode());
    }

    @Test
    void testControlStackPopsByKind() {
        ProgramCounter here = ProgramCounter.running(10, 0);
        runtime.pushFrame(ControlFrame.gosub(here));
        runtime.pushFrame(ControlFrame.whileLoop(here));
        assertEquals(ControlFrame.Kind.GOSUB, runtime.popFrame(ControlFrame.Kind.GOSUB).kind());
        assertNull(runtime.popFrame(ControlFrame.Kind.GOSUB));
        assertNotNull(runtime.popFrame(ControlFrame.Kind.WHILE));
    }

    @Test
    void testForLoopsKeepActivationOrder() {
        ProgramCounter here = ProgramCounter.running(10, 0);
        runtime.startLoop(new ForLoopState("i", here, 5, 1));
        runtime.startLoop(new ForLoopState("j", here, 5, 1));
        assertEquals("j", runtime.mostRecentLoop().variable());
        runtime.startLoop(new ForLoopState("i", here, 3, 1));
        assertEquals("i", runtime.mostRecentLoop().variable());
        runtime.endLoop("i");
        assertEquals("j", runtime.mostRecentLoop().variable());
    }

    @Test
    void testResetKeepsProgramAndErrorVariables() {
        runtime.setVariable("x", BasicValue.ofDouble(1));
        runtime.setVariable(BasicRuntime.ERR_VARIABLE, BasicValue.ofInteger(5));
        runtime.data().read();
        runtime.reset();
        assertFalse(runtime.hasVariable("x"));
        assertEquals(5, runtime.getVariable(BasicRuntime.ERR_VARIABLE).toInteger());
        assertEquals(1.0, runtime.data().read().toNumber());
        assertEquals(3, runtime.table().size());
    }

    @Test
    void testCaptureAndRestoreVariables() {
        runtime.setVariable("a", BasicValue.ofDouble(1));
        runtime.setVariable("b", BasicValue.ofDouble(2));
        runtime.dimArray("c", new int[]{2});
        BasicRuntime.VariableSnapshot kept = runtime.captureVariables(List.of("a", "c()"));
        runtime.reset();
        runtime.restoreVariables(kept);
        assertTrue(runtime.hasVariable("a"));
        assertFalse(runtime.hasVariable("b"));
        assertTrue(runtime.hasArray("c"));
    }

    @Test
    void testBreakpoints() {
        runtime.addBreakpoint(20, 0);
        assertTrue(runtime.isBreakpoint(ProgramCounter.running(20, 0).withReason(StopReason.STOP)));
        runtime.removeBreakpoint(20, 0);
        assertFalse(runtime.isBreakpoint(ProgramCounter.running(20, 0)));
    }
}
