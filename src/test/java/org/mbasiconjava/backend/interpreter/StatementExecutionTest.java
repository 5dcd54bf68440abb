package org.mbasiconjava.backend.interpreter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mbasiconjava.frontend.astnode.Line;
import org.mbasiconjava.frontend.astnode.Operator;
import org.mbasiconjava.frontend.astnode.PrintSeparator;
import org.mbasiconjava.frontend.astnode.Statement;
import org.mbasiconjava.io.BufferedConsole;
import org.mbasiconjava.runtime.BasicRuntime;
import org.mbasiconjava.runtime.StopReason;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;
import org.mbasiconjava.runtime.runtimetypes.VarType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mbasiconjava.ProgramBuilder.*;

public class StatementExecutionTest {

    private BasicRuntime runtime;
    private BufferedConsole console;
    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        runtime = new BasicRuntime();
        console = new BufferedConsole();
        interpreter = new Interpreter(runtime, console);
    }

    private ExecutionOutcome run(Line... lines) {
        runtime.load(program(lines));
        interpreter.start();
        return interpreter.run();
    }

    // PRINT

    @Test
    void testCommaMovesToNextZone() {
        run(line(10, new Statement.Print(null, List.of(str("A"), str("B")),
                List.of(PrintSeparator.COMMA, PrintSeparator.NONE))));
        assertEquals("A" + " ".repeat(13) + "B\n", console.getOutput());
    }

    @Test
    void testTrailingSemicolonSuppressesNewline() {
        run(line(10, new Statement.Print(null, List.of(str("A")), List.of(PrintSeparator.SEMICOLON)),
                print(str("B"))));
        assertEquals("AB\n", console.getOutput());
    }

    @Test
    void testEmptyPrintIsNewline() {
        run(line(10, new Statement.Print(null, List.of(), List.of())));
        assertEquals("\n", console.getOutput());
    }

    @Test
    void testTabUsesLiveColumn() {
        run(line(10, print(str("AB"), fn("tab", num(5)), str("C"))));
        assertEquals("AB  C\n", console.getOutput());
    }

    @Test
    void testPrintUsing() {
        run(line(10, new Statement.PrintUsing(null, str("###.##"), List.of(num(3.14159)), false)));
        assertEquals("  3.14\n", console.getOutput());
    }

    @Test
    void testWriteQuotesStrings() {
        run(line(10, new Statement.Write(null, List.of(num(1), str("A"), num(-2.5)))));
        assertEquals("1,\"A\",-2.5\n", console.getOutput());
    }

    @Test
    void testLprintGoesToPrinter() {
        BufferedConsole printer = new BufferedConsole();
        interpreter.setPrinter(printer);
        run(line(10, new Statement.Lprint(List.of(str("P")), List.of(PrintSeparator.NONE))));
        assertEquals("P\n", printer.getOutput());
        assertEquals("", console.getOutput());
    }

    // Assignment and types

    @Test
    void testStringConcatenationAndTypeMismatch() {
        run(line(10, let("a$", add(str("AB"), str("CD"))), print(var("a$"))));
        assertEquals("ABCD\n", console.getOutput());

        ExecutionOutcome outcome = run(line(10, let("a", str("X"))));
        assertEquals(ErrorCode.TYPE_MISMATCH, outcome.error().code());
    }

    @Test
    void testIntegerVariableOverflow() {
        ExecutionOutcome outcome = run(line(10, let("a%", num(40000))));
        assertEquals(ErrorCode.OVERFLOW, outcome.error().code());
    }

    @Test
    void testSinglePrecisionOverflow() {
        ExecutionOutcome outcome = run(line(10, let("a!", bin(Operator.MULTIPLY, num(1e20), num(1e20)))));
        assertEquals(ErrorCode.OVERFLOW, outcome.error().code());
        assertEquals(0.0, runtime.getVariable("a!").toNumber(), "variable keeps its old value");

        run(
                line(10, onErrorGoto(100)),
                line(20, let("a!", bin(Operator.MULTIPLY, num(1e20), num(1e20)))),
                line(30, new Statement.PrintUsing(null, str("##.##"), List.of(var("a!")), false)),
                line(40, end()),
                line(100, print(fn("err"))),
                line(110, resumeNext()));
        assertEquals(" 6 \n 0.00\n", console.getOutput());
    }

    @Test
    void testValOverflowIsTrappable() {
        run(
                line(10, onErrorGoto(100)),
                line(20, print(fn("val", str("&H123456789ABCDEF0123")))),
                line(30, print(fn("val", str("1E400")))),
                line(40, end()),
                line(100, print(fn("err"))),
                line(110, resumeNext()));
        assertEquals(" 6 \n 6 \n", console.getOutput());
    }

    @Test
    void testRelationalResultIsMinusOne() {
        run(line(10, print(eq(num(1), num(1)))));
        assertEquals("-1 \n", console.getOutput());
    }

    @Test
    void testSwap() {
        run(line(10, let("a", num(1)), let("b", num(2)), new Statement.Swap(var("a"), var("b"))));
        assertEquals(2.0, runtime.getVariable("a").toNumber());
        assertEquals(1.0, runtime.getVariable("b").toNumber());

        ExecutionOutcome outcome = run(line(10, new Statement.Swap(var("a"), var("b$"))));
        assertEquals(ErrorCode.TYPE_MISMATCH, outcome.error().code());
    }

    @Test
    void testMidAssign() {
        run(line(10, let("a$", str("HELLO")),
                new Statement.MidAssign(var("a$"), num(2), num(3), str("XYZW"))));
        assertEquals("HXYZO", runtime.getVariable("a$").getString());
    }

    @Test
    void testDefType() {
        run(line(10, new Statement.DefType(VarType.STRING, List.of('s')), let("sname", str("X"))));
        assertEquals("X", runtime.getVariable("sname").getString());
    }

    // Arrays

    @Test
    void testDimAndSubscripts() {
        run(line(10, new Statement.Dim(List.of(arr("a", num(5)))),
                let(arr("a", num(5)), num(7)),
                print(arr("a", num(5)))));
        assertEquals(" 7 \n", console.getOutput());

        ExecutionOutcome outcome = run(line(10, new Statement.Dim(List.of(arr("a", num(5)))),
                let(arr("a", num(6)), num(1))));
        assertEquals(ErrorCode.SUBSCRIPT_OUT_OF_RANGE, outcome.error().code());
    }

    @Test
    void testRedimIsDuplicateDefinition() {
        ExecutionOutcome outcome = run(line(10,
                new Statement.Dim(List.of(arr("a", num(5)))),
                new Statement.Dim(List.of(arr("a", num(5))))));
        assertEquals(ErrorCode.DUPLICATE_DEFINITION, outcome.error().code());
    }

    @Test
    void testEraseAllowsRedim() {
        ExecutionOutcome outcome = run(line(10,
                new Statement.Dim(List.of(arr("a", num(5)))),
                new Statement.Erase(List.of("a")),
                new Statement.Dim(List.of(arr("a", num(20))))));
        assertTrue(outcome.isFinished());
        assertEquals(21, runtime.getArray("a").size());
    }

    // DATA

    @Test
    void testReadDataAndRestore() {
        run(
                line(10, new Statement.Data(List.of(BasicValue.ofDouble(1), BasicValue.ofString("TWO")))),
                line(20, new Statement.Read(List.of(var("a"), var("b$")))),
                line(30, print(var("a"), var("b$"))),
                line(40, new Statement.Restore(null), new Statement.Read(List.of(var("c$")))),
                line(50, print(var("c$"))));
        assertEquals(" 1 TWO\n1\n", console.getOutput());
    }

    @Test
    void testReadStringIntoNumberIsSyntaxError() {
        ExecutionOutcome outcome = run(
                line(10, new Statement.Data(List.of(BasicValue.ofString("ABC")))),
                line(20, new Statement.Read(List.of(var("a")))));
        assertEquals(ErrorCode.SYNTAX_ERROR, outcome.error().code());
    }

    @Test
    void testRestorePastLastDataRunsOutOfData() {
        ExecutionOutcome outcome = run(
                line(10, new Statement.Data(List.of(BasicValue.ofDouble(1)))),
                line(20, new Statement.Restore(30)),
                line(30, new Statement.Read(List.of(var("a")))));
        assertEquals(ErrorCode.OUT_OF_DATA, outcome.error().code());
        assertEquals(30, outcome.error().line());
    }

    @Test
    void testOutOfData() {
        ExecutionOutcome outcome = run(line(10, new Statement.Read(List.of(var("a")))));
        assertEquals(ErrorCode.OUT_OF_DATA, outcome.error().code());
    }

    // User functions

    @Test
    void testDefFnBindsParametersTemporarily() {
        run(
                line(10, new Statement.DefFn("fnsq", List.of("x"), bin(Operator.MULTIPLY, var("x"), var("x")))),
                line(20, let("x", num(7))),
                line(30, print(fn("fnsq", num(4)), var("x"))));
        assertEquals(" 16  7 \n", console.getOutput());
    }

    @Test
    void testDefFnParameterDoesNotLeak() {
        run(
                line(10, new Statement.DefFn("fna", List.of("y"), add(var("y"), num(1)))),
                line(20, let("r", fn("fna", num(1)))));
        assertFalse(runtime.hasVariable("y"));
        assertEquals(2.0, runtime.getVariable("r").toNumber());
    }

    @Test
    void testUndefinedUserFunction() {
        ExecutionOutcome outcome = run(line(10, let("r", fn("fnz", num(1)))));
        assertEquals(ErrorCode.UNDEFINED_USER_FUNCTION, outcome.error().code());
    }

    // INPUT

    @Test
    void testInputWaitsForHostAndKeepsPrompt() {
        ExecutionOutcome outcome = run(
                line(10, new Statement.Input(null, "N", false, List.of(var("n")))),
                line(20, print(bin(Operator.MULTIPLY, var("n"), num(2)))));
        assertEquals(StopReason.INPUT_WAIT, outcome.reason());
        assertEquals(10, outcome.pc().line());
        assertEquals("N? ", console.getOutput());

        interpreter.provideInput("21");
        outcome = interpreter.run();
        assertEquals(StopReason.END, outcome.reason());
        assertEquals("N? 21\n 42 \n", console.getOutput());
    }

    @Test
    void testInputFromConsoleSplitsFields() {
        console.addInput("3,\"a, b\"");
        run(line(10, new Statement.Input(null, null, false, List.of(var("n"), var("s$")))),
                line(20, print(var("n"), var("s$"))));
        assertEquals("a, b", runtime.getVariable("s$").getString());
        assertEquals(3.0, runtime.getVariable("n").toNumber());
    }

    @Test
    void testQuotedInputKeepsInnerSpaces() {
        console.addInput("\"  hi  \",  plain  ");
        run(line(10, new Statement.Input(null, null, false, List.of(var("s$"), var("t$")))));
        assertEquals("  hi  ", runtime.getVariable("s$").getString());
        assertEquals("plain", runtime.getVariable("t$").getString());
    }

    @Test
    void testMalformedNumberAsksAgain() {
        console.addInput("abc", "5");
        run(line(10, new Statement.Input(null, null, false, List.of(var("n")))));
        assertTrue(console.getOutput().contains("?Redo from start"));
        assertEquals(5.0, runtime.getVariable("n").toNumber());
    }

    @Test
    void testLineInputTakesWholeLine() {
        console.addInput("one, two");
        run(line(10, new Statement.LineInput(null, "", var("l$"))));
        assertEquals("one, two", runtime.getVariable("l$").getString());
    }

    // Misc

    @Test
    void testClearKeepsRunning() {
        run(line(10, let("a", num(1)), new Statement.Clear(), print(var("a"))));
        assertEquals(" 0 \n", console.getOutput());
    }

    @Test
    void testDirectStatementsCanUseProgramVariables() {
        run(line(10, let("a", num(3))));
        ExecutionOutcome outcome = interpreter.executeDirect(List.of(print(var("a"))));
        assertEquals(StopReason.END, outcome.reason());
        assertEquals(" 3 \n", console.getOutput());
    }

    @Test
    void testHardwareStatementsEvaluateOperands() {
        ExecutionOutcome outcome = run(line(10,
                new Statement.Poke(num(100), num(1)),
                new Statement.Out(num(1), num(2)),
                new Statement.Call("routine", List.of(num(1)))));
        assertTrue(outcome.isFinished());

        outcome = run(line(10, new Statement.Poke(str("X"), num(1))));
        assertEquals(ErrorCode.TYPE_MISMATCH, outcome.error().code());
    }

    @Test
    void testWidthOutOfRange() {
        ExecutionOutcome outcome = run(line(10, new Statement.Width(num(0))));
        assertEquals(ErrorCode.ILLEGAL_FUNCTION_CALL, outcome.error().code());
        run(line(10, new Statement.Width(num(40))));
        assertEquals(40, console.getWidth());
    }
}
