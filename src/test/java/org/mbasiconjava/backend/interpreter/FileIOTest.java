package org.mbasiconjava.backend.interpreter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mbasiconjava.EngineOptions;
import org.mbasiconjava.frontend.astnode.Line;
import org.mbasiconjava.frontend.astnode.Statement;
import org.mbasiconjava.io.BufferedConsole;
import org.mbasiconjava.io.FileMode;
import org.mbasiconjava.io.NativeFileSystem;
import org.mbasiconjava.runtime.BasicRuntime;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mbasiconjava.ProgramBuilder.*;

public class FileIOTest {

    @TempDir
    Path tempDir;

    private BasicRuntime runtime;
    private BufferedConsole console;
    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        runtime = new BasicRuntime();
        console = new BufferedConsole();
        interpreter = new Interpreter(runtime, console, new NativeFileSystem(tempDir), new EngineOptions());
    }

    private ExecutionOutcome run(Line... lines) {
        runtime.load(program(lines));
        interpreter.start();
        return interpreter.run();
    }

    private static Statement open(FileMode mode, int number, String name) {
        return new Statement.Open(mode, num(number), str(name), null);
    }

    private static Statement openRandom(int number, String name, int recordLength) {
        return new Statement.Open(FileMode.RANDOM, num(number), str(name), num(recordLength));
    }

    private static Statement close() {
        return new Statement.Close(List.of());
    }

    @Test
    void testSequentialWriteAndReadBack() throws IOException {
        ExecutionOutcome outcome = run(
                line(10, open(FileMode.OUTPUT, 1, "t.txt")),
                line(20, printTo(num(1), str("HELLO"))),
                line(30, new Statement.Write(num(1), List.of(num(5), str("A,B")))),
                line(40, close()),
                line(50, open(FileMode.INPUT, 1, "t.txt")),
                line(60, new Statement.LineInput(num(1), null, var("l$"))),
                line(70, new Statement.Input(num(1), null, false, List.of(var("n"), var("s$")))),
                line(80, let("e", fn("eof", num(1)))),
                line(90, close()));

        assertTrue(outcome.isFinished(), "program should end normally");
        assertEquals("HELLO\n5,\"A,B\"\n", Files.readString(tempDir.resolve("t.txt"), StandardCharsets.UTF_8));
        assertEquals("HELLO", runtime.getVariable("l$").getString());
        assertEquals(5.0, runtime.getVariable("n").toNumber());
        assertEquals("A,B", runtime.getVariable("s$").getString());
        assertEquals(-1.0, runtime.getVariable("e").toNumber());
    }

    @Test
    void testAppendKeepsExistingContent() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "ONE\n", StandardCharsets.UTF_8);
        run(
                line(10, open(FileMode.APPEND, 2, "a.txt")),
                line(20, printTo(num(2), str("TWO"))),
                line(30, close()));
        assertEquals("ONE\nTWO\n", Files.readString(tempDir.resolve("a.txt"), StandardCharsets.UTF_8));
    }

    @Test
    void testReadingPastEnd() throws IOException {
        Files.writeString(tempDir.resolve("e.txt"), "X\n", StandardCharsets.UTF_8);
        ExecutionOutcome outcome = run(
                line(10, open(FileMode.INPUT, 1, "e.txt")),
                line(20, new Statement.LineInput(num(1), null, var("a$"))),
                line(30, new Statement.LineInput(num(1), null, var("a$"))));
        assertEquals(ErrorCode.INPUT_PAST_END, outcome.error().code());
        assertEquals(30, outcome.error().line());
    }

    @Test
    void testRandomRecords() {
        run(
                line(10, openRandom(1, "r.dat", 10)),
                line(20, new Statement.Field(num(1), List.of(new Statement.FieldSpec(num(5), "f$")))),
                line(30, new Statement.Lset(var("f$"), str("HI"))),
                line(40, new Statement.Put(num(1), num(1))),
                line(50, new Statement.Lset(var("f$"), str("XX"))),
                line(60, new Statement.Get(num(1), num(1))),
                line(70, print(add(add(str("["), var("f$")), str("]")))),
                line(80, let("l", fn("loc", num(1)))),
                line(90, close()));
        assertEquals("[HI   ]\n", console.getOutput());
        assertEquals(1.0, runtime.getVariable("l").toNumber());
    }

    @Test
    void testRecordsWithoutLenAreFieldWidth() throws IOException {
        run(
                line(10, new Statement.Open(FileMode.RANDOM, num(1), str("r.dat"), null)),
                line(20, new Statement.Field(num(1), List.of(new Statement.FieldSpec(num(5), "f$")))),
                line(30, new Statement.Lset(var("f$"), str("HI"))),
                line(40, new Statement.Put(num(1), num(1))),
                line(50, new Statement.Lset(var("f$"), str("YO"))),
                line(60, new Statement.Put(num(1), num(2))),
                line(70, close()));
        assertEquals(10, Files.size(tempDir.resolve("r.dat")));
        assertEquals("HI   YO   ", Files.readString(tempDir.resolve("r.dat"), StandardCharsets.ISO_8859_1));

        run(
                line(10, new Statement.Open(FileMode.RANDOM, num(1), str("r.dat"), null)),
                line(20, new Statement.Field(num(1), List.of(new Statement.FieldSpec(num(5), "f$")))),
                line(30, new Statement.Get(num(1), num(2))),
                line(40, print(add(add(str("["), var("f$")), str("]")))),
                line(50, close()));
        assertEquals("[YO   ]\n", console.getOutput());
    }

    @Test
    void testRsetRightJustifies() {
        run(
                line(10, openRandom(1, "r.dat", 8)),
                line(20, new Statement.Field(num(1), List.of(new Statement.FieldSpec(num(4), "f$")))),
                line(30, new Statement.Rset(var("f$"), str("AB"))),
                line(40, print(add(add(str("["), var("f$")), str("]")))));
        assertEquals("[  AB]\n", console.getOutput());
    }

    @Test
    void testGetPastEndSetsEof() {
        run(
                line(10, openRandom(1, "empty.dat", 4)),
                line(20, new Statement.Field(num(1), List.of(new Statement.FieldSpec(num(4), "f$")))),
                line(30, new Statement.Get(num(1), num(3))),
                line(40, let("e", fn("eof", num(1)))));
        assertEquals(-1.0, runtime.getVariable("e").toNumber());
    }

    @Test
    void testRandomErrors() {
        ExecutionOutcome outcome = run(
                line(10, openRandom(1, "r.dat", 4)),
                line(20, new Statement.Field(num(1), List.of(
                        new Statement.FieldSpec(num(3), "a$"),
                        new Statement.FieldSpec(num(3), "b$")))));
        assertEquals(ErrorCode.FIELD_OVERFLOW, outcome.error().code());

        outcome = run(
                line(10, openRandom(1, "r.dat", 4)),
                line(20, new Statement.Put(num(1), num(1))));
        assertEquals(ErrorCode.BAD_FILE_MODE, outcome.error().code());

        outcome = run(
                line(10, openRandom(1, "r.dat", 4)),
                line(20, new Statement.Field(num(1), List.of(new Statement.FieldSpec(num(4), "f$")))),
                line(30, new Statement.Get(num(1), num(0))));
        assertEquals(ErrorCode.BAD_RECORD_NUMBER, outcome.error().code());
    }

    @Test
    void testFileNumberAndModeErrors() {
        ExecutionOutcome outcome = run(line(10, printTo(num(3), str("X"))));
        assertEquals(ErrorCode.BAD_FILE_NUMBER, outcome.error().code());

        outcome = run(line(10, open(FileMode.INPUT, 1, "missing.txt")));
        assertEquals(ErrorCode.FILE_NOT_FOUND, outcome.error().code());

        outcome = run(
                line(10, open(FileMode.OUTPUT, 1, "o.txt")),
                line(20, open(FileMode.OUTPUT, 1, "p.txt")));
        assertEquals(ErrorCode.FILE_ALREADY_OPEN, outcome.error().code());

        outcome = run(
                line(10, open(FileMode.OUTPUT, 1, "o.txt")),
                line(20, new Statement.LineInput(num(1), null, var("a$"))));
        assertEquals(ErrorCode.BAD_FILE_MODE, outcome.error().code());
    }

    @Test
    void testEndClosesFiles() {
        run(line(10, open(FileMode.OUTPUT, 1, "o.txt")), line(20, end()));
        assertEquals(0, runtime.files().openCount());
    }

    @Test
    void testKillAndName() throws IOException {
        Files.writeString(tempDir.resolve("old.txt"), "X", StandardCharsets.UTF_8);
        ExecutionOutcome outcome = run(
                line(10, new Statement.Name(str("old.txt"), str("new.txt"))),
                line(20, new Statement.Kill(str("new.txt"))));
        assertTrue(outcome.isFinished());
        assertFalse(Files.exists(tempDir.resolve("old.txt")));
        assertFalse(Files.exists(tempDir.resolve("new.txt")));

        outcome = run(line(10, new Statement.Kill(str("new.txt"))));
        assertEquals(ErrorCode.FILE_NOT_FOUND, outcome.error().code());

        Files.writeString(tempDir.resolve("a.txt"), "A", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("b.txt"), "B", StandardCharsets.UTF_8);
        outcome = run(line(10, new Statement.Name(str("a.txt"), str("b.txt"))));
        assertEquals(ErrorCode.FILE_ALREADY_EXISTS, outcome.error().code());
    }

    @Test
    void testKillOpenFile() {
        ExecutionOutcome outcome = run(
                line(10, open(FileMode.OUTPUT, 1, "busy.txt")),
                line(20, new Statement.Kill(str("busy.txt"))));
        assertEquals(ErrorCode.FILE_ALREADY_OPEN, outcome.error().code());
    }

    @Test
    void testMissingFileTrappedByOnError() {
        run(
                line(10, onErrorGoto(100)),
                line(20, open(FileMode.INPUT, 1, "nope.txt")),
                line(30, end()),
                line(100, print(fn("err"))),
                line(110, resumeNext()));
        assertEquals(" 53 \n", console.getOutput());
    }

    @Test
    void testLineInputIntoNumberIsTypeMismatch() throws IOException {
        Files.writeString(tempDir.resolve("n.txt"), "12\n", StandardCharsets.UTF_8);
        ExecutionOutcome outcome = run(
                line(10, open(FileMode.INPUT, 1, "n.txt")),
                line(20, new Statement.LineInput(num(1), null, var("n"))));
        assertEquals(ErrorCode.TYPE_MISMATCH, outcome.error().code());
    }
}
