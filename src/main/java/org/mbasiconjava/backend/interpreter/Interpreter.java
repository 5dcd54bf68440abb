package org.mbasiconjava.backend.interpreter;

import org.mbasiconjava.EngineOptions;
import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.frontend.analysis.StatementVisitor;
import org.mbasiconjava.frontend.astnode.Expr;
import org.mbasiconjava.frontend.astnode.LValue;
import org.mbasiconjava.frontend.astnode.Line;
import org.mbasiconjava.frontend.astnode.PrintSeparator;
import org.mbasiconjava.frontend.astnode.Program;
import org.mbasiconjava.frontend.astnode.Statement;
import org.mbasiconjava.io.ConsoleIO;
import org.mbasiconjava.io.FileMode;
import org.mbasiconjava.io.FileSystem;
import org.mbasiconjava.io.NativeFileSystem;
import org.mbasiconjava.operators.BuiltinContext;
import org.mbasiconjava.operators.StringFunctions;
import org.mbasiconjava.operators.using.UsingFormatter;
import org.mbasiconjava.runtime.BasicRuntime;
import org.mbasiconjava.runtime.ControlFrame;
import org.mbasiconjava.runtime.ErrorTrap;
import org.mbasiconjava.runtime.FieldBuffer;
import org.mbasiconjava.runtime.FileTable;
import org.mbasiconjava.runtime.ForLoopState;
import org.mbasiconjava.runtime.OpenFile;
import org.mbasiconjava.runtime.ProgramCounter;
import org.mbasiconjava.runtime.StatementTable;
import org.mbasiconjava.runtime.StopReason;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;
import org.mbasiconjava.runtime.runtimetypes.VarType;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.InvalidPathException;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes a loaded program one statement per {@link #tick()}.
 * <p>
 * A statement that transfers control records its target with
 * {@link #jumpTo(int)}; after the statement the counter moves there, or to
 * the following statement when nothing was recorded. Runtime errors raised
 * by a statement are routed to the ON ERROR handler when one is registered
 * and no other error is being handled; otherwise execution halts with
 * reason ERROR and the error is reported in the {@link ExecutionOutcome}.
 * <p>
 * CHAIN, MERGE and RUN of a file cannot be completed by the engine, which
 * has no program loader. They halt with a {@link PendingRequest} that the
 * host services and then finishes with {@link #completeMerge(Program)} or
 * {@link #failPendingRequest(int, String)}.
 */
public class Interpreter implements StatementVisitor, BuiltinContext {
    private final BasicRuntime runtime;
    private final ConsoleIO console;
    private final FileSystem fileSystem;
    private final EngineOptions options;
    private final InterpreterState state = new InterpreterState();
    private final ExpressionEvaluator evaluator;
    private ConsoleIO printer;
    private PrintTarget activeTarget;

    public Interpreter(BasicRuntime runtime, ConsoleIO console) {
        this(runtime, console, new NativeFileSystem(), new EngineOptions());
    }

    public Interpreter(BasicRuntime runtime, ConsoleIO console, FileSystem fileSystem, EngineOptions options) {
        this.runtime = runtime;
        this.console = console;
        this.printer = console;
        this.fileSystem = fileSystem;
        this.options = options.clone();
        this.evaluator = new ExpressionEvaluator(this);
        console.setWidth(this.options.consoleWidth);
        runtime.files().setLimit(this.options.maxOpenFiles);
        if (this.options.randomSeed != null) {
            runtime.random().setSeed(this.options.randomSeed);
        }
        runtime.setTraceOn(this.options.traceOnStart);
    }

    // ---------------------------------------------------------------
    // Host API

    @Override
    public BasicRuntime runtime() {
        return runtime;
    }

    @Override
    public ConsoleIO console() {
        return console;
    }

    @Override
    public ConsoleIO printer() {
        return printer;
    }

    /**
     * Sends LPRINT output somewhere other than the console.
     */
    public void setPrinter(ConsoleIO printer) {
        this.printer = printer;
    }

    @Override
    public int printColumn() {
        return activeTarget != null ? activeTarget.column() : console.getColumn();
    }

    public EngineOptions options() {
        return options;
    }

    public InterpreterState state() {
        return state;
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    /**
     * RUN: clears variables, arrays, stacks and files, and positions at the
     * first statement.
     */
    public void start() {
        runtime.reset();
        runtime.setTraceOn(options.traceOnStart);
        state.prepareForRun();
        debug("start at " + runtime.getPc());
    }

    /**
     * RUN line.
     *
     * @throws BasicRuntimeException with "Undefined line number" when the line does not exist
     */
    public void start(int line) {
        ProgramCounter target = runtime.table().findLine(line);
        if (target.isHalted()) {
            throw new BasicRuntimeException(ErrorCode.UNDEFINED_LINE, "RUN " + line);
        }
        start();
        runtime.setPc(target);
    }

    /**
     * Ticks until the program halts for any reason.
     */
    public ExecutionOutcome run() {
        while (tick()) {
            // keep going
        }
        ProgramCounter pc = runtime.getPc();
        if (pc.line() == Configuration.directModeLine && pc.reason() != StopReason.INPUT_WAIT) {
            retireDirectLine();
        }
        return outcome();
    }

    public ExecutionOutcome outcome() {
        ProgramCounter pc = runtime.getPc();
        return new ExecutionOutcome(pc.reason(), state.getError(), state.getPendingRequest(), pc);
    }

    /**
     * Executes one statement.
     *
     * @return whether the program is still running afterwards
     */
    public boolean tick() {
        ProgramCounter pc = runtime.getPc();
        if (pc.isHalted()) {
            return false;
        }
        if (state.isPauseRequested()) {
            state.setPauseRequested(false);
            suspend(pc, StopReason.STOP, pc);
            return false;
        }
        if (runtime.isBreakRequested()) {
            runtime.setBreakRequested(false);
            suspend(pc, StopReason.BREAK, pc);
            return false;
        }
        if (runtime.isBreakpoint(pc) && !state.isSkipBreakpoint()) {
            state.setSkipBreakpoint(true);
            suspend(pc, StopReason.BREAKPOINT, pc);
            return false;
        }
        state.setSkipBreakpoint(false);

        Statement statement = runtime.table().get(pc);
        if (statement == null) {
            runtime.setPc(ProgramCounter.halted(StopReason.END));
            return false;
        }
        trace(pc);
        state.setNextPc(null);
        try {
            statement.accept(this);
            state.countStatement();
        } catch (BasicRuntimeException e) {
            handleError(e, pc);
        } catch (UncheckedIOException e) {
            handleError(FileTable.handleIOException(e.getCause(), "console"), pc);
        }
        advance(pc);
        return runtime.getPc().isRunning();
    }

    /**
     * Asks the engine to stop before the next statement, as if STOP had been
     * executed there.
     */
    public void pause() {
        state.setPauseRequested(true);
    }

    /**
     * Control-C: honoured at the next tick with reason BREAK.
     */
    public void requestBreak() {
        runtime.setBreakRequested(true);
    }

    /**
     * CONT: resumes after STOP, a pause, a break or a breakpoint.
     *
     * @throws BasicRuntimeException "Can't continue" when there is nothing to resume
     */
    public void continueExecution() {
        ProgramCounter resume = state.getContinuePc();
        if (resume == null) {
            throw new BasicRuntimeException(ErrorCode.CANT_CONTINUE);
        }
        state.setContinuePc(null);
        runtime.setPc(resume);
    }

    /**
     * Supplies a line for a waiting INPUT or LINE INPUT. The statement is
     * executed again by the next tick.
     */
    public void provideInput(String line) {
        state.inputLines().add(line);
        ProgramCounter pc = runtime.getPc();
        if (pc.reason() == StopReason.INPUT_WAIT) {
            runtime.setPc(ProgramCounter.running(pc.line(), pc.statement()));
        }
    }

    /**
     * Executes statements typed without a line number. They run as line
     * 65535, so ERL reports 65535 and errors print without a line; a GOTO
     * into the program carries on running it.
     */
    public ExecutionOutcome executeDirect(List<Statement> statements) {
        if (statements.isEmpty()) {
            return outcome();
        }
        runtime.table().merge(Program.of(new Line(Configuration.directModeLine, statements)));
        runtime.setDirectMode(true);
        ProgramCounter resume = state.getContinuePc();
        state.prepareForRun();
        state.setContinuePc(resume);
        runtime.setPc(ProgramCounter.running(Configuration.directModeLine, 0));
        return run();
    }

    /**
     * Finishes a pending MERGE or CHAIN MERGE by overlaying the loaded lines
     * and carrying on after the requesting statement.
     */
    public void completeMerge(Program program) {
        ProgramCounter at = state.getRequestPc();
        if (at == null) {
            throw new IllegalStateException("no pending request");
        }
        state.clearPendingRequest();
        runtime.merge(program);
        state.setContinuePc(null);
        runtime.setPc(runtime.table().next(ProgramCounter.running(at.line(), at.statement())));
    }

    /**
     * Reports that the host could not service the pending request. The
     * error goes through the usual ON ERROR handling at the requesting
     * statement.
     */
    public void failPendingRequest(int code, String detail) {
        ProgramCounter at = state.getRequestPc();
        if (at == null) {
            throw new IllegalStateException("no pending request");
        }
        state.clearPendingRequest();
        ProgramCounter running = ProgramCounter.running(at.line(), at.statement());
        runtime.setPc(running);
        state.setNextPc(null);
        handleError(new BasicRuntimeException(code, detail), running);
        advance(running);
    }

    /**
     * Drops a pending request after the host replaced the program itself
     * (CHAIN, RUN "file").
     */
    public void clearPendingRequest() {
        state.clearPendingRequest();
        state.setError(null);
        state.setContinuePc(null);
    }

    // ---------------------------------------------------------------
    // Sequencing

    /**
     * Records the target of a jump for the current statement.
     */
    public void jumpTo(int line) {
        ProgramCounter target = runtime.table().findLine(line);
        if (target.isHalted()) {
            throw new BasicRuntimeException(ErrorCode.UNDEFINED_LINE, "line " + line);
        }
        state.setNextPc(target);
    }

    private void advance(ProgramCounter executed) {
        ProgramCounter current = runtime.getPc();
        if (current.isHalted()) {
            return;
        }
        ProgramCounter next = state.getNextPc();
        state.setNextPc(null);
        if (next == null) {
            next = runtime.table().next(executed);
            if (next.isHalted() && runtime.getErrorPc() != null) {
                // ran off the end of the program inside an error handler
                ProgramCounter errorPc = runtime.getErrorPc();
                runtime.setErrorPc(null);
                fatal(new BasicRuntimeException(ErrorCode.NO_RESUME), errorPc);
                return;
            }
        }
        if (executed.line() == Configuration.directModeLine && next.line() != Configuration.directModeLine) {
            retireDirectLine();
        }
        runtime.setPc(next);
    }

    private void suspend(ProgramCounter at, StopReason reason, ProgramCounter resume) {
        debug(reason + " at " + at);
        state.setContinuePc(resume.isRunning() ? resume : null);
        runtime.setPc(at.withReason(reason));
    }

    private void retireDirectLine() {
        if (runtime.table().line(Configuration.directModeLine) != null) {
            runtime.table().deleteRange(Configuration.directModeLine, Configuration.directModeLine);
        }
        runtime.setDirectMode(false);
    }

    private void trace(ProgramCounter pc) {
        if (!runtime.isTraceOn()) {
            return;
        }
        if (pc.statement() == 0 || pc.line() != state.getLastTracedLine()) {
            console.print("[" + pc.line() + "]");
        }
        state.setLastTracedLine(pc.line());
    }

    // ---------------------------------------------------------------
    // Errors

    private void handleError(BasicRuntimeException e, ProgramCounter pc) {
        debug("error " + e.getCode() + " (" + e.getMessage() + ") at " + pc
                + (e.getDetail() != null ? ": " + e.getDetail() : ""));
        ErrorTrap trap = runtime.getErrorTrap();
        if (trap == null || runtime.getErrorPc() != null || pc.line() == Configuration.directModeLine) {
            fatal(e, pc);
            return;
        }
        ProgramCounter handler = runtime.table().findLine(trap.line());
        if (handler.isHalted()) {
            fatal(new BasicRuntimeException(ErrorCode.UNDEFINED_LINE, "error handler " + trap.line()), pc);
            return;
        }
        recordError(e.getCode(), pc);
        runtime.setErrorPc(pc);
        if (trap.gosub()) {
            runtime.pushFrame(ControlFrame.errorGosub(runtime.table().next(pc)));
        }
        state.setNextPc(handler);
    }

    private void fatal(BasicRuntimeException e, ProgramCounter pc) {
        recordError(e.getCode(), pc);
        ProgramCounter at = ProgramCounter.running(pc.line(), pc.statement());
        state.setError(new ErrorInfo(e.getCode(), e.getMessage(), e.getDetail(), at));
        state.setNextPc(null);
        state.setContinuePc(null);
        runtime.setErrorPc(null);
        runtime.setPc(at.withReason(StopReason.ERROR));
    }

    private void recordError(int code, ProgramCounter pc) {
        runtime.setVariable(BasicRuntime.ERR_VARIABLE, BasicValue.ofInteger(code));
        runtime.setVariable(BasicRuntime.ERL_VARIABLE, BasicValue.ofSingle(pc.line()));
    }

    private void debug(String message) {
        if (options.debugEnabled) {
            System.err.println("DEBUG: " + message);
        }
    }

    // ---------------------------------------------------------------
    // Assignment helpers

    private void assign(LValue target, BasicValue value) {
        BasicValue typed = ExpressionEvaluator.typed(runtime.resolveType(target.name()), value);
        if (target instanceof Expr.ArrayAccess access) {
            runtime.setArrayElement(access.name(), evaluator.evaluateIndices(access), typed);
        } else {
            runtime.setVariable(target.name(), typed);
        }
    }

    private BasicValue valueOf(LValue target) {
        return evaluator.evaluate(target);
    }

    private OpenFile file(Expr fileNumber, FileMode... modes) {
        OpenFile file = runtime.files().get(evaluator.evaluateInteger(fileNumber));
        for (FileMode mode : modes) {
            if (file.mode() == mode) {
                return file;
            }
        }
        throw new BasicRuntimeException(ErrorCode.BAD_FILE_MODE, "file #" + file.number() + " is " + file.mode());
    }

    private PrintTarget outputTarget(Expr fileNumber) {
        if (fileNumber == null) {
            return PrintTarget.console(console);
        }
        return PrintTarget.file(file(fileNumber, FileMode.OUTPUT, FileMode.APPEND));
    }

    private void printTo(PrintTarget target, List<Expr> items, List<PrintSeparator> separators) {
        PrintTarget previous = activeTarget;
        activeTarget = target;
        try {
            PrintFormatter.print(target, items, separators, evaluator);
        } finally {
            activeTarget = previous;
        }
    }

    private void printUsingTo(PrintTarget target, Expr format, List<Expr> items, boolean suppressNewline) {
        String pattern = evaluator.evaluateString(format);
        List<BasicValue> values = new ArrayList<>(items.size());
        for (Expr item : items) {
            values.add(evaluator.evaluate(item));
        }
        String text = UsingFormatter.format(pattern, values);
        target.emit(suppressNewline ? text : text + "\n");
    }

    // ---------------------------------------------------------------
    // Output

    @Override
    public void visit(Statement.Print node) {
        printTo(outputTarget(node.fileNumber()), node.items(), node.separators());
    }

    @Override
    public void visit(Statement.PrintUsing node) {
        printUsingTo(outputTarget(node.fileNumber()), node.format(), node.items(), node.suppressNewline());
    }

    @Override
    public void visit(Statement.Lprint node) {
        printTo(PrintTarget.console(printer), node.items(), node.separators());
    }

    @Override
    public void visit(Statement.LprintUsing node) {
        printUsingTo(PrintTarget.console(printer), node.format(), node.items(), node.suppressNewline());
    }

    @Override
    public void visit(Statement.Write node) {
        PrintTarget target = outputTarget(node.fileNumber());
        List<BasicValue> values = new ArrayList<>(node.items().size());
        for (Expr item : node.items()) {
            values.add(evaluator.evaluate(item));
        }
        target.emit(DelimitedFields.join(values) + "\n");
    }

    @Override
    public void visit(Statement.Cls node) {
        console.clearScreen();
    }

    @Override
    public void visit(Statement.Width node) {
        int width = evaluator.evaluateInteger(node.width());
        if (width < 1 || width > 255) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "WIDTH " + width);
        }
        console.setWidth(width);
    }

    // ---------------------------------------------------------------
    // Input

    @Override
    public void visit(Statement.Input node) {
        if (node.fileNumber() != null) {
            OpenFile file = file(node.fileNumber(), FileMode.INPUT);
            for (LValue target : node.targets()) {
                String item = nextFileItem(file);
                if (runtime.resolveType(target.name()) == VarType.STRING) {
                    assign(target, BasicValue.ofString(item));
                } else {
                    assign(target, BasicValue.ofDouble(StringFunctions.parseValue(item)));
                }
            }
            return;
        }

        String prompt = node.prompt() == null ? "? " : node.suppressQuestionMark() ? node.prompt() : node.prompt() + "? ";
        while (true) {
            String line = readConsoleLine(prompt);
            if (line == null) {
                waitForInput();
                return;
            }
            List<String> fields = DelimitedFields.split(line);
            List<BasicValue> values = fields == null || fields.size() < node.targets().size()
                    ? null : convertInput(node.targets(), fields);
            if (values == null) {
                console.print("?Redo from start\n");
                continue;
            }
            if (fields.size() > node.targets().size()) {
                console.print("?Extra ignored\n");
            }
            for (int i = 0; i < values.size(); i++) {
                assign(node.targets().get(i), values.get(i));
            }
            return;
        }
    }

    private List<BasicValue> convertInput(List<LValue> targets, List<String> fields) {
        List<BasicValue> values = new ArrayList<>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            if (runtime.resolveType(targets.get(i).name()) == VarType.STRING) {
                values.add(BasicValue.ofString(fields.get(i)));
            } else {
                Double number = StringFunctions.parseNumericItem(fields.get(i));
                if (number == null) {
                    return null;
                }
                values.add(BasicValue.ofDouble(number));
            }
        }
        return values;
    }

    @Override
    public void visit(Statement.LineInput node) {
        if (runtime.resolveType(node.target().name()) != VarType.STRING) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "LINE INPUT needs a string variable");
        }
        if (node.fileNumber() != null) {
            OpenFile file = file(node.fileNumber(), FileMode.INPUT);
            file.pendingItems().clear();
            String line;
            try {
                line = file.handle().readLine();
            } catch (IOException e) {
                throw FileTable.handleIOException(e, "LINE INPUT #" + file.number());
            }
            if (line == null) {
                throw new BasicRuntimeException(ErrorCode.INPUT_PAST_END);
            }
            assign(node.target(), BasicValue.ofString(line));
            return;
        }
        String line = readConsoleLine(node.prompt() == null ? "" : node.prompt());
        if (line == null) {
            waitForInput();
            return;
        }
        assign(node.target(), BasicValue.ofString(line));
    }

    /**
     * A line typed by the user: queued host input first, then the console.
     * The prompt is shown once even when the statement waits and runs again.
     */
    private String readConsoleLine(String prompt) {
        String queued = state.inputLines().poll();
        if (queued != null) {
            if (!state.isInputPromptShown()) {
                console.print(prompt);
            }
            console.print(queued + "\n");
            state.setInputPromptShown(false);
            return queued;
        }
        String line = console.input(state.isInputPromptShown() ? "" : prompt);
        state.setInputPromptShown(line == null);
        return line;
    }

    private void waitForInput() {
        ProgramCounter pc = runtime.getPc();
        debug("waiting for input at " + pc);
        state.setNextPc(null);
        runtime.setPc(pc.withReason(StopReason.INPUT_WAIT));
    }

    private String nextFileItem(OpenFile file) {
        while (file.pendingItems().isEmpty()) {
            String line;
            try {
                line = file.handle().readLine();
            } catch (IOException e) {
                throw FileTable.handleIOException(e, "INPUT #" + file.number());
            }
            if (line == null) {
                throw new BasicRuntimeException(ErrorCode.INPUT_PAST_END);
            }
            List<String> fields = DelimitedFields.split(line);
            if (fields == null) {
                throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "malformed item in file #" + file.number());
            }
            file.pendingItems().addAll(fields);
        }
        return file.pendingItems().poll();
    }

    // ---------------------------------------------------------------
    // Assignment

    @Override
    public void visit(Statement.Let node) {
        assign(node.target(), evaluator.evaluate(node.value()));
    }

    @Override
    public void visit(Statement.Swap node) {
        VarType first = runtime.resolveType(node.first().name());
        VarType second = runtime.resolveType(node.second().name());
        if (first != second) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "SWAP of different types");
        }
        BasicValue a = valueOf(node.first());
        BasicValue b = valueOf(node.second());
        assign(node.first(), b);
        assign(node.second(), a);
    }

    @Override
    public void visit(Statement.MidAssign node) {
        if (runtime.resolveType(node.target().name()) != VarType.STRING) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "MID$ needs a string variable");
        }
        String current = valueOf(node.target()).getString();
        int start = evaluator.evaluateInteger(node.start());
        if (start < 1 || start > current.length()) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "MID$ start " + start);
        }
        String replacement = evaluator.evaluateString(node.value());
        int length = replacement.length();
        if (node.length() != null) {
            length = evaluator.evaluateInteger(node.length());
            if (length < 0 || length > 255) {
                throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "MID$ length " + length);
            }
        }
        int count = Math.min(Math.min(length, replacement.length()), current.length() - start + 1);
        String result = current.substring(0, start - 1) + replacement.substring(0, count)
                + current.substring(start - 1 + count);
        assign(node.target(), BasicValue.ofString(result));
    }

    // ---------------------------------------------------------------
    // Branching

    @Override
    public void visit(Statement.If node) {
        boolean condition = evaluator.evaluate(node.condition()).toBoolean();
        if (condition) {
            branch(node.thenLine(), node.thenStatements());
        } else {
            branch(node.elseLine(), node.elseStatements());
        }
    }

    private void branch(Integer line, List<Statement> statements) {
        if (line != null) {
            jumpTo(line);
            return;
        }
        for (Statement statement : statements) {
            statement.accept(this);
            if (state.getNextPc() != null || runtime.getPc().isHalted()) {
                return;
            }
        }
    }

    @Override
    public void visit(Statement.Goto node) {
        jumpTo(node.line());
    }

    @Override
    public void visit(Statement.Gosub node) {
        jumpTo(node.line());
        runtime.pushFrame(ControlFrame.gosub(runtime.table().next(runtime.getPc())));
    }

    @Override
    public void visit(Statement.Return node) {
        ControlFrame frame = runtime.popFrame(ControlFrame.Kind.GOSUB);
        if (frame == null) {
            throw new BasicRuntimeException(ErrorCode.RETURN_WITHOUT_GOSUB);
        }
        if (frame.errorTrap()) {
            runtime.setErrorPc(null);
            runtime.setVariable(BasicRuntime.ERR_VARIABLE, BasicValue.ZERO);
        }
        if (node.line() != null) {
            jumpTo(node.line());
        } else {
            state.setNextPc(frame.pc());
        }
    }

    @Override
    public void visit(Statement.OnGoto node) {
        int index = evaluator.evaluateInteger(node.selector());
        if (index >= 1 && index <= node.lines().size()) {
            jumpTo(node.lines().get(index - 1));
        }
    }

    @Override
    public void visit(Statement.OnGosub node) {
        int index = evaluator.evaluateInteger(node.selector());
        if (index >= 1 && index <= node.lines().size()) {
            jumpTo(node.lines().get(index - 1));
            runtime.pushFrame(ControlFrame.gosub(runtime.table().next(runtime.getPc())));
        }
    }

    // ---------------------------------------------------------------
    // Loops

    @Override
    public void visit(Statement.For node) {
        String variable = node.variable();
        if (runtime.resolveType(variable) == VarType.STRING) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "FOR needs a numeric variable");
        }
        double start = evaluator.evaluateNumber(node.start());
        double end = evaluator.evaluateNumber(node.end());
        double step = node.step() == null ? 1 : evaluator.evaluateNumber(node.step());
        runtime.setVariable(variable, ExpressionEvaluator.typed(runtime.resolveType(variable), BasicValue.ofDouble(start)));
        double current = runtime.getVariable(variable).toNumber();
        ProgramCounter pc = runtime.getPc();
        if (finished(current, end, step)) {
            runtime.endLoop(variable);
            skipToNext(pc, variable);
            return;
        }
        runtime.startLoop(new ForLoopState(variable, runtime.table().next(pc), end, step));
    }

    private static boolean finished(double current, double end, double step) {
        if (BasicValue.floatEquals(current, end)) {
            return false;
        }
        return step >= 0 ? current > end : current < end;
    }

    /**
     * Zero-trip FOR: continue after the NEXT that closes this loop, counting
     * nested FORs on the way.
     */
    private void skipToNext(ProgramCounter forPc, String variable) {
        StatementTable table = runtime.table();
        int depth = 0;
        for (ProgramCounter scan = table.next(forPc); scan.isRunning(); scan = table.next(scan)) {
            Statement statement = table.get(scan);
            if (statement instanceof Statement.For) {
                depth++;
            } else if (statement instanceof Statement.Next next) {
                if (next.variables().isEmpty()) {
                    if (depth == 0) {
                        state.setNextPc(table.next(scan));
                        return;
                    }
                    depth--;
                    continue;
                }
                for (String name : next.variables()) {
                    if (depth == 0) {
                        if (name.equals(variable)) {
                            state.setNextPc(table.next(scan));
                            return;
                        }
                    } else {
                        depth--;
                    }
                }
            }
        }
        throw new BasicRuntimeException(ErrorCode.FOR_WITHOUT_NEXT, variable);
    }

    @Override
    public void visit(Statement.Next node) {
        if (node.variables().isEmpty()) {
            ForLoopState loop = runtime.mostRecentLoop();
            if (loop == null) {
                throw new BasicRuntimeException(ErrorCode.NEXT_WITHOUT_FOR);
            }
            step(loop);
            return;
        }
        for (String variable : node.variables()) {
            ForLoopState loop = runtime.getLoop(variable);
            if (loop == null) {
                throw new BasicRuntimeException(ErrorCode.NEXT_WITHOUT_FOR, variable);
            }
            if (step(loop)) {
                return;
            }
        }
    }

    /**
     * Adds the step and either jumps back into the body (true) or ends the
     * loop (false).
     */
    private boolean step(ForLoopState loop) {
        String variable = loop.variable();
        double value = runtime.getVariable(variable).toNumber() + loop.step();
        runtime.setVariable(variable, ExpressionEvaluator.typed(runtime.resolveType(variable), BasicValue.ofDouble(value)));
        double current = runtime.getVariable(variable).toNumber();
        if (finished(current, loop.end(), loop.step())) {
            runtime.endLoop(variable);
            return false;
        }
        state.setNextPc(loop.resumePc());
        return true;
    }

    @Override
    public void visit(Statement.While node) {
        ProgramCounter pc = runtime.getPc();
        if (evaluator.evaluate(node.condition()).toBoolean()) {
            runtime.pushFrame(ControlFrame.whileLoop(pc));
            return;
        }
        StatementTable table = runtime.table();
        int depth = 0;
        for (ProgramCounter scan = table.next(pc); scan.isRunning(); scan = table.next(scan)) {
            Statement statement = table.get(scan);
            if (statement instanceof Statement.While) {
                depth++;
            } else if (statement instanceof Statement.Wend) {
                if (depth == 0) {
                    state.setNextPc(table.next(scan));
                    return;
                }
                depth--;
            }
        }
        throw new BasicRuntimeException(ErrorCode.WHILE_WITHOUT_WEND);
    }

    @Override
    public void visit(Statement.Wend node) {
        ControlFrame frame = runtime.popFrame(ControlFrame.Kind.WHILE);
        if (frame == null) {
            throw new BasicRuntimeException(ErrorCode.WEND_WITHOUT_WHILE);
        }
        state.setNextPc(frame.pc());
    }

    // ---------------------------------------------------------------
    // Error handling statements

    @Override
    public void visit(Statement.Error node) {
        int code = evaluator.evaluateInteger(node.code());
        if (code < 1 || code > 255) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "ERROR " + code);
        }
        throw new BasicRuntimeException(code, "ERROR statement");
    }

    @Override
    public void visit(Statement.OnError node) {
        if (node.line() != 0) {
            runtime.setErrorTrap(new ErrorTrap(node.line(), node.gosub()));
            return;
        }
        runtime.setErrorTrap(null);
        ProgramCounter errorPc = runtime.getErrorPc();
        if (errorPc != null) {
            // inside a handler: the pending error becomes fatal where it happened
            int code = runtime.getVariable(BasicRuntime.ERR_VARIABLE).toInteger();
            fatal(new BasicRuntimeException(code), errorPc);
        }
    }

    @Override
    public void visit(Statement.Resume node) {
        ProgramCounter errorPc = runtime.getErrorPc();
        if (errorPc == null) {
            throw new BasicRuntimeException(ErrorCode.RESUME_WITHOUT_ERROR);
        }
        if (node.next()) {
            state.setNextPc(runtime.table().next(errorPc));
        } else if (node.line() != null && node.line() != 0) {
            jumpTo(node.line());
        } else {
            state.setNextPc(errorPc);
        }
        runtime.dropErrorFrame();
        runtime.setErrorPc(null);
        runtime.setVariable(BasicRuntime.ERR_VARIABLE, BasicValue.ZERO);
    }

    // ---------------------------------------------------------------
    // DATA

    @Override
    public void visit(Statement.Data node) {
        if (runtime.isDirectMode()) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_DIRECT, "DATA");
        }
    }

    @Override
    public void visit(Statement.Read node) {
        for (LValue target : node.targets()) {
            BasicValue datum = runtime.data().read();
            boolean stringTarget = runtime.resolveType(target.name()) == VarType.STRING;
            if (stringTarget && !datum.isString()) {
                datum = BasicValue.ofString(BasicValue.formatNumberBody(datum.toNumber()));
            } else if (!stringTarget && datum.isString()) {
                Double number = StringFunctions.parseNumericItem(datum.getString());
                if (number == null) {
                    throw new BasicRuntimeException(ErrorCode.SYNTAX_ERROR, "string DATA item read into " + target.name());
                }
                datum = BasicValue.ofDouble(number);
            }
            assign(target, datum);
        }
    }

    @Override
    public void visit(Statement.Restore node) {
        if (node.line() == null) {
            runtime.data().restore();
        } else {
            runtime.data().restore(node.line());
        }
    }

    // ---------------------------------------------------------------
    // Declarations

    @Override
    public void visit(Statement.Dim node) {
        for (Expr.ArrayAccess array : node.arrays()) {
            runtime.dimArray(array.name(), evaluator.evaluateIndices(array));
        }
    }

    @Override
    public void visit(Statement.Erase node) {
        for (String name : node.arrays()) {
            runtime.eraseArray(name);
        }
    }

    @Override
    public void visit(Statement.OptionBase node) {
        runtime.setArrayBase(node.base());
    }

    @Override
    public void visit(Statement.DefFn node) {
        if (runtime.isDirectMode()) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_DIRECT, "DEF FN");
        }
        runtime.defineFunction(node);
    }

    @Override
    public void visit(Statement.DefType node) {
        for (char letter : node.letters()) {
            runtime.setDefaultType(letter, node.type());
        }
    }

    @Override
    public void visit(Statement.Common node) {
        for (String name : node.variables()) {
            runtime.addCommonVariable(name);
        }
    }

    // ---------------------------------------------------------------
    // Program control

    @Override
    public void visit(Statement.End node) {
        if (runtime.getErrorPc() != null) {
            throw new BasicRuntimeException(ErrorCode.NO_RESUME);
        }
        runtime.files().closeAll();
        state.setContinuePc(null);
        runtime.setPc(runtime.getPc().withReason(StopReason.END));
    }

    @Override
    public void visit(Statement.Stop node) {
        ProgramCounter pc = runtime.getPc();
        console.print(pc.line() == Configuration.directModeLine ? "Break\n" : "Break in " + pc.line() + "\n");
        suspend(pc, StopReason.STOP, runtime.table().next(pc));
    }

    @Override
    public void visit(Statement.Rem node) {
    }

    @Override
    public void visit(Statement.Clear node) {
        ProgramCounter here = runtime.getPc();
        boolean direct = runtime.isDirectMode();
        runtime.reset();
        runtime.setDirectMode(direct);
        runtime.setPc(here);
    }

    @Override
    public void visit(Statement.Randomize node) {
        long seed = node.seed() == null
                ? System.nanoTime()
                : Double.doubleToLongBits(evaluator.evaluateNumber(node.seed()));
        runtime.random().setSeed(seed);
    }

    @Override
    public void visit(Statement.Tron node) {
        runtime.setTraceOn(true);
        state.setLastTracedLine(runtime.getPc().line());
    }

    @Override
    public void visit(Statement.Troff node) {
        runtime.setTraceOn(false);
    }

    @Override
    public void visit(Statement.Chain node) {
        String fileName = evaluator.evaluateString(node.fileName());
        Integer line = node.line() == null ? null : (int) Math.rint(evaluator.evaluateNumber(node.line()));
        request(new PendingRequest.ChainRequest(fileName, line, node.all(), node.merge(),
                node.deleteFrom(), node.deleteTo(), runtime.commonVariables()));
    }

    @Override
    public void visit(Statement.Merge node) {
        request(new PendingRequest.MergeRequest(evaluator.evaluateString(node.fileName())));
    }

    @Override
    public void visit(Statement.Run node) {
        if (node.fileName() != null) {
            request(new PendingRequest.RunRequest(evaluator.evaluateString(node.fileName()), node.keepVariables()));
            return;
        }
        ProgramCounter target = node.line() == null ? runtime.table().first() : runtime.table().findLine(node.line());
        if (node.line() != null && target.isHalted()) {
            throw new BasicRuntimeException(ErrorCode.UNDEFINED_LINE, "RUN " + node.line());
        }
        runtime.reset();
        if (target.isHalted() || target.line() == Configuration.directModeLine) {
            runtime.setPc(ProgramCounter.halted(StopReason.END));
            return;
        }
        state.setNextPc(target);
    }

    private void request(PendingRequest request) {
        ProgramCounter pc = runtime.getPc();
        debug("pending " + request + " at " + pc);
        state.setPendingRequest(request, pc);
        runtime.setPc(pc.withReason(StopReason.END));
    }

    // ---------------------------------------------------------------
    // Hardware statements: operands are evaluated, nothing else happens

    @Override
    public void visit(Statement.Poke node) {
        evaluator.evaluateNumber(node.address());
        evaluator.evaluateNumber(node.value());
    }

    @Override
    public void visit(Statement.Out node) {
        evaluator.evaluateNumber(node.port());
        evaluator.evaluateNumber(node.value());
    }

    @Override
    public void visit(Statement.Wait node) {
        evaluator.evaluateNumber(node.port());
        evaluator.evaluateNumber(node.mask());
        if (node.xorMask() != null) {
            evaluator.evaluateNumber(node.xorMask());
        }
    }

    @Override
    public void visit(Statement.Call node) {
        for (Expr arg : node.args()) {
            evaluator.evaluate(arg);
        }
    }

    // ---------------------------------------------------------------
    // Files

    @Override
    public void visit(Statement.Open node) {
        int number = evaluator.evaluateInteger(node.fileNumber());
        String name = evaluator.evaluateString(node.fileName());
        int recordLength = node.recordLength() == null
                ? options.defaultRecordLength
                : evaluator.evaluateInteger(node.recordLength());
        OpenFile file = runtime.files().open(number, name, node.mode(), recordLength, fileSystem);
        file.setFixedRecordLength(node.recordLength() != null);
        debug("opened #" + number + " " + name + " for " + node.mode());
    }

    @Override
    public void visit(Statement.Close node) {
        if (node.fileNumbers().isEmpty()) {
            runtime.files().closeAll();
            return;
        }
        for (Expr number : node.fileNumbers()) {
            runtime.files().close(evaluator.evaluateInteger(number));
        }
    }

    @Override
    public void visit(Statement.Reset node) {
        runtime.files().closeAll();
    }

    @Override
    public void visit(Statement.Field node) {
        OpenFile file = file(node.fileNumber(), FileMode.RANDOM);
        List<FieldBuffer.Field> fields = new ArrayList<>();
        int offset = 0;
        for (Statement.FieldSpec spec : node.fields()) {
            int width = evaluator.evaluateInteger(spec.width());
            if (width < 0 || width > 255) {
                throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "FIELD width " + width);
            }
            if (runtime.resolveType(spec.variable()) != VarType.STRING) {
                throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "FIELD needs string variables");
            }
            fields.add(new FieldBuffer.Field(spec.variable(), offset, width));
            offset += width;
        }
        if (offset > file.recordLength()) {
            throw new BasicRuntimeException(ErrorCode.FIELD_OVERFLOW, offset + " > " + file.recordLength());
        }
        // without LEN the record is exactly the fields
        int size = file.isFixedRecordLength() ? file.recordLength() : Math.max(offset, 1);
        FieldBuffer buffer = new FieldBuffer(fields, size);
        file.setFieldBuffer(buffer);
        publishFields(buffer);
    }

    private void publishFields(FieldBuffer buffer) {
        for (FieldBuffer.Field field : buffer.fields()) {
            runtime.setVariable(field.variable(), BasicValue.ofString(buffer.read(field)));
        }
    }

    private long recordNumber(OpenFile file, Expr record) {
        if (record == null) {
            return file.currentRecord() + 1;
        }
        long number = (long) Math.rint(evaluator.evaluateNumber(record));
        if (number < 1) {
            throw new BasicRuntimeException(ErrorCode.BAD_RECORD_NUMBER, "record " + number);
        }
        return number;
    }

    private FieldBuffer fieldBuffer(OpenFile file) {
        FieldBuffer buffer = file.fieldBuffer();
        if (buffer == null) {
            throw new BasicRuntimeException(ErrorCode.BAD_FILE_MODE, "no FIELD for file #" + file.number());
        }
        return buffer;
    }

    @Override
    public void visit(Statement.Get node) {
        OpenFile file = file(node.fileNumber(), FileMode.RANDOM);
        FieldBuffer buffer = fieldBuffer(file);
        long record = recordNumber(file, node.record());
        byte[] bytes = new byte[buffer.size()];
        int count;
        try {
            count = file.handle().readRecord((record - 1) * file.recordStride(), bytes);
        } catch (IOException e) {
            throw FileTable.handleIOException(e, "GET #" + file.number());
        }
        buffer.load(bytes, count);
        file.setCurrentRecord(record);
        file.setPastEnd(count < bytes.length);
        publishFields(buffer);
    }

    @Override
    public void visit(Statement.Put node) {
        OpenFile file = file(node.fileNumber(), FileMode.RANDOM);
        FieldBuffer buffer = fieldBuffer(file);
        long record = recordNumber(file, node.record());
        try {
            file.handle().writeRecord((record - 1) * file.recordStride(), buffer.bytes());
        } catch (IOException e) {
            throw FileTable.handleIOException(e, "PUT #" + file.number());
        }
        file.setCurrentRecord(record);
        file.setPastEnd(false);
    }

    @Override
    public void visit(Statement.Lset node) {
        setField(node.target(), evaluator.evaluateString(node.value()), false);
    }

    @Override
    public void visit(Statement.Rset node) {
        setField(node.target(), evaluator.evaluateString(node.value()), true);
    }

    /**
     * LSET/RSET: a FIELD variable is padded or cut to its width and written
     * into the record buffer; any other variable is simply assigned.
     */
    private void setField(LValue target, String value, boolean rightJustify) {
        if (target instanceof Expr.Variable) {
            for (OpenFile file : runtime.files().openFiles()) {
                FieldBuffer buffer = file.fieldBuffer();
                FieldBuffer.Field field = buffer == null ? null : buffer.find(target.name());
                if (field != null) {
                    runtime.setVariable(target.name(), BasicValue.ofString(buffer.write(field, value, rightJustify)));
                    return;
                }
            }
        }
        assign(target, BasicValue.ofString(value));
    }

    @Override
    public void visit(Statement.Kill node) {
        String name = evaluator.evaluateString(node.fileName());
        if (runtime.files().isOpen(name)) {
            throw new BasicRuntimeException(ErrorCode.FILE_ALREADY_OPEN, name);
        }
        try {
            if (!fileSystem.exists(name)) {
                throw new BasicRuntimeException(ErrorCode.FILE_NOT_FOUND, name);
            }
            fileSystem.remove(name);
        } catch (InvalidPathException e) {
            throw new BasicRuntimeException(ErrorCode.BAD_FILE_NAME, name, e);
        } catch (IOException e) {
            throw FileTable.handleIOException(e, "KILL " + name);
        }
    }

    @Override
    public void visit(Statement.Name node) {
        String oldName = evaluator.evaluateString(node.oldName());
        String newName = evaluator.evaluateString(node.newName());
        try {
            if (!fileSystem.exists(oldName)) {
                throw new BasicRuntimeException(ErrorCode.FILE_NOT_FOUND, oldName);
            }
            if (fileSystem.exists(newName)) {
                throw new BasicRuntimeException(ErrorCode.FILE_ALREADY_EXISTS, newName);
            }
            fileSystem.rename(oldName, newName);
        } catch (InvalidPathException e) {
            throw new BasicRuntimeException(ErrorCode.BAD_FILE_NAME, oldName + " AS " + newName, e);
        } catch (IOException e) {
            throw FileTable.handleIOException(e, "NAME " + oldName);
        }
    }
}
