package org.mbasiconjava.runtime;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.frontend.astnode.Line;
import org.mbasiconjava.frontend.astnode.Program;
import org.mbasiconjava.frontend.astnode.Statement;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;
import org.mbasiconjava.runtime.runtimetypes.VarType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * All mutable execution state of one program: variables, arrays, the
 * control stack, active FOR loops, the DATA cursor, open files, the error
 * handler registration and the program counter.
 * <p>
 * Variables are keyed by normalized name including the type suffix.
 * Untyped names take their type from the per-letter default table, which
 * starts out as the parser left it and changes when DEFINT and friends run.
 * <p>
 * Two pseudo-variables, {@code err%} and {@code erl!}, back the ERR and
 * ERL functions; they survive {@link #reset()}. ERL is single precision so
 * line numbers above 32767 fit.
 */
public class BasicRuntime {
    public static final String ERR_VARIABLE = "err%";
    public static final String ERL_VARIABLE = "erl!";

    private final StatementTable table = new StatementTable();
    private final Map<String, BasicValue> variables = new HashMap<>();
    private final Map<String, BasicArray> arrays = new HashMap<>();
    private final List<ControlFrame> controlStack = new ArrayList<>();
    // insertion order is activation order, FOR re-inserts its variable
    private final LinkedHashMap<String, ForLoopState> forLoops = new LinkedHashMap<>();
    private final DataCursor data = new DataCursor();
    private final FileTable files = new FileTable();
    private final Map<String, Statement.DefFn> userFunctions = new HashMap<>();
    private final Set<ProgramCounter> breakpoints = new HashSet<>();
    private final List<String> commonVariables = new ArrayList<>();
    private final VarType[] defaultTypes = new VarType[26];
    private final Random random = new Random();

    private ProgramCounter pc = ProgramCounter.halted(StopReason.END);
    private ErrorTrap errorTrap;
    private ProgramCounter errorPc;
    private int arrayBase;
    private boolean traceOn;
    private boolean breakRequested;
    private boolean directMode;
    private double lastRandom = 0.5;

    /**
     * Values carried across a program replacement by CHAIN or RUN.
     */
    public record VariableSnapshot(Map<String, BasicValue> variables, Map<String, BasicArray> arrays) {
    }

    public BasicRuntime() {
        Arrays.fill(defaultTypes, VarType.SINGLE);
        initSystemVariables();
    }

    // ---------------------------------------------------------------
    // Program lifecycle

    /**
     * Replaces the program and rebuilds every derived structure.
     *
     * @throws IllegalArgumentException when a line number is outside 0..65529
     */
    public void load(Program program) {
        for (Line line : program.lines()) {
            if (line.number() < 0 || line.number() > Configuration.maxLineNumber) {
                throw new IllegalArgumentException("Line number out of range: " + line.number());
            }
        }
        clear();
        table.build(program);
        for (char c = 'a'; c <= 'z'; c++) {
            defaultTypes[c - 'a'] = program.defaultType(c);
        }
        variables.clear();
        initSystemVariables();
        data.clear();
        data.collect(table);
        registerUserFunctions(program);
        pc = table.first();
    }

    /**
     * Overlays another program's lines, registering its DEF FN definitions
     * and rebuilding the DATA list.
     */
    public void merge(Program program) {
        for (Line line : program.lines()) {
            if (line.number() < 0 || line.number() > Configuration.maxLineNumber) {
                throw new IllegalArgumentException("Line number out of range: " + line.number());
            }
        }
        table.merge(program);
        registerUserFunctions(program);
        data.collect(table);
    }

    /**
     * Program replacement for CHAIN: files stay open, everything else is
     * rebuilt, then the kept variables are put back.
     *
     * @param merge overlay the new lines instead of replacing the program
     * @param kept  variables carried over, may be null
     */
    public void chain(Program program, boolean merge, VariableSnapshot kept) {
        for (Line line : program.lines()) {
            if (line.number() < 0 || line.number() > Configuration.maxLineNumber) {
                throw new IllegalArgumentException("Line number out of range: " + line.number());
            }
        }
        BasicValue err = getVariable(ERR_VARIABLE);
        BasicValue erl = getVariable(ERL_VARIABLE);
        if (merge) {
            table.merge(program);
        } else {
            table.build(program);
            userFunctions.clear();
            for (char c = 'a'; c <= 'z'; c++) {
                defaultTypes[c - 'a'] = program.defaultType(c);
            }
        }
        variables.clear();
        variables.put(ERR_VARIABLE, err);
        variables.put(ERL_VARIABLE, erl);
        arrays.clear();
        controlStack.clear();
        forLoops.clear();
        commonVariables.clear();
        errorTrap = null;
        errorPc = null;
        directMode = false;
        registerUserFunctions(program);
        data.clear();
        data.collect(table);
        if (kept != null) {
            restoreVariables(kept);
        }
        pc = table.first();
    }

    /**
     * Clears run state but keeps the program: used by RUN and CLEAR.
     * Files are closed; the counter moves to the first statement.
     */
    public void reset() {
        try {
            files.closeAll();
        } finally {
            BasicValue err = getVariable(ERR_VARIABLE);
            BasicValue erl = getVariable(ERL_VARIABLE);
            variables.clear();
            variables.put(ERR_VARIABLE, err);
            variables.put(ERL_VARIABLE, erl);
            arrays.clear();
            controlStack.clear();
            forLoops.clear();
            data.restore();
            commonVariables.clear();
            arrayBase = 0;
            breakRequested = false;
            directMode = false;
            errorTrap = null;
            errorPc = null;
            pc = table.first();
        }
    }

    /**
     * {@link #reset()} plus dropping DATA values, user functions and
     * breakpoints.
     */
    public void clear() {
        try {
            reset();
        } finally {
            data.clear();
            userFunctions.clear();
            breakpoints.clear();
        }
    }

    private void initSystemVariables() {
        variables.put(ERR_VARIABLE, BasicValue.ZERO);
        variables.put(ERL_VARIABLE, BasicValue.ZERO);
    }

    private void registerUserFunctions(Program program) {
        for (Line line : program.lines()) {
            for (Statement statement : line.statements()) {
                if (statement instanceof Statement.DefFn def) {
                    defineFunction(def);
                }
            }
        }
    }

    // ---------------------------------------------------------------
    // Variables

    /**
     * Type of a variable name: its suffix, else the default for its first
     * letter.
     */
    public VarType resolveType(String name) {
        VarType type = VarType.ofName(name);
        if (type != null) {
            return type;
        }
        char c = name.isEmpty() ? 'a' : name.charAt(0);
        if (c < 'a' || c > 'z') {
            return VarType.SINGLE;
        }
        return defaultTypes[c - 'a'];
    }

    public VarType getDefaultType(char letter) {
        return defaultTypes[Character.toLowerCase(letter) - 'a'];
    }

    public void setDefaultType(char letter, VarType type) {
        char c = Character.toLowerCase(letter);
        if (c >= 'a' && c <= 'z') {
            defaultTypes[c - 'a'] = type;
        }
    }

    /**
     * Reads a variable; unset variables read as their type's default.
     */
    public BasicValue getVariable(String name) {
        BasicValue value = variables.get(name);
        return value != null ? value : BasicValue.defaultFor(resolveType(name));
    }

    public void setVariable(String name, BasicValue value) {
        variables.put(name, value.coerceTo(resolveType(name)));
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public void removeVariable(String name) {
        variables.remove(name);
    }

    public Map<String, BasicValue> variables() {
        return Collections.unmodifiableMap(variables);
    }

    // ---------------------------------------------------------------
    // Arrays

    public void dimArray(String name, int[] bounds) {
        if (arrays.containsKey(name)) {
            throw new BasicRuntimeException(ErrorCode.DUPLICATE_DEFINITION, name);
        }
        arrays.put(name, new BasicArray(name, resolveType(name), bounds, arrayBase));
    }

    public BasicValue getArrayElement(String name, int[] indices) {
        return arrayFor(name, indices.length).get(indices);
    }

    public void setArrayElement(String name, int[] indices, BasicValue value) {
        arrayFor(name, indices.length).set(indices, value);
    }

    public boolean hasArray(String name) {
        return arrays.containsKey(name);
    }

    public BasicArray getArray(String name) {
        return arrays.get(name);
    }

    public void eraseArray(String name) {
        if (arrays.remove(name) == null) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL, "ERASE of undimensioned " + name);
        }
    }

    public int getArrayBase() {
        return arrayBase;
    }

    public void setArrayBase(int base) {
        if (base != 0 && base != 1) {
            throw new BasicRuntimeException(ErrorCode.SYNTAX_ERROR, "OPTION BASE " + base);
        }
        if (!arrays.isEmpty()) {
            throw new BasicRuntimeException(ErrorCode.DUPLICATE_DEFINITION, "OPTION BASE after DIM");
        }
        arrayBase = base;
    }

    private BasicArray arrayFor(String name, int dimensions) {
        BasicArray array = arrays.get(name);
        if (array == null) {
            int[] bounds = new int[dimensions];
            Arrays.fill(bounds, Configuration.autoDimensionBound);
            array = new BasicArray(name, resolveType(name), bounds, arrayBase);
            arrays.put(name, array);
        }
        return array;
    }

    // ---------------------------------------------------------------
    // Control stack and FOR loops

    public void pushFrame(ControlFrame frame) {
        controlStack.add(frame);
    }

    /**
     * Removes and returns the topmost frame of the given kind, skipping
     * frames of the other kind; null when there is none.
     */
    public ControlFrame popFrame(ControlFrame.Kind kind) {
        for (int i = controlStack.size() - 1; i >= 0; i--) {
            if (controlStack.get(i).kind() == kind) {
                return controlStack.remove(i);
            }
        }
        return null;
    }

    /**
     * Removes the topmost frame pushed by ON ERROR GOSUB, if any.
     */
    public void dropErrorFrame() {
        for (int i = controlStack.size() - 1; i >= 0; i--) {
            if (controlStack.get(i).errorTrap()) {
                controlStack.remove(i);
                return;
            }
        }
    }

    public List<ControlFrame> controlStack() {
        return Collections.unmodifiableList(controlStack);
    }

    /**
     * Registers a loop, replacing any loop on the same variable and making
     * it the most recently entered one.
     */
    public void startLoop(ForLoopState loop) {
        forLoops.remove(loop.variable());
        forLoops.put(loop.variable(), loop);
    }

    public ForLoopState getLoop(String variable) {
        return forLoops.get(variable);
    }

    public void endLoop(String variable) {
        forLoops.remove(variable);
    }

    /**
     * The most recently entered active loop, or null.
     */
    public ForLoopState mostRecentLoop() {
        ForLoopState last = null;
        for (ForLoopState loop : forLoops.values()) {
            last = loop;
        }
        return last;
    }

    public Collection<ForLoopState> activeLoops() {
        return Collections.unmodifiableCollection(forLoops.values());
    }

    // ---------------------------------------------------------------
    // User functions

    public void defineFunction(Statement.DefFn def) {
        userFunctions.put(def.name(), def);
    }

    public Statement.DefFn getFunction(String name) {
        return userFunctions.get(name);
    }

    // ---------------------------------------------------------------
    // CHAIN support

    public void addCommonVariable(String name) {
        if (!commonVariables.contains(name)) {
            commonVariables.add(name);
        }
    }

    public List<String> commonVariables() {
        return Collections.unmodifiableList(commonVariables);
    }

    /**
     * Copies the named variables and arrays; a null name list copies
     * everything. A name may carry a trailing {@code ()} to denote an array.
     */
    public VariableSnapshot captureVariables(Collection<String> names) {
        Map<String, BasicValue> keptVariables = new HashMap<>();
        Map<String, BasicArray> keptArrays = new HashMap<>();
        if (names == null) {
            keptVariables.putAll(variables);
            keptArrays.putAll(arrays);
        } else {
            for (String raw : names) {
                String name = raw.endsWith("()") ? raw.substring(0, raw.length() - 2) : raw;
                if (variables.containsKey(name)) {
                    keptVariables.put(name, variables.get(name));
                }
                if (arrays.containsKey(name)) {
                    keptArrays.put(name, arrays.get(name));
                }
            }
        }
        keptVariables.remove(ERR_VARIABLE);
        keptVariables.remove(ERL_VARIABLE);
        return new VariableSnapshot(keptVariables, keptArrays);
    }

    public void restoreVariables(VariableSnapshot snapshot) {
        snapshot.variables().forEach(this::setVariable);
        arrays.putAll(snapshot.arrays());
    }

    // ---------------------------------------------------------------
    // Breakpoints

    public void addBreakpoint(int line, int statement) {
        breakpoints.add(ProgramCounter.running(line, statement));
    }

    public void removeBreakpoint(int line, int statement) {
        breakpoints.remove(ProgramCounter.running(line, statement));
    }

    public void clearBreakpoints() {
        breakpoints.clear();
    }

    public boolean isBreakpoint(ProgramCounter at) {
        return breakpoints.contains(ProgramCounter.running(at.line(), at.statement()));
    }

    // ---------------------------------------------------------------
    // Random numbers

    public Random random() {
        return random;
    }

    public double getLastRandom() {
        return lastRandom;
    }

    public void setLastRandom(double lastRandom) {
        this.lastRandom = lastRandom;
    }

    // ---------------------------------------------------------------
    // Accessors

    public StatementTable table() {
        return table;
    }

    public DataCursor data() {
        return data;
    }

    public FileTable files() {
        return files;
    }

    public ProgramCounter getPc() {
        return pc;
    }

    public void setPc(ProgramCounter pc) {
        this.pc = pc;
    }

    public ErrorTrap getErrorTrap() {
        return errorTrap;
    }

    public void setErrorTrap(ErrorTrap errorTrap) {
        this.errorTrap = errorTrap;
    }

    /**
     * Address of the statement that raised the error currently being
     * handled; null outside a handler.
     */
    public ProgramCounter getErrorPc() {
        return errorPc;
    }

    public void setErrorPc(ProgramCounter errorPc) {
        this.errorPc = errorPc;
    }

    public boolean isTraceOn() {
        return traceOn;
    }

    public void setTraceOn(boolean traceOn) {
        this.traceOn = traceOn;
    }

    public boolean isBreakRequested() {
        return breakRequested;
    }

    public void setBreakRequested(boolean breakRequested) {
        this.breakRequested = breakRequested;
    }

    public boolean isDirectMode() {
        return directMode;
    }

    public void setDirectMode(boolean directMode) {
        this.directMode = directMode;
    }
}
