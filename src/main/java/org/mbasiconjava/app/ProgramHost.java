package org.mbasiconjava.app;

import org.mbasiconjava.backend.interpreter.ExecutionOutcome;
import org.mbasiconjava.backend.interpreter.Interpreter;
import org.mbasiconjava.backend.interpreter.PendingRequest;
import org.mbasiconjava.frontend.astnode.Line;
import org.mbasiconjava.frontend.astnode.Program;
import org.mbasiconjava.runtime.BasicRuntime;
import org.mbasiconjava.runtime.FileTable;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicSyntaxException;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;

import java.io.IOException;

/**
 * Runs a program to completion on behalf of a host, servicing the CHAIN,
 * RUN and MERGE requests the interpreter cannot complete by itself.
 * <p>
 * Stops and returns when the program ends, fails, stops or waits for input;
 * the caller decides whether to supply input or continue and call
 * {@link #runProgram()} again.
 */
public class ProgramHost {
    private final Interpreter interpreter;
    private final ProgramLoader loader;

    public ProgramHost(Interpreter interpreter, ProgramLoader loader) {
        this.interpreter = interpreter;
        this.loader = loader;
    }

    /**
     * Loads {@code fileName} and runs it from the top.
     *
     * @throws IOException when the file cannot be read
     */
    public ExecutionOutcome loadAndRun(String fileName) throws IOException {
        interpreter.runtime().load(loader.load(fileName));
        interpreter.start();
        return runProgram();
    }

    public ExecutionOutcome runProgram() {
        while (true) {
            ExecutionOutcome outcome = interpreter.run();
            if (outcome.hasRequest()) {
                service(outcome.request());
                continue;
            }
            if (outcome.isError()) {
                interpreter.console().print(outcome.error().format() + "\n");
            }
            return outcome;
        }
    }

    private void service(PendingRequest request) {
        Program program;
        try {
            program = loader.load(request.fileName());
        } catch (IOException e) {
            BasicRuntimeException error = FileTable.handleIOException(e, request.fileName());
            interpreter.failPendingRequest(error.getCode(), error.getDetail());
            return;
        } catch (BasicSyntaxException e) {
            interpreter.failPendingRequest(ErrorCode.SYNTAX_ERROR, e.getMessage());
            return;
        }

        try {
            if (request instanceof PendingRequest.MergeRequest) {
                interpreter.completeMerge(program);
            } else if (request instanceof PendingRequest.RunRequest run) {
                runFile(program, run);
            } else if (request instanceof PendingRequest.ChainRequest chain) {
                chain(program, chain);
            }
        } catch (IllegalArgumentException e) {
            interpreter.failPendingRequest(ErrorCode.SYNTAX_ERROR, e.getMessage());
        }
    }

    private void runFile(Program program, PendingRequest.RunRequest request) {
        BasicRuntime runtime = interpreter.runtime();
        if (request.keepVariables()) {
            runtime.chain(program, false, runtime.captureVariables(null));
        } else {
            runtime.load(program);
        }
        interpreter.clearPendingRequest();
    }

    private void chain(Program program, PendingRequest.ChainRequest request) {
        BasicRuntime runtime = interpreter.runtime();
        Integer line = request.line();
        if (line != null && !hasLine(program, line)
                && !(request.merge() && runtime.table().line(line) != null)) {
            interpreter.failPendingRequest(ErrorCode.UNDEFINED_LINE, "CHAIN " + request.fileName() + ", " + line);
            return;
        }
        BasicRuntime.VariableSnapshot kept = runtime.captureVariables(request.all() ? null : request.commonVariables());
        if (request.merge() && request.deleteFrom() != null) {
            int to = request.deleteTo() != null ? request.deleteTo() : request.deleteFrom();
            runtime.table().deleteRange(request.deleteFrom(), to);
        }
        runtime.chain(program, request.merge(), kept);
        interpreter.clearPendingRequest();
        if (line != null) {
            runtime.setPc(runtime.table().findLine(line));
        }
    }

    private static boolean hasLine(Program program, int number) {
        for (Line line : program.lines()) {
            if (line.number() == number) {
                return true;
            }
        }
        return false;
    }
}
