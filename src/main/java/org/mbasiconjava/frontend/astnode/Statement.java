package org.mbasiconjava.frontend.astnode;

import org.mbasiconjava.frontend.analysis.StatementVisitor;
import org.mbasiconjava.io.FileMode;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.VarType;

import java.util.List;
import java.util.Locale;

/**
 * Statement nodes. One record per statement kind; optional operands are
 * null when the source leaves them out.
 */
public sealed interface Statement {

    void accept(StatementVisitor visitor);

    /**
     * One {@code width AS variable} clause of a FIELD statement.
     */
    record FieldSpec(Expr width, String variable) {
        public FieldSpec {
            variable = variable.toLowerCase(Locale.ROOT);
        }
    }

    /**
     * PRINT and PRINT #n. {@code fileNumber} is null for the console.
     */
    record Print(Expr fileNumber, List<Expr> items, List<PrintSeparator> separators) implements Statement {
        public Print {
            items = List.copyOf(items);
            separators = List.copyOf(separators);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record PrintUsing(Expr fileNumber, Expr format, List<Expr> items, boolean suppressNewline) implements Statement {
        public PrintUsing {
            items = List.copyOf(items);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Lprint(List<Expr> items, List<PrintSeparator> separators) implements Statement {
        public Lprint {
            items = List.copyOf(items);
            separators = List.copyOf(separators);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record LprintUsing(Expr format, List<Expr> items, boolean suppressNewline) implements Statement {
        public LprintUsing {
            items = List.copyOf(items);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * INPUT and INPUT #n. A null prompt prints only {@code "? "}.
     */
    record Input(Expr fileNumber, String prompt, boolean suppressQuestionMark, List<LValue> targets) implements Statement {
        public Input {
            targets = List.copyOf(targets);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record LineInput(Expr fileNumber, String prompt, LValue target) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Let(LValue target, Expr value) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * IF/THEN/ELSE. Each branch is either a line number or an inline statement list.
     */
    record If(Expr condition, Integer thenLine, List<Statement> thenStatements, Integer elseLine, List<Statement> elseStatements) implements Statement {
        public If {
            thenStatements = thenStatements == null ? List.of() : List.copyOf(thenStatements);
            elseStatements = elseStatements == null ? List.of() : List.copyOf(elseStatements);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * FOR; {@code step} is null when omitted.
     */
    record For(String variable, Expr start, Expr end, Expr step) implements Statement {
        public For {
            variable = variable.toLowerCase(Locale.ROOT);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * NEXT with an optional variable list; an empty list is a bare NEXT.
     */
    record Next(List<String> variables) implements Statement {
        public Next {
            variables = variables.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record While(Expr condition) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Wend() implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Goto(int line) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Gosub(int line) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Return(Integer line) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record OnGoto(Expr selector, List<Integer> lines) implements Statement {
        public OnGoto {
            lines = List.copyOf(lines);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record OnGosub(Expr selector, List<Integer> lines) implements Statement {
        public OnGosub {
            lines = List.copyOf(lines);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Data(List<BasicValue> values) implements Statement {
        public Data {
            values = List.copyOf(values);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Read(List<LValue> targets) implements Statement {
        public Read {
            targets = List.copyOf(targets);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Restore(Integer line) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * DIM; each entry names an array and its upper bounds.
     */
    record Dim(List<Expr.ArrayAccess> arrays) implements Statement {
        public Dim {
            arrays = List.copyOf(arrays);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * DEF FNx(params) = body. The name includes the {@code fn} prefix.
     */
    record DefFn(String name, List<String> parameters, Expr body) implements Statement {
        public DefFn {
            name = name.toLowerCase(Locale.ROOT);
            parameters = parameters.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record DefType(VarType type, List<Character> letters) implements Statement {
        public DefType {
            letters = letters.stream().map(c -> Character.toLowerCase(c)).toList();
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record End() implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Stop() implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Cls() implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Rem(String text) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Swap(LValue first, LValue second) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Erase(List<String> arrays) implements Statement {
        public Erase {
            arrays = arrays.stream().map(a -> a.toLowerCase(Locale.ROOT)).toList();
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Clear() implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record OptionBase(int base) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Randomize(Expr seed) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Tron() implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Troff() implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Width(Expr width) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Poke(Expr address, Expr value) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Out(Expr port, Expr value) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Wait(Expr port, Expr mask, Expr xorMask) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Call(String target, List<Expr> args) implements Statement {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Error(Expr code) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * ON ERROR GOTO/GOSUB; line 0 disables the handler.
     */
    record OnError(int line, boolean gosub) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * RESUME, RESUME NEXT or RESUME line. Both fields unset means retry.
     */
    record Resume(boolean next, Integer line) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Open(FileMode mode, Expr fileNumber, Expr fileName, Expr recordLength) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * CLOSE; an empty list closes every file.
     */
    record Close(List<Expr> fileNumbers) implements Statement {
        public Close {
            fileNumbers = List.copyOf(fileNumbers);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Reset() implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Field(Expr fileNumber, List<FieldSpec> fields) implements Statement {
        public Field {
            fields = List.copyOf(fields);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Get(Expr fileNumber, Expr record) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Put(Expr fileNumber, Expr record) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Lset(LValue target, Expr value) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Rset(LValue target, Expr value) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Write(Expr fileNumber, List<Expr> items) implements Statement {
        public Write {
            items = List.copyOf(items);
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * CHAIN [MERGE] file [,line] [,ALL] [,DELETE from-to].
     */
    record Chain(Expr fileName, Expr line, boolean all, boolean merge, Integer deleteFrom, Integer deleteTo) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Common(List<String> variables) implements Statement {
        public Common {
            variables = variables.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
        }

        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * MID$(target, start[, length]) = value.
     */
    record MidAssign(LValue target, Expr start, Expr length, Expr value) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Kill(Expr fileName) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Name(Expr oldName, Expr newName) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    record Merge(Expr fileName) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }

    /**
     * RUN, RUN line or RUN "file"[,R].
     */
    record Run(Expr fileName, Integer line, boolean keepVariables) implements Statement {
        @Override
        public void accept(StatementVisitor visitor) {
            visitor.visit(this);
        }
    }
}
