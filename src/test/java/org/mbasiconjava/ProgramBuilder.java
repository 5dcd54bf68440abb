package org.mbasiconjava;

import org.mbasiconjava.frontend.astnode.Expr;
import org.mbasiconjava.frontend.astnode.LValue;
import org.mbasiconjava.frontend.astnode.Line;
import org.mbasiconjava.frontend.astnode.Operator;
import org.mbasiconjava.frontend.astnode.PrintSeparator;
import org.mbasiconjava.frontend.astnode.Program;
import org.mbasiconjava.frontend.astnode.Statement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shorthand for building programs in tests, standing in for the parser.
 */
public final class ProgramBuilder {

    private ProgramBuilder() {
    }

    public static Program program(Line... lines) {
        return Program.of(lines);
    }

    public static Line line(int number, Statement... statements) {
        return new Line(number, List.of(statements));
    }

    // Expressions

    public static Expr num(double value) {
        return new Expr.NumberLiteral(value);
    }

    public static Expr str(String value) {
        return new Expr.StringLiteral(value);
    }

    public static Expr.Variable var(String name) {
        return new Expr.Variable(name);
    }

    public static Expr.ArrayAccess arr(String name, Expr... indices) {
        return new Expr.ArrayAccess(name, List.of(indices));
    }

    public static Expr bin(Operator op, Expr left, Expr right) {
        return new Expr.Binary(op, left, right);
    }

    public static Expr add(Expr left, Expr right) {
        return bin(Operator.ADD, left, right);
    }

    public static Expr eq(Expr left, Expr right) {
        return bin(Operator.EQ, left, right);
    }

    public static Expr lt(Expr left, Expr right) {
        return bin(Operator.LT, left, right);
    }

    public static Expr fn(String name, Expr... args) {
        return new Expr.FunctionCall(name, List.of(args));
    }

    // Statements

    /**
     * PRINT with items joined by semicolons and a final newline.
     */
    public static Statement print(Expr... items) {
        List<PrintSeparator> separators = new ArrayList<>();
        for (int i = 0; i < items.length; i++) {
            separators.add(i == items.length - 1 ? PrintSeparator.NONE : PrintSeparator.SEMICOLON);
        }
        return new Statement.Print(null, List.of(items), separators);
    }

    public static Statement printTo(Expr file, Expr... items) {
        Statement.Print plain = (Statement.Print) print(items);
        return new Statement.Print(file, plain.items(), plain.separators());
    }

    public static Statement let(LValue target, Expr value) {
        return new Statement.Let(target, value);
    }

    public static Statement let(String name, Expr value) {
        return let(var(name), value);
    }

    public static Statement forLoop(String variable, Expr start, Expr end) {
        return new Statement.For(variable, start, end, null);
    }

    public static Statement forLoop(String variable, Expr start, Expr end, Expr step) {
        return new Statement.For(variable, start, end, step);
    }

    public static Statement next(String... variables) {
        return new Statement.Next(Arrays.asList(variables));
    }

    public static Statement gotoLine(int line) {
        return new Statement.Goto(line);
    }

    public static Statement gosub(int line) {
        return new Statement.Gosub(line);
    }

    public static Statement returnStatement() {
        return new Statement.Return(null);
    }

    public static Statement ifThen(Expr condition, Statement... statements) {
        return new Statement.If(condition, null, List.of(statements), null, null);
    }

    public static Statement ifThenElse(Expr condition, List<Statement> then, List<Statement> otherwise) {
        return new Statement.If(condition, null, then, null, otherwise);
    }

    public static Statement ifGoto(Expr condition, int line) {
        return new Statement.If(condition, line, null, null, null);
    }

    public static Statement end() {
        return new Statement.End();
    }

    public static Statement stop() {
        return new Statement.Stop();
    }

    public static Statement onErrorGoto(int line) {
        return new Statement.OnError(line, false);
    }

    public static Statement resumeNext() {
        return new Statement.Resume(true, null);
    }

    public static Statement error(int code) {
        return new Statement.Error(num(code));
    }
}
