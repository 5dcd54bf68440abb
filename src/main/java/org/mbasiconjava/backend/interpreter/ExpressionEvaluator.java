package org.mbasiconjava.backend.interpreter;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.frontend.analysis.ExprVisitor;
import org.mbasiconjava.frontend.astnode.Expr;
import org.mbasiconjava.frontend.astnode.Statement;
import org.mbasiconjava.operators.BuiltinContext;
import org.mbasiconjava.operators.BuiltinFunctions;
import org.mbasiconjava.operators.NumericOperators;
import org.mbasiconjava.runtime.BasicRuntime;
import org.mbasiconjava.runtime.runtimetypes.BasicRuntimeException;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;
import org.mbasiconjava.runtime.runtimetypes.ErrorCode;
import org.mbasiconjava.runtime.runtimetypes.VarType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates expression trees against the runtime. Built-ins go through
 * {@link BuiltinFunctions}; names starting with {@code fn} that are not
 * built-ins are user functions defined by DEF FN.
 */
public class ExpressionEvaluator implements ExprVisitor<BasicValue> {
    private final BuiltinContext context;
    private int functionDepth;

    public ExpressionEvaluator(BuiltinContext context) {
        this.context = context;
    }

    public BasicValue evaluate(Expr expr) {
        return expr.accept(this);
    }

    public double evaluateNumber(Expr expr) {
        BasicValue value = evaluate(expr);
        if (value.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "numeric expression expected");
        }
        return value.toNumber();
    }

    /**
     * Numeric expression rounded to a 16-bit integer.
     */
    public int evaluateInteger(Expr expr) {
        BasicValue value = evaluate(expr);
        if (value.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "numeric expression expected");
        }
        return value.toInteger();
    }

    public String evaluateString(Expr expr) {
        BasicValue value = evaluate(expr);
        if (!value.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH, "string expression expected");
        }
        return value.getString();
    }

    public int[] evaluateIndices(Expr.ArrayAccess access) {
        int[] indices = new int[access.indices().size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = evaluateInteger(access.indices().get(i));
        }
        return indices;
    }

    @Override
    public BasicValue visit(Expr.NumberLiteral node) {
        return BasicValue.ofDouble(node.value());
    }

    @Override
    public BasicValue visit(Expr.StringLiteral node) {
        return BasicValue.ofString(node.value());
    }

    @Override
    public BasicValue visit(Expr.Variable node) {
        return runtime().getVariable(node.name());
    }

    @Override
    public BasicValue visit(Expr.ArrayAccess node) {
        return runtime().getArrayElement(node.name(), evaluateIndices(node));
    }

    @Override
    public BasicValue visit(Expr.Binary node) {
        BasicValue left = evaluate(node.left());
        BasicValue right = evaluate(node.right());
        return NumericOperators.binary(node.op(), left, right);
    }

    @Override
    public BasicValue visit(Expr.Unary node) {
        return NumericOperators.unary(node.op(), evaluate(node.operand()));
    }

    @Override
    public BasicValue visit(Expr.FunctionCall node) {
        List<BasicValue> args = new ArrayList<>(node.args().size());
        for (Expr arg : node.args()) {
            args.add(evaluate(arg));
        }
        if (node.name().startsWith("fn") && !BuiltinFunctions.isBuiltin(node.name())) {
            return callUserFunction(node.name(), args);
        }
        return BuiltinFunctions.call(node.name(), context, args);
    }

    /**
     * Binds the arguments to the parameter names for the duration of the
     * body. Parameters shadow program variables of the same name, which get
     * their values back afterwards.
     */
    private BasicValue callUserFunction(String name, List<BasicValue> args) {
        BasicRuntime runtime = runtime();
        Statement.DefFn def = runtime.getFunction(name);
        if (def == null) {
            throw new BasicRuntimeException(ErrorCode.UNDEFINED_USER_FUNCTION, name);
        }
        if (args.size() != def.parameters().size()) {
            throw new BasicRuntimeException(ErrorCode.ILLEGAL_FUNCTION_CALL,
                    name + " expects " + def.parameters().size() + " arguments");
        }
        if (functionDepth >= Configuration.maxFunctionDepth) {
            throw new BasicRuntimeException(ErrorCode.OUT_OF_MEMORY, "user function nesting");
        }

        Map<String, BasicValue> saved = new HashMap<>();
        List<String> introduced = new ArrayList<>();
        for (String parameter : def.parameters()) {
            if (runtime.hasVariable(parameter)) {
                saved.put(parameter, runtime.getVariable(parameter));
            } else {
                introduced.add(parameter);
            }
        }
        functionDepth++;
        try {
            for (int i = 0; i < args.size(); i++) {
                String parameter = def.parameters().get(i);
                runtime.setVariable(parameter, typed(runtime.resolveType(parameter), args.get(i)));
            }
            BasicValue result = evaluate(def.body());
            return typed(runtime.resolveType(name), result);
        } finally {
            functionDepth--;
            saved.forEach(runtime::setVariable);
            introduced.forEach(runtime::removeVariable);
        }
    }

    /**
     * Converts between numeric types; a string/number mix is a type mismatch.
     */
    public static BasicValue typed(VarType type, BasicValue value) {
        if ((type == VarType.STRING) != value.isString()) {
            throw new BasicRuntimeException(ErrorCode.TYPE_MISMATCH);
        }
        if (type == VarType.INTEGER && value.isNumeric()) {
            double d = value.toNumber();
            if (d >= 32767.5 || d < -32768.5) {
                throw new BasicRuntimeException(ErrorCode.OVERFLOW);
            }
        }
        if (type == VarType.SINGLE) {
            NumericOperators.checkedSingle(value.toNumber());
        }
        return value.coerceTo(type);
    }

    private BasicRuntime runtime() {
        return context.runtime();
    }
}
