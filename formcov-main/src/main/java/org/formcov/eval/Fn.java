package org.formcov.eval;

import org.formcov.ast.Form;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A function value created by {@code fn*}, closing over the scope it was created in.
 */
public class Fn implements Invokable {

    /**
     * One overload: fixed parameters, an optional rest parameter after {@code &}, and a body.
     */
    public record Arity(List<String> parameters, String restParameter, List<Form> body) {

        public boolean isVariadic() {
            return restParameter != null;
        }

        boolean accepts(int argumentCount) {
            return isVariadic() ? argumentCount >= parameters.size() : argumentCount == parameters.size();
        }
    }

    private final String name;
    private final List<Arity> arities;
    private final Environment closure;
    private final Interpreter interpreter;

    public Fn(String name, List<Arity> arities, Environment closure, Interpreter interpreter) {
        this.name = name;
        this.arities = List.copyOf(arities);
        this.closure = closure;
        this.interpreter = interpreter;
    }

    public String getName() {
        return name;
    }

    public List<Arity> getArities() {
        return arities;
    }

    @Override
    public Object invoke(List<Object> args) {
        Arity arity = select(args.size());
        Environment scope = name != null ? closure.bind(name, this) : closure;
        Environment env = bindParameters(scope, arity, args, false);
        while (true) {
            Object result = interpreter.evalBody(arity.body(), env);
            if (!(result instanceof RecurSignal recur)) {
                return result;
            }
            List<Object> recurArgs = recur.arguments();
            int expected = arity.parameters().size() + (arity.isVariadic() ? 1 : 0);
            if (recurArgs.size() != expected) {
                throw new EvaluatorException("Mismatched argument count to recur, expected: " + expected
                                             + " args, got: " + recurArgs.size());
            }
            env = bindParameters(scope, arity, recurArgs, true);
        }
    }

    private Arity select(int argumentCount) {
        for (Arity arity : arities) {
            if (!arity.isVariadic() && arity.accepts(argumentCount)) {
                return arity;
            }
        }
        for (Arity arity : arities) {
            if (arity.accepts(argumentCount)) {
                return arity;
            }
        }
        throw new EvaluatorException("Wrong number of args (" + argumentCount + ") passed to " + this);
    }

    // A recur supplies the rest parameter as a single collection rather than spread arguments.
    private static Environment bindParameters(Environment scope, Arity arity, List<Object> args, boolean fromRecur) {
        Map<String, Object> bindings = new LinkedHashMap<>();
        List<String> parameters = arity.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            bindings.put(parameters.get(i), args.get(i));
        }
        if (arity.isVariadic()) {
            Object rest;
            if (fromRecur) {
                rest = args.get(parameters.size());
            } else if (args.size() > parameters.size()) {
                rest = Values.list(new ArrayList<>(args.subList(parameters.size(), args.size())));
            } else {
                rest = null;
            }
            bindings.put(arity.restParameter(), rest);
        }
        return scope.bindAll(bindings);
    }

    @Override
    public String toString() {
        return "#<fn " + (name != null ? name : "anonymous") + ">";
    }
}
