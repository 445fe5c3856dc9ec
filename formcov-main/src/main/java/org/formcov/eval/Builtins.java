package org.formcov.eval;

import org.formcov.ast.Form;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * The core library installed into {@value Interpreter#CORE_NAMESPACE}.
 */
public final class Builtins {

    /**
     * A named host-implemented function.
     */
    public record Builtin(String name, Invokable body) implements Invokable {

        @Override
        public Object invoke(List<Object> args) {
            return body.invoke(args);
        }

        @Override
        public String toString() {
            return "#<builtin " + name + ">";
        }
    }

    private Builtins() {}

    public static void install(Interpreter interpreter) {
        installArithmetic(interpreter);
        installComparison(interpreter);
        installCollections(interpreter);
        installSequences(interpreter);
        installPredicates(interpreter);
        installMisc(interpreter);
    }

    private static void define(Interpreter interpreter, String name, Invokable body) {
        interpreter.define(Interpreter.CORE_NAMESPACE, name, new Builtin(name, body));
    }

    private static void installArithmetic(Interpreter in) {
        define(in, "+", args -> {
            Number sum = 0L;
            for (Object arg : args) {
                sum = Numbers.add(sum, Numbers.toNumber(arg, "+"));
            }
            return sum;
        });
        define(in, "*", args -> {
            Number product = 1L;
            for (Object arg : args) {
                product = Numbers.multiply(product, Numbers.toNumber(arg, "*"));
            }
            return product;
        });
        define(in, "-", args -> {
            arity("-", args, 1, Integer.MAX_VALUE);
            Number first = Numbers.toNumber(args.get(0), "-");
            if (args.size() == 1) {
                return Numbers.subtract(0L, first);
            }
            Number result = first;
            for (Object arg : args.subList(1, args.size())) {
                result = Numbers.subtract(result, Numbers.toNumber(arg, "-"));
            }
            return result;
        });
        define(in, "/", args -> {
            arity("/", args, 1, Integer.MAX_VALUE);
            Number first = Numbers.toNumber(args.get(0), "/");
            if (args.size() == 1) {
                return Numbers.divide(1L, first);
            }
            Number result = first;
            for (Object arg : args.subList(1, args.size())) {
                result = Numbers.divide(result, Numbers.toNumber(arg, "/"));
            }
            return result;
        });
        define(in, "inc", args -> Numbers.add(number("inc", args), 1L));
        define(in, "dec", args -> Numbers.subtract(number("dec", args), 1L));
        define(in, "quot", args -> {
            arity("quot", args, 2, 2);
            return Numbers.quotient(Numbers.toNumber(args.get(0), "quot"), Numbers.toNumber(args.get(1), "quot"));
        });
        define(in, "rem", args -> {
            arity("rem", args, 2, 2);
            return Numbers.remainder(Numbers.toNumber(args.get(0), "rem"), Numbers.toNumber(args.get(1), "rem"));
        });
        define(in, "mod", args -> {
            arity("mod", args, 2, 2);
            return Numbers.modulo(Numbers.toNumber(args.get(0), "mod"), Numbers.toNumber(args.get(1), "mod"));
        });
        define(in, "max", args -> extreme("max", args, 1));
        define(in, "min", args -> extreme("min", args, -1));
    }

    private static void installComparison(Interpreter in) {
        define(in, "=", args -> {
            arity("=", args, 1, Integer.MAX_VALUE);
            for (int i = 1; i < args.size(); i++) {
                if (!Values.equiv(args.get(i - 1), args.get(i))) {
                    return false;
                }
            }
            return true;
        });
        define(in, "not=", args -> {
            arity("not=", args, 1, Integer.MAX_VALUE);
            for (int i = 1; i < args.size(); i++) {
                if (!Values.equiv(args.get(i - 1), args.get(i))) {
                    return true;
                }
            }
            return false;
        });
        define(in, "<", args -> chain("<", args, c -> c < 0));
        define(in, ">", args -> chain(">", args, c -> c > 0));
        define(in, "<=", args -> chain("<=", args, c -> c <= 0));
        define(in, ">=", args -> chain(">=", args, c -> c >= 0));
        define(in, "not", args -> {
            arity("not", args, 1, 1);
            return !Values.isTruthy(args.get(0));
        });
    }

    private static void installCollections(Interpreter in) {
        define(in, "list", args -> Values.list(args));
        define(in, "vector", args -> Values.list(args));
        define(in, "vec", args -> {
            arity("vec", args, 1, 1);
            return Values.list(Values.seq(args.get(0)));
        });
        define(in, "hash-map", args -> {
            if (args.size() % 2 != 0) {
                throw new EvaluatorException("No value supplied for key: " + Values.print(args.get(args.size() - 1), true));
            }
            Map<Object, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < args.size(); i += 2) {
                map.put(args.get(i), args.get(i + 1));
            }
            return Collections.unmodifiableMap(map);
        });
        define(in, "hash-set", args -> Collections.unmodifiableSet(new LinkedHashSet<>(args)));
        define(in, "count", args -> {
            arity("count", args, 1, 1);
            Object coll = args.get(0);
            if (coll instanceof Map<?, ?> map) {
                return (long) map.size();
            }
            if (coll instanceof CharSequence text) {
                return (long) text.length();
            }
            return (long) Values.seq(coll).size();
        });
        define(in, "get", args -> {
            arity("get", args, 2, 3);
            return Values.lookup(args.get(0), args.get(1), args.size() == 3 ? args.get(2) : null);
        });
        define(in, "nth", args -> {
            arity("nth", args, 2, 3);
            long index = Numbers.toIndex(Numbers.toNumber(args.get(1), "nth"));
            if (args.size() == 3) {
                List<Object> elements = Values.seq(args.get(0));
                return index >= 0 && index < elements.size() ? elements.get((int) index) : args.get(2);
            }
            return Values.nth(args.get(0), index);
        });
        define(in, "contains?", args -> {
            arity("contains?", args, 2, 2);
            Object coll = args.get(0);
            Object key = args.get(1);
            if (coll instanceof Map<?, ?> map) {
                return map.containsKey(key);
            }
            if (coll instanceof Set<?> set) {
                return set.contains(key);
            }
            if (coll instanceof List<?> list && key instanceof Number number) {
                long index = Numbers.toIndex(number);
                return index >= 0 && index < list.size();
            }
            return false;
        });
        define(in, "assoc", args -> {
            arity("assoc", args, 3, Integer.MAX_VALUE);
            if (args.size() % 2 != 1) {
                throw new EvaluatorException("assoc expects even number of arguments after map/vector");
            }
            Object coll = args.get(0);
            if (coll instanceof List<?> list) {
                List<Object> updated = new ArrayList<>(list);
                for (int i = 1; i < args.size(); i += 2) {
                    long index = Numbers.toIndex(Numbers.toNumber(args.get(i), "assoc"));
                    if (index == updated.size()) {
                        updated.add(args.get(i + 1));
                    } else if (index >= 0 && index < updated.size()) {
                        updated.set((int) index, args.get(i + 1));
                    } else {
                        throw new EvaluatorException("Index " + index + " out of bounds for assoc");
                    }
                }
                return Collections.unmodifiableList(updated);
            }
            Map<Object, Object> updated = new LinkedHashMap<>(asMap(coll, "assoc"));
            for (int i = 1; i < args.size(); i += 2) {
                updated.put(args.get(i), args.get(i + 1));
            }
            return Collections.unmodifiableMap(updated);
        });
        define(in, "dissoc", args -> {
            arity("dissoc", args, 1, Integer.MAX_VALUE);
            if (args.get(0) == null) {
                return null;
            }
            Map<Object, Object> updated = new LinkedHashMap<>(asMap(args.get(0), "dissoc"));
            for (Object key : args.subList(1, args.size())) {
                updated.remove(key);
            }
            return Collections.unmodifiableMap(updated);
        });
        define(in, "keys", args -> {
            arity("keys", args, 1, 1);
            Map<?, ?> map = asMap(args.get(0), "keys");
            return map.isEmpty() ? null : Values.list(map.keySet());
        });
        define(in, "vals", args -> {
            arity("vals", args, 1, 1);
            Map<?, ?> map = asMap(args.get(0), "vals");
            return map.isEmpty() ? null : Values.list(map.values());
        });
        define(in, "conj", args -> {
            arity("conj", args, 1, Integer.MAX_VALUE);
            return conj(args.get(0), args.subList(1, args.size()));
        });
    }

    private static void installSequences(Interpreter in) {
        define(in, "first", args -> {
            arity("first", args, 1, 1);
            List<Object> elements = Values.seq(args.get(0));
            return elements.isEmpty() ? null : elements.get(0);
        });
        define(in, "rest", args -> {
            arity("rest", args, 1, 1);
            List<Object> elements = Values.seq(args.get(0));
            return elements.isEmpty() ? List.of() : Values.list(elements.subList(1, elements.size()));
        });
        define(in, "next", args -> {
            arity("next", args, 1, 1);
            List<Object> elements = Values.seq(args.get(0));
            return elements.size() <= 1 ? null : Values.list(elements.subList(1, elements.size()));
        });
        define(in, "cons", args -> {
            arity("cons", args, 2, 2);
            List<Object> elements = new ArrayList<>();
            elements.add(args.get(0));
            elements.addAll(Values.seq(args.get(1)));
            return Collections.unmodifiableList(elements);
        });
        define(in, "map", args -> {
            arity("map", args, 2, Integer.MAX_VALUE);
            Object fn = args.get(0);
            List<List<Object>> colls = new ArrayList<>();
            int length = Integer.MAX_VALUE;
            for (Object coll : args.subList(1, args.size())) {
                List<Object> elements = Values.seq(coll);
                colls.add(elements);
                length = Math.min(length, elements.size());
            }
            List<Object> result = new ArrayList<>();
            for (int i = 0; i < length; i++) {
                List<Object> callArgs = new ArrayList<>(colls.size());
                for (List<Object> elements : colls) {
                    callArgs.add(elements.get(i));
                }
                result.add(Values.invoke(fn, callArgs));
            }
            return Collections.unmodifiableList(result);
        });
        define(in, "filter", args -> {
            arity("filter", args, 2, 2);
            List<Object> result = new ArrayList<>();
            for (Object element : Values.seq(args.get(1))) {
                if (Values.isTruthy(Values.invoke(args.get(0), singleton(element)))) {
                    result.add(element);
                }
            }
            return Collections.unmodifiableList(result);
        });
        define(in, "reduce", args -> {
            arity("reduce", args, 2, 3);
            Object fn = args.get(0);
            List<Object> elements = Values.seq(args.get(args.size() - 1));
            Object accumulator;
            int start;
            if (args.size() == 3) {
                accumulator = args.get(1);
                start = 0;
            } else if (elements.isEmpty()) {
                return Values.invoke(fn, List.of());
            } else {
                accumulator = elements.get(0);
                start = 1;
            }
            for (Object element : elements.subList(start, elements.size())) {
                List<Object> callArgs = new ArrayList<>(2);
                callArgs.add(accumulator);
                callArgs.add(element);
                accumulator = Values.invoke(fn, callArgs);
            }
            return accumulator;
        });
        define(in, "range", args -> {
            arity("range", args, 1, 3);
            long start = 0;
            long end;
            long step = 1;
            if (args.size() == 1) {
                end = Numbers.toNumber(args.get(0), "range").longValue();
            } else {
                start = Numbers.toNumber(args.get(0), "range").longValue();
                end = Numbers.toNumber(args.get(1), "range").longValue();
                if (args.size() == 3) {
                    step = Numbers.toNumber(args.get(2), "range").longValue();
                }
            }
            if (step == 0) {
                throw new EvaluatorException("range step must not be zero");
            }
            List<Object> result = new ArrayList<>();
            for (long i = start; step > 0 ? i < end : i > end; i += step) {
                result.add(i);
            }
            return Collections.unmodifiableList(result);
        });
        define(in, "apply", args -> {
            arity("apply", args, 2, Integer.MAX_VALUE);
            List<Object> callArgs = new ArrayList<>(args.subList(1, args.size() - 1));
            callArgs.addAll(Values.seq(args.get(args.size() - 1)));
            return Values.invoke(args.get(0), callArgs);
        });
    }

    private static void installPredicates(Interpreter in) {
        define(in, "nil?", args -> single("nil?", args) == null);
        define(in, "some?", args -> single("some?", args) != null);
        define(in, "empty?", args -> {
            Object coll = single("empty?", args);
            if (coll instanceof Map<?, ?> map) {
                return map.isEmpty();
            }
            return Values.seq(coll).isEmpty();
        });
        define(in, "zero?", args -> Numbers.isZero(number("zero?", args)));
        define(in, "pos?", args -> Numbers.signum(number("pos?", args)) > 0);
        define(in, "neg?", args -> Numbers.signum(number("neg?", args)) < 0);
        define(in, "even?", args -> Numbers.isZero(Numbers.remainder(integer("even?", args), 2L)));
        define(in, "odd?", args -> !Numbers.isZero(Numbers.remainder(integer("odd?", args), 2L)));
        define(in, "number?", args -> single("number?", args) instanceof Number);
        define(in, "string?", args -> single("string?", args) instanceof String);
        define(in, "keyword?", args -> single("keyword?", args) instanceof Form.Keyword);
        define(in, "symbol?", args -> single("symbol?", args) instanceof Form.Symbol);
        define(in, "fn?", args -> single("fn?", args) instanceof Invokable);
        define(in, "instance?", args -> {
            arity("instance?", args, 2, 2);
            if (!(args.get(0) instanceof Class<?> type)) {
                throw new EvaluatorException("instance? expects a class but got " + Values.typeName(args.get(0)));
            }
            return type.isInstance(args.get(1));
        });
    }

    private static void installMisc(Interpreter in) {
        define(in, "identity", args -> single("identity", args));
        define(in, "str", args -> {
            StringBuilder sb = new StringBuilder();
            for (Object arg : args) {
                sb.append(Values.str(arg));
            }
            return sb.toString();
        });
        define(in, "keyword", args -> {
            Object name = single("keyword", args);
            if (name instanceof Form.Keyword) {
                return name;
            }
            if (name instanceof String text) {
                return Form.keyword(text);
            }
            if (name instanceof Form.Symbol symbol) {
                return Form.keyword(symbol.fullName());
            }
            throw new EvaluatorException("keyword expects a string but got " + Values.typeName(name));
        });
        define(in, "symbol", args -> Form.symbol(Values.str(single("symbol", args))));
        define(in, "name", args -> {
            Object named = single("name", args);
            if (named instanceof Form.Keyword keyword) {
                return keyword.name();
            }
            if (named instanceof Form.Symbol symbol) {
                return symbol.name();
            }
            if (named instanceof String) {
                return named;
            }
            throw new EvaluatorException("Doesn't support name: " + Values.typeName(named));
        });
        define(in, "class", args -> {
            Object value = single("class", args);
            return value == null ? null : value.getClass();
        });
        define(in, "deref", args -> {
            Object ref = single("deref", args);
            if (!(ref instanceof Var var)) {
                throw new EvaluatorException("deref expects a var but got " + Values.typeName(ref));
            }
            return var.deref();
        });
        define(in, "in-ns", args -> {
            Object name = single("in-ns", args);
            if (!(name instanceof Form.Symbol symbol)) {
                throw new EvaluatorException("in-ns expects a symbol but got " + Values.typeName(name));
            }
            return in.inNamespace(symbol.fullName());
        });
        define(in, "print", args -> {
            in.getOut().print(join(args, false));
            return null;
        });
        define(in, "println", args -> {
            in.getOut().println(join(args, false));
            return null;
        });
        define(in, "prn", args -> {
            in.getOut().println(join(args, true));
            return null;
        });
        define(in, "pr-str", args -> join(args, true));
    }

    private static Object conj(Object coll, List<Object> values) {
        if (coll == null) {
            return Values.list(values);
        }
        if (coll instanceof Set<?> set) {
            Set<Object> updated = new LinkedHashSet<>(set);
            updated.addAll(values);
            return Collections.unmodifiableSet(updated);
        }
        if (coll instanceof Map<?, ?> map) {
            Map<Object, Object> updated = new LinkedHashMap<>(map);
            for (Object value : values) {
                if (value instanceof Map<?, ?> entries) {
                    updated.putAll(entries);
                } else if (value instanceof List<?> pair && pair.size() == 2) {
                    updated.put(pair.get(0), pair.get(1));
                } else {
                    throw new EvaluatorException("Vector arg to map conj must be a pair");
                }
            }
            return Collections.unmodifiableMap(updated);
        }
        if (coll instanceof Collection<?> collection) {
            List<Object> updated = new ArrayList<>(collection);
            updated.addAll(values);
            return Collections.unmodifiableList(updated);
        }
        throw new EvaluatorException("Don't know how to conj onto " + Values.typeName(coll));
    }

    private static Map<?, ?> asMap(Object value, String operation) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new EvaluatorException(operation + " expects a map but got " + Values.typeName(value));
    }

    private interface ComparisonTest {
        boolean test(int comparison);
    }

    private static boolean chain(String name, List<Object> args, ComparisonTest test) {
        arity(name, args, 1, Integer.MAX_VALUE);
        for (int i = 1; i < args.size(); i++) {
            int comparison = Numbers.compare(Numbers.toNumber(args.get(i - 1), name), Numbers.toNumber(args.get(i), name));
            if (!test.test(comparison)) {
                return false;
            }
        }
        Numbers.toNumber(args.get(0), name);
        return true;
    }

    private static Number extreme(String name, List<Object> args, int sign) {
        arity(name, args, 1, Integer.MAX_VALUE);
        Number best = Numbers.toNumber(args.get(0), name);
        for (Object arg : args.subList(1, args.size())) {
            Number candidate = Numbers.toNumber(arg, name);
            if (Integer.signum(Numbers.compare(candidate, best)) == sign) {
                best = candidate;
            }
        }
        return best;
    }

    private static String join(List<Object> args, boolean readably) {
        StringJoiner joiner = new StringJoiner(" ");
        for (Object arg : args) {
            joiner.add(Values.print(arg, readably));
        }
        return joiner.toString();
    }

    private static List<Object> singleton(Object value) {
        List<Object> args = new ArrayList<>(1);
        args.add(value);
        return args;
    }

    private static Object single(String name, List<Object> args) {
        arity(name, args, 1, 1);
        return args.get(0);
    }

    private static Number number(String name, List<Object> args) {
        return Numbers.toNumber(single(name, args), name);
    }

    private static Number integer(String name, List<Object> args) {
        Number n = number(name, args);
        if (!Numbers.isIntegral(n)) {
            throw new EvaluatorException("Argument must be an integer: " + n);
        }
        return n;
    }

    private static void arity(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new EvaluatorException("Wrong number of args (" + args.size() + ") passed to " + name);
        }
    }
}
