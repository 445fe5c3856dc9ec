package org.formcov.eval;

import org.formcov.ast.Form;
import org.formcov.ast.meta.MetadataTable;
import org.formcov.classify.FormClassifier;
import org.formcov.normalize.Normalizer;
import org.formcov.printer.FormPrinter;
import org.formcov.reader.FormReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates forms directly, one top-level form at a time, so that definitions made by one form are visible to
 * the next.
 * <p>
 * Special forms are {@code quote}, {@code var}, {@code def}, {@code let*}, {@code loop*}, {@code recur},
 * {@code fn}/{@code fn*}, {@code if}, {@code do}, {@code throw}, {@code try}, {@code new}, {@code .},
 * {@code set!} and {@code import*}. Everything else is either sugar expanded by the {@link Normalizer} or a call.
 * Host classes are reached by reflection through {@link HostInterop}.
 */
public class Interpreter implements FormEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    public static final String CORE_NAMESPACE = "clojure.core";
    public static final String DEFAULT_NAMESPACE = "user";

    private final Map<String, Namespace> namespaces = new LinkedHashMap<>();
    private final Map<String, Class<?>> imports = new HashMap<>();
    private final Normalizer normalizer;
    private final ClassLoader classLoader;
    private PrintStream out = System.out;
    private Namespace currentNamespace;

    public Interpreter() {
        this(new Normalizer(), Interpreter.class.getClassLoader());
    }

    public Interpreter(Normalizer normalizer, ClassLoader classLoader) {
        this.normalizer = normalizer;
        this.classLoader = classLoader;
        Builtins.install(this);
        this.currentNamespace = namespace(DEFAULT_NAMESPACE);
    }

    @Override
    public Object eval(Form form) {
        if (LOG.isTraceEnabled()) {
            LOG.trace("Evaluating {}", FormPrinter.print(form));
        }
        Object result = eval(form, Environment.EMPTY);
        if (result instanceof RecurSignal) {
            throw new EvaluatorException("Can only recur from tail position of a loop or function");
        }
        return result;
    }

    /**
     * Reads and evaluates every form of {@code source} in order.
     *
     * @return the value of the last form, or {@code null} if there is none
     */
    public Object evalString(String source) {
        Object result = null;
        for (Form form : FormReader.readAll(source, new MetadataTable())) {
            result = eval(form);
        }
        return result;
    }

    public Object eval(Form form, Environment env) {
        if (form instanceof Form.Symbol symbol) {
            return resolveSymbol(symbol, env);
        }
        if (form instanceof Form.ListForm list) {
            return evalList(list, env);
        }
        if (form instanceof Form.VectorForm vector) {
            return Values.list(evalAll(vector.elements(), env));
        }
        if (form instanceof Form.MapForm mapForm) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (Form.MapForm.Entry entry : mapForm.entries()) {
                map.put(eval(entry.key(), env), eval(entry.value(), env));
            }
            return Collections.unmodifiableMap(map);
        }
        if (form instanceof Form.SetForm set) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(evalAll(set.elements(), env)));
        }
        return Values.fromForm(form);
    }

    Object evalBody(List<Form> body, Environment env) {
        Object result = null;
        for (Form form : body) {
            result = eval(form, env);
        }
        return result;
    }

    private List<Object> evalAll(List<Form> forms, Environment env) {
        List<Object> values = new ArrayList<>(forms.size());
        for (Form form : forms) {
            values.add(eval(form, env));
        }
        return values;
    }

    private Object evalList(Form.ListForm form, Environment env) {
        if (form.isEmpty()) {
            return List.of();
        }
        Form head = form.get(0);
        if (head instanceof Form.Symbol symbol) {
            String name = symbol.fullName();
            switch (name) {
                case "quote":
                    requireSize(form, 2, 2);
                    return Values.fromForm(form.get(1));
                case "var":
                    return evalVar(form);
                case "def":
                    return evalDef(form, env);
                case "let*":
                    return evalLet(form, env);
                case "loop*":
                    return evalLoop(form, env);
                case "recur":
                    return new RecurSignal(Values.list(evalAll(form.drop(1), env)));
                case "fn":
                case "fn*":
                    return evalFn(form, env);
                case "if":
                    return evalIf(form, env);
                case "do":
                    return evalBody(form.drop(1), env);
                case "throw":
                    return evalThrow(form, env);
                case "try":
                    return evalTry(form, env);
                case "new":
                    return evalNew(form, env);
                case ".":
                    return evalMemberAccess(form, env);
                case "set!":
                    return evalSet(form, env);
                case "import*":
                case "clojure.core/import*":
                    return evalImport(form, env);
                default:
                    break;
            }
            if (!env.contains(name) && normalizer.isExpandable(form)) {
                return eval(normalizer.expand(form), env);
            }
        }
        Object fn = eval(head, env);
        return Values.invoke(fn, evalAll(form.drop(1), env));
    }

    private Object evalVar(Form.ListForm form) {
        requireSize(form, 2, 2);
        Form.Symbol symbol = symbolAt(form, 1);
        return resolveVar(symbol)
                .orElseThrow(() -> new EvaluatorException("Unable to resolve var: " + symbol + " in this context"));
    }

    // (def name), (def name init) or (def name "doc" init)
    private Object evalDef(Form.ListForm form, Environment env) {
        requireSize(form, 2, 4);
        Form.Symbol symbol = symbolAt(form, 1);
        if (symbol.isQualified() && !symbol.namespace().equals(currentNamespace.getName())) {
            throw new EvaluatorException("Can't create defs outside of current ns: " + symbol);
        }
        Var var = currentNamespace.intern(symbol.name());
        if (form.size() > 2) {
            var.bindRoot(eval(form.get(form.size() - 1), env));
        }
        LOG.debug("Defined {}", var);
        return var;
    }

    private Object evalLet(Form.ListForm form, Environment env) {
        List<Form> bindings = bindingVector(form);
        Environment scope = env;
        for (int i = 0; i < bindings.size(); i += 2) {
            String name = bindingName(bindings.get(i), form);
            scope = scope.bind(name, eval(bindings.get(i + 1), scope));
        }
        return evalBody(form.drop(2), scope);
    }

    private Object evalLoop(Form.ListForm form, Environment env) {
        List<Form> bindings = bindingVector(form);
        List<String> names = new ArrayList<>();
        Environment scope = env;
        for (int i = 0; i < bindings.size(); i += 2) {
            String name = bindingName(bindings.get(i), form);
            names.add(name);
            scope = scope.bind(name, eval(bindings.get(i + 1), scope));
        }
        List<Form> body = form.drop(2);
        while (true) {
            Object result = evalBody(body, scope);
            if (!(result instanceof RecurSignal recur)) {
                return result;
            }
            List<Object> values = recur.arguments();
            if (values.size() != names.size()) {
                throw new EvaluatorException("Mismatched argument count to recur, expected: " + names.size()
                                             + " args, got: " + values.size());
            }
            Map<String, Object> rebound = new LinkedHashMap<>();
            for (int i = 0; i < names.size(); i++) {
                rebound.put(names.get(i), values.get(i));
            }
            scope = env.bindAll(rebound);
        }
    }

    // (fn name? [params] body*) or (fn name? ([params] body*)+)
    private Object evalFn(Form.ListForm form, Environment env) {
        int index = 1;
        String name = null;
        if (form.size() > 1 && form.get(1) instanceof Form.Symbol symbol) {
            name = symbol.name();
            index = 2;
        }
        List<Form> overloads = form.drop(index);
        if (overloads.isEmpty()) {
            throw new EvaluatorException("Parameter declaration missing in " + FormPrinter.print(form));
        }
        List<Fn.Arity> arities = new ArrayList<>();
        if (overloads.get(0) instanceof Form.VectorForm parameters) {
            arities.add(arity(parameters, overloads.subList(1, overloads.size()), form));
        } else {
            for (Form overload : overloads) {
                if (!(overload instanceof Form.ListForm group) || group.isEmpty()
                    || !(group.get(0) instanceof Form.VectorForm parameters)) {
                    throw new EvaluatorException("Invalid function overload " + FormPrinter.print(overload));
                }
                arities.add(arity(parameters, group.drop(1), form));
            }
        }
        return new Fn(name, arities, env, this);
    }

    private static Fn.Arity arity(Form.VectorForm parameters, List<Form> body, Form.ListForm form) {
        List<String> names = new ArrayList<>();
        String rest = null;
        List<Form> elements = parameters.elements();
        for (int i = 0; i < elements.size(); i++) {
            String name = bindingName(elements.get(i), form);
            if (name.equals("&")) {
                if (i != elements.size() - 2) {
                    throw new EvaluatorException("& must be followed by exactly one parameter in "
                                                 + FormPrinter.print(parameters));
                }
                rest = bindingName(elements.get(i + 1), form);
                break;
            }
            names.add(name);
        }
        return new Fn.Arity(names, rest, List.copyOf(body));
    }

    private Object evalIf(Form.ListForm form, Environment env) {
        requireSize(form, 3, 4);
        if (Values.isTruthy(eval(form.get(1), env))) {
            return eval(form.get(2), env);
        }
        return form.size() == 4 ? eval(form.get(3), env) : null;
    }

    private Object evalThrow(Form.ListForm form, Environment env) {
        requireSize(form, 2, 2);
        Object value = eval(form.get(1), env);
        if (!(value instanceof Throwable throwable)) {
            throw new EvaluatorException("Cannot throw " + Values.typeName(value));
        }
        throw ThrownException.propagate(throwable);
    }

    // (try body* (catch Class name body*)* (finally body*)?)
    private Object evalTry(Form.ListForm form, Environment env) {
        List<Form> body = new ArrayList<>();
        List<Form.ListForm> catches = new ArrayList<>();
        Form.ListForm finallyClause = null;
        for (Form clause : form.drop(1)) {
            if (FormClassifier.isHeadedBy(clause, "catch")) {
                Form.ListForm catchClause = (Form.ListForm) clause;
                if (catchClause.size() < 3 || !(catchClause.get(1) instanceof Form.Symbol)
                    || !(catchClause.get(2) instanceof Form.Symbol)) {
                    throw new EvaluatorException("Malformed catch clause " + FormPrinter.print(clause));
                }
                catches.add(catchClause);
            } else if (FormClassifier.isHeadedBy(clause, "finally")) {
                finallyClause = (Form.ListForm) clause;
            } else if (!catches.isEmpty() || finallyClause != null) {
                throw new EvaluatorException("Only catch or finally clause can follow catch in try expression");
            } else {
                body.add(clause);
            }
        }
        try {
            return evalBody(body, env);
        } catch (RuntimeException e) {
            Throwable thrown = ThrownException.unwrap(e);
            for (Form.ListForm catchClause : catches) {
                Class<?> type = requireClass((Form.Symbol) catchClause.get(1));
                if (type.isInstance(thrown)) {
                    String name = ((Form.Symbol) catchClause.get(2)).name();
                    return evalBody(catchClause.drop(3), env.bind(name, thrown));
                }
            }
            throw e;
        } finally {
            if (finallyClause != null) {
                evalBody(finallyClause.drop(1), env);
            }
        }
    }

    private Object evalNew(Form.ListForm form, Environment env) {
        if (form.size() < 2) {
            throw new EvaluatorException("new requires a class name");
        }
        Class<?> type = requireClass(symbolAt(form, 1));
        return HostInterop.construct(type, evalAll(form.drop(2), env));
    }

    // (. target member args*) or (. target (member args*))
    private Object evalMemberAccess(Form.ListForm form, Environment env) {
        if (form.size() < 3) {
            throw new EvaluatorException("Malformed member expression " + FormPrinter.print(form));
        }
        Form selector = form.get(2);
        String member;
        List<Form> argForms;
        if (selector instanceof Form.ListForm call) {
            if (call.isEmpty() || !(call.get(0) instanceof Form.Symbol method)) {
                throw new EvaluatorException("Malformed member expression " + FormPrinter.print(form));
            }
            member = method.name();
            argForms = call.drop(1);
        } else if (selector instanceof Form.Symbol field) {
            member = field.name();
            argForms = form.drop(3);
        } else {
            throw new EvaluatorException("Malformed member expression " + FormPrinter.print(form));
        }
        Optional<Class<?>> staticTarget = staticTarget(form.get(1), env);
        if (staticTarget.isPresent()) {
            return HostInterop.invokeStatic(staticTarget.get(), member, evalAll(argForms, env));
        }
        Object target = eval(form.get(1), env);
        return HostInterop.invokeInstance(target, member, evalAll(argForms, env));
    }

    private Optional<Class<?>> staticTarget(Form target, Environment env) {
        if (!(target instanceof Form.Symbol symbol)) {
            return Optional.empty();
        }
        if (symbol.isQualified() || env.contains(symbol.name()) || resolveVar(symbol).isPresent()) {
            return Optional.empty();
        }
        return resolveClass(symbol.name());
    }

    private Object evalSet(Form.ListForm form, Environment env) {
        requireSize(form, 3, 3);
        Form.Symbol symbol = symbolAt(form, 1);
        Var var = resolveVar(symbol)
                .orElseThrow(() -> new EvaluatorException("Can't change/establish root binding of: " + symbol));
        Object value = eval(form.get(2), env);
        var.bindRoot(value);
        return value;
    }

    private Object evalImport(Form.ListForm form, Environment env) {
        Class<?> last = null;
        for (Form spec : form.drop(1)) {
            Object name = spec instanceof Form.Symbol symbol ? symbol.fullName() : eval(spec, env);
            if (!(name instanceof String className)) {
                throw new EvaluatorException("import* expects a class name but got " + FormPrinter.print(spec));
            }
            Class<?> type = HostInterop.loadClass(className, classLoader)
                    .orElseThrow(() -> new EvaluatorException("Unable to import class " + name));
            importClass(type);
            last = type;
        }
        return last;
    }

    private Object resolveSymbol(Form.Symbol symbol, Environment env) {
        if (!symbol.isQualified() && env.contains(symbol.name())) {
            return env.lookup(symbol.name());
        }
        Optional<Var> var = resolveVar(symbol);
        if (var.isPresent()) {
            return var.get().deref();
        }
        if (symbol.isQualified()) {
            Optional<Class<?>> type = resolveClass(symbol.namespace());
            if (type.isPresent() && HostInterop.hasStaticField(type.get(), symbol.name())) {
                return HostInterop.getStaticField(type.get(), symbol.name());
            }
        } else {
            Optional<Class<?>> type = resolveClass(symbol.name());
            if (type.isPresent()) {
                return type.get();
            }
        }
        throw new EvaluatorException("Unable to resolve symbol: " + symbol + " in this context");
    }

    /**
     * The var a symbol names: qualified symbols look in their namespace, plain ones in the current namespace and
     * then in {@value #CORE_NAMESPACE}.
     */
    public Optional<Var> resolveVar(Form.Symbol symbol) {
        if (symbol.isQualified()) {
            return findNamespace(symbol.namespace()).flatMap(ns -> ns.find(symbol.name()));
        }
        return currentNamespace.find(symbol.name())
                .or(() -> findNamespace(CORE_NAMESPACE).flatMap(ns -> ns.find(symbol.name())));
    }

    public Optional<Class<?>> resolveClass(String name) {
        return HostInterop.resolveClass(name, imports, classLoader);
    }

    private Class<?> requireClass(Form.Symbol symbol) {
        return resolveClass(symbol.fullName())
                .orElseThrow(() -> new EvaluatorException("Unable to resolve classname: " + symbol));
    }

    /**
     * The current value of a symbol, as evaluated at top level.
     */
    public Object resolve(String symbol) {
        return resolveSymbol(Form.symbol(symbol), Environment.EMPTY);
    }

    public Var define(String namespaceName, String name, Object value) {
        Var var = namespace(namespaceName).intern(name);
        var.bindRoot(value);
        return var;
    }

    /**
     * The namespace of that name, created if missing.
     */
    public Namespace namespace(String name) {
        return namespaces.computeIfAbsent(name, Namespace::new);
    }

    public Optional<Namespace> findNamespace(String name) {
        return Optional.ofNullable(namespaces.get(name));
    }

    public Namespace inNamespace(String name) {
        currentNamespace = namespace(name);
        LOG.debug("Switched to namespace {}", name);
        return currentNamespace;
    }

    public Namespace getCurrentNamespace() {
        return currentNamespace;
    }

    public void importClass(Class<?> type) {
        imports.put(type.getSimpleName(), type);
    }

    public Normalizer getNormalizer() {
        return normalizer;
    }

    public ClassLoader getClassLoader() {
        return classLoader;
    }

    public PrintStream getOut() {
        return out;
    }

    public void setOut(PrintStream out) {
        this.out = out;
    }

    private static List<Form> bindingVector(Form.ListForm form) {
        if (form.size() < 2 || !(form.get(1) instanceof Form.VectorForm vector)) {
            throw new EvaluatorException(form.get(0) + " requires a vector for its binding");
        }
        List<Form> bindings = vector.elements();
        if (bindings.size() % 2 != 0) {
            throw new EvaluatorException(form.get(0) + " requires an even number of forms in binding vector");
        }
        return bindings;
    }

    private static String bindingName(Form form, Form.ListForm enclosing) {
        if (!(form instanceof Form.Symbol symbol) || symbol.isQualified()) {
            throw new EvaluatorException("Unsupported binding form " + FormPrinter.print(form) + " in "
                                         + FormPrinter.print(enclosing));
        }
        return symbol.name();
    }

    private static Form.Symbol symbolAt(Form.ListForm form, int index) {
        if (!(form.get(index) instanceof Form.Symbol symbol)) {
            throw new EvaluatorException("Expected a symbol at position " + index + " of " + FormPrinter.print(form));
        }
        return symbol;
    }

    private static void requireSize(Form.ListForm form, int min, int max) {
        if (form.size() < min || form.size() > max) {
            throw new EvaluatorException("Wrong number of forms in " + FormPrinter.print(form));
        }
    }
}
