package org.formcov.eval;

import org.formcov.ast.Form;
import org.formcov.ast.visitor.FormVisitor;
import org.formcov.printer.FormPrinter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runtime representation of values and the operations every part of the interpreter shares.
 * <p>
 * {@code nil} is {@code null}; lists and vectors are unmodifiable {@link List}s; maps and sets keep insertion
 * order; symbols and keywords are the {@link Form.Symbol} and {@link Form.Keyword} records themselves; integers
 * are {@link Long}s.
 */
public final class Values {

    private static final FormVisitor<Object, Void> DATA = new FormVisitor<>() {

        @Override
        public Object visit(Form.Symbol n, Void arg) {
            return n;
        }

        @Override
        public Object visit(Form.Keyword n, Void arg) {
            return n;
        }

        @Override
        public Object visit(Form.Str n, Void arg) {
            return n.value();
        }

        @Override
        public Object visit(Form.Char n, Void arg) {
            return n.value();
        }

        @Override
        public Object visit(Form.Num n, Void arg) {
            return n.value();
        }

        @Override
        public Object visit(Form.Bool n, Void arg) {
            return n.value();
        }

        @Override
        public Object visit(Form.Nil n, Void arg) {
            return null;
        }

        @Override
        public Object visit(Form.ListForm n, Void arg) {
            return list(convertAll(n.elements()));
        }

        @Override
        public Object visit(Form.VectorForm n, Void arg) {
            return list(convertAll(n.elements()));
        }

        @Override
        public Object visit(Form.MapForm n, Void arg) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (Form.MapForm.Entry entry : n.entries()) {
                map.put(entry.key().accept(this, null), entry.value().accept(this, null));
            }
            return Collections.unmodifiableMap(map);
        }

        @Override
        public Object visit(Form.SetForm n, Void arg) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(convertAll(n.elements())));
        }

        private List<Object> convertAll(List<Form> forms) {
            List<Object> values = new ArrayList<>(forms.size());
            for (Form form : forms) {
                values.add(form.accept(this, null));
            }
            return values;
        }
    };

    private Values() {}

    /**
     * The value a quoted form denotes.
     */
    public static Object fromForm(Form form) {
        return form.accept(DATA, null);
    }

    public static List<Object> list(Collection<?> elements) {
        return Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static boolean isTruthy(Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    /**
     * Equality as {@code =} sees it: numbers compare by value within their kind, collections element-wise.
     */
    public static boolean equiv(Object a, Object b) {
        if (a instanceof Number m && b instanceof Number n) {
            return Numbers.equiv(m, n);
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) {
                return false;
            }
            for (int i = 0; i < x.size(); i++) {
                if (!equiv(x.get(i), y.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /**
     * Any sequential view of a value: collections, maps as key/value pairs, strings as characters.
     */
    public static List<Object> seq(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) value;
            return list;
        }
        if (value instanceof Collection<?> collection) {
            return list(collection);
        }
        if (value instanceof Map<?, ?> map) {
            List<Object> entries = new ArrayList<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.add(list(Arrays.asList(entry.getKey(), entry.getValue())));
            }
            return Collections.unmodifiableList(entries);
        }
        if (value instanceof CharSequence text) {
            List<Object> chars = new ArrayList<>();
            for (int i = 0; i < text.length(); i++) {
                chars.add(text.charAt(i));
            }
            return Collections.unmodifiableList(chars);
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> elements = new ArrayList<>();
            for (Iterator<?> it = iterable.iterator(); it.hasNext(); ) {
                elements.add(it.next());
            }
            return Collections.unmodifiableList(elements);
        }
        throw new EvaluatorException("Don't know how to create a sequence from " + typeName(value));
    }

    /**
     * Call a value in function position.
     */
    public static Object invoke(Object fn, List<Object> args) {
        if (fn instanceof Invokable invokable) {
            return invokable.invoke(args);
        }
        if (fn instanceof Form.Keyword || fn instanceof Map || fn instanceof Set) {
            if (args.isEmpty() || args.size() > 2) {
                throw new EvaluatorException("Wrong number of args (" + args.size() + ") passed to " + print(fn, true));
            }
            Object fallback = args.size() == 2 ? args.get(1) : null;
            if (fn instanceof Form.Keyword) {
                return lookup(args.get(0), fn, fallback);
            }
            return lookup(fn, args.get(0), fallback);
        }
        if (fn instanceof List) {
            if (args.size() != 1 || !(args.get(0) instanceof Number index)) {
                throw new EvaluatorException("A vector called as a function takes one index");
            }
            return nth(fn, Numbers.toIndex(index));
        }
        throw new EvaluatorException(typeName(fn) + " cannot be called as a function");
    }

    /**
     * Keyed lookup on maps, sets and (by index) lists. Anything else yields the fallback.
     */
    public static Object lookup(Object coll, Object key, Object fallback) {
        if (coll instanceof Map<?, ?> map) {
            return map.containsKey(key) ? map.get(key) : fallback;
        }
        if (coll instanceof Set<?> set) {
            return set.contains(key) ? key : fallback;
        }
        if (coll instanceof List<?> list && key instanceof Number number) {
            long index = Numbers.toIndex(number);
            return index >= 0 && index < list.size() ? list.get((int) index) : fallback;
        }
        return fallback;
    }

    public static Object nth(Object coll, long index) {
        List<Object> elements = seq(coll);
        if (index < 0 || index >= elements.size()) {
            throw new EvaluatorException("Index " + index + " out of bounds for length " + elements.size());
        }
        return elements.get((int) index);
    }

    public static String typeName(Object value) {
        return value == null ? "nil" : value.getClass().getName();
    }

    /**
     * Integer-like host results become {@link Long} and floats become {@link Double}, so host values compare
     * equal to literals.
     */
    public static Object fromHost(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    /**
     * Render a value. Readable output quotes strings and characters the way the reader expects them.
     */
    public static String print(Object value, boolean readably) {
        StringBuilder sb = new StringBuilder();
        print(value, readably, sb);
        return sb.toString();
    }

    /**
     * What {@code str} makes of a value: {@code nil} is empty, everything else prints non-readably.
     */
    public static String str(Object value) {
        return value == null ? "" : print(value, false);
    }

    private static void print(Object value, boolean readably, StringBuilder sb) {
        if (value == null) {
            sb.append("nil");
        } else if (value instanceof String text) {
            sb.append(readably ? FormPrinter.print(Form.string(text)) : text);
        } else if (value instanceof Character c) {
            sb.append(readably ? FormPrinter.print(new Form.Char(c)) : c);
        } else if (value instanceof List<?> list) {
            printAll(list, "[", "]", readably, sb);
        } else if (value instanceof Set<?> set) {
            printAll(set, "#{", "}", readably, sb);
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                print(entry.getKey(), readably, sb);
                sb.append(' ');
                print(entry.getValue(), readably, sb);
            }
            sb.append('}');
        } else if (value instanceof Class<?> type) {
            sb.append(type.getName());
        } else {
            sb.append(value);
        }
    }

    private static void printAll(Collection<?> values, String open, String close, boolean readably, StringBuilder sb) {
        sb.append(open);
        boolean first = true;
        for (Object element : values) {
            if (!first) {
                sb.append(' ');
            }
            first = false;
            print(element, readably, sb);
        }
        sb.append(close);
    }
}
