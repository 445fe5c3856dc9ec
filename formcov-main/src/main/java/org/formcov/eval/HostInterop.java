package org.formcov.eval;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reflective access to host classes: constructors, static and instance methods, and public fields.
 * <p>
 * Overloads are chosen by arity first, then by how many arguments need a numeric conversion. Integral arguments
 * arrive as {@link Long} and are narrowed to {@code int}, {@code short} or {@code byte} when they fit.
 */
public final class HostInterop {

    private static final Object NO_MATCH = new Object();

    // Primitive type → boxed type
    private static final Map<Class<?>, Class<?>> BOXING_TYPES = Map.of(
        int.class, Integer.class,
        long.class, Long.class,
        double.class, Double.class,
        float.class, Float.class,
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        char.class, Character.class,
        short.class, Short.class
    );

    private HostInterop() {}

    /**
     * Resolve a class name: explicit imports first, then {@code java.lang}, then the fully qualified name.
     */
    public static Optional<Class<?>> resolveClass(String name, Map<String, Class<?>> imports, ClassLoader loader) {
        Class<?> imported = imports.get(name);
        if (imported != null) {
            return Optional.of(imported);
        }
        if (name.indexOf('.') < 0) {
            return loadClass("java.lang." + name, loader);
        }
        return loadClass(name, loader);
    }

    public static Optional<Class<?>> loadClass(String name, ClassLoader loader) {
        if (name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0))) {
            return Optional.empty();
        }
        try {
            return Optional.of(Class.forName(name, false, loader));
        } catch (ClassNotFoundException | LinkageError e) {
            return Optional.empty();
        }
    }

    public static Object construct(Class<?> type, List<Object> args) {
        Constructor<?> best = null;
        Object[] bestArgs = null;
        int bestScore = Integer.MAX_VALUE;
        for (Constructor<?> constructor : type.getConstructors()) {
            Object[] converted = convertArguments(constructor, args);
            if (converted != null) {
                int score = score(constructor, args);
                if (score < bestScore) {
                    best = constructor;
                    bestArgs = converted;
                    bestScore = score;
                }
            }
        }
        if (best == null) {
            throw new EvaluatorException("No matching constructor for " + type.getName() + " taking " + args.size() + " argument(s)");
        }
        try {
            return Values.fromHost(best.newInstance(bestArgs));
        } catch (InvocationTargetException e) {
            throw ThrownException.propagate(e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new EvaluatorException("Unable to construct " + type.getName(), e);
        }
    }

    /**
     * Call a static method, or read a static field when no method of that name takes no arguments.
     */
    public static Object invokeStatic(Class<?> type, String member, List<Object> args) {
        Optional<Method> method = findMethod(type, member, args, true);
        if (method.isPresent()) {
            return invoke(method.get(), null, args);
        }
        if (args.isEmpty()) {
            Optional<Field> field = findField(type, fieldName(member), true);
            if (field.isPresent()) {
                return readField(field.get(), null);
            }
        }
        throw new EvaluatorException("No matching method " + member + " found taking " + args.size()
                                     + " argument(s) for class " + type.getName());
    }

    public static Object getStaticField(Class<?> type, String name) {
        return findField(type, name, true)
                .map(field -> readField(field, null))
                .orElseThrow(() -> new EvaluatorException("Unable to find static field: " + name + " in " + type.getName()));
    }

    public static boolean hasStaticField(Class<?> type, String name) {
        return findField(type, name, true).isPresent();
    }

    /**
     * Call an instance method, or read a public field when the member is named {@code -field} or no method
     * matches.
     */
    public static Object invokeInstance(Object target, String member, List<Object> args) {
        if (target == null) {
            throw new EvaluatorException("Cannot invoke " + member + " on nil");
        }
        Class<?> type = target.getClass();
        if (!member.startsWith("-")) {
            Optional<Method> method = findMethod(type, member, args, false);
            if (method.isPresent()) {
                return invoke(method.get(), target, args);
            }
        }
        if (args.isEmpty()) {
            Optional<Field> field = findField(type, fieldName(member), false);
            if (field.isPresent()) {
                return readField(field.get(), target);
            }
        }
        throw new EvaluatorException("No matching method " + member + " found taking " + args.size()
                                     + " argument(s) for class " + type.getName());
    }

    private static String fieldName(String member) {
        return member.startsWith("-") ? member.substring(1) : member;
    }

    private static Optional<Method> findMethod(Class<?> type, String name, List<Object> args, boolean isStatic) {
        Method best = null;
        int bestScore = Integer.MAX_VALUE;
        for (Method method : type.getMethods()) {
            if (!method.getName().equals(name) || Modifier.isStatic(method.getModifiers()) != isStatic) {
                continue;
            }
            if (convertArguments(method, args) == null) {
                continue;
            }
            int score = score(method, args);
            if (score < bestScore) {
                best = method;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best).map(HostInterop::accessible);
    }

    // Methods declared by non-public classes (e.g. collection views) are called through a public supertype.
    private static Method accessible(Method method) {
        if (Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
            return method;
        }
        List<Class<?>> supertypes = new ArrayList<>();
        collectSupertypes(method.getDeclaringClass(), supertypes);
        for (Class<?> supertype : supertypes) {
            if (!Modifier.isPublic(supertype.getModifiers())) {
                continue;
            }
            for (Method candidate : supertype.getMethods()) {
                if (candidate.getName().equals(method.getName())
                    && Arrays.equals(candidate.getParameterTypes(), method.getParameterTypes())) {
                    return candidate;
                }
            }
        }
        return method;
    }

    private static void collectSupertypes(Class<?> type, List<Class<?>> out) {
        for (Class<?> iface : type.getInterfaces()) {
            out.add(iface);
            collectSupertypes(iface, out);
        }
        if (type.getSuperclass() != null) {
            out.add(type.getSuperclass());
            collectSupertypes(type.getSuperclass(), out);
        }
    }

    private static Optional<Field> findField(Class<?> type, String name, boolean isStatic) {
        try {
            Field field = type.getField(name);
            return Modifier.isStatic(field.getModifiers()) == isStatic ? Optional.of(field) : Optional.empty();
        } catch (NoSuchFieldException e) {
            return Optional.empty();
        }
    }

    private static Object readField(Field field, Object target) {
        try {
            return Values.fromHost(field.get(target));
        } catch (IllegalAccessException e) {
            throw new EvaluatorException("Unable to read field " + field.getName(), e);
        }
    }

    private static Object invoke(Method method, Object target, List<Object> args) {
        try {
            return Values.fromHost(method.invoke(target, convertArguments(method, args)));
        } catch (InvocationTargetException e) {
            throw ThrownException.propagate(e.getCause());
        } catch (IllegalAccessException e) {
            throw new EvaluatorException("Unable to call " + method, e);
        }
    }

    private static Object[] convertArguments(Executable executable, List<Object> args) {
        Class<?>[] parameterTypes = executable.getParameterTypes();
        if (parameterTypes.length != args.size()) {
            return null;
        }
        Object[] converted = new Object[args.size()];
        for (int i = 0; i < parameterTypes.length; i++) {
            Object value = convert(args.get(i), parameterTypes[i]);
            if (value == NO_MATCH) {
                return null;
            }
            converted[i] = value;
        }
        return converted;
    }

    // Number of arguments that are not already instances of their parameter type.
    private static int score(Executable executable, List<Object> args) {
        Class<?>[] parameterTypes = executable.getParameterTypes();
        int score = 0;
        for (int i = 0; i < parameterTypes.length; i++) {
            Class<?> boxed = parameterTypes[i].isPrimitive() ? BOXING_TYPES.get(parameterTypes[i]) : parameterTypes[i];
            Object arg = args.get(i);
            if (arg == null || !boxed.isInstance(arg)) {
                score++;
            }
            if (boxed == Object.class) {
                score++;
            }
        }
        return score;
    }

    private static Object convert(Object value, Class<?> type) {
        if (value == null) {
            return type.isPrimitive() ? NO_MATCH : null;
        }
        Class<?> boxed = type.isPrimitive() ? BOXING_TYPES.get(type) : type;
        if (boxed.isInstance(value)) {
            return value;
        }
        if (!(value instanceof Number number)) {
            return NO_MATCH;
        }
        boolean integral = Numbers.isIntegral(number);
        long asLong = number.longValue();
        if (boxed == Integer.class) {
            return integral && asLong == (int) asLong ? (Object) (int) asLong : NO_MATCH;
        }
        if (boxed == Long.class) {
            return integral ? (Object) asLong : NO_MATCH;
        }
        if (boxed == Short.class) {
            return integral && asLong == (short) asLong ? (Object) (short) asLong : NO_MATCH;
        }
        if (boxed == Byte.class) {
            return integral && asLong == (byte) asLong ? (Object) (byte) asLong : NO_MATCH;
        }
        if (boxed == Double.class) {
            return number.doubleValue();
        }
        if (boxed == Float.class) {
            return number.floatValue();
        }
        return NO_MATCH;
    }
}
