/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.formcov.normalize;

import org.formcov.FormWrapException;
import org.formcov.ast.Form;
import org.formcov.printer.FormPrinter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * The built-in desugaring table.
 */
public final class CoreExpansions {

    /**
     * An expansion selected by the shape of the head symbol rather than its exact name.
     */
    public record SymbolPattern(String description, Predicate<Form.Symbol> matches, Expansion expansion) {}

    private static final Map<String, Expansion> TABLE = Map.ofEntries(
            rule("let", (f, n) -> renameHead(f, "let*")),
            rule("loop", (f, n) -> renameHead(f, "loop*")),
            rule("defn", CoreExpansions::defn),
            rule("defn-", CoreExpansions::defn),
            rule("deftest", CoreExpansions::deftest),
            rule("when", CoreExpansions::when),
            rule("when-not", CoreExpansions::whenNot),
            rule("if-not", CoreExpansions::ifNot),
            rule("cond", CoreExpansions::cond),
            rule("and", CoreExpansions::and),
            rule("or", CoreExpansions::or),
            rule("->", (f, n) -> thread(f, true)),
            rule("->>", (f, n) -> thread(f, false)),
            rule("comment", (f, n) -> Form.nil()),
            rule("dotimes", CoreExpansions::dotimes),
            rule("while", CoreExpansions::whileLoop),
            rule("when-let", CoreExpansions::whenLet),
            rule("if-let", CoreExpansions::ifLet),
            rule("ns", CoreExpansions::ns),
            rule("import", CoreExpansions::importClasses)
    );

    private static final List<SymbolPattern> PATTERNS = List.of(
            new SymbolPattern("(.member target args*)", CoreExpansions::isMemberSugar, CoreExpansions::memberCall),
            new SymbolPattern("(Class. args*)", CoreExpansions::isConstructorSugar, CoreExpansions::constructorCall),
            new SymbolPattern("(Class/member args*)", CoreExpansions::isStaticSugar, CoreExpansions::staticCall)
    );

    private CoreExpansions() {}

    private static Map.Entry<String, Expansion> rule(String head, Expansion expansion) {
        return Map.entry(head, expansion);
    }

    public static Map<String, Expansion> table() {
        return TABLE;
    }

    public static List<SymbolPattern> patterns() {
        return PATTERNS;
    }

    /**
     * Whether a qualified symbol names a host class member, e.g. {@code Math/abs} or
     * {@code java.lang.Integer/parseInt}: the last namespace segment starts with an upper-case letter.
     */
    public static boolean isClassQualified(Form.Symbol symbol) {
        if (!symbol.isQualified()) {
            return false;
        }
        String ns = symbol.namespace();
        String last = ns.substring(ns.lastIndexOf('.') + 1);
        return !last.isEmpty() && Character.isUpperCase(last.charAt(0));
    }

    private static Form renameHead(Form.ListForm form, String head) {
        List<Form> elements = new ArrayList<>(form.elements());
        elements.set(0, Form.symbol(head));
        return Form.list(elements);
    }

    // (defn name doc? attrs? [params] body*) or (defn name doc? attrs? ([params] body*)+)
    private static Form defn(Form.ListForm form, Normalizer normalizer) {
        if (form.size() < 3 || !(form.get(1) instanceof Form.Symbol name)) {
            throw malformed("defn needs a name and at least one overload", form);
        }
        int index = 2;
        if (index < form.size() && form.get(index) instanceof Form.Str) {
            index++;
        }
        if (index < form.size() && form.get(index) instanceof Form.MapForm) {
            index++;
        }
        if (index >= form.size()) {
            throw malformed("defn has no parameter vector", form);
        }
        List<Form> fn = new ArrayList<>();
        fn.add(Form.symbol("fn"));
        fn.add(name);
        fn.addAll(form.drop(index));
        return Form.list(Form.symbol("def"), name, Form.list(fn));
    }

    private static Form deftest(Form.ListForm form, Normalizer normalizer) {
        if (form.size() < 2 || !(form.get(1) instanceof Form.Symbol)) {
            throw malformed("deftest needs a name", form);
        }
        List<Form> fn = new ArrayList<>();
        fn.add(Form.symbol("fn"));
        fn.add(form.get(1));
        fn.add(Form.vector());
        fn.addAll(form.drop(2));
        return Form.list(Form.symbol("def"), form.get(1), Form.list(fn));
    }

    private static Form when(Form.ListForm form, Normalizer normalizer) {
        requireArgs(form, 1);
        return Form.list(Form.symbol("if"), form.get(1), doBlock(form.drop(2)));
    }

    private static Form whenNot(Form.ListForm form, Normalizer normalizer) {
        requireArgs(form, 1);
        return Form.list(Form.symbol("if"), form.get(1), Form.nil(), doBlock(form.drop(2)));
    }

    private static Form ifNot(Form.ListForm form, Normalizer normalizer) {
        if (form.size() < 3 || form.size() > 4) {
            throw malformed("if-not takes a test, a then branch and an optional else branch", form);
        }
        Form otherwise = form.size() == 4 ? form.get(3) : Form.nil();
        return Form.list(Form.symbol("if"), form.get(1), otherwise, form.get(2));
    }

    private static Form cond(Form.ListForm form, Normalizer normalizer) {
        List<Form> clauses = form.drop(1);
        if (clauses.size() % 2 != 0) {
            throw malformed("cond requires an even number of forms", form);
        }
        if (clauses.isEmpty()) {
            return Form.nil();
        }
        List<Form> rest = new ArrayList<>();
        rest.add(Form.symbol("cond"));
        rest.addAll(clauses.subList(2, clauses.size()));
        return Form.list(Form.symbol("if"), clauses.get(0), clauses.get(1), Form.list(rest));
    }

    private static Form and(Form.ListForm form, Normalizer normalizer) {
        if (form.size() == 1) {
            return Form.bool(true);
        }
        if (form.size() == 2) {
            return form.get(1);
        }
        Form.Symbol temp = normalizer.gensym("and");
        return Form.list(Form.symbol("let*"), Form.vector(temp, form.get(1)),
                         Form.list(Form.symbol("if"), temp, continueWith("and", form), temp));
    }

    private static Form or(Form.ListForm form, Normalizer normalizer) {
        if (form.size() == 1) {
            return Form.nil();
        }
        if (form.size() == 2) {
            return form.get(1);
        }
        Form.Symbol temp = normalizer.gensym("or");
        return Form.list(Form.symbol("let*"), Form.vector(temp, form.get(1)),
                         Form.list(Form.symbol("if"), temp, temp, continueWith("or", form)));
    }

    private static Form continueWith(String head, Form.ListForm form) {
        List<Form> rest = new ArrayList<>();
        rest.add(Form.symbol(head));
        rest.addAll(form.drop(2));
        return Form.list(rest);
    }

    private static Form thread(Form.ListForm form, boolean first) {
        requireArgs(form, 1);
        Form result = form.get(1);
        for (Form step : form.drop(2)) {
            List<Form> call = new ArrayList<>();
            if (step instanceof Form.ListForm stepList && !stepList.isEmpty()) {
                call.add(stepList.get(0));
                if (first) {
                    call.add(result);
                    call.addAll(stepList.drop(1));
                } else {
                    call.addAll(stepList.drop(1));
                    call.add(result);
                }
            } else {
                call.add(step);
                call.add(result);
            }
            result = Form.list(call);
        }
        return result;
    }

    // (dotimes [i n] body*)
    private static Form dotimes(Form.ListForm form, Normalizer normalizer) {
        Form.VectorForm binding = bindingPair(form, "dotimes");
        Form.Symbol limit = normalizer.gensym("limit");
        Form index = binding.get(0);
        List<Form> body = new ArrayList<>();
        body.add(Form.symbol("do"));
        body.addAll(form.drop(2));
        body.add(Form.list(Form.symbol("recur"), Form.list(Form.symbol("inc"), index)));
        return Form.list(Form.symbol("let*"), Form.vector(limit, binding.get(1)),
                         Form.list(Form.symbol("loop*"), Form.vector(index, Form.number(0)),
                                   Form.list(Form.symbol("if"),
                                             Form.list(Form.symbol("<"), index, limit),
                                             Form.list(body),
                                             Form.nil())));
    }

    private static Form whileLoop(Form.ListForm form, Normalizer normalizer) {
        requireArgs(form, 1);
        List<Form> body = new ArrayList<>();
        body.add(Form.symbol("do"));
        body.addAll(form.drop(2));
        body.add(Form.list(Form.symbol("recur")));
        return Form.list(Form.symbol("loop*"), Form.vector(),
                         Form.list(Form.symbol("if"), form.get(1), Form.list(body), Form.nil()));
    }

    private static Form whenLet(Form.ListForm form, Normalizer normalizer) {
        Form.VectorForm binding = bindingPair(form, "when-let");
        Form.Symbol temp = normalizer.gensym("temp");
        List<Form> inner = new ArrayList<>();
        inner.add(Form.symbol("let*"));
        inner.add(Form.vector(binding.get(0), temp));
        inner.addAll(form.drop(2));
        return Form.list(Form.symbol("let*"), Form.vector(temp, binding.get(1)),
                         Form.list(Form.symbol("if"), temp, Form.list(inner), Form.nil()));
    }

    private static Form ifLet(Form.ListForm form, Normalizer normalizer) {
        Form.VectorForm binding = bindingPair(form, "if-let");
        if (form.size() < 3 || form.size() > 4) {
            throw malformed("if-let takes a binding, a then branch and an optional else branch", form);
        }
        Form.Symbol temp = normalizer.gensym("temp");
        Form otherwise = form.size() == 4 ? form.get(3) : Form.nil();
        return Form.list(Form.symbol("let*"), Form.vector(temp, binding.get(1)),
                         Form.list(Form.symbol("if"), temp,
                                   Form.list(Form.symbol("let*"), Form.vector(binding.get(0), temp), form.get(2)),
                                   otherwise));
    }

    // (ns name doc? (:import ...)*); other clauses need module loading and are dropped
    private static Form ns(Form.ListForm form, Normalizer normalizer) {
        if (form.size() < 2 || !(form.get(1) instanceof Form.Symbol)) {
            throw malformed("ns needs a name", form);
        }
        List<Form> block = new ArrayList<>();
        block.add(Form.symbol("do"));
        block.add(Form.list(Form.symbol("in-ns"), Form.list(Form.symbol("quote"), form.get(1))));
        for (Form clause : form.drop(2)) {
            if (clause instanceof Form.ListForm list && list.head().filter(Form.keyword("import")::equals).isPresent()) {
                for (Form spec : list.drop(1)) {
                    addImports(spec, block, form);
                }
            }
        }
        return Form.list(block);
    }

    // (import 'java.util.Date '(java.util List Map))
    private static Form importClasses(Form.ListForm form, Normalizer normalizer) {
        List<Form> block = new ArrayList<>();
        block.add(Form.symbol("do"));
        for (Form spec : form.drop(1)) {
            Form unquoted = spec;
            if (spec instanceof Form.ListForm quoted && quoted.size() == 2
                && quoted.headSymbol().filter(s -> s.fullName().equals("quote")).isPresent()) {
                unquoted = quoted.get(1);
            }
            addImports(unquoted, block, form);
        }
        return Form.list(block);
    }

    private static void addImports(Form spec, List<Form> block, Form.ListForm enclosing) {
        if (spec instanceof Form.Symbol symbol) {
            block.add(Form.list(Form.symbol("import*"), Form.string(symbol.fullName())));
            return;
        }
        List<Form> parts;
        if (spec instanceof Form.ListForm list) {
            parts = list.elements();
        } else if (spec instanceof Form.VectorForm vector) {
            parts = vector.elements();
        } else {
            throw malformed("Unsupported import spec " + FormPrinter.print(spec), enclosing);
        }
        if (parts.isEmpty() || !(parts.get(0) instanceof Form.Symbol packageName)) {
            throw malformed("Import spec must start with a package name", enclosing);
        }
        String pkg = packageName.fullName();
        for (Form className : parts.subList(1, parts.size())) {
            if (!(className instanceof Form.Symbol classSymbol)) {
                throw malformed("Imported class names must be symbols", enclosing);
            }
            block.add(Form.list(Form.symbol("import*"), Form.string(pkg + "." + classSymbol.fullName())));
        }
    }

    private static boolean isMemberSugar(Form.Symbol head) {
        String name = head.name();
        return !head.isQualified() && name.length() > 1 && name.charAt(0) == '.' && !name.equals("..");
    }

    private static boolean isConstructorSugar(Form.Symbol head) {
        String name = head.fullName();
        return name.length() > 1 && name.endsWith(".") && !name.equals("..") && !name.startsWith(".");
    }

    private static boolean isStaticSugar(Form.Symbol head) {
        return isClassQualified(head);
    }

    private static Form memberCall(Form.ListForm form, Normalizer normalizer) {
        if (form.size() < 2) {
            throw malformed("Member call needs a target", form);
        }
        Form.Symbol head = (Form.Symbol) form.get(0);
        List<Form> call = new ArrayList<>();
        call.add(Form.symbol("."));
        call.add(form.get(1));
        call.add(Form.symbol(head.name().substring(1)));
        call.addAll(form.drop(2));
        return Form.list(call);
    }

    private static Form constructorCall(Form.ListForm form, Normalizer normalizer) {
        String name = ((Form.Symbol) form.get(0)).fullName();
        List<Form> call = new ArrayList<>();
        call.add(Form.symbol("new"));
        call.add(Form.symbol(name.substring(0, name.length() - 1)));
        call.addAll(form.drop(1));
        return Form.list(call);
    }

    private static Form staticCall(Form.ListForm form, Normalizer normalizer) {
        Form.Symbol head = (Form.Symbol) form.get(0);
        List<Form> call = new ArrayList<>();
        call.add(Form.symbol("."));
        call.add(Form.symbol(head.namespace()));
        call.add(Form.symbol(head.name()));
        call.addAll(form.drop(1));
        return Form.list(call);
    }

    private static Form doBlock(List<Form> body) {
        List<Form> block = new ArrayList<>();
        block.add(Form.symbol("do"));
        block.addAll(body);
        return Form.list(block);
    }

    private static Form.VectorForm bindingPair(Form.ListForm form, String name) {
        if (form.size() < 2 || !(form.get(1) instanceof Form.VectorForm binding) || binding.size() != 2) {
            throw malformed(name + " requires a vector with exactly one binding", form);
        }
        return binding;
    }

    private static void requireArgs(Form.ListForm form, int count) {
        if (form.size() < count + 1) {
            throw malformed(form.headSymbol().map(Form.Symbol::fullName).orElse("form")
                            + " needs at least " + count + " argument(s)", form);
        }
    }

    private static FormWrapException malformed(String message, Form.ListForm form) {
        return new FormWrapException(message, FormPrinter.print(form), null);
    }
}
