package org.formcov.ast.visitor;

import org.formcov.ast.Form;

/**
 * A {@link FormVisitor} where every visit method routes to {@link #defaultAction(Form, Object)}.
 * Subclasses override only the kinds they care about.
 */
public abstract class FormVisitorWithDefaults<R, A> implements FormVisitor<R, A> {

    public abstract R defaultAction(Form n, A arg);

    @Override
    public R visit(Form.Symbol n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.Keyword n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.Str n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.Char n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.Num n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.Bool n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.Nil n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.ListForm n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.VectorForm n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.MapForm n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Form.SetForm n, A arg) {
        return defaultAction(n, arg);
    }
}
