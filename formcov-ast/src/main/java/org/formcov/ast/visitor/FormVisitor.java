package org.formcov.ast.visitor;

import org.formcov.ast.Form;

/**
 * A visitor over every concrete kind of {@link Form}.
 *
 * @param <R> the return type
 * @param <A> the type of the argument passed along the traversal
 */
public interface FormVisitor<R, A> {

    R visit(Form.Symbol n, A arg);

    R visit(Form.Keyword n, A arg);

    R visit(Form.Str n, A arg);

    R visit(Form.Char n, A arg);

    R visit(Form.Num n, A arg);

    R visit(Form.Bool n, A arg);

    R visit(Form.Nil n, A arg);

    R visit(Form.ListForm n, A arg);

    R visit(Form.VectorForm n, A arg);

    R visit(Form.MapForm n, A arg);

    R visit(Form.SetForm n, A arg);
}
