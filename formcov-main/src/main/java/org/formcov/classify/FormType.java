package org.formcov.classify;

/**
 * Category labels assigned by {@link FormClassifier}. The instrumenting wrapper dispatches on these.
 */
public enum FormType {
    /** Never descended into and never wrapped. */
    STOP,
    /** A symbol or literal: wrapped, not descended into. */
    ATOMIC,
    /** A vector or map: elements are wrapped, the container is not. */
    STRUCTURAL,
    /** {@code let*} or {@code loop*}. */
    BINDING,
    /** {@code def}. */
    DEFINITION,
    /** {@code new}. */
    CONSTRUCTOR_CALL,
    /** {@code .}, host member access. */
    MEMBER_ACCESS,
    /** {@code fn} or {@code fn*}. */
    FUNCTION,
    /** Any other list: a call, a special form or unexpanded sugar. */
    COMPOUND,
    /** Anything the classifier does not recognize. */
    DEFAULT
}
