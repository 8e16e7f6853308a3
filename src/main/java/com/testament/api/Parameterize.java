package com.testament.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs a test once per parameter tuple.
 * <p>
 * {@link #value()} names a method on the same class (static or instance, no arguments)
 * returning a {@code List}, an {@code Object[][]} or an {@code Object[]}. Each element is
 * one tuple: an {@code Object[]} is spread over the test's parameters, anything else is
 * passed as a single argument.
 * <p>
 * Selectors can restrict the tuples with slice syntax: {@code testAdd[0]},
 * {@code testAdd[1:3]}, {@code testAdd[::2]}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Parameterize {

    String value();

    /**
     * When true, the first element of every tuple is a label used in the sub-result name
     * and is not passed to the test.
     */
    boolean firstArgIsName() default false;
}
