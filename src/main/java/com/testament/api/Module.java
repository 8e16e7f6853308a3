package com.testament.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a class as a test module.
 * <p>
 * Every class holding {@code test*} methods must carry this annotation; a class with test
 * methods but no run mode is reported as a failed import.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Module {

    RunMode runMode();

    /** Module-level tags, matched by tag selectors together with each test's own tags. */
    String[] tags() default {};

    String description() default "";
}
