package com.testament.core.model;

import java.lang.reflect.Method;

/**
 * A setup or teardown method bound to the instance it runs on.
 *
 * @param method the fixture method
 * @param target receiver, or {@code null} for a static method
 */
public record Fixture(Method method, Object target) {

    public String name() {
        return method.getName();
    }

    @Override
    public String toString() {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }
}
