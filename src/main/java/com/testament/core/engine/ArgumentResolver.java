package com.testament.core.engine;

import com.testament.core.scope.Scope;
import org.slf4j.Logger;

import java.lang.reflect.Method;
import java.util.List;

/**
 * Builds the argument list of a test or fixture call. A {@link Logger} parameter gets the
 * unit's logger and a {@link Scope} parameter gets the scope frame. A reference parameter
 * matching one of the driver-supplied objects gets that object; every other parameter
 * takes the next value of the parameter tuple.
 *
 * @see TestParametersProvider
 */
final class ArgumentResolver {

    private ArgumentResolver() {}

    static Object[] resolve(Method method, Object[] tuple, Scope scope, Logger logger, List<Object> supplied) {
        Class<?>[] types = method.getParameterTypes();
        Object[] args = new Object[types.length];
        int next = 0;
        for (int i = 0; i < types.length; i++) {
            Object match = types[i].isPrimitive() ? null : suppliedOf(types[i], supplied);
            if (types[i] == Logger.class) {
                args[i] = logger;
            } else if (types[i] == Scope.class) {
                args[i] = scope;
            } else if (match != null) {
                args[i] = match;
            } else {
                if (tuple == null || next >= tuple.length) {
                    throw new IllegalArgumentException(method.getName() + " expects a value for parameter "
                            + (i + 1) + " (" + types[i].getSimpleName() + ") but the parameter set has "
                            + (tuple == null ? 0 : tuple.length) + " values");
                }
                args[i] = tuple[next++];
            }
        }
        if (tuple != null && next < tuple.length) {
            throw new IllegalArgumentException(method.getName() + " takes " + next
                    + " parameter values but the parameter set has " + tuple.length);
        }
        return args;
    }

    private static Object suppliedOf(Class<?> type, List<Object> supplied) {
        for (Object candidate : supplied) {
            if (type.isInstance(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
