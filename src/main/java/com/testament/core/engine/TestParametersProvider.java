package com.testament.core.engine;

import com.testament.core.scope.Scope;
import org.slf4j.Logger;

import java.util.List;

/**
 * Supplies driver-owned objects, such as clients or connections, to every setup, test and
 * teardown call. A method parameter receives the first supplied object that is an instance
 * of its type, ahead of parameter-set values; primitive parameters only take parameter-set
 * values.
 * <p>
 * Called once per invocation with the unit's logger and the scope frame it runs in.
 */
@FunctionalInterface
public interface TestParametersProvider {

    TestParametersProvider NONE = (logger, scope) -> List.of();

    List<Object> parameters(Logger logger, Scope scope);
}
