package io.cortexr.sandbox;

import java.util.List;
import java.util.Map;

/**
 * A function that plan code can call.
 */
@FunctionalInterface
interface PlanCallable {

    Object call(List<Object> args, Map<String, Object> kwargs);
}
