package io.cortexr.sandbox;

/**
 * A named object exposed to plan code whose attributes are functions or constants,
 * such as {@code json}, {@code re} or the {@code mcp} tool proxy.
 */
interface PlanModule {

    String name();

    /**
     * Resolves {@code module.attribute}.
     *
     * @throws PlanExecutionException if the module has no such attribute
     */
    Object attribute(String attribute);
}
