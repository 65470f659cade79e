package com.sovereign.core.scope;

/**
 * Code executed inside an open scope by {@link TaskScope#run}; typically spawns tasks.
 */
@FunctionalInterface
public interface ScopeBody {

    void accept(TaskScope scope) throws Exception;
}
