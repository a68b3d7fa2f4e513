package org.metaconv.compiler.api;

import java.util.List;

/**
 * Defines the public interface of the expression compiler.
 */
public interface IExpressionCompiler {

    /**
     * Compiles a corpus of expressions into one set of functions.
     *
     * @param records The expressions with their parsed trees.
     * @return The distinct functions, the call-site lookup table and the coverage report.
     * @throws CompilationException if the run has to be aborted because a compiler invariant broke.
     */
    CompilationResult compile(List<ExpressionRecord> records) throws CompilationException;
}
