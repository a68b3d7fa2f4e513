package org.metaconv.compiler.frontend.reader;

/**
 * The upstream AST of a single expression is malformed. Recovered per expression.
 */
public class ParseInputException extends Exception {

    public ParseInputException(String message) {
        super(message);
    }
}
