package org.metaconv.compiler.api;

/**
 * No normalization or generation rule matches a construct. Recovered per expression by emitting a
 * fallback function and counting it in the coverage report.
 */
public class UnsupportedConstructException extends Exception {

    public UnsupportedConstructException(String message) {
        super(message);
    }
}
