package org.metaconv.compiler.registry;

/**
 * Two structurally different trees were assigned the same function name. Deduplication can no longer
 * be trusted, so the run is aborted.
 */
public class DuplicateNameCollisionException extends RuntimeException {

    private final String functionName;

    public DuplicateNameCollisionException(String functionName, String existingKey, String newKey) {
        super("Function name " + functionName + " already belongs to " + existingKey + ", cannot reuse it for " + newKey);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
