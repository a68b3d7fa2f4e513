package org.metaconv.compiler.api;

/**
 * Where in the tag tables an expression is used.
 *
 * @param module The Perl module, e.g. {@code Canon}.
 * @param table The tag table within the module, e.g. {@code CameraSettings}.
 * @param tag The tag name or id.
 */
public record UsageSite(String module, String table, String tag) {
    @Override
    public String toString() {
        return module + "::" + table + "[" + tag + "]";
    }
}
