package io.github.cyfko.sdtp.core.model;

import io.github.cyfko.sdtp.core.api.Op;

/**
 * Builds the locations reported with filter errors.
 * <p>
 * A combinator child is addressed {@code OP[i]}; segments are joined with {@code "."}; the root
 * node has the empty path. For example the value of the second child of a top-level AND is
 * {@code "AND[1].value"}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FilterPath {

    public static final String ROOT = "";

    private FilterPath() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    public static String child(String parent, Op combinator, int index) {
        return append(parent, combinator.code() + "[" + index + "]");
    }

    public static String field(String parent, String name) {
        return append(parent, name);
    }

    public static String element(String parent, String name, int index) {
        return append(parent, name + "[" + index + "]");
    }

    /**
     * Path reported for an error on a node as a whole. The root node is named after its operator.
     *
     * @param nodePath the node path
     * @param operator the operator spelling of that node
     * @return {@code nodePath}, or {@code operator} at the root
     */
    public static String node(String nodePath, String operator) {
        return nodePath.isEmpty() ? operator : nodePath;
    }

    private static String append(String parent, String segment) {
        return parent.isEmpty() ? segment : parent + "." + segment;
    }
}
