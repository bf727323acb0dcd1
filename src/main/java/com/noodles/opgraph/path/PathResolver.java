package com.noodles.opgraph.path;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Pure functions over operator paths and handle identifiers.
 *
 * <p>
 * Operator paths are POSIX-style absolute paths ({@code /container/op}). The
 * path tree is purely lexical: {@code .} and {@code ..} are resolved against
 * the path's own segments, never against a filesystem, and {@code ..} above
 * the root is clamped to the root.
 *
 * <p>
 * Methods that cannot produce an answer return {@code null} rather than
 * throwing; callers decide whether a failed resolution matters.
 */
public final class PathResolver {
    public static final String ROOT = "/";
    private static final char SEPARATOR = '/';

    private PathResolver() {
        // Utility class
    }

    /**
     * A path is valid iff it is non-empty, absolute, free of control
     * characters, has no empty segments and no trailing slash (root excepted).
     */
    public static boolean isValidPath(String path) {
        if (path == null || path.isEmpty() || path.charAt(0) != SEPARATOR)
            return false;
        for (int i = 0; i < path.length(); i++) {
            if (Character.isISOControl(path.charAt(i)))
                return false;
        }
        if (path.contains("//"))
            return false;
        return path.equals(ROOT) || path.charAt(path.length() - 1) != SEPARATOR;
    }

    public static boolean isAbsolutePath(String path) {
        return isValidPath(path);
    }

    /**
     * Collapses {@code .}, {@code ..} and empty segments. The result is always
     * absolute; {@code null} and the empty string normalize to the root.
     */
    public static String normalizePath(String path) {
        if (path == null || path.isEmpty())
            return ROOT;

        Deque<String> stack = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals("."))
                continue;
            if (segment.equals("..")) {
                // clamp at root
                stack.pollLast();
            } else {
                stack.addLast(segment);
            }
        }
        if (stack.isEmpty())
            return ROOT;

        StringBuilder sb = new StringBuilder(path.length() + 1);
        for (String segment : stack)
            sb.append(SEPARATOR).append(segment);
        return sb.toString();
    }

    /** Joins the segments with {@code /} and normalizes the result. */
    public static String joinPath(String... segments) {
        if (segments == null || segments.length == 0)
            return ROOT;
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (segment == null)
                continue;
            sb.append(SEPARATOR).append(segment);
        }
        return normalizePath(sb.toString());
    }

    /**
     * Returns the path without its final segment. The parent of the root and of
     * a single-segment path is the root.
     *
     * @return the parent path, or {@code null} for empty input or a bare name
     *         with no separator.
     */
    public static String getParentPath(String path) {
        if (path == null || path.isEmpty())
            return null;
        if (path.equals(ROOT))
            return ROOT;

        String clean = stripTrailingSeparator(path);
        int idx = clean.lastIndexOf(SEPARATOR);
        if (idx < 0)
            return null;
        if (idx == 0)
            return ROOT;
        return clean.substring(0, idx);
    }

    /** Final segment of the path; empty for the root or empty input. */
    public static String getBaseName(String path) {
        if (path == null || path.isEmpty() || path.equals(ROOT))
            return "";
        String clean = stripTrailingSeparator(path);
        return clean.substring(clean.lastIndexOf(SEPARATOR) + 1);
    }

    /**
     * Builds the path of a new operator named {@code baseName} inside
     * {@code containerId}. The container may be given without its leading
     * slash.
     */
    public static String generateQualifiedPath(String baseName, String containerId) {
        String container = (containerId == null || containerId.isEmpty()) ? ROOT : containerId;
        return normalizePath(container + SEPARATOR + baseName);
    }

    /**
     * Resolves {@code reference} as seen from the operator at
     * {@code contextPath}.
     *
     * <p>
     * Absolute references are normalized. Anything else ({@code ./x},
     * {@code ../x}, or a bare name) resolves against the context operator's
     * container, i.e. its parent path, so a bare name addresses a sibling.
     *
     * @return a valid absolute path, or {@code null} if the reference is empty
     *         or cannot be resolved.
     */
    public static String resolvePath(String reference, String contextPath) {
        if (reference == null || reference.isEmpty())
            return null;

        String resolved;
        if (reference.charAt(0) == SEPARATOR) {
            resolved = normalizePath(reference);
        } else {
            String container = getParentPath(contextPath);
            if (container == null)
                return null;
            resolved = normalizePath(container + SEPARATOR + reference);
        }
        return isValidPath(resolved) ? resolved : null;
    }

    /**
     * Parses {@code namespace.field}. Dots after the first belong to the field
     * name.
     *
     * @return the parsed handle, or {@code null} if the namespace is not
     *         {@code par}/{@code out} or the field is missing.
     */
    public static HandleId parseHandleId(String handleId) {
        if (handleId == null || handleId.isEmpty())
            return null;
        int dot = handleId.indexOf('.');
        if (dot < 0)
            return null;

        HandleNamespace namespace = HandleNamespace.fromToken(handleId.substring(0, dot));
        String fieldName = handleId.substring(dot + 1);
        if (namespace == null || fieldName.isEmpty())
            return null;
        return new HandleId(namespace, fieldName);
    }

    /** Splits a path into {@code ["/", seg1, seg2, ...]}. */
    public static List<String> splitPath(String path) {
        List<String> segments = new ArrayList<>();
        segments.add(ROOT);
        if (path == null)
            return segments;
        for (String segment : path.split("/")) {
            if (!segment.isEmpty())
                segments.add(segment);
        }
        return segments;
    }

    /**
     * True if {@code child}'s parent is {@code container}. Root-level operators
     * are not children of any container, including {@code /}.
     */
    public static boolean isDirectChild(String child, String container) {
        if (child == null || child.isEmpty() || container == null || container.isEmpty())
            return false;
        String parent = getParentPath(child);
        if (parent == null || parent.equals(ROOT))
            return false;
        return parent.equals(container);
    }

    /** True if {@code path} lies anywhere below {@code container}. */
    public static boolean isWithinContainer(String path, String container) {
        if (path == null || path.isEmpty() || container == null || container.isEmpty())
            return false;
        return path.startsWith(container + SEPARATOR);
    }

    private static String stripTrailingSeparator(String path) {
        return path.length() > 1 && path.charAt(path.length() - 1) == SEPARATOR
                ? path.substring(0, path.length() - 1)
                : path;
    }
}
