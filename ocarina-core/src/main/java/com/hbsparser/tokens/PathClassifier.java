package com.hbsparser.tokens;

import static com.hbsparser.tokens.Classification.SKIP;

/**
 * Decides whether a path names a global invocation and, if so, normalizes it.
 *
 * <p>Rules, in order:</p>
 * <ol>
 *   <li>{@code @}-prefixed paths are caller arguments and always skipped.</li>
 *   <li>Paths whose head segment is bound by an enclosing block parameter are skipped.</li>
 *   <li>Tag names starting with a lowercase letter are plain markup and skipped; other tag
 *       names are dasherized per {@code ::} segment and joined with {@code /}.</li>
 *   <li>Curly paths are already in canonical form and returned unchanged.</li>
 * </ol>
 */
public final class PathClassifier {
    private final CollectorOptions options;

    public PathClassifier() {
        this(CollectorOptions.DEFAULT);
    }

    public PathClassifier(CollectorOptions options) {
        this.options = options;
    }

    public Classification classify(String rawPath, PathContext context, BlockScope scope) {
        if (rawPath.isEmpty() || rawPath.charAt(0) == '@') {
            return SKIP;
        }

        String head = headSegment(rawPath, context);
        if (scope.isBound(head)) {
            return SKIP;
        }

        if (context == PathContext.TAG_NAME) {
            char first = rawPath.charAt(0);
            // <:header> is a named block slot of the enclosing component
            if (Character.isLowerCase(first) || first == ':') {
                return SKIP;
            }
            return new Classification.Component(normalizeTagPath(rawPath));
        }

        if (options.ignoreThisPaths() && head.equals("this")) {
            return SKIP;
        }
        return new Classification.Invocable(rawPath);
    }

    /**
     * Portion of {@code rawPath} that a block parameter could bind: up to the first
     * {@code ::} then {@code .} for tag names, up to the first {@code .} or {@code /} otherwise.
     */
    static String headSegment(String rawPath, PathContext context) {
        String path = rawPath;
        if (context == PathContext.TAG_NAME) {
            int separator = path.indexOf("::");
            if (separator >= 0) {
                path = path.substring(0, separator);
            }
            int dot = path.indexOf('.');
            return dot >= 0 ? path.substring(0, dot) : path;
        }
        for (int i = 0; i < path.length(); i++) {
            char ch = path.charAt(i);
            if (ch == '.' || ch == '/') {
                return path.substring(0, i);
            }
        }
        return path;
    }

    /**
     * {@code MyComponent::FooBar} becomes {@code my-component/foo-bar}.
     */
    public static String normalizeTagPath(String tagPath) {
        String[] segments = tagPath.split("::", -1);
        StringBuilder normalized = new StringBuilder(tagPath.length() + 8);
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                normalized.append('/');
            }
            normalized.append(dasherize(segments[i]));
        }
        return normalized.toString();
    }

    /**
     * Insert a hyphen before every uppercase letter except a leading one, then lowercase.
     */
    public static String dasherize(String segment) {
        StringBuilder out = new StringBuilder(segment.length() + 4);
        for (int i = 0; i < segment.length(); i++) {
            char ch = segment.charAt(i);
            if (Character.isUpperCase(ch)) {
                if (i > 0) {
                    out.append('-');
                }
                out.append(Character.toLowerCase(ch));
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }
}
