package com.pixelservices.invoke.components.http.routing.trie;

import com.pixelservices.invoke.exceptions.InvalidRoutePatternException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One classified segment of a route pattern.
 * <ul>
 *     <li>{@code :name} is a {@link NodeType#PARAM}</li>
 *     <li>{@code {name:regex}} is a {@link NodeType#REGEX}</li>
 *     <li>anything else is a {@link NodeType#STATIC} literal</li>
 * </ul>
 */
public final class SegmentPattern {
    private final NodeType type;
    private final String text;
    private final String paramName;
    private final Pattern compiled;

    private SegmentPattern(NodeType type, String text, String paramName, Pattern compiled) {
        this.type = type;
        this.text = text;
        this.paramName = paramName;
        this.compiled = compiled;
    }

    /**
     * Classifies a single route segment. Regex segments are compiled here so a malformed
     * pattern fails registration instead of the first matching request.
     *
     * @param segment       the raw segment, without slashes
     * @param caseSensitive whether literals and regexes keep their case
     * @return the parsed segment
     * @throws InvalidRoutePatternException if the parameter name is empty or the regex does not compile
     */
    public static SegmentPattern parse(String segment, boolean caseSensitive) {
        if (segment.startsWith(":")) {
            String name = segment.substring(1);
            if (name.isEmpty()) {
                throw new InvalidRoutePatternException("Empty parameter name in segment '" + segment + "'");
            }
            return new SegmentPattern(NodeType.PARAM, name, name, null);
        }
        if (segment.startsWith("{") && segment.endsWith("}") && segment.length() > 1) {
            String content = segment.substring(1, segment.length() - 1);
            int colon = content.indexOf(':');
            if (colon >= 0) {
                String name = content.substring(0, colon);
                String regex = content.substring(colon + 1);
                if (name.isEmpty()) {
                    throw new InvalidRoutePatternException("Empty parameter name in segment '" + segment + "'");
                }
                try {
                    Pattern compiled = caseSensitive
                            ? Pattern.compile(regex)
                            : Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                    return new SegmentPattern(NodeType.REGEX, name + ":" + regex, name, compiled);
                } catch (PatternSyntaxException e) {
                    throw new InvalidRoutePatternException("Malformed regex in segment '" + segment + "': " + e.getDescription(), e);
                }
            }
            // no colon: treated as a plain literal
        }
        return new SegmentPattern(NodeType.STATIC, normalize(segment, caseSensitive), null, null);
    }

    /**
     * Splits a path on '/', ignoring leading and trailing slashes. The root path yields a
     * single empty segment.
     */
    public static String[] split(String path) {
        String trimmed = trimSlashes(path == null ? "" : path);
        return trimmed.split("/", -1);
    }

    /**
     * Splits and, unless case sensitive, lower-cases a request path.
     */
    public static String[] normalizedSegments(String path, boolean caseSensitive) {
        String[] segments = split(path);
        if (caseSensitive) {
            return segments;
        }
        return Arrays.stream(segments).map(s -> s.toLowerCase(Locale.ROOT)).toArray(String[]::new);
    }

    static String normalize(String literal, boolean caseSensitive) {
        return caseSensitive ? literal : literal.toLowerCase(Locale.ROOT);
    }

    private static String trimSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') start++;
        while (end > start && path.charAt(end - 1) == '/') end--;
        return path.substring(start, end);
    }

    public NodeType getType() {
        return type;
    }

    /**
     * The identity text of this segment: the literal, the parameter name, or {@code name:regex}.
     */
    public String getText() {
        return text;
    }

    public String getParamName() {
        return paramName;
    }

    public Pattern getCompiled() {
        return compiled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SegmentPattern)) return false;
        SegmentPattern that = (SegmentPattern) o;
        return type == that.type && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        switch (type) {
            case PARAM:
                return ":" + text;
            case REGEX:
                return "{" + text + "}";
            default:
                return text;
        }
    }
}
