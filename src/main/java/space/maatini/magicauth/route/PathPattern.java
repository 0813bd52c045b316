package space.maatini.magicauth.route;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled route template such as {@code blog/<int:year>/<str:slug>/}.
 * <p>
 * Literal text is matched verbatim, parameters are written as
 * {@code <converter:name>} or {@code <name>} (defaults to {@code str}).
 * Supported converters:
 * <ul>
 * <li>{@code str}: any non-empty segment without a slash</li>
 * <li>{@code int}: digits, converted to {@link Integer} or, past its range, {@link java.math.BigInteger}</li>
 * <li>{@code slug}: ASCII letters, digits, hyphens and underscores</li>
 * <li>{@code uuid}: lowercase canonical UUID, converted to {@link UUID}</li>
 * <li>{@code path}: any non-empty text including slashes</li>
 * </ul>
 * Matching is anchored at the start of the input only; the text following
 * the matched template is returned as the remaining suffix.
 */
public final class PathPattern {

    private static final Pattern PARAMETER = Pattern.compile("<(?:(?<converter>[^>:]+):)?(?<name>[^>]+)>");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String template;
    private final Pattern regex;
    private final Map<String, Converter> converters;

    private PathPattern(String template, Pattern regex, Map<String, Converter> converters) {
        this.template = template;
        this.regex = regex;
        this.converters = converters;
    }

    /**
     * Compiles a route template.
     *
     * @param template the route template, without a leading slash
     * @return the compiled pattern
     * @throws IllegalArgumentException if the template is malformed
     */
    public static PathPattern compile(String template) {
        if (template == null) {
            throw new IllegalArgumentException("Route template must not be null");
        }

        StringBuilder regex = new StringBuilder("^");
        Map<String, Converter> converters = new LinkedHashMap<>();
        Matcher m = PARAMETER.matcher(template);
        int last = 0;
        while (m.find()) {
            appendLiteral(template, template.substring(last, m.start()), regex);

            String name = m.group("name");
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new IllegalArgumentException(
                        "Route '%s' uses parameter name '%s' which isn't a valid identifier".formatted(template, name));
            }
            if (converters.containsKey(name)) {
                throw new IllegalArgumentException(
                        "Route '%s' uses parameter name '%s' more than once".formatted(template, name));
            }
            String converterName = m.group("converter") != null ? m.group("converter") : "str";
            Converter converter = Converter.byName(converterName)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Route '%s' uses invalid converter '%s'".formatted(template, converterName)));

            converters.put(name, converter);
            regex.append('(').append(converter.regex).append(')');
            last = m.end();
        }
        appendLiteral(template, template.substring(last), regex);

        return new PathPattern(template, Pattern.compile(regex.toString()), Collections.unmodifiableMap(converters));
    }

    private static void appendLiteral(String template, String literal, StringBuilder regex) {
        if (literal.indexOf('<') >= 0 || literal.indexOf('>') >= 0) {
            throw new IllegalArgumentException("Route '%s' contains an unbalanced '<' or '>'".formatted(template));
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal));
        }
    }

    /**
     * Matches the beginning of the given path.
     *
     * @param path the path, leading slash and registry prefix already removed
     * @return the remaining suffix and converted parameters, or empty if the
     *         path does not start with this template
     */
    public Optional<PatternMatch> match(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher m = regex.matcher(path);
        if (!m.lookingAt()) {
            return Optional.empty();
        }

        Map<String, Object> params = new LinkedHashMap<>();
        int group = 1;
        for (Map.Entry<String, Converter> entry : converters.entrySet()) {
            params.put(entry.getKey(), entry.getValue().toValue(m.group(group++)));
        }
        return Optional.of(new PatternMatch(path.substring(m.end()), params));
    }

    /**
     * Names of the captured parameters in template order.
     */
    public Set<String> parameterNames() {
        return converters.keySet();
    }

    /**
     * Returns true if the literal template ends with a slash.
     */
    public boolean endsWithSlash() {
        return template.endsWith("/");
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PathPattern other && template.equals(other.template));
    }

    @Override
    public int hashCode() {
        return template.hashCode();
    }

    @Override
    public String toString() {
        return template;
    }

    private enum Converter {
        STR("str", "[^/]+"),
        INT("int", "[0-9]+"),
        SLUG("slug", "[-a-zA-Z0-9_]+"),
        CANONICAL_UUID("uuid", "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"),
        PATH("path", ".+");

        private final String converterName;
        private final String regex;

        Converter(String converterName, String regex) {
            this.converterName = converterName;
            this.regex = regex;
        }

        static Optional<Converter> byName(String name) {
            for (Converter c : values()) {
                if (c.converterName.equals(name)) {
                    return Optional.of(c);
                }
            }
            return Optional.empty();
        }

        /**
         * Converts text already accepted by the converter regex. Never fails,
         * so a matched path always stays matched.
         */
        Object toValue(String raw) {
            return switch (this) {
                case INT -> toInteger(raw);
                case CANONICAL_UUID -> UUID.fromString(raw);
                default -> raw;
            };
        }

        private static Number toInteger(String digits) {
            BigInteger value = new BigInteger(digits);
            // Integer where it fits, BigInteger beyond
            return value.bitLength() < Integer.SIZE ? Integer.valueOf(value.intValue()) : value;
        }
    }
}
