package space.maatini.magicauth.route;

import java.util.Map;

/**
 * Successful match of a {@link PathPattern} against the start of a path.
 *
 * @param remaining text following the matched template
 * @param params    converted parameter values by name
 */
public record PatternMatch(String remaining, Map<String, Object> params) {

    public PatternMatch {
        remaining = remaining != null ? remaining : "";
        params = params != null ? Map.copyOf(params) : Map.of();
    }
}
