package space.maatini.magicauth.model;

import space.maatini.magicauth.config.AccessSettings.SameSite;

/**
 * Cookie persisting a validated token for one protected pattern.
 */
public record TokenCookie(
        String name,
        String value,
        String path,
        int maxAge,
        boolean httpOnly,
        boolean secure,
        SameSite sameSite) {

    /**
     * Renders the cookie as a Set-Cookie header value.
     */
    public String toHeaderValue() {
        StringBuilder sb = new StringBuilder()
                .append(name).append('=').append(value)
                .append("; Path=").append(path)
                .append("; Max-Age=").append(maxAge);
        if (secure) {
            sb.append("; Secure");
        }
        if (httpOnly) {
            sb.append("; HttpOnly");
        }
        if (sameSite != null) {
            sb.append("; SameSite=").append(sameSite.attributeValue());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TokenCookie[name=" + name + ", path=" + path + "]";
    }
}
