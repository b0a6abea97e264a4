package com.example.scrubservice.engine;

import java.util.List;
import java.util.Locale;

/**
 * A URL split into {@code scheme:[//authority]path[;params][?query][#fragment]}.
 *
 * <p>Splitting never fails: text that does not look like a URL ends up in {@code path}.
 * The scheme is lower-cased. {@link #toUrlString()} reassembles the remaining parts as written,
 * except that empty params, query and fragment are dropped together with their delimiter.</p>
 */
public final class UrlComponents {

    private final String scheme;
    private final String authority;
    private final String path;
    private final String params;
    private final String query;
    private final String fragment;

    private UrlComponents(String scheme, String authority, String path, String params, String query, String fragment) {
        this.scheme = scheme;
        this.authority = authority;
        this.path = path;
        this.params = params;
        this.query = query;
        this.fragment = fragment;
    }

    public static UrlComponents parse(String url) {
        String rest = url;

        String scheme = null;
        int colon = rest.indexOf(':');
        if (colon > 0 && isScheme(rest.substring(0, colon))) {
            scheme = rest.substring(0, colon).toLowerCase(Locale.ROOT);
            rest = rest.substring(colon + 1);
        }

        String authority = null;
        if (rest.startsWith("//")) {
            int end = indexOfAny(rest, 2, "/?#");
            authority = rest.substring(2, end);
            rest = rest.substring(end);
        }

        String fragment = null;
        int hash = rest.indexOf('#');
        if (hash >= 0) {
            fragment = rest.substring(hash + 1);
            rest = rest.substring(0, hash);
        }

        String query = null;
        int question = rest.indexOf('?');
        if (question >= 0) {
            query = rest.substring(question + 1);
            rest = rest.substring(0, question);
        }

        // params belong to the last path segment only
        String params = null;
        int semicolon = rest.indexOf(';', Math.max(rest.lastIndexOf('/'), 0));
        if (semicolon >= 0) {
            params = rest.substring(semicolon + 1);
            rest = rest.substring(0, semicolon);
        }

        return new UrlComponents(scheme, authority, rest, params, query, fragment);
    }

    public UrlComponents withQueryParameters(List<QueryParameter> parameters) {
        return new UrlComponents(scheme, authority, path, params, QueryParameter.join(parameters), fragment);
    }

    public List<QueryParameter> getQueryParameters() {
        return QueryParameter.parseAll(query);
    }

    public String toUrlString() {
        StringBuilder url = new StringBuilder();
        if (scheme != null) {
            url.append(scheme).append(':');
        }
        if (authority != null) {
            url.append("//").append(authority);
        }
        url.append(path);
        if (params != null && !params.isEmpty()) {
            url.append(';').append(params);
        }
        if (query != null && !query.isEmpty()) {
            url.append('?').append(query);
        }
        if (fragment != null && !fragment.isEmpty()) {
            url.append('#').append(fragment);
        }
        return url.toString();
    }

    public String getScheme() {
        return scheme;
    }

    public String getAuthority() {
        return authority;
    }

    public String getPath() {
        return path;
    }

    public String getParams() {
        return params;
    }

    public String getQuery() {
        return query;
    }

    public String getFragment() {
        return fragment;
    }

    @Override
    public String toString() {
        return toUrlString();
    }

    private static boolean isScheme(String candidate) {
        if (!isAsciiLetter(candidate.charAt(0))) {
            return false;
        }
        for (int i = 1; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (!isAsciiLetter(c) && !(c >= '0' && c <= '9') && c != '+' && c != '-' && c != '.') {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static int indexOfAny(String value, int from, String delimiters) {
        for (int i = from; i < value.length(); i++) {
            if (delimiters.indexOf(value.charAt(i)) >= 0) {
                return i;
            }
        }
        return value.length();
    }
}
