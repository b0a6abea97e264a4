package com.example.scrubservice.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code key=value} segment of a query string.
 *
 * <p>The segment keeps its original encoded text so that re-emitting a kept parameter does not
 * alter it. Rules are matched against the decoded {@link #getName() name}.</p>
 */
public final class QueryParameter {

    private final String raw;
    private final String name;

    private QueryParameter(String raw, String name) {
        this.raw = raw;
        this.name = name;
    }

    public static QueryParameter parse(String segment) {
        int equals = segment.indexOf('=');
        String encodedName = equals < 0 ? segment : segment.substring(0, equals);
        return new QueryParameter(segment, PercentDecoder.decodeForm(encodedName));
    }

    /**
     * Split a query string on '&amp;'. Empty segments are dropped; order and duplicates are kept.
     */
    public static List<QueryParameter> parseAll(String query) {
        List<QueryParameter> parameters = new ArrayList<>();
        if (query == null || query.isEmpty()) {
            return parameters;
        }
        for (String segment : query.split("&", -1)) {
            if (!segment.isEmpty()) {
                parameters.add(parse(segment));
            }
        }
        return parameters;
    }

    public static String join(List<QueryParameter> parameters) {
        StringBuilder query = new StringBuilder();
        for (QueryParameter parameter : parameters) {
            if (query.length() > 0) {
                query.append('&');
            }
            query.append(parameter.raw);
        }
        return query.toString();
    }

    /**
     * @return decoded parameter name ('+' read as space)
     */
    public String getName() {
        return name;
    }

    /**
     * @return segment exactly as it appeared in the query
     */
    public String getRaw() {
        return raw;
    }

    @Override
    public String toString() {
        return raw;
    }
}
