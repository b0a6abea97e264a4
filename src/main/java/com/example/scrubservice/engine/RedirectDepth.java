package com.example.scrubservice.engine;

/**
 * How many more embedded redirects an evaluation may follow.
 *
 * <p>A top-level evaluation starts at {@link #AT_MOST_ONE_REDIRECT}. Following a redirect
 * evaluates the target at {@link #NO_MORE_REDIRECTS}, where a matching redirection only
 * replaces the URL in place.</p>
 */
public enum RedirectDepth {

    AT_MOST_ONE_REDIRECT,

    NO_MORE_REDIRECTS;

    public boolean allowsRecursion() {
        return this == AT_MOST_ONE_REDIRECT;
    }

    public RedirectDepth next() {
        return NO_MORE_REDIRECTS;
    }
}
