package com.example.scrubservice.engine;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Lenient percent-decoding.
 *
 * <p>Unlike {@link java.net.URLDecoder}, malformed escapes are kept as written and invalid UTF-8
 * byte sequences decode to U+FFFD instead of failing.</p>
 */
public final class PercentDecoder {

    private PercentDecoder() {
    }

    /**
     * Decode %XX escapes; '+' is left as is.
     */
    public static String decode(String value) {
        return decode(value, false);
    }

    /**
     * Decode a form-encoded component: %XX escapes, and '+' as a space.
     */
    public static String decodeForm(String value) {
        return decode(value, true);
    }

    private static String decode(String value, boolean plusAsSpace) {
        if (value.indexOf('%') < 0 && (!plusAsSpace || value.indexOf('+') < 0)) {
            return value;
        }

        StringBuilder out = new StringBuilder(value.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '%' && isEscape(value, i)) {
                pending.write((hexValue(value.charAt(i + 1)) << 4) | hexValue(value.charAt(i + 2)));
                i += 3;
                continue;
            }
            flush(pending, out);
            out.append(plusAsSpace && c == '+' ? ' ' : c);
            i++;
        }
        flush(pending, out);
        return out.toString();
    }

    private static boolean isEscape(String value, int index) {
        return index + 2 < value.length()
                && hexValue(value.charAt(index + 1)) >= 0
                && hexValue(value.charAt(index + 2)) >= 0;
    }

    private static void flush(ByteArrayOutputStream pending, StringBuilder out) {
        if (pending.size() > 0) {
            out.append(new String(pending.toByteArray(), StandardCharsets.UTF_8));
            pending.reset();
        }
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }
}
