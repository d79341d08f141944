package io.formulaxform.core.parser;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;

/**
 * Decodes backslash escapes inside single-quoted formula strings.
 *
 * <p>Supported: {@code \n \t \r \b \f \0 \\ \' \"}, {@code \}{@code uXXXX} and {@code \xHH}. Runs
 * of {@code \xHH} escapes are collected as bytes and decoded with the configured charset, so
 * {@code '\xc3\xa9'} is {@code é} under UTF-8. An unknown escape is kept verbatim, backslash
 * included.
 */
public final class StringLiterals {

    private StringLiterals() {
        // static utility
    }

    /**
     * @param raw the literal body between the quotes
     * @param charset charset for {@code \xHH} byte runs
     * @return the decoded string
     * @throws IllegalArgumentException if an escape is truncated or has bad hex digits; the message
     *     names the offending index within {@code raw}
     */
    public static String unescape(String raw, Charset charset) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder out = new StringBuilder(raw.length());
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c != '\\') {
                flush(bytes, out, charset);
                out.append(c);
                i++;
                continue;
            }
            if (i + 1 >= raw.length()) {
                throw new IllegalArgumentException("dangling backslash at index " + i);
            }
            char e = raw.charAt(i + 1);
            if (e == 'x') {
                bytes.write(hex(raw, i + 2, 2, i));
                i += 4;
                continue;
            }
            flush(bytes, out, charset);
            switch (e) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case '0' -> out.append('\0');
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'u' -> {
                    out.append((char) hex(raw, i + 2, 4, i));
                    i += 4;
                }
                default -> out.append('\\').append(e);
            }
            i += 2;
        }
        flush(bytes, out, charset);
        return out.toString();
    }

    private static int hex(String raw, int from, int digits, int escapeIndex) {
        if (from + digits > raw.length()) {
            throw new IllegalArgumentException("truncated escape at index " + escapeIndex);
        }
        int value = 0;
        for (int k = from; k < from + digits; k++) {
            int d = Character.digit(raw.charAt(k), 16);
            if (d < 0) {
                throw new IllegalArgumentException("invalid hex digit '" + raw.charAt(k) + "' at index " + k);
            }
            value = value * 16 + d;
        }
        return value;
    }

    private static void flush(ByteArrayOutputStream bytes, StringBuilder out, Charset charset) {
        if (bytes.size() > 0) {
            out.append(new String(bytes.toByteArray(), charset));
            bytes.reset();
        }
    }
}
