package com.promptguard.content.detect;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fallible decoders for payloads smuggled past plain-text matching. Each
 * decoder answers {@link Optional#empty()} when the input is not a clean
 * encoding of readable text; that is the common case, not an error.
 */
public final class ContentDecoder {

    private static final Pattern BASE64_BODY = Pattern.compile("^[A-Za-z0-9+/]+={0,2}$");

    private ContentDecoder() {}

    public record DecodedVariant(ContentVariant variant, String text) {}

    /**
     * Every decoding of the full input that succeeds and differs from it,
     * Base64 first, then URL percent-encoding.
     */
    public static List<DecodedVariant> variants(String content) {
        List<DecodedVariant> variants = new ArrayList<>(2);
        decodeBase64(content).ifPresent(text ->
                variants.add(new DecodedVariant(ContentVariant.BASE64_DECODED, text)));
        decodeUrl(content).ifPresent(text ->
                variants.add(new DecodedVariant(ContentVariant.URL_DECODED, text)));
        return variants;
    }

    public static Optional<String> decodeBase64(String content) {
        if (content == null || content.isEmpty()) return Optional.empty();
        String trimmed = content.trim();
        if (!BASE64_BODY.matcher(trimmed).matches()) return Optional.empty();

        int remainder = trimmed.length() % 4;
        boolean padded = trimmed.endsWith("=");
        if (remainder == 1 || (padded && remainder != 0)) return Optional.empty();
        // Unpadded input is accepted the way lenient decoders accept it
        String normalized = remainder == 0 ? trimmed : trimmed + "=".repeat(4 - remainder);

        byte[] bytes = Base64.getDecoder().decode(normalized);
        return readableUtf8(bytes).filter(decoded -> !decoded.equals(content));
    }

    public static Optional<String> decodeUrl(String content) {
        if (content == null || content.indexOf('%') < 0) return Optional.empty();

        StringBuilder out = new StringBuilder(content.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '%') {
                if (i + 2 >= content.length()) return Optional.empty();
                int hi = Character.digit(content.charAt(i + 1), 16);
                int lo = Character.digit(content.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) return Optional.empty();
                pending.write((hi << 4) | lo);
                i += 3;
            } else {
                if (!flushPending(pending, out)) return Optional.empty();
                out.append(c);
                i++;
            }
        }
        if (!flushPending(pending, out)) return Optional.empty();

        String decoded = out.toString();
        return decoded.equals(content) ? Optional.empty() : Optional.of(decoded);
    }

    private static boolean flushPending(ByteArrayOutputStream pending, StringBuilder out) {
        if (pending.size() == 0) return true;
        Optional<String> text = readableUtf8(pending.toByteArray());
        pending.reset();
        text.ifPresent(out::append);
        return text.isPresent();
    }

    // Malformed UTF-8 surfaces as U+FFFD; binary noise as control characters
    private static Optional<String> readableUtf8(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\uFFFD') return Optional.empty();
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t') return Optional.empty();
        }
        return Optional.of(text);
    }
}
