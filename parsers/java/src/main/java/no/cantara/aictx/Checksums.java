package no.cantara.aictx;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content checksums that do not depend on platform line endings or surrounding whitespace.
 *
 * <p>Content is normalized ({@code \r\n} and lone {@code \r} to {@code \n}, then stripped
 * of leading and trailing Unicode whitespace),
 * encoded as UTF-8 and hashed with SHA-256. The result is rendered {@code sha256:<hex>}.
 */
public final class Checksums {

    public static final String PREFIX = "sha256:";

    private Checksums() {}

    public static String normalize(String content) {
        String text = content.replace("\r\n", "\n").replace('\r', '\n');
        int start = 0;
        int end = text.length();
        while (start < end && isSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * Unicode whitespace, including the no-break spaces and NEL that {@link String#strip()} keeps.
     */
    static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == 0x85;
    }

    public static byte[] normalizedBytes(String content) {
        return normalize(content).getBytes(StandardCharsets.UTF_8);
    }

    public static String checksum(String content) {
        MessageDigest digest = newDigest();
        digest.update(normalizedBytes(content));
        return render(digest);
    }

    public static String fileChecksum(Path path) throws IOException {
        return checksum(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Feeds each file's normalized content, in the given order, into one running SHA-256.
     */
    public static String aggregate(Iterable<Path> files) throws IOException {
        MessageDigest digest = newDigest();
        for (Path file : files) {
            digest.update(normalizedBytes(Files.readString(file, StandardCharsets.UTF_8)));
        }
        return render(digest);
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String render(MessageDigest digest) {
        byte[] hash = digest.digest();
        StringBuilder hex = new StringBuilder(PREFIX.length() + hash.length * 2).append(PREFIX);
        for (byte b : hash) {
            String h = Integer.toHexString(0xff & b);
            if (h.length() == 1) {
                hex.append('0');
            }
            hex.append(h);
        }
        return hex.toString();
    }
}
