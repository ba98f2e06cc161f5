package io.mersel.services.media.infrastructure;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Commit adımında gönderilen içerik checksum'ı (MD5, küçük harf hex).
 */
public final class FileChecksums {

    private static final int BUFFER_SIZE = 64 * 1024;

    private FileChecksums() {
    }

    public static String md5Hex(Path file) throws IOException {
        MessageDigest digest = md5();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String md5Hex(byte[] content) {
        return HexFormat.of().formatHex(md5().digest(content));
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algoritması bulunamadı", e);
        }
    }
}
