package io.mersel.services.media.infrastructure;

import java.nio.file.Path;

/**
 * Kullanıcının girdiği klasör yollarını temizler.
 * <p>
 * Terminale sürükle-bırak ile gelen yollar tırnaklı veya ters bölü kaçışlı olabilir
 * ({@code '/Users/x/My Media'}, {@code /Users/x/My\ Media}); baştaki {@code ~} ev dizinine açılır.
 */
public final class MediaPaths {

    private MediaPaths() {
    }

    public static Path sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Klasör yolu boş olamaz");
        }
        String path = raw.trim();
        if (path.length() >= 2
                && ((path.startsWith("\"") && path.endsWith("\"")) || (path.startsWith("'") && path.endsWith("'")))) {
            path = path.substring(1, path.length() - 1);
        }
        path = path.replaceAll("\\\\(.)", "$1");

        String home = System.getProperty("user.home");
        if (path.equals("~")) {
            path = home;
        } else if (path.startsWith("~/")) {
            path = home + path.substring(1);
        }
        return Path.of(path).toAbsolutePath().normalize();
    }
}
