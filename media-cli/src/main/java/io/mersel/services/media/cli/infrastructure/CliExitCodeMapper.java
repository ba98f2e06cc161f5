package io.mersel.services.media.cli.infrastructure;

import io.mersel.services.media.application.interfaces.MediaSyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

/**
 * Komuttan çıkan istisnaları süreç çıkış koduna çevirir.
 * <ul>
 *   <li>2 — yapılandırma veya kullanım hatası (eksik anahtar, eksik parametre)</li>
 *   <li>3 — uzak API veya ağ hatası</li>
 *   <li>1 — diğer</li>
 * </ul>
 * Spring runner istisnaları sarmaladığından neden zinciri taranır.
 */
@Component
public class CliExitCodeMapper implements ExitCodeExceptionMapper {

    private static final Logger log = LoggerFactory.getLogger(CliExitCodeMapper.class);

    public static final int EXIT_FAILED_ITEMS = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_REMOTE = 3;

    @Override
    public int getExitCode(Throwable exception) {
        Throwable root = exception;
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof MediaSyncException) {
                log.error("Uzak işlem başarısız: {}", t.getMessage());
                return EXIT_REMOTE;
            }
            root = t;
        }
        if (root instanceof IllegalArgumentException || root instanceof IllegalStateException) {
            log.error("Yapılandırma hatası: {}", root.getMessage());
            return EXIT_CONFIGURATION;
        }
        return EXIT_FAILED_ITEMS;
    }
}
