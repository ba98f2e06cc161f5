package io.mersel.services.media.application.interfaces;

/**
 * Commit sırasında sunucunun checksum'ı reddetmesi. Tekrar denenemez.
 */
public class IntegrityException extends MediaSyncException {

    private final String fileName;
    private final String detail;

    public IntegrityException(String fileName, String detail) {
        super("Checksum reddedildi: " + fileName + " — " + detail);
        this.fileName = fileName;
        this.detail = detail;
    }

    public String getFileName() {
        return fileName;
    }

    /** Sunucunun döndürdüğü hata açıklaması. */
    public String getDetail() {
        return detail;
    }
}
