package io.mersel.services.media.application.interfaces;

/**
 * Asset rezervasyonunun reddedilmesi (kota, geçersiz set, geçersiz dosya adı vb.).
 * <p>
 * Tekrar denenemez ve asset slotu tüketmez.
 */
public class ReservationException extends MediaSyncException {

    private final int statusCode;

    public ReservationException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ReservationException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
