package io.mersel.services.media.application.interfaces;

/**
 * Set veya asset uzak tarafta bulunamadı (örn: başka bir araç tarafından silindi).
 */
public class RemoteNotFoundException extends MediaSyncException {

    public RemoteNotFoundException(String message) {
        super(message);
    }
}
