package io.mersel.services.media.application.interfaces;

import io.mersel.services.media.application.models.AssetGroupKey;

/**
 * Onarım sırasında yerel dosya sayısı ile uzak öğe sayısı uyuşmuyor.
 * <p>
 * Konum tabanlı eşleştirme güvenilmez hale geldiği için yalnızca ilgili grup durdurulur.
 */
public class CardinalityMismatchException extends MediaSyncException {

    private final AssetGroupKey group;
    private final int localCount;
    private final int remoteCount;

    public CardinalityMismatchException(AssetGroupKey group, int localCount, int remoteCount) {
        super("Yerel/uzak öğe sayısı uyuşmuyor [" + group + "]: yerel=" + localCount
                + ", uzak=" + remoteCount);
        this.group = group;
        this.localCount = localCount;
        this.remoteCount = remoteCount;
    }

    public AssetGroupKey getGroup() {
        return group;
    }

    public int getLocalCount() {
        return localCount;
    }

    public int getRemoteCount() {
        return remoteCount;
    }
}
