package io.mersel.services.media.application.interfaces;

import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.models.AssetReservation;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.application.models.RemoteAssetSet;
import io.mersel.services.media.application.models.UploadOperation;

import java.util.List;

/**
 * Kimliği doğrulanmış App Store Connect REST istemcisi arayüzü.
 * <p>
 * İstek imzalama, HTTP seviyesinde tekrar deneme ve sayfalama bu katmanın sorumluluğundadır.
 * Senkronizasyon motoru yalnızca bu arayüz üzerinden uzak tarafla konuşur.
 */
public interface IMediaApiClient {

    /**
     * Sürümün tüm setlerini, iç içe öğe listeleriyle birlikte taze olarak getirir.
     *
     * @param versionId App Store sürüm kimliği
     * @return Ekran görüntüsü ve önizleme setleri
     */
    List<RemoteAssetSet> listSets(String versionId) throws MediaSyncException;

    /**
     * Bir setin öğelerini uzak sırayla getirir.
     */
    List<RemoteAsset> listAssets(String setId, AssetKind kind) throws MediaSyncException;

    /**
     * Boş bir set oluşturur.
     *
     * @return yeni set kimliği
     * @throws RemoteNotFoundException locale sürümde yoksa
     */
    String createSet(String versionId, String locale, String displayType, AssetKind kind)
            throws MediaSyncException;

    /**
     * Asset rezervasyonu: {@code AWAITING_UPLOAD} durumunda asset ve upload operasyonları döner.
     *
     * @throws ReservationException istek reddedilirse
     */
    AssetReservation reserveAsset(String setId, AssetKind kind, String fileName, long fileSize)
            throws MediaSyncException;

    /**
     * Tek bir byte aralığını presigned URL'ye aktarır.
     */
    void putChunk(UploadOperation operation, byte[] bytes) throws TransportException;

    /**
     * Checksum ve "uploaded" bayrağını göndererek yüklemeyi tamamlar.
     *
     * @throws IntegrityException checksum reddedilirse
     */
    RemoteAsset commitAsset(String assetId, AssetKind kind, String checksum, boolean uploaded)
            throws MediaSyncException;

    /**
     * Tek bir asset'in güncel durumunu getirir.
     */
    RemoteAsset fetchAsset(String assetId, AssetKind kind) throws MediaSyncException;

    void deleteAsset(String assetId, AssetKind kind) throws MediaSyncException;

    /**
     * Setin öğe sırasını tek bir ilişki güncellemesiyle değiştirir.
     */
    void reorderSet(String setId, AssetKind kind, List<String> orderedAssetIds) throws MediaSyncException;

    /**
     * Çözümlenmiş teslim URL'sinden düz HTTP GET.
     */
    byte[] fetchBytes(String url) throws TransportException;
}
