package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.enums.AssetDeliveryState;
import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.IntegrityException;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.interfaces.RemoteNotFoundException;
import io.mersel.services.media.application.interfaces.ReservationException;
import io.mersel.services.media.application.interfaces.TransportException;
import io.mersel.services.media.application.models.AssetReservation;
import io.mersel.services.media.application.models.DeliveryDescriptor;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.application.models.RemoteAssetSet;
import io.mersel.services.media.application.models.UploadOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bellek içi App Store Connect taklidi.
 * <p>
 * Rezervasyonları {@link #chunkSize} byte'lık operasyonlara böler, parçaları birleştirir ve
 * commit'te MD5'i gerçekten kontrol eder. Tüm mutasyon çağrıları {@link #calls} listesine yazılır.
 */
class InMemoryMediaApiClient implements IMediaApiClient {

    final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    int chunkSize = 4;
    AssetDeliveryState stateAfterCommit = AssetDeliveryState.COMPLETE;
    final Set<String> failingDeletes = new HashSet<>();
    /** Commit'te checksum'ı reddedilecek dosya adları. */
    final Set<String> corruptCommits = new HashSet<>();

    private final Set<String> locales = new LinkedHashSet<>();
    private final Map<String, StoredSet> sets = new LinkedHashMap<>();
    private final Map<String, StoredAsset> assets = new HashMap<>();
    private int sequence;

    static final class StoredSet {
        final String id;
        final String locale;
        final String displayType;
        final AssetKind kind;
        final List<String> itemIds = new ArrayList<>();

        StoredSet(String id, String locale, String displayType, AssetKind kind) {
            this.id = id;
            this.locale = locale;
            this.displayType = displayType;
            this.kind = kind;
        }
    }

    static final class StoredAsset {
        final String id;
        final String setId;
        final String fileName;
        final AssetKind kind;
        byte[] content;
        String checksum;
        AssetDeliveryState state = AssetDeliveryState.AWAITING_UPLOAD;

        StoredAsset(String id, String setId, String fileName, AssetKind kind, long size) {
            this.id = id;
            this.setId = setId;
            this.fileName = fileName;
            this.kind = kind;
            this.content = new byte[(int) size];
        }
    }

    // ── Kurulum yardımcıları ─────────────────────────────────────────

    InMemoryMediaApiClient withLocale(String locale) {
        locales.add(locale);
        return this;
    }

    String seedSet(String locale, String displayType, AssetKind kind, AssetDeliveryState... states) {
        locales.add(locale);
        String setId = "set-" + (++sequence);
        StoredSet set = new StoredSet(setId, locale, displayType, kind);
        sets.put(setId, set);
        for (int i = 0; i < states.length; i++) {
            String assetId = "seed-" + (++sequence);
            StoredAsset asset = new StoredAsset(assetId, setId, "seed_" + (i + 1) + ".png", kind, 3);
            asset.content = new byte[]{1, 2, 3};
            asset.state = states[i];
            assets.put(assetId, asset);
            set.itemIds.add(assetId);
        }
        return setId;
    }

    List<String> itemIds(String setId) {
        return List.copyOf(sets.get(setId).itemIds);
    }

    StoredAsset asset(String assetId) {
        return assets.get(assetId);
    }

    List<String> fileNames(String setId) {
        return sets.get(setId).itemIds.stream().map(id -> assets.get(id).fileName).toList();
    }

    String setIdFor(String locale, String displayType, AssetKind kind) {
        return sets.values().stream()
                .filter(s -> s.locale.equals(locale) && s.displayType.equals(displayType) && s.kind == kind)
                .map(s -> s.id)
                .findFirst()
                .orElse(null);
    }

    List<String> mutations() {
        synchronized (calls) {
            return calls.stream()
                    .filter(c -> !c.startsWith("listSets") && !c.startsWith("listAssets")
                            && !c.startsWith("fetch"))
                    .toList();
        }
    }

    // ── IMediaApiClient ──────────────────────────────────────────────

    @Override
    public synchronized List<RemoteAssetSet> listSets(String versionId) {
        calls.add("listSets " + versionId);
        List<RemoteAssetSet> result = new ArrayList<>();
        for (StoredSet set : sets.values()) {
            result.add(new RemoteAssetSet(set.id, set.locale, set.displayType, set.kind, toRemote(set)));
        }
        return result;
    }

    @Override
    public synchronized List<RemoteAsset> listAssets(String setId, AssetKind kind) throws MediaSyncException {
        calls.add("listAssets " + setId);
        StoredSet set = sets.get(setId);
        if (set == null) {
            throw new RemoteNotFoundException("set yok: " + setId);
        }
        return toRemote(set);
    }

    @Override
    public synchronized String createSet(String versionId, String locale, String displayType, AssetKind kind)
            throws MediaSyncException {
        calls.add("createSet " + locale + "/" + displayType + "/" + kind.label());
        if (!locales.contains(locale)) {
            throw new RemoteNotFoundException("Sürümde '" + locale + "' lokalizasyonu yok");
        }
        String setId = "set-" + (++sequence);
        sets.put(setId, new StoredSet(setId, locale, displayType, kind));
        return setId;
    }

    @Override
    public synchronized AssetReservation reserveAsset(String setId, AssetKind kind, String fileName, long fileSize)
            throws MediaSyncException {
        calls.add("reserve " + fileName);
        StoredSet set = sets.get(setId);
        if (set == null) {
            throw new ReservationException("set yok: " + setId, 409);
        }
        String assetId = "asset-" + (++sequence);
        assets.put(assetId, new StoredAsset(assetId, setId, fileName, kind, fileSize));
        set.itemIds.add(assetId);

        List<UploadOperation> operations = new ArrayList<>();
        for (long offset = 0; offset < fileSize || offset == 0; offset += chunkSize) {
            long length = Math.min(chunkSize, fileSize - offset);
            operations.add(new UploadOperation("PUT", "mem://upload/" + assetId + "/" + offset, offset, length,
                    Map.of("Content-Type", "application/octet-stream")));
            if (fileSize == 0) {
                break;
            }
        }
        return new AssetReservation(assetId, operations);
    }

    @Override
    public void putChunk(UploadOperation operation, byte[] bytes) throws TransportException {
        String[] parts = operation.url().substring("mem://upload/".length()).split("/");
        synchronized (this) {
            StoredAsset asset = assets.get(parts[0]);
            if (asset == null) {
                throw new TransportException("upload hedefi yok", 404);
            }
            System.arraycopy(bytes, 0, asset.content, (int) operation.offset(), bytes.length);
        }
    }

    @Override
    public synchronized RemoteAsset commitAsset(String assetId, AssetKind kind, String checksum, boolean uploaded)
            throws MediaSyncException {
        calls.add("commit " + assetId);
        StoredAsset asset = assets.get(assetId);
        if (asset == null) {
            throw new RemoteNotFoundException("asset yok: " + assetId);
        }
        if (corruptCommits.contains(asset.fileName) || !FileChecksums.md5Hex(asset.content).equals(checksum)) {
            asset.state = AssetDeliveryState.FAILED;
            throw new IntegrityException(asset.fileName, "checksum uyuşmuyor");
        }
        asset.checksum = checksum;
        asset.state = stateAfterCommit;
        return toRemote(asset);
    }

    @Override
    public synchronized RemoteAsset fetchAsset(String assetId, AssetKind kind) throws MediaSyncException {
        calls.add("fetchAsset " + assetId);
        StoredAsset asset = assets.get(assetId);
        if (asset == null) {
            throw new RemoteNotFoundException("asset yok: " + assetId);
        }
        return toRemote(asset);
    }

    @Override
    public synchronized void deleteAsset(String assetId, AssetKind kind) throws MediaSyncException {
        calls.add("delete " + assetId);
        if (failingDeletes.contains(assetId)) {
            throw new MediaSyncException("silme reddedildi: " + assetId);
        }
        StoredAsset asset = assets.remove(assetId);
        if (asset == null) {
            throw new RemoteNotFoundException("asset yok: " + assetId);
        }
        sets.get(asset.setId).itemIds.remove(assetId);
    }

    @Override
    public synchronized void reorderSet(String setId, AssetKind kind, List<String> orderedAssetIds)
            throws MediaSyncException {
        calls.add("reorder " + setId + " " + orderedAssetIds);
        StoredSet set = sets.get(setId);
        if (!new HashSet<>(set.itemIds).equals(new HashSet<>(orderedAssetIds))) {
            throw new MediaSyncException("sıralama setin öğeleriyle uyuşmuyor: " + orderedAssetIds);
        }
        set.itemIds.clear();
        set.itemIds.addAll(orderedAssetIds);
    }

    @Override
    public synchronized byte[] fetchBytes(String url) throws TransportException {
        calls.add("fetchBytes " + url);
        String assetId = url.substring("mem://".length()).split("/")[0];
        StoredAsset asset = assets.get(assetId);
        if (asset == null) {
            throw new TransportException("İndirme HTTP 404 döndü — URL: " + url, 404);
        }
        return asset.content.clone();
    }

    private List<RemoteAsset> toRemote(StoredSet set) {
        return set.itemIds.stream().map(id -> toRemote(assets.get(id))).toList();
    }

    private RemoteAsset toRemote(StoredAsset asset) {
        DeliveryDescriptor delivery = asset.kind == AssetKind.SCREENSHOT
                ? DeliveryDescriptor.imageTemplate("mem://" + asset.id + "/{w}x{h}bb.{f}", 1290, 2796)
                : DeliveryDescriptor.video("mem://" + asset.id + "/video.mp4");
        return new RemoteAsset(asset.id, asset.fileName, asset.content.length, asset.checksum, asset.state,
                delivery, List.of());
    }
}
