package io.mersel.services.media.infrastructure.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mersel.services.media.application.enums.AssetDeliveryState;
import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.enums.ScreenshotDisplayType;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.IntegrityException;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.interfaces.RemoteNotFoundException;
import io.mersel.services.media.application.interfaces.ReservationException;
import io.mersel.services.media.application.interfaces.TransportException;
import io.mersel.services.media.application.models.AssetReservation;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.application.models.RemoteAssetSet;
import io.mersel.services.media.application.models.UploadOperation;
import io.mersel.services.media.infrastructure.config.MediaSyncProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * App Store Connect REST API istemcisi.
 * <p>
 * Her istek ES256 JWT ile imzalanır. 429 ve 5xx yanıtları ile bağlantı hataları
 * {@code asc.media.api-max-attempts} kadar, doğrusal artan bekleme ile tekrar denenir.
 * Liste uç noktaları {@code links.next} takip edilerek sonuna kadar okunur.
 * <p>
 * Presigned URL'lere yapılan aktarımlar ve teslim URL'lerinden indirmeler imzasız gider.
 */
@Component
public class AppStoreConnectClient implements IMediaApiClient {

    private static final Logger log = LoggerFactory.getLogger(AppStoreConnectClient.class);

    /** JDK HttpClient'ın elle ayarlanmasına izin vermediği başlıklar. */
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade");

    private static final Map<String, String> VIDEO_MIME_TYPES = Map.of(
            "mp4", "video/mp4",
            "mov", "video/quicktime");

    private final MediaSyncProperties properties;
    private final AccessTokenProvider tokenProvider;
    private final JsonApiMapper jsonApi;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final ExecutorService httpExecutor;

    @Autowired
    public AppStoreConnectClient(MediaSyncProperties properties, AccessTokenProvider tokenProvider,
                                 ObjectMapper objectMapper) {
        this(properties, tokenProvider, objectMapper, Executors.newFixedThreadPool(4));
    }

    private AppStoreConnectClient(MediaSyncProperties properties, AccessTokenProvider tokenProvider,
                                  ObjectMapper objectMapper, ExecutorService executor) {
        this(properties, tokenProvider, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .executor(executor)
                .build(), executor);
    }

    /**
     * Constructor with injectable HttpClient for testing.
     */
    AppStoreConnectClient(MediaSyncProperties properties, AccessTokenProvider tokenProvider,
                          ObjectMapper objectMapper, HttpClient httpClient) {
        this(properties, tokenProvider, objectMapper, httpClient, null);
    }

    private AppStoreConnectClient(MediaSyncProperties properties, AccessTokenProvider tokenProvider,
                                  ObjectMapper objectMapper, HttpClient httpClient,
                                  ExecutorService httpExecutor) {
        this.properties = properties;
        this.tokenProvider = tokenProvider;
        this.objectMapper = objectMapper;
        this.jsonApi = new JsonApiMapper(objectMapper);
        this.httpClient = httpClient;
        this.httpExecutor = httpExecutor;
    }

    @PreDestroy
    void shutdown() {
        if (httpExecutor != null) {
            httpExecutor.shutdown();
            log.debug("HTTP executor kapatıldı");
        }
    }

    // ── Okuma ────────────────────────────────────────────────────────

    @Override
    public List<RemoteAssetSet> listSets(String versionId) throws MediaSyncException {
        List<RemoteAssetSet> sets = new ArrayList<>();
        for (JsonNode localization : listLocalizations(versionId)) {
            String localizationId = localization.path("id").asText();
            String locale = localization.path("attributes").path("locale").asText();

            for (JsonNode set : getAll("/v1/appStoreVersionLocalizations/" + localizationId
                    + "/appScreenshotSets?limit=" + properties.getPageLimit())) {
                String setId = set.path("id").asText();
                String displayType = set.path("attributes").path("screenshotDisplayType").asText();
                List<RemoteAsset> items = listAssetsOfSet(setId, AssetKind.SCREENSHOT);
                if (items != null) {
                    sets.add(new RemoteAssetSet(setId, locale, displayType, AssetKind.SCREENSHOT, items));
                }
            }

            for (JsonNode set : getAll("/v1/appStoreVersionLocalizations/" + localizationId
                    + "/appPreviewSets?limit=" + properties.getPageLimit())) {
                String setId = set.path("id").asText();
                String previewType = set.path("attributes").path("previewType").asText();
                List<RemoteAsset> items = listAssetsOfSet(setId, AssetKind.PREVIEW);
                if (items != null) {
                    sets.add(new RemoteAssetSet(setId, locale,
                            ScreenshotDisplayType.folderNameForPreviewType(previewType), AssetKind.PREVIEW, items));
                }
            }
        }
        log.debug("Sürüm {} için {} set okundu", versionId, sets.size());
        return sets;
    }

    /**
     * Listeleme ile okuma arasında silinen set için {@code null} döner; set anlık görüntüden çıkarılır.
     */
    private List<RemoteAsset> listAssetsOfSet(String setId, AssetKind kind) throws MediaSyncException {
        try {
            return listAssets(setId, kind);
        } catch (RemoteNotFoundException e) {
            log.warn("{} seti {} okunamadı, atlanıyor: {}", kind.label(), setId, e.getMessage());
            return null;
        }
    }

    @Override
    public List<RemoteAsset> listAssets(String setId, AssetKind kind) throws MediaSyncException {
        String path = "/v1/" + JsonApiMapper.setResourceType(kind) + "/" + setId + "/"
                + JsonApiMapper.assetResourceType(kind) + "?limit=" + properties.getPageLimit();
        List<RemoteAsset> assets = new ArrayList<>();
        for (JsonNode data : getAll(path)) {
            assets.add(jsonApi.toRemoteAsset(data, kind));
        }
        return assets;
    }

    @Override
    public RemoteAsset fetchAsset(String assetId, AssetKind kind) throws MediaSyncException {
        ApiResponse response = call("GET", assetPath(kind, assetId), null);
        expectSuccess(response, "Asset okunamadı: " + assetId);
        return jsonApi.toRemoteAsset(response.body().path("data"), kind);
    }

    // ── Yazma ────────────────────────────────────────────────────────

    @Override
    public String createSet(String versionId, String locale, String displayType, AssetKind kind)
            throws MediaSyncException {
        String localizationId = resolveLocalizationId(versionId, locale);
        String remoteType = kind == AssetKind.SCREENSHOT
                ? displayType
                : ScreenshotDisplayType.previewTypeForFolderName(displayType);

        ApiResponse response = call("POST", "/v1/" + JsonApiMapper.setResourceType(kind),
                jsonApi.createSetRequest(kind, remoteType, localizationId), false);
        expectSuccess(response, "Set oluşturulamadı [" + locale + "/" + displayType + "]");

        String setId = response.body().path("data").path("id").asText();
        log.info("Yeni {} seti oluşturuldu: {} [{}/{}]", kind.label(), setId, locale, displayType);
        return setId;
    }

    @Override
    public AssetReservation reserveAsset(String setId, AssetKind kind, String fileName, long fileSize)
            throws MediaSyncException {
        String mimeType = kind == AssetKind.PREVIEW ? videoMimeType(fileName) : null;
        ApiResponse response;
        try {
            response = call("POST", "/v1/" + JsonApiMapper.assetResourceType(kind),
                    jsonApi.reserveRequest(kind, setId, fileName, fileSize, mimeType), false);
        } catch (TransportException e) {
            throw new ReservationException("Rezervasyon isteği başarısız: " + fileName + " — " + e.getMessage(), e);
        }

        if (response.status() / 100 != 2) {
            throw new ReservationException("Rezervasyon reddedildi: " + fileName + " — HTTP "
                    + response.status() + " " + jsonApi.errorDetail(response.body()), response.status());
        }

        JsonNode data = response.body().path("data");
        List<UploadOperation> operations = jsonApi.toUploadOperations(data);
        if (operations.isEmpty()) {
            throw new ReservationException("Rezervasyon upload operasyonu içermiyor: " + fileName,
                    response.status());
        }
        String assetId = data.path("id").asText();
        log.debug("Rezervasyon alındı: {} → {} ({} operasyon)", fileName, assetId, operations.size());
        return new AssetReservation(assetId, operations);
    }

    @Override
    public void putChunk(UploadOperation operation, byte[] bytes) throws TransportException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(operation.url()))
                .timeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .method(operation.method(), HttpRequest.BodyPublishers.ofByteArray(bytes));
        operation.headers().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                builder.header(name, value);
            }
        });

        HttpResponse<Void> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new TransportException("Parça aktarımı başarısız (offset=" + operation.offset() + "): "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Parça aktarımı kesildi", e);
        }

        int status = response.statusCode();
        if (status / 100 == 2) {
            return;
        }
        if (status == 403) {
            throw new TransportException("Upload URL'sinin süresi dolmuş (offset=" + operation.offset() + ")",
                    status, true, null);
        }
        throw new TransportException("Parça aktarımı HTTP " + status + " döndü (offset="
                + operation.offset() + ")", status);
    }

    @Override
    public RemoteAsset commitAsset(String assetId, AssetKind kind, String checksum, boolean uploaded)
            throws MediaSyncException {
        ApiResponse response = call("PATCH", assetPath(kind, assetId),
                jsonApi.commitRequest(kind, assetId, checksum, uploaded));

        if (response.status() == 409 || response.status() == 422) {
            throw new IntegrityException(assetId, jsonApi.errorDetail(response.body()));
        }
        expectSuccess(response, "Commit başarısız: " + assetId);

        RemoteAsset asset = jsonApi.toRemoteAsset(response.body().path("data"), kind);
        if (asset.state() == AssetDeliveryState.FAILED && mentionsChecksum(asset.errors())) {
            throw new IntegrityException(asset.fileName() != null ? asset.fileName() : assetId,
                    String.join("; ", asset.errors()));
        }
        return asset;
    }

    @Override
    public void deleteAsset(String assetId, AssetKind kind) throws MediaSyncException {
        ApiResponse response = call("DELETE", assetPath(kind, assetId), null);
        expectSuccess(response, "Asset silinemedi: " + assetId);
        log.debug("Asset silindi: {}", assetId);
    }

    @Override
    public void reorderSet(String setId, AssetKind kind, List<String> orderedAssetIds) throws MediaSyncException {
        String path = "/v1/" + JsonApiMapper.setResourceType(kind) + "/" + setId
                + "/relationships/" + JsonApiMapper.assetResourceType(kind);
        ApiResponse response = call("PATCH", path, jsonApi.reorderRequest(kind, orderedAssetIds));
        expectSuccess(response, "Set sırası güncellenemedi: " + setId);
    }

    @Override
    public byte[] fetchBytes(String url) throws TransportException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .GET()
                .build();
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                throw new TransportException("İndirme HTTP " + response.statusCode() + " döndü — URL: " + url,
                        response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new TransportException("İndirme başarısız — URL: " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("İndirme kesildi — URL: " + url, e);
        }
    }

    // ── Yardımcılar ──────────────────────────────────────────────────

    private List<JsonNode> listLocalizations(String versionId) throws MediaSyncException {
        return getAll("/v1/appStoreVersions/" + versionId + "/appStoreVersionLocalizations?limit="
                + properties.getPageLimit());
    }

    private String resolveLocalizationId(String versionId, String locale) throws MediaSyncException {
        for (JsonNode localization : listLocalizations(versionId)) {
            if (locale.equals(localization.path("attributes").path("locale").asText())) {
                return localization.path("id").asText();
            }
        }
        throw new RemoteNotFoundException("Sürümde '" + locale + "' lokalizasyonu yok");
    }

    /**
     * Sayfalı bir liste uç noktasını {@code links.next} bitene kadar okur.
     */
    private List<JsonNode> getAll(String path) throws MediaSyncException {
        List<JsonNode> items = new ArrayList<>();
        String next = path;
        while (next != null) {
            ApiResponse response = call("GET", next, null);
            expectSuccess(response, "Liste okunamadı: " + path);
            response.body().path("data").forEach(items::add);
            next = JsonApiMapper.textOrNull(response.body().path("links"), "next");
        }
        return items;
    }

    private ApiResponse call(String method, String pathOrUrl, JsonNode body) throws MediaSyncException {
        return call(method, pathOrUrl, body, true);
    }

    /**
     * İmzalı API çağrısı; {@code retryable} ise 429, 5xx ve bağlantı hatalarında tekrar dener.
     * <p>
     * Kaynak oluşturan POST'lar tekrar denenmez: ilk deneme sunucuda başarılı olmuş olabilir.
     * Bu durumda 429/5xx yanıtı çağırana olduğu gibi döner.
     */
    private ApiResponse call(String method, String pathOrUrl, JsonNode body, boolean retryable)
            throws MediaSyncException {
        URI uri = URI.create(pathOrUrl.startsWith("http")
                ? pathOrUrl
                : properties.getBaseUrl().replaceAll("/$", "") + pathOrUrl);
        int maxAttempts = retryable ? properties.getApiMaxAttempts() : 1;

        for (int attempt = 1; ; attempt++) {
            try {
                HttpRequest.Builder builder = HttpRequest.newBuilder()
                        .uri(uri)
                        .timeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                        .header("Authorization", "Bearer " + tokenProvider.bearerToken())
                        .header("Accept", "application/json");
                if (body != null) {
                    builder.header("Content-Type", "application/json")
                            .method(method, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
                } else {
                    builder.method(method, HttpRequest.BodyPublishers.noBody());
                }

                HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if ((status == 429 || status >= 500) && attempt < maxAttempts) {
                    log.warn("{} {} → HTTP {}, tekrar deneniyor ({}/{})", method, uri.getPath(), status,
                            attempt, maxAttempts);
                    backoff(attempt);
                    continue;
                }
                if (retryable && (status == 429 || status >= 500)) {
                    throw new TransportException(method + " " + uri.getPath() + " → HTTP " + status, status);
                }
                return new ApiResponse(status, parse(response.body()));
            } catch (IOException e) {
                if (attempt >= maxAttempts) {
                    throw new TransportException(method + " " + uri.getPath() + " başarısız: " + e.getMessage(), e);
                }
                log.warn("{} {} bağlantı hatası: {}, tekrar deneniyor ({}/{})", method, uri.getPath(),
                        e.getMessage(), attempt, maxAttempts);
                backoff(attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(method + " " + uri.getPath() + " kesildi", e);
            }
        }
    }

    private void backoff(int attempt) throws TransportException {
        long delay = properties.getRetryBackoffMs() * attempt;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Tekrar deneme beklemesi kesildi", e);
        }
    }

    private JsonNode parse(String body) throws IOException {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        return objectMapper.readTree(body);
    }

    private void expectSuccess(ApiResponse response, String context) throws MediaSyncException {
        int status = response.status();
        if (status / 100 == 2) {
            return;
        }
        String detail = jsonApi.errorDetail(response.body());
        if (status == 404) {
            throw new RemoteNotFoundException(context + " — bulunamadı " + detail);
        }
        throw new MediaSyncException(context + " — HTTP " + status + " " + detail);
    }

    private static String assetPath(AssetKind kind, String assetId) {
        return "/v1/" + JsonApiMapper.assetResourceType(kind) + "/" + assetId;
    }

    private static boolean mentionsChecksum(List<String> errors) {
        return errors.stream().anyMatch(e -> e.toLowerCase(Locale.ROOT).contains("checksum"));
    }

    static String videoMimeType(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String ext = dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        return VIDEO_MIME_TYPES.getOrDefault(ext, "video/mp4");
    }

    private record ApiResponse(int status, JsonNode body) {
    }
}
