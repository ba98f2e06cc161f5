package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.enums.AssetDeliveryState;
import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.interfaces.MediaSyncException;
import io.mersel.services.media.application.models.AssetGroupKey;
import io.mersel.services.media.application.models.ItemResult;
import io.mersel.services.media.application.models.LocalAssetFile;
import io.mersel.services.media.application.models.LocalAssetIndex;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.application.models.RemoteAssetSet;
import io.mersel.services.media.application.models.VerifyReport;
import io.mersel.services.media.infrastructure.diagnostics.MediaSyncMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssetRepairCoordinator")
class AssetRepairCoordinatorTest {

    private static final AssetGroupKey GROUP = new AssetGroupKey("en-US", "APP_IPHONE_67", AssetKind.SCREENSHOT);

    @Mock
    private IMediaApiClient apiClient;

    @Mock
    private AssetUploadPipeline uploadPipeline;

    @Mock
    private SetReorderCoordinator reorderCoordinator;

    @Mock
    private MediaSyncMetrics metrics;

    private AssetRepairCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new AssetRepairCoordinator(apiClient, uploadPipeline, reorderCoordinator, metrics);
    }

    private static RemoteAsset asset(String id, AssetDeliveryState state) {
        return new RemoteAsset(id, id + ".png", 10, null, state, null, List.of());
    }

    private static LocalAssetIndex localFiles(int count) {
        List<LocalAssetFile> files = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            files.add(new LocalAssetFile(Path.of("/media/en-US/APP_IPHONE_67/" + i + ".png"),
                    "en-US", "APP_IPHONE_67", AssetKind.SCREENSHOT, i, i + ".png", 10));
        }
        return new LocalAssetIndex(Path.of("/media"), Map.of(GROUP, files), List.of());
    }

    private static VerifyReport report(List<RemoteAsset> items) {
        RemoteAssetSet set = new RemoteAssetSet("set-1", "en-US", "APP_IPHONE_67", AssetKind.SCREENSHOT, items);
        return new VerifyReport("v1", List.of(AssetStateVerifier.verifySet(set)));
    }

    @Test
    @DisplayName("kardinalite_uyusmazligi — 3 uzak / 2 yerel: hiçbir şey silinmez")
    void kardinalite_uyusmazligi() throws Exception {
        List<RemoteAsset> items = List.of(asset("r1", AssetDeliveryState.COMPLETE),
                asset("r2", AssetDeliveryState.UPLOAD_COMPLETE), asset("r3", AssetDeliveryState.COMPLETE));
        when(apiClient.listAssets("set-1", AssetKind.SCREENSHOT)).thenReturn(items);

        List<ItemResult> results = coordinator.repair(report(items), localFiles(2));

        assertThat(results).singleElement()
                .satisfies(r -> {
                    assertThat(r.outcome()).isEqualTo(ItemResult.Outcome.FAILED);
                    assertThat(r.message()).contains("yerel=2").contains("uzak=3");
                });
        verify(apiClient, never()).deleteAsset(anyString(), any());
        verify(uploadPipeline, never()).upload(any(), anyString());
        verify(reorderCoordinator, never()).reorder(anyString(), any(), anyList());
    }

    @Test
    @DisplayName("pozisyona_gore_onarim — sil, aynı pozisyondaki dosyayı yükle, sırayı geri yükle")
    void pozisyona_gore_onarim() throws Exception {
        List<RemoteAsset> items = List.of(asset("r1", AssetDeliveryState.COMPLETE),
                asset("r2", AssetDeliveryState.UPLOAD_COMPLETE), asset("r3", AssetDeliveryState.COMPLETE));
        LocalAssetIndex index = localFiles(3);
        when(apiClient.listAssets("set-1", AssetKind.SCREENSHOT)).thenReturn(items);
        when(uploadPipeline.upload(index.fileAt(GROUP, 2).orElseThrow(), "set-1"))
                .thenReturn(asset("n2", AssetDeliveryState.UPLOAD_COMPLETE));

        List<ItemResult> results = coordinator.repair(report(items), index);

        assertThat(results).singleElement()
                .satisfies(r -> assertThat(r.outcome()).isEqualTo(ItemResult.Outcome.SUCCEEDED));
        InOrder order = inOrder(apiClient, uploadPipeline, reorderCoordinator);
        order.verify(apiClient).deleteAsset("r2", AssetKind.SCREENSHOT);
        order.verify(uploadPipeline).upload(index.fileAt(GROUP, 2).orElseThrow(), "set-1");
        order.verify(reorderCoordinator).reorder("set-1", AssetKind.SCREENSHOT, List.of("r1", "n2", "r3"));
        verify(metrics).recordRepair(true);
    }

    @Test
    @DisplayName("silme_basarisiz — o öğe yeniden yüklenmez, sıralama yapılmaz")
    void silme_basarisiz() throws Exception {
        List<RemoteAsset> items = List.of(asset("r1", AssetDeliveryState.UPLOAD_COMPLETE));
        when(apiClient.listAssets("set-1", AssetKind.SCREENSHOT)).thenReturn(items);
        doThrow(new MediaSyncException("reddedildi")).when(apiClient).deleteAsset("r1", AssetKind.SCREENSHOT);

        List<ItemResult> results = coordinator.repair(report(items), localFiles(1));

        assertThat(results).singleElement()
                .satisfies(r -> assertThat(r.message()).contains("silme başarısız"));
        verify(uploadPipeline, never()).upload(any(), anyString());
        verify(reorderCoordinator, never()).reorder(anyString(), any(), anyList());
    }

    @Test
    @DisplayName("yukleme_basarisiz — silinen öğe sıradan çıkarılır, diğerleri sıralanır")
    void yukleme_basarisiz() throws Exception {
        List<RemoteAsset> items = List.of(asset("r1", AssetDeliveryState.FAILED),
                asset("r2", AssetDeliveryState.COMPLETE));
        when(apiClient.listAssets("set-1", AssetKind.SCREENSHOT)).thenReturn(items);
        when(uploadPipeline.upload(any(), anyString())).thenThrow(new MediaSyncException("ağ hatası"));

        List<ItemResult> results = coordinator.repair(report(items), localFiles(2));

        assertThat(results).singleElement()
                .satisfies(r -> assertThat(r.outcome()).isEqualTo(ItemResult.Outcome.FAILED));
        verify(reorderCoordinator).reorder("set-1", AssetKind.SCREENSHOT, List.of("r2"));
        verify(metrics).recordRepair(false);
    }

    @Test
    @DisplayName("rapor_eski — artık sette olmayan öğe atlanır")
    void rapor_eski() throws Exception {
        List<RemoteAsset> reported = List.of(asset("old", AssetDeliveryState.UPLOAD_COMPLETE));
        when(apiClient.listAssets("set-1", AssetKind.SCREENSHOT))
                .thenReturn(List.of(asset("fresh", AssetDeliveryState.COMPLETE)));

        List<ItemResult> results = coordinator.repair(report(reported), localFiles(1));

        assertThat(results).singleElement()
                .satisfies(r -> assertThat(r.outcome()).isEqualTo(ItemResult.Outcome.SKIPPED));
        verify(apiClient, never()).deleteAsset(anyString(), any());
    }
}
