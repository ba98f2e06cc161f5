package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.models.AssetGroupKey;
import io.mersel.services.media.application.models.RemoteAssetSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RemoteSetResolver")
class RemoteSetResolverTest {

    private static final AssetGroupKey KEY = new AssetGroupKey("en-US", "APP_IPHONE_67", AssetKind.PREVIEW);

    private IMediaApiClient apiClient;
    private RemoteSetResolver resolver;

    @BeforeEach
    void setUp() {
        apiClient = mock(IMediaApiClient.class);
        resolver = new RemoteSetResolver(apiClient);
    }

    @Test
    @DisplayName("bos_set_mevcut — boş set yeniden oluşturulmaz")
    void bos_set_mevcut() throws Exception {
        RemoteAssetSet empty = new RemoteAssetSet("set-1", "en-US", "APP_IPHONE_67", AssetKind.PREVIEW, List.of());

        RemoteAssetSet resolved = resolver.resolveOrCreate("v1", List.of(empty), KEY);

        assertThat(resolved.id()).isEqualTo("set-1");
        verify(apiClient, never()).createSet(anyString(), anyString(), anyString(), any());
        verify(apiClient, never()).listSets(anyString());
    }

    @Test
    @DisplayName("tur_farkli — aynı display type'ın ekran görüntüsü seti önizleme seti yerine geçmez")
    void tur_farkli() throws Exception {
        RemoteAssetSet screenshots = new RemoteAssetSet("set-s", "en-US", "APP_IPHONE_67",
                AssetKind.SCREENSHOT, List.of());
        when(apiClient.listSets("v1")).thenReturn(List.of(screenshots));
        when(apiClient.createSet("v1", "en-US", "APP_IPHONE_67", AssetKind.PREVIEW)).thenReturn("set-p");

        RemoteAssetSet resolved = resolver.resolveOrCreate("v1", List.of(screenshots), KEY);

        assertThat(resolved.id()).isEqualTo("set-p");
        assertThat(resolved.items()).isEmpty();
    }

    @Test
    @DisplayName("olusturmadan_once_tekrar_kontrol — arada oluşmuş set kullanılır")
    void olusturmadan_once_tekrar_kontrol() throws Exception {
        RemoteAssetSet concurrent = new RemoteAssetSet("set-x", "en-US", "APP_IPHONE_67", AssetKind.PREVIEW, List.of());
        when(apiClient.listSets("v1")).thenReturn(List.of(concurrent));

        RemoteAssetSet resolved = resolver.resolveOrCreate("v1", List.of(), KEY);

        assertThat(resolved.id()).isEqualTo("set-x");
        verify(apiClient, never()).createSet(anyString(), anyString(), anyString(), any());
    }
}
