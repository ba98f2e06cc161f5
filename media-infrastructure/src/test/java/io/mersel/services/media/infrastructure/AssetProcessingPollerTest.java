package io.mersel.services.media.infrastructure;

import io.mersel.services.media.application.enums.AssetDeliveryState;
import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.interfaces.IMediaApiClient;
import io.mersel.services.media.application.models.ProcessingPollResult;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.infrastructure.config.MediaSyncProperties;
import io.mersel.services.media.infrastructure.diagnostics.MediaSyncMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AssetProcessingPoller")
class AssetProcessingPollerTest {

    /** Uyku çağrısıyla ilerleyen sahte saat. */
    private static final class SteppingClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(long millis) {
            now = now.plusMillis(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private IMediaApiClient apiClient;
    private MediaSyncMetrics metrics;
    private SteppingClock clock;
    private AssetProcessingPoller poller;

    @BeforeEach
    void setUp() {
        apiClient = mock(IMediaApiClient.class);
        metrics = mock(MediaSyncMetrics.class);
        clock = new SteppingClock();
        var properties = new MediaSyncProperties();
        properties.setPollIntervalMs(1000);
        properties.setPollTimeoutMs(3000);
        poller = new AssetProcessingPoller(apiClient, properties, metrics, clock, clock::advance);
    }

    private static RemoteAsset asset(AssetDeliveryState state) {
        return new RemoteAsset("a1", "home.png", 10, null, state, null, List.of("IMAGE_INCORRECT_DIMENSIONS"));
    }

    @Test
    @DisplayName("tamamlanana_kadar_bekler — ikinci okumada COMPLETE")
    void tamamlanana_kadar_bekler() throws Exception {
        when(apiClient.fetchAsset("a1", AssetKind.SCREENSHOT))
                .thenReturn(asset(AssetDeliveryState.UPLOAD_COMPLETE), asset(AssetDeliveryState.COMPLETE));

        ProcessingPollResult result = poller.await("a1", AssetKind.SCREENSHOT);

        assertThat(result.status()).isEqualTo(ProcessingPollResult.Status.COMPLETE);
        assertThat(result.attempts()).isEqualTo(2);
        verify(metrics).recordProcessingWait(eq("complete"), anyLong());
    }

    @Test
    @DisplayName("failed_durumu — hata kodlarıyla döner")
    void failed_durumu() throws Exception {
        when(apiClient.fetchAsset("a1", AssetKind.SCREENSHOT)).thenReturn(asset(AssetDeliveryState.FAILED));

        ProcessingPollResult result = poller.await("a1", AssetKind.SCREENSHOT);

        assertThat(result.status()).isEqualTo(ProcessingPollResult.Status.FAILED);
        assertThat(result.asset().errors()).containsExactly("IMAGE_INCORRECT_DIMENSIONS");
    }

    @Test
    @DisplayName("sure_dolar — sınırlı sayıda okuma sonrası TIMED_OUT")
    void sure_dolar() throws Exception {
        when(apiClient.fetchAsset("a1", AssetKind.SCREENSHOT)).thenReturn(asset(AssetDeliveryState.UPLOAD_COMPLETE));

        ProcessingPollResult result = poller.await("a1", AssetKind.SCREENSHOT);

        assertThat(result.status()).isEqualTo(ProcessingPollResult.Status.TIMED_OUT);
        assertThat(result.attempts()).isEqualTo(3);
        verify(apiClient, times(3)).fetchAsset("a1", AssetKind.SCREENSHOT);
    }

    @Test
    @DisplayName("cagiran_araligi — verilen aralık ve süre kullanılır")
    void cagiran_araligi() throws Exception {
        when(apiClient.fetchAsset("a1", AssetKind.PREVIEW)).thenReturn(asset(AssetDeliveryState.UPLOAD_COMPLETE));

        ProcessingPollResult result = poller.await("a1", AssetKind.PREVIEW,
                Duration.ofMillis(100), Duration.ofMillis(1000));

        assertThat(result.status()).isEqualTo(ProcessingPollResult.Status.TIMED_OUT);
        assertThat(result.attempts()).isEqualTo(10);
    }
}
