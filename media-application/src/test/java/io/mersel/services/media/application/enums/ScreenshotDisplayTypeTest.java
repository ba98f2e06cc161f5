package io.mersel.services.media.application.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScreenshotDisplayType")
class ScreenshotDisplayTypeTest {

    @Test
    @DisplayName("klasor_adi_eslesmesi — büyük/küçük harf duyarlı")
    void klasor_adi_eslesmesi() {
        assertThat(ScreenshotDisplayType.fromFolderName("APP_IPHONE_67")).contains(ScreenshotDisplayType.APP_IPHONE_67);
        assertThat(ScreenshotDisplayType.fromFolderName("app_iphone_67")).isEmpty();
        assertThat(ScreenshotDisplayType.fromFolderName("UNKNOWN")).isEmpty();
        assertThat(ScreenshotDisplayType.fromFolderName(null)).isEmpty();
    }

    @Test
    @DisplayName("onizleme_tipi — APP_ öneki kaldırılır")
    void onizleme_tipi() {
        assertThat(ScreenshotDisplayType.APP_IPHONE_67.previewType()).contains("IPHONE_67");
        assertThat(ScreenshotDisplayType.APP_IPAD_PRO_3GEN_129.previewType()).contains("IPAD_PRO_3GEN_129");
        assertThat(ScreenshotDisplayType.APP_APPLE_VISION_PRO.previewType()).contains("APPLE_VISION_PRO");
    }

    @Test
    @DisplayName("yalnizca_ekran_goruntusu — Watch ve iMessage önizleme kabul etmez")
    void yalnizca_ekran_goruntusu() {
        assertThat(ScreenshotDisplayType.APP_WATCH_ULTRA.isScreenshotOnly()).isTrue();
        assertThat(ScreenshotDisplayType.APP_WATCH_ULTRA.previewType()).isEmpty();
        assertThat(ScreenshotDisplayType.IMESSAGE_APP_IPHONE_67.isScreenshotOnly()).isTrue();
        assertThat(ScreenshotDisplayType.IMESSAGE_APP_IPHONE_67.previewType()).isEmpty();
        assertThat(ScreenshotDisplayType.APP_DESKTOP.isScreenshotOnly()).isFalse();
    }

    @Test
    @DisplayName("cift_yonlu_donusum — klasör adı ↔ önizleme tipi")
    void cift_yonlu_donusum() {
        assertThat(ScreenshotDisplayType.folderNameForPreviewType("IPHONE_65")).isEqualTo("APP_IPHONE_65");
        assertThat(ScreenshotDisplayType.previewTypeForFolderName("APP_IPHONE_65")).isEqualTo("IPHONE_65");
        assertThatThrownBy(() -> ScreenshotDisplayType.previewTypeForFolderName("APP_WATCH_SERIES_7"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("teslim_durumu_ayristirma — tanınmayan değer UNKNOWN")
    void teslim_durumu_ayristirma() {
        assertThat(AssetDeliveryState.fromApiValue("COMPLETE")).isEqualTo(AssetDeliveryState.COMPLETE);
        assertThat(AssetDeliveryState.fromApiValue("upload_complete")).isEqualTo(AssetDeliveryState.UPLOAD_COMPLETE);
        assertThat(AssetDeliveryState.fromApiValue("PROCESSING")).isEqualTo(AssetDeliveryState.UNKNOWN);
        assertThat(AssetDeliveryState.fromApiValue(null)).isEqualTo(AssetDeliveryState.UNKNOWN);
    }

    @Test
    @DisplayName("teslim_durumu_turkce_locale — varsayılan locale tr-TR iken de 'failed' FAILED olur")
    void teslim_durumu_turkce_locale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(AssetDeliveryState.fromApiValue("failed")).isEqualTo(AssetDeliveryState.FAILED);
            assertThat(AssetDeliveryState.fromApiValue("awaiting_upload")).isEqualTo(AssetDeliveryState.AWAITING_UPLOAD);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
