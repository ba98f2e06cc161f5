package io.mersel.services.media.application.models;

import java.util.List;

/**
 * Rezervasyon (reserve) çağrısının sonucu: {@code AWAITING_UPLOAD} durumunda yeni asset
 * ve aktarılması gereken byte aralıkları.
 */
public record AssetReservation(String assetId, List<UploadOperation> operations) {
}
