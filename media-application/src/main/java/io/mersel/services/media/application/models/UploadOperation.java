package io.mersel.services.media.application.models;

import java.util.Map;

/**
 * Rezervasyon yanıtındaki tek bir presigned byte aralığı aktarımı.
 *
 * @param method  HTTP metodu (genellikle PUT)
 * @param url     Presigned hedef URL (istemci imzalamaz)
 * @param offset  Dosya içindeki başlangıç ofseti
 * @param length  Aralık uzunluğu (byte)
 * @param headers Aynen gönderilmesi gereken başlıklar
 */
public record UploadOperation(
        String method,
        String url,
        long offset,
        long length,
        Map<String, String> headers
) {
}
