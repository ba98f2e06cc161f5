package io.mersel.services.media.application.models;

/**
 * Tarama sırasında atlanan bir dosya veya klasör. Ölümcül değildir, sadece raporlanır.
 *
 * @param locale      Locale klasörü
 * @param displayType Display type klasörü ({@code null} olabilir)
 * @param fileName    Atlanan dosya ({@code null} ise klasörün tamamı atlandı)
 * @param reason      İnsan tarafından okunabilir neden
 */
public record ScanWarning(String locale, String displayType, String fileName, String reason) {

    public String message() {
        StringBuilder sb = new StringBuilder("[").append(locale);
        if (displayType != null) {
            sb.append("/").append(displayType);
        }
        sb.append("] ");
        if (fileName != null) {
            sb.append("'").append(fileName).append("' atlandı: ");
        }
        return sb.append(reason).toString();
    }
}
