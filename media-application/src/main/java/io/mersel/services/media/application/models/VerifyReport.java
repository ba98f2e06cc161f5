package io.mersel.services.media.application.models;

import java.util.List;

/**
 * Bir sürümün tüm setleri için doğrulama raporu. Salt okunurdur.
 *
 * @param versionId Doğrulanan sürüm
 * @param sets      Locale ve display type'a göre sıralı set sonuçları
 */
public record VerifyReport(String versionId, List<SetVerification> sets) {

    public int total() {
        return sets.stream().mapToInt(s -> s.statuses().size()).sum();
    }

    public long stuckCount() {
        return sets.stream().mapToLong(SetVerification::stuckCount).sum();
    }

    public long failedCount() {
        return sets.stream().mapToLong(SetVerification::failedCount).sum();
    }

    public long completeCount() {
        return total() - stuckCount() - failedCount();
    }

    public boolean isAllComplete() {
        return sets.stream().allMatch(SetVerification::isCompact);
    }

    public boolean isEmpty() {
        return total() == 0;
    }

    /** Onarım adayı olan (stuck veya failed) öğeleri içeren setler. */
    public List<SetVerification> setsNeedingAttention() {
        return sets.stream().filter(s -> !s.isCompact()).toList();
    }
}
