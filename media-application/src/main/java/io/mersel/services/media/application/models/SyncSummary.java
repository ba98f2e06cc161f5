package io.mersel.services.media.application.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Bir komutun öğe bazında özeti.
 * <p>
 * Her komut başarılı / başarısız / atlanan sayılarıyla biter. Öğe hataları kardeş öğelerin
 * işlenmesini durdurmaz; burada toplanır.
 */
public class SyncSummary {

    private final String operation;
    private final List<ItemResult> items;
    private final List<ScanWarning> warnings;
    private final long durationMs;

    private SyncSummary(Builder builder) {
        this.operation = builder.operation;
        this.items = List.copyOf(builder.items);
        this.warnings = List.copyOf(builder.warnings);
        this.durationMs = builder.durationMs;
    }

    /** Komut adı ("upload", "download", "repair"). */
    public String getOperation() {
        return operation;
    }

    public List<ItemResult> getItems() {
        return items;
    }

    public List<ScanWarning> getWarnings() {
        return warnings;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public int succeeded() {
        return count(ItemResult.Outcome.SUCCEEDED);
    }

    public int failed() {
        return count(ItemResult.Outcome.FAILED);
    }

    public int skipped() {
        return count(ItemResult.Outcome.SKIPPED);
    }

    /** Hiçbir öğe başarısız olmadıysa {@code true}; atlananlar ve uyarılar başarıyı bozmaz. */
    public boolean isSuccessful() {
        return failed() == 0;
    }

    private int count(ItemResult.Outcome outcome) {
        return (int) items.stream().filter(i -> i.outcome() == outcome).count();
    }

    public static Builder builder(String operation) {
        return new Builder(operation);
    }

    public static class Builder {
        private final String operation;
        private final List<ItemResult> items = new ArrayList<>();
        private final List<ScanWarning> warnings = new ArrayList<>();
        private long durationMs;

        private Builder(String operation) {
            this.operation = operation;
        }

        public Builder add(ItemResult item) {
            this.items.add(item);
            return this;
        }

        public Builder addAll(List<ItemResult> items) {
            this.items.addAll(items);
            return this;
        }

        public Builder warnings(List<ScanWarning> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public SyncSummary build() {
            return new SyncSummary(this);
        }
    }
}
