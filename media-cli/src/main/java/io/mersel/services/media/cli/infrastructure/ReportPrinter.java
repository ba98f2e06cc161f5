package io.mersel.services.media.cli.infrastructure;

import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.models.AssetGroupKey;
import io.mersel.services.media.application.models.AssetStatus;
import io.mersel.services.media.application.models.ItemResult;
import io.mersel.services.media.application.models.LocalAssetFile;
import io.mersel.services.media.application.models.LocalAssetIndex;
import io.mersel.services.media.application.models.RemoteAssetSet;
import io.mersel.services.media.application.models.ScanWarning;
import io.mersel.services.media.application.models.SetVerification;
import io.mersel.services.media.application.models.SyncSummary;
import io.mersel.services.media.application.models.VerifyReport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plan, doğrulama raporu ve işlem özetlerinin konsol biçimi.
 */
@Component
public class ReportPrinter {

    private final ConsoleIO console;

    public ReportPrinter(ConsoleIO console) {
        this.console = console;
    }

    public void printWarnings(List<ScanWarning> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        warnings.forEach(w -> console.println("Warning: " + w.message()));
        console.println();
    }

    /**
     * Yükleme planı: locale başına display type ve dosya sayıları.
     */
    public void printPlan(LocalAssetIndex index, String versionId, boolean replace) {
        printWarnings(index.warnings());
        console.println("Version: " + versionId);
        console.println("Folder:  " + index.root());
        console.println("Mode:    " + (replace ? "Replace existing media" : "Append to existing media"));
        console.println();

        Map<String, Map<String, int[]>> byLocale = new LinkedHashMap<>();
        for (Map.Entry<AssetGroupKey, List<LocalAssetFile>> entry : index.groups().entrySet()) {
            AssetGroupKey key = entry.getKey();
            int[] counts = byLocale
                    .computeIfAbsent(key.locale(), l -> new LinkedHashMap<>())
                    .computeIfAbsent(key.displayType(), d -> new int[2]);
            counts[key.kind() == AssetKind.SCREENSHOT ? 0 : 1] += entry.getValue().size();
        }

        byLocale.forEach((locale, types) -> {
            console.println("[" + locale + "]");
            types.forEach((displayType, counts) -> {
                List<String> parts = new ArrayList<>();
                if (counts[0] > 0) {
                    parts.add(plural(counts[0], "screenshot"));
                }
                if (counts[1] > 0) {
                    parts.add(plural(counts[1], "preview"));
                }
                console.println("  " + displayType + ": " + String.join(", ", parts));
            });
        });
        console.println();
    }

    public void printSummary(SyncSummary summary) {
        console.println();
        for (ItemResult item : summary.getItems()) {
            if (item.outcome() == ItemResult.Outcome.FAILED) {
                console.println("  FAILED   " + item.item() + ": " + item.message());
            } else if (item.outcome() == ItemResult.Outcome.SKIPPED) {
                console.println("  SKIPPED  " + item.item() + ": " + item.message());
            }
        }
        console.println("Done. " + summary.succeeded() + " succeeded, " + summary.failed() + " failed, "
                + summary.skipped() + " skipped.");
    }

    /**
     * Tümü tamam olan setler tek satır, diğerleri öğe öğe yazılır.
     */
    public void printVerifyReport(VerifyReport report) {
        if (report.isEmpty()) {
            console.println("No media found for this version.");
            return;
        }
        for (SetVerification verification : report.sets()) {
            RemoteAssetSet set = verification.set();
            if (set.items().isEmpty()) {
                continue;
            }
            String label = "[" + set.locale() + "] " + set.displayType()
                    + (set.kind() == AssetKind.PREVIEW ? " (preview)" : "");
            if (verification.isCompact()) {
                int n = verification.statuses().size();
                console.println(label + ": " + n + "/" + n + " complete");
                continue;
            }
            console.println(label + ":");
            for (AssetStatus status : verification.statuses()) {
                String marker = status.classification() == AssetStatus.Classification.COMPLETE
                        ? "complete"
                        : status.asset().state().name();
                console.println("  #" + status.position() + "  " + status.asset().fileName() + "    " + marker);
            }
        }

        console.println();
        if (report.isAllComplete()) {
            console.println("All " + plural(report.total(), "media item") + " complete.");
        } else {
            console.println(report.completeCount() + " of " + report.total() + " complete, "
                    + report.stuckCount() + " stuck, " + report.failedCount() + " failed.");
        }
    }

    static String plural(long count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
