package pro.kaleert.rasp.service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one pass over the raw schedule directory. {@code failed} maps a source file to the error message.
 */
public record ConversionReport(List<Path> converted, List<Path> skipped, Map<Path, String> failed) {

    public ConversionReport {
        converted = List.copyOf(converted);
        skipped = List.copyOf(skipped);
        failed = Map.copyOf(failed);
    }

    public static ConversionReport empty() {
        return new ConversionReport(List.of(), List.of(), Map.of());
    }

    public boolean hasChanges() {
        return !converted.isEmpty() || !failed.isEmpty();
    }
}
