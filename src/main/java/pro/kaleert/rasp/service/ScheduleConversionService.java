package pro.kaleert.rasp.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import pro.kaleert.rasp.config.RaspConfig;
import pro.kaleert.rasp.model.Course;
import pro.kaleert.rasp.service.parser.ScheduleParserService;
import pro.kaleert.rasp.service.parser.WorkbookGridReader;
import pro.kaleert.rasp.service.parser.grid.SheetGrid;
import pro.kaleert.rasp.service.storage.ScheduleJsonCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Converts spreadsheets dropped into the raw directory into JSON files in the parsed directory.
 * A spreadsheet is converted once: if {@code <name>.json} already exists it is left alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleConversionService {

    static final String PARSED_EXTENSION = ".json";

    private final RaspConfig properties;
    private final WorkbookGridReader gridReader;
    private final ScheduleParserService parserService;
    private final ScheduleJsonCodec codec;

    @Scheduled(fixedDelayString = "${rasp.scheduler.check-interval:600000}")
    public void checkRawDirectory() {
        if (!properties.getScheduler().isEnabled()) {
            return;
        }
        ConversionReport report = convertPending();
        if (report.hasChanges()) {
            log.info("Conversion pass: {} converted, {} skipped, {} failed",
                    report.converted().size(), report.skipped().size(), report.failed().size());
        } else {
            log.debug("Conversion pass: nothing new");
        }
    }

    public ConversionReport convertPending() {
        return convertPending(Path.of(properties.getRawDir()), Path.of(properties.getParsedDir()));
    }

    public ConversionReport convertPending(Path rawDir, Path parsedDir) {
        if (!Files.isDirectory(rawDir)) {
            log.warn("Raw schedule directory {} doesn't exist", rawDir.toAbsolutePath());
            return ConversionReport.empty();
        }
        try {
            Files.createDirectories(parsedDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create " + parsedDir, e);
        }

        List<Path> converted = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        Map<Path, String> failed = new LinkedHashMap<>();

        for (Path source : listSpreadsheets(rawDir)) {
            Path target = parsedDir.resolve(baseName(source) + PARSED_EXTENSION);
            if (Files.exists(target)) {
                skipped.add(source);
                continue;
            }
            try {
                convert(source, target);
                converted.add(source);
            } catch (RuntimeException e) {
                log.error("Failed to convert {}", source.getFileName(), e);
                failed.put(source, e.getMessage());
            }
        }
        return new ConversionReport(converted, skipped, failed);
    }

    public List<Course> convert(Path source, Path target) {
        log.info("Parsing {}", source.getFileName());
        List<SheetGrid> sheets = gridReader.read(source);
        List<Course> courses = parserService.parse(sheets);
        codec.write(courses, target);
        log.info("Saved {} -> {}", source.getFileName(), target.getFileName());
        return courses;
    }

    private static List<Path> listSpreadsheets(Path rawDir) {
        try (Stream<Path> files = Files.list(rawDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> !file.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + rawDir, e);
        }
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
