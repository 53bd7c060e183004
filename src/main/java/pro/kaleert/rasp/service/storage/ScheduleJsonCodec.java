package pro.kaleert.rasp.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import pro.kaleert.rasp.config.RaspConfig;
import pro.kaleert.rasp.model.Course;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes a parsed workbook (its list of courses) as JSON.
 */
@Component
@RequiredArgsConstructor
public class ScheduleJsonCodec {

    private static final TypeReference<List<Course>> COURSES = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final RaspConfig properties;

    public String toJson(List<Course> courses) {
        try {
            return writer().writeValueAsString(courses);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize schedule", e);
        }
    }

    public List<Course> fromJson(String json) {
        try {
            return objectMapper.readValue(json, COURSES);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a parsed schedule: " + e.getOriginalMessage(), e);
        }
    }

    public void write(List<Course> courses, Path target) {
        try {
            writer().writeValue(target.toFile(), courses);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write schedule to " + target, e);
        }
    }

    public List<Course> read(Path source) {
        try {
            return objectMapper.readValue(Files.readAllBytes(source), COURSES);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read schedule from " + source, e);
        }
    }

    private ObjectWriter writer() {
        ObjectWriter writer = objectMapper.writerFor(COURSES);
        return properties.isPrettyJson() ? writer.withDefaultPrettyPrinter() : writer;
    }
}
