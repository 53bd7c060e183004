package pro.kaleert.rasp.service.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pro.kaleert.rasp.config.RaspConfig;
import pro.kaleert.rasp.model.Course;
import pro.kaleert.rasp.model.ScheduleModelFixtures;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleJsonCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ScheduleJsonCodec codec = new ScheduleJsonCodec(objectMapper, new RaspConfig());

    private final List<Course> courses = List.of(
            ScheduleModelFixtures.sampleCourse("1 курс"),
            ScheduleModelFixtures.sampleCourse("2 курс"),
            new Course("3 курс", List.of()),
            ScheduleModelFixtures.sampleCourse("4 курс"));

    @Test
    void roundTripsThroughString() {
        assertThat(codec.fromJson(codec.toJson(courses))).isEqualTo(courses);
    }

    @Test
    void roundTripsThroughFile(@TempDir Path dir) {
        Path file = dir.resolve("itkn.json");

        codec.write(courses, file);

        assertThat(file).exists();
        assertThat(codec.read(file)).isEqualTo(courses);
    }

    @Test
    void tagsUnionsAndKeepsEmptySlotsAsNull() throws Exception {
        JsonNode root = objectMapper.readTree(codec.toJson(courses));
        JsonNode groups = root.get(0).get("groups");

        JsonNode split = groups.get(0).get("subgroups");
        assertThat(split.get("kind").asText()).isEqualTo("WITH_SUBGROUPS");
        JsonNode week = split.get("subgroups").get(0).get("days");
        assertThat(week.isArray()).isTrue();
        assertThat(week.size()).isEqualTo(7);
        JsonNode monday = week.get(0);
        assertThat(monday.get("upperClasses").get(0).get("type").get("kind").asText()).isEqualTo("LECTURE");
        assertThat(monday.get("upperClasses").get(0).get("type").has("label")).isFalse();
        assertThat(monday.get("upperClasses").get(1).isNull()).isTrue();

        JsonNode whole = groups.get(1).get("subgroups");
        assertThat(whole.get("kind").asText()).isEqualTo("WITHOUT_SUBGROUP");
        assertThat(whole.get("week").size()).isEqualTo(7);

        JsonNode sport = groups.get(2).get("subgroups").get("week").get(5).get("lowerClasses").get(1);
        assertThat(sport.get("type").get("label").asText()).isEqualTo("Секция");
        assertThat(sport.get("teacher").isNull()).isTrue();
    }

    @Test
    void compactOutputWhenPrettyPrintingIsOff() {
        RaspConfig config = new RaspConfig();
        config.setPrettyJson(false);

        assertThat(new ScheduleJsonCodec(objectMapper, config).toJson(courses)).doesNotContain("\n");
        assertThat(codec.toJson(courses)).contains("\n");
    }

    @Test
    void rejectsForeignJson() {
        assertThatThrownBy(() -> codec.fromJson("{\"name\": \"not a list\"}"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
