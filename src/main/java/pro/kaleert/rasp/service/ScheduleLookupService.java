package pro.kaleert.rasp.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import pro.kaleert.rasp.config.RaspConfig;
import pro.kaleert.rasp.model.Course;
import pro.kaleert.rasp.model.GroupInfo;
import pro.kaleert.rasp.model.Subgroup;
import pro.kaleert.rasp.service.storage.ScheduleJsonCodec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Finds groups and subgroups in converted schedules.
 */
@Service
@RequiredArgsConstructor
public class ScheduleLookupService {

    private final RaspConfig properties;
    private final ScheduleJsonCodec codec;

    public List<Course> load(String scheduleName) {
        if (scheduleName == null || scheduleName.isBlank()) {
            throw new IllegalArgumentException("Укажите имя расписания.");
        }
        Path file = Path.of(properties.getParsedDir()).resolve(scheduleName + ScheduleConversionService.PARSED_EXTENSION);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Расписание '" + scheduleName + "' не найдено.");
        }
        return codec.read(file);
    }

    public GroupInfo findGroup(String scheduleName, int courseIndex, String groupName) {
        List<Course> courses = load(scheduleName);
        if (courseIndex < 0 || courseIndex >= courses.size()) {
            throw new IllegalArgumentException("Нет курса с номером " + courseIndex + ".");
        }
        Course course = courses.get(courseIndex);
        return course.findGroup(groupName)
                .orElseThrow(() -> new IllegalArgumentException("Группа " + groupName + " не найдена в курсе " + course.name() + "."));
    }

    public Subgroup findSubgroup(String scheduleName, int courseIndex, String groupName, int subgroupNumber) {
        GroupInfo group = findGroup(scheduleName, courseIndex, groupName);
        return group.findSubgroup(subgroupNumber)
                .orElseThrow(() -> new IllegalArgumentException("У группы " + groupName + " нет подгруппы " + subgroupNumber + "."));
    }
}
