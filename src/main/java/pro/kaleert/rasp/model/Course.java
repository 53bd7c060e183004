package pro.kaleert.rasp.model;

import java.util.List;
import java.util.Optional;

/**
 * Everything parsed from one sheet. {@code name} is the sheet name.
 */
public record Course(String name, List<GroupInfo> groups) {

    public Course {
        groups = List.copyOf(groups);
    }

    public Optional<GroupInfo> findGroup(String groupName) {
        return groups.stream()
                .filter(group -> group.name().equals(groupName))
                .findFirst();
    }
}
