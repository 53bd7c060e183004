package pro.kaleert.rasp.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Schedule shape of a group: either split into numbered subgroups or a single week.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WeekInfo.WithSubgroups.class, name = "WITH_SUBGROUPS"),
        @JsonSubTypes.Type(value = WeekInfo.WithoutSubgroup.class, name = "WITHOUT_SUBGROUP")
})
public sealed interface WeekInfo permits WeekInfo.WithSubgroups, WeekInfo.WithoutSubgroup {

    /**
     * Number of week-columns the group occupies in the sheet.
     */
    int columnCount();

    record WithSubgroups(List<Subgroup> subgroups) implements WeekInfo {

        public WithSubgroups {
            if (subgroups == null || subgroups.isEmpty()) {
                throw new IllegalArgumentException("Group with subgroups needs at least one subgroup");
            }
            subgroups = List.copyOf(subgroups);
        }

        @Override
        public int columnCount() {
            return subgroups.size();
        }
    }

    record WithoutSubgroup(Week week) implements WeekInfo {

        @Override
        public int columnCount() {
            return 1;
        }
    }
}
