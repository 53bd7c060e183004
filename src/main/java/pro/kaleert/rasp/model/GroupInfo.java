package pro.kaleert.rasp.model;

import java.util.Optional;

public record GroupInfo(String name, WeekInfo subgroups) {

    /**
     * Empty both when the number is absent and when the group isn't split into subgroups.
     */
    public Optional<Subgroup> findSubgroup(int number) {
        if (subgroups instanceof WeekInfo.WithSubgroups withSubgroups) {
            return withSubgroups.subgroups().stream()
                    .filter(subgroup -> subgroup.number() == number)
                    .findFirst();
        }
        return Optional.empty();
    }
}
