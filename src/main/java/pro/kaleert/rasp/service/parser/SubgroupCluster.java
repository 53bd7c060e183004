package pro.kaleert.rasp.service.parser;

import java.util.List;

/**
 * Columns of one group in the subgroup header. No numbers means a single column without subgroups.
 */
public record SubgroupCluster(List<Integer> numbers) {

    private static final SubgroupCluster SINGLE = new SubgroupCluster(List.of());

    public SubgroupCluster {
        numbers = List.copyOf(numbers);
    }

    public static SubgroupCluster single() {
        return SINGLE;
    }

    public static SubgroupCluster numbered(List<Integer> numbers) {
        if (numbers.isEmpty()) {
            throw new IllegalArgumentException("Numbered cluster needs at least one subgroup");
        }
        return new SubgroupCluster(numbers);
    }

    public boolean hasSubgroups() {
        return !numbers.isEmpty();
    }

    public int columnCount() {
        return hasSubgroups() ? numbers.size() : 1;
    }

    public static int totalColumns(List<SubgroupCluster> clusters) {
        return clusters.stream().mapToInt(SubgroupCluster::columnCount).sum();
    }
}
