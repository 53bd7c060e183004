package pro.kaleert.rasp.model;

public record Subgroup(int number, Week days) {
}
