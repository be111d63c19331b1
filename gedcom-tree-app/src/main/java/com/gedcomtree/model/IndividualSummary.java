package com.gedcomtree.model;

/**
 * Flat view of an individual record for API responses.
 */
public record IndividualSummary(
    String pointer,
    String givenName,
    String surname,
    String gender,
    Integer birthYear,
    Integer deathYear
) {
    public static IndividualSummary of(IndividualElement individual) {
        PersonName name = individual.getName();
        int birth = individual.getBirthYear();
        int death = individual.getDeathYear();
        return new IndividualSummary(
            individual.getPointer(),
            name.given(),
            name.surname(),
            individual.getGender(),
            birth >= 0 ? birth : null,
            death >= 0 ? death : null
        );
    }
}
