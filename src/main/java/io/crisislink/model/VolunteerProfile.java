package io.crisislink.model;

import java.util.Set;

public record VolunteerProfile(Set<String> languages, Set<String> specializations) {
    public VolunteerProfile {
        languages = languages == null || languages.isEmpty() ? Set.of("en") : Set.copyOf(languages);
        specializations = specializations == null ? Set.of() : Set.copyOf(specializations);
    }

    public static VolunteerProfile general() {
        return new VolunteerProfile(Set.of("en"), Set.of());
    }
}
