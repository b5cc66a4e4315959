package io.crisislink.model;

public record VolunteerRequest(String language, String specialization) {
    public static VolunteerRequest any() {
        return new VolunteerRequest(null, null);
    }
}
