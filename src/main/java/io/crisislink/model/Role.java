package io.crisislink.model;

public enum Role {
    PERSON_IN_CRISIS,
    VOLUNTEER,
    SUPERVISOR;

    public boolean requiresAuthentication() {
        return this != PERSON_IN_CRISIS;
    }
}
