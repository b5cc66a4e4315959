package io.crisislink.model;

public record ConnectionInfo(
        String participantId,
        Role role,
        boolean authenticated,
        String language
) {
    public ConnectionInfo {
        if (participantId == null || participantId.isBlank()) {
            throw new IllegalArgumentException("participantId cannot be empty");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        participantId = participantId.trim();
        language = language == null || language.isBlank() ? "en" : language.trim();
    }

    public static ConnectionInfo anonymousPerson(String participantId) {
        return new ConnectionInfo(participantId, Role.PERSON_IN_CRISIS, false, "en");
    }

    public static ConnectionInfo volunteer(String participantId, String language) {
        return new ConnectionInfo(participantId, Role.VOLUNTEER, true, language);
    }
}
