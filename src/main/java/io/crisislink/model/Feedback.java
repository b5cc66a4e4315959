package io.crisislink.model;

public record Feedback(Integer rating, String comment) {
    public Feedback {
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new IllegalArgumentException("rating must be between 1 and 5");
        }
    }

    public static Feedback none() {
        return new Feedback(null, null);
    }
}
