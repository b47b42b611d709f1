package com.fbo.reconciliation.core.model;

/**
 * Services an FBO may offer. Amenities are additive: once any source confirms one,
 * merged records keep it.
 */
public enum Amenity {
    CREW_CAR("Crew Car"),
    CREW_LOUNGE("Lounge"),
    CATERING("Catering"),
    MAINTENANCE("Mx"),
    HANGARS("Hangars"),
    DEICE("Deice"),
    OXYGEN("Oxygen"),
    GROUND_POWER("GPU"),
    LAVATORY_SERVICE("Lav");

    private final String displayName;

    Amenity(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
