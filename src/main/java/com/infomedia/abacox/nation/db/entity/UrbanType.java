package com.infomedia.abacox.nation.db.entity;

/**
 * Urban area classifications. Stored by name in {@code urban.type}.
 */
public enum UrbanType implements EntityKind {
    CITY("City"),
    TOWN("Town"),
    WARD("Ward"),
    SHIRE("Shire"),
    AMPHOR("Amphor"),
    VILLAGE("Village"),
    HAMLET("Hamlet");

    private final String label;

    UrbanType(String label) {
        this.label = label;
    }

    @Override
    public String getDiscriminator() {
        return name();
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static UrbanType fromDiscriminator(String discriminator) {
        if (discriminator != null) {
            for (UrbanType type : values()) {
                if (type.name().equalsIgnoreCase(discriminator.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown urban type: " + discriminator);
    }

    public static UrbanType fromLabel(String label) {
        if (label != null) {
            for (UrbanType type : values()) {
                if (type.label.equalsIgnoreCase(label.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown urban label: " + label);
    }
}
