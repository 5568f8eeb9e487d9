package com.infomedia.abacox.nation.db.entity;

/**
 * Administrative division classifications. Stored by name in {@code division.type}.
 */
public enum DivisionType implements EntityKind {
    PROVINCE("Province"),
    STATE("State"),
    REGION("Region"),
    COUNTY("County"),
    CANTON("Canton"),
    DISTRICT("District"),
    MUNICIPALITY("Municipality"),
    TERRITORY("Territory"),
    PREFECTURE("Prefecture"),
    DEPARTMENT("Department"),
    AREA("Area"),
    COMMUNITY("Community"),
    PARISH("Parish"),
    OBLAST("Oblast"),
    VOIVODESHIP("Voivodeship"),
    BANNER("Banner"),
    BARANGAY("Barangay"),
    KAMPONG("Kampong"),
    BARONY("Barony"),
    HUNDRED("Hundred"),
    KINGDOM("Kingdom"),
    PRINCIPALITY("Principality"),
    REGENCY("Regency"),
    REPUBLIC("Republic"),
    RIDING("Riding"),
    THEME("Theme"),
    BANAT("Banat");

    private final String label;

    DivisionType(String label) {
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

    public static DivisionType fromDiscriminator(String discriminator) {
        if (discriminator != null) {
            for (DivisionType type : values()) {
                if (type.name().equalsIgnoreCase(discriminator.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown division type: " + discriminator);
    }

    public static DivisionType fromLabel(String label) {
        if (label != null) {
            for (DivisionType type : values()) {
                if (type.label.equalsIgnoreCase(label.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown division label: " + label);
    }
}
