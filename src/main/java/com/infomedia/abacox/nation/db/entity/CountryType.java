package com.infomedia.abacox.nation.db.entity;

/**
 * Countries form a closed family with a single variant.
 */
public enum CountryType implements EntityKind {
    COUNTRY("Country");

    private final String label;

    CountryType(String label) {
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
}
