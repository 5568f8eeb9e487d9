package com.infomedia.abacox.nation.component.seed;

import com.infomedia.abacox.nation.db.entity.Country;
import com.infomedia.abacox.nation.db.entity.Division;
import com.infomedia.abacox.nation.db.entity.DivisionType;
import com.infomedia.abacox.nation.db.entity.EntityKind;
import com.infomedia.abacox.nation.db.entity.Urban;
import com.infomedia.abacox.nation.db.entity.UrbanType;
import org.springframework.core.io.ClassPathResource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the seed datasets shipped on the classpath.
 * <p>
 * Layout:
 * <ul>
 *     <li>{@code seed/country.csv}: {@code id,iso,calling_code,name,native,population}</li>
 *     <li>{@code seed/division/<type>.csv}: {@code id,country_id,iso,name,native,population}</li>
 *     <li>{@code seed/urban/<type>.csv}: {@code id,division_id,iso,name,native}</li>
 * </ul>
 * where {@code <type>} is the lower-case discriminator. A division or urban variant has a
 * dataset exactly when its file exists.
 */
public final class SeedCatalog {

    public static final String COUNTRY_FAMILY = "country";
    public static final String DIVISION_FAMILY = "division";
    public static final String URBAN_FAMILY = "urban";

    private static final String SEED_ROOT = "seed/";

    private static final SeedDataset<Country> COUNTRIES = new SeedDataset<>(
            COUNTRY_FAMILY, SEED_ROOT + "country.csv", Country.class, SeedCatalog::toCountry);

    private static final Map<DivisionType, SeedDataset<Division>> DIVISIONS = divisionDatasets();

    private static final Map<UrbanType, SeedDataset<Urban>> URBANS = urbanDatasets();

    private SeedCatalog() {
    }

    public static SeedDataset<Country> countries() {
        return COUNTRIES;
    }

    public static Optional<SeedDataset<Division>> divisions(DivisionType type) {
        return Optional.ofNullable(DIVISIONS.get(type));
    }

    public static Optional<SeedDataset<Urban>> urbans(UrbanType type) {
        return Optional.ofNullable(URBANS.get(type));
    }

    /**
     * @return every shipped division dataset, in {@link DivisionType} declaration order
     */
    public static List<SeedDataset<Division>> allDivisions() {
        return List.copyOf(DIVISIONS.values());
    }

    /**
     * @return every shipped urban dataset, in {@link UrbanType} declaration order
     */
    public static List<SeedDataset<Urban>> allUrbans() {
        return List.copyOf(URBANS.values());
    }

    /**
     * Looks a dataset up by family and variant name, both case-insensitive, e.g.
     * {@code ("division", "province")}. For the country family the variant may be
     * {@code null} or {@code "country"}.
     */
    public static Optional<SeedDataset<?>> find(String family, String variant) {
        if (family == null) {
            return Optional.empty();
        }
        String key = variant == null ? null : variant.trim().toLowerCase(Locale.ROOT);
        switch (family.trim().toLowerCase(Locale.ROOT)) {
            case COUNTRY_FAMILY:
                return key == null || key.equals(COUNTRY_FAMILY) ? Optional.of(COUNTRIES) : Optional.empty();
            case DIVISION_FAMILY:
                return DIVISIONS.values().stream()
                        .filter(dataset -> dataset.getName().equals(DIVISION_FAMILY + "/" + key))
                        .<SeedDataset<?>>map(dataset -> dataset)
                        .findFirst();
            case URBAN_FAMILY:
                return URBANS.values().stream()
                        .filter(dataset -> dataset.getName().equals(URBAN_FAMILY + "/" + key))
                        .<SeedDataset<?>>map(dataset -> dataset)
                        .findFirst();
            default:
                return Optional.empty();
        }
    }

    /**
     * @return names of all shipped datasets, e.g. {@code country}, {@code division/province}
     */
    public static List<String> names() {
        List<String> names = new ArrayList<>();
        names.add(COUNTRIES.getName());
        DIVISIONS.values().forEach(dataset -> names.add(dataset.getName()));
        URBANS.values().forEach(dataset -> names.add(dataset.getName()));
        return Collections.unmodifiableList(names);
    }

    private static Map<DivisionType, SeedDataset<Division>> divisionDatasets() {
        Map<DivisionType, SeedDataset<Division>> datasets = new EnumMap<>(DivisionType.class);
        for (DivisionType type : DivisionType.values()) {
            String resource = resourceFor(DIVISION_FAMILY, type);
            if (new ClassPathResource(resource).exists()) {
                datasets.put(type, new SeedDataset<>(datasetName(DIVISION_FAMILY, type), resource,
                        Division.class, row -> toDivision(type, row)));
            }
        }
        return Collections.unmodifiableMap(datasets);
    }

    private static Map<UrbanType, SeedDataset<Urban>> urbanDatasets() {
        Map<UrbanType, SeedDataset<Urban>> datasets = new EnumMap<>(UrbanType.class);
        for (UrbanType type : UrbanType.values()) {
            String resource = resourceFor(URBAN_FAMILY, type);
            if (new ClassPathResource(resource).exists()) {
                datasets.put(type, new SeedDataset<>(datasetName(URBAN_FAMILY, type), resource,
                        Urban.class, row -> toUrban(type, row)));
            }
        }
        return Collections.unmodifiableMap(datasets);
    }

    private static String datasetName(String family, EntityKind kind) {
        return family + "/" + kind.getDiscriminator().toLowerCase(Locale.ROOT);
    }

    private static String resourceFor(String family, EntityKind kind) {
        return SEED_ROOT + datasetName(family, kind) + ".csv";
    }

    private static Country toCountry(SeedRow row) {
        return Country.builder()
                .id(row.integer("id"))
                .iso(row.text("iso"))
                .callingCode(row.integer("calling_code"))
                .name(row.text("name"))
                .nativeName(row.text("native"))
                .population(row.integer("population"))
                .build();
    }

    private static Division toDivision(DivisionType type, SeedRow row) {
        return Division.builder()
                .id(row.integer("id"))
                .countryId(row.integer("country_id"))
                .type(type)
                .iso(row.text("iso"))
                .name(row.text("name"))
                .nativeName(row.text("native"))
                .population(row.integer("population"))
                .build();
    }

    private static Urban toUrban(UrbanType type, SeedRow row) {
        return Urban.builder()
                .id(row.integer("id"))
                .divisionId(row.integer("division_id"))
                .type(type)
                .iso(row.text("iso"))
                .name(row.text("name"))
                .nativeName(row.text("native"))
                .build();
    }
}
