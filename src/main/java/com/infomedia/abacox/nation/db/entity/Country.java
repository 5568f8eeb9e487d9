package com.infomedia.abacox.nation.db.entity;

import com.infomedia.abacox.nation.db.entity.superclass.IdentifiedEntity;
import com.infomedia.abacox.nation.db.util.EntityValidator;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Nationalized;

/**
 * Sovereign country, root of the hierarchy.
 */
@Entity
@Table(
        name = "country",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_country_iso", columnNames = "iso")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Country extends IdentifiedEntity<Integer> {

    /**
     * Primary key. Seeded rows use the ISO 3166-1 numeric code.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "country_id_seq")
    @SequenceGenerator(
            name = "country_id_seq",
            sequenceName = "country_id_seq",
            allocationSize = 1,
            initialValue = 1000000
    )
    @Column(name = "id", nullable = false)
    private Integer id;

    /**
     * ISO 3166-1 alpha-2 code.
     */
    @NotBlank
    @Size(min = 2, max = 2)
    @Pattern(regexp = "[A-Z]{2}")
    @Column(name = "iso", length = 2, nullable = false)
    private String iso;

    /**
     * International dialing prefix, without the leading plus.
     */
    @NotNull
    @PositiveOrZero
    @Column(name = "calling_code", nullable = false)
    private Integer callingCode;

    @NotBlank
    @Size(max = 100)
    @Column(name = "name", length = 100, nullable = false)
    private String name;

    /**
     * Name in the country's own language and script.
     */
    @NotBlank
    @Size(max = 100)
    @Nationalized
    @Column(name = "native_name", length = 100, nullable = false)
    private String nativeName;

    @NotNull
    @PositiveOrZero
    @Column(name = "population", nullable = false)
    private Integer population;

    @Builder(toBuilder = true)
    public Country(Integer id, String iso, Integer callingCode, String name, String nativeName, Integer population) {
        this.id = id;
        this.iso = iso;
        this.callingCode = callingCode;
        this.name = name;
        this.nativeName = nativeName;
        this.population = population;
        EntityValidator.validate(this);
    }

    @Override
    public EntityKind getKind() {
        return CountryType.COUNTRY;
    }
}
