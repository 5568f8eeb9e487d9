package com.infomedia.abacox.nation.db.entity;

import com.infomedia.abacox.nation.db.entity.superclass.IdentifiedEntity;
import com.infomedia.abacox.nation.db.util.EntityValidator;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Nationalized;

/**
 * First-level administrative division of a country. All division variants share this
 * table and are told apart by {@link #getType()}.
 */
@Entity
@Table(
        name = "division",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_division_country_iso", columnNames = {"country_id", "iso"})
        },
        indexes = {
                @Index(name = "idx_division_country", columnList = "country_id"),
                @Index(name = "idx_division_type", columnList = "type")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Division extends IdentifiedEntity<Integer> {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "division_id_seq")
    @SequenceGenerator(
            name = "division_id_seq",
            sequenceName = "division_id_seq",
            allocationSize = 1,
            initialValue = 1000000
    )
    @Column(name = "id", nullable = false)
    private Integer id;

    @NotNull
    @Column(name = "country_id", nullable = false)
    private Integer countryId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(
            name = "country_id",
            insertable = false,
            updatable = false,
            foreignKey = @ForeignKey(name = "fk_division_country")
    )
    private Country country;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "type", length = 20, nullable = false)
    private DivisionType type;

    /**
     * Subdivision code within the country, e.g. "BKK".
     */
    @NotBlank
    @Size(max = 3)
    @Column(name = "iso", length = 3, nullable = false)
    private String iso;

    @NotBlank
    @Size(max = 100)
    @Column(name = "name", length = 100, nullable = false)
    private String name;

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
    public Division(Integer id, Integer countryId, DivisionType type, String iso, String name,
                    String nativeName, Integer population) {
        this.id = id;
        this.countryId = countryId;
        this.type = type;
        this.iso = iso;
        this.name = name;
        this.nativeName = nativeName;
        this.population = population;
        EntityValidator.validate(this);
    }

    public boolean is(DivisionType type) {
        return this.type == type;
    }

    @Override
    public EntityKind getKind() {
        return type;
    }
}
