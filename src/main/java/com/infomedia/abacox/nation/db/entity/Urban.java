package com.infomedia.abacox.nation.db.entity;

import com.infomedia.abacox.nation.db.entity.superclass.IdentifiedEntity;
import com.infomedia.abacox.nation.db.util.EntityValidator;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Nationalized;

/**
 * Urban area (city, town, village...) inside a division.
 */
@Entity
@Table(
        name = "urban",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_urban_division_iso", columnNames = {"division_id", "iso"})
        },
        indexes = {
                @Index(name = "idx_urban_division", columnList = "division_id"),
                @Index(name = "idx_urban_type", columnList = "type")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Urban extends IdentifiedEntity<Integer> {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "urban_id_seq")
    @SequenceGenerator(
            name = "urban_id_seq",
            sequenceName = "urban_id_seq",
            allocationSize = 1,
            initialValue = 1000000
    )
    @Column(name = "id", nullable = false)
    private Integer id;

    @NotNull
    @Column(name = "division_id", nullable = false)
    private Integer divisionId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(
            name = "division_id",
            insertable = false,
            updatable = false,
            foreignKey = @ForeignKey(name = "fk_urban_division")
    )
    private Division division;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "type", length = 20, nullable = false)
    private UrbanType type;

    @NotBlank
    @Size(max = 100)
    @Column(name = "name", length = 100, nullable = false)
    private String name;

    @NotBlank
    @Size(max = 100)
    @Nationalized
    @Column(name = "native_name", length = 100, nullable = false)
    private String nativeName;

    @NotBlank
    @Size(max = 5)
    @Column(name = "iso", length = 5, nullable = false)
    private String iso;

    @Builder(toBuilder = true)
    public Urban(Integer id, Integer divisionId, UrbanType type, String name, String nativeName, String iso) {
        this.id = id;
        this.divisionId = divisionId;
        this.type = type;
        this.name = name;
        this.nativeName = nativeName;
        this.iso = iso;
        EntityValidator.validate(this);
    }

    public boolean is(UrbanType type) {
        return this.type == type;
    }

    @Override
    public EntityKind getKind() {
        return type;
    }
}
