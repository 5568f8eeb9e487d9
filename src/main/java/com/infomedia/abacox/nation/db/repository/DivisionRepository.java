package com.infomedia.abacox.nation.db.repository;

import com.infomedia.abacox.nation.db.entity.Division;
import com.infomedia.abacox.nation.db.entity.DivisionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;
import java.util.Optional;

public interface DivisionRepository extends JpaRepository<Division, Integer>, JpaSpecificationExecutor<Division> {

    List<Division> findAllByCountryId(Integer countryId);

    List<Division> findAllByType(DivisionType type);

    Optional<Division> findByCountryIdAndIso(Integer countryId, String iso);
}
