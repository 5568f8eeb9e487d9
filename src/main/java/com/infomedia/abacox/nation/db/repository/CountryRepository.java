package com.infomedia.abacox.nation.db.repository;

import com.infomedia.abacox.nation.db.entity.Country;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

public interface CountryRepository extends JpaRepository<Country, Integer>, JpaSpecificationExecutor<Country> {

    Optional<Country> findByIso(String iso);
}
