package com.infomedia.abacox.nation.db.repository;

import com.infomedia.abacox.nation.db.entity.Urban;
import com.infomedia.abacox.nation.db.entity.UrbanType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;

public interface UrbanRepository extends JpaRepository<Urban, Integer>, JpaSpecificationExecutor<Urban> {

    List<Urban> findAllByDivisionId(Integer divisionId);

    List<Urban> findAllByType(UrbanType type);
}
