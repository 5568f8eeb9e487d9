package com.infomedia.abacox.nation.db.repository;

import com.infomedia.abacox.nation.db.entity.Country;
import com.infomedia.abacox.nation.db.entity.Division;
import com.infomedia.abacox.nation.db.entity.DivisionType;
import com.infomedia.abacox.nation.db.entity.Urban;
import com.infomedia.abacox.nation.db.entity.UrbanType;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class GeographyRepositoryTest {

    @Autowired
    private CountryRepository countryRepository;

    @Autowired
    private DivisionRepository divisionRepository;

    @Autowired
    private UrbanRepository urbanRepository;

    @Autowired
    private EntityManager entityManager;

    private Country vietnam;

    @BeforeEach
    void setUp() {
        vietnam = countryRepository.saveAndFlush(new Country(null, "VN", 84, "Vietnam", "Việt Nam", 100300000));
    }

    @Test
    void transientCountryGetsSequenceIdOnSave() {
        assertFalse(vietnam.isTransient());
        assertTrue(vietnam.getId() >= 1000000, "generated id " + vietnam.getId());
    }

    @Test
    void reloadedEntityEqualsSavedOne() {
        Integer id = vietnam.getId();
        entityManager.clear();

        Country reloaded = countryRepository.findByIso("VN").orElseThrow();

        assertNotSame(vietnam, reloaded);
        assertEquals(vietnam, reloaded);
        assertEquals(id, reloaded.getId());
        assertEquals("Việt Nam", reloaded.getNativeName());
    }

    @Test
    void duplicateCountryIsoIsRejectedByTheStore() {
        Country duplicate = new Country(null, "VN", 84, "Viet Nam", "Việt Nam", 1);

        assertThrows(DataIntegrityViolationException.class, () -> countryRepository.saveAndFlush(duplicate));
    }

    @Test
    void divisionWithUnknownCountryIsRejectedByTheStore() {
        Division orphan = new Division(null, 999999, DivisionType.PROVINCE, "HN", "Hanoi", "Hà Nội", 8000000);

        assertThrows(DataIntegrityViolationException.class, () -> divisionRepository.saveAndFlush(orphan));
    }

    @Test
    void divisionIsoIsUniquePerCountry() {
        divisionRepository.saveAndFlush(
                new Division(null, vietnam.getId(), DivisionType.PROVINCE, "HN", "Hanoi", "Hà Nội", 8000000));
        Division duplicate = new Division(null, vietnam.getId(), DivisionType.MUNICIPALITY, "HN", "Ha Noi", "Hà Nội", 1);

        assertThrows(DataIntegrityViolationException.class, () -> divisionRepository.saveAndFlush(duplicate));
    }

    @Test
    void variantsShareOneTableAndFilterByType() {
        Division hanoi = divisionRepository.save(
                new Division(null, vietnam.getId(), DivisionType.MUNICIPALITY, "HN", "Hanoi", "Hà Nội", 8000000));
        divisionRepository.save(
                new Division(null, vietnam.getId(), DivisionType.PROVINCE, "QN", "Quang Ninh", "Quảng Ninh", 1300000));
        divisionRepository.flush();
        entityManager.clear();

        List<Division> municipalities = divisionRepository.findAllByType(DivisionType.MUNICIPALITY);
        assertEquals(List.of(hanoi), municipalities);
        assertEquals(2, divisionRepository.findAllByCountryId(vietnam.getId()).size());
        assertEquals(DivisionType.MUNICIPALITY,
                divisionRepository.findByCountryIdAndIso(vietnam.getId(), "HN").orElseThrow().getType());
    }

    @Test
    void urbanResolvesItsParents() {
        Division hanoi = divisionRepository.saveAndFlush(
                new Division(null, vietnam.getId(), DivisionType.MUNICIPALITY, "HN", "Hanoi", "Hà Nội", 8000000));
        Urban hoanKiem = urbanRepository.saveAndFlush(
                new Urban(null, hanoi.getId(), UrbanType.WARD, "Hoan Kiem", "Hoàn Kiếm", "HK"));
        entityManager.clear();

        Urban reloaded = urbanRepository.findById(hoanKiem.getId()).orElseThrow();

        assertEquals(UrbanType.WARD, reloaded.getType());
        assertEquals("Hanoi", reloaded.getDivision().getName());
        assertEquals("Vietnam", reloaded.getDivision().getCountry().getName());
        assertEquals(List.of(hoanKiem), urbanRepository.findAllByDivisionId(hanoi.getId()));
        assertTrue(urbanRepository.findAllByType(UrbanType.CITY).isEmpty());
    }
}
