package com.infomedia.abacox.nation.service;

import com.infomedia.abacox.nation.component.seed.SeedCatalog;
import com.infomedia.abacox.nation.component.seed.SeedDatabaseLoader;
import com.infomedia.abacox.nation.component.seed.SeedDataset;
import com.infomedia.abacox.nation.component.seed.SeedDatasetException;
import com.infomedia.abacox.nation.db.entity.Division;
import com.infomedia.abacox.nation.db.entity.Urban;
import com.infomedia.abacox.nation.db.repository.CountryRepository;
import com.infomedia.abacox.nation.db.repository.DivisionRepository;
import com.infomedia.abacox.nation.db.repository.UrbanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bootstraps an empty database with the shipped seed datasets. Families are loaded
 * parents first, each family only when its table is still empty, and child rows only
 * when their parent row is present.
 */
@Service
@RequiredArgsConstructor
@Log4j2
public class SeedDataLoadingService {

    private final SeedDatabaseLoader seedDatabaseLoader;
    private final CountryRepository countryRepository;
    private final DivisionRepository divisionRepository;
    private final UrbanRepository urbanRepository;

    @Value("${nation.seed.load-on-startup:true}")
    private boolean loadOnStartup;

    @EventListener(ApplicationReadyEvent.class)
    public void init() {
        if (!loadOnStartup) {
            log.info("Seed data loading on startup is disabled");
            return;
        }
        loadAll();
    }

    /**
     * @return number of rows inserted across all families
     */
    public int loadAll() {
        return loadCountries() + loadDivisions() + loadUrbans();
    }

    public int loadCountries() {
        if (countryRepository.count() > 0) {
            log.debug("Countries already present, skipping seed");
            return 0;
        }
        log.info("Loading countries");
        return load(SeedCatalog.countries(), country -> true);
    }

    /**
     * Seeds divisions whose country exists; rows pointing at a missing country are skipped.
     */
    public int loadDivisions() {
        if (divisionRepository.count() > 0) {
            log.debug("Divisions already present, skipping seed");
            return 0;
        }
        log.info("Loading divisions");
        int total = 0;
        for (SeedDataset<Division> dataset : SeedCatalog.allDivisions()) {
            total += load(dataset, division -> countryRepository.existsById(division.getCountryId()));
        }
        return total;
    }

    /**
     * Seeds urban areas whose division exists; rows pointing at a missing division are skipped.
     */
    public int loadUrbans() {
        if (urbanRepository.count() > 0) {
            log.debug("Urban areas already present, skipping seed");
            return 0;
        }
        log.info("Loading urban areas");
        int total = 0;
        for (SeedDataset<Urban> dataset : SeedCatalog.allUrbans()) {
            total += load(dataset, urban -> divisionRepository.existsById(urban.getDivisionId()));
        }
        return total;
    }

    private <E> int load(SeedDataset<E> dataset, Predicate<E> parentPresent) {
        try {
            List<E> rows = new ArrayList<>();
            for (E entity : dataset.getEntries()) {
                if (parentPresent.test(entity)) {
                    rows.add(entity);
                } else {
                    log.warn("Skipping seed row {} of dataset {}: parent row is missing", entity, dataset.getName());
                }
            }
            log.info("Loading seed dataset {} from {}", dataset.getName(), dataset.getResource());
            return seedDatabaseLoader.insertForcingIds(rows, dataset.getEntityClass());
        } catch (SeedDatasetException e) {
            log.error("Error reading seed dataset {}", dataset.getName(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Error loading seed dataset {} into database", dataset.getName(), e);
            throw new SeedDatasetException("Error loading seed dataset '" + dataset.getName() + "'", e);
        }
    }
}
