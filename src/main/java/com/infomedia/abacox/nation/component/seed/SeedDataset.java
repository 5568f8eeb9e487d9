package com.infomedia.abacox.nation.component.seed;

import com.opencsv.CSVReaderHeaderAware;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Named, ordered, read-only collection of seed entities of one variant, backed by a
 * UTF-8 CSV file on the classpath. The file is parsed on first access and the resulting
 * list is shared by every caller afterwards.
 *
 * @param <E> entity type
 */
@Log4j2
public final class SeedDataset<E> {

    private final String name;
    private final String resource;
    private final Class<E> entityClass;
    private final Function<SeedRow, E> rowMapper;

    private volatile List<E> entries;

    public SeedDataset(String name, String resource, Class<E> entityClass, Function<SeedRow, E> rowMapper) {
        this.name = name;
        this.resource = resource;
        this.entityClass = entityClass;
        this.rowMapper = rowMapper;
    }

    public String getName() {
        return name;
    }

    public String getResource() {
        return resource;
    }

    public Class<E> getEntityClass() {
        return entityClass;
    }

    /**
     * @return the dataset rows in file order, unmodifiable
     * @throws SeedDatasetException if the resource is missing or a row is invalid
     */
    public List<E> getEntries() {
        List<E> result = entries;
        if (result == null) {
            synchronized (this) {
                result = entries;
                if (result == null) {
                    result = read();
                    entries = result;
                }
            }
        }
        return result;
    }

    public int size() {
        return getEntries().size();
    }

    private List<E> read() {
        ClassPathResource csv = new ClassPathResource(resource);
        if (!csv.exists()) {
            throw new SeedDatasetException("Seed dataset '" + name + "' not found: " + resource);
        }
        log.debug("Reading seed dataset {} from {}", name, resource);
        List<E> rows = new ArrayList<>();
        try (Reader reader = new InputStreamReader(csv.getInputStream(), StandardCharsets.UTF_8);
             CSVReaderHeaderAware csvReader = new CSVReaderHeaderAware(reader)) {
            Map<String, String> values;
            while ((values = csvReader.readMap()) != null) {
                SeedRow row = new SeedRow(values, csvReader.getLinesRead());
                try {
                    rows.add(rowMapper.apply(row));
                } catch (SeedDatasetException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new SeedDatasetException("Invalid row at line " + row.getLine()
                            + " of seed dataset '" + name + "': " + e.getMessage(), e);
                }
            }
        } catch (IOException | CsvValidationException e) {
            throw new SeedDatasetException("Error reading seed dataset '" + name + "' from " + resource, e);
        }
        log.info("Seed dataset {} holds {} {} rows", name, rows.size(), entityClass.getSimpleName());
        return Collections.unmodifiableList(rows);
    }

    @Override
    public String toString() {
        return "SeedDataset[" + name + "]";
    }
}
