package com.infomedia.abacox.nation.component.seed;

import com.infomedia.abacox.nation.db.entity.Country;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeedDatasetTest {

    private static SeedDataset<Country> countries(String resource) {
        return new SeedDataset<>("test-country", resource, Country.class, row -> Country.builder()
                .id(row.integer("id"))
                .iso(row.text("iso"))
                .callingCode(row.integer("calling_code"))
                .name(row.text("name"))
                .nativeName(row.text("native"))
                .population(row.integer("population"))
                .build());
    }

    @Test
    void concurrentReadersSeeOneUnmodifiedList() throws Exception {
        SeedDataset<Country> dataset = countries("seed/country.csv");
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<Country>>> futures = new ArrayList<>();
            for (int i = 0; i < threads * 4; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return dataset.getEntries();
                }));
            }
            start.countDown();

            List<Country> first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<List<Country>> future : futures) {
                List<Country> entries = future.get(10, TimeUnit.SECONDS);
                assertSame(first, entries);
            }
            assertEquals(3, first.size());
            assertEquals("TH", first.get(0).getIso());
            assertEquals("ไทย", first.get(0).getNativeName());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void missingResourceFailsOnFirstRead() {
        SeedDataset<Country> dataset = countries("seed-test/absent.csv");

        SeedDatasetException e = assertThrows(SeedDatasetException.class, dataset::getEntries);
        assertTrue(e.getMessage().contains("seed-test/absent.csv"));
    }

    @Test
    void invalidRowIsReportedWithItsLine() {
        SeedDataset<Country> dataset = countries("seed-test/negative_population.csv");

        SeedDatasetException e = assertThrows(SeedDatasetException.class, dataset::getEntries);
        assertInstanceOf(ConstraintViolationException.class, e.getCause());
        assertTrue(e.getMessage().contains("line 3"), e.getMessage());
    }

    @Test
    void nonNumericValueIsRejected() {
        SeedDataset<Country> dataset = countries("seed-test/malformed_id.csv");

        SeedDatasetException e = assertThrows(SeedDatasetException.class, dataset::getEntries);
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void missingColumnIsRejected() {
        SeedDataset<Country> dataset = countries("seed-test/missing_column.csv");

        SeedDatasetException e = assertThrows(SeedDatasetException.class, dataset::getEntries);
        assertTrue(e.getMessage().contains("calling_code"), e.getMessage());
    }
}
