package com.di.plumeflux.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should set the unit key only for the duration of the task")
    void testRunWithUnitKey() {
        String[] seen = new String[1];
        MdcPropagation.runWithUnitKey("pair:20240601T121000Z", () -> seen[0] = MDC.get(MdcPropagation.UNIT_KEY));

        assertEquals("pair:20240601T121000Z", seen[0]);
        assertNull(MDC.get(MdcPropagation.UNIT_KEY));
    }

    @Test
    @DisplayName("Should carry the submitting thread's MDC into a wrapped pool")
    void testWrapExecutor() throws Exception {
        ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newSingleThreadExecutor());
        try {
            MDC.put(MdcPropagation.UNIT_KEY, "scan:20240601T120000Z");
            Future<String> inside = pool.submit(() -> MDC.get(MdcPropagation.UNIT_KEY));
            assertEquals("scan:20240601T120000Z", inside.get(5, TimeUnit.SECONDS));

            MDC.clear();
            Future<String> after = pool.submit(() -> MDC.get(MdcPropagation.UNIT_KEY));
            assertNull(after.get(5, TimeUnit.SECONDS), "worker MDC is cleaned between tasks");
        } finally {
            pool.shutdownNow();
        }
    }
}
