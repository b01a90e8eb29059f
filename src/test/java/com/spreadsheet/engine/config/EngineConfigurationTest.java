package com.spreadsheet.engine.config;

import com.spreadsheet.engine.EngineApplication;
import com.spreadsheet.engine.models.LoadOrder;
import com.spreadsheet.engine.services.EngineWorker;
import com.spreadsheet.engine.services.FormulaEngine;
import com.spreadsheet.engine.services.WorkerRequest;
import com.spreadsheet.engine.values.Value;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring tests: the application context builds the engine beans from the "test" profile.
 */
@SpringBootTest(classes = EngineApplication.class)
@ActiveProfiles("test")
class EngineConfigurationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private EngineProperties properties;

    @Autowired
    private EngineWorker worker;

    /**
     * Properties bind from application-test.properties.
     */
    @Test
    void testPropertiesBound() {
        assertEquals(LoadOrder.TOPOLOGICAL, properties.getLoadOrder());
        assertEquals("UTC", properties.getTimeZone());
        assertEquals("formula-worker-test", properties.getWorkerThreadName());
    }

    /**
     * Each injected engine is a separate sheet.
     */
    @Test
    void testEnginesArePrototypes() {
        FormulaEngine first = context.getBean(FormulaEngine.class);
        FormulaEngine second = context.getBean(FormulaEngine.class);
        assertNotSame(first, second);
        first.setCellValue("A1", "1");
        assertTrue(second.getCellValue("A1").isEmpty());
    }

    /**
     * The worker bean serves requests through its own engine.
     */
    @Test
    void testWorkerBean() throws Exception {
        worker.submit(WorkerRequest.setCellValue("A1", "2")).get(5, TimeUnit.SECONDS);
        Value value = worker.submit(WorkerRequest.setFormula("A2", "=A1^3"))
                .get(5, TimeUnit.SECONDS).getUpdates().get("A2");
        assertEquals(Value.of(8), value);
    }
}
