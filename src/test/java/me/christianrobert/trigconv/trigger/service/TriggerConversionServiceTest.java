package me.christianrobert.trigconv.trigger.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import me.christianrobert.trigconv.config.service.ConfigService;
import me.christianrobert.trigconv.core.exception.TriggerConversionException;
import me.christianrobert.trigconv.translator.mapping.ClasspathMappingTableProvider;
import me.christianrobert.trigconv.translator.mapping.MappingTableProvider;
import me.christianrobert.trigconv.translator.mapping.MappingTables;
import me.christianrobert.trigconv.trigger.model.BatchConversionResult;
import me.christianrobert.trigconv.trigger.model.ConversionResult;
import me.christianrobert.trigconv.trigger.model.TriggerSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for TriggerConversionService.
 *
 * Purpose: configuration and mapping tables are read per request, and a batch keeps going
 * after a failed trigger.
 */
class TriggerConversionServiceTest {

    private ConfigService configService;
    private MappingTableProvider mappingTableProvider;
    private TriggerConversionService service;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        mappingTableProvider = mock(MappingTableProvider.class);
        when(mappingTableProvider.getTables()).thenReturn(new ClasspathMappingTableProvider().getTables());
        service = new TriggerConversionService(configService, mappingTableProvider);
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = TriggerConversionServiceTest.class.getResourceAsStream("/triggers/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // ========== Single Trigger ==========

    @Test
    void convertAuditTrigger() throws IOException {
        ConversionResult result = service.convert(new TriggerSource("audit", fixture("trg_emp_audit.sql")));

        assertTrue(result.isSuccess(), result.toString());
        assertEquals("trg_emp_audit", result.getTriggerName());
        String body = result.getPostgresBody();
        assertTrue(body.startsWith("DECLARE\n  v_action varchar(10);\nBEGIN\n"));
        assertTrue(body.contains("  IF TG_OP = 'INSERT' THEN\n"));
        assertTrue(body.contains("  ELSIF TG_OP = 'UPDATE' THEN\n"));
        assertTrue(body.contains("VALUES (COALESCE(NEW.id, OLD.id), v_action, CURRENT_TIMESTAMP);"));
        assertTrue(body.contains("  WHEN OTHERS THEN\n    RAISE EXCEPTION 'Audit failed' USING ERRCODE = 'P0001'"));
        assertTrue(body.contains("  RETURN NULL;\nEXCEPTION\n"));
        assertTrue(result.getFunctionDdl().startsWith("CREATE OR REPLACE FUNCTION hr.trg_emp_audit_func()"));
        assertTrue(result.getTriggerDdl().contains("  AFTER INSERT OR UPDATE OR DELETE\n  ON hr.emp\n"));
    }

    @Test
    void configChangesApplyToNextRequest() {
        configService.setConfigValue(ConfigService.GENERATE_DDL, false);
        configService.setConfigValue(ConfigService.OPERATION_VARIABLE, "tg_op");

        ConversionResult result = service.convert(new TriggerSource("t",
                "BEGIN\n  IF DELETING THEN\n    NULL;\n  END IF;\nEND;"));

        assertEquals("BEGIN\n  IF tg_op = 'DELETE' THEN\n    NULL;\n  END IF;\nEND;\n", result.getPostgresBody());
        assertNull(result.getTriggerDdl());
    }

    @Test
    void tablesFetchedPerRequest() {
        service.convert(new TriggerSource("a", "BEGIN\n  NULL;\nEND;"));
        service.convert(new TriggerSource("b", "BEGIN\n  NULL;\nEND;"));

        verify(mappingTableProvider, times(2)).getTables();
    }

    @Test
    void sourceMetadataOverridesHeader() {
        TriggerSource source = new TriggerSource("t", "BEGIN\n  NULL;\nEND;");
        source.setTiming("before");
        source.setEvents(List.of("insert"));
        source.setTableName("emp");
        source.setLevel("row");

        ConversionResult result = service.convert(source);

        assertTrue(result.getPostgresBody().contains("RETURN NEW;"));
        assertTrue(result.getTriggerDdl().contains("  BEFORE INSERT\n"));
    }

    @Test
    void headerNameWinsOverDisplayName() {
        ConversionResult result = service.convert(new TriggerSource("fallback",
                "CREATE OR REPLACE TRIGGER trg_x BEFORE INSERT ON emp FOR EACH ROW\nBEGIN\n  NULL;\nEND;"));

        assertEquals("trg_x", result.getTriggerName());
        assertTrue(result.getTriggerDdl().startsWith("CREATE TRIGGER trg_x\n"));
    }

    @Test
    void explicitTriggerNameOverridesHeader() {
        TriggerSource source = new TriggerSource("fallback",
                "CREATE OR REPLACE TRIGGER trg_x BEFORE INSERT ON emp FOR EACH ROW\nBEGIN\n  NULL;\nEND;");
        source.setTriggerName("trg_renamed");

        ConversionResult result = service.convert(source);

        assertEquals("trg_renamed", result.getTriggerName());
        assertTrue(result.getTriggerDdl().startsWith("CREATE TRIGGER trg_renamed\n"));
    }

    // ========== Batch ==========

    @Test
    void batchContinuesAfterFailure() throws IOException {
        BatchConversionResult batch = service.convertBatch(List.of(
                new TriggerSource("first", fixture("trg_broken.sql")),
                new TriggerSource("second", fixture("trg_emp_audit.sql")),
                new TriggerSource("third", "")));

        assertEquals(3, batch.getTotalCount());
        assertEquals(1, batch.getSuccessCount());
        assertEquals(2, batch.getFailureCount());
        assertFalse(batch.isAllSucceeded());

        ConversionResult broken = batch.getResults().get(0);
        assertEquals("first", broken.getTriggerName());
        assertEquals("STRUCTURAL_PARSE_ERROR", broken.getErrorKind());
        assertEquals(7, broken.getLineNumber());
        assertTrue(batch.getResults().get(1).isSuccess());
        assertEquals("third", batch.getResults().get(2).getTriggerName());
    }

    @Test
    void unexpectedError_reportedAsInternal() {
        MappingTables failing = mock(MappingTables.class);
        when(failing.getFunctions()).thenThrow(new IllegalStateException("table store unavailable"));
        when(mappingTableProvider.getTables()).thenReturn(failing);

        BatchConversionResult batch = service.convertBatch(List.of(new TriggerSource("t", "BEGIN\n  NULL;\nEND;")));

        ConversionResult result = batch.getResults().get(0);
        assertTrue(result.isFailure());
        assertEquals(ConversionResult.INTERNAL, result.getErrorKind());
        assertTrue(result.getErrorMessage().contains("table store unavailable"));
    }

    // ========== IR JSON ==========

    @Test
    void parseToJson() throws IOException {
        ObjectNode json = service.parseToJson(new TriggerSource("audit", fixture("trg_emp_audit.sql")));

        assertEquals("trg_emp_audit", json.get("trigger_metadata").get("trigger_name").asText());
        assertTrue(json.has("main"));
    }

    @Test
    void parseToJson_propagatesErrors() throws IOException {
        TriggerSource broken = new TriggerSource("b", fixture("trg_broken.sql"));
        assertThrows(TriggerConversionException.class, () -> service.parseToJson(broken));
    }
}
