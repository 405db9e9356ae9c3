package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.ir.TriggerIR;
import me.christianrobert.trigconv.parser.TriggerParser;
import me.christianrobert.trigconv.report.WarningKind;
import me.christianrobert.trigconv.translator.mapping.ClasspathMappingTableProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeTranslatorTest {

    private TranslationContext context;
    private TypeTranslator types;

    @BeforeEach
    void setUp() {
        TriggerIR ir = new TriggerParser().parse("BEGIN\n  NULL;\nEND;").getIr();
        context = new TranslationContext(ir, new ClasspathMappingTableProvider().getTables(), ConversionOptions.defaults());
        types = new TypeTranslator(context);
    }

    @Test
    void simpleTypes() {
        assertEquals("integer", types.translate("PLS_INTEGER", 1));
        assertEquals("timestamp", types.translate("DATE", 1));
        assertEquals("text", types.translate("CLOB", 1));
        assertEquals("boolean", types.translate("BOOLEAN", 1));
    }

    @Test
    void sizeCarriedOver() {
        assertEquals("varchar(100)", types.translate("VARCHAR2(100 CHAR)", 1));
        assertEquals("numeric(10,2)", types.translate("NUMBER(10,2)", 1));
        assertEquals("numeric(38,0)", types.translate("NUMBER(*,0)", 1));
        assertEquals("timestamp(6) with time zone", types.translate("TIMESTAMP(6) WITH TIME ZONE", 1));
    }

    @Test
    void sizeDroppedForUnsizedTargets() {
        assertEquals("text", types.translate("LONG", 1));
        assertEquals("integer", types.translate("INTEGER(5)", 1));
    }

    @Test
    void anchoredTypesVerbatim() {
        assertEquals("emp.sal%TYPE", types.translate("emp.sal%TYPE", 1));
        assertEquals("emp%ROWTYPE", types.translate("emp%ROWTYPE", 1));
        assertTrue(context.getWarnings().isEmpty());
    }

    @Test
    void unknownType_keptWithWarning() {
        assertEquals("t_money", types.translate("t_money", 7));

        assertEquals(1, context.getWarnings().count(WarningKind.UNMAPPED_TYPE));
        assertEquals(7, context.getWarnings().getWarnings().get(0).getLineNumber());
    }

    @Test
    void targetSpellingsMapToThemselves() {
        for (String type : new String[]{"varchar(100)", "numeric(10,2)", "timestamp", "integer", "text", "bytea"}) {
            assertEquals(type, types.translate(type, 1));
        }
        assertTrue(context.getWarnings().isEmpty());
    }
}
