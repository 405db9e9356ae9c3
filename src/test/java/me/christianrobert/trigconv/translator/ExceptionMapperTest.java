package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.ir.Declarations;
import me.christianrobert.trigconv.ir.ExceptionDecl;
import me.christianrobert.trigconv.ir.TriggerIR;
import me.christianrobert.trigconv.parser.TriggerParser;
import me.christianrobert.trigconv.report.WarningKind;
import me.christianrobert.trigconv.translator.mapping.ClasspathMappingTableProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExceptionMapper.
 *
 * Purpose: declared exceptions get stable SQLSTATEs per trigger, and RAISE statements and
 * handlers refer to them consistently.
 */
class ExceptionMapperTest {

    private static final String TRIGGER = String.join("\n",
            "DECLARE",
            "  e_limit EXCEPTION;",
            "  PRAGMA EXCEPTION_INIT(e_limit, -20005);",
            "  e_auto EXCEPTION;",
            "  e_dup EXCEPTION;",
            "  PRAGMA EXCEPTION_INIT(e_dup, -1);",
            "BEGIN",
            "  NULL;",
            "END;");

    private TranslationContext context;
    private ExceptionMapper mapper;

    @BeforeEach
    void setUp() {
        TriggerIR ir = new TriggerParser().parse(TRIGGER).getIr();
        context = new TranslationContext(ir, new ClasspathMappingTableProvider().getTables(), ConversionOptions.defaults());
        mapper = new ExceptionMapper(context, new ExpressionTranslator(context));
        mapper.enterScope(ir.getDeclarations());
    }

    // ========== SQLSTATE Assignment ==========

    @Test
    void sqlState_fromApplicationErrorCode() {
        assertEquals("P0005", mapper.sqlStateOf("e_limit"));
    }

    @Test
    void sqlState_autoAssigned() {
        assertEquals("P9001", mapper.sqlStateOf("E_AUTO"));
    }

    @Test
    void sqlState_wellKnownOracleError() {
        assertEquals("23505", mapper.sqlStateOf("e_dup"));
    }

    @Test
    void innerScopeShadowsOuter() {
        mapper.enterScope(new Declarations(List.of(new ExceptionDecl("e_limit", null, 12))));
        assertEquals("P9002", mapper.sqlStateOf("e_limit"));

        mapper.exitScope();
        assertEquals("P0005", mapper.sqlStateOf("e_limit"));
    }

    @Test
    void declarationComment() {
        ExceptionDecl declaration = new ExceptionDecl("e_limit", -20005, 2);
        assertEquals("-- e_limit EXCEPTION; PRAGMA EXCEPTION_INIT(-20005); (mapped to SQLSTATE 'P0005')",
                mapper.declarationComment(declaration));
    }

    // ========== Handlers ==========

    @Test
    void handler_declaredException() {
        assertEquals("SQLSTATE 'P9001'", mapper.handlerCondition("e_auto", 10));
    }

    @Test
    void handler_standardExceptions() {
        assertEquals("no_data_found", mapper.handlerCondition("NO_DATA_FOUND", 10));
        assertEquals("division_by_zero", mapper.handlerCondition("ZERO_DIVIDE", 10));
        assertEquals("unique_violation", mapper.handlerCondition("DUP_VAL_ON_INDEX", 10));
        assertEquals("OTHERS", mapper.handlerCondition("others", 10));
        assertTrue(context.getWarnings().isEmpty());
    }

    @Test
    void handler_targetConditionsPassUnchanged() {
        assertEquals("division_by_zero", mapper.handlerCondition("division_by_zero", 10));
        assertEquals("SQLSTATE 'P0001'", mapper.handlerCondition("SQLSTATE 'P0001'", 10));
        assertTrue(context.getWarnings().isEmpty());
    }

    @Test
    void handler_unknownExceptionWarns() {
        assertEquals("other_pkg.e_fail", mapper.handlerCondition("other_pkg.e_fail", 10));
        assertEquals(1, context.getWarnings().count(WarningKind.UNMAPPED_EXCEPTION));
    }

    // ========== RAISE ==========

    @Test
    void raiseApplicationError_literalMessage() {
        assertEquals("RAISE EXCEPTION 'Bad' USING ERRCODE = 'P0001', HINT = 'Original Oracle error code: -20001'",
                mapper.translateRaise("RAISE_APPLICATION_ERROR(-20001, 'Bad')", 5));
    }

    @Test
    void raiseApplicationError_percentEscaped() {
        assertEquals("RAISE EXCEPTION 'Done 100%%' USING ERRCODE = 'P0002', HINT = 'Original Oracle error code: -20002'",
                mapper.translateRaise("RAISE_APPLICATION_ERROR(-20002, 'Done 100%')", 5));
    }

    @Test
    void raiseApplicationError_expressionMessage() {
        assertEquals("RAISE EXCEPTION USING MESSAGE = 'Salary ' || NEW.sal, ERRCODE = 'P0010', "
                        + "HINT = 'Original Oracle error code: -20010'",
                mapper.translateRaise("RAISE_APPLICATION_ERROR(-20010, 'Salary ' || :NEW.sal)", 5));
    }

    @Test
    void raiseApplicationError_missingMessageWarns() {
        mapper.translateRaise("RAISE_APPLICATION_ERROR(-20001)", 5);
        assertEquals(1, context.getWarnings().count(WarningKind.UNMAPPED_EXCEPTION));
    }

    @Test
    void raise_declaredException() {
        assertEquals("RAISE EXCEPTION 'e_auto' USING ERRCODE = 'P9001'", mapper.translateRaise("RAISE e_auto", 5));
        // no message template in the exception table
        assertEquals(1, context.getWarnings().count(WarningKind.UNMAPPED_EXCEPTION));
    }

    @Test
    void raise_standardException() {
        assertEquals("RAISE division_by_zero", mapper.translateRaise("RAISE ZERO_DIVIDE", 5));
    }

    @Test
    void raise_reraiseAndPlpgsqlFormsUnchanged() {
        assertEquals("RAISE", mapper.translateRaise("RAISE", 5));
        assertEquals("RAISE EXCEPTION 'x %', v USING ERRCODE = 'P0001'",
                mapper.translateRaise("RAISE EXCEPTION 'x %', v USING ERRCODE = 'P0001'", 5));
        assertEquals("RAISE NOTICE 'done'", mapper.translateRaise("RAISE NOTICE 'done'", 5));
        assertTrue(context.getWarnings().isEmpty());
    }
}
