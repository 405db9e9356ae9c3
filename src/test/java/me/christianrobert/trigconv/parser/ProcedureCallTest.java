package me.christianrobert.trigconv.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProcedureCallTest {

    @Test
    void namedAndPositionalArguments() {
        ProcedureCall call = ProcedureCall.parse("pkg.log_it(:NEW.id, p_msg => 'a, b', p_n => NVL(x, 0))");

        assertNotNull(call);
        assertEquals("pkg.log_it", call.getFunctionName());
        assertEquals("mixed", call.getParameterType());
        assertEquals(3, call.getArguments().size());
        assertNull(call.getArguments().get(0).getName());
        assertEquals(":NEW.id", call.getArguments().get(0).getValue());
        assertEquals("p_msg", call.getArguments().get(1).getName());
        assertEquals("'a, b'", call.getArguments().get(1).getValue());
        assertEquals("NVL(x, 0)", call.getArguments().get(2).getValue());
    }

    @Test
    void multiLineArgumentsKeepTheirText() {
        ProcedureCall call = ProcedureCall.parse("notify(\n    p_text => 'x' ||\n      y)");

        assertEquals("named", call.getParameterType());
        assertEquals("'x' ||\n      y", call.getArguments().get(0).getValue());
    }

    @Test
    void bareNameAndEmptyParentheses() {
        assertEquals("empty", ProcedureCall.parse("refresh_cache").getParameterType());
        assertEquals("", ProcedureCall.parse("refresh_cache()").getRawArguments());
    }

    @Test
    void notACall() {
        assertNull(ProcedureCall.parse("f(a)(b)"));
        assertNull(ProcedureCall.parse("f(a,,b)"));
        assertNull(ProcedureCall.parse("'text'"));
        assertNull(ProcedureCall.parse("f(a) + 1"));
    }
}
