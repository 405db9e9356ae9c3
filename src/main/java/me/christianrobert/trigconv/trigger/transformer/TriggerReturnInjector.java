package me.christianrobert.trigconv.trigger.transformer;

import me.christianrobert.trigconv.ir.LeafKind;
import me.christianrobert.trigconv.ir.SqlLeaf;
import me.christianrobert.trigconv.ir.Statement;
import me.christianrobert.trigconv.ir.TriggerMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decides the RETURN statements of PostgreSQL trigger functions.
 *
 * <p>PostgreSQL trigger functions MUST return a value, unlike Oracle triggers
 * which have no return statement. The return value depends on the trigger
 * timing and level:</p>
 *
 * <table border="1">
 *   <tr>
 *     <th>Trigger Timing</th>
 *     <th>Trigger Level</th>
 *     <th>Return Value</th>
 *     <th>Effect</th>
 *   </tr>
 *   <tr>
 *     <td>BEFORE</td>
 *     <td>ROW</td>
 *     <td>NEW</td>
 *     <td>Modified row will be processed</td>
 *   </tr>
 *   <tr>
 *     <td>AFTER</td>
 *     <td>ROW</td>
 *     <td>NULL</td>
 *     <td>Ignored by PostgreSQL</td>
 *   </tr>
 *   <tr>
 *     <td>BEFORE/AFTER</td>
 *     <td>STATEMENT</td>
 *     <td>NULL</td>
 *     <td>Ignored by PostgreSQL</td>
 *   </tr>
 *   <tr>
 *     <td>INSTEAD OF</td>
 *     <td>ROW</td>
 *     <td>NULL</td>
 *     <td>Ignored by PostgreSQL</td>
 *   </tr>
 * </table>
 *
 * <p>The return is appended to a statement list (the main section, or a top-level exception
 * handler) whose last statement does not already leave the function.</p>
 */
public class TriggerReturnInjector {

    private static final Logger log = LoggerFactory.getLogger(TriggerReturnInjector.class);

    /**
     * Returns the value to return: {@code NEW} for BEFORE ROW triggers, {@code NULL} otherwise.
     *
     * @param metadata trigger metadata, possibly without timing or level
     * @param newRecordName name of the new-row record in the target
     */
    public static String determineReturnValue(TriggerMetadata metadata, String newRecordName) {
        if (metadata == null || metadata.getTiming() == null || metadata.getLevel() == null) {
            log.debug("Trigger timing or level unknown, defaulting to RETURN NULL");
            return "NULL";
        }
        if (metadata.isBeforeRow()) {
            return newRecordName;
        }
        return "NULL";
    }

    /**
     * True when control can fall off the end of the statement list, i.e. it does not end with
     * RETURN or RAISE.
     */
    public static boolean needsReturn(List<Statement> statements) {
        if (statements.isEmpty()) {
            return true;
        }
        Statement last = statements.get(statements.size() - 1);
        if (last instanceof SqlLeaf) {
            LeafKind kind = ((SqlLeaf) last).getKind();
            return kind != LeafKind.RETURN && kind != LeafKind.RAISE;
        }
        return true;
    }

    public static String returnStatement(TriggerMetadata metadata, String newRecordName) {
        return "RETURN " + determineReturnValue(metadata, newRecordName) + ";";
    }
}
