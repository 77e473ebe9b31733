package com.omniva.dbnotifier.engine.postgres;

import com.omniva.dbnotifier.engine.fault.DbNotifierFatalError;
import com.omniva.dbnotifier.messaging.model.ChangeType;
import com.omniva.dbnotifier.synthesis.ColumnPolicy;
import com.omniva.dbnotifier.synthesis.HandlerPlan;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.omniva.dbnotifier.engine.postgres.SqlQuoting.quoteIdent;
import static com.omniva.dbnotifier.engine.postgres.SqlQuoting.quoteLiteral;
import static com.omniva.dbnotifier.engine.postgres.SqlQuoting.quoteNullable;
import static com.omniva.dbnotifier.engine.postgres.SqlQuoting.quoteQualified;

/**
 * Lowers a {@link HandlerPlan} into PL/pgSQL: the trigger function that selects the columns,
 * builds the {@code {name, table, event, timestamp, data}} envelope and calls {@code pg_notify},
 * plus the matching CREATE/DROP TRIGGER statements.
 */
public class PlpgsqlHandlerEmitter {

    private static final String UNSUPPORTED_EVENT =
            "    RAISE EXCEPTION 'Unsupported trigger event for notifications.';\n";

    public String createFunction(String handlerName, HandlerPlan plan) {
        String body = declarations(plan) + "BEGIN\n" + selection(plan.columnPolicy()) + envelope(plan) + "END;\n";
        String tag = dollarTag(body);

        return "CREATE OR REPLACE FUNCTION " + quoteIdent(handlerName) + "() RETURNS TRIGGER AS " + tag + "\n"
                + body
                + tag + " LANGUAGE plpgsql";
    }

    public String dropFunction(String handlerName) {
        return "DROP FUNCTION IF EXISTS " + quoteIdent(handlerName) + "()";
    }

    public String createTrigger(String tableName, String triggerName, String handlerName, Set<ChangeType> events) {
        String eventClause = events.stream()
                .sorted()
                .map(ChangeType::name)
                .collect(Collectors.joining(" OR "));

        return String.format("CREATE TRIGGER %s AFTER %s ON %s FOR EACH ROW EXECUTE PROCEDURE %s()",
                quoteIdent(triggerName), eventClause, quoteQualified(tableName), quoteIdent(handlerName));
    }

    public String dropTrigger(String tableName, String triggerName) {
        return String.format("DROP TRIGGER IF EXISTS %s ON %s", quoteIdent(triggerName), quoteQualified(tableName));
    }

    private String declarations(HandlerPlan plan) {
        return "DECLARE\n"
                + "  old_jsonb jsonb;\n"
                + "  new_jsonb jsonb;\n"
                + "  notif_name text := " + quoteNullable(plan.notifName()) + ";\n"
                + "  notif_data jsonb := '{}';\n"
                + "  notif jsonb;\n";
    }

    private String selection(ColumnPolicy policy) {
        if (policy instanceof ColumnPolicy.AllColumns) {
            return "  IF TG_OP = 'INSERT' OR TG_OP = 'UPDATE' THEN\n"
                    + "    notif_data := to_jsonb(NEW);\n"
                    + "  ELSIF TG_OP = 'DELETE' THEN\n"
                    + "    notif_data := to_jsonb(OLD);\n"
                    + "  ELSE\n"
                    + UNSUPPORTED_EVENT
                    + "  END IF;\n";
        }

        if (policy instanceof ColumnPolicy.ChangedColumns changed) {
            StringBuilder sql = new StringBuilder()
                    .append("  IF TG_OP = 'INSERT' THEN\n")
                    .append("    notif_data := to_jsonb(NEW);\n")
                    .append("  ELSIF TG_OP = 'UPDATE' THEN\n")
                    .append("    new_jsonb := to_jsonb(NEW);\n")
                    .append("    old_jsonb := to_jsonb(OLD);\n")
                    .append("    SELECT COALESCE(jsonb_object_agg(n.key, n.value), '{}'::jsonb) INTO notif_data\n")
                    .append("      FROM jsonb_each(old_jsonb) AS o, jsonb_each(new_jsonb) AS n\n")
                    .append("     WHERE o.key = n.key AND o.value IS DISTINCT FROM n.value;\n");
            if (!changed.extras().isEmpty()) {
                sql.append("    notif_data := notif_data || ").append(buildObject(changed.extras(), "new_jsonb")).append(";\n");
            }
            return sql.append("  ELSIF TG_OP = 'DELETE' THEN\n")
                    .append("    notif_data := to_jsonb(OLD);\n")
                    .append("  ELSE\n")
                    .append(UNSUPPORTED_EVENT)
                    .append("  END IF;\n")
                    .toString();
        }

        if (policy instanceof ColumnPolicy.ExplicitColumns explicit) {
            return "  IF TG_OP = 'INSERT' OR TG_OP = 'UPDATE' THEN\n"
                    + "    new_jsonb := to_jsonb(NEW);\n"
                    + "    notif_data := " + buildObject(explicit.columns(), "new_jsonb") + ";\n"
                    + "  ELSIF TG_OP = 'DELETE' THEN\n"
                    + "    old_jsonb := to_jsonb(OLD);\n"
                    + "    notif_data := " + buildObject(explicit.columns(), "old_jsonb") + ";\n"
                    + "  ELSE\n"
                    + UNSUPPORTED_EVENT
                    + "  END IF;\n";
        }

        throw new DbNotifierFatalError("Unreachable column selection branch for policy " + policy);
    }

    private String envelope(HandlerPlan plan) {
        return "  notif := jsonb_build_object(\n"
                + "    'name', notif_name,\n"
                + "    'table', TG_TABLE_NAME,\n"
                + "    'event', TG_OP,\n"
                + "    'timestamp', CURRENT_TIMESTAMP,\n"
                + "    'data', notif_data\n"
                + "  );\n"
                + "  PERFORM pg_notify(" + quoteLiteral(plan.channelName()) + ", notif::text);\n"
                + "  RETURN NULL;\n";
    }

    // jsonb_build_object('col', image->'col', ...)
    private String buildObject(List<String> columns, String image) {
        return columns.stream()
                .map(column -> quoteLiteral(column) + ", " + image + "->" + quoteLiteral(column))
                .collect(Collectors.joining(", ", "jsonb_build_object(", ")"));
    }

    // A dollar-quote tag that cannot be terminated early by quoted names inside the body
    private String dollarTag(String body) {
        String tag = "$notify$";
        for (int i = 1; body.contains(tag); i++) {
            tag = "$notify" + i + "$";
        }
        return tag;
    }
}
