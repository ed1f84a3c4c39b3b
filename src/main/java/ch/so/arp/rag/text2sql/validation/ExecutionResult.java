package ch.so.arp.rag.text2sql.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows returned by an executed query, capped at the configured maximum.
 *
 * @param columns column labels in select order
 * @param rows row values in column order
 * @param truncated whether more rows were available than returned
 */
public record ExecutionResult(List<String> columns, List<List<Object>> rows, boolean truncated) {

    public ExecutionResult {
        columns = List.copyOf(columns);
        rows = rows.stream().map(row -> Collections.unmodifiableList(new ArrayList<>(row))).toList();
    }

    public int rowCount() {
        return rows.size();
    }
}
