package com.lineage.core.persistence.migration;

import com.lineage.core.persistence.TableNames;

/**
 * A live table rebuilt through a temporary table with the target columns.
 */
public record TableSwap(String liveTable, String targetColumns) {

    public String tempTable() {
        return TableNames.tempOf(liveTable);
    }

    public String createTempSql() {
        return "CREATE TABLE " + tempTable() + " (\n" + targetColumns + ")";
    }
}
