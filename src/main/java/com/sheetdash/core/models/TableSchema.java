package com.sheetdash.core.models;

import com.sheetdash.core.enums.ColumnRole;
import com.sheetdash.core.enums.NameMode;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Column positions resolved by the schema validator.
 */
@Value
public class TableSchema {

    NameMode nameMode;
    Map<ColumnRole, Integer> columns;
    /** Month key to column index, iterated chronologically. */
    Map<MonthKey, Integer> monthColumns;

    @Builder
    public TableSchema(NameMode nameMode, Map<ColumnRole, Integer> columns, Map<MonthKey, Integer> monthColumns) {
        this.nameMode = nameMode;
        this.columns = Collections.unmodifiableMap(new EnumMap<>(columns));
        this.monthColumns = Collections.unmodifiableMap(new TreeMap<>(monthColumns));
    }

    public int columnOf(ColumnRole role) {
        Integer index = columns.get(role);
        if (index == null) {
            throw new IllegalStateException("Column " + role.getHeader() + " was not resolved");
        }
        return index;
    }

    public List<MonthKey> getMonthKeys() {
        return Collections.unmodifiableList(new ArrayList<>(monthColumns.keySet()));
    }
}
