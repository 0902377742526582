package com.sqlrecall.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Tabular query result: ordered column names plus row values in column order.
 * Values survive the cache as JSON scalars (numbers, strings, booleans, nulls).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultTable {

    @Builder.Default
    private List<String> columns = new ArrayList<>();

    @Builder.Default
    private List<List<Object>> rows = new ArrayList<>();

    @JsonIgnore
    public int getRowCount() {
        return rows == null ? 0 : rows.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return getRowCount() == 0;
    }
}
