package com.noi.backend.services.extraction.preprocessing;

import java.util.List;

/**
 * Role assignment for the columns of one table.
 *
 * @param categoryColumn index of the label column, -1 when every column is numeric
 * @param valueColumn    index of the value column, -1 for an empty table
 * @param keptColumns    columns that survive placeholder filtering, in order
 * @param numericRatios  share of numeric cells per column, indexed like the table
 * @param valueColumnDefaulted true when no column passed the ratio and the last column was taken
 */
public record ColumnRoles(int categoryColumn, int valueColumn, List<Integer> keptColumns, List<Double> numericRatios,
        boolean valueColumnDefaulted) {

    public boolean hasPairs() {
        return categoryColumn >= 0 && valueColumn >= 0 && categoryColumn != valueColumn;
    }

    public int numericColumnCount(double threshold) {
        int n = 0;
        for (int c : keptColumns) {
            if (numericRatios.get(c) > threshold) n++;
        }
        return n;
    }
}
