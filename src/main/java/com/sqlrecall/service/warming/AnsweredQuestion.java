package com.sqlrecall.service.warming;

import com.sqlrecall.model.ResultTable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A freshly generated answer, ready to be cached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnsweredQuestion {
    private String sqlQuery;
    private String answer;
    private ResultTable table;
}
