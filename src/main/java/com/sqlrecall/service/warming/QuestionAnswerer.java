package com.sqlrecall.service.warming;

/**
 * Produces a fresh answer for a question: SQL generation, execution and answer text.
 * Implemented by the query-handling side of the chat service; the cache only consumes it.
 */
public interface QuestionAnswerer {

    /**
     * Answer a question from scratch.
     *
     * @param question  natural language question
     * @param modelName model to generate the SQL with
     * @return generated SQL, answer text and optional tabular result
     */
    AnsweredQuestion answer(String question, String modelName);
}
