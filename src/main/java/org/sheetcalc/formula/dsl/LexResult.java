package org.sheetcalc.formula.dsl;

import java.util.List;

/**
 * Output of the lexer: the tokens, always terminated by EOF, and any lexical errors.
 *
 * @param tokens The token stream
 * @param errors Human readable lexical errors, empty when the text lexed cleanly
 */
public record LexResult(List<Token> tokens, List<String> errors) {

    public LexResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
