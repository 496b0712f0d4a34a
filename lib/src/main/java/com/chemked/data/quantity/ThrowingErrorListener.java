package com.chemked.data.quantity;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.RecognitionException;

/**
 * Reports the first lexer or parser error of one unit expression as a {@link UnitFormatException}
 * pointing at the offending character.
 */
final class ThrowingErrorListener extends BaseErrorListener {
    private final String expression;

    ThrowingErrorListener(String expression) {
        this.expression = expression;
    }

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        int column = charPositionInLine + 1;
        throw new UnitFormatException(
                expression,
                column,
                "Invalid unit expression '" + expression + "' at column " + column + ": " + msg,
                e);
    }
}
