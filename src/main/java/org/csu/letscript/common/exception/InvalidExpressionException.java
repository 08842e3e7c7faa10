package org.csu.letscript.common.exception;

import org.csu.letscript.compiler.lexer.Token;

import java.util.List;

/**
 * 给定的 Token 区间不匹配任何表达式规则 (字面量、括号、二元运算)。
 */
public class InvalidExpressionException extends ParseException {

    public InvalidExpressionException(String message, List<Token> tokens) {
        super(message, tokens);
    }
}
