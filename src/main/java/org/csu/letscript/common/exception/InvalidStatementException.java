package org.csu.letscript.common.exception;

import org.csu.letscript.compiler.lexer.Token;

import java.util.List;

/**
 * 语句为空、不以 LET / PRINT 开头，或 let 语句缺少名称 / 赋值部分。
 */
public class InvalidStatementException extends ParseException {

    public InvalidStatementException(String message, List<Token> tokens) {
        super(message, tokens);
    }
}
