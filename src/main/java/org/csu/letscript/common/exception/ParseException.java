package org.csu.letscript.common.exception;

import lombok.Getter;
import org.csu.letscript.compiler.lexer.Token;

import java.util.List;

/**
 * 语法分析阶段所有错误的基类。
 * 携带出错的 Token 区间，方便调用方输出诊断信息。
 */
@Getter
public class ParseException extends RuntimeException {

    private final List<Token> tokens;

    public ParseException(String message, List<Token> tokens) {
        super(message + ": " + tokens);
        this.tokens = List.copyOf(tokens);
    }
}
