package org.csu.letscript.compiler.parser;

import org.csu.letscript.compiler.lexer.Token;

import java.util.List;

/**
 * 一次顶层运算符切分的结果: 运算符左侧、运算符本身、运算符右侧。
 * 仅在解析过程中临时使用，不属于 AST。
 */
public record TokenSplitResult(List<Token> left, Token operator, List<Token> right) {

    public TokenSplitResult {
        left = List.copyOf(left);
        right = List.copyOf(right);
    }
}
