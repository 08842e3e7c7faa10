package org.csu.letscript.compiler.parser;

import org.csu.letscript.compiler.lexer.Token;
import org.csu.letscript.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Token 序列的切分工具。
 * 所有方法都是纯函数，不会修改传入的列表。
 */
public final class TokenSplitter {

    private TokenSplitter() {
    }

    public static List<List<Token>> splitTokens(List<Token> tokens, TokenType delimiter) {
        return splitTokens(tokens, delimiter, 0);
    }

    /**
     * 按分隔符切分 Token 序列，分隔符本身被丢弃。
     * <p>
     * 当 maxChunks &gt; 0 且已完成的块数达到 maxChunks - 1 时停止切分，
     * 剩余的 Token (包括其中的分隔符) 原样追加到当前块中。
     * 末尾为空的累积不会产生空块，但两个相邻分隔符之间的空块会被保留。
     *
     * @param maxChunks 最多产出的块数，&lt;= 0 表示不限
     */
    public static List<List<Token>> splitTokens(List<Token> tokens, TokenType delimiter, int maxChunks) {
        List<List<Token>> chunks = new ArrayList<>();
        List<Token> current = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            if (maxChunks > 0 && chunks.size() == maxChunks - 1) {
                current.addAll(tokens.subList(i, tokens.size()));
                break;
            }

            Token token = tokens.get(i);
            if (token.type() == delimiter) {
                chunks.add(current);
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }

        if (!current.isEmpty()) {
            chunks.add(current);
        }
        return chunks;
    }

    /**
     * 从右向左寻找第一个处于括号深度 0 的运算符，并在该处切分。
     * <p>
     * 注意深度的方向与从左向右扫描相反: 逆向扫描时先遇到 RPAREN，
     * 因此 RPAREN 使深度 +1，LPAREN 使深度 -1。只有位于任何括号组之外的 Token
     * 深度才为 0。右括号多余导致的负深度不会匹配，也不视为错误。
     * <p>
     * 选择最右侧的运算符作为最外层节点，使同级运算符左结合: a - b - c 切分为 (a - b) - c。
     *
     * @return 切分结果；没有顶层运算符时返回 {@link Optional#empty()}
     */
    public static Optional<TokenSplitResult> splitByTopLevelOperator(List<Token> tokens, Set<TokenType> operatorTypes) {
        int reverseDepth = 0;

        for (int i = tokens.size() - 1; i >= 0; i--) {
            Token token = tokens.get(i);

            if (token.type() == TokenType.RPAREN) {
                reverseDepth++;
            } else if (token.type() == TokenType.LPAREN) {
                reverseDepth--;
            }

            if (reverseDepth == 0 && operatorTypes.contains(token.type())) {
                return Optional.of(new TokenSplitResult(
                        tokens.subList(0, i),
                        token,
                        tokens.subList(i + 1, tokens.size())));
            }
        }
        return Optional.empty();
    }
}
