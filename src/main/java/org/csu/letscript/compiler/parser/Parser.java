package org.csu.letscript.compiler.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.csu.letscript.common.exception.InvalidStatementException;
import org.csu.letscript.compiler.lexer.Token;
import org.csu.letscript.compiler.lexer.TokenType;
import org.csu.letscript.compiler.parser.ast.ExpressionNode;
import org.csu.letscript.compiler.parser.ast.ProgramNode;
import org.csu.letscript.compiler.parser.ast.StatementNode;
import org.csu.letscript.compiler.parser.ast.IdentifierNode;
import org.csu.letscript.compiler.parser.ast.LetStatementNode;
import org.csu.letscript.compiler.parser.ast.PrintStatementNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 语法分析器
 * 将外部词法分析器产出的 Token 序列转换为抽象语法树(AST)。
 * <p>
 * 解析器不持有任何可变状态，同一个实例可以重复使用，也可以在多个线程间共享。
 * 遇到第一个错误即抛出 {@link org.csu.letscript.common.exception.ParseException} 的子类，
 * 不做错误恢复，也不返回部分结果。
 */
public class Parser {

    private static final Logger log = LogManager.getLogger(Parser.class);

    private final ExpressionParser expressionParser;

    public Parser() {
        this(new ExpressionParser());
    }

    public Parser(int maxNestingDepth) {
        this(new ExpressionParser(maxNestingDepth));
    }

    public Parser(ExpressionParser expressionParser) {
        this.expressionParser = Objects.requireNonNull(expressionParser, "expressionParser");
    }

    public ProgramNode parseProgram(List<Token> tokens) {
        if (tokens.isEmpty()) {
            throw new InvalidStatementException("Empty program", tokens);
        }

        List<StatementNode> statements = new ArrayList<>();
        for (List<Token> chunk : TokenSplitter.splitTokens(tokens, TokenType.SEMICOLON)) {
            statements.add(parseStatement(chunk));
        }
        log.debug("parsed program with {} statement(s)", statements.size());
        return new ProgramNode(statements);
    }

    public StatementNode parseStatement(List<Token> tokens) {
        if (tokens.isEmpty()) {
            throw new InvalidStatementException("Empty statement", tokens);
        }

        TokenType type = tokens.get(0).type();
        if (type == TokenType.LET) {
            return parseLetStatement(tokens);
        }
        if (type == TokenType.PRINT) {
            log.debug("parse print statement");
            return new PrintStatementNode(parseExpression(tokens.subList(1, tokens.size())));
        }
        throw new InvalidStatementException("Expected 'let' or 'print' at the start of a statement", tokens);
    }

    public ExpressionNode parseExpression(List<Token> tokens) {
        return expressionParser.parseExpression(tokens);
    }

    private LetStatementNode parseLetStatement(List<Token> tokens) {
        log.debug("parse let statement");
        if (tokens.size() < 2 || tokens.get(1).type() != TokenType.IDENT) {
            throw new InvalidStatementException("Expected an identifier after 'let'", tokens);
        }
        IdentifierNode name = expressionParser.parseIdentifier(tokens.get(1));

        // 只在第一个 '=' 处切分，值表达式内部的 '=' 留给表达式解析器处理
        List<List<Token>> parts = TokenSplitter.splitTokens(tokens, TokenType.EQUAL, 2);
        if (parts.size() != 2) {
            throw new InvalidStatementException("Expected '=' followed by a value in let statement", tokens);
        }
        return new LetStatementNode(name, parseExpression(parts.get(1)));
    }
}
