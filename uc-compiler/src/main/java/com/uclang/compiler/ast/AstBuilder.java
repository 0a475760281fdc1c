package com.uclang.compiler.ast;

import com.uclang.compiler.ast.decl.*;
import com.uclang.compiler.ast.expr.*;
import com.uclang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.uclang.compiler.ast.expr.Literal.LiteralKind;
import com.uclang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.uclang.compiler.ast.stmt.*;
import com.uclang.compiler.ast.type.ArrayTypeName;
import com.uclang.compiler.ast.type.SimpleTypeName;
import com.uclang.compiler.ast.type.TypeName;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * AST 构建器：上游解析器的接入口。
 *
 * <p>所有节点都登记到同一个 {@link AstArena}，位置取自 {@link #at(int)} 设置的当前行号。</p>
 */
public final class AstBuilder {

    private final AstArena arena;
    private final String file;
    private int line = 1;

    public AstBuilder() {
        this(null);
    }

    /** file 为 null 时位置只带行号 */
    public AstBuilder(String file) {
        this.arena = new AstArena();
        this.file = file;
    }

    public AstArena getArena() {
        return arena;
    }

    /** 设置后续节点的行号 */
    public AstBuilder at(int line) {
        this.line = line;
        return this;
    }

    private SourceLocation loc() {
        return file == null ? SourceLocation.atLine(line) : new SourceLocation(file, line, 0);
    }

    @SafeVarargs
    public static <T> List<T> list(T... items) {
        return new ArrayList<T>(Arrays.asList(items));
    }

    // ============ 声明 ============

    public Program program(Declaration... declarations) {
        return arena.add(new Program(loc(), list(declarations)));
    }

    public StructDecl struct(String name, VarDecl... fields) {
        return arena.add(new StructDecl(loc(), name, list(fields)));
    }

    public FunctionDecl function(TypeName returnType, String name, List<Parameter> params,
                                 List<VarDecl> locals, Block body) {
        return arena.add(new FunctionDecl(loc(), returnType, name, params, locals, body));
    }

    /** 无参数、无局部变量的函数 */
    public FunctionDecl function(String returnType, String name, Statement... body) {
        return function(type(returnType), name, new ArrayList<Parameter>(), new ArrayList<VarDecl>(),
                block(body));
    }

    public VarDecl var(TypeName type, String name) {
        return arena.add(new VarDecl(loc(), type, name));
    }

    public VarDecl var(String type, String name) {
        return var(type(type), name);
    }

    public Parameter param(TypeName type, String name) {
        return arena.add(new Parameter(loc(), type, name));
    }

    public Parameter param(String type, String name) {
        return param(type(type), name);
    }

    // ============ 类型名 ============

    public SimpleTypeName type(String name) {
        return arena.add(new SimpleTypeName(loc(), name));
    }

    public ArrayTypeName arrayOf(TypeName elementType) {
        return arena.add(new ArrayTypeName(loc(), elementType));
    }

    public ArrayTypeName arrayOf(String elementType) {
        return arrayOf(type(elementType));
    }

    // ============ 语句 ============

    public Block block(Statement... statements) {
        return arena.add(new Block(loc(), list(statements)));
    }

    public IfStmt ifStmt(Expression condition, Block thenBranch, Block elseBranch) {
        return arena.add(new IfStmt(loc(), condition, thenBranch, elseBranch));
    }

    public WhileStmt whileStmt(Expression condition, Block body) {
        return arena.add(new WhileStmt(loc(), condition, body));
    }

    /** init、condition、update 可为 null */
    public ForStmt forStmt(Expression init, Expression condition, Expression update, Block body) {
        return arena.add(new ForStmt(loc(), init, condition, update, body));
    }

    public BreakStmt breakStmt() {
        return arena.add(new BreakStmt(loc()));
    }

    public ContinueStmt continueStmt() {
        return arena.add(new ContinueStmt(loc()));
    }

    /** value 为 null 表示无返回值 */
    public ReturnStmt returnStmt(Expression value) {
        return arena.add(new ReturnStmt(loc(), value));
    }

    public ExpressionStmt exprStmt(Expression expression) {
        return arena.add(new ExpressionStmt(loc(), expression));
    }

    // ============ 表达式 ============

    public Literal literal(LiteralKind kind, String text) {
        return arena.add(new Literal(loc(), kind, text));
    }

    /** 整数字面量，text 可带 L 后缀 */
    public Literal integer(String text) {
        return literal(LiteralKind.INTEGER, text);
    }

    public Literal integer(int value) {
        return integer(String.valueOf(value));
    }

    public Literal floating(String text) {
        return literal(LiteralKind.FLOAT, text);
    }

    /** 字符串字面量，contents 为引号内的源码文本 */
    public Literal str(String contents) {
        return literal(LiteralKind.STRING, "\"" + contents + "\"");
    }

    public Literal bool(boolean value) {
        return literal(LiteralKind.BOOLEAN, String.valueOf(value));
    }

    public Literal nullLiteral() {
        return literal(LiteralKind.NULL, "nullptr");
    }

    public NameExpr name(String name) {
        return arena.add(new NameExpr(loc(), name));
    }

    public CallExpr call(String name, Expression... args) {
        return arena.add(new CallExpr(loc(), name, list(args)));
    }

    public NewExpr newObject(String typeName, Expression... args) {
        return arena.add(new NewExpr(loc(), typeName, list(args)));
    }

    public NewArrayExpr newArray(TypeName elementType, Expression... args) {
        return arena.add(new NewArrayExpr(loc(), elementType, list(args)));
    }

    public FieldAccessExpr fieldAccess(Expression receiver, String fieldName) {
        return arena.add(new FieldAccessExpr(loc(), receiver, fieldName));
    }

    public IndexExpr index(Expression receiver, Expression index) {
        return arena.add(new IndexExpr(loc(), receiver, index));
    }

    public UnaryExpr unary(UnaryOp operator, Expression operand) {
        return arena.add(new UnaryExpr(loc(), operator, operand));
    }

    public BinaryExpr binary(Expression left, BinaryOp operator, Expression right) {
        return arena.add(new BinaryExpr(loc(), left, operator, right));
    }

    public AssignExpr assign(Expression target, Expression value) {
        return arena.add(new AssignExpr(loc(), target, value));
    }
}
