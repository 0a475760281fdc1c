package com.uclang.compiler.ast;

import com.uclang.compiler.analysis.types.UcTypes;
import com.uclang.compiler.analysis.types.UserType;
import com.uclang.compiler.ast.decl.FunctionDecl;
import com.uclang.compiler.ast.decl.StructDecl;
import com.uclang.compiler.ast.expr.FieldAccessExpr;
import com.uclang.compiler.ast.expr.Literal;
import com.uclang.compiler.ast.expr.NameExpr;
import com.uclang.compiler.ast.stmt.ForStmt;
import com.uclang.compiler.ast.stmt.IfStmt;
import com.uclang.compiler.ast.type.SimpleTypeName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AST 节点测试")
class AstNodeTest {

    private final AstBuilder b = new AstBuilder();

    @Nested
    @DisplayName("节点编号")
    class Ids {

        @Test
        @DisplayName("按创建顺序分配，子节点先于父节点")
        void creationOrder() {
            NameExpr x = b.name("x");
            Literal one = b.integer(1);
            FieldAccessExpr access = b.fieldAccess(b.name("p"), "y");

            assertEquals(0, x.getId());
            assertEquals(1, one.getId());
            assertEquals(3, access.getId());
            assertEquals(2, access.getReceiver().getId());
            assertEquals(4, b.getArena().getNodes().size());
            assertSame(access, b.getArena().getNodes().get(3));
        }

        @Test
        @DisplayName("同一节点不能登记两次")
        void doubleRegistration() {
            NameExpr x = b.name("x");
            assertThrows(IllegalStateException.class, () -> b.getArena().add(x));
            assertThrows(IllegalStateException.class, () -> new AstArena().add(x));
        }

        @Test
        @DisplayName("直接构造的节点未登记")
        void unregistered() {
            assertEquals(-1, new NameExpr(SourceLocation.atLine(1), "x").getId());
        }
    }

    @Nested
    @DisplayName("子节点")
    class Children {

        @Test
        @DisplayName("缺省的 else 不出现在子节点中")
        void missingElse() {
            IfStmt withElse = b.ifStmt(b.bool(true), b.block(), b.block());
            IfStmt withoutElse = b.ifStmt(b.bool(true), b.block(), null);
            assertEquals(3, withElse.getChildren().size());
            assertEquals(2, withoutElse.getChildren().size());
            assertFalse(withoutElse.hasElse());
        }

        @Test
        @DisplayName("for 只包含出现的部分")
        void forParts() {
            ForStmt empty = b.forStmt(null, null, null, b.block());
            assertEquals(1, empty.getChildren().size());
            ForStmt update = b.forStmt(null, null, b.name("i"), b.block());
            assertSame(update.getUpdate(), update.getChildren().get(0));
        }

        @Test
        @DisplayName("函数的子节点依次为返回类型、参数、局部变量、函数体")
        void functionChildren() {
            FunctionDecl f = b.function(b.type("int"), "f", AstBuilder.list(b.param("int", "a")),
                    AstBuilder.list(b.var("long", "x"), b.var("long", "y")), b.block());
            assertEquals(5, f.getChildren().size());
            assertSame(f.getReturnType(), f.getChildren().get(0));
            assertSame(f.getBody(), f.getChildren().get(4));
        }
    }

    @Nested
    @DisplayName("延迟属性")
    class LateAttributes {

        @Test
        @DisplayName("未计算时读取抛出异常")
        void readBeforeSet() {
            NameExpr x = b.name("x");
            SimpleTypeName t = b.type("int");
            StructDecl s = b.struct("S");
            FunctionDecl f = b.function("void", "f");

            assertFalse(x.isTyped());
            assertNull(x.peekType());
            assertThrows(IllegalStateException.class, x::getType);
            assertFalse(t.isResolved());
            assertThrows(IllegalStateException.class, t::getType);
            assertFalse(s.isTypeRegistered());
            assertThrows(IllegalStateException.class, s::getType);
            assertFalse(f.isFunctionRegistered());
            assertThrows(IllegalStateException.class, f::getFunction);
        }

        @Test
        @DisplayName("设置后可以读取")
        void readAfterSet() {
            NameExpr x = b.name("x");
            x.setType(UcTypes.FLOAT);
            assertTrue(x.isTyped());
            assertSame(UcTypes.FLOAT, x.getType());
        }
    }

    @Test
    @DisplayName("数组长度字段不是左值，结构体字段是")
    void fieldLvalue() {
        FieldAccessExpr length = b.fieldAccess(b.name("a"), "length");
        length.getReceiver().setType(UcTypes.INT.getArrayType());
        assertTrue(length.isLengthField());
        assertFalse(length.isLvalue());

        FieldAccessExpr field = b.fieldAccess(b.name("p"), "length");
        field.getReceiver().setType(new UserType("P", b.struct("P")));
        assertTrue(field.isLvalue());
        assertFalse(b.integer(1).isLvalue());
        assertTrue(b.index(b.name("a"), b.integer(0)).isLvalue());
    }

    @Test
    @DisplayName("整数字面量的 long 后缀")
    void longSuffix() {
        assertTrue(b.integer("7L").hasLongSuffix());
        assertTrue(b.integer("7l").hasLongSuffix());
        assertFalse(b.integer("7").hasLongSuffix());
        assertFalse(b.floating("7.0").hasLongSuffix());
    }
}
