package ward.runtime.engine;

import ward.runtime.AbstractInstantiationException;
import ward.runtime.DefinitionException;
import ward.runtime.engine.cache.CacheStats;
import ward.runtime.types.Members;
import ward.runtime.types.Modifier;
import ward.runtime.types.Visibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 接口定义、implements 检查与 instanceOf
 */
class ConformanceCheckerTest {

    private WardRuntime runtime;
    private WardInterface shape;

    @BeforeEach
    void setUp() {
        runtime = new WardRuntime();
        shape = runtime.defineInterface("Shape")
                .method("area", 0)
                .data("name")
                .define();
    }

    /** 公有 area / name，不声明实现 */
    private WardClass defineSquare(String id) {
        return runtime.defineClass(id)
                .attribute("name", "square")
                .member(Members.method("area", 0, (self, args) -> 4))
                .define();
    }

    // ============ implements ============

    @Nested
    @DisplayName("implements 定义期检查")
    class ImplementsTests {

        @Test
        @DisplayName("缺少成员时报错并指出成员名")
        void testMissingMember() {
            DefinitionException e = assertThrows(DefinitionException.class, () -> runtime.defineClass("Circle")
                    .implement(shape)
                    .member(Members.method("area", 0, (self, args) -> 3.14))
                    .define());

            assertTrue(e.getMessage().contains("missing member 'name'"));
            assertTrue(e.getMessage().contains("'Shape'"));
            assertNull(runtime.findClass("Circle"));
        }

        @Test
        @DisplayName("参数个数不符报错")
        void testArityMismatch() {
            assertThrows(DefinitionException.class, () -> runtime.defineClass("Circle")
                    .implement(shape)
                    .attribute("name", "circle")
                    .member(Members.method("area", 1, (self, args) -> 3.14))
                    .define());
        }

        @Test
        @DisplayName("数据要求不能由方法满足")
        void testKindMismatch() {
            assertThrows(DefinitionException.class, () -> runtime.defineClass("Circle")
                    .implement(shape)
                    .member(Members.method("name", 0, (self, args) -> "circle"))
                    .member(Members.method("area", 0, (self, args) -> 3.14))
                    .define());
        }

        @Test
        @DisplayName("完全符合的类通过精确检查")
        void testConforming() {
            WardClass circle = runtime.defineClass("Circle")
                    .implement(shape)
                    .member(Members.constant("name", "circle"))
                    .member(Members.method("area", 0, (self, args) -> 3.14))
                    .define();
            WardObject c = circle.newInstance();

            assertTrue(runtime.instanceOf(c, shape, false));
            assertTrue(runtime.instanceOf(c, shape, true));
        }

        @Test
        @DisplayName("继承的成员和可变参数方法满足要求")
        void testInheritedAndVarargs() {
            WardClass base = runtime.defineClass("Base")
                    .attribute("name", "base")
                    .member(Members.method("area", -1, (self, args) -> 0))
                    .define();
            WardClass derived = runtime.defineClass("Derived").extend(base).implement(shape).define();

            assertTrue(runtime.instanceOf(derived.newInstance(), shape, false));
        }

        @Test
        @DisplayName("子接口的实现也满足父接口")
        void testSubInterface() {
            WardInterface polygon = runtime.defineInterface("Polygon")
                    .extend(shape)
                    .method("sides", 0)
                    .define();
            WardClass triangle = runtime.defineClass("Triangle")
                    .implement(polygon)
                    .attribute("name", "triangle")
                    .member(Members.method("area", 0, (self, args) -> 1))
                    .member(Members.method("sides", 0, (self, args) -> 3))
                    .define();
            WardObject t = triangle.newInstance();

            assertTrue(runtime.instanceOf(t, polygon, false));
            assertTrue(runtime.instanceOf(t, shape, false));
            assertTrue(polygon.isSubInterfaceOf(shape));
            assertEquals(3, polygon.getRequiredMembers().size());
        }

        @Test
        @DisplayName("子接口缺少父接口的成员时报错")
        void testSubInterfaceMissingInherited() {
            WardInterface polygon = runtime.defineInterface("Polygon").extend(shape).method("sides", 0).define();

            DefinitionException e = assertThrows(DefinitionException.class, () -> runtime.defineClass("Line")
                    .implement(polygon)
                    .member(Members.method("sides", 0, (self, args) -> 1))
                    .member(Members.method("area", 0, (self, args) -> 0))
                    .define());
            assertTrue(e.getMessage().contains("'name'"));
        }
    }

    // ============ instanceOf ============

    @Nested
    @DisplayName("instanceOf")
    class InstanceOfTests {

        @Test
        @DisplayName("鸭子类型：不声明也符合")
        void testDuckTyped() {
            WardObject s = defineSquare("Square").newInstance();

            assertTrue(runtime.instanceOf(s, shape));
            assertTrue(runtime.instanceOf(s, shape, true));
            assertFalse(runtime.instanceOf(s, shape, false));
        }

        @Test
        @DisplayName("私有 / 受保护的匹配视为不存在，即使声明了实现")
        void testHiddenMatchCountsAsAbsent() {
            WardClass shy = runtime.defineClass("Shy")
                    .implement(shape)
                    .attribute("name", "shy")
                    .member(Members.method("area", 0, (self, args) -> 1).visibility(Visibility.PRIVATE))
                    .define();
            WardObject s = shy.newInstance();

            assertFalse(runtime.instanceOf(s, shape, true));
            assertTrue(runtime.instanceOf(s, shape, false));

            WardClass guarded = runtime.defineClass("Guarded")
                    .member(Members.protectedVar("name"))
                    .member(Members.method("area", 0, (self, args) -> 1))
                    .define();
            assertFalse(runtime.instanceOf(guarded.newInstance(), shape, true));
        }

        @Test
        @DisplayName("未覆盖的抽象方法不符合")
        void testAbstractNotConforming() {
            WardClass sketch = runtime.defineClass("Sketch")
                    .modifiers(Modifier.ABSTRACT)
                    .attribute("name", "sketch")
                    .member(Members.abstractMethod("area", 0))
                    .define();
            WardClass draft = runtime.defineClass("Draft").extend(sketch).define();

            assertFalse(runtime.instanceOf(draft.newInstance(), shape, true));
        }

        @Test
        @DisplayName("下划线开头的接口成员不要求")
        void testHiddenInterfaceMember() {
            WardInterface sized = runtime.defineInterface("Sized")
                    .method("size", 0)
                    .method("_cache", 0)
                    .define();
            WardObject bag = runtime.defineClass("Bag")
                    .member(Members.method("size", 0, (self, args) -> 0))
                    .define().newInstance();

            assertTrue(runtime.instanceOf(bag, sized));
        }

        @Test
        @DisplayName("类作为类型时按继承链判断")
        void testClassLineage() {
            WardClass animal = runtime.defineClass("Animal").define();
            WardClass cat = runtime.defineClass("Cat").extend(animal).define();

            assertTrue(runtime.instanceOf(cat.newInstance(), animal));
            assertFalse(runtime.instanceOf(animal.newInstance(), cat));
            assertFalse(runtime.instanceOf("cat", animal));
        }

        @Test
        @DisplayName("类对象按静态成员和常量判断")
        void testClassObject() {
            WardInterface countable = runtime.defineInterface("Countable").data("total").define();
            WardClass tally = runtime.defineClass("Tally")
                    .member(Members.staticVar("total").defaultValue(0))
                    .define();
            WardClass box = runtime.defineClass("Box").attribute("total", 0).define();

            assertTrue(runtime.instanceOf(tally, countable));
            assertFalse(runtime.instanceOf(box, countable));
            assertTrue(runtime.instanceOf(box.newInstance(), countable));
        }

        @Test
        @DisplayName("声明了但未赋值且无默认值的数据成员视为不存在")
        void testUnassignedDataCountsAsAbsent() {
            WardClass blank = runtime.defineClass("Blank")
                    .member(Members.publicVar("name"))
                    .member(Members.method("area", 0, (self, args) -> 0))
                    .define();
            WardObject b = blank.newInstance();

            assertFalse(runtime.instanceOf(b, shape, true));
            b.set("name", "blank");
            assertTrue(runtime.instanceOf(b, shape, true));
            b.delete("name");
            assertFalse(runtime.instanceOf(b, shape, true));

            WardInterface countable = runtime.defineInterface("Countable").data("total").define();
            WardClass tally = runtime.defineClass("Tally").member(Members.staticVar("total")).define();
            assertFalse(runtime.instanceOf(tally, countable));
            tally.set("total", 3);
            assertTrue(runtime.instanceOf(tally, countable));
        }

        @Test
        @DisplayName("Java 对象反射探测并缓存结果")
        void testReflectiveProbe() {
            WardInterface sized = runtime.defineInterface("Sized").method("size", 0).define();

            assertTrue(runtime.instanceOf(new ArrayList<Object>(), sized));
            assertTrue(runtime.instanceOf(new ArrayList<Object>(), sized));
            assertFalse(runtime.instanceOf("text", runtime.defineInterface("Pointed").data("x").define()));
            assertTrue(runtime.instanceOf(new Point(), runtime.findInterface("Pointed")));

            CacheStats stats = runtime.getConformanceCacheStats();
            assertEquals(1L, stats.getHitCount());
            assertEquals(3L, stats.getMissCount());
        }

        @Test
        @DisplayName("null 对象返回 false，非法类型抛出 IllegalArgumentException")
        void testArguments() {
            assertFalse(runtime.instanceOf(null, shape));
            assertThrows(IllegalArgumentException.class, () -> runtime.instanceOf(new Object(), null));
            assertThrows(IllegalArgumentException.class, () -> runtime.instanceOf(new Object(), "Shape"));
            assertTrue(runtime.instanceOf("text", String.class));
        }

        @Test
        @DisplayName("严格策略默认按显式声明判断")
        void testStrictDefault() {
            WardRuntime strict = new WardRuntime(WardPolicy.strict());
            WardInterface iface = strict.defineInterface("Shape").method("area", 0).define();
            WardObject square = strict.defineClass("Square")
                    .member(Members.method("area", 0, (self, args) -> 4))
                    .define().newInstance();

            assertFalse(strict.instanceOf(square, iface));
            assertTrue(strict.instanceOf(square, iface, true));
        }
    }

    // ============ 注册表 ============

    @Nested
    @DisplayName("接口注册")
    class RegistryTests {

        @Test
        @DisplayName("重复的接口 id 报错")
        void testDuplicate() {
            assertThrows(DefinitionException.class, () -> runtime.defineInterface("Shape").define());
            assertSame(shape, runtime.findInterface("Shape"));
        }

        @Test
        @DisplayName("接口不能实例化")
        void testInstantiateInterface() {
            AbstractInstantiationException e = assertThrows(AbstractInstantiationException.class,
                    () -> runtime.instantiate(shape));
            assertEquals("Shape", e.getTypeName());
        }

        @Test
        @DisplayName("instantiate 创建类实例")
        void testInstantiateClass() {
            WardClass square = defineSquare("Square");
            assertTrue(runtime.instantiate(square) instanceof WardObject);
        }

        @Test
        @DisplayName("父接口签名冲突报错")
        void testConflictingParents() {
            WardInterface measured = runtime.defineInterface("Measured").method("area", 1).define();

            assertThrows(DefinitionException.class,
                    () -> runtime.defineInterface("Both").extend(shape, measured).define());
            assertNull(runtime.findInterface("Both"));
        }
    }

    /** 反射探测用：公有字段 x */
    public static class Point {
        public int x;
    }
}
