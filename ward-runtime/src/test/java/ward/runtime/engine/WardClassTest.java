package ward.runtime.engine;

import ward.runtime.AccessDeniedException;
import ward.runtime.DefinitionException;
import ward.runtime.MemberNotFoundException;
import ward.runtime.WardException;
import ward.runtime.types.DenyReason;
import ward.runtime.types.Members;
import ward.runtime.types.Modifier;
import ward.runtime.types.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 类增强、属性表分派与实例化
 */
class WardClassTest {

    private WardRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new WardRuntime();
    }

    // ============ 增强 ============

    @Nested
    @DisplayName("类增强")
    class AugmentTests {

        @Test
        @DisplayName("同一个定义重复增强返回同一个类")
        void testIdempotent() {
            ClassDefinition def = ClassDefinition.builder("Point").attribute("x", 0).build();

            WardClass first = runtime.encapsulate(def);
            assertSame(first, runtime.encapsulate(def));
            assertSame(first, runtime.encapsulate(first));
            assertSame(first, runtime.findClass("Point"));
        }

        @Test
        @DisplayName("重复的类 id 报错")
        void testDuplicateId() {
            runtime.defineClass("Point").define();
            assertThrows(DefinitionException.class, () -> runtime.defineClass("Point").define());
        }

        @Test
        @DisplayName("未绑定运行时的 Builder 不能 define")
        void testUnboundBuilder() {
            assertThrows(IllegalStateException.class, () -> ClassDefinition.builder("Loose").define());
        }

        @Test
        @DisplayName("类级修饰符只允许 abstract / final")
        void testClassModifiers() {
            assertThrows(DefinitionException.class,
                    () -> runtime.defineClass("Bad").modifiers(Modifier.STATIC).define());
        }

        @Test
        @DisplayName("未标记的类体属性是带默认值的公有变量")
        void testAttribute() {
            WardClass point = runtime.defineClass("Point").attribute("x", 0).define();
            WardObject p = point.newInstance();

            assertEquals(0, p.get("x"));
            p.set("x", 5);
            assertEquals(5, p.get("x"));
            assertTrue(point.hasMember("x"));
        }

        @Test
        @DisplayName("运行期声明成员被拒绝")
        void testDynamicDeclarationRejected() {
            WardClass point = runtime.defineClass("Point").define();
            WardObject p = point.newInstance();

            assertThrows(DefinitionException.class, () -> p.set("y", Members.variable("y")));
            assertThrows(DefinitionException.class, () -> point.set("y", Members.variable("y").build()));
            assertFalse(point.hasMember("y"));
        }
    }

    // ============ 变量 ============

    @Nested
    @DisplayName("变量读写")
    class VariableTests {

        @Test
        @DisplayName("未赋值且无默认值读到 null")
        void testUnsetReadsNull() {
            WardObject o = runtime.defineClass("Box").member(Members.variable("content")).define().newInstance();
            assertNull(o.get("content"));
        }

        @Test
        @DisplayName("删除变量恢复默认值")
        void testDeleteResetsDefault() {
            WardObject o = runtime.defineClass("Box").attribute("size", 1).define().newInstance();

            o.set("size", 9);
            o.delete("size");
            assertEquals(1, o.get("size"));
        }

        @Test
        @DisplayName("实例之间存储独立")
        void testIndependentInstances() {
            WardClass box = runtime.defineClass("Box").attribute("size", 1).define();
            WardObject a = box.newInstance();
            WardObject b = box.newInstance();

            a.set("size", 2);
            assertEquals(2, a.get("size"));
            assertEquals(1, b.get("size"));
        }

        @Test
        @DisplayName("类级访问实例变量报错")
        void testClassScopeInstanceVariable() {
            WardClass box = runtime.defineClass("Box").attribute("size", 1).define();

            WardException e = assertThrows(WardException.class, () -> box.get("size"));
            assertTrue(e.getMessage().contains("class scope"));
        }

        @Test
        @DisplayName("不存在的成员抛出 MemberNotFoundException")
        void testNotFound() {
            WardClass box = runtime.defineClass("Box").define();

            assertThrows(MemberNotFoundException.class, () -> box.newInstance().get("missing"));
            assertThrows(MemberNotFoundException.class, () -> box.get("missing"));
            assertThrows(MemberNotFoundException.class, () -> box.newInstance().delete("missing"));
        }
    }

    // ============ 静态成员 ============

    @Nested
    @DisplayName("静态成员")
    class StaticTests {

        @Test
        @DisplayName("类与所有实例共享存储")
        void testSharedStorage() {
            WardClass counter = runtime.defineClass("Counter")
                    .member(Members.staticVar("count", TypeTags.INT).defaultValue(0))
                    .define();
            WardObject a = counter.newInstance();
            WardObject b = counter.newInstance();

            a.set("count", 3);
            assertEquals(3, b.get("count"));
            assertEquals(3, counter.get("count"));

            counter.set("count", 4);
            assertEquals(4, a.get("count"));
        }

        @Test
        @DisplayName("子类实例写入落到声明类")
        void testSubclassWritesDeclaringClass() {
            WardClass base = runtime.defineClass("Base")
                    .member(Members.staticVar("registry").defaultValue("empty"))
                    .define();
            WardClass derived = runtime.defineClass("Derived").extend(base).define();

            derived.newInstance().set("registry", "full");
            assertEquals("full", base.get("registry"));
            assertEquals("full", derived.get("registry"));
        }

        @Test
        @DisplayName("静态方法无接收者")
        void testStaticMethod() {
            WardClass factory = runtime.defineClass("Factory")
                    .member(Members.staticVar("made").defaultValue(0))
                    .member(Members.method("make", 0, (self, args) -> {
                        self.set("made", (Integer) self.get("made") + 1);
                        return self.getReceiver();
                    }).staticScope())
                    .define();

            assertNull(factory.invoke("make"));
            assertNull(factory.newInstance().invoke("make"));
            assertEquals(2, factory.get("made"));
        }

        @Test
        @DisplayName("静态方法访问实例成员报错")
        void testStaticMethodInstanceAccess() {
            WardClass broken = runtime.defineClass("Broken")
                    .attribute("value", 1)
                    .member(Members.method("peek", 0, (self, args) -> self.get("value")).staticScope())
                    .define();

            assertThrows(WardException.class, () -> broken.invoke("peek"));
        }

        @Test
        @DisplayName("类级调用实例方法报错")
        void testClassScopeInstanceMethod() {
            WardClass greeter = runtime.defineClass("Greeter")
                    .member(Members.method("hello", 0, (self, args) -> "hi"))
                    .define();

            assertThrows(WardException.class, () -> greeter.invoke("hello"));
            assertEquals("hi", greeter.newInstance().invoke("hello"));
        }
    }

    // ============ 方法 ============

    @Nested
    @DisplayName("方法")
    class MethodTests {

        @Test
        @DisplayName("参数个数不符报错")
        void testArityMismatch() {
            WardObject o = runtime.defineClass("Calc")
                    .member(Members.method("add", 2, (self, args) -> (Integer) args.get(0) + (Integer) args.get(1)))
                    .define().newInstance();

            assertEquals(3, o.invoke("add", 1, 2));
            assertThrows(WardException.class, () -> o.invoke("add", 1));
        }

        @Test
        @DisplayName("可变参数方法接受任意个数")
        void testVarargs() {
            WardObject o = runtime.defineClass("Joiner")
                    .member(Members.method("join", -1, (self, args) -> String.valueOf(args)))
                    .define().newInstance();

            assertEquals("[]", o.invoke("join"));
            assertEquals(Arrays.asList("a", "b").toString(), o.invoke("join", "a", "b"));
        }

        @Test
        @DisplayName("方法不能作为数据写入或删除")
        void testMethodWriteDenied() {
            WardObject o = runtime.defineClass("Greeter")
                    .member(Members.method("hello", 0, (self, args) -> "hi"))
                    .define().newInstance();

            AccessDeniedException e = assertThrows(AccessDeniedException.class, () -> o.set("hello", "bye"));
            assertEquals(DenyReason.METHOD, e.getReason());
            assertEquals(Operation.WRITE, e.getOperation());
            assertThrows(AccessDeniedException.class, () -> o.delete("hello"));
        }

        @Test
        @DisplayName("读取方法得到绑定方法")
        void testBoundMethod() {
            WardObject o = runtime.defineClass("Greeter")
                    .member(Members.method("hello", 1, (self, args) -> "hi " + args.get(0)))
                    .define().newInstance();

            BoundMethod m = (BoundMethod) o.get("hello");
            assertSame(o, m.getReceiver());
            assertEquals(1, m.getArity());
            assertEquals("hi bob", m.call("bob"));
        }

        @Test
        @DisplayName("非方法成员不可调用")
        void testNotCallable() {
            WardObject o = runtime.defineClass("Box").attribute("size", 1).define().newInstance();
            assertThrows(WardException.class, () -> o.invoke("size"));
        }
    }

    // ============ 未声明属性 ============

    @Nested
    @DisplayName("未声明属性")
    class UndeclaredTests {

        private WardClass cache;

        @BeforeEach
        void defineCache() {
            cache = runtime.defineClass("Cache")
                    .member(Members.method("remember", 1, (self, args) -> {
                        self.set("last", args.get(0));
                        return null;
                    }))
                    .member(Members.method("recall", 0, (self, args) -> self.get("last")))
                    .member(Members.method("forget", 0, (self, args) -> {
                        self.delete("last");
                        return null;
                    }))
                    .define();
        }

        @Test
        @DisplayName("外部写入被拒绝")
        void testExternalWrite() {
            WardObject c = cache.newInstance();

            AccessDeniedException e = assertThrows(AccessDeniedException.class, () -> c.set("last", 1));
            assertEquals(DenyReason.UNDECLARED, e.getReason());
        }

        @Test
        @DisplayName("类内部方法可读写删除")
        void testInternalAccess() {
            WardObject c = cache.newInstance();

            c.invoke("remember", "x");
            assertEquals("x", c.invoke("recall"));
            assertThrows(AccessDeniedException.class, () -> c.get("last"));

            c.invoke("forget");
            assertThrows(MemberNotFoundException.class, () -> c.invoke("recall"));
        }

        @Test
        @DisplayName("祖先类的方法在子类实例上也可以使用")
        void testAncestorMethod() {
            WardObject c = runtime.defineClass("LruCache").extend(cache).define().newInstance();

            c.invoke("remember", 42);
            assertEquals(42, c.invoke("recall"));
        }

        @Test
        @DisplayName("无关类的上下文被拒绝")
        void testUnrelatedContext() {
            WardObject c = cache.newInstance();
            WardClass other = runtime.defineClass("Other").define();

            assertThrows(AccessDeniedException.class, () -> c.set("last", 1, AccessContext.of(other)));
        }
    }

    // ============ 构造器 ============

    @Nested
    @DisplayName("构造器")
    class ConstructorTests {

        @Test
        @DisplayName("无构造器时传参报错")
        void testNoConstructor() {
            WardClass plain = runtime.defineClass("Plain").define();
            assertThrows(WardException.class, () -> plain.newInstance(1));
        }

        @Test
        @DisplayName("superInit 执行父类构造器")
        void testSuperInit() {
            WardClass named = runtime.defineClass("Named")
                    .member(Members.protectedVar("name", TypeTags.STRING))
                    .constructor(1, (self, args) -> {
                        self.set("name", args.get(0));
                        return null;
                    })
                    .define();
            WardClass person = runtime.defineClass("Person")
                    .extend(named)
                    .member(Members.variable("age", TypeTags.INT))
                    .member(Members.method("describe", 0, (self, args) -> self.get("name") + ":" + self.get("age")))
                    .constructor(2, (self, args) -> {
                        self.superInit(args.get(0));
                        self.set("age", args.get(1));
                        return null;
                    })
                    .define();

            assertEquals("ann:30", person.newInstance("ann", "30").invoke("describe"));
        }

        @Test
        @DisplayName("构造器参数个数不符报错")
        void testConstructorArity() {
            WardClass one = runtime.defineClass("One")
                    .constructor(1, (self, args) -> null)
                    .define();
            assertThrows(WardException.class, () -> one.newInstance());
        }
    }
}
