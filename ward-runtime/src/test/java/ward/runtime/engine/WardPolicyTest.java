package ward.runtime.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 策略配置
 */
class WardPolicyTest {

    @Test
    @DisplayName("默认策略")
    void testDefaults() {
        WardPolicy policy = WardPolicy.defaults();

        assertEquals(WardPolicy.Mode.DEFAULT, policy.getMode());
        assertTrue(policy.isCoercionEnabled());
        assertTrue(policy.isDuckTypedByDefault());
        assertEquals(1024L, policy.getConformanceCacheSize());
        assertEquals(Level.FINE, policy.getDenialLogLevel());
    }

    @Test
    @DisplayName("严格策略")
    void testStrict() {
        WardPolicy policy = WardPolicy.strict();

        assertEquals(WardPolicy.Mode.STRICT, policy.getMode());
        assertFalse(policy.isCoercionEnabled());
        assertFalse(policy.isDuckTypedByDefault());
        assertEquals(Level.INFO, policy.getDenialLogLevel());
    }

    @Test
    @DisplayName("自定义策略")
    void testCustom() {
        WardPolicy policy = WardPolicy.custom()
                .coercion(false)
                .conformanceCacheSize(16)
                .denialLogLevel(Level.WARNING)
                .build();

        assertEquals(WardPolicy.Mode.CUSTOM, policy.getMode());
        assertFalse(policy.isCoercionEnabled());
        assertTrue(policy.isDuckTypedByDefault());
        assertEquals(16L, policy.getConformanceCacheSize());
        assertEquals(Level.WARNING, policy.getDenialLogLevel());
        assertSame(policy, new WardRuntime(policy).getPolicy());
    }

    @Test
    @DisplayName("非法配置被拒绝")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> WardPolicy.custom().conformanceCacheSize(0));
        assertThrows(IllegalArgumentException.class, () -> WardPolicy.custom().denialLogLevel(null));
    }
}
