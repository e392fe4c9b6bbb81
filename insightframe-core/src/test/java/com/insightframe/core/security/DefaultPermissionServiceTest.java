package com.insightframe.core.security;

import com.insightframe.api.plugin.Permission;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultPermissionService 单元测试")
class DefaultPermissionServiceTest {

    @Test
    @DisplayName("只允许清单中授予的权限")
    void grantAndCheck() {
        DefaultPermissionService service = new DefaultPermissionService();

        assertFalse(service.isAllowed("p", Permission.READ_EXPERIENCES));

        service.grant("p", EnumSet.of(Permission.READ_EXPERIENCES));

        assertTrue(service.isAllowed("p", Permission.READ_EXPERIENCES));
        assertFalse(service.isAllowed("p", Permission.WRITE_EXPERIENCES));
        assertFalse(service.isAllowed("other", Permission.READ_EXPERIENCES));
    }

    @Test
    @DisplayName("重新授予会替换旧权限")
    void regrantReplaces() {
        DefaultPermissionService service = new DefaultPermissionService();
        service.grant("p", EnumSet.of(Permission.READ_EXPERIENCES));

        service.grant("p", Set.of());

        assertFalse(service.isAllowed("p", Permission.READ_EXPERIENCES));
    }

    @Test
    @DisplayName("移除插件后权限失效")
    void removePlugin() {
        DefaultPermissionService service = new DefaultPermissionService();
        service.grant("p", EnumSet.of(Permission.SEND_NOTIFICATIONS));

        service.removePlugin("p");

        assertFalse(service.isAllowed("p", Permission.SEND_NOTIFICATIONS));
    }

    @Test
    @DisplayName("关闭强制校验时未声明的权限也放行")
    void auditOnlyMode() {
        DefaultPermissionService service = new DefaultPermissionService(false);

        assertTrue(service.isAllowed("p", Permission.NETWORK_ACCESS));
        assertDoesNotThrow(() -> service.audit("p", Permission.NETWORK_ACCESS, "connect", true));
    }
}
