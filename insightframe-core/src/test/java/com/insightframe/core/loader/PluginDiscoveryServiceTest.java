package com.insightframe.core.loader;

import com.insightframe.core.config.InsightFrameConfig;
import com.insightframe.core.plugin.PluginManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PluginDiscoveryService 单元测试")
class PluginDiscoveryServiceTest {

    @Mock
    private PluginManager pluginManager;

    @Test
    @DisplayName("开启自动扫描时委托给 PluginManager")
    void scansWhenEnabled() {
        when(pluginManager.scanStore()).thenReturn(3);
        when(pluginManager.getLoadedPlugins()).thenReturn(List.of());
        PluginDiscoveryService service = new PluginDiscoveryService(
                InsightFrameConfig.builder().autoScan(true).build(), pluginManager);

        assertEquals(3, service.scanAndLoad());
        verify(pluginManager).scanStore();
    }

    @Test
    @DisplayName("关闭自动扫描时什么也不做")
    void skipsWhenDisabled() {
        PluginDiscoveryService service = new PluginDiscoveryService(
                InsightFrameConfig.builder().autoScan(false).build(), pluginManager);

        assertEquals(0, service.scanAndLoad());
        verify(pluginManager, never()).scanStore();
    }
}
