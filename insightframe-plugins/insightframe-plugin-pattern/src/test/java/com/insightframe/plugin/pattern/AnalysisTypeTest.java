package com.insightframe.plugin.pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalysisType 单元测试")
class AnalysisTypeTest {

    @Test
    @DisplayName("空值表示全部分析")
    void blankMeansAll() {
        assertEquals(EnumSet.allOf(AnalysisType.class), AnalysisType.parseList(null));
        assertEquals(EnumSet.allOf(AnalysisType.class), AnalysisType.parseList("  "));
    }

    @Test
    @DisplayName("接受能力ID和常量名，忽略未知项")
    void parsesKnownIgnoresUnknown() {
        Set<AnalysisType> types = AnalysisType.parseList("risk-assessment, TIMING,,astrology");

        assertEquals(EnumSet.of(AnalysisType.RISK, AnalysisType.TIMING), types);
    }

    @Test
    @DisplayName("全部未知时结果为空集合")
    void allUnknown() {
        assertTrue(AnalysisType.parseList("astrology").isEmpty());
        assertEquals(Optional.empty(), AnalysisType.fromId(null));
        assertEquals(Optional.of(AnalysisType.INTERACTION), AnalysisType.fromId("Substance-Interaction-Detection"));
    }
}
