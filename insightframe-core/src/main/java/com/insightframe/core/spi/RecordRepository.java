package com.insightframe.core.spi;

import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.Substance;

import java.util.List;

/**
 * 宿主记录存储 SPI
 * 实现必须能承受多个插件的并发调用
 */
public interface RecordRepository {

    List<Experience> findAllExperiences();

    List<Substance> findAllSubstances();

    void saveExperience(Experience experience);
}
