package com.insightframe.api.context;

import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.Substance;

import java.util.List;

/**
 * 插件可见的记录访问接口
 * 宿主存储引擎不会直接暴露给插件
 */
public interface RecordAccess {

    /**
     * @return 全部历史体验记录快照
     * @throws com.insightframe.api.exception.PermissionDeniedException 未声明 read-experiences
     */
    List<Experience> readExperiences();

    /**
     * @return 已知物质目录
     * @throws com.insightframe.api.exception.PermissionDeniedException 未声明 read-substances
     */
    List<Substance> readSubstances();

    /**
     * 保存 (新增或覆盖) 一条体验记录
     * @throws com.insightframe.api.exception.PermissionDeniedException 未声明 write-experiences
     */
    void saveExperience(Experience experience);
}
