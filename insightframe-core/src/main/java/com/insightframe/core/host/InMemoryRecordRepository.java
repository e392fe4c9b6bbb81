package com.insightframe.core.host;

import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.Substance;
import com.insightframe.core.spi.RecordRepository;

import java.util.ArrayList;
import java.util.List;

/**
 * 内存记录存储
 * 读返回快照，写操作串行化
 */
public class InMemoryRecordRepository implements RecordRepository {

    private final List<Experience> experiences = new ArrayList<>();
    private final List<Substance> substances = new ArrayList<>();

    public InMemoryRecordRepository() {
    }

    public InMemoryRecordRepository(List<Experience> experiences, List<Substance> substances) {
        this.experiences.addAll(experiences);
        this.substances.addAll(substances);
    }

    @Override
    public synchronized List<Experience> findAllExperiences() {
        return List.copyOf(experiences);
    }

    @Override
    public synchronized List<Substance> findAllSubstances() {
        return List.copyOf(substances);
    }

    /**
     * 相同 id 的记录被覆盖，否则追加
     */
    @Override
    public synchronized void saveExperience(Experience experience) {
        for (int i = 0; i < experiences.size(); i++) {
            if (experiences.get(i).id() == experience.id()) {
                experiences.set(i, experience);
                return;
            }
        }
        experiences.add(experience);
    }

    public synchronized void addSubstance(Substance substance) {
        substances.add(substance);
    }
}
