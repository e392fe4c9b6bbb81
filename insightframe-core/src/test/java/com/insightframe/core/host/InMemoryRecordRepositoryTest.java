package com.insightframe.core.host;

import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.Substance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryRecordRepository 单元测试")
class InMemoryRecordRepositoryTest {

    @Test
    @DisplayName("相同 id 覆盖，不同 id 追加")
    void saveReplacesById() {
        InMemoryRecordRepository repository = new InMemoryRecordRepository();

        repository.saveExperience(Experience.builder().id(1).title("first").build());
        repository.saveExperience(Experience.builder().id(2).title("second").build());
        repository.saveExperience(Experience.builder().id(1).title("edited").build());

        List<Experience> experiences = repository.findAllExperiences();
        assertEquals(2, experiences.size());
        assertEquals("edited", experiences.get(0).title());
    }

    @Test
    @DisplayName("读取返回不可变快照")
    void readsAreSnapshots() {
        InMemoryRecordRepository repository = new InMemoryRecordRepository(List.of(), List.of(new Substance("LSD")));

        List<Substance> substances = repository.findAllSubstances();
        repository.addSubstance(new Substance("MDMA"));

        assertEquals(1, substances.size());
        assertEquals(2, repository.findAllSubstances().size());
        assertThrows(UnsupportedOperationException.class, () -> substances.add(new Substance("x")));
    }
}
