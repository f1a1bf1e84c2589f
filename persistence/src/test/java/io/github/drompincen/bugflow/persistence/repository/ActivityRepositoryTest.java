package io.github.drompincen.bugflow.persistence.repository;

import org.junit.jupiter.api.Test;
import org.springframework.data.repository.CrudRepository;

import java.lang.reflect.Method;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class ActivityRepositoryTest {

    @Test
    void exposesNoUpdateOrDeleteMethods() {
        assertThat(CrudRepository.class).isNotAssignableFrom(ActivityRepository.class);
        assertThat(Arrays.stream(ActivityRepository.class.getMethods()).map(Method::getName))
                .contains("insert")
                .noneMatch(name -> name.startsWith("save") || name.startsWith("delete"));
    }
}
