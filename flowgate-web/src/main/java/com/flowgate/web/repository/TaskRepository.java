package com.flowgate.web.repository;

import com.flowgate.web.entity.TaskEntity;
import org.springframework.data.repository.CrudRepository;

import java.util.Optional;

public interface TaskRepository extends CrudRepository<TaskEntity, Long> {

    Optional<TaskEntity> findByTaskId(String taskId);
}
