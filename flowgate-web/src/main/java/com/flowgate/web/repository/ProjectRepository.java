package com.flowgate.web.repository;

import com.flowgate.web.entity.ProjectEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface ProjectRepository extends CrudRepository<ProjectEntity, Long> {

    @Query("SELECT * FROM t_project WHERE token_id = :tokenId ORDER BY id")
    List<ProjectEntity> findByTokenId(Long tokenId);

    @Modifying
    @Query("DELETE FROM t_project WHERE token_id = :tokenId")
    int deleteByTokenId(Long tokenId);
}
