package com.flowgate.web.repository;

import com.flowgate.web.entity.SettingsEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

public interface SettingsRepository extends CrudRepository<SettingsEntity, Long> {

    @Modifying
    @Query("INSERT OR REPLACE INTO t_settings (id, version, payload, updated_at) "
            + "VALUES (:id, :version, :payload, :updatedAt)")
    int upsert(Long id, Long version, String payload, Long updatedAt);
}
