package com.flowgate.web.repository;

import com.flowgate.web.entity.ProxyEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface ProxyRepository extends CrudRepository<ProxyEntity, Long> {

    @Query("SELECT * FROM t_proxy_pool ORDER BY id")
    List<ProxyEntity> findAllOrdered();

    /** 轮换顺序 */
    @Query("SELECT * FROM t_proxy_pool WHERE enabled = 1 ORDER BY id")
    List<ProxyEntity> findEnabled();

    @Modifying
    @Query("UPDATE t_proxy_pool SET success_count = success_count + 1, last_used_at = :usedAt WHERE id = :id")
    int recordSuccess(Long id, Long usedAt);

    @Modifying
    @Query("UPDATE t_proxy_pool SET fail_count = fail_count + 1, last_used_at = :usedAt WHERE id = :id")
    int recordFailure(Long id, Long usedAt);
}
