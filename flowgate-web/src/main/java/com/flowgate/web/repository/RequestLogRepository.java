package com.flowgate.web.repository;

import com.flowgate.web.entity.RequestLogEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;

public interface RequestLogRepository extends CrudRepository<RequestLogEntity, Long> {

    /** 最近的请求日志 */
    @Query("SELECT * FROM t_request_log ORDER BY id DESC LIMIT :limit")
    List<RequestLogEntity> findRecent(int limit);
}
