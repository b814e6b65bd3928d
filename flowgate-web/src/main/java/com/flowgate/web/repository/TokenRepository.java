package com.flowgate.web.repository;

import com.flowgate.web.entity.TokenEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface TokenRepository extends CrudRepository<TokenEntity, Long> {

    Optional<TokenEntity> findBySessionToken(String sessionToken);

    Optional<TokenEntity> findFirstByEmail(String email);

    @Query("SELECT * FROM t_token ORDER BY id")
    List<TokenEntity> findAllOrdered();

    @Query("SELECT * FROM t_token WHERE active = 1 ORDER BY id")
    List<TokenEntity> findActive();

    @Modifying
    @Query("UPDATE t_token SET "
            + "session_token = :sessionToken, "
            + "access_token = :accessToken, "
            + "access_token_expires = :expires, "
            + "remark = :remark, "
            + "image_enabled = :imageEnabled, "
            + "video_enabled = :videoEnabled, "
            + "image_concurrency = :imageConcurrency, "
            + "video_concurrency = :videoConcurrency "
            + "WHERE id = :id")
    int updateEditable(Long id, String sessionToken, String accessToken, Long expires, String remark,
                       Boolean imageEnabled, Boolean videoEnabled,
                       Integer imageConcurrency, Integer videoConcurrency);

    @Modifying
    @Query("UPDATE t_token SET access_token = :accessToken, access_token_expires = :expires WHERE id = :id")
    int updateAccessToken(Long id, String accessToken, Long expires);

    @Modifying
    @Query("UPDATE t_token SET credits = :credits, paygate_tier = :paygateTier WHERE id = :id")
    int updateCredits(Long id, Integer credits, String paygateTier);

    @Modifying
    @Query("UPDATE t_token SET current_project_id = :projectId, current_project_name = :projectName WHERE id = :id")
    int updateCurrentProject(Long id, String projectId, String projectName);

    @Modifying
    @Query("UPDATE t_token SET active = :active, ban_reason = :banReason, banned_at = :bannedAt WHERE id = :id")
    int updateActive(Long id, Boolean active, String banReason, Long bannedAt);

    @Modifying
    @Query("UPDATE t_token SET use_count = use_count + 1, last_used_at = :usedAt WHERE id = :id")
    int markUsed(Long id, Long usedAt);
}
