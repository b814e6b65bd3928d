package com.flowgate.web.repository;

import com.flowgate.web.entity.TokenStatsEntity;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.Optional;

/**
 * 计数全部在 SQL 中自增，today_* 与 today_date 不一致时先归零。
 */
public interface TokenStatsRepository extends CrudRepository<TokenStatsEntity, Long> {

    Optional<TokenStatsEntity> findByTokenId(Long tokenId);

    @Modifying
    @Query("DELETE FROM t_token_stats WHERE token_id = :tokenId")
    int deleteByTokenId(Long tokenId);

    @Modifying
    @Query("UPDATE t_token_stats SET "
            + "image_count = image_count + 1, "
            + "success_count = success_count + 1, "
            + "last_success_at = :now, "
            + "today_image_count = CASE WHEN today_date = :today THEN today_image_count + 1 ELSE 1 END, "
            + "today_video_count = CASE WHEN today_date = :today THEN today_video_count ELSE 0 END, "
            + "today_error_count = CASE WHEN today_date = :today THEN today_error_count ELSE 0 END, "
            + "today_date = :today "
            + "WHERE token_id = :tokenId")
    int incrementImage(Long tokenId, String today, Long now);

    @Modifying
    @Query("UPDATE t_token_stats SET "
            + "video_count = video_count + 1, "
            + "success_count = success_count + 1, "
            + "last_success_at = :now, "
            + "today_video_count = CASE WHEN today_date = :today THEN today_video_count + 1 ELSE 1 END, "
            + "today_image_count = CASE WHEN today_date = :today THEN today_image_count ELSE 0 END, "
            + "today_error_count = CASE WHEN today_date = :today THEN today_error_count ELSE 0 END, "
            + "today_date = :today "
            + "WHERE token_id = :tokenId")
    int incrementVideo(Long tokenId, String today, Long now);

    @Modifying
    @Query("UPDATE t_token_stats SET "
            + "error_count = error_count + 1, "
            + "consecutive_error_count = consecutive_error_count + 1, "
            + "last_error_at = :now, "
            + "today_error_count = CASE WHEN today_date = :today THEN today_error_count + 1 ELSE 1 END, "
            + "today_image_count = CASE WHEN today_date = :today THEN today_image_count ELSE 0 END, "
            + "today_video_count = CASE WHEN today_date = :today THEN today_video_count ELSE 0 END, "
            + "today_date = :today "
            + "WHERE token_id = :tokenId")
    int incrementError(Long tokenId, String today, Long now);

    @Query("SELECT consecutive_error_count FROM t_token_stats WHERE token_id = :tokenId")
    Integer findConsecutiveErrors(Long tokenId);

    @Modifying
    @Query("UPDATE t_token_stats SET consecutive_error_count = 0 WHERE token_id = :tokenId")
    int resetConsecutiveErrors(Long tokenId);
}
