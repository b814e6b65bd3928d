package com.flowgate.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * 运行配置，只有 id = 1 一行，payload 为整份配置的 JSON。
 */
@Table("t_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingsEntity {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    private Long version;
    private String payload;
    private Long updatedAt;
}
