package com.flowgate.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Table("t_proxy_pool")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyEntity {

    @Id
    private Long id;

    private String proxyUrl;
    private String name;

    @Builder.Default
    private Boolean enabled = true;

    @Builder.Default
    private Integer successCount = 0;

    @Builder.Default
    private Integer failCount = 0;

    private Long lastUsedAt;
    private Long createdAt;
}
