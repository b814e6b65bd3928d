package com.flowgate.web.entity;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

@Table("t_project")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectEntity {

    @Id
    private Long id;

    private String projectId;
    private Long tokenId;
    private String projectName;
    private String toolName;

    @Builder.Default
    private Boolean active = true;

    private Long createdAt;
}
