package com.flowgate.dispatcher.service;

import com.flowgate.common.dto.GenerationType;
import com.flowgate.common.dto.Token;
import com.flowgate.dispatcher.concurrency.ConcurrencyManager;
import com.flowgate.dispatcher.registry.CredentialRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 账号选择器：最久未使用优先。
 * <p>
 * 过滤条件：已启用、对应能力开关打开、有空闲并发槽位、AT 可用（必要时刷新）。
 * 候选按 last_used_at 升序（从未使用的排最前），依次校验凭证，取第一个通过的。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoadBalancer {

    private static final Comparator<Token> LONGEST_IDLE_FIRST = Comparator
            .comparing(Token::getLastUsedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Token::getId);

    private final CredentialRegistry registry;
    private final ConcurrencyManager concurrencyManager;
    private final TokenHealthService healthService;

    /**
     * 选择一个可用账号。
     *
     * @param type      图片或视频
     * @param modelHint 请求的模型，仅用于日志
     * @return 没有可用账号时返回 empty
     */
    public Optional<Token> select(GenerationType type, String modelHint) {
        List<Token> candidates = registry.findActiveTokens().stream()
                .filter(Token::isActive)
                .filter(t -> t.isEnabledFor(type))
                .filter(t -> concurrencyManager.hasFreeSlot(t.getId(), type))
                .sorted(LONGEST_IDLE_FIRST)
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            log.warn("没有可用的{}账号 (model: {})", type.getLabel(), modelHint);
            return Optional.empty();
        }

        for (Token candidate : candidates) {
            if (!healthService.isAccessCredentialValid(candidate.getId())) {
                log.warn("Token {} 的 AT 无效且刷新失败, 跳过", candidate.getId());
                continue;
            }
            // 刷新后凭证可能已变化，重新读取
            Optional<Token> latest = registry.findToken(candidate.getId()).filter(Token::isActive);
            if (latest.isPresent()) {
                log.info("为 {} 选中 Token {} ({})", modelHint, candidate.getId(), candidate.getEmail());
                return latest;
            }
        }

        log.warn("{} 个候选账号的凭证均不可用 (model: {})", candidates.size(), modelHint);
        return Optional.empty();
    }
}
