package com.apifarm.web.service;

import com.apifarm.common.exception.DuplicateKeyException;
import com.apifarm.common.exception.PersistenceException;
import com.apifarm.dispatcher.pool.Credential;
import com.apifarm.dispatcher.pool.CredentialStatus;
import com.apifarm.dispatcher.pool.CredentialStore;
import com.apifarm.web.entity.CredentialEntity;
import com.apifarm.web.repository.CredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 基于 Spring Data JDBC 的凭证存储，每次调用即一次 SQLite 事务。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcCredentialStore implements CredentialStore {

    private final CredentialRepository credentialRepository;

    @Override
    public List<Credential> loadAll() {
        try {
            return credentialRepository.findAllInInsertionOrder().stream()
                    .map(this::toCredential)
                    .toList();
        } catch (DataAccessException | IllegalArgumentException e) {
            throw new PersistenceException("加载凭证数据失败", e);
        }
    }

    @Override
    public Credential insert(Credential credential) {
        CredentialEntity entity = CredentialEntity.builder()
                .ownerId(credential.getOwnerId())
                .apiKey(credential.getValue())
                .endpoint(credential.getEndpoint())
                .status(credential.getStatus().name())
                .failureCount(credential.getFailureCount())
                .lastUsedAt(credential.getLastUsedAt())
                .cooldownUntil(credential.getCooldownUntil())
                .createdAt(credential.getCreatedAt())
                .build();
        try {
            CredentialEntity saved = credentialRepository.save(entity);
            return credential.toBuilder().id(saved.getId()).build();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateKeyException("该 API Key 已存在于池中");
        } catch (DataAccessException e) {
            log.error("保存凭证失败", e);
            throw new PersistenceException("保存凭证失败，请稍后重试", e);
        }
    }

    @Override
    public void delete(Long credentialId) {
        try {
            credentialRepository.deleteById(credentialId);
        } catch (DataAccessException e) {
            log.error("删除凭证 {} 失败", credentialId, e);
            throw new PersistenceException("删除凭证失败，请稍后重试", e);
        }
    }

    @Override
    public void updateHealth(Credential credential) {
        try {
            credentialRepository.updateHealth(
                    credential.getId(),
                    credential.getStatus().name(),
                    credential.getFailureCount(),
                    credential.getLastUsedAt(),
                    credential.getCooldownUntil());
        } catch (DataAccessException e) {
            throw new PersistenceException("更新凭证状态失败", e);
        }
    }

    private Credential toCredential(CredentialEntity entity) {
        return Credential.builder()
                .id(entity.getId())
                .ownerId(entity.getOwnerId())
                .value(entity.getApiKey())
                .endpoint(entity.getEndpoint())
                .status(CredentialStatus.valueOf(entity.getStatus()))
                .failureCount(entity.getFailureCount() != null ? entity.getFailureCount() : 0)
                .lastUsedAt(entity.getLastUsedAt())
                .cooldownUntil(entity.getCooldownUntil())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
