package com.olend.service;

import com.olend.domain.model.ConfigChange;
import com.olend.entity.ConfigChangeEntity;
import com.olend.mapper.ConfigChangeMapper;
import com.olend.repository.jpa.ConfigChangeJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists admin configuration changes to H2 as an audit trail.
 *
 * <p>The in-memory config is swapped first and the audit row written after, so the admin
 * response reflects the new config immediately.
 */
@Service
public class ConfigAuditService {

    private static final Logger log = LoggerFactory.getLogger(ConfigAuditService.class);

    private final ConfigChangeJpaRepository configChangeJpaRepository;
    private final ConfigChangeMapper configChangeMapper = Mappers.getMapper(ConfigChangeMapper.class);

    public ConfigAuditService(ConfigChangeJpaRepository configChangeJpaRepository) {
        this.configChangeJpaRepository = configChangeJpaRepository;
    }

    public ConfigChange record(
            String configType, String configKey, Object oldValue, Object newValue, String changedBy, long now) {
        ConfigChange change = ConfigChange.builder()
                .configType(configType)
                .configKey(configKey)
                .oldValue(oldValue != null ? oldValue.toString() : null)
                .newValue(newValue != null ? newValue.toString() : null)
                .changedBy(changedBy)
                .logicalTimestamp(now)
                .recordedAt(LocalDateTime.now())
                .build();

        ConfigChangeEntity saved = configChangeJpaRepository.save(configChangeMapper.toEntity(change));
        log.info("Config change recorded: {}[{}] by {}", configType, configKey, changedBy);
        return configChangeMapper.toDomain(saved);
    }

    /**
     * Full history, newest first.
     */
    public List<ConfigChange> history() {
        return configChangeMapper.toDomainList(configChangeJpaRepository.findAllNewestFirst());
    }

    public List<ConfigChange> historyByType(String configType) {
        return configChangeMapper.toDomainList(configChangeJpaRepository.findByConfigTypeNewestFirst(configType));
    }
}
