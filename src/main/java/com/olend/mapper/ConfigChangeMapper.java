package com.olend.mapper;

import com.olend.domain.model.ConfigChange;
import com.olend.entity.ConfigChangeEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between ConfigChange and ConfigChangeEntity. 1:1 field mapping.
 */
@Mapper
public interface ConfigChangeMapper {

    ConfigChangeEntity toEntity(ConfigChange configChange);

    ConfigChange toDomain(ConfigChangeEntity entity);

    List<ConfigChange> toDomainList(List<ConfigChangeEntity> entities);
}
