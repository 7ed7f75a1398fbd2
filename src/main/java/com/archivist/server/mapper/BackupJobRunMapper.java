package com.archivist.server.mapper;

import com.archivist.server.model.entity.BackupJobRunEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface BackupJobRunMapper extends BaseMapper<BackupJobRunEntity> {
}
