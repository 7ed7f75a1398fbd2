package com.archivist.server.configuration;

import com.archivist.server.enums.DeletedEnum;
import com.baomidou.mybatisplus.core.handlers.MetaObjectHandler;
import org.apache.ibatis.reflection.MetaObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

@Component
public class MyMetaObjectHandler implements MetaObjectHandler {

    private static final String SYSTEM_USER = "System";

    private final Clock clock;

    @Autowired
    public MyMetaObjectHandler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void insertFill(MetaObject metaObject) {
        // base entity autofill
        this.strictInsertFill(metaObject, "createdUser", String.class, SYSTEM_USER);
        this.strictInsertFill(metaObject, "createdTime", LocalDateTime.class, LocalDateTime.now(this.clock));
        this.strictInsertFill(metaObject, "lastUpdatedUser", String.class, SYSTEM_USER);
        this.strictInsertFill(metaObject, "lastUpdatedTime", LocalDateTime.class, LocalDateTime.now(this.clock));
        this.strictInsertFill(metaObject, "recordDeleted", Integer.class, DeletedEnum.NOT_DELETED.getCode());
    }

    @Override
    public void updateFill(MetaObject metaObject) {
        this.strictUpdateFill(metaObject, "lastUpdatedUser", String.class, SYSTEM_USER);
        this.strictUpdateFill(metaObject, "lastUpdatedTime", LocalDateTime.class, LocalDateTime.now(this.clock));
    }
}
