package com.autoreports.sync.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.OffsetDateTime;

/**
 * Bookkeeping of the sync itself: schema version and the last write of each operation.
 */
public interface SyncStateMapper {
    String SCHEMA_VERSION = "schema_version";

    @Select("SELECT state_value FROM sync_state WHERE state_key = #{key}")
    String selectState(@Param("key") String key);

    @Insert("INSERT INTO sync_state(state_key, state_value, updated_at) VALUES(#{key}, #{value}, #{at}) "
            + "ON CONFLICT(state_key) DO UPDATE SET state_value = excluded.state_value, updated_at = excluded.updated_at")
    int saveState(@Param("key") String key, @Param("value") String value, @Param("at") OffsetDateTime at);
}
