package com.marketintel.store.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface RunStateMapper {
    @Insert("INSERT INTO run_states(run_id, market_domain, query, state_json, created_at, updated_at) " +
            "VALUES(#{runId}, #{marketDomain}, #{query}, #{stateJson}, #{createdAt}, #{updatedAt}) " +
            "ON CONFLICT(run_id) DO UPDATE SET market_domain=excluded.market_domain, query=excluded.query, " +
            "state_json=excluded.state_json, updated_at=excluded.updated_at")
    int upsertState(RunStateRow row);

    @Select("SELECT run_id, market_domain, query, state_json, created_at, updated_at " +
            "FROM run_states WHERE run_id = #{runId}")
    RunStateRow selectState(@Param("runId") String runId);

    @Select("SELECT run_id, market_domain, query, state_json, created_at, updated_at " +
            "FROM run_states ORDER BY updated_at DESC LIMIT #{limit}")
    List<RunStateRow> listRecent(@Param("limit") int limit);
}
