package com.marketintel.store.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface ChatTurnMapper {
    @Insert("INSERT INTO chat_turns(session_id, role, content, created_at_ms) " +
            "VALUES(#{sessionId}, #{role}, #{content}, #{createdAtMs})")
    int insertTurn(ChatTurnRow row);

    @Select("SELECT id, session_id, role, content, created_at_ms FROM chat_turns " +
            "WHERE session_id = #{sessionId} ORDER BY created_at_ms ASC, id ASC")
    List<ChatTurnRow> listBySession(@Param("sessionId") String sessionId);
}
