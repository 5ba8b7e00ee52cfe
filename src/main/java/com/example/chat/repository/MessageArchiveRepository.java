package com.example.chat.repository;

import com.example.chat.model.ChatMessage;
import com.example.chat.model.MessageType;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only archive of every message that went over the bus.
 * The primary key (room_id, message_id) makes redelivered messages collide instead of duplicating.
 */
@Repository
public class MessageArchiveRepository {

    private final JdbcTemplate jdbcTemplate;

    public MessageArchiveRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<ChatMessage> messageRowMapper = (rs, rowNum) -> ChatMessage.builder()
            .id(rs.getString("message_id"))
            .type(MessageType.fromWireName(rs.getString("message_type")))
            .roomId(rs.getString("room_id"))
            .content(rs.getString("content"))
            .userId(rs.getString("user_id"))
            .username(rs.getString("username"))
            .timestamp(rs.getLong("sent_at"))
            .build();

    /**
     * @return false when the message was already archived
     */
    public boolean saveIfAbsent(ChatMessage message) {
        String sql = """
            INSERT INTO chat_messages
            (room_id, message_id, message_type, content, user_id, username, sent_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                    message.getRoomId(),
                    message.getId(),
                    message.getType() != null ? message.getType().wireName() : MessageType.MESSAGE.wireName(),
                    message.getContent(),
                    message.getUserId(),
                    message.getUsername(),
                    message.getTimestamp());
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    /**
     * Newest-first page of a room's archive.
     *
     * @param olderThan exclusive upper bound on the timestamp, or null
     * @param newerThan exclusive lower bound on the timestamp, or null
     */
    public List<ChatMessage> findNewestFirst(String roomId, Long olderThan, Long newerThan, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM chat_messages WHERE room_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(roomId);
        if (olderThan != null) {
            sql.append(" AND sent_at < ?");
            args.add(olderThan);
        }
        if (newerThan != null) {
            sql.append(" AND sent_at > ?");
            args.add(newerThan);
        }
        sql.append(" ORDER BY sent_at DESC, message_id DESC LIMIT ?");
        args.add(limit);
        return jdbcTemplate.query(sql.toString(), messageRowMapper, args.toArray());
    }

    public long countByRoom(String roomId) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM chat_messages WHERE room_id = ?", Long.class, roomId);
        return count != null ? count : 0L;
    }
}
