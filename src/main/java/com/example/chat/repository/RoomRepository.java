package com.example.chat.repository;

import com.example.chat.model.Room;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class RoomRepository {

    private final JdbcTemplate jdbcTemplate;

    public RoomRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<Room> roomRowMapper = (rs, rowNum) -> Room.builder()
            .id(rs.getString("id"))
            .name(rs.getString("name"))
            .created(rs.getLong("created_at"))
            .createdBy(rs.getString("created_by"))
            .build();

    /**
     * @throws DuplicateKeyException if a room with the same id already exists
     */
    public Room insert(Room room) {
        String sql = "INSERT INTO chat_rooms (id, name, created_at, created_by) VALUES (?, ?, ?, ?)";
        jdbcTemplate.update(sql, room.getId(), room.getName(), room.getCreated(), room.getCreatedBy());
        return room;
    }

    public boolean insertIfAbsent(Room room) {
        try {
            insert(room);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public Optional<Room> findById(String id) {
        String sql = "SELECT * FROM chat_rooms WHERE id = ?";
        return jdbcTemplate.query(sql, roomRowMapper, id).stream().findFirst();
    }

    public boolean existsById(String id) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM chat_rooms WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    public List<Room> findAll() {
        return jdbcTemplate.query("SELECT * FROM chat_rooms ORDER BY created_at, id", roomRowMapper);
    }

    public List<String> findAllIds() {
        return jdbcTemplate.queryForList("SELECT id FROM chat_rooms ORDER BY id", String.class);
    }
}
