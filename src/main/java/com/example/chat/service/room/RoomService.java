package com.example.chat.service.room;

import com.example.chat.config.AppProperties;
import com.example.chat.exception.InvalidRequestException;
import com.example.chat.exception.ResourceNotFoundException;
import com.example.chat.exception.RoomAlreadyExistsException;
import com.example.chat.model.Room;
import com.example.chat.repository.RoomRepository;
import com.example.chat.service.archive.MessageArchiver;
import com.example.chat.service.bus.ChatEventBus;
import com.example.chat.util.Constants;
import com.example.chat.util.RoomNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class RoomService {

    static final String SYSTEM_CREATOR = "system";

    private final RoomRepository roomRepository;
    private final ChatEventBus chatEventBus;
    private final MessageArchiver messageArchiver;
    private final AppProperties appProperties;
    private final Clock clock;

    public List<Room> list() {
        return roomRepository.findAll();
    }

    public Room get(String roomId) {
        return roomRepository.findById(roomId)
                .orElseThrow(() -> new ResourceNotFoundException(Constants.ErrorText.ROOM_NOT_FOUND));
    }

    public boolean exists(String roomId) {
        return roomRepository.existsById(roomId);
    }

    /**
     * Creates a room, its topic, and starts archiving it.
     *
     * @throws InvalidRequestException if the name is blank, too long, or would not yield a valid topic name
     * @throws RoomAlreadyExistsException if the derived id is taken
     */
    public Room create(String name, String creatorId) {
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("Room name is required");
        }
        String displayName = name.trim();
        if (displayName.length() > Constants.ROOM_NAME_MAX_LENGTH) {
            throw new InvalidRequestException(Constants.ErrorText.ROOM_NAME_TOO_LONG);
        }
        String roomId = RoomNames.toRoomId(displayName);
        String topic = RoomNames.toTopic(appProperties.getKafka().getTopicPrefix(), roomId);
        if (topic.length() > Constants.TOPIC_NAME_MAX_LENGTH) {
            throw new InvalidRequestException("Room name is too long for a topic name under prefix " + appProperties.getKafka().getTopicPrefix());
        }
        Room room = Room.builder()
                .id(roomId)
                .name(displayName)
                .created(clock.millis())
                .createdBy(creatorId)
                .build();
        try {
            roomRepository.insert(room);
        } catch (DuplicateKeyException e) {
            throw new RoomAlreadyExistsException(room.getId());
        }
        log.info("Room {} created by {}", room.getId(), creatorId);

        createTopic(room.getId());
        messageArchiver.track(room.getId());
        return room;
    }

    /**
     * Inserts the configured default rooms that do not exist yet and makes sure every room has a topic.
     *
     * @return ids of all rooms
     */
    public List<String> ensureDefaultRooms() {
        for (String roomId : appProperties.getRooms().getDefaults()) {
            Room room = Room.builder()
                    .id(roomId)
                    .name(RoomNames.toDisplayName(roomId))
                    .created(clock.millis())
                    .createdBy(SYSTEM_CREATOR)
                    .build();
            if (roomRepository.insertIfAbsent(room)) {
                log.info("Created default room {}", roomId);
            }
        }
        List<String> roomIds = roomRepository.findAllIds();
        roomIds.forEach(this::createTopic);
        return roomIds;
    }

    private void createTopic(String roomId) {
        try {
            chatEventBus.createTopic(roomId);
        } catch (RuntimeException e) {
            // the broker still auto-creates the topic on first publish
            log.warn("Could not create topic for room {}: {}", roomId, e.getMessage());
        }
    }
}
