package com.example.chat.controller;

import com.example.chat.dto.CreateRoomRequest;
import com.example.chat.dto.HistoryPage;
import com.example.chat.dto.HistoryQuery;
import com.example.chat.model.HistorySource;
import com.example.chat.model.Room;
import com.example.chat.model.UserIdentity;
import com.example.chat.service.history.HistoryComposer;
import com.example.chat.service.room.RoomService;
import com.example.chat.util.Constants;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

@RestController
@RequestMapping("/api/rooms")
@Slf4j
public class RoomController {

    private final RoomService roomService;
    private final HistoryComposer historyComposer;
    private final Scheduler chatIoScheduler;

    public RoomController(RoomService roomService, HistoryComposer historyComposer,
                          @Qualifier("chatIoScheduler") Scheduler chatIoScheduler) {
        this.roomService = roomService;
        this.historyComposer = historyComposer;
        this.chatIoScheduler = chatIoScheduler;
    }

    @GetMapping
    public Mono<List<Room>> listRooms() {
        return Mono.fromCallable(roomService::list).subscribeOn(chatIoScheduler);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Room> createRoom(@Valid @RequestBody CreateRoomRequest request,
                                 @RequestAttribute(Constants.AUTH_IDENTITY_ATTRIBUTE) UserIdentity identity) {
        return Mono.fromCallable(() -> roomService.create(request.getName(), identity.getId()))
                .subscribeOn(chatIoScheduler);
    }

    @GetMapping("/{roomId}")
    public Mono<Room> getRoom(@PathVariable String roomId) {
        return Mono.fromCallable(() -> roomService.get(roomId)).subscribeOn(chatIoScheduler);
    }

    /**
     * Paged history, cache first then archive unless {@code source} picks a tier.
     */
    @GetMapping("/{roomId}/messages")
    public Mono<HistoryPage> getMessages(@PathVariable String roomId,
                                         @RequestParam(required = false) Integer limit,
                                         @RequestParam(required = false) Long before,
                                         @RequestParam(required = false) Long after,
                                         @RequestParam(required = false) String source) {
        HistoryQuery query = HistoryQuery.builder()
                .roomId(roomId)
                .limit(limit)
                .before(before)
                .after(after)
                .source(HistorySource.fromHint(source).orElse(null))
                .build();
        return Mono.fromCallable(() -> historyComposer.history(query)).subscribeOn(chatIoScheduler);
    }

    /**
     * Archive-only history, kept for clients that page through the durable store directly.
     */
    @GetMapping("/{roomId}/history")
    public Mono<HistoryPage> getArchivedHistory(@PathVariable String roomId,
                                                @RequestParam(required = false) Integer limit,
                                                @RequestParam(required = false) Long before) {
        HistoryQuery query = HistoryQuery.builder()
                .roomId(roomId)
                .limit(limit)
                .before(before)
                .source(HistorySource.ARCHIVE)
                .build();
        return Mono.fromCallable(() -> historyComposer.history(query)).subscribeOn(chatIoScheduler);
    }
}
