package com.voxnote.api.controller;

import com.voxnote.api.model.ChatMessage;
import com.voxnote.api.model.ChatRequest;
import com.voxnote.api.model.ChatResponse;
import com.voxnote.api.service.ChatService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping(path = {"", "/"}, consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        return Mono.fromCallable(() -> new ChatResponse(chatService.handle(request.transcriptionId(), request.message())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(path = "/history/{transcriptionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<ChatMessage>> history(@PathVariable long transcriptionId) {
        return Mono.fromCallable(() -> chatService.history(transcriptionId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
