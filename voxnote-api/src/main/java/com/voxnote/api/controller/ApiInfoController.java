package com.voxnote.api.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class ApiInfoController {

    @GetMapping("/api")
    public Map<String, String> root() {
        return Map.of("message", "Welcome to Audio Transcription and Chat API");
    }
}
