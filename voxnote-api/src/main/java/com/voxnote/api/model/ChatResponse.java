package com.voxnote.api.model;

public record ChatResponse(String answer) {
}
