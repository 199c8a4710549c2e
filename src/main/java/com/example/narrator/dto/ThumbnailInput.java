package com.example.narrator.dto;

public record ThumbnailInput(RenderResult video) {
}
