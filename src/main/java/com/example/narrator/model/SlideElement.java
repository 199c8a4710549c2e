package com.example.narrator.model;

public record SlideElement(int slideIndex, ElementRole role, String text, BoundingBox box) {
}
