package com.example.narrator.model;

import java.util.List;

public record Slide(int index, String title, String text, List<SlideElement> elements) {
    public Slide {
        elements = List.copyOf(elements);
    }
}
