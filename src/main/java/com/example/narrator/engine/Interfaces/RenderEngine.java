package com.example.narrator.engine.Interfaces;

import com.example.narrator.dto.RenderRequest;
import com.example.narrator.dto.RenderResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface RenderEngine {
    RenderResult render(RenderRequest request) throws IOException, InterruptedException;

    /** Concatenates audio segments, in the given order, into one track. */
    Path mergeAudio(List<Path> segments, Path target) throws IOException, InterruptedException;

    Path extractFrame(Path video, double atSeconds, Path target) throws IOException, InterruptedException;
}
