package com.example.narrator.engine;

import com.example.narrator.dto.RenderRequest;
import com.example.narrator.dto.RenderResult;
import com.example.narrator.dto.RenderSpec;
import com.example.narrator.engine.Interfaces.RenderEngine;
import com.example.narrator.exception.RenderException;
import com.example.narrator.model.BoundingBox;
import com.example.narrator.model.OverlayCue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Composes narration videos with ffmpeg: a solid colour canvas, the master audio track, highlight
 * boxes enabled during their cue windows and optionally burned-in subtitles.
 */
public class FfmpegRenderEngine implements RenderEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegRenderEngine.class);

    private static final int FONT_MIN_PX = 14;
    private static final int FONT_MAX_PX = 48;
    private static final int MIN_MARGIN_V_PX = 44;
    private static final double FONT_MUL = 0.030;
    private static final int HIGHLIGHT_BORDER_PX = 6;

    private final String ffmpegBin;
    private final FfmpegRunner runner;
    private final @Nullable Path fontsDir;

    public FfmpegRenderEngine(String ffmpegBin, Duration timeout, @Nullable Path fontsDir) {
        this.ffmpegBin = ffmpegBin;
        this.runner = new FfmpegRunner(timeout);
        this.fontsDir = fontsDir != null ? fontsDir.toAbsolutePath().normalize() : null;
    }

    @Override
    public RenderResult render(RenderRequest request) throws IOException, InterruptedException {
        if (request.audio() == null || !Files.exists(request.audio())) {
            throw new RenderException("Audio file not found: " + request.audio());
        }
        if (request.duration() <= 0) {
            throw new RenderException("Invalid video duration: " + request.duration());
        }
        RenderSpec spec = request.spec() != null ? request.spec() : RenderSpec.DEFAULT;
        Files.createDirectories(request.output().toAbsolutePath().getParent());

        boolean burn = request.burnSubtitles() && request.captions() != null && Files.exists(request.captions());
        if (request.burnSubtitles() && !burn) {
            LOGGER.warn("Captions not found for burn-in (skipping): {}", request.captions());
        }

        Path clean = null;
        if (burn) {
            clean = siblingWithSuffix(request.output(), "_clean");
            runner.run("render-clean", buildCommand(spec, request, null, clean));
        }
        runner.run("render", buildCommand(spec, request, burn ? request.captions() : null, request.output()));

        long size = Files.size(request.output());
        LOGGER.info("FFmpeg render done output={} sizeBytes={} cues={} burnSubtitles={}",
                request.output(), size, request.cues().size(), burn);
        return new RenderResult(request.output(), clean, spec.resolution(), request.duration(), size);
    }

    @Override
    public Path mergeAudio(List<Path> segments, Path target) throws IOException, InterruptedException {
        if (segments == null || segments.isEmpty()) {
            throw new RenderException("No audio segments to merge");
        }
        Files.createDirectories(target.toAbsolutePath().getParent());
        Path list = target.resolveSibling(target.getFileName() + ".concat.txt");
        StringBuilder sb = new StringBuilder();
        for (Path segment : segments) {
            sb.append("file '").append(segment.toAbsolutePath().toString().replace("'", "'\\''")).append("'\n");
        }
        Files.writeString(list, sb.toString(), StandardCharsets.UTF_8);

        List<String> cmd = List.of(
                ffmpegBin, "-y",
                "-f", "concat",
                "-safe", "0",
                "-i", list.toAbsolutePath().toString(),
                "-c", "copy",
                target.toAbsolutePath().toString());
        runner.run("merge-audio", cmd);
        return target;
    }

    @Override
    public Path extractFrame(Path video, double atSeconds, Path target) throws IOException, InterruptedException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        List<String> cmd = List.of(
                ffmpegBin, "-y",
                "-ss", String.format(Locale.ROOT, "%.3f", Math.max(0.0, atSeconds)),
                "-i", video.toAbsolutePath().toString(),
                "-frames:v", "1",
                target.toAbsolutePath().toString());
        runner.run("thumbnail", cmd);
        if (!Files.exists(target)) {
            throw new RenderException("ffmpeg produced no frame at " + atSeconds + "s from " + video);
        }
        return target;
    }

    List<String> buildCommand(RenderSpec spec, RenderRequest request, @Nullable Path subtitles, Path output) {
        int w = even(spec.width(), 1920);
        int h = even(spec.height(), 1080);
        int fps = spec.fps() != null ? spec.fps() : 30;

        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpegBin);
        cmd.add("-y");
        cmd.add("-f"); cmd.add("lavfi");
        cmd.add("-i"); cmd.add("color=c=" + spec.backgroundColor() + ":s=" + w + "x" + h + ":r=" + fps);
        cmd.add("-i"); cmd.add(request.audio().toAbsolutePath().toString());

        String vf = null;
        for (OverlayCue cue : request.cues()) {
            vf = appendFilter(vf, drawBox(cue, spec.highlightColor(), w, h));
        }
        if (subtitles != null) {
            String style = subtitleStyleForHeight(h).replace("'", "\\'");
            String subFilter = "subtitles='" + escapeForFilter(subtitles.toAbsolutePath().toString()) + "':force_style='" + style + "'";
            if (fontsDir != null) subFilter += ":fontsdir='" + escapeForFilter(fontsDir.toString()) + "'";
            vf = appendFilter(vf, subFilter);
        }
        if (vf != null) { cmd.add("-vf"); cmd.add(vf); }

        cmd.add("-map"); cmd.add("0:v:0");
        cmd.add("-map"); cmd.add("1:a:0");
        cmd.add("-c:v"); cmd.add("libx264");
        cmd.add("-preset"); cmd.add(spec.preset() != null ? spec.preset() : "medium");
        cmd.add("-crf"); cmd.add(String.valueOf(spec.crf() != null ? spec.crf() : 23));
        cmd.add("-c:a"); cmd.add("aac");
        cmd.add("-b:a"); cmd.add("128k");
        cmd.add("-t"); cmd.add(String.format(Locale.ROOT, "%.3f", request.duration()));
        cmd.add("-pix_fmt"); cmd.add("yuv420p");
        cmd.add("-movflags"); cmd.add("+faststart");
        cmd.add("-shortest");
        cmd.add(output.toAbsolutePath().toString());
        return cmd;
    }

    private static String drawBox(OverlayCue cue, String color, int frameW, int frameH) {
        BoundingBox box = cue.box().clampTo(frameW, frameH);
        return String.format(Locale.ROOT,
                "drawbox=x=%d:y=%d:w=%d:h=%d:color=%s@0.85:t=%d:enable='between(t,%.3f,%.3f)'",
                box.x(), box.y(), box.width(), box.height(),
                color == null ? "yellow" : color, HIGHLIGHT_BORDER_PX, cue.start(), cue.end());
    }

    private static String subtitleStyleForHeight(int videoH) {
        int fontPx = Math.max(FONT_MIN_PX, Math.min(FONT_MAX_PX, (int) Math.round(videoH * FONT_MUL)));
        int outline = Math.max(1, Math.min(3, (int) Math.round(fontPx * 0.08)));
        int marginV = Math.max(MIN_MARGIN_V_PX, (int) Math.round(videoH * 0.05));
        return "FontSize=" + fontPx
                + ",PrimaryColour=&H00FFFFFF"
                + ",OutlineColour=&H80000000"
                + ",BackColour=&H80000000"
                + ",BorderStyle=3"
                + ",Outline=" + outline
                + ",Shadow=0"
                + ",MarginV=" + marginV
                + ",Alignment=2"
                + ",WrapStyle=2";
    }

    private static int even(Integer value, int fallback) {
        int v = value != null ? value : fallback;
        return (v & 1) == 1 ? v + 1 : v;
    }

    private static String appendFilter(String current, String add) {
        return current == null ? add : current + "," + add;
    }

    private static String escapeForFilter(String path) {
        return path
                .replace("\\", "\\\\")
                .replace(":", "\\:")
                .replace("'", "\\'");
    }

    private static Path siblingWithSuffix(Path file, String suffix) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String renamed = dot > 0 ? name.substring(0, dot) + suffix + name.substring(dot) : name + suffix;
        return file.resolveSibling(renamed);
    }
}
