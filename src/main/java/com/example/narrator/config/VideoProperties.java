package com.example.narrator.config;

import com.example.narrator.dto.RenderSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "narrator.video")
public class VideoProperties {
    private int width = 1920;
    private int height = 1080;
    private int fps = 30;
    private int crf = 23;
    private String preset = "medium";
    private String backgroundColor = "0x101820";
    private String highlightColor = "yellow";
    private boolean burnSubtitles = true;

    public int getWidth() { return width; }
    public void setWidth(int width) { this.width = width; }

    public int getHeight() { return height; }
    public void setHeight(int height) { this.height = height; }

    public int getFps() { return fps; }
    public void setFps(int fps) { this.fps = fps; }

    public int getCrf() { return crf; }
    public void setCrf(int crf) { this.crf = crf; }

    public String getPreset() { return preset; }
    public void setPreset(String preset) { this.preset = preset; }

    public String getBackgroundColor() { return backgroundColor; }
    public void setBackgroundColor(String backgroundColor) { this.backgroundColor = backgroundColor; }

    public String getHighlightColor() { return highlightColor; }
    public void setHighlightColor(String highlightColor) { this.highlightColor = highlightColor; }

    public boolean isBurnSubtitles() { return burnSubtitles; }
    public void setBurnSubtitles(boolean burnSubtitles) { this.burnSubtitles = burnSubtitles; }

    public RenderSpec toRenderSpec() {
        return new RenderSpec(width, height, fps, crf, preset, backgroundColor, highlightColor);
    }
}
