package com.example.narrator.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Job-level pipeline behaviour: where jobs land, which optional stages run, pacing assumptions.
 */
@Validated
@ConfigurationProperties(prefix = "narrator.pipeline")
public class PipelineProperties {

    @NotBlank
    private String outputDir = "outputs";
    private boolean keepTemp = true;
    private boolean qualityCheckEnabled = true;
    @Min(0) @Max(100)
    private int qualityMinScore = 70;
    private Integer defaultTargetSeconds;
    @Min(60) @Max(400)
    private int wordsPerMinute = 150;
    @Min(1)
    private int minTextLength = 100;
    private String subtitleFormat = "srt";

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public boolean isKeepTemp() { return keepTemp; }
    public void setKeepTemp(boolean keepTemp) { this.keepTemp = keepTemp; }

    public boolean isQualityCheckEnabled() { return qualityCheckEnabled; }
    public void setQualityCheckEnabled(boolean qualityCheckEnabled) { this.qualityCheckEnabled = qualityCheckEnabled; }

    public int getQualityMinScore() { return qualityMinScore; }
    public void setQualityMinScore(int qualityMinScore) { this.qualityMinScore = qualityMinScore; }

    public Integer getDefaultTargetSeconds() { return defaultTargetSeconds; }
    public void setDefaultTargetSeconds(Integer defaultTargetSeconds) { this.defaultTargetSeconds = defaultTargetSeconds; }

    public int getWordsPerMinute() { return wordsPerMinute; }
    public void setWordsPerMinute(int wordsPerMinute) { this.wordsPerMinute = wordsPerMinute; }

    public int getMinTextLength() { return minTextLength; }
    public void setMinTextLength(int minTextLength) { this.minTextLength = minTextLength; }

    public String getSubtitleFormat() { return subtitleFormat; }
    public void setSubtitleFormat(String subtitleFormat) { this.subtitleFormat = subtitleFormat; }
}
