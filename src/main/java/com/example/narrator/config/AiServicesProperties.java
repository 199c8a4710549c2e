package com.example.narrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "narrator.ai")
public class AiServicesProperties {

    private OpenAIServiceProperties llm = new OpenAIServiceProperties("gpt-4o-mini");
    private Speech tts = new Speech();
    private OpenAIServiceProperties asr = new OpenAIServiceProperties("whisper-1");
    private double temperature = 0.4;

    public OpenAIServiceProperties getLlm() { return llm; }
    public void setLlm(OpenAIServiceProperties llm) { this.llm = llm; }

    public Speech getTts() { return tts; }
    public void setTts(Speech tts) { this.tts = tts; }

    public OpenAIServiceProperties getAsr() { return asr; }
    public void setAsr(OpenAIServiceProperties asr) { this.asr = asr; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }

    public static class Speech extends OpenAIServiceProperties {
        private String voice = "alloy";
        private double speed = 1.0;

        public Speech() {
            super("tts-1");
        }

        public String getVoice() { return voice; }
        public void setVoice(String voice) { this.voice = voice; }

        public double getSpeed() { return speed; }
        public void setSpeed(double speed) { this.speed = speed; }
    }
}
