package com.example.narrator.engine;

import com.example.narrator.exception.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs one ffmpeg invocation with a hard timeout, draining stdout and stderr on daemon threads.
 */
class FfmpegRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegRunner.class);
    private static final int STDERR_TAIL_CHARS = 4000;

    private final Duration timeout;

    FfmpegRunner(Duration timeout) {
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(10);
    }

    void run(String label, List<String> cmd) throws IOException, InterruptedException {
        LOGGER.info("FFmpeg {} command: {}", label, String.join(" ", cmd));

        Process p = new ProcessBuilder(cmd).redirectErrorStream(false).start();
        StringBuffer outBuf = new StringBuffer();
        StringBuffer errBuf = new StringBuffer();

        Thread tOut = drain(p.getInputStream(), outBuf, "ffmpeg-out");
        Thread tErr = drain(p.getErrorStream(), errBuf, "ffmpeg-err");
        tOut.start();
        tErr.start();

        boolean finished;
        try {
            finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            throw e;
        }
        if (!finished) {
            p.destroyForcibly();
            throw new RenderException("ffmpeg " + label + " timed out after " + timeout
                    + "\n---- ffmpeg stderr ----\n" + tail(errBuf));
        }
        tOut.join(1000);
        tErr.join(1000);
        if (p.exitValue() != 0) {
            throw new RenderException("ffmpeg " + label + " failed with exit " + p.exitValue()
                    + "\n---- ffmpeg stderr ----\n" + tail(errBuf) + "\n---- ffmpeg stdout ----\n" + tail(outBuf));
        }
    }

    private static Thread drain(InputStream stream, StringBuffer sink, String prefix) {
        Thread t = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                br.lines().forEach(line -> {
                    LOGGER.debug("[{}] {}", prefix, line);
                    sink.append(line).append('\n');
                });
            } catch (IOException | UncheckedIOException e) {
                LOGGER.debug("[{}] stream closed: {}", prefix, e.toString());
            }
        }, prefix);
        t.setDaemon(true);
        return t;
    }

    private static String tail(CharSequence buf) {
        int len = buf.length();
        return len <= STDERR_TAIL_CHARS ? buf.toString() : buf.subSequence(len - STDERR_TAIL_CHARS, len).toString();
    }
}
