package com.example.narrator.engine;

import com.example.narrator.config.IntakeProperties;
import com.example.narrator.dto.ResolvedContent;
import com.example.narrator.dto.SourceMetadata;
import com.example.narrator.engine.Interfaces.ContentResolver;
import com.example.narrator.exception.ExternalServiceException;
import com.example.narrator.exception.TransientServiceException;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.util.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.HtmlUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches a blog or article page and extracts its main text and basic metadata.
 */
public class WebArticleContentResolver implements ContentResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebArticleContentResolver.class);
    private static final String SERVICE = "Article fetch";

    private static final Pattern NOISE_PATTERN =
            Pattern.compile("(?is)<(script|style|nav|footer|aside|noscript)\\b[^>]*>.*?</\\1\\s*>");
    private static final Pattern COMMENT_PATTERN = Pattern.compile("(?s)<!--.*?-->");
    private static final Pattern META_PATTERN = Pattern.compile("(?i)<meta\\s+[^>]*>");
    private static final Pattern ATTR_PATTERN = Pattern.compile("(?i)([a-z0-9:-]+)\\s*=\\s*['\"]([^'\"]*)['\"]");
    private static final Pattern TITLE_PATTERN = Pattern.compile("(?is)<title[^>]*>(.*?)</title>");
    private static final Pattern H1_PATTERN = Pattern.compile("(?is)<h1[^>]*>(.*?)</h1>");
    private static final Pattern BODY_PATTERN = Pattern.compile("(?is)<body[^>]*>(.*)</body>");
    private static final Pattern TAG_PATTERN = Pattern.compile("(?s)<[^>]+>");
    private static final Pattern BLOCK_END_PATTERN = Pattern.compile("(?i)</(p|div|h[1-6]|li|section|article|br)\\s*>|<br\\s*/?>");
    private static final List<Pattern> CONTENT_PATTERNS = List.of(
            Pattern.compile("(?is)<article\\b[^>]*>(.*?)</article>"),
            Pattern.compile("(?is)<main\\b[^>]*>(.*?)</main>"),
            classPattern("post-content"),
            classPattern("entry-content"),
            classPattern("article-body"),
            classPattern("content"));

    private final WebClient webClient;
    private final IntakeProperties props;
    private final Clock clock;

    public WebArticleContentResolver(WebClient webClient, IntakeProperties props, Clock clock) {
        this.webClient = webClient;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public boolean supports(SourceType sourceType) {
        return sourceType == SourceType.URL;
    }

    @Override
    public ResolvedContent resolve(String sourceRef) {
        URI uri = parseHttpUri(sourceRef);
        String html;
        try {
            html = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> RetrySupport.statusError(SERVICE, resp.statusCode(), body)))
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds())));
        } catch (WebClientRequestException ex) {
            throw new TransientServiceException(SERVICE, "Cannot reach " + uri + ": " + ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            throw new TransientServiceException(SERVICE, "Timed out fetching " + uri, ex);
        }
        if (html == null || html.isBlank()) {
            throw new ExternalServiceException(SERVICE, 204, "Empty page: " + uri);
        }
        ResolvedContent content = extract(html);
        LOGGER.info("Article fetched url={} htmlChars={} textChars={} title={}",
                uri, html.length(), content.text().length(), content.metadata().title());
        return content;
    }

    ResolvedContent extract(String html) {
        String title = firstNonBlank(extractFirst(TITLE_PATTERN, html), extractFirst(H1_PATTERN, html));
        String author = findMeta(html, "author");
        String published = findMeta(html, "article:published_time");

        String cleaned = COMMENT_PATTERN.matcher(html).replaceAll(" ");
        cleaned = NOISE_PATTERN.matcher(cleaned).replaceAll(" ");

        String main = "";
        for (Pattern pattern : CONTENT_PATTERNS) {
            Matcher matcher = pattern.matcher(cleaned);
            while (matcher.find()) {
                String text = toText(matcher.group(matcher.groupCount()));
                if (text.length() > main.length()) {
                    main = text;
                }
            }
        }
        if (main.isBlank()) {
            Matcher body = BODY_PATTERN.matcher(cleaned);
            main = toText(body.find() ? body.group(1) : cleaned);
        }
        SourceMetadata metadata = new SourceMetadata(trimToNull(title), trimToNull(author), trimToNull(published), clock.instant());
        return new ResolvedContent(main, metadata, List.of());
    }

    private static URI parseHttpUri(String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new ValidationException("source URL is blank");
        }
        try {
            URI uri = new URI(sourceRef.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!uri.isAbsolute() || uri.getHost() == null || !(scheme.equals("http") || scheme.equals("https"))) {
                throw new ValidationException("Invalid URL: " + sourceRef);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL: " + sourceRef, e);
        }
    }

    private static Pattern classPattern(String cssClass) {
        return Pattern.compile("(?is)<(div|section)\\b[^>]*class\\s*=\\s*['\"][^'\"]*\\b" + Pattern.quote(cssClass)
                + "\\b[^'\"]*['\"][^>]*>(.*?)</\\1>");
    }

    private static String toText(String fragment) {
        String withBreaks = BLOCK_END_PATTERN.matcher(fragment).replaceAll("\n");
        String stripped = TAG_PATTERN.matcher(withBreaks).replaceAll(" ");
        return HtmlUtils.htmlUnescape(stripped).trim();
    }

    private static String extractFirst(Pattern pattern, String html) {
        Matcher matcher = pattern.matcher(html);
        if (matcher.find()) {
            return toText(matcher.group(1));
        }
        return null;
    }

    private static String findMeta(String body, String key) {
        Matcher matcher = META_PATTERN.matcher(body);
        while (matcher.find()) {
            Matcher attrMatcher = ATTR_PATTERN.matcher(matcher.group());
            String property = null;
            String content = null;
            while (attrMatcher.find()) {
                String name = attrMatcher.group(1).toLowerCase(Locale.ROOT);
                String value = attrMatcher.group(2);
                if (("property".equals(name) || "name".equals(name)) && value != null && !value.isBlank()) {
                    property = value;
                } else if ("content".equals(name) && value != null && !value.isBlank()) {
                    content = value;
                }
            }
            if (property != null && property.equalsIgnoreCase(key) && content != null) {
                return HtmlUtils.htmlUnescape(content);
            }
        }
        return null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
