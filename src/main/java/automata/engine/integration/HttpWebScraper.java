package automata.engine.integration;

import automata.engine.exception.ActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches pages over HTTP. Without a selector the raw body is returned, capped at
 * {@code contentLimit} characters. A selector is a plain element name such as {@code h2}:
 * the text of every matching element is returned as an item.
 */
public class HttpWebScraper implements WebScraper {

    private static final Logger log = LoggerFactory.getLogger(HttpWebScraper.class);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern ELEMENT_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9-]*");

    private final HttpClient httpClient;
    private final Duration timeout;
    private final int contentLimit;

    public HttpWebScraper(Duration timeout, int contentLimit) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.timeout = timeout;
        this.contentLimit = contentLimit;
    }

    @Override
    public ScrapeResult scrape(String url, String selector) {
        String body = fetch(url);

        if (selector == null || selector.isBlank()) {
            String content = body.length() > contentLimit ? body.substring(0, contentLimit) : body;
            return new ScrapeResult(null, content);
        }

        String element = selector.trim();
        if (!ELEMENT_NAME.matcher(element).matches()) {
            throw new ActionException("Unsupported selector: " + selector);
        }

        Pattern pattern = Pattern.compile("<" + element + "(?:\\s[^>]*)?>(.*?)</" + element + ">",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
        Matcher matcher = pattern.matcher(body);
        List<String> items = new ArrayList<>();
        while (matcher.find()) {
            String text = TAG.matcher(matcher.group(1)).replaceAll("").trim();
            if (!text.isEmpty()) {
                items.add(text);
            }
        }
        log.debug("Selector '{}' matched {} element(s) on {}", element, items.size(), url);
        return new ScrapeResult(items, null);
    }

    private String fetch(String url) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", "automata-scraper/1.0")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new ActionException("Scrape of " + url + " failed with status " + response.statusCode());
            }
            return response.body() == null ? "" : response.body();
        } catch (IOException e) {
            throw new ActionException("Scrape of " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException("Scrape of " + url + " interrupted", e);
        }
    }
}
