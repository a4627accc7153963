package automata.engine.integration;

import automata.engine.exception.ActionException;
import automata.engine.support.TestWebhookServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpWebScraperTest {

    private static final String PAGE = "<html><body>"
            + "<h2 class=\"title\">First <em>story</em></h2>"
            + "<p>intro</p>"
            + "<H2>Second story</H2>"
            + "<h2> </h2>"
            + "</body></html>";

    private TestWebhookServer server;
    private HttpWebScraper scraper;

    @BeforeEach
    void setUp() {
        server = new TestWebhookServer();
        scraper = new HttpWebScraper(Duration.ofSeconds(5), 20);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void selectorExtractsElementText() {
        server.respondWith(200, "text/html", PAGE);

        ScrapeResult result = scraper.scrape(server.url("/news"), "h2");

        assertEquals(List.of("First story", "Second story"), result.items());
        assertNull(result.content());
        assertEquals("GET", server.received().get(0).method());
    }

    @Test
    void withoutSelectorContentIsCapped() {
        server.respondWith(200, "text/html", PAGE);

        ScrapeResult result = scraper.scrape(server.url("/news"), null);

        assertNull(result.items());
        assertEquals(PAGE.substring(0, 20), result.content());
    }

    @Test
    void errorStatusFails() {
        server.respondWith(404, "text/html", "missing");

        ActionException e = assertThrows(ActionException.class, () -> scraper.scrape(server.url("/gone"), null));
        assertTrue(e.getMessage().endsWith("failed with status 404"));
    }

    @Test
    void complexSelectorsAreRejected() {
        server.respondWith(200, "text/html", PAGE);

        assertThrows(ActionException.class, () -> scraper.scrape(server.url("/news"), "div > .title"));
    }
}
