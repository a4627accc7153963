package automata.engine.executor.handler;

import automata.engine.exception.MissingDependencyException;
import automata.engine.executor.ExecutionLog;
import automata.engine.integration.ScrapeResult;
import automata.engine.integration.WebScraper;
import automata.engine.model.action.WebScrapeAction;
import automata.engine.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class WebScrapeHandler extends AbstractActionHandler<WebScrapeAction> {

    private final WebScraper scraper;

    public WebScrapeHandler(WebScraper scraper) {
        this.scraper = scraper;
    }

    @Override
    protected String startMessage(WebScrapeAction action) {
        return "Scraping " + action.url() + "...";
    }

    @Override
    protected String failurePrefix() {
        return "Web scraping failed";
    }

    @Override
    protected JsonNode run(WebScrapeAction action, ExecutionLog executionLog) {
        if (scraper == null) {
            throw new MissingDependencyException("Web scraper");
        }
        ScrapeResult scraped = scraper.scrape(action.url(), action.selector());
        executionLog.append("Scraped " + scraped.itemCount() + " items");

        ObjectNode result = Json.object();
        if (scraped.items() != null) {
            ArrayNode items = result.putArray("items");
            scraped.items().forEach(items::add);
        }
        if (scraped.content() != null) {
            result.put("content", scraped.content());
        }
        return result;
    }
}
