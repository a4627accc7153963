package automata.engine.integration;

public interface WebScraper {

    /**
     * @param selector optional CSS selector; null scrapes the whole page
     */
    ScrapeResult scrape(String url, String selector);
}
