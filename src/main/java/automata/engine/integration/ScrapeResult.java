package automata.engine.integration;

import java.util.List;

/**
 * @param items   matched elements, null when no selector was given
 * @param content raw page content, null when items were extracted
 */
public record ScrapeResult(List<String> items, String content) {

    public ScrapeResult {
        items = items == null ? null : List.copyOf(items);
    }

    public int itemCount() {
        return items == null ? 0 : items.size();
    }
}
