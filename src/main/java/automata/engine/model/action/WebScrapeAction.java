package automata.engine.model.action;

public record WebScrapeAction(String url, String selector) implements TaskAction {

    @Override
    public ActionType type() {
        return ActionType.WEB_SCRAPE;
    }
}
