package app.jira.catalogue;

public class UnknownToolException extends RuntimeException {

    private final String toolId;

    public UnknownToolException(String toolId) {
        super("Unknown tool '%s'".formatted(toolId));
        this.toolId = toolId;
    }

    public String getToolId() {
        return toolId;
    }
}
