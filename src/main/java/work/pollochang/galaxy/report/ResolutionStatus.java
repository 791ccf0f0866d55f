package work.pollochang.galaxy.report;

public enum ResolutionStatus {
    FOUND("找到星系"),
    NOT_FOUND("搜尋半徑內無星系"),
    FAILED_TRANSPORT("網路/IO錯誤"),
    FAILED_TIMEOUT("逾時"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    ResolutionStatus(String description) { this.description = description; }
    public String getDescription() { return description; }

    public boolean isFailure() {
        return this != FOUND && this != NOT_FOUND;
    }
}
