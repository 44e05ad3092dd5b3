package sbhackathon.koala.previewStack.entity;

public enum ServiceStatus {
    RUNNING("실행중"),
    PAUSED("일시정지");

    private final String description;

    ServiceStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
