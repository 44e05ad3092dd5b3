package sbhackathon.koala.previewStack.entity;

public enum ContainerType {
    INSTANCE("instance"),
    REPLICA("replica"),
    APPLICATION_COMPANION("app-companion"),
    SERVICE_COMPANION("service-companion");

    private final String label;

    ContainerType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 애플리케이션 설정 목록에 포함되는 타입인지 여부. companion 서비스는 배포는 되지만 제외됩니다.
     */
    public boolean isApplicationConfig() {
        return this == INSTANCE || this == REPLICA;
    }

    public static ContainerType fromLabel(String label) {
        for (ContainerType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown container type: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
