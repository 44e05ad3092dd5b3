package sbhackathon.koala.previewStack.deployment;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;

/**
 * 재배포 시 Pod를 다시 생성해야 하는지를 결정합니다.
 * <p>
 * Kubernetes는 Pod template이 바뀌었을 때만 Pod를 다시 만들기 때문에, 전략에 따라
 * Pod template에 annotation을 추가해서 재생성 여부를 제어합니다.
 */
public final class DeploymentStrategy {

    public static final String IMAGE_HASH_ANNOTATION = "imageHash";
    public static final String DATE_ANNOTATION = "date";

    public enum Kind {
        REDEPLOY_ON_IMAGE_UPDATE,
        REDEPLOY_NEVER,
        REDEPLOY_ALWAYS
    }

    private static final DeploymentStrategy NEVER = new DeploymentStrategy(Kind.REDEPLOY_NEVER, null);
    private static final DeploymentStrategy ALWAYS = new DeploymentStrategy(Kind.REDEPLOY_ALWAYS, null);

    private final Kind kind;
    private final String imageHash;

    private DeploymentStrategy(Kind kind, String imageHash) {
        this.kind = kind;
        this.imageHash = imageHash;
    }

    /**
     * 이미지 해시가 바뀐 경우에만 Pod를 다시 만듭니다.
     */
    public static DeploymentStrategy redeployOnImageUpdate(String imageHash) {
        return new DeploymentStrategy(Kind.REDEPLOY_ON_IMAGE_UPDATE,
                Objects.requireNonNull(imageHash, "imageHash"));
    }

    public static DeploymentStrategy redeployNever() {
        return NEVER;
    }

    /**
     * 배포할 때마다 Pod를 다시 만듭니다.
     */
    public static DeploymentStrategy redeployAlways() {
        return ALWAYS;
    }

    public Kind getKind() {
        return kind;
    }

    public String getImageHash() {
        return imageHash;
    }

    /**
     * Pod template에 붙일 annotation. 호출할 때마다 새로 계산합니다.
     * REDEPLOY_ALWAYS는 현재 시각을 기록하므로 매번 template이 달라집니다.
     */
    public Map<String, String> podAnnotations(Clock clock) {
        switch (kind) {
            case REDEPLOY_ON_IMAGE_UPDATE:
                return Map.of(IMAGE_HASH_ANNOTATION, imageHash);
            case REDEPLOY_ALWAYS:
                return Map.of(DATE_ANNOTATION,
                        OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
            case REDEPLOY_NEVER:
            default:
                return Map.of();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeploymentStrategy)) {
            return false;
        }
        DeploymentStrategy that = (DeploymentStrategy) o;
        return kind == that.kind && Objects.equals(imageHash, that.imageHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, imageHash);
    }

    @Override
    public String toString() {
        return imageHash != null ? kind + "(" + imageHash + ")" : kind.toString();
    }
}
