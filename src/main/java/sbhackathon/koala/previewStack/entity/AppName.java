package sbhackathon.koala.previewStack.entity;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 프리뷰 애플리케이션 이름.
 * <p>
 * 사용자가 입력한 원본 이름은 라벨에만 기록하고, 네임스페이스나 오브젝트 이름에는
 * 항상 {@link #toRfc1123NamespaceId()} 결과를 사용합니다. Kubernetes 이름 규칙은 대문자를 허용하지 않습니다.
 */
public final class AppName implements Comparable<AppName> {

    public static final AppName MASTER = new AppName("master");

    private static final Pattern VALID_NAME = Pattern.compile("^[A-Za-z0-9_.\\-]+$");

    private final String value;

    private AppName(String value) {
        this.value = value;
    }

    /**
     * 원본 이름으로 AppName을 생성합니다.
     *
     * @throws IllegalArgumentException 비어 있거나 허용되지 않는 문자가 포함된 경우
     */
    public static AppName of(String value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Invalid app name: " + value);
        }
        return new AppName(value);
    }

    public static boolean isValid(String value) {
        return value != null && VALID_NAME.matcher(value).matches();
    }

    /**
     * 이름을 Kubernetes에서 사용 가능한 형태(소문자)로 변환합니다. 여러 번 적용해도 결과는 같습니다.
     */
    public static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    /**
     * See https://kubernetes.io/docs/concepts/overview/working-with-objects/names/#dns-label-names
     */
    public String toRfc1123NamespaceId() {
        return normalize(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(AppName other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AppName)) {
            return false;
        }
        return value.equals(((AppName) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
