package sbhackathon.koala.previewStack.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 컨테이너 환경 변수. 값은 비밀번호 등을 담을 수 있으므로 toString에 노출하지 않습니다.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "value")
public class EnvironmentVariable {

    private final String key;
    private final String value;
    private final boolean templated;
    private final boolean replicate;

    public EnvironmentVariable(String key, String value, boolean templated, boolean replicate) {
        this.key = key;
        this.value = value;
        this.templated = templated;
        this.replicate = replicate;
    }

    public EnvironmentVariable(String key, String value) {
        this(key, value, false, false);
    }

    /**
     * 레플리카 서비스에도 복제되어야 하는 환경 변수를 생성합니다.
     */
    public static EnvironmentVariable replicated(String key, String value) {
        return new EnvironmentVariable(key, value, false, true);
    }
}
